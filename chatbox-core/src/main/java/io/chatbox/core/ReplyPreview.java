package io.chatbox.core;

/**
 * Snapshot of the quoted message carried by a reply.
 *
 * @param messageId dedupe key of the quoted message
 * @param username author of the quoted message
 * @param text first {@link #MAX_TEXT} characters of the quoted text
 */
public record ReplyPreview(String messageId, String username, String text) {

    public static final int MAX_TEXT = 100;

    public static ReplyPreview of(ChatMessage quoted) {
        String text = quoted.text();
        if (text.length() > MAX_TEXT) {
            text = text.substring(0, MAX_TEXT);
        }
        return new ReplyPreview(quoted.messageId(), quoted.username(), text);
    }
}

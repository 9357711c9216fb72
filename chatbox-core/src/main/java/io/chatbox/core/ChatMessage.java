package io.chatbox.core;

import java.time.Instant;
import java.util.Objects;

/**
 * Public chat message as persisted.
 *
 * @param sequenceId server-assigned, strictly increasing receive order
 * @param messageId globally unique dedupe key ({@code msg_...})
 * @param accountId owning account, {@code null} for guests
 * @param replyTo dedupe key of the quoted message, or {@code null}
 * @param originAddress network origin of the writer; never sent to viewers
 */
public record ChatMessage(
        long sequenceId,
        String messageId,
        String username,
        Long accountId,
        String text,
        String replyTo,
        ReplyPreview replyPreview,
        String originAddress,
        Instant createdAt,
        boolean deleted
) {
    public ChatMessage {
        Objects.requireNonNull(messageId, "messageId");
        Objects.requireNonNull(username, "username");
        Objects.requireNonNull(text, "text");
        Objects.requireNonNull(createdAt, "createdAt");
    }

    public ChatMessage markDeleted() {
        return new ChatMessage(sequenceId, messageId, username, accountId, text, replyTo, replyPreview,
                originAddress, createdAt, true);
    }

    public MessageView toView() {
        return new MessageView(sequenceId, messageId, username, text, replyTo, replyPreview, createdAt);
    }
}

package io.chatbox.core;

import java.time.Instant;

/**
 * Viewer-facing projection of {@link PrivateChatMessage}; session ids stay on the server.
 */
public record PrivateMessageView(
        long id,
        String fromUsername,
        String toUsername,
        String text,
        String attachmentRef,
        Instant createdAt,
        Instant readAt
) {
}

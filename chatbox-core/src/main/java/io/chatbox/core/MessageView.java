package io.chatbox.core;

import java.time.Instant;

/**
 * Viewer-facing projection of {@link ChatMessage}, as carried by {@code history}, {@code message} and catch-up
 * responses.
 */
public record MessageView(
        long sequenceId,
        String messageId,
        String username,
        String text,
        String replyTo,
        ReplyPreview replyPreview,
        Instant createdAt
) {
}

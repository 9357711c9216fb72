package io.chatbox.server.spi;

import io.chatbox.core.ReplyPreview;

import java.time.Instant;

/**
 * Public message before the store assigns its sequence id.
 */
public record NewMessage(
        String messageId,
        String username,
        Long accountId,
        String text,
        String replyTo,
        ReplyPreview replyPreview,
        String originAddress,
        Instant createdAt
) {
}

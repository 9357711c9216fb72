package io.chatbox.server.spi;

import java.time.Instant;

/**
 * Private message before the store assigns its id.
 */
public record NewPrivateMessage(
        String fromUsername,
        String fromSessionId,
        Long fromAccountId,
        String toUsername,
        String toSessionId,
        Long toAccountId,
        String text,
        String attachmentRef,
        Instant createdAt
) {
}

package io.chatbox.core;

import java.time.Instant;

/**
 * One-to-one message scoped to the exact (username, session id) pair on each side.
 *
 * <p>At least one of {@code text} and {@code attachmentRef} is present.
 */
public record PrivateChatMessage(
        long id,
        String fromUsername,
        String fromSessionId,
        Long fromAccountId,
        String toUsername,
        String toSessionId,
        Long toAccountId,
        String text,
        String attachmentRef,
        Instant createdAt,
        Instant readAt
) {

    public boolean isFrom(String username, String sessionId) {
        return fromUsername.equals(username) && fromSessionId.equals(sessionId);
    }

    public boolean isTo(String username, String sessionId) {
        return toUsername.equals(username) && toSessionId.equals(sessionId);
    }

    public boolean involves(String username, String sessionId) {
        return isFrom(username, sessionId) || isTo(username, sessionId);
    }

    public PrivateChatMessage withReadAt(Instant at) {
        return new PrivateChatMessage(id, fromUsername, fromSessionId, fromAccountId, toUsername, toSessionId,
                toAccountId, text, attachmentRef, createdAt, at);
    }

    public PrivateMessageView toView() {
        return new PrivateMessageView(id, fromUsername, toUsername, text, attachmentRef, createdAt, readAt);
    }
}

package io.chatbox.server.spi;

import io.chatbox.core.Profile;
import io.chatbox.core.Role;

import java.time.Instant;
import java.util.Objects;

/**
 * Live binding of a nickname to a browser session.
 *
 * @param accountId {@code null} for guests
 * @param role {@link Role#SIMPLE_USER} for guests
 */
public record SessionRecord(
        String sessionId,
        String username,
        String originAddress,
        Long accountId,
        Role role,
        Instant joinedAt,
        Instant lastHeartbeat,
        Profile profile
) {
    public SessionRecord {
        Objects.requireNonNull(sessionId, "sessionId");
        Objects.requireNonNull(username, "username");
        Objects.requireNonNull(role, "role");
        Objects.requireNonNull(joinedAt, "joinedAt");
        Objects.requireNonNull(lastHeartbeat, "lastHeartbeat");
    }

    public boolean isGuest() {
        return accountId == null;
    }

    public boolean isLive(Instant liveSince) {
        return !lastHeartbeat.isBefore(liveSince);
    }

    public SessionRecord withHeartbeat(Instant at) {
        return new SessionRecord(sessionId, username, originAddress, accountId, role, joinedAt, at, profile);
    }
}

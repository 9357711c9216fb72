package io.chatbox.server.spi;

import java.util.Objects;

/**
 * Result of an atomic nickname claim.
 */
public final class ClaimOutcome {
    public enum Status {
        CREATED,
        REFRESHED,   // same session already held a row; idempotent success
        CONFLICT     // nickname held by another live session
    }

    private final Status status;
    private final SessionRecord session;

    /**
     * @param session the stored row on success, or the conflicting holder on {@link Status#CONFLICT}
     */
    public ClaimOutcome(Status status, SessionRecord session) {
        this.status = Objects.requireNonNull(status, "status");
        this.session = Objects.requireNonNull(session, "session");
    }

    public Status status() {
        return status;
    }

    public SessionRecord session() {
        return session;
    }

    public boolean succeeded() {
        return status != Status.CONFLICT;
    }
}

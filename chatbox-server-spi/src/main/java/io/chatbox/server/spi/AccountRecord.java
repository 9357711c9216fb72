package io.chatbox.server.spi;

import io.chatbox.core.Role;

import java.time.Instant;

/**
 * Registered account. {@code passwordHash} is an encoded salted hash, never the credential.
 */
public record AccountRecord(
        long id,
        String username,
        String displayName,
        String email,
        Role role,
        String passwordHash,
        boolean active,
        Instant createdAt,
        Instant lastLogin
) {
    public AccountRecord withLastLogin(Instant at) {
        return new AccountRecord(id, username, displayName, email, role, passwordHash, active, createdAt, at);
    }

    public AccountRecord withDisplayName(String value) {
        return new AccountRecord(id, username, value, email, role, passwordHash, active, createdAt, lastLogin);
    }

    public AccountRecord withActive(boolean value) {
        return new AccountRecord(id, username, displayName, email, role, passwordHash, value, createdAt, lastLogin);
    }

    /** Name shown in the roster: the display name when set, otherwise the username. */
    public String visibleName() {
        return displayName == null || displayName.isBlank() ? username : displayName;
    }
}

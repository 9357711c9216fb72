package io.chatbox.core;

import java.util.Locale;

/**
 * Account roles in ascending order of privilege.
 */
public enum Role {
    SIMPLE_USER(0),
    MODERATOR(1),
    ADMINISTRATOR(2),
    ROOT(3);

    private final int level;

    Role(int level) {
        this.level = level;
    }

    public int level() {
        return level;
    }

    public boolean atLeast(Role other) {
        return level >= other.level;
    }

    /** Elevated roles may hold the same nickname from several sessions at once. */
    public boolean allowsMultipleSessions() {
        return atLeast(MODERATOR);
    }

    public String wireName() {
        return name().toLowerCase(Locale.ROOT);
    }

    public static Role fromWire(String value) {
        if (value == null || value.isBlank()) {
            throw new ChatException.Validation("role must not be empty");
        }
        try {
            return Role.valueOf(value.trim().toUpperCase(Locale.ROOT));
        } catch (IllegalArgumentException e) {
            throw new ChatException.Validation("unknown role: " + value);
        }
    }
}

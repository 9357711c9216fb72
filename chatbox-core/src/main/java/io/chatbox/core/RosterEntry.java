package io.chatbox.core;

import java.time.Instant;

/**
 * One row of the presence roster. Synthetic entries are administrator-injected padding.
 */
public record RosterEntry(
        String username,
        Instant joinedAt,
        Integer age,
        String location,
        String sex,
        boolean synthetic
) {
}

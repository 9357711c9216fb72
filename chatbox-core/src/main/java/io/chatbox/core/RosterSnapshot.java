package io.chatbox.core;

import java.util.List;

/**
 * Full roster view.
 *
 * @param count displayed total, synthetic entries included
 * @param realCount live sessions only
 */
public record RosterSnapshot(int count, int realCount, List<RosterEntry> users) {

    public RosterSnapshot {
        users = List.copyOf(users);
    }

    public static RosterSnapshot of(List<RosterEntry> users) {
        int real = (int) users.stream().filter(u -> !u.synthetic()).count();
        return new RosterSnapshot(users.size(), real, users);
    }

    public boolean contains(String username) {
        return users.stream().anyMatch(u -> u.username().equalsIgnoreCase(username));
    }
}

package io.chatbox.server.core.service;

import io.chatbox.core.ChatException;
import io.chatbox.server.spi.AccountRecord;
import io.chatbox.server.spi.ChatStore;
import io.chatbox.server.spi.SessionRecord;
import io.chatbox.server.spi.SyntheticIdentity;

import java.time.Clock;
import java.time.Duration;
import java.util.Objects;

/**
 * Case-insensitive ownership of visible names. A name is taken when it matches an account username, an account
 * display name, a synthetic identity or the nickname of a live guest session.
 */
final class NameRegistry {
    private final ChatStore store;
    private final Clock clock;
    private final Duration sessionExpiry;

    NameRegistry(ChatStore store, Clock clock, Duration sessionExpiry) {
        this.store = Objects.requireNonNull(store, "store");
        this.clock = Objects.requireNonNull(clock, "clock");
        this.sessionExpiry = Objects.requireNonNull(sessionExpiry, "sessionExpiry");
    }

    /**
     * @param ownerId account that may keep names it already owns, or {@code null}
     * @param includeLiveGuests whether live guest nicknames count; guest claims leave that to the session claim
     * @throws ChatException.Conflict when someone else owns {@code name}
     */
    void requireAvailable(String name, Long ownerId, boolean includeLiveGuests) {
        for (AccountRecord account : store.accounts()) {
            if (ownerId != null && account.id() == ownerId) {
                continue;
            }
            if (account.username().equalsIgnoreCase(name)
                    || (account.displayName() != null && account.displayName().equalsIgnoreCase(name))) {
                throw new ChatException.Conflict("name " + name + " belongs to a registered account");
            }
        }
        for (SyntheticIdentity synthetic : store.syntheticIdentities()) {
            if (synthetic.nickname().equalsIgnoreCase(name)) {
                throw new ChatException.Conflict("name " + name + " is already in use");
            }
        }
        if (includeLiveGuests) {
            for (SessionRecord session : store.liveSessions(clock.instant().minus(sessionExpiry))) {
                if (session.accountId() == null && session.username().equalsIgnoreCase(name)) {
                    throw new ChatException.Conflict("name " + name + " is held by a live guest");
                }
            }
        }
    }
}

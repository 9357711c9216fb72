package io.chatbox.server.core.service;

import io.chatbox.core.ChatException;
import io.chatbox.core.Role;
import io.chatbox.server.core.ChatServerConfig;
import io.chatbox.server.spi.AccountRecord;
import io.chatbox.server.spi.ChatStore;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.time.Duration;
import java.util.Objects;
import java.util.Optional;

/**
 * Registered accounts and credential checks.
 */
public final class AccountService {
    private static final Logger logger = LoggerFactory.getLogger(AccountService.class);

    private static final int MIN_PASSWORD_LENGTH = 8;

    private final ChatStore store;
    private final PasswordHasher hasher;
    private final Clock clock;
    private final NameRegistry names;

    public AccountService(ChatStore store, PasswordHasher hasher, Clock clock) {
        this(store, hasher, clock, ChatServerConfig.defaults().sessionExpiry());
    }

    public AccountService(ChatStore store, PasswordHasher hasher, Clock clock, Duration sessionExpiry) {
        this.store = Objects.requireNonNull(store, "store");
        this.hasher = Objects.requireNonNull(hasher, "hasher");
        this.clock = Objects.requireNonNull(clock, "clock");
        this.names = new NameRegistry(store, clock, sessionExpiry);
    }

    public AccountRecord create(String username, String displayName, String email, Role role, String password) {
        String name = PresenceManager.normalizeNickname(username, Integer.MAX_VALUE);
        if (password == null || password.length() < MIN_PASSWORD_LENGTH) {
            throw new ChatException.Validation("password must be at least " + MIN_PASSWORD_LENGTH + " characters");
        }
        String display = displayName == null || displayName.isBlank() ? null : displayName.trim();
        names.requireAvailable(name, null, true);
        if (display != null && !display.equalsIgnoreCase(name)) {
            names.requireAvailable(display, null, true);
        }
        AccountRecord account = store.createAccount(name, display, email, role, hasher.hash(password.toCharArray()),
                clock.instant());
        logger.info("Created {} account {}", role.wireName(), account.username());
        return account;
    }

    /**
     * Checks credentials and stamps {@code lastLogin}. Unknown users, wrong passwords and inactive accounts all
     * fail the same way.
     */
    public AccountRecord authenticate(String username, String password) {
        if (username == null || username.isBlank() || password == null || password.isEmpty()) {
            throw new ChatException.Auth("invalid credentials");
        }
        AccountRecord account = store.findAccountByUsername(username.trim())
                .filter(AccountRecord::active)
                .filter(a -> hasher.verify(password.toCharArray(), a.passwordHash()))
                .orElseThrow(() -> new ChatException.Auth("invalid credentials"));
        AccountRecord updated = account.withLastLogin(clock.instant());
        store.updateAccount(updated);
        logger.info("Account {} signed in", updated.username());
        return updated;
    }

    public Optional<AccountRecord> find(long id) {
        return store.findAccount(id);
    }

    /**
     * Changes the name shown in the roster. A blank value clears it.
     *
     * @throws ChatException.Conflict when another account, a synthetic identity or a live guest owns the name
     */
    public AccountRecord updateDisplayName(long id, String displayName) {
        AccountRecord account = store.findAccount(id)
                .orElseThrow(() -> new ChatException.NotFound("account " + id + " not found"));
        String display = null;
        if (displayName != null && !displayName.isBlank()) {
            display = PresenceManager.normalizeNickname(displayName, Integer.MAX_VALUE);
            names.requireAvailable(display, account.id(), true);
        }
        AccountRecord updated = account.withDisplayName(display);
        store.updateAccount(updated);
        logger.info("Account {} display name changed", account.username());
        return updated;
    }

    public AccountRecord setActive(long id, boolean active) {
        AccountRecord account = store.findAccount(id)
                .orElseThrow(() -> new ChatException.NotFound("account " + id + " not found"));
        AccountRecord updated = account.withActive(active);
        store.updateAccount(updated);
        return updated;
    }
}

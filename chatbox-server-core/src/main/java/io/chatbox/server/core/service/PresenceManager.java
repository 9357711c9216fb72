package io.chatbox.server.core.service;

import io.chatbox.core.ChatEvent;
import io.chatbox.core.ChatException;
import io.chatbox.core.Profile;
import io.chatbox.core.Role;
import io.chatbox.core.RosterEntry;
import io.chatbox.core.RosterSnapshot;
import io.chatbox.server.core.ChatServerConfig;
import io.chatbox.server.spi.AccountRecord;
import io.chatbox.server.spi.ChatStore;
import io.chatbox.server.spi.ClaimOutcome;
import io.chatbox.server.spi.DistributionBus;
import io.chatbox.server.spi.SessionRecord;
import io.chatbox.server.spi.SyntheticIdentity;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;

/**
 * Nickname claims, heartbeats and the derived roster.
 *
 * <p>Session rows are the only presence state. The roster is recomputed from live rows on every read and
 * republished after each change.
 */
public final class PresenceManager {
    private static final Logger logger = LoggerFactory.getLogger(PresenceManager.class);

    private final ChatStore store;
    private final AccountService accounts;
    private final BanService bans;
    private final SettingsService settings;
    private final DistributionBus bus;
    private final ChatServerConfig config;
    private final Clock clock;
    private final NameRegistry names;

    public PresenceManager(ChatStore store, AccountService accounts, BanService bans, SettingsService settings,
                           DistributionBus bus, ChatServerConfig config, Clock clock) {
        this.store = Objects.requireNonNull(store, "store");
        this.accounts = Objects.requireNonNull(accounts, "accounts");
        this.bans = Objects.requireNonNull(bans, "bans");
        this.settings = Objects.requireNonNull(settings, "settings");
        this.bus = Objects.requireNonNull(bus, "bus");
        this.config = Objects.requireNonNull(config, "config");
        this.clock = Objects.requireNonNull(clock, "clock");
        this.names = new NameRegistry(store, clock, config.sessionExpiry());
    }

    /**
     * Binds {@code nickname} to {@code sessionId}.
     *
     * <p>Re-registering the same nickname from the same session refreshes the heartbeat. A session already signed
     * in to an account may only use that account's username or display name.
     *
     * @param profile may be {@code null} unless the {@code require_profile} setting is on
     * @throws ChatException.Conflict when another live session holds the nickname or it belongs to someone else
     */
    public SessionRecord register(String nickname, String sessionId, String originAddress, Profile profile) {
        String name = normalizeNickname(nickname, config.maxNicknameLength());
        requireSessionId(sessionId);
        Profile checked = checkProfile(profile);
        bans.requireNotBanned(sessionId, originAddress, name);

        Optional<SessionRecord> existing = store.findSession(sessionId);
        Optional<AccountRecord> bound = existing.map(SessionRecord::accountId).flatMap(store::findAccount);
        Long accountId = null;
        Role role = Role.SIMPLE_USER;
        if (bound.isPresent()) {
            AccountRecord account = bound.get();
            if (!name.equalsIgnoreCase(account.username()) && !name.equalsIgnoreCase(account.visibleName())) {
                throw new ChatException.Conflict("session is signed in as " + account.username());
            }
            accountId = account.id();
            role = account.role();
        } else {
            checkGuestNickname(name);
        }

        Instant now = clock.instant();
        SessionRecord candidate = new SessionRecord(sessionId, name, originAddress, accountId, role, now, now, checked);
        SessionRecord stored = claim(candidate, role);
        logger.debug("Session {} registered as {}", sessionId, stored.username());
        publishRoster();
        return stored;
    }

    /**
     * Authenticates and binds the session to the account. The session id is kept; any guest nickname it held is
     * replaced by the account username.
     */
    public SessionRecord login(String username, String password, String sessionId, String originAddress) {
        requireSessionId(sessionId);
        bans.requireNotBanned(sessionId, originAddress, username == null ? null : username.trim());
        AccountRecord account = accounts.authenticate(username, password);
        bans.requireNotBanned(null, null, account.username());

        Instant now = clock.instant();
        Profile profile = store.findSession(sessionId).map(SessionRecord::profile).orElse(Profile.empty());
        SessionRecord candidate = new SessionRecord(sessionId, account.username(), originAddress, account.id(),
                account.role(), now, now, profile);
        SessionRecord stored = claim(candidate, account.role());
        logger.info("Session {} bound to account {}", sessionId, account.username());
        publishRoster();
        return stored;
    }

    /** Returns {@code false} when no live row exists for that nickname and session. */
    public boolean heartbeat(String username, String sessionId) {
        if (username == null || sessionId == null) {
            return false;
        }
        return store.touchSession(username.trim(), sessionId, clock.instant(), liveSince());
    }

    /** Deletes sessions that missed the expiry window. */
    public int sweepExpired() {
        List<SessionRecord> removed = store.deleteSessionsIdleSince(liveSince());
        if (!removed.isEmpty()) {
            logger.info("Expired {} idle sessions", removed.size());
            publishRoster();
        }
        return removed.size();
    }

    /**
     * Ends every session of {@code username}, bans their session ids for a while and tells their streams to
     * disconnect.
     */
    public List<String> kick(String username) {
        if (username == null || username.isBlank()) {
            throw new ChatException.Validation("username must not be empty");
        }
        List<SessionRecord> removed = store.deleteSessionsForUsername(username.trim());
        if (removed.isEmpty()) {
            throw new ChatException.NotFound("no session for " + username.trim());
        }
        List<String> sessionIds = new ArrayList<>();
        for (SessionRecord s : removed) {
            bans.banSession(s.sessionId());
            sessionIds.add(s.sessionId());
        }
        bus.publish(new ChatEvent.ForceDisconnect(removed.get(0).username(), sessionIds));
        publishRoster();
        logger.info("Kicked {} ({} sessions)", removed.get(0).username(), sessionIds.size());
        return sessionIds;
    }

    public boolean logout(String sessionId) {
        requireSessionId(sessionId);
        Optional<SessionRecord> removed = store.deleteSession(sessionId);
        removed.ifPresent(s -> {
            logger.debug("Session {} ({}) logged out", sessionId, s.username());
            publishRoster();
        });
        return removed.isPresent();
    }

    /**
     * Live sessions, one row per nickname with the earliest join time, plus active synthetic identities whose
     * nickname is not taken by a real user. Sorted by nickname.
     */
    public RosterSnapshot roster() {
        Map<String, RosterEntry> byName = new LinkedHashMap<>();
        for (SessionRecord s : store.liveSessions(liveSince())) {
            String key = s.username().toLowerCase(Locale.ROOT);
            RosterEntry current = byName.get(key);
            if (current == null || s.joinedAt().isBefore(current.joinedAt())) {
                Profile p = s.profile() == null ? Profile.empty() : s.profile();
                byName.put(key, new RosterEntry(s.username(), s.joinedAt(), p.age(), p.location(), p.sex(), false));
            }
        }
        for (SyntheticIdentity synthetic : store.syntheticIdentities()) {
            String key = synthetic.nickname().toLowerCase(Locale.ROOT);
            if (synthetic.active() && !byName.containsKey(key)) {
                byName.put(key, new RosterEntry(synthetic.nickname(), null, synthetic.age(), synthetic.location(),
                        synthetic.sex(), true));
            }
        }
        List<RosterEntry> users = new ArrayList<>(byName.values());
        users.sort(Comparator.comparing(e -> e.username().toLowerCase(Locale.ROOT)));
        return RosterSnapshot.of(users);
    }

    /** Number of distinct nicknames with a live session. */
    public int liveUserCount() {
        return roster().realCount();
    }

    /**
     * Resolves the caller's live session.
     *
     * @throws ChatException.Auth when the pair does not name a live session
     */
    public SessionRecord requireLiveSession(String username, String sessionId) {
        if (username == null || username.isBlank() || sessionId == null || sessionId.isBlank()) {
            throw new ChatException.Auth("username and sessionId are required");
        }
        return store.findSession(sessionId)
                .filter(s -> s.username().equalsIgnoreCase(username.trim()))
                .filter(s -> s.isLive(liveSince()))
                .orElseThrow(() -> new ChatException.Auth("no live session for " + username.trim()));
    }

    /** Live session by id alone, used for header-authenticated moderation calls. */
    public Optional<SessionRecord> liveSession(String sessionId) {
        if (sessionId == null || sessionId.isBlank()) {
            return Optional.empty();
        }
        return store.findSession(sessionId).filter(s -> s.isLive(liveSince()));
    }

    /** Live session with the most recent heartbeat for {@code username}. */
    public Optional<SessionRecord> latestLiveSession(String username) {
        Instant since = liveSince();
        return store.sessionsForUsername(username).stream()
                .filter(s -> s.isLive(since))
                .max(Comparator.comparing(SessionRecord::lastHeartbeat));
    }

    public void publishRoster() {
        try {
            bus.publish(new ChatEvent.Roster(roster()));
        } catch (ChatException.TransientStore e) {
            logger.warn("Roster broadcast skipped, store unavailable", e);
        }
    }

    NameRegistry names() {
        return names;
    }

    Instant liveSince() {
        return clock.instant().minus(config.sessionExpiry());
    }

    private SessionRecord claim(SessionRecord candidate, Role role) {
        ClaimOutcome outcome = store.claimSession(candidate, liveSince(), role.allowsMultipleSessions());
        if (!outcome.succeeded()) {
            throw new ChatException.Conflict("nickname " + candidate.username() + " is already in use");
        }
        return outcome.session();
    }

    private void checkGuestNickname(String name) {
        String lower = name.toLowerCase(Locale.ROOT);
        if (config.reservedNicknames().contains(lower)) {
            throw new ChatException.Validation("nickname " + name + " is reserved");
        }
        names.requireAvailable(name, null, false);
    }

    private Profile checkProfile(Profile profile) {
        Profile p = profile == null ? Profile.empty() : profile;
        if (p.age() != null && (p.age() < Profile.MIN_AGE || p.age() > Profile.MAX_AGE)) {
            throw new ChatException.Validation("age must be between " + Profile.MIN_AGE + " and " + Profile.MAX_AGE);
        }
        if (settings.requireProfile() && !p.isComplete()) {
            throw new ChatException.Validation("age, location and sex are required");
        }
        return new Profile(p.age(), trimToNull(p.location()), trimToNull(p.sex()));
    }

    private static void requireSessionId(String sessionId) {
        if (sessionId == null || sessionId.isBlank()) {
            throw new ChatException.Validation("sessionId is required");
        }
    }

    /** Trims and validates a nickname: non-empty, bounded, no control characters. */
    static String normalizeNickname(String nickname, int maxLength) {
        if (nickname == null) {
            throw new ChatException.Validation("nickname is required");
        }
        String name = nickname.strip();
        if (name.isEmpty()) {
            throw new ChatException.Validation("nickname is required");
        }
        if (name.length() > maxLength) {
            throw new ChatException.Validation("nickname must be at most " + maxLength + " characters");
        }
        if (name.chars().anyMatch(Character::isISOControl)) {
            throw new ChatException.Validation("nickname contains control characters");
        }
        return name;
    }

    private static String trimToNull(String s) {
        return s == null || s.isBlank() ? null : s.trim();
    }
}

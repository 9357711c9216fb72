package io.chatbox.server.core.service;

import io.chatbox.core.ChatException;
import io.chatbox.json.spi.JsonCodec;
import io.chatbox.server.core.ChatServerConfig;
import io.chatbox.server.spi.AddressBan;
import io.chatbox.server.spi.CacheKeys;
import io.chatbox.server.spi.ChatCache;
import io.chatbox.server.spi.ChatStore;
import io.chatbox.server.spi.NicknameBan;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.Locale;
import java.util.Objects;
import java.util.Optional;

/**
 * Address, nickname and kicked-session bans.
 *
 * <p>Address and nickname bans live in the durable store and are cached as whole lists; kicked sessions are
 * short-lived cache markers only.
 */
public final class BanService {
    private static final Logger logger = LoggerFactory.getLogger(BanService.class);

    private final ChatStore store;
    private final DegradingCache cache;
    private final CacheKeys keys;
    private final ChatServerConfig config;
    private final Clock clock;

    public BanService(ChatStore store, ChatCache cache, CacheKeys keys, JsonCodec codec, ChatServerConfig config,
                      Clock clock) {
        this.store = Objects.requireNonNull(store, "store");
        this.cache = new DegradingCache(cache, codec);
        this.keys = Objects.requireNonNull(keys, "keys");
        this.config = Objects.requireNonNull(config, "config");
        this.clock = Objects.requireNonNull(clock, "clock");
    }

    /**
     * Rejects callers whose session was kicked recently, whose address is banned or whose nickname is banned.
     * Any argument may be {@code null} to skip that check.
     */
    public void requireNotBanned(String sessionId, String originAddress, String nickname) {
        if (sessionId != null && isSessionBanned(sessionId)) {
            throw new ChatException.Forbidden("session was removed by a moderator");
        }
        if (originAddress != null && activeAddressBan(originAddress).isPresent()) {
            throw new ChatException.Forbidden("address is banned");
        }
        if (nickname != null && isNicknameBanned(nickname)) {
            throw new ChatException.Forbidden("nickname is banned");
        }
    }

    public Optional<AddressBan> activeAddressBan(String originAddress) {
        Instant now = clock.instant();
        return addressBans().stream()
                .filter(b -> b.originAddress().equals(originAddress) && b.isActive(now))
                .findFirst();
    }

    public boolean isNicknameBanned(String nickname) {
        String lower = nickname.trim().toLowerCase(Locale.ROOT);
        return nicknameBans().stream().anyMatch(b -> b.nickname().toLowerCase(Locale.ROOT).equals(lower));
    }

    public List<AddressBan> addressBans() {
        String key = keys.bannedAddresses();
        Optional<List<AddressBan>> cached = cache.getList(key, AddressBan.class);
        if (cached.isPresent()) {
            return cached.get();
        }
        List<AddressBan> fresh = store.addressBans();
        cache.putJson(key, fresh, config.settingsCacheTtl());
        return fresh;
    }

    public List<NicknameBan> nicknameBans() {
        String key = keys.bannedNicknames();
        Optional<List<NicknameBan>> cached = cache.getList(key, NicknameBan.class);
        if (cached.isPresent()) {
            return cached.get();
        }
        List<NicknameBan> fresh = store.nicknameBans();
        cache.putJson(key, fresh, config.settingsCacheTtl());
        return fresh;
    }

    /**
     * @param duration {@code null} for a permanent ban
     */
    public AddressBan banAddress(String originAddress, String reason, String bannedBy, Duration duration) {
        if (originAddress == null || originAddress.isBlank()) {
            throw new ChatException.Validation("address must not be empty");
        }
        Instant now = clock.instant();
        AddressBan ban = new AddressBan(originAddress.trim(), reason, bannedBy, now,
                duration == null ? null : now.plus(duration));
        store.putAddressBan(ban);
        cache.invalidate(keys.bannedAddresses());
        logger.info("Banned address {} until {} by {}", ban.originAddress(),
                ban.bannedUntil() == null ? "forever" : ban.bannedUntil(), bannedBy);
        return ban;
    }

    public boolean unbanAddress(String originAddress) {
        boolean removed = store.removeAddressBan(originAddress);
        cache.invalidate(keys.bannedAddresses());
        if (removed) logger.info("Lifted ban on address {}", originAddress);
        return removed;
    }

    public NicknameBan banNickname(String nickname, String reason, String bannedBy) {
        if (nickname == null || nickname.isBlank()) {
            throw new ChatException.Validation("nickname must not be empty");
        }
        NicknameBan ban = new NicknameBan(nickname.trim(), reason, bannedBy, clock.instant());
        store.putNicknameBan(ban);
        cache.invalidate(keys.bannedNicknames());
        logger.info("Banned nickname {} by {}", ban.nickname(), bannedBy);
        return ban;
    }

    public boolean unbanNickname(String nickname) {
        boolean removed = store.removeNicknameBan(nickname);
        cache.invalidate(keys.bannedNicknames());
        if (removed) logger.info("Lifted ban on nickname {}", nickname);
        return removed;
    }

    /** Blocks a kicked session id from re-registering for the configured kick ban duration. */
    public void banSession(String sessionId) {
        try {
            cache.raw().put(keys.bannedSession(sessionId), "1", config.kickBanDuration());
        } catch (ChatException.TransientStore e) {
            logger.warn("Could not record kicked session {}", sessionId, e);
        }
    }

    public boolean isSessionBanned(String sessionId) {
        try {
            return cache.raw().exists(keys.bannedSession(sessionId));
        } catch (ChatException.TransientStore e) {
            logger.warn("Kicked-session check unavailable for {}", sessionId, e);
            return false;
        }
    }

    /** Drops address bans that have run out. */
    public int sweepExpired() {
        int removed = store.deleteAddressBansExpiredBefore(clock.instant());
        if (removed > 0) {
            cache.invalidate(keys.bannedAddresses());
            logger.info("Removed {} expired address bans", removed);
        }
        return removed;
    }
}

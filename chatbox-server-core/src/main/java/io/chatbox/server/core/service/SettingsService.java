package io.chatbox.server.core.service;

import io.chatbox.core.ChatEvent;
import io.chatbox.core.ChatException;
import io.chatbox.core.ChatMode;
import io.chatbox.json.spi.JsonCodec;
import io.chatbox.json.spi.JsonException;
import io.chatbox.server.core.ChatServerConfig;
import io.chatbox.server.core.cache.FixedWindowRateLimiter;
import io.chatbox.server.spi.CacheKeys;
import io.chatbox.server.spi.ChatCache;
import io.chatbox.server.spi.ChatStore;
import io.chatbox.server.spi.DistributionBus;
import io.chatbox.server.spi.UrlList;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;

/**
 * Runtime settings stored in the durable store and cached in the shared cache.
 *
 * <p>Reads fall back to the store when the cache misbehaves. Updates invalidate the cache and announce chat mode
 * changes on the bus.
 */
public final class SettingsService {
    private static final Logger logger = LoggerFactory.getLogger(SettingsService.class);

    public static final String CHAT_MODE = "chat_mode";
    public static final String RATE_LIMIT_MESSAGES = "rate_limit_messages";
    public static final String RATE_LIMIT_WINDOW = "rate_limit_window";
    public static final String REQUIRE_PROFILE = "require_profile";
    public static final String MINIMUM_USERS = "minimum_users";
    public static final String ALLOW_PHOTO_UPLOADS = "allow_photo_uploads";
    public static final String MAX_PHOTO_SIZE_MB = "max_photo_size_mb";
    public static final String ADMIN_PASSWORD_HASH = "admin_password_hash";

    private static final String SEEDED_MARKER = "url_whitelist_seeded";

    /** Keys never exposed through the public settings route. */
    private static final Set<String> PRIVATE_KEYS = Set.of(
            ADMIN_PASSWORD_HASH, RATE_LIMIT_MESSAGES, RATE_LIMIT_WINDOW, SEEDED_MARKER);

    public static final List<String> DEFAULT_WHITELIST = List.of(
            "youtube.com", "youtu.be", "twitter.com", "x.com", "facebook.com", "instagram.com",
            "tiktok.com", "spotify.com", "soundcloud.com", "twitch.tv");

    private final ChatStore store;
    private final DegradingCache cache;
    private final CacheKeys keys;
    private final JsonCodec codec;
    private final DistributionBus bus;
    private final ChatServerConfig config;

    public SettingsService(ChatStore store, ChatCache cache, CacheKeys keys, JsonCodec codec, DistributionBus bus,
                           ChatServerConfig config) {
        this.store = Objects.requireNonNull(store, "store");
        this.keys = Objects.requireNonNull(keys, "keys");
        this.codec = Objects.requireNonNull(codec, "codec");
        this.cache = new DegradingCache(cache, codec);
        this.bus = Objects.requireNonNull(bus, "bus");
        this.config = Objects.requireNonNull(config, "config");
    }

    /** Installs the default URL whitelist once per store. */
    public void seedDefaults() {
        if (store.settings().containsKey(SEEDED_MARKER)) {
            return;
        }
        if (store.urlPatterns(UrlList.WHITELIST).isEmpty()) {
            DEFAULT_WHITELIST.forEach(p -> store.addUrlPattern(UrlList.WHITELIST, p));
            logger.info("Seeded URL whitelist with {} default patterns", DEFAULT_WHITELIST.size());
        }
        store.putSettings(Map.of(SEEDED_MARKER, "true"));
        cache.invalidate(keys.settings());
        cache.invalidate(keys.urlList(UrlList.WHITELIST));
    }

    public Map<String, String> all() {
        Optional<String> cached = cache.get(keys.settings());
        if (cached.isPresent()) {
            try {
                Map<String, Object> raw = codec.readObject(cached.get().getBytes(StandardCharsets.UTF_8));
                Map<String, String> out = new LinkedHashMap<>();
                raw.forEach((k, v) -> out.put(k, v == null ? null : v.toString()));
                return out;
            } catch (JsonException e) {
                logger.warn("Discarding unreadable settings cache entry", e);
                cache.invalidate(keys.settings());
            }
        }
        Map<String, String> fresh = store.settings();
        cache.putJson(keys.settings(), fresh, config.settingsCacheTtl());
        return fresh;
    }

    public String get(String key, String defaultValue) {
        String v = all().get(key);
        return v == null ? defaultValue : v;
    }

    public int getInt(String key, int defaultValue) {
        String v = all().get(key);
        if (v == null || v.isBlank()) return defaultValue;
        try {
            return Integer.parseInt(v.trim());
        } catch (NumberFormatException e) {
            logger.warn("Setting {} is not an integer: {}", key, v);
            return defaultValue;
        }
    }

    public boolean getBoolean(String key, boolean defaultValue) {
        String v = all().get(key);
        if (v == null || v.isBlank()) return defaultValue;
        return v.trim().equalsIgnoreCase("true") || v.trim().equals("1");
    }

    public ChatMode chatMode() {
        return ChatMode.parseOrDefault(all().get(CHAT_MODE));
    }

    public boolean requireProfile() {
        return getBoolean(REQUIRE_PROFILE, false);
    }

    /** Current write budget: runtime settings over configured defaults. */
    public FixedWindowRateLimiter.Limit rateLimit() {
        int messages = getInt(RATE_LIMIT_MESSAGES, config.rateLimitMessages());
        int windowSeconds = getInt(RATE_LIMIT_WINDOW, (int) config.rateLimitWindow().toSeconds());
        if (messages <= 0 || windowSeconds <= 0) {
            return new FixedWindowRateLimiter.Limit(config.rateLimitMessages(), config.rateLimitWindow());
        }
        return new FixedWindowRateLimiter.Limit(messages, Duration.ofSeconds(windowSeconds));
    }

    /** Settings safe to hand to anonymous viewers. */
    public Map<String, String> publicSettings() {
        Map<String, String> out = new LinkedHashMap<>(all());
        PRIVATE_KEYS.forEach(out::remove);
        out.put(CHAT_MODE, chatMode().wireName());
        return out;
    }

    /**
     * Validates and persists a batch of settings.
     */
    public void update(Map<String, String> values) {
        Objects.requireNonNull(values, "values");
        if (values.isEmpty()) {
            throw new ChatException.Validation("no settings given");
        }
        Map<String, String> normalized = new LinkedHashMap<>();
        values.forEach((k, v) -> normalized.put(k, validate(k, v)));

        ChatMode before = chatMode();
        store.putSettings(normalized);
        cache.invalidate(keys.settings());
        logger.info("Updated settings {}", normalized.keySet());

        ChatMode after = ChatMode.parseOrDefault(store.settings().get(CHAT_MODE));
        if (after != before) {
            bus.publish(new ChatEvent.ConfigChanged(after));
        }
    }

    public List<String> urlPatterns(UrlList list) {
        String key = keys.urlList(list);
        Optional<List<String>> cached = cache.getList(key, String.class);
        if (cached.isPresent()) {
            return cached.get();
        }
        List<String> fresh = store.urlPatterns(list);
        cache.putJson(key, fresh, config.settingsCacheTtl());
        return fresh;
    }

    public boolean addUrlPattern(UrlList list, String pattern) {
        String p = HostPattern.normalize(pattern);
        boolean added = store.addUrlPattern(list, p);
        cache.invalidate(keys.urlList(list));
        return added;
    }

    public boolean removeUrlPattern(UrlList list, String pattern) {
        boolean removed = store.removeUrlPattern(list, HostPattern.normalize(pattern));
        cache.invalidate(keys.urlList(list));
        return removed;
    }

    private String validate(String key, String value) {
        if (key == null || key.isBlank()) {
            throw new ChatException.Validation("setting key must not be empty");
        }
        String v = value == null ? "" : value.trim();
        switch (key) {
            case CHAT_MODE -> {
                return ChatMode.fromWire(v).wireName();
            }
            case RATE_LIMIT_MESSAGES, RATE_LIMIT_WINDOW, MINIMUM_USERS, MAX_PHOTO_SIZE_MB -> {
                int n;
                try {
                    n = Integer.parseInt(v);
                } catch (NumberFormatException e) {
                    throw new ChatException.Validation(key + " must be an integer");
                }
                boolean zeroAllowed = key.equals(MINIMUM_USERS);
                if (n < 0 || (n == 0 && !zeroAllowed)) {
                    throw new ChatException.Validation(key + " is out of range");
                }
                return Integer.toString(n);
            }
            case REQUIRE_PROFILE, ALLOW_PHOTO_UPLOADS -> {
                return Boolean.toString(v.equalsIgnoreCase("true") || v.equals("1"));
            }
            default -> {
                return v;
            }
        }
    }
}

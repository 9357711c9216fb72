package io.chatbox.server.core;

import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Path;
import java.time.Duration;
import java.util.Arrays;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;
import java.util.Properties;
import java.util.Set;
import java.util.function.Function;
import java.util.stream.Collectors;

/**
 * Immutable engine configuration.
 *
 * <p>Use {@link #builder()} for programmatic setup, or {@link #load()} to read {@code chatbox.properties} from the
 * classpath, then system properties, then {@code CHATBOX_*} environment variables (later sources win):
 * <pre>{@code
 * chatbox.heartbeat.interval=PT60S      ->  CHATBOX_HEARTBEAT_INTERVAL=PT60S
 * chatbox.history.capacity=100          ->  CHATBOX_HISTORY_CAPACITY=100
 * }</pre>
 * Durations use ISO-8601 ({@code PT20S}) or plain seconds ({@code 20}).
 */
public final class ChatServerConfig {

    public static final String RESOURCE = "chatbox.properties";

    private static final Set<String> DEFAULT_RESERVED = Set.of(
            "admin", "administrator", "moderator", "root", "system", "sysop", "staff");

    private final String cacheProduct;
    private final String cacheInstance;
    private final Duration heartbeatInterval;
    private final Duration sessionExpiry;
    private final int historyCapacity;
    private final int defaultHistoryLimit;
    private final Duration historyCacheTtl;
    private final int maxMessageLength;
    private final int maxNicknameLength;
    private final int rateLimitMessages;
    private final Duration rateLimitWindow;
    private final Duration streamMaxDuration;
    private final Duration streamPingInterval;
    private final Duration kickBanDuration;
    private final Duration violationWindow;
    private final int violationThreshold;
    private final Duration autoBanDuration;
    private final Duration settingsCacheTtl;
    private final Duration attachmentRetention;
    private final long attachmentMaxBytes;
    private final Path attachmentDir;
    private final int privateConversationLimit;
    private final int privateRecentLimit;
    private final Duration deletedMessageRetention;
    private final Set<String> reservedNicknames;
    private final boolean trustForwardedFor;
    private final Path storeDir;

    private ChatServerConfig(Builder b) {
        this.cacheProduct = b.cacheProduct;
        this.cacheInstance = b.cacheInstance;
        this.heartbeatInterval = positive(b.heartbeatInterval, "heartbeatInterval");
        this.sessionExpiry = positive(b.sessionExpiry, "sessionExpiry");
        this.historyCapacity = positive(b.historyCapacity, "historyCapacity");
        this.defaultHistoryLimit = Math.min(positive(b.defaultHistoryLimit, "defaultHistoryLimit"), historyCapacity);
        this.historyCacheTtl = positive(b.historyCacheTtl, "historyCacheTtl");
        this.maxMessageLength = positive(b.maxMessageLength, "maxMessageLength");
        this.maxNicknameLength = positive(b.maxNicknameLength, "maxNicknameLength");
        this.rateLimitMessages = positive(b.rateLimitMessages, "rateLimitMessages");
        this.rateLimitWindow = positive(b.rateLimitWindow, "rateLimitWindow");
        this.streamMaxDuration = positive(b.streamMaxDuration, "streamMaxDuration");
        this.streamPingInterval = positive(b.streamPingInterval, "streamPingInterval");
        this.kickBanDuration = positive(b.kickBanDuration, "kickBanDuration");
        this.violationWindow = positive(b.violationWindow, "violationWindow");
        this.violationThreshold = positive(b.violationThreshold, "violationThreshold");
        this.autoBanDuration = positive(b.autoBanDuration, "autoBanDuration");
        this.settingsCacheTtl = positive(b.settingsCacheTtl, "settingsCacheTtl");
        this.attachmentRetention = positive(b.attachmentRetention, "attachmentRetention");
        this.attachmentMaxBytes = b.attachmentMaxBytes;
        this.attachmentDir = Objects.requireNonNull(b.attachmentDir, "attachmentDir");
        this.privateConversationLimit = positive(b.privateConversationLimit, "privateConversationLimit");
        this.privateRecentLimit = positive(b.privateRecentLimit, "privateRecentLimit");
        this.deletedMessageRetention = positive(b.deletedMessageRetention, "deletedMessageRetention");
        this.reservedNicknames = b.reservedNicknames.stream()
                .map(s -> s.toLowerCase(Locale.ROOT))
                .collect(Collectors.toUnmodifiableSet());
        this.trustForwardedFor = b.trustForwardedFor;
        this.storeDir = b.storeDir;
    }

    public static Builder builder() {
        return new Builder();
    }

    public static ChatServerConfig defaults() {
        return builder().build();
    }

    /** Loads configuration from the classpath resource, system properties and environment. */
    public static ChatServerConfig load() {
        Properties props = new Properties();
        ClassLoader cl = Thread.currentThread().getContextClassLoader();
        try (InputStream in = cl == null ? null : cl.getResourceAsStream(RESOURCE)) {
            if (in != null) {
                props.load(in);
            }
        } catch (IOException e) {
            throw new IllegalStateException("Failed to read " + RESOURCE, e);
        }
        System.getProperties().forEach((k, v) -> {
            if (k.toString().startsWith("chatbox.")) props.setProperty(k.toString(), v.toString());
        });
        return fromProperties(props, System.getenv());
    }

    /**
     * Builds a configuration from explicit sources; {@code env} entries named {@code CHATBOX_*} override
     * {@code props}.
     */
    public static ChatServerConfig fromProperties(Properties props, Map<String, String> env) {
        Function<String, String> lookup = key -> {
            String envKey = key.toUpperCase(Locale.ROOT).replace('.', '_').replace('-', '_');
            String fromEnv = env.get(envKey);
            return fromEnv != null ? fromEnv : props.getProperty(key);
        };
        Builder b = builder();
        apply(lookup, "chatbox.cache.product", v -> b.cacheProduct = v);
        apply(lookup, "chatbox.cache.instance", v -> b.cacheInstance = v);
        apply(lookup, "chatbox.heartbeat.interval", v -> b.heartbeatInterval = duration(v));
        apply(lookup, "chatbox.session.expiry", v -> b.sessionExpiry = duration(v));
        apply(lookup, "chatbox.history.capacity", v -> b.historyCapacity = Integer.parseInt(v.trim()));
        apply(lookup, "chatbox.history.default-limit", v -> b.defaultHistoryLimit = Integer.parseInt(v.trim()));
        apply(lookup, "chatbox.history.cache-ttl", v -> b.historyCacheTtl = duration(v));
        apply(lookup, "chatbox.message.max-length", v -> b.maxMessageLength = Integer.parseInt(v.trim()));
        apply(lookup, "chatbox.nickname.max-length", v -> b.maxNicknameLength = Integer.parseInt(v.trim()));
        apply(lookup, "chatbox.nickname.reserved", v -> b.reservedNicknames = Arrays.stream(v.split(","))
                .map(String::trim).filter(s -> !s.isEmpty()).collect(Collectors.toSet()));
        apply(lookup, "chatbox.rate-limit.messages", v -> b.rateLimitMessages = Integer.parseInt(v.trim()));
        apply(lookup, "chatbox.rate-limit.window", v -> b.rateLimitWindow = duration(v));
        apply(lookup, "chatbox.stream.max-duration", v -> b.streamMaxDuration = duration(v));
        apply(lookup, "chatbox.stream.ping-interval", v -> b.streamPingInterval = duration(v));
        apply(lookup, "chatbox.kick.ban-duration", v -> b.kickBanDuration = duration(v));
        apply(lookup, "chatbox.violations.window", v -> b.violationWindow = duration(v));
        apply(lookup, "chatbox.violations.threshold", v -> b.violationThreshold = Integer.parseInt(v.trim()));
        apply(lookup, "chatbox.violations.auto-ban", v -> b.autoBanDuration = duration(v));
        apply(lookup, "chatbox.settings.cache-ttl", v -> b.settingsCacheTtl = duration(v));
        apply(lookup, "chatbox.attachments.retention", v -> b.attachmentRetention = duration(v));
        apply(lookup, "chatbox.attachments.max-bytes", v -> b.attachmentMaxBytes = Long.parseLong(v.trim()));
        apply(lookup, "chatbox.attachments.dir", v -> b.attachmentDir = Path.of(v.trim()));
        apply(lookup, "chatbox.private.conversation-limit", v -> b.privateConversationLimit = Integer.parseInt(v.trim()));
        apply(lookup, "chatbox.private.recent-limit", v -> b.privateRecentLimit = Integer.parseInt(v.trim()));
        apply(lookup, "chatbox.messages.deleted-retention", v -> b.deletedMessageRetention = duration(v));
        apply(lookup, "chatbox.http.trust-forwarded-for", v -> b.trustForwardedFor = Boolean.parseBoolean(v.trim()));
        apply(lookup, "chatbox.store.dir", v -> b.storeDir = v.isBlank() ? null : Path.of(v.trim()));
        return b.build();
    }

    private static void apply(Function<String, String> lookup, String key, java.util.function.Consumer<String> setter) {
        String value = lookup.apply(key);
        if (value == null) return;
        try {
            setter.accept(value);
        } catch (RuntimeException e) {
            throw new IllegalArgumentException("Invalid value for " + key + ": " + value, e);
        }
    }

    static Duration duration(String raw) {
        String v = raw.trim();
        if (v.startsWith("P") || v.startsWith("p")) {
            return Duration.parse(v.toUpperCase(Locale.ROOT));
        }
        return Duration.ofSeconds(Long.parseLong(v));
    }

    private static Duration positive(Duration d, String name) {
        Objects.requireNonNull(d, name);
        if (d.isZero() || d.isNegative()) throw new IllegalArgumentException(name + " must be positive");
        return d;
    }

    private static int positive(int v, String name) {
        if (v <= 0) throw new IllegalArgumentException(name + " must be positive");
        return v;
    }

    public String cacheProduct() { return cacheProduct; }
    public String cacheInstance() { return cacheInstance; }
    public Duration heartbeatInterval() { return heartbeatInterval; }
    public Duration sessionExpiry() { return sessionExpiry; }
    public int historyCapacity() { return historyCapacity; }
    public int defaultHistoryLimit() { return defaultHistoryLimit; }
    public Duration historyCacheTtl() { return historyCacheTtl; }
    public int maxMessageLength() { return maxMessageLength; }
    public int maxNicknameLength() { return maxNicknameLength; }
    public int rateLimitMessages() { return rateLimitMessages; }
    public Duration rateLimitWindow() { return rateLimitWindow; }
    public Duration streamMaxDuration() { return streamMaxDuration; }
    public Duration streamPingInterval() { return streamPingInterval; }
    public Duration kickBanDuration() { return kickBanDuration; }
    public Duration violationWindow() { return violationWindow; }
    public int violationThreshold() { return violationThreshold; }
    public Duration autoBanDuration() { return autoBanDuration; }
    public Duration settingsCacheTtl() { return settingsCacheTtl; }
    public Duration attachmentRetention() { return attachmentRetention; }
    public long attachmentMaxBytes() { return attachmentMaxBytes; }
    public Path attachmentDir() { return attachmentDir; }
    public int privateConversationLimit() { return privateConversationLimit; }
    public int privateRecentLimit() { return privateRecentLimit; }
    public Duration deletedMessageRetention() { return deletedMessageRetention; }
    public Set<String> reservedNicknames() { return reservedNicknames; }
    public boolean trustForwardedFor() { return trustForwardedFor; }

    /** RocksDB directory, or {@code null} for the in-memory store. */
    public Path storeDir() { return storeDir; }

    /**
     * Builder for {@link ChatServerConfig}. Every setting has a default.
     */
    public static final class Builder {
        private String cacheProduct = "chatbox";
        private String cacheInstance = "default";
        private Duration heartbeatInterval = Duration.ofSeconds(60);
        private Duration sessionExpiry = Duration.ofMinutes(5);
        private int historyCapacity = 100;
        private int defaultHistoryLimit = 50;
        private Duration historyCacheTtl = Duration.ofHours(24);
        private int maxMessageLength = 500;
        private int maxNicknameLength = 50;
        private int rateLimitMessages = 10;
        private Duration rateLimitWindow = Duration.ofSeconds(60);
        private Duration streamMaxDuration = Duration.ofMinutes(10);
        private Duration streamPingInterval = Duration.ofSeconds(20);
        private Duration kickBanDuration = Duration.ofHours(1);
        private Duration violationWindow = Duration.ofHours(1);
        private int violationThreshold = 3;
        private Duration autoBanDuration = Duration.ofHours(24);
        private Duration settingsCacheTtl = Duration.ofMinutes(5);
        private Duration attachmentRetention = Duration.ofHours(48);
        private long attachmentMaxBytes = 5L * 1024 * 1024;
        private Path attachmentDir = Path.of(System.getProperty("java.io.tmpdir"), "chatbox-attachments");
        private int privateConversationLimit = 500;
        private int privateRecentLimit = 50;
        private Duration deletedMessageRetention = Duration.ofDays(30);
        private Set<String> reservedNicknames = DEFAULT_RESERVED;
        private boolean trustForwardedFor;
        private Path storeDir;

        private Builder() {
        }

        /** Cache key namespace: {@code <product>:<instance>:}. Default: {@code chatbox:default:}. */
        public Builder cacheNamespace(String product, String instance) {
            this.cacheProduct = Objects.requireNonNull(product, "product");
            this.cacheInstance = Objects.requireNonNull(instance, "instance");
            return this;
        }

        /** Heartbeat and sweep period. Default: 60 seconds. */
        public Builder heartbeatInterval(Duration v) { this.heartbeatInterval = v; return this; }

        /** Presence rows idle for longer than this are swept. Default: 5 minutes. */
        public Builder sessionExpiry(Duration v) { this.sessionExpiry = v; return this; }

        /** Size of the recent-history window. Default: 100. */
        public Builder historyCapacity(int v) { this.historyCapacity = v; return this; }

        public Builder defaultHistoryLimit(int v) { this.defaultHistoryLimit = v; return this; }

        public Builder historyCacheTtl(Duration v) { this.historyCacheTtl = v; return this; }

        public Builder maxMessageLength(int v) { this.maxMessageLength = v; return this; }

        public Builder maxNicknameLength(int v) { this.maxNicknameLength = v; return this; }

        public Builder reservedNicknames(Set<String> v) { this.reservedNicknames = Set.copyOf(v); return this; }

        /** Default write budget; runtime settings may override it. Default: 10 per 60 seconds. */
        public Builder rateLimit(int messages, Duration window) {
            this.rateLimitMessages = messages;
            this.rateLimitWindow = window;
            return this;
        }

        /** Streams end with a {@code reconnect} event after this long. Default: 10 minutes. */
        public Builder streamMaxDuration(Duration v) { this.streamMaxDuration = v; return this; }

        /** Keep-alive comment interval. Default: 20 seconds. */
        public Builder streamPingInterval(Duration v) { this.streamPingInterval = v; return this; }

        public Builder kickBanDuration(Duration v) { this.kickBanDuration = v; return this; }

        /** Auto-ban after {@code threshold} violations of one kind within {@code window}, for {@code banFor}. */
        public Builder violations(int threshold, Duration window, Duration banFor) {
            this.violationThreshold = threshold;
            this.violationWindow = window;
            this.autoBanDuration = banFor;
            return this;
        }

        public Builder settingsCacheTtl(Duration v) { this.settingsCacheTtl = v; return this; }

        public Builder attachmentRetention(Duration v) { this.attachmentRetention = v; return this; }

        public Builder attachmentMaxBytes(long v) { this.attachmentMaxBytes = v; return this; }

        public Builder attachmentDir(Path v) { this.attachmentDir = v; return this; }

        public Builder privateConversationLimit(int v) { this.privateConversationLimit = v; return this; }

        public Builder privateRecentLimit(int v) { this.privateRecentLimit = v; return this; }

        public Builder deletedMessageRetention(Duration v) { this.deletedMessageRetention = v; return this; }

        /** Take the origin address from {@code X-Forwarded-For} when present. Default: false. */
        public Builder trustForwardedFor(boolean v) { this.trustForwardedFor = v; return this; }

        public Builder storeDir(Path v) { this.storeDir = v; return this; }

        public ChatServerConfig build() {
            return new ChatServerConfig(this);
        }
    }
}

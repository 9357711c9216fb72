package io.chatbox.server.core;

import io.chatbox.core.ChatException;
import io.chatbox.json.spi.JsonCodec;
import io.chatbox.json.spi.JsonCodecs;
import io.chatbox.server.core.cache.FixedWindowRateLimiter;
import io.chatbox.server.core.cache.InMemoryChatCache;
import io.chatbox.server.core.cache.LocalDistributionBus;
import io.chatbox.server.core.service.AccountService;
import io.chatbox.server.core.service.AttachmentService;
import io.chatbox.server.core.service.BanService;
import io.chatbox.server.core.service.ContentFilter;
import io.chatbox.server.core.service.MessageService;
import io.chatbox.server.core.service.ModerationService;
import io.chatbox.server.core.service.PasswordHasher;
import io.chatbox.server.core.service.PresenceManager;
import io.chatbox.server.core.service.PrivateMessageService;
import io.chatbox.server.core.service.SettingsService;
import io.chatbox.server.core.service.SyntheticRosterService;
import io.chatbox.server.core.service.ViolationTracker;
import io.chatbox.server.core.store.RowChatStore;
import io.chatbox.server.spi.CacheKeys;
import io.chatbox.server.spi.ChatCache;
import io.chatbox.server.spi.ChatStore;
import io.chatbox.server.spi.DistributionBus;
import io.chatbox.server.spi.RateLimiter;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.util.Objects;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.TimeUnit;
import java.util.function.IntSupplier;

/**
 * Wires the chat services over one store, cache and bus, and runs periodic maintenance.
 *
 * <pre>{@code
 * ChatEngine engine = ChatEngine.builder()
 *     .config(ChatServerConfig.load())
 *     .build();
 * engine.start();
 * ChatHandler handler = ChatHandler.builder(engine).build();
 * }</pre>
 */
public final class ChatEngine implements AutoCloseable {
    private static final Logger logger = LoggerFactory.getLogger(ChatEngine.class);

    private final ChatServerConfig config;
    private final ChatStore store;
    private final ChatCache cache;
    private final DistributionBus bus;
    private final JsonCodec codec;
    private final Clock clock;

    private final SettingsService settings;
    private final BanService bans;
    private final AccountService accounts;
    private final PresenceManager presence;
    private final MessageService messages;
    private final PrivateMessageService privateMessages;
    private final AttachmentService attachments;
    private final SyntheticRosterService synthetic;
    private final ModerationService moderation;

    private ScheduledExecutorService maintenance;

    public static Builder builder() {
        return new Builder();
    }

    private ChatEngine(Builder b) {
        this.config = b.config != null ? b.config : ChatServerConfig.defaults();
        this.clock = b.clock != null ? b.clock : Clock.systemUTC();
        this.codec = b.codec != null ? b.codec : JsonCodecs.load();
        this.store = b.store != null ? b.store : defaultStore(config, codec);
        this.cache = b.cache != null ? b.cache : new InMemoryChatCache(clock);
        this.bus = b.bus != null ? b.bus : new LocalDistributionBus();

        CacheKeys keys = new CacheKeys(config.cacheProduct(), config.cacheInstance());
        this.settings = new SettingsService(store, cache, keys, codec, bus, config);
        RateLimiter rateLimiter = b.rateLimiter != null
                ? b.rateLimiter
                : new FixedWindowRateLimiter(cache, keys, settings::rateLimit, clock);
        this.bans = new BanService(store, cache, keys, codec, config, clock);
        ViolationTracker violations = new ViolationTracker(cache, keys, bans, config);
        ContentFilter filter = new ContentFilter(settings);
        this.accounts = new AccountService(store, new PasswordHasher(), clock, config.sessionExpiry());
        this.presence = new PresenceManager(store, accounts, bans, settings, bus, config, clock);
        this.messages = new MessageService(store, cache, keys, codec, bus, settings, filter, rateLimiter, violations,
                bans, presence, config, clock);
        this.attachments = new AttachmentService(store, presence, settings, config, clock);
        this.privateMessages = new PrivateMessageService(store, presence, attachments, settings, filter, rateLimiter,
                violations, bans, bus, config, clock);
        this.synthetic = new SyntheticRosterService(store, presence, settings, config);
        this.moderation = new ModerationService(presence, accounts, messages, bans, settings, synthetic);
    }

    private static ChatStore defaultStore(ChatServerConfig config, JsonCodec codec) {
        if (config.storeDir() == null) {
            logger.info("No store directory configured, using in-memory store");
            return RowChatStore.inMemory();
        }
        return RowChatStore.rocksDb(config.storeDir(), codec);
    }

    /**
     * Verifies the durable store, seeds defaults and schedules maintenance.
     *
     * @throws ChatException.TransientStore when the durable store is unreachable
     */
    public synchronized void start() {
        if (maintenance != null) {
            return;
        }
        store.ping();
        try {
            cache.ping();
        } catch (ChatException.TransientStore e) {
            logger.warn("Cache unavailable at start-up, reads will fall back to the durable store", e);
        }
        settings.seedDefaults();

        long periodMillis = config.heartbeatInterval().toMillis();
        maintenance = Executors.newSingleThreadScheduledExecutor(r -> {
            Thread t = new Thread(r, "chatbox-maintenance");
            t.setDaemon(true);
            return t;
        });
        maintenance.scheduleAtFixedRate(this::runMaintenance, periodMillis, periodMillis, TimeUnit.MILLISECONDS);
        logger.info("Chat engine started (heartbeat {}, session expiry {})",
                config.heartbeatInterval(), config.sessionExpiry());
    }

    /** One maintenance pass. Each step is isolated so one failure does not skip the rest. */
    public void runMaintenance() {
        step("presence sweep", presence::sweepExpired);
        step("synthetic roster balance", synthetic::balance);
        step("ban expiry", bans::sweepExpired);
        step("attachment purge", attachments::purgeExpired);
        step("deleted message purge", messages::purgeDeleted);
    }

    private static void step(String name, IntSupplier task) {
        try {
            int n = task.getAsInt();
            logger.debug("Maintenance {} touched {} rows", name, n);
        } catch (RuntimeException e) {
            logger.warn("Maintenance step {} failed", name, e);
        }
    }

    public synchronized void stop() {
        if (maintenance != null) {
            maintenance.shutdownNow();
            maintenance = null;
            logger.info("Chat engine stopped");
        }
    }

    @Override
    public void close() {
        stop();
        store.close();
    }

    public ChatServerConfig config() { return config; }
    public ChatStore store() { return store; }
    public ChatCache cache() { return cache; }
    public DistributionBus bus() { return bus; }
    public JsonCodec codec() { return codec; }
    public Clock clock() { return clock; }
    public SettingsService settings() { return settings; }
    public BanService bans() { return bans; }
    public AccountService accounts() { return accounts; }
    public PresenceManager presence() { return presence; }
    public MessageService messages() { return messages; }
    public PrivateMessageService privateMessages() { return privateMessages; }
    public AttachmentService attachments() { return attachments; }
    public SyntheticRosterService synthetic() { return synthetic; }
    public ModerationService moderation() { return moderation; }

    /**
     * Builder for {@link ChatEngine}. Every collaborator is optional.
     */
    public static final class Builder {
        private ChatServerConfig config;
        private ChatStore store;
        private ChatCache cache;
        private DistributionBus bus;
        private JsonCodec codec;
        private RateLimiter rateLimiter;
        private Clock clock;

        private Builder() {
        }

        /** Default: {@link ChatServerConfig#defaults()}. */
        public Builder config(ChatServerConfig config) {
            this.config = config;
            return this;
        }

        /** Default: RocksDB under {@code storeDir}, or in-memory when none is configured. */
        public Builder store(ChatStore store) {
            this.store = store;
            return this;
        }

        /** Default: {@link InMemoryChatCache}. */
        public Builder cache(ChatCache cache) {
            this.cache = cache;
            return this;
        }

        /** Default: {@link LocalDistributionBus}. */
        public Builder bus(DistributionBus bus) {
            this.bus = bus;
            return this;
        }

        /** Default: the first {@code JsonCodecProvider} on the class path. */
        public Builder codec(JsonCodec codec) {
            this.codec = codec;
            return this;
        }

        /** Default: fixed window over the cache, limits from the {@code rate_limit_*} settings. */
        public Builder rateLimiter(RateLimiter rateLimiter) {
            this.rateLimiter = rateLimiter;
            return this;
        }

        public Builder clock(Clock clock) {
            this.clock = Objects.requireNonNull(clock, "clock");
            return this;
        }

        public ChatEngine build() {
            return new ChatEngine(this);
        }
    }
}

package io.chatbox.server.core.service;

import io.chatbox.core.ChatEvent;
import io.chatbox.core.ChatException;
import io.chatbox.core.ChatMessage;
import io.chatbox.core.MessageView;
import io.chatbox.core.ReplyPreview;
import io.chatbox.json.spi.JsonCodec;
import io.chatbox.json.spi.JsonException;
import io.chatbox.server.core.ChatServerConfig;
import io.chatbox.server.spi.CacheKeys;
import io.chatbox.server.spi.ChatCache;
import io.chatbox.server.spi.ChatStore;
import io.chatbox.server.spi.DistributionBus;
import io.chatbox.server.spi.NewMessage;
import io.chatbox.server.spi.RateLimiter;
import io.chatbox.server.spi.SessionRecord;
import io.chatbox.server.spi.WindowEntry;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;
import java.util.UUID;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Public chat: posting, history and moderation deletes.
 *
 * <p>The durable store is the source of truth. The cache holds a bounded window of the newest messages, keyed
 * by sequence id; the window is only appended to while it exists and is rebuilt from the store on a miss. A
 * rebuild runs at most once per key at a time, and it drops its own result if a message was persisted while it
 * was loading.
 */
public final class MessageService {
    private static final Logger logger = LoggerFactory.getLogger(MessageService.class);

    public static final int MAX_CATCH_UP = 500;

    private final ChatStore store;
    private final DegradingCache cache;
    private final CacheKeys keys;
    private final DistributionBus bus;
    private final SettingsService settings;
    private final ContentFilter filter;
    private final RateLimiter rateLimiter;
    private final ViolationTracker violations;
    private final BanService bans;
    private final PresenceManager presence;
    private final ChatServerConfig config;
    private final Clock clock;

    private final ConcurrentHashMap<String, CompletableFuture<List<ChatMessage>>> rebuilds = new ConcurrentHashMap<>();

    public MessageService(ChatStore store, ChatCache cache, CacheKeys keys, JsonCodec codec, DistributionBus bus,
                          SettingsService settings, ContentFilter filter, RateLimiter rateLimiter,
                          ViolationTracker violations, BanService bans, PresenceManager presence,
                          ChatServerConfig config, Clock clock) {
        this.store = Objects.requireNonNull(store, "store");
        this.cache = new DegradingCache(cache, codec);
        this.keys = Objects.requireNonNull(keys, "keys");
        this.bus = Objects.requireNonNull(bus, "bus");
        this.settings = Objects.requireNonNull(settings, "settings");
        this.filter = Objects.requireNonNull(filter, "filter");
        this.rateLimiter = Objects.requireNonNull(rateLimiter, "rateLimiter");
        this.violations = Objects.requireNonNull(violations, "violations");
        this.bans = Objects.requireNonNull(bans, "bans");
        this.presence = Objects.requireNonNull(presence, "presence");
        this.config = Objects.requireNonNull(config, "config");
        this.clock = Objects.requireNonNull(clock, "clock");
    }

    /**
     * Validates, filters, persists and broadcasts a public message.
     *
     * @param replyTo message id being quoted; ignored when that message is gone
     * @throws ChatException.RateLimited when the origin is over its write budget; nothing is stored
     */
    public ChatMessage post(String username, String sessionId, String originAddress, String text, String replyTo) {
        String body = text == null ? "" : text.strip();
        if (body.isEmpty()) {
            throw new ChatException.Validation("message must not be empty");
        }
        if (body.length() > config.maxMessageLength()) {
            throw new ChatException.Validation("message must be at most " + config.maxMessageLength() + " characters");
        }
        SessionRecord session = presence.requireLiveSession(username, sessionId);
        if (!settings.chatMode().allowsPublic()) {
            throw new ChatException.Forbidden("public chat is disabled");
        }
        bans.requireNotBanned(session.sessionId(), originAddress, session.username());
        checkRate(originAddress);

        FilterResult filtered = filter.filter(body, Visibility.PUBLIC);
        if (filtered.blacklistHit()) {
            violations.record(ViolationTracker.Kind.SPAM_URL, originAddress);
        }
        if (filtered.modified()) {
            logger.debug("Filtered message from {}: {}", session.username(), filtered.reasons());
        }

        String quoted = replyTo == null || replyTo.isBlank() ? null : replyTo.trim();
        ReplyPreview preview = null;
        if (quoted != null) {
            Optional<ChatMessage> target = store.findMessage(quoted).filter(m -> !m.deleted());
            if (target.isPresent()) {
                preview = ReplyPreview.of(target.get());
            } else {
                logger.debug("Reply target {} is gone, posting without quote", quoted);
                quoted = null;
            }
        }

        ChatMessage saved = store.appendMessage(new NewMessage("msg_" + UUID.randomUUID(), session.username(),
                session.accountId(), filtered.text(), quoted, preview, originAddress, clock.instant()));
        store.touchSession(session.username(), session.sessionId(), clock.instant(), presence.liveSince());
        appendToWindow(saved);
        bus.publish(new ChatEvent.Message(saved));
        logger.debug("Stored message {} seq={} from {}", saved.messageId(), saved.sequenceId(), saved.username());
        return saved;
    }

    /**
     * Newest {@code limit} live messages, oldest first. Empty while public chat is disabled.
     */
    public List<MessageView> history(int limit) {
        if (!settings.chatMode().allowsPublic()) {
            return List.of();
        }
        int n = limit <= 0 ? config.defaultHistoryLimit() : Math.min(limit, config.historyCapacity());
        Optional<List<WindowEntry>> window;
        try {
            window = cache.raw().windowRange(keys.messages(), n);
        } catch (ChatException.TransientStore e) {
            logger.warn("History cache unavailable, reading durable store", e);
            return views(store.recentMessages(n));
        }
        if (window.isEmpty()) {
            return views(tail(rebuild(), n));
        }
        return fromWindow(window.get());
    }

    /** Live messages with a sequence id above {@code sequenceId}, ascending. */
    public List<MessageView> messagesAfter(long sequenceId, int limit) {
        if (!settings.chatMode().allowsPublic()) {
            return List.of();
        }
        int n = limit <= 0 ? MAX_CATCH_UP : Math.min(limit, MAX_CATCH_UP);
        return views(store.messagesAfter(Math.max(0, sequenceId), n));
    }

    public void delete(String messageId) {
        if (messageId == null || messageId.isBlank()) {
            throw new ChatException.Validation("message id is required");
        }
        if (!store.softDeleteMessage(messageId.trim())) {
            throw new ChatException.NotFound("message " + messageId.trim() + " not found");
        }
        cache.invalidate(keys.messages());
        bus.publish(new ChatEvent.MessageDeleted(messageId.trim()));
        logger.info("Deleted message {}", messageId.trim());
    }

    /** Soft-deletes every message and tells viewers to clear their screens. */
    public int clear() {
        int n = store.softDeleteAllMessages();
        cache.invalidate(keys.messages());
        bus.publish(new ChatEvent.Clear());
        logger.info("Cleared chat ({} messages)", n);
        return n;
    }

    /** Drops the cached window; the next history read rebuilds it. */
    public void clearCache() {
        cache.invalidate(keys.messages());
    }

    /** Administrative listing, newest first, deleted rows included. */
    public List<ChatMessage> listAll(int limit, int offset) {
        int n = limit <= 0 ? config.defaultHistoryLimit() : Math.min(limit, MAX_CATCH_UP);
        return store.listMessages(n, Math.max(0, offset));
    }

    public long count() {
        return store.countMessages();
    }

    /** Physically removes messages soft-deleted longer than the retention period. */
    public int purgeDeleted() {
        int n = store.purgeDeletedMessagesBefore(clock.instant().minus(config.deletedMessageRetention()));
        if (n > 0) {
            logger.info("Purged {} deleted messages", n);
        }
        return n;
    }

    private void checkRate(String originAddress) {
        if (rateLimiter.tryAcquire(originAddress) instanceof RateLimiter.Result.Rejected rejected) {
            violations.record(ViolationTracker.Kind.RATE_LIMIT, originAddress);
            throw new ChatException.RateLimited("too many messages, slow down", rejected.retryAfter().orElse(null));
        }
    }

    private void appendToWindow(ChatMessage saved) {
        try {
            cache.raw().windowAdd(keys.messages(), entry(saved), config.historyCapacity(), config.historyCacheTtl());
        } catch (ChatException.TransientStore e) {
            logger.warn("History cache update failed for {}, dropping window", saved.messageId(), e);
            cache.invalidate(keys.messages());
        }
    }

    private List<ChatMessage> rebuild() {
        String key = keys.messages();
        CompletableFuture<List<ChatMessage>> mine = new CompletableFuture<>();
        CompletableFuture<List<ChatMessage>> inFlight = rebuilds.putIfAbsent(key, mine);
        if (inFlight != null) {
            return await(inFlight);
        }
        try {
            long watermark = store.latestSequence();
            List<ChatMessage> recent = store.recentMessages(config.historyCapacity());
            install(recent);
            if (store.latestSequence() != watermark) {
                // a post landed while loading and could not reach the missing window
                cache.invalidate(key);
            }
            mine.complete(recent);
            return recent;
        } catch (RuntimeException e) {
            mine.completeExceptionally(e);
            throw e;
        } finally {
            rebuilds.remove(key, mine);
        }
    }

    private void install(List<ChatMessage> recent) {
        List<WindowEntry> entries = new ArrayList<>(recent.size());
        for (ChatMessage m : recent) {
            entries.add(entry(m));
        }
        try {
            cache.raw().windowInstall(keys.messages(), entries, config.historyCapacity(), config.historyCacheTtl());
            logger.debug("Rebuilt history window with {} messages", entries.size());
        } catch (ChatException.TransientStore e) {
            logger.warn("Could not install history window", e);
        }
    }

    private List<MessageView> fromWindow(List<WindowEntry> window) {
        List<Long> ids = new ArrayList<>(window.size());
        for (WindowEntry e : window) {
            ids.add(e.score());
        }
        Set<Long> deleted = ids.isEmpty() ? Set.of() : store.deletedAmong(ids);
        List<MessageView> out = new ArrayList<>(window.size());
        for (WindowEntry e : window) {
            if (deleted.contains(e.score())) continue;
            try {
                out.add(cache.codec().readValue(e.member(), MessageView.class));
            } catch (JsonException ex) {
                logger.warn("Unreadable history entry seq={}, dropping window", e.score(), ex);
                cache.invalidate(keys.messages());
                return views(store.recentMessages(window.size()));
            }
        }
        return out;
    }

    private WindowEntry entry(ChatMessage m) {
        try {
            return new WindowEntry(m.sequenceId(), cache.codec().writeString(m.toView()));
        } catch (JsonException e) {
            throw new IllegalStateException("Failed to encode message " + m.messageId(), e);
        }
    }

    private static List<ChatMessage> await(CompletableFuture<List<ChatMessage>> inFlight) {
        try {
            return inFlight.join();
        } catch (CompletionException e) {
            if (e.getCause() instanceof RuntimeException re) {
                throw re;
            }
            throw e;
        }
    }

    private static List<ChatMessage> tail(List<ChatMessage> messages, int n) {
        return messages.size() <= n ? messages : messages.subList(messages.size() - n, messages.size());
    }

    private static List<MessageView> views(List<ChatMessage> messages) {
        List<MessageView> out = new ArrayList<>(messages.size());
        for (ChatMessage m : messages) {
            out.add(m.toView());
        }
        return out;
    }
}

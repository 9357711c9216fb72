package io.chatbox.server.core.service;

import io.chatbox.core.ChatEvent;
import io.chatbox.core.ChatException;
import io.chatbox.core.PrivateChatMessage;
import io.chatbox.core.PrivateMessageView;
import io.chatbox.server.core.ChatServerConfig;
import io.chatbox.server.spi.ChatStore;
import io.chatbox.server.spi.DistributionBus;
import io.chatbox.server.spi.NewPrivateMessage;
import io.chatbox.server.spi.RateLimiter;
import io.chatbox.server.spi.SessionRecord;
import io.chatbox.server.spi.SyntheticIdentity;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.Optional;

/**
 * One-to-one messages. Every row is addressed to an exact (username, session id) pair on both sides, so a later
 * session reusing a nickname never sees the earlier session's conversations.
 */
public final class PrivateMessageService {
    private static final Logger logger = LoggerFactory.getLogger(PrivateMessageService.class);

    private record Recipient(String username, String sessionId, Long accountId) {}

    private final ChatStore store;
    private final PresenceManager presence;
    private final AttachmentService attachments;
    private final SettingsService settings;
    private final ContentFilter filter;
    private final RateLimiter rateLimiter;
    private final ViolationTracker violations;
    private final BanService bans;
    private final DistributionBus bus;
    private final ChatServerConfig config;
    private final Clock clock;

    public PrivateMessageService(ChatStore store, PresenceManager presence, AttachmentService attachments,
                                 SettingsService settings, ContentFilter filter, RateLimiter rateLimiter,
                                 ViolationTracker violations, BanService bans, DistributionBus bus,
                                 ChatServerConfig config, Clock clock) {
        this.store = Objects.requireNonNull(store, "store");
        this.presence = Objects.requireNonNull(presence, "presence");
        this.attachments = Objects.requireNonNull(attachments, "attachments");
        this.settings = Objects.requireNonNull(settings, "settings");
        this.filter = Objects.requireNonNull(filter, "filter");
        this.rateLimiter = Objects.requireNonNull(rateLimiter, "rateLimiter");
        this.violations = Objects.requireNonNull(violations, "violations");
        this.bans = Objects.requireNonNull(bans, "bans");
        this.bus = Objects.requireNonNull(bus, "bus");
        this.config = Objects.requireNonNull(config, "config");
        this.clock = Objects.requireNonNull(clock, "clock");
    }

    /**
     * Sends a private message. At least one of {@code text} and {@code attachmentRef} is required.
     *
     * <p>The recipient is the live session of {@code toUsername} with the most recent heartbeat, or an active
     * synthetic identity of that name.
     */
    public PrivateChatMessage send(String fromUsername, String fromSessionId, String originAddress,
                                   String toUsername, String text, String attachmentRef) {
        if (!settings.chatMode().allowsPrivate()) {
            throw new ChatException.Forbidden("private chat is disabled");
        }
        SessionRecord sender = presence.requireLiveSession(fromUsername, fromSessionId);
        String body = text == null || text.isBlank() ? null : text.strip();
        String ref = attachmentRef == null || attachmentRef.isBlank() ? null : attachmentRef.trim();
        if (body == null && ref == null) {
            throw new ChatException.Validation("message or attachment is required");
        }
        if (body != null && body.length() > config.maxMessageLength()) {
            throw new ChatException.Validation("message must be at most " + config.maxMessageLength() + " characters");
        }
        if (toUsername == null || toUsername.isBlank()) {
            throw new ChatException.Validation("recipient is required");
        }
        if (toUsername.trim().equalsIgnoreCase(sender.username())) {
            throw new ChatException.Validation("cannot send a private message to yourself");
        }
        bans.requireNotBanned(sender.sessionId(), originAddress, sender.username());
        if (rateLimiter.tryAcquire(originAddress) instanceof RateLimiter.Result.Rejected rejected) {
            violations.record(ViolationTracker.Kind.RATE_LIMIT, originAddress);
            throw new ChatException.RateLimited("too many messages, slow down", rejected.retryAfter().orElse(null));
        }

        Recipient to = resolveRecipient(toUsername.trim());
        String filteredText = null;
        if (body != null) {
            FilterResult filtered = filter.filter(body, Visibility.PRIVATE);
            if (filtered.blacklistHit()) {
                violations.record(ViolationTracker.Kind.SPAM_URL, originAddress);
            }
            filteredText = filtered.text();
        }
        if (ref != null) {
            attachments.requireLinkable(ref, sender.sessionId());
        }

        PrivateChatMessage saved = store.appendPrivateMessage(new NewPrivateMessage(sender.username(),
                sender.sessionId(), sender.accountId(), to.username(), to.sessionId(), to.accountId(),
                filteredText, ref, clock.instant()));
        bus.publish(new ChatEvent.PrivateMessage(saved));
        logger.debug("Private message {} from {} to {}", saved.id(), saved.fromUsername(), saved.toUsername());
        return saved;
    }

    /** Conversation between the caller's session and {@code withUsername}, oldest first. */
    public List<PrivateMessageView> conversation(String username, String sessionId, String withUsername) {
        SessionRecord me = presence.requireLiveSession(username, sessionId);
        if (withUsername == null || withUsername.isBlank()) {
            throw new ChatException.Validation("conversation partner is required");
        }
        return views(store.conversation(me.username(), me.sessionId(), withUsername.trim(),
                config.privateConversationLimit()));
    }

    /** The caller's most recent private messages with anyone. */
    public List<PrivateMessageView> recent(String username, String sessionId) {
        SessionRecord me = presence.requireLiveSession(username, sessionId);
        return views(store.recentPrivateMessages(me.username(), me.sessionId(), config.privateRecentLimit()));
    }

    public int markRead(String username, String sessionId, String fromUsername) {
        SessionRecord me = presence.requireLiveSession(username, sessionId);
        if (fromUsername == null || fromUsername.isBlank()) {
            throw new ChatException.Validation("sender is required");
        }
        return store.markPrivateMessagesRead(me.username(), me.sessionId(), fromUsername.trim(), clock.instant());
    }

    private Recipient resolveRecipient(String toUsername) {
        Optional<SessionRecord> live = presence.latestLiveSession(toUsername);
        if (live.isPresent()) {
            SessionRecord s = live.get();
            return new Recipient(s.username(), s.sessionId(), s.accountId());
        }
        for (SyntheticIdentity synthetic : store.syntheticIdentities()) {
            if (synthetic.active() && synthetic.nickname().equalsIgnoreCase(toUsername)) {
                return new Recipient(synthetic.nickname(), synthetic.sessionId(), null);
            }
        }
        throw new ChatException.NotFound(toUsername + " is not online");
    }

    private static List<PrivateMessageView> views(List<PrivateChatMessage> rows) {
        List<PrivateMessageView> out = new ArrayList<>(rows.size());
        for (PrivateChatMessage pm : rows) {
            out.add(pm.toView());
        }
        return out;
    }
}

package io.chatbox.server.core;

import io.chatbox.core.ChatEvent;
import io.chatbox.core.ChatMode;
import io.chatbox.core.PrivateChatMessage;
import io.chatbox.core.Protocol;
import io.chatbox.json.spi.JsonCodec;
import io.chatbox.json.spi.JsonException;
import io.chatbox.server.core.service.MessageService;
import io.chatbox.server.core.service.PresenceManager;
import io.chatbox.server.core.service.SettingsService;
import io.chatbox.server.spi.DistributionBus;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;
import java.util.concurrent.BlockingQueue;
import java.util.concurrent.Flow;
import java.util.concurrent.LinkedBlockingQueue;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * Per-client chat stream: an initial snapshot ({@code users}, {@code history}, {@code config}) followed by live
 * bus events, keep-alive comments and a final {@code reconnect}.
 *
 * <p>Each subscriber gets its own publisher thread and bus subscription; the subscription is released when the
 * stream ends for any reason.
 */
final class ChatStreamPublisher implements Flow.Publisher<SseFrame> {
    private static final Logger logger = LoggerFactory.getLogger(ChatStreamPublisher.class);

    private static final long POLL_MILLIS = 100;

    private final PresenceManager presence;
    private final MessageService messages;
    private final SettingsService settings;
    private final DistributionBus bus;
    private final JsonCodec codec;
    private final String username;
    private final String sessionId;
    private final Duration maxDuration;
    private final Duration pingInterval;
    private final Clock clock;
    private final ThreadFactory threads;

    ChatStreamPublisher(
            PresenceManager presence,
            MessageService messages,
            SettingsService settings,
            DistributionBus bus,
            JsonCodec codec,
            String username,
            String sessionId,
            Duration maxDuration,
            Duration pingInterval,
            Clock clock,
            ThreadFactory threads
    ) {
        this.presence = Objects.requireNonNull(presence, "presence");
        this.messages = Objects.requireNonNull(messages, "messages");
        this.settings = Objects.requireNonNull(settings, "settings");
        this.bus = Objects.requireNonNull(bus, "bus");
        this.codec = Objects.requireNonNull(codec, "codec");
        this.username = username;
        this.sessionId = sessionId;
        this.maxDuration = Objects.requireNonNull(maxDuration, "maxDuration");
        this.pingInterval = Objects.requireNonNull(pingInterval, "pingInterval");
        this.clock = Objects.requireNonNull(clock, "clock");
        this.threads = Objects.requireNonNull(threads, "threads");
    }

    @Override
    public void subscribe(Flow.Subscriber<? super SseFrame> subscriber) {
        Objects.requireNonNull(subscriber, "subscriber");
        subscriber.onSubscribe(new Sub(subscriber));
    }

    private final class Sub implements Flow.Subscription, Runnable {
        private final Flow.Subscriber<? super SseFrame> sub;
        private final AtomicBoolean cancelled = new AtomicBoolean(false);
        private final BlockingQueue<ChatEvent> inbox = new LinkedBlockingQueue<>();
        private volatile long demand;
        private ChatMode mode;

        Sub(Flow.Subscriber<? super SseFrame> sub) {
            this.sub = sub;
            threads.newThread(this).start();
        }

        @Override
        public void request(long n) {
            if (n <= 0) return;
            long current = demand;
            demand = current > Long.MAX_VALUE - n ? Long.MAX_VALUE : current + n;
        }

        @Override
        public void cancel() {
            cancelled.set(true);
        }

        @Override
        public void run() {
            DistributionBus.Subscription subscription = null;
            Instant started = clock.instant();
            try {
                // subscribe before the snapshot so nothing published in between is lost
                subscription = bus.subscribe(inbox::offer);
                mode = settings.chatMode();
                emit(Protocol.EV_USERS, presence.roster());
                if (mode.allowsPublic()) {
                    emit(Protocol.EV_HISTORY, messages.history(0));
                }
                emit(Protocol.EV_CONFIG, configPayload(mode));

                Instant lastPing = clock.instant();
                while (!cancelled.get()) {
                    Instant now = clock.instant();
                    if (Duration.between(started, now).compareTo(maxDuration) >= 0) {
                        emit(Protocol.EV_RECONNECT, Map.of("reason", Protocol.REASON_MAX_RUNTIME));
                        break;
                    }
                    if (Duration.between(lastPing, now).compareTo(pingInterval) >= 0) {
                        emitFrame(SseFrame.comment("ping"));
                        lastPing = now;
                    }
                    ChatEvent event = inbox.poll(POLL_MILLIS, TimeUnit.MILLISECONDS);
                    if (event != null && !deliver(event)) {
                        break;
                    }
                }
                if (!cancelled.get()) {
                    sub.onComplete();
                }
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                sub.onError(e);
            } catch (Throwable t) {
                logger.warn("Chat stream for {} failed", username, t);
                sub.onError(t);
            } finally {
                if (subscription != null) {
                    subscription.close();
                }
            }
        }

        /** Returns {@code false} when the stream must end. */
        private boolean deliver(ChatEvent event) throws InterruptedException, JsonException {
            if (event instanceof ChatEvent.Message m) {
                if (mode.allowsPublic()) emit(Protocol.EV_MESSAGE, m.message().toView());
            } else if (event instanceof ChatEvent.MessageDeleted d) {
                if (mode.allowsPublic()) emit(Protocol.EV_MESSAGE_DELETED, Map.of("message_id", d.messageId()));
            } else if (event instanceof ChatEvent.Clear) {
                if (mode.allowsPublic()) emit(Protocol.EV_CLEAR, Map.of());
            } else if (event instanceof ChatEvent.Roster r) {
                emit(Protocol.EV_USERS, r.snapshot());
            } else if (event instanceof ChatEvent.PrivateMessage p) {
                if (mode.allowsPrivate() && involvesMe(p.message())) emit(Protocol.EV_PRIVATE, p.message().toView());
            } else if (event instanceof ChatEvent.ConfigChanged c) {
                mode = c.chatMode();
                emit(Protocol.EV_CONFIG, configPayload(mode));
            } else if (event instanceof ChatEvent.ForceDisconnect f) {
                Map<String, Object> marker = new LinkedHashMap<>();
                marker.put("type", Protocol.TYPE_USER_KICKED);
                marker.put("username", f.username());
                emit(Protocol.EV_USERS, marker);
                if (f.targets(sessionId)) {
                    emit(Protocol.EV_RECONNECT, Map.of("reason", Protocol.REASON_KICKED));
                    return false;
                }
            }
            return true;
        }

        private boolean involvesMe(PrivateChatMessage pm) {
            if (username == null || sessionId == null) return false;
            boolean from = pm.fromSessionId().equals(sessionId) && pm.fromUsername().equalsIgnoreCase(username);
            boolean to = pm.toSessionId().equals(sessionId) && pm.toUsername().equalsIgnoreCase(username);
            return from || to;
        }

        private void emit(String event, Object payload) throws InterruptedException, JsonException {
            emitFrame(new SseFrame(event, codec.writeString(payload)));
        }

        private void emitFrame(SseFrame frame) throws InterruptedException {
            while (demand <= 0 && !cancelled.get()) {
                Thread.sleep(5);
            }
            if (cancelled.get()) return;
            sub.onNext(frame);
            demand--;
        }
    }

    private static Map<String, String> configPayload(ChatMode mode) {
        return Map.of("chat_mode", mode.wireName());
    }
}

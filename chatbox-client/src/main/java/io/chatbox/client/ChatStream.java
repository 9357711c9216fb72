package io.chatbox.client;

import io.chatbox.core.ChatMode;
import io.chatbox.core.MessageView;
import io.chatbox.core.PrivateMessageView;
import io.chatbox.core.Protocol;
import io.chatbox.core.RosterSnapshot;
import io.chatbox.core.SseParser;
import io.chatbox.json.spi.JsonCodec;
import io.chatbox.json.spi.JsonException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.EOFException;
import java.io.IOException;
import java.io.InputStream;
import java.net.URI;
import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * A live chat subscription running on its own daemon thread.
 *
 * <p>The loop opens the stream, dispatches events to the listener and reconnects with {@link ReconnectBackoff}
 * when the connection drops or the server asks for a reconnect. Before resuming after a reconnect it fetches
 * public messages newer than the highest sequence id seen so far. Live messages at or below that id are
 * dropped as duplicates. A {@code reconnect} event with reason {@code kicked}, or a 403 on connect, ends the
 * loop for good.
 */
public final class ChatStream implements AutoCloseable {
    private static final Logger logger = LoggerFactory.getLogger(ChatStream.class);

    static final int CATCH_UP_PAGE = 500;

    private final ChatClient client;
    private final ChatTransport transport;
    private final JsonCodec codec;
    private final URI url;
    private final ChatStreamListener listener;
    private final ReconnectBackoff backoff;

    private final AtomicBoolean closed = new AtomicBoolean();
    private final CountDownLatch terminated = new CountDownLatch(1);
    private volatile Thread thread;
    private volatile InputStream current;
    private volatile long lastSequenceId;
    private volatile boolean kicked;

    ChatStream(ChatClient client, ChatTransport transport, JsonCodec codec, URI url, ChatStreamListener listener,
               ReconnectBackoff backoff) {
        this.client = client;
        this.transport = transport;
        this.codec = codec;
        this.url = url;
        this.listener = listener;
        this.backoff = backoff;
    }

    void start() {
        Thread t = new Thread(this::run, "chatbox-stream");
        t.setDaemon(true);
        thread = t;
        t.start();
    }

    /** Highest public sequence id delivered so far, 0 before any. */
    public long lastSequenceId() {
        return lastSequenceId;
    }

    public boolean isKicked() {
        return kicked;
    }

    public boolean isRunning() {
        return terminated.getCount() > 0;
    }

    public boolean awaitTermination(Duration timeout) throws InterruptedException {
        return terminated.await(timeout.toMillis(), TimeUnit.MILLISECONDS);
    }

    @Override
    public void close() {
        if (!closed.compareAndSet(false, true)) {
            return;
        }
        InputStream in = current;
        if (in != null) {
            try {
                in.close();
            } catch (IOException e) {
                logger.debug("Error closing stream body", e);
            }
        }
        Thread t = thread;
        if (t != null) {
            t.interrupt();
        }
    }

    private void run() {
        boolean connectedBefore = false;
        try {
            while (!closed.get()) {
                Throwable cause;
                try {
                    TransportResponse<InputStream> resp = transport.sendStream(TransportRequest.eventStream(url));
                    try (InputStream body = resp.body()) {
                        if (resp.status() == 403) {
                            logger.warn("Stream refused with 403; not reconnecting");
                            listener.onDisconnected(new ChatClientException(403, "forbidden", "stream refused"));
                            return;
                        }
                        if (resp.status() != 200) {
                            throw new ChatClientException(resp.status(), null, "stream status=" + resp.status());
                        }
                        current = body;
                        backoff.reset();
                        boolean reconnect = connectedBefore;
                        connectedBefore = true;
                        if (reconnect) {
                            catchUp();
                        }
                        listener.onConnected(reconnect);
                        if (consume(body)) {
                            kicked = true;
                            listener.onKicked();
                            return;
                        }
                        cause = null;
                    } finally {
                        current = null;
                    }
                } catch (EOFException e) {
                    cause = e;
                } catch (Exception e) {
                    if (closed.get()) {
                        return;
                    }
                    logger.debug("Chat stream failed", e);
                    cause = e;
                }
                if (closed.get()) {
                    return;
                }
                listener.onDisconnected(cause);
                Duration delay = backoff.nextDelay();
                logger.debug("Reconnecting in {} ms (attempt {})", delay.toMillis(), backoff.attempts());
                Thread.sleep(delay.toMillis());
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
        } finally {
            terminated.countDown();
        }
    }

    private void catchUp() throws Exception {
        while (true) {
            List<MessageView> page = client.messagesAfter(lastSequenceId, CATCH_UP_PAGE);
            for (MessageView m : page) {
                deliverMessage(m);
            }
            if (page.size() < CATCH_UP_PAGE) {
                return;
            }
        }
    }

    /**
     * Reads events until the connection ends.
     *
     * @return {@code true} if this session was kicked
     * @throws EOFException if the server closed without a {@code reconnect} event
     */
    private boolean consume(InputStream body) throws IOException, JsonException {
        SseParser parser = new SseParser(body);
        SseParser.Event ev;
        while ((ev = parser.next()) != null) {
            if (Protocol.EV_RECONNECT.equals(ev.eventType())) {
                Object reason = codec.readObject(bytes(ev.data())).get("reason");
                logger.debug("Server requested reconnect: {}", reason);
                return Protocol.REASON_KICKED.equals(reason);
            }
            dispatch(ev);
        }
        throw new EOFException("stream ended without reconnect");
    }

    private void dispatch(SseParser.Event ev) throws JsonException {
        String data = ev.data();
        try {
            switch (ev.eventType()) {
                case Protocol.EV_HISTORY -> {
                    List<MessageView> messages = codec.readList(data, MessageView.class);
                    messages.forEach(m -> lastSequenceId = Math.max(lastSequenceId, m.sequenceId()));
                    listener.onHistory(messages);
                }
                case Protocol.EV_MESSAGE -> deliverMessage(codec.readValue(data, MessageView.class));
                case Protocol.EV_MESSAGE_DELETED -> {
                    Object id = codec.readObject(bytes(data)).get("message_id");
                    if (id != null) listener.onMessageDeleted(id.toString());
                }
                case Protocol.EV_CLEAR -> listener.onClear();
                case Protocol.EV_USERS -> {
                    Map<String, Object> raw = codec.readObject(bytes(data));
                    if (Protocol.TYPE_USER_KICKED.equals(raw.get("type"))) {
                        listener.onUserKicked(String.valueOf(raw.get("username")));
                    } else {
                        listener.onRoster(codec.readValue(data, RosterSnapshot.class));
                    }
                }
                case Protocol.EV_PRIVATE -> listener.onPrivateMessage(codec.readValue(data, PrivateMessageView.class));
                case Protocol.EV_CONFIG -> {
                    Object mode = codec.readObject(bytes(data)).get("chat_mode");
                    listener.onConfig(ChatMode.parseOrDefault(mode == null ? null : mode.toString()));
                }
                default -> logger.debug("Ignoring unknown event {}", ev.eventType());
            }
        } catch (RuntimeException e) {
            logger.warn("Listener failed on {} event", ev.eventType(), e);
        }
    }

    private void deliverMessage(MessageView m) {
        if (m.sequenceId() <= lastSequenceId) {
            return;
        }
        lastSequenceId = m.sequenceId();
        listener.onMessage(m);
    }

    private static byte[] bytes(String s) {
        return s.getBytes(StandardCharsets.UTF_8);
    }
}

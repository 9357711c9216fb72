package io.chatbox.client;

import io.chatbox.core.Headers;
import io.chatbox.core.MessageView;
import io.chatbox.core.PrivateMessageView;
import io.chatbox.core.Profile;
import io.chatbox.core.Protocol;
import io.chatbox.json.spi.JsonCodec;
import io.chatbox.json.spi.JsonException;

import java.net.URI;
import java.net.URLEncoder;
import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.function.Supplier;

public final class JdkChatClient implements ChatClient {

    record Messages(List<MessageView> messages) {}

    record PrivateMessages(List<PrivateMessageView> messages) {}

    private final URI baseUri;
    private final ChatTransport transport;
    private final JsonCodec codec;
    private final Supplier<ReconnectBackoff> backoff;
    private final Duration requestTimeout;

    JdkChatClient(URI baseUri, ChatTransport transport, JsonCodec codec, Supplier<ReconnectBackoff> backoff,
                  Duration requestTimeout) {
        this.baseUri = Objects.requireNonNull(baseUri, "baseUri");
        this.transport = Objects.requireNonNull(transport, "transport");
        this.codec = Objects.requireNonNull(codec, "codec");
        this.backoff = Objects.requireNonNull(backoff, "backoff");
        this.requestTimeout = requestTimeout;
    }

    @Override
    public SessionInfo register(String username, String sessionId, Profile profile) throws Exception {
        Map<String, Object> body = new LinkedHashMap<>();
        body.put("username", username);
        body.put("sessionId", sessionId);
        if (profile != null) {
            body.put("age", profile.age());
            body.put("location", profile.location());
            body.put("sex", profile.sex());
        }
        return postJson(Protocol.PATH_REGISTER, body, SessionInfo.class);
    }

    @Override
    public void heartbeat(String username, String sessionId) throws Exception {
        postJson(Protocol.PATH_HEARTBEAT, Map.of("username", username, "sessionId", sessionId), Map.class);
    }

    @Override
    public void logout(String sessionId) throws Exception {
        postJson(Protocol.PATH_LOGOUT, Map.of("sessionId", sessionId), Map.class);
    }

    @Override
    public MessageView send(String username, String sessionId, String text, String replyTo) throws Exception {
        Map<String, Object> body = new LinkedHashMap<>();
        body.put("username", username);
        body.put("sessionId", sessionId);
        body.put("message", text);
        if (replyTo != null) {
            body.put("replyTo", replyTo);
        }
        return postJson(Protocol.PATH_SEND, body, MessageView.class);
    }

    @Override
    public List<MessageView> history(int limit) throws Exception {
        URI url = url(Protocol.PATH_HISTORY, Map.of(Protocol.Q_LIMIT, Integer.toString(limit)));
        return getJson(url, Messages.class).messages();
    }

    @Override
    public List<MessageView> messagesAfter(long afterSequenceId, int limit) throws Exception {
        Map<String, String> q = new LinkedHashMap<>();
        q.put(Protocol.Q_AFTER, Long.toString(afterSequenceId));
        if (limit > 0) {
            q.put(Protocol.Q_LIMIT, Integer.toString(limit));
        }
        List<MessageView> rows = getJson(url(Protocol.PATH_MESSAGES, q), Messages.class).messages();
        return rows == null ? List.of() : rows;
    }

    @Override
    public PrivateMessageView sendPrivate(String username, String sessionId, String to, String text)
            throws Exception {
        Map<String, Object> body = new LinkedHashMap<>();
        body.put("username", username);
        body.put("sessionId", sessionId);
        body.put("to", to);
        body.put("message", text);
        return postJson(Protocol.PATH_PRIVATE_MESSAGE, body, PrivateMessageView.class);
    }

    @Override
    public List<PrivateMessageView> privateConversation(String username, String sessionId, String with)
            throws Exception {
        Map<String, String> q = new LinkedHashMap<>();
        q.put(Protocol.Q_USERNAME, username);
        q.put(Protocol.Q_SESSION_ID, sessionId);
        if (with != null) {
            q.put(Protocol.Q_WITH, with);
        }
        List<PrivateMessageView> rows = getJson(url(Protocol.PATH_PRIVATE_MESSAGE, q), PrivateMessages.class)
                .messages();
        return rows == null ? List.of() : rows;
    }

    @Override
    public ChatStream stream(String username, String sessionId, ChatStreamListener listener) {
        Map<String, String> q = new LinkedHashMap<>();
        q.put(Protocol.Q_USERNAME, username);
        q.put(Protocol.Q_SESSION_ID, sessionId);
        ChatStream stream = new ChatStream(this, transport, codec, url(Protocol.PATH_STREAM, q), listener,
                backoff.get());
        stream.start();
        return stream;
    }

    private <T> T getJson(URI url, Class<T> type) throws Exception {
        return decode(transport.sendBytes(TransportRequest.getJson(url, requestTimeout)), type);
    }

    private <T> T postJson(String path, Object body, Class<T> type) throws Exception {
        TransportRequest req = TransportRequest.postJson(url(path, Map.of()), codec.writeBytes(body), requestTimeout);
        return decode(transport.sendBytes(req), type);
    }

    private <T> T decode(TransportResponse<byte[]> resp, Class<T> type) throws JsonException {
        if (resp.status() / 100 != 2) {
            throw toException(resp);
        }
        return codec.readValue(resp.body(), type);
    }

    private ChatClientException toException(TransportResponse<byte[]> resp) {
        String code = Headers.firstValue(resp.headers(), Protocol.H_ERROR).orElse(null);
        String message = null;
        if (resp.body() != null && resp.body().length > 0) {
            try {
                Map<String, Object> err = codec.readObject(resp.body());
                message = err.get("message") == null ? null : err.get("message").toString();
                if (code == null && err.get("error") != null) {
                    code = err.get("error").toString();
                }
            } catch (JsonException e) {
                message = new String(resp.body(), StandardCharsets.UTF_8);
            }
        }
        return new ChatClientException(resp.status(), code, message);
    }

    URI url(String path, Map<String, String> query) {
        StringBuilder sb = new StringBuilder(trimTrailingSlash(baseUri.toString())).append(path);
        char sep = '?';
        for (Map.Entry<String, String> e : query.entrySet()) {
            sb.append(sep)
                    .append(URLEncoder.encode(e.getKey(), StandardCharsets.UTF_8))
                    .append('=')
                    .append(URLEncoder.encode(e.getValue(), StandardCharsets.UTF_8));
            sep = '&';
        }
        return URI.create(sb.toString());
    }

    private static String trimTrailingSlash(String s) {
        return s.endsWith("/") ? s.substring(0, s.length() - 1) : s;
    }
}

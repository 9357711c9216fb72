package io.chatbox.server.core;

import io.chatbox.core.ChatException;
import io.chatbox.core.ChatMessage;
import io.chatbox.core.Profile;
import io.chatbox.core.Protocol;
import io.chatbox.json.spi.JsonCodec;
import io.chatbox.json.spi.JsonException;
import io.chatbox.server.spi.AttachmentRecord;
import io.chatbox.server.spi.SessionRecord;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Path;
import java.time.Clock;
import java.time.Duration;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;
import java.util.concurrent.ThreadFactory;

/**
 * Framework-neutral HTTP handler for the chat API.
 *
 * <p>Every route answers JSON except the stream ({@code text/event-stream}) and attachment downloads. Failures
 * are mapped in one place: a {@link ChatException} becomes its status with {@code X-Error: <code>} and a
 * {@code {error, message}} body; anything else is a 500 {@code internal_error}.
 *
 * <pre>{@code
 * ChatHandler handler = ChatHandler.builder(engine)
 *     .maxBodySize(6 * 1024 * 1024)
 *     .build();
 * }</pre>
 */
public final class ChatHandler {
    private static final Logger logger = LoggerFactory.getLogger(ChatHandler.class);

    /** Default cap on request bodies: attachments plus headroom. */
    public static final long DEFAULT_MAX_BODY_SIZE = 6L * 1024 * 1024;

    private final ChatEngine engine;
    private final JsonCodec codec;
    private final Duration streamMaxDuration;
    private final Duration pingInterval;
    private final long maxBodySize;
    private final Clock clock;
    private final ThreadFactory streamThreads;

    public static Builder builder(ChatEngine engine) {
        return new Builder(engine);
    }

    public ChatHandler(ChatEngine engine) {
        this(builder(engine));
    }

    private ChatHandler(Builder builder) {
        this.engine = Objects.requireNonNull(builder.engine, "engine");
        ChatServerConfig config = engine.config();
        this.codec = engine.codec();
        this.streamMaxDuration = builder.streamMaxDuration != null ? builder.streamMaxDuration : config.streamMaxDuration();
        this.pingInterval = builder.pingInterval != null ? builder.pingInterval : config.streamPingInterval();
        this.maxBodySize = builder.maxBodySize > 0 ? builder.maxBodySize : DEFAULT_MAX_BODY_SIZE;
        this.clock = builder.clock != null ? builder.clock : engine.clock();
        this.streamThreads = VirtualThreads.newFactory("chatbox-stream");
    }

    /**
     * Builder for {@link ChatHandler}.
     */
    public static final class Builder {
        private final ChatEngine engine;
        private Duration streamMaxDuration;
        private Duration pingInterval;
        private long maxBodySize;
        private Clock clock;

        private Builder(ChatEngine engine) {
            this.engine = Objects.requireNonNull(engine, "engine");
        }

        /** Stream lifetime before a {@code reconnect} is sent. Default: from the engine configuration. */
        public Builder streamMaxDuration(Duration streamMaxDuration) {
            this.streamMaxDuration = streamMaxDuration;
            return this;
        }

        /** Keep-alive comment interval. Default: from the engine configuration. */
        public Builder pingInterval(Duration pingInterval) {
            this.pingInterval = pingInterval;
            return this;
        }

        /** Maximum request body in bytes. Default: {@link #DEFAULT_MAX_BODY_SIZE}. */
        public Builder maxBodySize(long maxBodySize) {
            this.maxBodySize = maxBodySize;
            return this;
        }

        /** Clock used by streams. Default: the engine clock. */
        public Builder clock(Clock clock) {
            this.clock = clock;
            return this;
        }

        public ChatHandler build() {
            return new ChatHandler(this);
        }
    }

    public ServerResponse handle(ServerRequest req) {
        return handle(req, null);
    }

    /**
     * @param remoteAddress peer address reported by the hosting framework; replaced by the first
     *                      {@code X-Forwarded-For} entry when the configuration trusts that header
     */
    public ServerResponse handle(ServerRequest req, String remoteAddress) {
        String origin = originAddress(req, remoteAddress);
        String path = req.uri().getPath();
        try {
            if (path.startsWith(Protocol.ADMIN_PREFIX)) {
                return handleAdmin(req, path.substring(Protocol.ADMIN_PREFIX.length()));
            }
            return switch (path) {
                case Protocol.PATH_STREAM -> get(req, () -> handleStream(req));
                case Protocol.PATH_REGISTER -> post(req, () -> handleRegister(req, origin));
                case Protocol.PATH_LOGIN -> post(req, () -> handleLogin(req, origin));
                case Protocol.PATH_LOGOUT -> post(req, () -> handleLogout(req));
                case Protocol.PATH_HEARTBEAT -> post(req, () -> handleHeartbeat(req));
                case Protocol.PATH_SEND -> post(req, () -> handleSend(req, origin));
                case Protocol.PATH_HISTORY -> get(req, () -> handleHistory(req));
                case Protocol.PATH_MESSAGES -> get(req, () -> handleCatchUp(req));
                case Protocol.PATH_ACTIVE_USERS -> get(req, () -> json(200, engine.presence().roster()));
                case Protocol.PATH_SETTINGS -> get(req, () -> json(200, engine.settings().publicSettings()));
                case Protocol.PATH_PRIVATE_MESSAGE -> req.method() == HttpMethod.POST
                        ? handleSendPrivate(req, origin)
                        : get(req, () -> handlePrivateHistory(req));
                case Protocol.PATH_PRIVATE_MESSAGE_READ -> post(req, () -> handleMarkRead(req));
                case Protocol.PATH_ATTACHMENTS -> req.method() == HttpMethod.POST
                        ? handleUpload(req)
                        : get(req, () -> handleDownload(req));
                case Protocol.PATH_HEALTH -> get(req, this::handleHealth);
                default -> throw new ChatException.NotFound("no route for " + path);
            };
        } catch (ChatException e) {
            return error(e);
        } catch (Exception e) {
            logger.error("Unhandled failure on {} {}", req.method(), path, e);
            return new ServerResponse(500, errorBody("internal_error", "internal error"))
                    .header(Protocol.H_CONTENT_TYPE, Protocol.CT_JSON)
                    .header(Protocol.H_CACHE_CONTROL, "no-store")
                    .header(Protocol.H_ERROR, "internal_error");
        }
    }

    // ===== Public routes =====

    private ServerResponse handleStream(ServerRequest req) {
        Map<String, String> q = QueryString.parse(req.uri());
        String username = blankToNull(q.get(Protocol.Q_USERNAME));
        String sessionId = blankToNull(q.get(Protocol.Q_SESSION_ID));
        ChatStreamPublisher pub = new ChatStreamPublisher(engine.presence(), engine.messages(), engine.settings(),
                engine.bus(), codec, username, sessionId, streamMaxDuration, pingInterval, clock, streamThreads);
        return new ServerResponse(200, new ResponseBody.Sse(pub))
                .header(Protocol.H_CONTENT_TYPE, Protocol.CT_EVENT_STREAM)
                .header(Protocol.H_CACHE_CONTROL, "no-cache")
                .header("X-Accel-Buffering", "no");
    }

    private ServerResponse handleRegister(ServerRequest req, String origin) throws Exception {
        JsonBody body = readBody(req);
        Profile profile = new Profile(body.integer("age"), body.string("location"), body.string("sex"));
        SessionRecord session = engine.presence().register(body.string("username"), body.string("sessionId"),
                origin, profile);
        return json(200, sessionPayload(session));
    }

    private ServerResponse handleLogin(ServerRequest req, String origin) throws Exception {
        JsonBody body = readBody(req);
        SessionRecord session = engine.presence().login(body.string("username"), body.string("password"),
                body.string("sessionId"), origin);
        return json(200, sessionPayload(session));
    }

    private ServerResponse handleLogout(ServerRequest req) throws Exception {
        JsonBody body = readBody(req);
        boolean removed = engine.presence().logout(body.string("sessionId"));
        return json(200, Map.of("success", removed));
    }

    private ServerResponse handleHeartbeat(ServerRequest req) throws Exception {
        JsonBody body = readBody(req);
        if (!engine.presence().heartbeat(body.string("username"), body.string("sessionId"))) {
            throw new ChatException.NotFound("session not registered");
        }
        return json(200, Map.of("success", true));
    }

    private ServerResponse handleSend(ServerRequest req, String origin) throws Exception {
        JsonBody body = readBody(req);
        ChatMessage saved = engine.messages().post(body.string("username"), body.string("sessionId"), origin,
                body.firstString("message", "text"), body.firstString("replyTo", "reply_to"));
        return json(200, saved.toView());
    }

    private ServerResponse handleHistory(ServerRequest req) throws Exception {
        Map<String, String> q = QueryString.parse(req.uri());
        int limit = (int) QueryString.longParam(q, Protocol.Q_LIMIT, 0);
        return json(200, Map.of("messages", engine.messages().history(limit)));
    }

    private ServerResponse handleCatchUp(ServerRequest req) throws Exception {
        Map<String, String> q = QueryString.parse(req.uri());
        long after = QueryString.longParam(q, Protocol.Q_AFTER, 0);
        int limit = (int) QueryString.longParam(q, Protocol.Q_LIMIT, 0);
        return json(200, Map.of("messages", engine.messages().messagesAfter(after, limit)));
    }

    private ServerResponse handleSendPrivate(ServerRequest req, String origin) throws Exception {
        JsonBody body = readBody(req);
        var saved = engine.privateMessages().send(body.string("username"), body.string("sessionId"), origin,
                body.string("to"), body.firstString("message", "text"), body.string("attachmentRef"));
        return json(200, saved.toView());
    }

    private ServerResponse handlePrivateHistory(ServerRequest req) throws Exception {
        Map<String, String> q = QueryString.parse(req.uri());
        String username = q.get(Protocol.Q_USERNAME);
        String sessionId = q.get(Protocol.Q_SESSION_ID);
        String with = blankToNull(q.get(Protocol.Q_WITH));
        var rows = with == null
                ? engine.privateMessages().recent(username, sessionId)
                : engine.privateMessages().conversation(username, sessionId, with);
        return json(200, Map.of("messages", rows));
    }

    private ServerResponse handleMarkRead(ServerRequest req) throws Exception {
        JsonBody body = readBody(req);
        int updated = engine.privateMessages().markRead(body.string("username"), body.string("sessionId"),
                body.string("from"));
        return json(200, Map.of("updated", updated));
    }

    private ServerResponse handleUpload(ServerRequest req) throws Exception {
        Map<String, String> q = QueryString.parse(req.uri());
        String contentType = req.header(Protocol.H_CONTENT_TYPE).orElse(null);
        byte[] bytes = readBytes(req.body());
        AttachmentRecord record = engine.attachments().upload(q.get(Protocol.Q_USERNAME),
                q.get(Protocol.Q_SESSION_ID), contentType, bytes);
        Map<String, Object> out = new LinkedHashMap<>();
        out.put("ref", record.ref());
        out.put("mimeType", record.mimeType());
        out.put("size", record.size());
        out.put("expiresAt", record.expiresAt());
        return json(200, out);
    }

    private ServerResponse handleDownload(ServerRequest req) {
        Map<String, String> q = QueryString.parse(req.uri());
        AttachmentRecord record = engine.attachments().open(q.get("ref"), q.get(Protocol.Q_USERNAME),
                q.get(Protocol.Q_SESSION_ID));
        return new ServerResponse(200, new ResponseBody.File(Path.of(record.storagePath()), record.size()))
                .header(Protocol.H_CONTENT_TYPE, record.mimeType())
                .header(Protocol.H_CACHE_CONTROL, "private, no-store");
    }

    private ServerResponse handleHealth() throws Exception {
        Map<String, Object> out = new LinkedHashMap<>();
        int status = 200;
        try {
            engine.store().ping();
            out.put("store", "up");
        } catch (ChatException.TransientStore e) {
            logger.warn("Health check: durable store unavailable", e);
            out.put("store", "down");
            status = 503;
        }
        try {
            engine.cache().ping();
            out.put("cache", "up");
        } catch (ChatException.TransientStore e) {
            logger.warn("Health check: cache unavailable", e);
            out.put("cache", "degraded");
        }
        out.put("status", status == 200 ? "ok" : "unavailable");
        return json(status, out);
    }

    // ===== Moderation routes =====

    private ServerResponse handleAdmin(ServerRequest req, String action) throws Exception {
        String caller = req.header(Protocol.H_CHAT_SESSION).orElse(null);
        var moderation = engine.moderation();
        return switch (action) {
            case "delete-message" -> post(req, () -> {
                moderation.deleteMessage(caller, readBody(req).firstString("messageId", "message_id"));
                return ok();
            });
            case "kick" -> post(req, () -> json(200,
                    Map.of("sessions", moderation.kick(caller, readBody(req).string("username")))));
            case "clear" -> post(req, () -> json(200, Map.of("cleared", moderation.clear(caller))));
            case "ban-ip" -> post(req, () -> {
                JsonBody body = readBody(req);
                Long seconds = body.longValue("durationSeconds");
                Duration duration = seconds == null || seconds <= 0 ? null : Duration.ofSeconds(seconds);
                return json(200, moderation.banAddress(caller, body.firstString("address", "ip"),
                        body.string("reason"), duration));
            });
            case "unban-ip" -> post(req, () -> json(200, Map.of("success",
                    moderation.unbanAddress(caller, readBody(req).firstString("address", "ip")))));
            case "ban-nickname" -> post(req, () -> {
                JsonBody body = readBody(req);
                return json(200, moderation.banNickname(caller, body.string("nickname"), body.string("reason")));
            });
            case "unban-nickname" -> post(req, () -> json(200, Map.of("success",
                    moderation.unbanNickname(caller, readBody(req).string("nickname")))));
            case "bans" -> get(req, () -> json(200, Map.of(
                    "addresses", moderation.addressBans(caller),
                    "nicknames", moderation.nicknameBans(caller))));
            case "settings" -> post(req, () -> {
                moderation.updateSettings(caller, readBody(req).asStrings());
                return ok();
            });
            case "messages" -> get(req, () -> {
                Map<String, String> q = QueryString.parse(req.uri());
                int limit = (int) QueryString.longParam(q, Protocol.Q_LIMIT, 0);
                int offset = (int) QueryString.longParam(q, Protocol.Q_OFFSET, 0);
                Map<String, Object> out = new LinkedHashMap<>();
                out.put("messages", moderation.listMessages(caller, limit, offset));
                out.put("total", moderation.countMessages(caller));
                return json(200, out);
            });
            case "synthetic-users" -> req.method() == HttpMethod.POST
                    ? handleSynthetic(req, caller)
                    : get(req, () -> json(200, Map.of("users", moderation.syntheticUsers(caller))));
            default -> throw new ChatException.NotFound("no route for " + Protocol.ADMIN_PREFIX + action);
        };
    }

    private ServerResponse handleSynthetic(ServerRequest req, String caller) throws Exception {
        JsonBody body = readBody(req);
        var moderation = engine.moderation();
        String action = body.string("action");
        if (action == null) {
            throw new ChatException.Validation("action is required");
        }
        return switch (action) {
            case "add" -> json(200, moderation.addSyntheticUser(caller, body.string("nickname"),
                    body.integer("age"), body.string("sex"), body.string("location"),
                    body.bool("active", true)));
            case "activate", "deactivate" -> {
                moderation.setSyntheticUserActive(caller, body.requiredLong("id"), action.equals("activate"));
                yield ok();
            }
            case "delete" -> {
                moderation.deleteSyntheticUser(caller, body.requiredLong("id"));
                yield ok();
            }
            default -> throw new ChatException.Validation("unknown action " + action);
        };
    }

    // ===== Helpers =====

    @FunctionalInterface
    private interface Route {
        ServerResponse handle() throws Exception;
    }

    private static ServerResponse get(ServerRequest req, Route route) throws Exception {
        if (req.method() != HttpMethod.GET && req.method() != HttpMethod.HEAD) {
            return methodNotAllowed("GET");
        }
        return route.handle();
    }

    private static ServerResponse post(ServerRequest req, Route route) throws Exception {
        if (req.method() != HttpMethod.POST) {
            return methodNotAllowed("POST");
        }
        return route.handle();
    }

    private static ServerResponse methodNotAllowed(String allowed) {
        return new ServerResponse(405, new ResponseBody.Empty())
                .header("Allow", allowed)
                .header(Protocol.H_CACHE_CONTROL, "no-store")
                .header(Protocol.H_ERROR, "method_not_allowed");
    }

    private ServerResponse ok() throws JsonException {
        return json(200, Map.of("success", true));
    }

    private ServerResponse json(int status, Object payload) throws JsonException {
        return new ServerResponse(status, new ResponseBody.Bytes(codec.writeBytes(payload)))
                .header(Protocol.H_CONTENT_TYPE, Protocol.CT_JSON)
                .header(Protocol.H_CACHE_CONTROL, "no-store");
    }

    private ServerResponse error(ChatException e) {
        int status = statusFor(e);
        if (status >= 500) {
            logger.warn("Request failed: {}", e.getMessage(), e);
        }
        ServerResponse resp = new ServerResponse(status, errorBody(e.code(), e.getMessage()))
                .header(Protocol.H_CONTENT_TYPE, Protocol.CT_JSON)
                .header(Protocol.H_CACHE_CONTROL, "no-store")
                .header(Protocol.H_ERROR, e.code());
        if (e instanceof ChatException.RateLimited rl) {
            rl.retryAfter().ifPresent(d -> resp.header(Protocol.H_RETRY_AFTER,
                    Long.toString(Math.max(1, d.toSeconds()))));
        }
        return resp;
    }

    static int statusFor(ChatException e) {
        if (e instanceof ChatException.Validation) return 400;
        if (e instanceof ChatException.Auth) return 401;
        if (e instanceof ChatException.Forbidden) return 403;
        if (e instanceof ChatException.NotFound) return 404;
        if (e instanceof ChatException.Conflict) return 409;
        if (e instanceof ChatException.RateLimited) return 429;
        if (e instanceof ChatException.TransientStore) return 503;
        return 500;
    }

    private ResponseBody errorBody(String code, String message) {
        Map<String, String> body = new LinkedHashMap<>();
        body.put("error", code);
        body.put("message", message == null ? code : message);
        try {
            return new ResponseBody.Bytes(codec.writeBytes(body));
        } catch (JsonException e) {
            logger.warn("Could not encode error body for {}", code, e);
            return new ResponseBody.Empty();
        }
    }

    private JsonBody readBody(ServerRequest req) throws IOException {
        byte[] bytes = readBytes(req.body());
        if (bytes.length == 0) {
            return new JsonBody(Map.of());
        }
        try {
            return new JsonBody(codec.readObject(bytes));
        } catch (JsonException e) {
            throw new ChatException.Validation("request body must be a JSON object");
        }
    }

    private byte[] readBytes(InputStream in) throws IOException {
        if (in == null) {
            return new byte[0];
        }
        try (in) {
            byte[] bytes = in.readNBytes((int) Math.min(Integer.MAX_VALUE - 8L, maxBodySize + 1));
            if (bytes.length > maxBodySize) {
                throw new ChatException.Validation("request body exceeds " + maxBodySize + " bytes");
            }
            return bytes;
        }
    }

    private String originAddress(ServerRequest req, String remoteAddress) {
        if (engine.config().trustForwardedFor()) {
            String forwarded = req.header(Protocol.H_FORWARDED_FOR).orElse(null);
            if (forwarded != null) {
                String first = forwarded.split(",")[0].trim();
                if (!first.isEmpty()) return first;
            }
        }
        return remoteAddress;
    }

    private static Map<String, Object> sessionPayload(SessionRecord session) {
        Map<String, Object> out = new LinkedHashMap<>();
        out.put("success", true);
        out.put("username", session.username());
        out.put("sessionId", session.sessionId());
        out.put("role", session.role().wireName());
        return out;
    }

    private static String blankToNull(String s) {
        return s == null || s.isBlank() ? null : s.trim();
    }

    /** Loosely typed view over a parsed JSON object body. */
    private record JsonBody(Map<String, Object> values) {

        String string(String key) {
            Object v = values.get(key);
            return v == null ? null : v.toString();
        }

        String firstString(String... keys) {
            for (String key : keys) {
                String v = string(key);
                if (v != null) return v;
            }
            return null;
        }

        Integer integer(String key) {
            Long v = longValue(key);
            return v == null ? null : Math.toIntExact(v);
        }

        Long longValue(String key) {
            Object v = values.get(key);
            if (v == null || (v instanceof String s && s.isBlank())) return null;
            if (v instanceof Number n) return n.longValue();
            try {
                return Long.parseLong(v.toString().trim());
            } catch (NumberFormatException e) {
                throw new ChatException.Validation(key + " must be a number");
            }
        }

        long requiredLong(String key) {
            Long v = longValue(key);
            if (v == null) throw new ChatException.Validation(key + " is required");
            return v;
        }

        boolean bool(String key, boolean defaultValue) {
            Object v = values.get(key);
            if (v == null) return defaultValue;
            if (v instanceof Boolean b) return b;
            return v.toString().equalsIgnoreCase("true") || v.toString().equals("1");
        }

        Map<String, String> asStrings() {
            Object nested = values.get("settings");
            Map<?, ?> source = nested instanceof Map<?, ?> m ? m : values;
            Map<String, String> out = new LinkedHashMap<>();
            source.forEach((k, v) -> out.put(String.valueOf(k), v == null ? null : v.toString()));
            return out;
        }
    }
}

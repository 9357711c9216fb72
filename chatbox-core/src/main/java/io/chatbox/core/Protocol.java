package io.chatbox.core;

/**
 * Chat wire constants: routes, SSE event names, query keys and headers.
 *
 * <p>Shared by the server handler and the client so both sides agree on names. No HTTP bindings live here.
 */
public final class Protocol {
    private Protocol() {}

    // Routes
    public static final String API_PREFIX = "/api";
    public static final String PATH_STREAM = "/api/stream";
    public static final String PATH_REGISTER = "/api/register";
    public static final String PATH_LOGIN = "/api/login";
    public static final String PATH_LOGOUT = "/api/logout";
    public static final String PATH_HEARTBEAT = "/api/heartbeat";
    public static final String PATH_SEND = "/api/send";
    public static final String PATH_HISTORY = "/api/history";
    public static final String PATH_MESSAGES = "/api/messages";
    public static final String PATH_ACTIVE_USERS = "/api/active-users";
    public static final String PATH_SETTINGS = "/api/settings";
    public static final String PATH_PRIVATE_MESSAGE = "/api/private-message";
    public static final String PATH_PRIVATE_MESSAGE_READ = "/api/private-message/read";
    public static final String PATH_ATTACHMENTS = "/api/attachments";
    public static final String PATH_HEALTH = "/api/health";
    public static final String ADMIN_PREFIX = "/api/admin/";

    // SSE event names
    public static final String EV_HISTORY = "history";
    public static final String EV_MESSAGE = "message";
    public static final String EV_USERS = "users";
    public static final String EV_PRIVATE = "private";
    public static final String EV_CONFIG = "config";
    public static final String EV_CLEAR = "clear";
    public static final String EV_MESSAGE_DELETED = "message_deleted";
    public static final String EV_RECONNECT = "reconnect";

    // reconnect reasons
    public static final String REASON_MAX_RUNTIME = "max_runtime";
    public static final String REASON_KICKED = "kicked";

    /** Marker carried by a {@code users} event when an identity was kicked. */
    public static final String TYPE_USER_KICKED = "user_kicked";

    // Query parameter keys
    public static final String Q_USERNAME = "username";
    public static final String Q_SESSION_ID = "sessionId";
    public static final String Q_AFTER = "after";
    public static final String Q_LIMIT = "limit";
    public static final String Q_OFFSET = "offset";
    public static final String Q_WITH = "with";

    // Headers
    public static final String H_CONTENT_TYPE = "Content-Type";
    public static final String H_ACCEPT = "Accept";
    public static final String H_CACHE_CONTROL = "Cache-Control";
    public static final String H_RETRY_AFTER = "Retry-After";
    public static final String H_ERROR = "X-Error";
    public static final String H_CHAT_SESSION = "X-Chat-Session";
    public static final String H_FORWARDED_FOR = "X-Forwarded-For";

    // Content types
    public static final String CT_JSON = "application/json";
    public static final String CT_EVENT_STREAM = "text/event-stream";
}

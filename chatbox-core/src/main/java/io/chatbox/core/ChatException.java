package io.chatbox.core;

import java.time.Duration;
import java.util.Objects;
import java.util.Optional;

/**
 * Base class for chat engine errors surfaced to callers.
 *
 * <p>Every subclass carries a stable {@link #code()} that HTTP adapters expose to clients. Validation,
 * conflict and rate-limit failures are final answers and are never retried by the server.
 */
public abstract class ChatException extends RuntimeException {

    private final String code;

    protected ChatException(String code, String message) {
        super(message);
        this.code = Objects.requireNonNull(code, "code");
    }

    protected ChatException(String code, String message, Throwable cause) {
        super(message, cause);
        this.code = Objects.requireNonNull(code, "code");
    }

    /** Stable machine-readable error code. */
    public String code() {
        return code;
    }

    /**
     * Raised when input fails validation (empty text, oversize payload, malformed nickname).
     */
    public static class Validation extends ChatException {
        public Validation(String message) {
            super("validation_failed", message);
        }
    }

    /**
     * Raised when a nickname is already held by another live session.
     */
    public static class Conflict extends ChatException {
        public Conflict(String message) {
            super("conflict", message);
        }
    }

    /**
     * Raised when an origin exceeded its write budget.
     */
    public static class RateLimited extends ChatException {
        private final Duration retryAfter;

        public RateLimited(String message, Duration retryAfter) {
            super("rate_limited", message);
            this.retryAfter = retryAfter;
        }

        public Optional<Duration> retryAfter() {
            return Optional.ofNullable(retryAfter);
        }
    }

    /**
     * Raised when credentials are wrong or the caller has no usable session.
     */
    public static class Auth extends ChatException {
        public Auth(String message) {
            super("unauthorized", message);
        }
    }

    /**
     * Raised when the caller is known but not allowed: bans, kicked sessions, insufficient role.
     */
    public static class Forbidden extends ChatException {
        public Forbidden(String message) {
            super("forbidden", message);
        }
    }

    /**
     * Raised when a referenced message, recipient or attachment does not exist.
     */
    public static class NotFound extends ChatException {
        public NotFound(String message) {
            super("not_found", message);
        }
    }

    /**
     * Raised when the durable store or the shared cache cannot be reached.
     */
    public static class TransientStore extends ChatException {
        public TransientStore(String message, Throwable cause) {
            super("store_unavailable", message, cause);
        }

        public TransientStore(String message) {
            super("store_unavailable", message);
        }
    }
}

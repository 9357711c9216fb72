package io.chatbox.server.spi;

import java.time.Duration;
import java.util.Optional;

/**
 * Write-rate limiting SPI keyed by origin address.
 *
 * <p>A rejected write is dropped before persistence and never retried by the server.
 */
public interface RateLimiter {

    /**
     * @param origin network origin of the writer; {@code null} is treated as a single anonymous origin
     */
    Result tryAcquire(String origin);

    sealed interface Result permits Result.Allowed, Result.Rejected {

        record Allowed() implements Result {}

        /**
         * @param retryAfter optional duration after which the origin may write again
         */
        record Rejected(Optional<Duration> retryAfter) implements Result {
            public Rejected() {
                this(Optional.empty());
            }

            public Rejected(Duration retryAfter) {
                this(Optional.ofNullable(retryAfter));
            }
        }
    }

    /**
     * No-op rate limiter that allows all writes.
     */
    static RateLimiter permitAll() {
        return origin -> new Result.Allowed();
    }
}

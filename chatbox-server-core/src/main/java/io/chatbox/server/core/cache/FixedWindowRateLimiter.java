package io.chatbox.server.core.cache;

import io.chatbox.server.spi.CacheKeys;
import io.chatbox.server.spi.ChatCache;
import io.chatbox.server.spi.Counter;
import io.chatbox.server.spi.RateLimiter;

import java.time.Clock;
import java.time.Duration;
import java.util.Objects;
import java.util.function.Supplier;

/**
 * Fixed-window write limiter built on {@link ChatCache#increment}.
 *
 * <p>The counter lives in the shared cache, so every node sharing the cache enforces one budget per origin. The
 * limit is read on every call, which lets runtime settings change it without a restart.
 */
public final class FixedWindowRateLimiter implements RateLimiter {

    /**
     * @param maxWrites writes allowed per window
     */
    public record Limit(int maxWrites, Duration window) {
        public Limit {
            if (maxWrites <= 0) throw new IllegalArgumentException("maxWrites must be positive");
            Objects.requireNonNull(window, "window");
            if (window.isZero() || window.isNegative()) throw new IllegalArgumentException("window must be positive");
        }
    }

    private final ChatCache cache;
    private final CacheKeys keys;
    private final Supplier<Limit> limit;
    private final Clock clock;

    public FixedWindowRateLimiter(ChatCache cache, CacheKeys keys, Limit limit, Clock clock) {
        this(cache, keys, () -> limit, clock);
    }

    public FixedWindowRateLimiter(ChatCache cache, CacheKeys keys, Supplier<Limit> limit, Clock clock) {
        this.cache = Objects.requireNonNull(cache, "cache");
        this.keys = Objects.requireNonNull(keys, "keys");
        this.limit = Objects.requireNonNull(limit, "limit");
        this.clock = Objects.requireNonNull(clock, "clock");
    }

    @Override
    public Result tryAcquire(String origin) {
        Limit current = limit.get();
        String key = keys.rateLimit(origin != null ? origin : "anonymous");
        Counter counter = cache.increment(key, current.window());
        if (counter.count() <= current.maxWrites()) {
            return new Result.Allowed();
        }
        Duration retryAfter = Duration.between(clock.instant(), counter.resetAt());
        if (retryAfter.isNegative()) {
            retryAfter = Duration.ZERO;
        }
        return new Result.Rejected(retryAfter);
    }
}

package io.chatbox.client;

import java.time.Duration;

/**
 * Exponential reconnect delay: {@code base * factor^(attempt-1)}, capped at {@code max}. Reset after a successful
 * connect.
 */
public final class ReconnectBackoff {

    public static final Duration DEFAULT_BASE = Duration.ofSeconds(2);
    public static final double DEFAULT_FACTOR = 1.5;
    public static final Duration DEFAULT_MAX = Duration.ofSeconds(30);

    private final long baseMillis;
    private final double factor;
    private final long maxMillis;
    private int attempts;

    public ReconnectBackoff() {
        this(DEFAULT_BASE, DEFAULT_FACTOR, DEFAULT_MAX);
    }

    public ReconnectBackoff(Duration base, double factor, Duration max) {
        if (base.isNegative() || max.compareTo(base) < 0 || factor < 1.0) {
            throw new IllegalArgumentException("invalid backoff: base=" + base + " factor=" + factor + " max=" + max);
        }
        this.baseMillis = base.toMillis();
        this.factor = factor;
        this.maxMillis = max.toMillis();
    }

    /** Counts one attempt and returns how long to wait before it. */
    public synchronized Duration nextDelay() {
        attempts++;
        double delay = baseMillis * Math.pow(factor, attempts - 1);
        return Duration.ofMillis((long) Math.min(delay, maxMillis));
    }

    public synchronized void reset() {
        attempts = 0;
    }

    public synchronized int attempts() {
        return attempts;
    }
}

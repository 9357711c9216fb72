package io.chatbox.server.spi;

import java.time.Duration;
import java.util.List;
import java.util.Optional;

/**
 * Fast shared cache SPI, modelled on a networked key/value server.
 *
 * <p>Every method is atomic for its key. Values are strings; callers serialize. Failures surface as
 * {@link io.chatbox.core.ChatException.TransientStore} so read paths can degrade to the durable store.
 */
public interface ChatCache {

    void ping();

    Optional<String> get(String key);

    void put(String key, String value, Duration ttl);

    /** Sets the key only when absent; returns true when this call set it. */
    boolean putIfAbsent(String key, String value, Duration ttl);

    boolean delete(String key);

    boolean exists(String key);

    /**
     * Increments a counter. The first increment in a window sets the expiry to {@code window}; later increments
     * leave it unchanged.
     */
    Counter increment(String key, Duration window);

    /**
     * Adds one member to an existing window, then trims to {@code capacity} newest entries and refreshes the TTL,
     * as one operation. A member whose score is already present is not added twice.
     *
     * @return false when the window does not exist (nothing is created)
     */
    boolean windowAdd(String key, WindowEntry entry, int capacity, Duration ttl);

    /** Replaces the whole window atomically. */
    void windowInstall(String key, List<WindowEntry> entries, int capacity, Duration ttl);

    /**
     * Newest {@code limit} entries, oldest first.
     *
     * @return empty when the window does not exist (a present but empty window yields an empty list)
     */
    Optional<List<WindowEntry>> windowRange(String key, int limit);
}

package io.chatbox.server.core.service;

import io.chatbox.core.ChatException;
import io.chatbox.json.spi.JsonCodec;
import io.chatbox.json.spi.JsonException;
import io.chatbox.server.spi.ChatCache;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.List;
import java.util.Objects;
import java.util.Optional;

/**
 * Read-through helpers over {@link ChatCache} for derived data whose source of truth is the durable store.
 *
 * <p>Cache failures and unreadable entries are logged and reported as a miss; the caller then reads the store.
 */
final class DegradingCache {
    private static final Logger logger = LoggerFactory.getLogger(DegradingCache.class);

    private final ChatCache cache;
    private final JsonCodec codec;

    DegradingCache(ChatCache cache, JsonCodec codec) {
        this.cache = Objects.requireNonNull(cache, "cache");
        this.codec = Objects.requireNonNull(codec, "codec");
    }

    ChatCache raw() {
        return cache;
    }

    JsonCodec codec() {
        return codec;
    }

    Optional<String> get(String key) {
        try {
            return cache.get(key);
        } catch (ChatException.TransientStore e) {
            logger.warn("Cache read failed for {}, falling back to durable store", key, e);
            return Optional.empty();
        }
    }

    <T> Optional<List<T>> getList(String key, Class<T> elementType) {
        Optional<String> json = get(key);
        if (json.isEmpty()) return Optional.empty();
        try {
            return Optional.of(codec.readList(json.get(), elementType));
        } catch (JsonException e) {
            logger.warn("Discarding unreadable cache entry {}", key, e);
            invalidate(key);
            return Optional.empty();
        }
    }

    void putJson(String key, Object value, Duration ttl) {
        String json;
        try {
            json = codec.writeString(value);
        } catch (JsonException e) {
            throw new IllegalStateException("Failed to encode cache entry " + key, e);
        }
        try {
            cache.put(key, json, ttl);
        } catch (ChatException.TransientStore e) {
            logger.warn("Cache write failed for {}", key, e);
        }
    }

    void invalidate(String key) {
        try {
            cache.delete(key);
        } catch (ChatException.TransientStore e) {
            logger.warn("Cache invalidation failed for {}", key, e);
        }
    }
}

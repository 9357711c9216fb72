package io.chatbox.server.core.store;

import java.util.List;
import java.util.Optional;
import java.util.function.Predicate;

/**
 * Ordered key/row storage underneath {@link RowChatStore}.
 *
 * <p>Keys are compared as UTF-8 byte strings; numeric key segments are zero-padded so lexical order matches
 * numeric order. Single-key operations are atomic; compound atomicity is provided by the caller.
 */
public interface RowStore extends AutoCloseable {

    <T> Optional<T> get(String key, Class<T> type);

    void put(String key, Object row);

    boolean delete(String key);

    /** All rows under {@code prefix} in ascending key order. */
    <T> List<T> scan(String prefix, Class<T> type);

    /** Up to {@code limit} matching rows under {@code prefix}, in descending key order. */
    <T> List<T> scanDescending(String prefix, Class<T> type, int limit, Predicate<? super T> filter);

    /** Up to {@code limit} matching rows under {@code prefix} whose key is greater than {@code afterKey}. */
    <T> List<T> scanAfter(String prefix, String afterKey, Class<T> type, int limit, Predicate<? super T> filter);

    void ping();

    @Override
    default void close() {
    }
}

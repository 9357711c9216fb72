package io.chatbox.server.core.store;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.NavigableMap;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.ConcurrentSkipListMap;
import java.util.function.Predicate;

/**
 * Reference in-memory {@link RowStore}.
 *
 * <p>Good for unit tests and single-node demos. Rows are kept as the immutable records handed in.
 */
public final class InMemoryRowStore implements RowStore {

    private final ConcurrentSkipListMap<String, Object> rows = new ConcurrentSkipListMap<>();

    @Override
    public <T> Optional<T> get(String key, Class<T> type) {
        Objects.requireNonNull(key, "key");
        Object row = rows.get(key);
        return row == null ? Optional.empty() : Optional.of(type.cast(row));
    }

    @Override
    public void put(String key, Object row) {
        Objects.requireNonNull(key, "key");
        Objects.requireNonNull(row, "row");
        rows.put(key, row);
    }

    @Override
    public boolean delete(String key) {
        return rows.remove(key) != null;
    }

    @Override
    public <T> List<T> scan(String prefix, Class<T> type) {
        List<T> out = new ArrayList<>();
        for (Object row : range(prefix).values()) {
            out.add(type.cast(row));
        }
        return out;
    }

    @Override
    public <T> List<T> scanDescending(String prefix, Class<T> type, int limit, Predicate<? super T> filter) {
        List<T> out = new ArrayList<>();
        for (Object row : range(prefix).descendingMap().values()) {
            if (out.size() >= limit) break;
            T typed = type.cast(row);
            if (filter.test(typed)) out.add(typed);
        }
        return out;
    }

    @Override
    public <T> List<T> scanAfter(String prefix, String afterKey, Class<T> type, int limit, Predicate<? super T> filter) {
        List<T> out = new ArrayList<>();
        for (Map.Entry<String, Object> e : range(prefix).tailMap(afterKey, false).entrySet()) {
            if (out.size() >= limit) break;
            T typed = type.cast(e.getValue());
            if (filter.test(typed)) out.add(typed);
        }
        return out;
    }

    @Override
    public void ping() {
        // always reachable
    }

    private NavigableMap<String, Object> range(String prefix) {
        return rows.subMap(prefix, true, prefix + Character.MAX_VALUE, false);
    }
}

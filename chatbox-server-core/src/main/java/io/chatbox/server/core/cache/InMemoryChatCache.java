package io.chatbox.server.core.cache;

import io.chatbox.server.spi.ChatCache;
import io.chatbox.server.spi.Counter;
import io.chatbox.server.spi.WindowEntry;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.TreeMap;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Reference in-memory {@link ChatCache} for single-node deployments and tests.
 *
 * <p>Each key holds one entry with an optional expiry; expired entries are dropped lazily on access. Per-key
 * atomicity comes from {@link ConcurrentHashMap#compute}.
 */
public final class InMemoryChatCache implements ChatCache {

    private final Map<String, Entry> entries = new ConcurrentHashMap<>();
    private final Clock clock;

    public InMemoryChatCache() {
        this(Clock.systemUTC());
    }

    public InMemoryChatCache(Clock clock) {
        this.clock = Objects.requireNonNull(clock, "clock");
    }

    @Override
    public void ping() {
        // always reachable
    }

    @Override
    public Optional<String> get(String key) {
        Entry e = live(key);
        return e instanceof Value v ? Optional.of(v.value) : Optional.empty();
    }

    @Override
    public void put(String key, String value, Duration ttl) {
        entries.put(key, new Value(value, expiry(ttl)));
    }

    @Override
    public boolean putIfAbsent(String key, String value, Duration ttl) {
        boolean[] set = {false};
        entries.compute(key, (k, existing) -> {
            if (existing != null && !existing.isExpired(clock.instant())) return existing;
            set[0] = true;
            return new Value(value, expiry(ttl));
        });
        return set[0];
    }

    @Override
    public boolean delete(String key) {
        Entry removed = entries.remove(key);
        return removed != null && !removed.isExpired(clock.instant());
    }

    @Override
    public boolean exists(String key) {
        return live(key) != null;
    }

    @Override
    public Counter increment(String key, Duration window) {
        Instant now = clock.instant();
        Entry updated = entries.compute(key, (k, existing) -> {
            if (existing instanceof Count c && !c.isExpired(now)) {
                return new Count(c.count + 1, c.expiresAt);
            }
            return new Count(1, now.plus(window));
        });
        Count c = (Count) updated;
        return new Counter(c.count, c.expiresAt);
    }

    @Override
    public boolean windowAdd(String key, WindowEntry entry, int capacity, Duration ttl) {
        boolean[] applied = {false};
        entries.computeIfPresent(key, (k, existing) -> {
            if (!(existing instanceof Window w) || w.isExpired(clock.instant())) {
                return existing.isExpired(clock.instant()) ? null : existing;
            }
            TreeMap<Long, String> members = new TreeMap<>(w.members);
            members.putIfAbsent(entry.score(), entry.member());
            trim(members, capacity);
            applied[0] = true;
            return new Window(members, expiry(ttl));
        });
        return applied[0];
    }

    @Override
    public void windowInstall(String key, List<WindowEntry> windowEntries, int capacity, Duration ttl) {
        TreeMap<Long, String> members = new TreeMap<>();
        for (WindowEntry e : windowEntries) {
            members.putIfAbsent(e.score(), e.member());
        }
        trim(members, capacity);
        entries.put(key, new Window(members, expiry(ttl)));
    }

    @Override
    public Optional<List<WindowEntry>> windowRange(String key, int limit) {
        Entry e = live(key);
        if (!(e instanceof Window w)) {
            return Optional.empty();
        }
        List<WindowEntry> all = new ArrayList<>(w.members.size());
        w.members.forEach((score, member) -> all.add(new WindowEntry(score, member)));
        int from = Math.max(0, all.size() - limit);
        return Optional.of(List.copyOf(all.subList(from, all.size())));
    }

    /** Drops every key. */
    public void flush() {
        entries.clear();
    }

    private Entry live(String key) {
        Entry e = entries.get(key);
        if (e == null) return null;
        if (e.isExpired(clock.instant())) {
            entries.remove(key, e);
            return null;
        }
        return e;
    }

    private Instant expiry(Duration ttl) {
        return ttl == null ? null : clock.instant().plus(ttl);
    }

    private static void trim(TreeMap<Long, String> members, int capacity) {
        while (members.size() > capacity) {
            members.pollFirstEntry();
        }
    }

    private abstract static class Entry {
        final Instant expiresAt;

        Entry(Instant expiresAt) {
            this.expiresAt = expiresAt;
        }

        boolean isExpired(Instant now) {
            return expiresAt != null && !now.isBefore(expiresAt);
        }
    }

    private static final class Value extends Entry {
        final String value;

        Value(String value, Instant expiresAt) {
            super(expiresAt);
            this.value = value;
        }
    }

    private static final class Count extends Entry {
        final long count;

        Count(long count, Instant expiresAt) {
            super(expiresAt);
            this.count = count;
        }
    }

    private static final class Window extends Entry {
        final TreeMap<Long, String> members;

        Window(TreeMap<Long, String> members, Instant expiresAt) {
            super(expiresAt);
            this.members = members;
        }
    }
}

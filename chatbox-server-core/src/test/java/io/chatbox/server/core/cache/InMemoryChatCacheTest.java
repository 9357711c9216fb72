package io.chatbox.server.core.cache;

import io.chatbox.server.core.MutableClock;
import io.chatbox.server.spi.Counter;
import io.chatbox.server.spi.WindowEntry;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;

class InMemoryChatCacheTest {

    private final MutableClock clock = MutableClock.startingAt("2026-03-01T12:00:00Z");
    private final InMemoryChatCache cache = new InMemoryChatCache(clock);

    @Test
    void valuesExpireAfterTheirTtl() {
        cache.put("k", "v", Duration.ofSeconds(10));
        assertThat(cache.get("k")).contains("v");

        clock.advance(Duration.ofSeconds(10));

        assertThat(cache.get("k")).isEmpty();
        assertThat(cache.exists("k")).isFalse();
    }

    @Test
    void putIfAbsentOnlySetsOnce() {
        assertThat(cache.putIfAbsent("k", "a", Duration.ofSeconds(5))).isTrue();
        assertThat(cache.putIfAbsent("k", "b", Duration.ofSeconds(5))).isFalse();
        assertThat(cache.get("k")).contains("a");

        clock.advance(Duration.ofSeconds(6));
        assertThat(cache.putIfAbsent("k", "c", Duration.ofSeconds(5))).isTrue();
    }

    @Test
    void counterWindowStartsOnFirstIncrement() {
        Counter first = cache.increment("c", Duration.ofSeconds(60));
        clock.advance(Duration.ofSeconds(30));
        Counter second = cache.increment("c", Duration.ofSeconds(60));

        assertThat(first.count()).isEqualTo(1);
        assertThat(second.count()).isEqualTo(2);
        assertThat(second.resetAt()).isEqualTo(first.resetAt());

        clock.advance(Duration.ofSeconds(31));
        assertThat(cache.increment("c", Duration.ofSeconds(60)).count()).isEqualTo(1);
    }

    @Test
    void windowAddNeverCreatesAWindow() {
        assertThat(cache.windowAdd("w", new WindowEntry(1, "a"), 3, Duration.ofMinutes(1))).isFalse();
        assertThat(cache.windowRange("w", 10)).isEmpty();
    }

    @Test
    void windowKeepsTheNewestEntriesInOrder() {
        cache.windowInstall("w", List.of(new WindowEntry(2, "b"), new WindowEntry(1, "a")), 3, Duration.ofMinutes(1));

        assertThat(cache.windowAdd("w", new WindowEntry(3, "c"), 3, Duration.ofMinutes(1))).isTrue();
        assertThat(cache.windowAdd("w", new WindowEntry(4, "d"), 3, Duration.ofMinutes(1))).isTrue();
        assertThat(cache.windowAdd("w", new WindowEntry(4, "dup"), 3, Duration.ofMinutes(1))).isTrue();

        assertThat(cache.windowRange("w", 10).orElseThrow())
                .containsExactly(new WindowEntry(2, "b"), new WindowEntry(3, "c"), new WindowEntry(4, "d"));
        assertThat(cache.windowRange("w", 2).orElseThrow())
                .containsExactly(new WindowEntry(3, "c"), new WindowEntry(4, "d"));
    }

    @Test
    void emptyInstalledWindowIsPresent() {
        cache.windowInstall("w", List.of(), 3, Duration.ofMinutes(1));

        assertThat(cache.windowRange("w", 10)).contains(List.of());
    }
}

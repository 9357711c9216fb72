package io.chatbox.server.core.service;

import io.chatbox.core.MessageView;
import io.chatbox.core.Role;
import io.chatbox.json.jackson.JacksonJsonCodec;
import io.chatbox.server.core.ChatEngine;
import io.chatbox.server.core.FlakyChatCache;
import io.chatbox.server.core.MutableClock;
import io.chatbox.server.core.cache.InMemoryChatCache;
import io.chatbox.server.core.store.RowChatStore;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;

class HistoryCacheFailureTest {

    private FlakyChatCache cache;
    private ChatEngine engine;

    @BeforeEach
    void setUp() {
        MutableClock clock = MutableClock.startingAt("2026-03-01T12:00:00Z");
        cache = new FlakyChatCache(new InMemoryChatCache(clock));
        engine = ChatEngine.builder()
                .clock(clock)
                .codec(new JacksonJsonCodec())
                .store(RowChatStore.inMemory())
                .cache(cache)
                .build();
        engine.presence().register("alice", "S1", "10.0.0.1", null);
    }

    @Test
    void historyFallsBackToTheStoreWhileTheWindowIsUnreachable() {
        engine.messages().post("alice", "S1", "10.0.0.1", "a", null);
        cache.failWindows(true);
        engine.messages().post("alice", "S1", "10.0.0.1", "b", null);

        assertThat(engine.messages().history(10)).extracting(MessageView::text).containsExactly("a", "b");
    }

    @Test
    void failedAppendDropsTheWindowSoTheNextReadIsComplete() {
        engine.messages().post("alice", "S1", "10.0.0.1", "a", null);
        assertThat(engine.messages().history(10)).hasSize(1);

        cache.failWindows(true);
        engine.messages().post("alice", "S1", "10.0.0.1", "b", null);
        cache.failWindows(false);

        assertThat(engine.messages().history(10)).extracting(MessageView::text).containsExactly("a", "b");
    }

    @Test
    void settingsAndBansAreReadFromTheStoreWhenCacheReadsFail() {
        engine.accounts().create("admin1", null, null, Role.ADMINISTRATOR, "password1");
        engine.bans().banNickname("troll", "spam", "admin1");
        engine.settings().update(Map.of(SettingsService.MINIMUM_USERS, "4"));
        cache.failReads(true);

        assertThat(engine.bans().isNicknameBanned("TROLL")).isTrue();
        assertThat(engine.settings().getInt(SettingsService.MINIMUM_USERS, 0)).isEqualTo(4);
        assertThat(engine.bans().isSessionBanned("S1")).isFalse();
    }
}

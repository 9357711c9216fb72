package io.chatbox.server.core;

import io.chatbox.json.jackson.JacksonJsonCodec;
import io.chatbox.server.core.cache.InMemoryChatCache;
import io.chatbox.server.core.store.RowChatStore;

/**
 * In-memory engines driven by a {@link MutableClock}.
 */
public final class TestEngines {
    private TestEngines() {}

    public static ChatEngine inMemory(MutableClock clock) {
        return inMemory(clock, ChatServerConfig.defaults());
    }

    public static ChatEngine inMemory(MutableClock clock, ChatServerConfig config) {
        return ChatEngine.builder()
                .config(config)
                .clock(clock)
                .codec(new JacksonJsonCodec())
                .store(RowChatStore.inMemory())
                .cache(new InMemoryChatCache(clock))
                .build();
    }
}

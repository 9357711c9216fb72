package io.chatbox.server.spi;

/**
 * Member of a bounded recent-history window, ordered by {@code score}.
 */
public record WindowEntry(long score, String member) {
}

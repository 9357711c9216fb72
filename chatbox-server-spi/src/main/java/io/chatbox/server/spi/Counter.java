package io.chatbox.server.spi;

import java.time.Instant;

/**
 * Value of a fixed-window counter after an increment.
 *
 * @param resetAt when the window (and the counter) expires
 */
public record Counter(long count, Instant resetAt) {
}

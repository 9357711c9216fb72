package io.chatbox.server.spi;

import java.time.Instant;

/**
 * Ban on a network origin. {@code bannedUntil == null} means permanent.
 */
public record AddressBan(String originAddress, String reason, String bannedBy, Instant bannedAt, Instant bannedUntil) {

    public boolean isActive(Instant now) {
        return bannedUntil == null || now.isBefore(bannedUntil);
    }
}

package io.chatbox.server.spi;

import java.time.Instant;

/**
 * Permanent ban on a nickname, matched case-insensitively.
 */
public record NicknameBan(String nickname, String reason, String bannedBy, Instant bannedAt) {
}

package io.chatbox.client;

/**
 * Identity granted by a successful register or login.
 */
public record SessionInfo(String username, String sessionId, String role) {
}

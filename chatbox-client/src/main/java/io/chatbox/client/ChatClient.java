package io.chatbox.client;

import io.chatbox.core.MessageView;
import io.chatbox.core.PrivateMessageView;
import io.chatbox.core.Profile;

import java.util.List;

/**
 * Client for a chat server's public routes.
 *
 * <p>Non-success responses surface as {@link ChatClientException}.
 */
public interface ChatClient {
    SessionInfo register(String username, String sessionId, Profile profile) throws Exception;

    void heartbeat(String username, String sessionId) throws Exception;

    void logout(String sessionId) throws Exception;

    MessageView send(String username, String sessionId, String text, String replyTo) throws Exception;

    List<MessageView> history(int limit) throws Exception;

    /** Public messages with a sequence id strictly greater than {@code afterSequenceId}, ascending. */
    List<MessageView> messagesAfter(long afterSequenceId, int limit) throws Exception;

    PrivateMessageView sendPrivate(String username, String sessionId, String to, String text) throws Exception;

    List<PrivateMessageView> privateConversation(String username, String sessionId, String with) throws Exception;

    /**
     * Opens a live stream for the session and starts delivering to {@code listener} on a background thread.
     * The stream reconnects with backoff until closed or kicked.
     */
    ChatStream stream(String username, String sessionId, ChatStreamListener listener);

    static ChatClient create(java.net.URI baseUri) {
        return builder(baseUri).build();
    }

    static ChatClientBuilder builder(java.net.URI baseUri) {
        return new ChatClientBuilder(baseUri);
    }
}

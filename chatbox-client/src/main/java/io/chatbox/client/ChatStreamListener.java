package io.chatbox.client;

import io.chatbox.core.ChatMode;
import io.chatbox.core.MessageView;
import io.chatbox.core.PrivateMessageView;
import io.chatbox.core.RosterSnapshot;

import java.util.List;

/**
 * Callbacks from a {@link ChatStream}, invoked on the stream's thread.
 */
public interface ChatStreamListener {

    /** Stream opened; on a reconnect, missed messages have already been delivered through {@link #onMessage}. */
    default void onConnected(boolean reconnect) {}

    /** Full recent history sent at the start of every connection. */
    default void onHistory(List<MessageView> messages) {}

    default void onMessage(MessageView message) {}

    default void onMessageDeleted(String messageId) {}

    default void onClear() {}

    default void onRoster(RosterSnapshot roster) {}

    default void onUserKicked(String username) {}

    default void onPrivateMessage(PrivateMessageView message) {}

    default void onConfig(ChatMode chatMode) {}

    /**
     * Connection lost or ended by the server; the stream will reconnect.
     *
     * @param cause {@code null} when the server asked the client to reconnect
     */
    default void onDisconnected(Throwable cause) {}

    /** This session was kicked. The stream has stopped; register again to continue. */
    default void onKicked() {}
}

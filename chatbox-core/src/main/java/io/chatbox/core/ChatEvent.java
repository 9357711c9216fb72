package io.chatbox.core;

import java.util.List;
import java.util.Objects;

/**
 * Events carried by the distribution bus to every connected stream.
 */
public sealed interface ChatEvent permits ChatEvent.Message, ChatEvent.MessageDeleted, ChatEvent.Clear,
        ChatEvent.Roster, ChatEvent.PrivateMessage, ChatEvent.ConfigChanged, ChatEvent.ForceDisconnect {

    record Message(ChatMessage message) implements ChatEvent {
        public Message {
            Objects.requireNonNull(message, "message");
        }
    }

    record MessageDeleted(String messageId) implements ChatEvent {
        public MessageDeleted {
            Objects.requireNonNull(messageId, "messageId");
        }
    }

    record Clear() implements ChatEvent {}

    /** Always the full roster, synthetic identities included. */
    record Roster(RosterSnapshot snapshot) implements ChatEvent {
        public Roster {
            Objects.requireNonNull(snapshot, "snapshot");
        }
    }

    record PrivateMessage(PrivateChatMessage message) implements ChatEvent {
        public PrivateMessage {
            Objects.requireNonNull(message, "message");
        }
    }

    record ConfigChanged(ChatMode chatMode) implements ChatEvent {
        public ConfigChanged {
            Objects.requireNonNull(chatMode, "chatMode");
        }
    }

    /**
     * Ends the streams of the listed sessions.
     */
    record ForceDisconnect(String username, List<String> sessionIds) implements ChatEvent {
        public ForceDisconnect {
            Objects.requireNonNull(username, "username");
            sessionIds = List.copyOf(sessionIds);
        }

        public boolean targets(String sessionId) {
            return sessionId != null && sessionIds.contains(sessionId);
        }
    }
}

package io.chatbox.server.spi;

/**
 * Administrator-defined roster padding. Never backed by a session.
 */
public record SyntheticIdentity(long id, String nickname, Integer age, String sex, String location, boolean active) {

    /** Pseudo session id used when a private message is addressed to this identity. */
    public String sessionId() {
        return "synthetic_" + id;
    }

    public SyntheticIdentity withActive(boolean value) {
        return new SyntheticIdentity(id, nickname, age, sex, location, value);
    }
}

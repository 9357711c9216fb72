package io.chatbox.core;

import java.util.Locale;

/**
 * Which conversation surfaces are enabled.
 */
public enum ChatMode {
    PUBLIC,
    PRIVATE,
    BOTH;

    public boolean allowsPublic() {
        return this != PRIVATE;
    }

    public boolean allowsPrivate() {
        return this != PUBLIC;
    }

    public String wireName() {
        return name().toLowerCase(Locale.ROOT);
    }

    /** Lenient parse used for stored settings: unknown values fall back to {@link #PUBLIC}. */
    public static ChatMode parseOrDefault(String value) {
        if (value == null) return PUBLIC;
        return switch (value.trim().toLowerCase(Locale.ROOT)) {
            case "private" -> PRIVATE;
            case "both" -> BOTH;
            default -> PUBLIC;
        };
    }

    /** Strict parse used for administrator input. */
    public static ChatMode fromWire(String value) {
        if (value == null) throw new ChatException.Validation("chat_mode must not be empty");
        return switch (value.trim().toLowerCase(Locale.ROOT)) {
            case "public" -> PUBLIC;
            case "private" -> PRIVATE;
            case "both" -> BOTH;
            default -> throw new ChatException.Validation("chat_mode must be public, private or both");
        };
    }
}

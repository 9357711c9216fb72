package io.chatbox.json.spi;

/**
 * Raised when a value cannot be serialized or parsed.
 */
public class JsonException extends Exception {
    public JsonException(String message) {
        super(message);
    }

    public JsonException(String message, Throwable cause) {
        super(message, cause);
    }
}

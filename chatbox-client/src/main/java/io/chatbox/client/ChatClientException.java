package io.chatbox.client;

/**
 * Non-success response from the chat server.
 */
public class ChatClientException extends RuntimeException {
    private final int status;
    private final String errorCode;

    public ChatClientException(int status, String errorCode, String message) {
        super(message == null ? "HTTP " + status : message);
        this.status = status;
        this.errorCode = errorCode;
    }

    public int status() {
        return status;
    }

    /** Value of the server's {@code error} field, {@code null} when absent. */
    public String errorCode() {
        return errorCode;
    }
}

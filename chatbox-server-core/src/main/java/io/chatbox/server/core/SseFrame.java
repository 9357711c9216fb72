package io.chatbox.server.core;

import java.util.Objects;

/**
 * One Server-Sent Events block: either a named event with a JSON payload or a keep-alive comment.
 */
public final class SseFrame {
    private final String event;
    private final String data;
    private final boolean comment;

    private SseFrame(String event, String data, boolean comment) {
        this.event = event;
        this.data = data == null ? "" : data;
        this.comment = comment;
    }

    public SseFrame(String event, String data) {
        this(Objects.requireNonNull(event, "event"), data, false);
    }

    public static SseFrame comment(String text) {
        return new SseFrame(null, text, true);
    }

    /** Event name, {@code null} for comments. */
    public String event() {
        return event;
    }

    public String data() {
        return data;
    }

    public boolean isComment() {
        return comment;
    }

    /**
     * Render as an SSE block (without HTTP headers).
     */
    public String render() {
        StringBuilder sb = new StringBuilder();
        String[] lines = data.split("\r?\n", -1);
        if (comment) {
            for (String line : lines) {
                sb.append(": ").append(line).append("\n");
            }
            sb.append("\n");
            return sb.toString();
        }
        sb.append("event: ").append(event).append("\n");
        // each payload line needs its own "data:" prefix
        for (String line : lines) {
            sb.append("data: ").append(line).append("\n");
        }
        sb.append("\n");
        return sb.toString();
    }
}

package io.chatbox.core;

import java.io.BufferedReader;
import java.io.IOException;
import java.io.InputStream;
import java.io.InputStreamReader;
import java.nio.charset.StandardCharsets;

/**
 * Minimal SSE parser for chat streams.
 *
 * <p>Comment lines (keep-alive pings) are skipped; a block made only of comments is not reported as an event.
 */
public final class SseParser implements AutoCloseable {

    public record Event(String eventType, String data) {}

    private final BufferedReader in;

    public SseParser(InputStream is) {
        this.in = new BufferedReader(new InputStreamReader(is, StandardCharsets.UTF_8));
    }

    /**
     * Reads the next event.
     *
     * @return the next event, or {@code null} at end of stream
     * @throws IOException if the underlying stream fails
     */
    public Event next() throws IOException {
        while (true) {
            String eventType = "message";
            StringBuilder data = new StringBuilder();
            boolean seenAny = false;
            boolean seenField = false;

            String line;
            while ((line = in.readLine()) != null) {
                seenAny = true;
                if (line.isEmpty()) break;
                if (line.startsWith(":")) continue;
                if (line.startsWith("event:")) {
                    eventType = line.substring("event:".length()).trim();
                    seenField = true;
                } else if (line.startsWith("data:")) {
                    data.append(stripLeadingSpace(line.substring("data:".length()))).append("\n");
                    seenField = true;
                }
            }

            if (!seenAny) return null;
            if (!seenField) continue;
            return new Event(eventType, stripTrailingNewline(data.toString()));
        }
    }

    private static String stripLeadingSpace(String s) {
        return s.startsWith(" ") ? s.substring(1) : s;
    }

    private static String stripTrailingNewline(String s) {
        int len = s.length();
        while (len > 0 && (s.charAt(len - 1) == '\n' || s.charAt(len - 1) == '\r')) len--;
        return s.substring(0, len);
    }

    @Override
    public void close() throws IOException {
        in.close();
    }
}

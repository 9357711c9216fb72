package io.chatbox.core;

import org.junit.jupiter.api.Test;

import java.io.ByteArrayInputStream;
import java.nio.charset.StandardCharsets;

import static org.assertj.core.api.Assertions.assertThat;

class SseParserTest {

    @Test
    void parsesNamedEventsAndSkipsPings() throws Exception {
        String raw = ": connected\n\n"
                + "event: users\n"
                + "data: {\"count\":1}\n\n"
                + ": ping 1700000000\n\n"
                + "event: message\n"
                + "data: line1\n"
                + "data: line2\n\n";

        try (SseParser parser = new SseParser(new ByteArrayInputStream(raw.getBytes(StandardCharsets.UTF_8)))) {
            SseParser.Event users = parser.next();
            assertThat(users.eventType()).isEqualTo("users");
            assertThat(users.data()).isEqualTo("{\"count\":1}");

            SseParser.Event message = parser.next();
            assertThat(message.eventType()).isEqualTo("message");
            assertThat(message.data()).isEqualTo("line1\nline2");

            assertThat(parser.next()).isNull();
        }
    }

    @Test
    void defaultsEventTypeToMessage() throws Exception {
        String raw = "data: hi\n\n";
        try (SseParser parser = new SseParser(new ByteArrayInputStream(raw.getBytes(StandardCharsets.UTF_8)))) {
            SseParser.Event ev = parser.next();
            assertThat(ev.eventType()).isEqualTo("message");
            assertThat(ev.data()).isEqualTo("hi");
        }
    }
}

package io.chatbox.client;

import io.chatbox.core.MessageView;
import io.chatbox.core.RosterSnapshot;
import io.chatbox.json.jackson.JacksonJsonCodec;
import okhttp3.mockwebserver.MockResponse;
import okhttp3.mockwebserver.MockWebServer;
import okhttp3.mockwebserver.RecordedRequest;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.util.List;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.TimeUnit;

import static org.assertj.core.api.Assertions.assertThat;

class ChatStreamTest {

    private MockWebServer server;
    private ChatClient client;

    @BeforeEach
    void setUp() throws Exception {
        server = new MockWebServer();
        server.start();
        client = ChatClient.builder(server.url("/").uri())
                .codec(new JacksonJsonCodec())
                .backoff(() -> new ReconnectBackoff(Duration.ofMillis(10), 1.5, Duration.ofMillis(50)))
                .build();
    }

    @AfterEach
    void tearDown() throws Exception {
        server.shutdown();
    }

    @Test
    void reconnectFetchesMissedMessagesAndDropsDuplicates() throws Exception {
        server.enqueue(sse("event: history\ndata: [" + msg(1, "a") + "," + msg(2, "b") + "]\n\n"));
        server.enqueue(sse("event: history\ndata: [" + msg(3, "c") + "," + msg(4, "d") + "]\n\n"
                + "event: message\ndata: " + msg(4, "d") + "\n\n"
                + ": ping\n\n"
                + "event: message\ndata: " + msg(5, "e") + "\n\n"
                + "event: reconnect\ndata: {\"reason\":\"kicked\"}\n\n"));
        server.enqueue(new MockResponse()
                .addHeader("Content-Type", "application/json")
                .setBody("{\"messages\":[" + msg(3, "c") + "," + msg(4, "d") + "]}"));

        Recorder recorder = new Recorder();
        ChatStream stream = client.stream("alice", "s1", recorder);

        assertThat(stream.awaitTermination(Duration.ofSeconds(10))).isTrue();
        assertThat(recorder.messages).extracting(MessageView::sequenceId).containsExactly(3L, 4L, 5L);
        assertThat(recorder.connects).containsExactly(false, true);
        assertThat(recorder.disconnects).hasSize(1);
        assertThat(stream.lastSequenceId()).isEqualTo(5L);
        assertThat(stream.isKicked()).isTrue();

        RecordedRequest first = server.takeRequest(1, TimeUnit.SECONDS);
        RecordedRequest second = server.takeRequest(1, TimeUnit.SECONDS);
        RecordedRequest catchUp = server.takeRequest(1, TimeUnit.SECONDS);
        assertThat(first.getPath()).isEqualTo("/api/stream?username=alice&sessionId=s1");
        assertThat(first.getHeader("Accept")).isEqualTo("text/event-stream");
        assertThat(second.getPath()).isEqualTo("/api/stream?username=alice&sessionId=s1");
        assertThat(catchUp.getPath()).isEqualTo("/api/messages?after=2&limit=500");
    }

    @Test
    void kickStopsTheLoop() throws Exception {
        server.enqueue(sse("event: users\ndata: {\"count\":1,\"realCount\":1,\"users\":[{\"username\":\"bob\","
                + "\"joinedAt\":\"2026-01-01T00:00:00Z\",\"synthetic\":false}]}\n\n"
                + "event: users\ndata: {\"type\":\"user_kicked\",\"username\":\"alice\"}\n\n"
                + "event: reconnect\ndata: {\"reason\":\"kicked\"}\n\n"));

        Recorder recorder = new Recorder();
        ChatStream stream = client.stream("alice", "s1", recorder);

        assertThat(stream.awaitTermination(Duration.ofSeconds(10))).isTrue();
        assertThat(recorder.rosters).hasSize(1);
        assertThat(recorder.rosters.get(0).contains("bob")).isTrue();
        assertThat(recorder.kickedUsers).containsExactly("alice");
        assertThat(recorder.kicked).isTrue();
        assertThat(server.getRequestCount()).isEqualTo(1);
    }

    @Test
    void maxRuntimeReconnectResumes() throws Exception {
        server.enqueue(sse("event: config\ndata: {\"chat_mode\":\"both\"}\n\n"
                + "event: reconnect\ndata: {\"reason\":\"max_runtime\"}\n\n"));
        server.enqueue(sse("event: reconnect\ndata: {\"reason\":\"kicked\"}\n\n"));
        server.enqueue(new MockResponse()
                .addHeader("Content-Type", "application/json")
                .setBody("{\"messages\":[]}"));

        Recorder recorder = new Recorder();
        ChatStream stream = client.stream("alice", "s1", recorder);

        assertThat(stream.awaitTermination(Duration.ofSeconds(10))).isTrue();
        assertThat(recorder.connects).containsExactly(false, true);
        assertThat(recorder.disconnects).containsExactly((Throwable) null);
        assertThat(server.getRequestCount()).isEqualTo(3);
    }

    @Test
    void closeStopsReconnecting() throws Exception {
        for (int i = 0; i < 100; i++) {
            server.enqueue(new MockResponse().setResponseCode(503));
        }

        ChatStream stream = client.stream("alice", "s1", new Recorder());
        server.takeRequest(5, TimeUnit.SECONDS);
        stream.close();

        assertThat(stream.awaitTermination(Duration.ofSeconds(5))).isTrue();
        assertThat(stream.isRunning()).isFalse();
    }

    private static MockResponse sse(String body) {
        return new MockResponse()
                .addHeader("Content-Type", "text/event-stream")
                .setBody(body);
    }

    private static String msg(long seq, String text) {
        return "{\"sequenceId\":" + seq + ",\"messageId\":\"msg_" + seq + "\",\"username\":\"bob\",\"text\":\""
                + text + "\",\"createdAt\":\"2026-01-01T00:00:00Z\"}";
    }

    private static final class Recorder implements ChatStreamListener {
        final List<MessageView> messages = new CopyOnWriteArrayList<>();
        final List<Boolean> connects = new CopyOnWriteArrayList<>();
        final List<Throwable> disconnects = new CopyOnWriteArrayList<>();
        final List<RosterSnapshot> rosters = new CopyOnWriteArrayList<>();
        final List<String> kickedUsers = new CopyOnWriteArrayList<>();
        volatile boolean kicked;

        @Override
        public void onConnected(boolean reconnect) {
            connects.add(reconnect);
        }

        @Override
        public void onMessage(MessageView message) {
            messages.add(message);
        }

        @Override
        public void onDisconnected(Throwable cause) {
            disconnects.add(cause);
        }

        @Override
        public void onRoster(RosterSnapshot roster) {
            rosters.add(roster);
        }

        @Override
        public void onUserKicked(String username) {
            kickedUsers.add(username);
        }

        @Override
        public void onKicked() {
            kicked = true;
        }
    }
}

package io.chatbox.server.core;

import io.chatbox.core.Protocol;
import io.chatbox.core.Role;
import io.chatbox.json.jackson.JacksonJsonCodec;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.ByteArrayInputStream;
import java.net.URI;
import java.nio.charset.StandardCharsets;
import java.nio.file.Path;
import java.time.Duration;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;

class ChatHandlerTest {

    private static final String BASE = "http://localhost";

    @TempDir
    Path attachmentDir;

    private final JacksonJsonCodec codec = new JacksonJsonCodec();
    private MutableClock clock;
    private ChatEngine engine;
    private ChatHandler handler;

    @BeforeEach
    void setUp() {
        clock = MutableClock.startingAt("2026-03-01T12:00:00Z");
        engine = TestEngines.inMemory(clock, ChatServerConfig.builder()
                .rateLimit(3, Duration.ofMinutes(1))
                .attachmentDir(attachmentDir)
                .trustForwardedFor(true)
                .build());
        handler = ChatHandler.builder(engine).maxBodySize(64 * 1024).build();
    }

    @Test
    void registerReturnsTheBoundSession() throws Exception {
        ServerResponse resp = post(Protocol.PATH_REGISTER, "{\"username\":\"alice\",\"sessionId\":\"S1\"}", "10.0.0.1");

        assertThat(resp.status()).isEqualTo(200);
        assertThat(firstHeader(resp, Protocol.H_CONTENT_TYPE)).isEqualTo(Protocol.CT_JSON);
        assertThat(json(resp)).containsEntry("success", true)
                .containsEntry("username", "alice")
                .containsEntry("sessionId", "S1")
                .containsEntry("role", "simple_user");
    }

    @Test
    void conflictsCarryTheErrorCode() throws Exception {
        post(Protocol.PATH_REGISTER, "{\"username\":\"alice\",\"sessionId\":\"S1\"}", "10.0.0.1");

        ServerResponse resp = post(Protocol.PATH_REGISTER, "{\"username\":\"alice\",\"sessionId\":\"S2\"}", "10.0.0.2");

        assertThat(resp.status()).isEqualTo(409);
        assertThat(firstHeader(resp, Protocol.H_ERROR)).isEqualTo("conflict");
        assertThat(firstHeader(resp, Protocol.H_CACHE_CONTROL)).isEqualTo("no-store");
        assertThat(json(resp)).containsEntry("error", "conflict").containsKey("message");
    }

    @Test
    void sendThenReadHistoryAndCatchUp() throws Exception {
        post(Protocol.PATH_REGISTER, "{\"username\":\"alice\",\"sessionId\":\"S1\"}", "10.0.0.1");
        ServerResponse sent = post(Protocol.PATH_SEND,
                "{\"username\":\"alice\",\"sessionId\":\"S1\",\"message\":\"hello\"}", "10.0.0.1");
        post(Protocol.PATH_SEND, "{\"username\":\"alice\",\"sessionId\":\"S1\",\"text\":\"world\"}", "10.0.0.1");

        assertThat(sent.status()).isEqualTo(200);
        assertThat(json(sent)).containsEntry("text", "hello").containsEntry("sequenceId", 1)
                .doesNotContainKey("originAddress");

        List<?> history = (List<?>) json(get(Protocol.PATH_HISTORY + "?limit=10")).get("messages");
        assertThat(history).hasSize(2);

        List<?> after = (List<?>) json(get(Protocol.PATH_MESSAGES + "?after=1")).get("messages");
        assertThat(after).singleElement().satisfies(m -> assertThat((Map<String, Object>) m).containsEntry("text", "world"));
    }

    @Test
    void rateLimitedSendAnswers429WithRetryAfter() throws Exception {
        post(Protocol.PATH_REGISTER, "{\"username\":\"alice\",\"sessionId\":\"S1\"}", "10.0.0.1");
        String body = "{\"username\":\"alice\",\"sessionId\":\"S1\",\"message\":\"m\"}";
        for (int i = 0; i < 3; i++) {
            assertThat(post(Protocol.PATH_SEND, body, "10.0.0.1").status()).isEqualTo(200);
        }

        ServerResponse limited = post(Protocol.PATH_SEND, body, "10.0.0.1");

        assertThat(limited.status()).isEqualTo(429);
        assertThat(firstHeader(limited, Protocol.H_ERROR)).isEqualTo("rate_limited");
        assertThat(firstHeader(limited, Protocol.H_RETRY_AFTER)).isEqualTo("60");
    }

    @Test
    void forwardedAddressIsUsedWhenTrusted() throws Exception {
        engine.bans().banAddress("203.0.113.7", "abuse", "admin1", null);

        ServerResponse resp = handler.handle(request(HttpMethod.POST, uri(Protocol.PATH_REGISTER),
                headers(Protocol.H_FORWARDED_FOR, "203.0.113.7, 10.0.0.1"),
                "{\"username\":\"mallory\",\"sessionId\":\"S9\"}".getBytes(StandardCharsets.UTF_8)), "10.0.0.1");

        assertThat(resp.status()).isEqualTo(403);
        assertThat(firstHeader(resp, Protocol.H_ERROR)).isEqualTo("forbidden");
    }

    @Test
    void malformedRequestsAreRejected() throws Exception {
        assertThat(post(Protocol.PATH_REGISTER, "not json", "10.0.0.1").status()).isEqualTo(400);
        assertThat(get(Protocol.PATH_HISTORY + "?limit=lots").status()).isEqualTo(400);
        assertThat(post(Protocol.PATH_SEND, "{\"message\":\"" + "x".repeat(70_000) + "\"}", "10.0.0.1").status())
                .isEqualTo(400);

        ServerResponse wrongMethod = get(Protocol.PATH_SEND);
        assertThat(wrongMethod.status()).isEqualTo(405);
        assertThat(firstHeader(wrongMethod, "Allow")).isEqualTo("POST");

        ServerResponse unknown = get("/api/nothing-here");
        assertThat(unknown.status()).isEqualTo(404);
        assertThat(firstHeader(unknown, Protocol.H_ERROR)).isEqualTo("not_found");
    }

    @Test
    void heartbeatForAnUnknownSessionIsNotFound() throws Exception {
        post(Protocol.PATH_REGISTER, "{\"username\":\"alice\",\"sessionId\":\"S1\"}", "10.0.0.1");

        assertThat(post(Protocol.PATH_HEARTBEAT, "{\"username\":\"alice\",\"sessionId\":\"S1\"}", null).status())
                .isEqualTo(200);
        assertThat(post(Protocol.PATH_HEARTBEAT, "{\"username\":\"alice\",\"sessionId\":\"S2\"}", null).status())
                .isEqualTo(404);
        assertThat(json(post(Protocol.PATH_LOGOUT, "{\"sessionId\":\"S1\"}", null))).containsEntry("success", true);
    }

    @Test
    void activeUsersAndSettingsArePublic() throws Exception {
        post(Protocol.PATH_REGISTER, "{\"username\":\"alice\",\"sessionId\":\"S1\",\"age\":30}", "10.0.0.1");

        Map<String, Object> roster = json(get(Protocol.PATH_ACTIVE_USERS));
        assertThat(roster).containsEntry("count", 1).containsEntry("realCount", 1);

        assertThat(json(get(Protocol.PATH_SETTINGS))).containsEntry("chat_mode", "public");
    }

    @Test
    void adminRoutesNeedASignedInSession() throws Exception {
        engine.accounts().create("mod1", null, null, Role.MODERATOR, "password1");
        post(Protocol.PATH_REGISTER, "{\"username\":\"guest\",\"sessionId\":\"G1\"}", "10.0.0.1");
        ServerResponse login = post(Protocol.PATH_LOGIN,
                "{\"username\":\"mod1\",\"password\":\"password1\",\"sessionId\":\"M1\"}", "10.0.0.2");
        assertThat(json(login)).containsEntry("role", "moderator");

        ServerResponse anonymous = post(Protocol.ADMIN_PREFIX + "kick", "{\"username\":\"guest\"}", null);
        assertThat(anonymous.status()).isEqualTo(401);

        ServerResponse kicked = handler.handle(request(HttpMethod.POST, uri(Protocol.ADMIN_PREFIX + "kick"),
                headers(Protocol.H_CHAT_SESSION, "M1"), "{\"username\":\"guest\"}".getBytes(StandardCharsets.UTF_8)));
        assertThat(kicked.status()).isEqualTo(200);
        assertThat(json(kicked)).containsEntry("sessions", List.of("G1"));

        ServerResponse clear = handler.handle(request(HttpMethod.POST, uri(Protocol.ADMIN_PREFIX + "clear"),
                headers(Protocol.H_CHAT_SESSION, "M1"), null));
        assertThat(clear.status()).isEqualTo(403);
    }

    @Test
    void privateMessagesRoundTripThroughTheRoutes() throws Exception {
        engine.settings().update(Map.of("chat_mode", "both"));
        post(Protocol.PATH_REGISTER, "{\"username\":\"alice\",\"sessionId\":\"A1\"}", "10.0.0.1");
        post(Protocol.PATH_REGISTER, "{\"username\":\"bob\",\"sessionId\":\"B1\"}", "10.0.0.2");

        ServerResponse sent = post(Protocol.PATH_PRIVATE_MESSAGE,
                "{\"username\":\"alice\",\"sessionId\":\"A1\",\"to\":\"bob\",\"message\":\"psst\"}", "10.0.0.1");
        assertThat(sent.status()).isEqualTo(200);
        assertThat(json(sent)).containsEntry("toUsername", "bob").doesNotContainKey("toSessionId");

        Map<String, Object> conversation = json(get(Protocol.PATH_PRIVATE_MESSAGE
                + "?username=bob&sessionId=B1&with=alice"));
        assertThat((List<?>) conversation.get("messages")).hasSize(1);

        assertThat(json(post(Protocol.PATH_PRIVATE_MESSAGE_READ,
                "{\"username\":\"bob\",\"sessionId\":\"B1\",\"from\":\"alice\"}", null)))
                .containsEntry("updated", 1);
    }

    @Test
    void attachmentUploadAndDownload() throws Exception {
        engine.settings().update(Map.of("chat_mode", "both"));
        post(Protocol.PATH_REGISTER, "{\"username\":\"alice\",\"sessionId\":\"A1\"}", "10.0.0.1");
        byte[] image = {1, 2, 3, 4};

        ServerResponse uploaded = handler.handle(request(HttpMethod.POST,
                uri(Protocol.PATH_ATTACHMENTS + "?username=alice&sessionId=A1"),
                headers(Protocol.H_CONTENT_TYPE, "image/gif"), image));
        assertThat(uploaded.status()).isEqualTo(200);
        String ref = (String) json(uploaded).get("ref");

        ServerResponse download = get(Protocol.PATH_ATTACHMENTS + "?ref=" + ref + "&username=alice&sessionId=A1");
        assertThat(download.status()).isEqualTo(200);
        assertThat(firstHeader(download, Protocol.H_CONTENT_TYPE)).isEqualTo("image/gif");
        assertThat(download.body()).isInstanceOfSatisfying(ResponseBody.File.class, file -> {
            assertThat(file.length()).isEqualTo(4);
            assertThat(file.path()).exists();
        });

        assertThat(get(Protocol.PATH_ATTACHMENTS + "?ref=att_nope&username=alice&sessionId=A1").status())
                .isEqualTo(404);
    }

    @Test
    void streamRouteAnswersWithAnEventStream() {
        ServerResponse resp = get(Protocol.PATH_STREAM + "?username=alice&sessionId=S1");

        assertThat(resp.status()).isEqualTo(200);
        assertThat(firstHeader(resp, Protocol.H_CONTENT_TYPE)).isEqualTo(Protocol.CT_EVENT_STREAM);
        assertThat(firstHeader(resp, Protocol.H_CACHE_CONTROL)).isEqualTo("no-cache");
        assertThat(resp.body()).isInstanceOf(ResponseBody.Sse.class);
    }

    @Test
    void healthReportsStoreAndCache() throws Exception {
        ServerResponse resp = get(Protocol.PATH_HEALTH);

        assertThat(resp.status()).isEqualTo(200);
        assertThat(json(resp)).containsEntry("store", "up").containsEntry("cache", "up").containsEntry("status", "ok");
    }

    private ServerResponse post(String path, String body, String remote) {
        return handler.handle(request(HttpMethod.POST, uri(path), headers(Protocol.H_CONTENT_TYPE, Protocol.CT_JSON),
                body.getBytes(StandardCharsets.UTF_8)), remote);
    }

    private ServerResponse get(String pathAndQuery) {
        return handler.handle(request(HttpMethod.GET, uri(pathAndQuery), Map.of(), null));
    }

    private Map<String, Object> json(ServerResponse resp) throws Exception {
        assertThat(resp.body()).isInstanceOf(ResponseBody.Bytes.class);
        return codec.readObject(((ResponseBody.Bytes) resp.body()).bytes());
    }

    private static URI uri(String pathAndQuery) {
        return URI.create(BASE + pathAndQuery);
    }

    private static ServerRequest request(HttpMethod method, URI uri, Map<String, List<String>> headers, byte[] body) {
        return new ServerRequest(method, uri, headers, body == null ? null : new ByteArrayInputStream(body));
    }

    private static Map<String, List<String>> headers(String... kv) {
        Map<String, List<String>> out = new LinkedHashMap<>();
        for (int i = 0; i < kv.length; i += 2) {
            out.put(kv[i], List.of(kv[i + 1]));
        }
        return out;
    }

    private static String firstHeader(ServerResponse response, String name) {
        return response.firstHeader(name).orElse(null);
    }
}

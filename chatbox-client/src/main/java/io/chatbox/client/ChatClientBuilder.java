package io.chatbox.client;

import io.chatbox.json.spi.JsonCodec;
import io.chatbox.json.spi.JsonCodecs;

import java.net.URI;
import java.net.http.HttpClient;
import java.time.Duration;
import java.util.Objects;
import java.util.function.Supplier;

public final class ChatClientBuilder {
    private final URI baseUri;
    private ChatTransport transport;
    private JsonCodec codec;
    private Supplier<ReconnectBackoff> backoff = ReconnectBackoff::new;
    private Duration requestTimeout = Duration.ofSeconds(15);

    ChatClientBuilder(URI baseUri) {
        this.baseUri = Objects.requireNonNull(baseUri, "baseUri");
    }

    public ChatClientBuilder transport(ChatTransport transport) {
        this.transport = Objects.requireNonNull(transport, "transport");
        return this;
    }

    public ChatClientBuilder jdkHttpClient(HttpClient httpClient) {
        this.transport = new JdkHttpTransport(Objects.requireNonNull(httpClient, "httpClient"));
        return this;
    }

    public ChatClientBuilder codec(JsonCodec codec) {
        this.codec = Objects.requireNonNull(codec, "codec");
        return this;
    }

    /** Backoff used by each stream; a fresh instance per stream. */
    public ChatClientBuilder backoff(Supplier<ReconnectBackoff> backoff) {
        this.backoff = Objects.requireNonNull(backoff, "backoff");
        return this;
    }

    public ChatClientBuilder requestTimeout(Duration requestTimeout) {
        this.requestTimeout = Objects.requireNonNull(requestTimeout, "requestTimeout");
        return this;
    }

    public ChatClient build() {
        ChatTransport resolved = transport;
        if (resolved == null) {
            resolved = new JdkHttpTransport(HttpClient.newHttpClient());
        }
        JsonCodec resolvedCodec = codec == null ? JsonCodecs.load() : codec;
        return new JdkChatClient(baseUri, resolved, resolvedCodec, backoff, requestTimeout);
    }
}

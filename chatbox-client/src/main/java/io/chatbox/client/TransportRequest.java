package io.chatbox.client;

import io.chatbox.core.Protocol;

import java.net.URI;
import java.time.Duration;
import java.util.Objects;

/**
 * One exchange issued by the chat client. JSON calls carry the client's request timeout; the event stream has none
 * and stays open until the server ends it.
 */
public record TransportRequest(String method, URI url, String accept, String contentType, byte[] body,
                               Duration timeout) {
    public TransportRequest {
        Objects.requireNonNull(method, "method");
        Objects.requireNonNull(url, "url");
        Objects.requireNonNull(accept, "accept");
        if (body != null && contentType == null) {
            throw new IllegalArgumentException("a request body needs a content type");
        }
    }

    public static TransportRequest getJson(URI url, Duration timeout) {
        return new TransportRequest("GET", url, Protocol.CT_JSON, null, null, timeout);
    }

    public static TransportRequest postJson(URI url, byte[] body, Duration timeout) {
        return new TransportRequest("POST", url, Protocol.CT_JSON, Protocol.CT_JSON,
                Objects.requireNonNull(body, "body"), timeout);
    }

    public static TransportRequest eventStream(URI url) {
        return new TransportRequest("GET", url, Protocol.CT_EVENT_STREAM, null, null, null);
    }
}

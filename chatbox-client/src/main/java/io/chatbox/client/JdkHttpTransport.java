package io.chatbox.client;

import io.chatbox.core.Protocol;

import java.io.InputStream;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.util.Objects;

/**
 * {@link ChatTransport} on {@link HttpClient}. JSON answers are buffered; the event stream is handed over as a live
 * {@link InputStream} that the caller closes.
 */
public final class JdkHttpTransport implements ChatTransport {
    private final HttpClient http;

    public JdkHttpTransport(HttpClient http) {
        this.http = Objects.requireNonNull(http, "http");
    }

    @Override
    public TransportResponse<byte[]> sendBytes(TransportRequest request) throws Exception {
        HttpResponse<byte[]> resp = http.send(toHttpRequest(request), HttpResponse.BodyHandlers.ofByteArray());
        return new TransportResponse<>(resp.statusCode(), resp.headers().map(),
                resp.body() == null ? new byte[0] : resp.body());
    }

    @Override
    public TransportResponse<InputStream> sendStream(TransportRequest request) throws Exception {
        HttpResponse<InputStream> resp = http.send(toHttpRequest(request), HttpResponse.BodyHandlers.ofInputStream());
        return new TransportResponse<>(resp.statusCode(), resp.headers().map(), resp.body());
    }

    static HttpRequest toHttpRequest(TransportRequest request) {
        HttpRequest.Builder builder = HttpRequest.newBuilder(request.url())
                .header(Protocol.H_ACCEPT, request.accept())
                .method(request.method(), request.body() == null
                        ? HttpRequest.BodyPublishers.noBody()
                        : HttpRequest.BodyPublishers.ofByteArray(request.body()));
        if (request.contentType() != null) {
            builder.header(Protocol.H_CONTENT_TYPE, request.contentType());
        }
        if (request.timeout() != null) {
            builder.timeout(request.timeout());
        }
        return builder.build();
    }
}

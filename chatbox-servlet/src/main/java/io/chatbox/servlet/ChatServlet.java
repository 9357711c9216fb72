package io.chatbox.servlet;

import io.chatbox.server.core.ChatHandler;
import io.chatbox.server.core.HttpMethod;
import io.chatbox.server.core.ResponseBody;
import io.chatbox.server.core.ServerRequest;
import io.chatbox.server.core.ServerResponse;
import io.chatbox.server.core.SseFrame;
import jakarta.servlet.AsyncContext;
import jakarta.servlet.ServletOutputStream;
import jakarta.servlet.http.HttpServlet;
import jakarta.servlet.http.HttpServletRequest;
import jakarta.servlet.http.HttpServletResponse;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.ByteArrayInputStream;
import java.io.IOException;
import java.io.InputStream;
import java.net.URI;
import java.net.URISyntaxException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.util.Collections;
import java.util.Enumeration;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.concurrent.Flow;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * Exposes a {@link ChatHandler} as a Jakarta servlet. Streams use async I/O with no timeout; the handler decides
 * when a stream ends.
 */
public final class ChatServlet extends HttpServlet {
    private static final Logger logger = LoggerFactory.getLogger(ChatServlet.class);

    private final transient ChatHandler handler;

    public ChatServlet(ChatHandler handler) {
        this.handler = handler;
    }

    @Override
    protected void service(HttpServletRequest req, HttpServletResponse resp) throws IOException {
        ServerResponse engineResp;
        try {
            engineResp = handler.handle(toEngineRequest(req), req.getRemoteAddr());
        } catch (IllegalArgumentException | URISyntaxException e) {
            logger.debug("Rejected malformed request {} {}", req.getMethod(), req.getRequestURI(), e);
            resp.setStatus(400);
            resp.setHeader("X-Error", "bad_request");
            return;
        }

        resp.setStatus(engineResp.status());
        engineResp.headers().forEach((k, vals) -> vals.forEach(v -> resp.addHeader(k, v)));

        ResponseBody body = engineResp.body();
        if (body instanceof ResponseBody.Empty) {
            return;
        }
        if (body instanceof ResponseBody.Bytes bytes) {
            resp.setContentLength(bytes.bytes().length);
            resp.getOutputStream().write(bytes.bytes());
            return;
        }
        if (body instanceof ResponseBody.File file) {
            resp.setContentLengthLong(file.length());
            Files.copy(file.path(), resp.getOutputStream());
            return;
        }
        if (body instanceof ResponseBody.Sse sse) {
            stream(req, resp, sse.publisher());
        }
    }

    private static void stream(HttpServletRequest req, HttpServletResponse resp, Flow.Publisher<SseFrame> pub)
            throws IOException {
        resp.setContentType("text/event-stream");
        resp.setCharacterEncoding("UTF-8");
        resp.flushBuffer();

        AsyncContext async = req.startAsync();
        async.setTimeout(0);
        ServletOutputStream out = resp.getOutputStream();
        AtomicBoolean completed = new AtomicBoolean(false);

        pub.subscribe(new Flow.Subscriber<>() {
            private Flow.Subscription subscription;

            @Override
            public void onSubscribe(Flow.Subscription subscription) {
                this.subscription = subscription;
                subscription.request(Long.MAX_VALUE);
            }

            @Override
            public void onNext(SseFrame item) {
                try {
                    out.write(item.render().getBytes(StandardCharsets.UTF_8));
                    out.flush();
                } catch (IOException e) {
                    logger.debug("Stream client went away", e);
                    subscription.cancel();
                    complete();
                }
            }

            @Override
            public void onError(Throwable throwable) {
                logger.debug("Stream ended with error", throwable);
                complete();
            }

            @Override
            public void onComplete() {
                complete();
            }

            private void complete() {
                if (completed.compareAndSet(false, true)) {
                    async.complete();
                }
            }
        });
    }

    static ServerRequest toEngineRequest(HttpServletRequest req) throws IOException, URISyntaxException {
        HttpMethod method = HttpMethod.valueOf(req.getMethod().toUpperCase(Locale.ROOT));
        String query = req.getQueryString();
        URI uri = new URI(req.getRequestURL().toString() + (query == null ? "" : "?" + query));

        Map<String, List<String>> headers = new LinkedHashMap<>();
        Enumeration<String> names = req.getHeaderNames();
        while (names != null && names.hasMoreElements()) {
            String name = names.nextElement();
            headers.put(name, Collections.list(req.getHeaders(name)));
        }

        byte[] bodyBytes = readBody(req);
        ByteArrayInputStream body = bodyBytes.length == 0 ? null : new ByteArrayInputStream(bodyBytes);
        return new ServerRequest(method, uri, headers, body);
    }

    private static byte[] readBody(HttpServletRequest req) throws IOException {
        if (req.getContentLengthLong() == 0) {
            return new byte[0];
        }
        try (InputStream in = req.getInputStream()) {
            return in == null ? new byte[0] : in.readAllBytes();
        }
    }
}

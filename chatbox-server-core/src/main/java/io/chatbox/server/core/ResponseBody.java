package io.chatbox.server.core;

import java.nio.file.Path;
import java.util.concurrent.Flow;

/**
 * Framework-neutral response body.
 */
public sealed interface ResponseBody permits ResponseBody.Empty, ResponseBody.Bytes, ResponseBody.File, ResponseBody.Sse {

    record Empty() implements ResponseBody {}

    record Bytes(byte[] bytes) implements ResponseBody {}

    /** Whole file streamed by the adapter, used for attachment downloads. */
    record File(Path path, long length) implements ResponseBody {}

    record Sse(Flow.Publisher<SseFrame> publisher) implements ResponseBody {}
}

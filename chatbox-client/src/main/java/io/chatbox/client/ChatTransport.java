package io.chatbox.client;

import java.io.InputStream;

/**
 * Blocking HTTP exchange used by the chat client.
 */
public interface ChatTransport {
    TransportResponse<byte[]> sendBytes(TransportRequest request) throws Exception;

    TransportResponse<InputStream> sendStream(TransportRequest request) throws Exception;
}

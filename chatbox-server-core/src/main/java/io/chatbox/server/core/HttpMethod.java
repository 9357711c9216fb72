package io.chatbox.server.core;

/**
 * HTTP methods the chat handler distinguishes.
 */
public enum HttpMethod {
    GET,
    HEAD,
    POST,
    PUT,
    DELETE,
    OPTIONS
}

package io.chatbox.server.core.service;

/**
 * Where filtered text will be shown.
 */
public enum Visibility {
    PUBLIC,
    PRIVATE
}

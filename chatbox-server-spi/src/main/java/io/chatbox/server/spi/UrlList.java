package io.chatbox.server.spi;

/**
 * The two administrator-maintained URL pattern lists.
 */
public enum UrlList {
    WHITELIST,
    BLACKLIST
}

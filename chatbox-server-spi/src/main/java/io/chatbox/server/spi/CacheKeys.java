package io.chatbox.server.spi;

import java.util.Locale;
import java.util.Objects;

/**
 * Namespaced cache key builder: every key starts with {@code <product>:<instance>:}.
 */
public final class CacheKeys {

    private final String prefix;

    public CacheKeys(String product, String instance) {
        Objects.requireNonNull(product, "product");
        Objects.requireNonNull(instance, "instance");
        if (product.isBlank() || instance.isBlank()) {
            throw new IllegalArgumentException("product and instance must not be blank");
        }
        this.prefix = product + ":" + instance + ":";
    }

    public static CacheKeys defaults() {
        return new CacheKeys("chatbox", "default");
    }

    public String prefix() {
        return prefix;
    }

    public String messages() {
        return prefix + "chat:messages";
    }

    public String rateLimit(String origin) {
        return prefix + "rate_limit:" + origin;
    }

    public String violations(String kind, String origin) {
        return prefix + "violations:" + kind + ":" + origin;
    }

    public String bannedSession(String sessionId) {
        return prefix + "banned_session:" + sessionId;
    }

    public String settings() {
        return prefix + "settings";
    }

    public String urlList(UrlList list) {
        return prefix + "url_" + list.name().toLowerCase(Locale.ROOT);
    }

    public String bannedAddresses() {
        return prefix + "banned_ips";
    }

    public String bannedNicknames() {
        return prefix + "banned_nicknames";
    }
}

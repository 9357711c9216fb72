package io.chatbox.server.core.service;

import io.chatbox.core.ChatException;

import java.util.Locale;
import java.util.regex.Pattern;

/**
 * URL white/blacklist entry matched against the host of a URL.
 *
 * <p>{@code example.com} matches that host and its subdomains; {@code *.example.com} matches the subdomains and
 * the apex; any other {@code *} is a wildcard within the host.
 */
final class HostPattern {

    private final String base;
    private final Pattern wildcard;

    private HostPattern(String normalized) {
        if (normalized.startsWith("*.")) {
            this.base = normalized.substring(2);
            this.wildcard = null;
        } else if (normalized.contains("*")) {
            this.base = null;
            StringBuilder regex = new StringBuilder();
            for (String part : normalized.split("\\*", -1)) {
                if (regex.length() > 0) regex.append(".*");
                regex.append(Pattern.quote(part));
            }
            this.wildcard = Pattern.compile(regex.toString());
        } else {
            this.base = normalized;
            this.wildcard = null;
        }
    }

    static HostPattern of(String pattern) {
        return new HostPattern(normalize(pattern));
    }

    /**
     * Reduces administrator input to a lower-case host pattern: scheme, path and port are dropped.
     */
    static String normalize(String pattern) {
        if (pattern == null || pattern.isBlank()) {
            throw new ChatException.Validation("URL pattern must not be empty");
        }
        String p = pattern.trim().toLowerCase(Locale.ROOT);
        int scheme = p.indexOf("://");
        if (scheme >= 0) p = p.substring(scheme + 3);
        int slash = p.indexOf('/');
        if (slash >= 0) p = p.substring(0, slash);
        int colon = p.indexOf(':');
        if (colon >= 0) p = p.substring(0, colon);
        if (p.isEmpty() || p.equals("*") || p.equals("*.")) {
            throw new ChatException.Validation("URL pattern must name a host");
        }
        return p;
    }

    boolean matches(String host) {
        String h = host.toLowerCase(Locale.ROOT);
        if (wildcard != null) {
            return wildcard.matcher(h).matches();
        }
        return h.equals(base) || h.endsWith("." + base);
    }
}

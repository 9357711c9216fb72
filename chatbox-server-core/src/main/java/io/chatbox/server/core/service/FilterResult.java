package io.chatbox.server.core.service;

import java.util.List;

/**
 * Outcome of {@link ContentFilter#filter}.
 *
 * @param reasons human-readable reasons for each redaction kind applied
 * @param blacklistHit whether a blacklisted URL was redacted (counts as a {@code spam_url} violation)
 */
public record FilterResult(String text, boolean modified, List<String> reasons, boolean blacklistHit) {
    public FilterResult {
        reasons = List.copyOf(reasons);
    }
}

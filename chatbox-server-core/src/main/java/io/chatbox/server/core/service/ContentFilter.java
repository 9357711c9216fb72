package io.chatbox.server.core.service;

import io.chatbox.server.spi.UrlList;

import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Objects;
import java.util.function.Predicate;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Sanitizes chat text before it is stored.
 *
 * <p>Offending spans are replaced with {@link #REDACTED}; text is never rejected outright. Steps, in order:
 * injection-prone markup (all visibilities), then for public text non-whitelisted URLs and phone numbers outside
 * kept URLs, then blacklisted URLs (all visibilities).
 */
public final class ContentFilter {

    public static final String REDACTED = "***";

    private record Rule(Pattern pattern, String reason) {}

    private static final List<Rule> MARKUP_RULES = List.of(
            new Rule(Pattern.compile("<script\\b[^>]*>.*?</script\\s*>", Pattern.CASE_INSENSITIVE | Pattern.DOTALL),
                    "Script tags not allowed"),
            new Rule(Pattern.compile("<script\\b[^>]*>", Pattern.CASE_INSENSITIVE), "Script tags not allowed"),
            new Rule(Pattern.compile("\\bon(?:load|error|click|mouseover|mouseout|keydown|keyup|focus|blur|change"
                    + "|submit|dblclick|contextmenu|input|mouseenter|mouseleave|wheel|copy|paste)\\s*=",
                    Pattern.CASE_INSENSITIVE), "Event handlers not allowed"),
            new Rule(Pattern.compile("(?:javascript|vbscript)\\s*:", Pattern.CASE_INSENSITIVE),
                    "Script protocol not allowed"),
            new Rule(Pattern.compile("data:text/html", Pattern.CASE_INSENSITIVE), "Data URLs not allowed"),
            new Rule(Pattern.compile("<style\\b[^>]*>.*?</style\\s*>", Pattern.CASE_INSENSITIVE | Pattern.DOTALL),
                    "Style tags not allowed"),
            new Rule(Pattern.compile("style\\s*=\\s*[\"'][^\"']*(?:expression\\(|url\\()[^\"']*[\"']",
                    Pattern.CASE_INSENSITIVE), "Style expressions not allowed"),
            new Rule(Pattern.compile("<(?:iframe|object|embed|applet|meta|base|link|form|input|textarea|button|select|style)"
                    + "\\b[^>]*>", Pattern.CASE_INSENSITIVE), "Embedded markup not allowed"));

    /** Scheme URLs, {@code www.}/{@code ftp.} hosts and bare domains on common top-level domains. */
    private static final Pattern PUBLIC_URL = Pattern.compile(
            "\\b(?:(?:https?|ftp|file)://|www\\.|ftp\\.)[-a-z0-9+&@#/%=~_|$?!:,.]*[a-z0-9+&@#/%=~_|$]"
                    + "|\\b[a-z0-9]+(?:[-.][a-z0-9]+)*\\.(?:com|net|org|edu|gov|co|io|ai|app|dev|tech|info|biz|me|tv"
                    + "|cc|xyz|online|site|website|blog|shop|store|be)\\b(?:/[^\\s]*)?",
            Pattern.CASE_INSENSITIVE);

    /** Any host-like token, used for blacklist checks in every visibility. */
    private static final Pattern ANY_HOST = Pattern.compile(
            "\\b(?:[a-z][a-z0-9+.-]*://)?(?:[a-z0-9](?:[a-z0-9-]*[a-z0-9])?\\.)+[a-z]{2,}(?::\\d+)?(?:/[^\\s]*)?",
            Pattern.CASE_INSENSITIVE);

    private static final Pattern LONG_PHONE = Pattern.compile("\\+?\\(?\\d[\\d\\s\\-().]{8,}\\d");
    private static final Pattern SHORT_PHONE = Pattern.compile(
            "(?<!\\d)(?:\\(?\\d{3}\\)?[\\s.\\-]?)?\\d{3}[\\s.\\-]?\\d{4}(?!\\d)");

    private final SettingsService settings;

    public ContentFilter(SettingsService settings) {
        this.settings = Objects.requireNonNull(settings, "settings");
    }

    public FilterResult filter(String text, Visibility visibility) {
        Objects.requireNonNull(text, "text");
        Objects.requireNonNull(visibility, "visibility");
        String out = text;
        List<String> reasons = new ArrayList<>();

        for (Rule rule : MARKUP_RULES) {
            String next = rule.pattern().matcher(out).replaceAll(REDACTED);
            if (!next.equals(out) && !reasons.contains(rule.reason())) reasons.add(rule.reason());
            out = next;
        }

        if (visibility == Visibility.PUBLIC) {
            out = redactPublic(out, patterns(UrlList.WHITELIST), reasons);
        }

        List<HostPattern> blacklist = patterns(UrlList.BLACKLIST);
        boolean blacklistHit = false;
        if (!blacklist.isEmpty()) {
            String next = redactUrls(out, ANY_HOST, host -> blacklist.stream().anyMatch(p -> p.matches(host)));
            if (!next.equals(out)) {
                reasons.add("Blacklisted URL removed");
                blacklistHit = true;
            }
            out = next;
        }

        return new FilterResult(out, !out.equals(text), reasons, blacklistHit);
    }

    private List<HostPattern> patterns(UrlList list) {
        List<HostPattern> out = new ArrayList<>();
        for (String p : settings.urlPatterns(list)) {
            out.add(HostPattern.of(p));
        }
        return out;
    }

    /**
     * Drops URLs whose host is not whitelisted and phone numbers outside the URLs that were kept, so digits inside
     * an accepted link stay intact.
     */
    private static String redactPublic(String text, List<HostPattern> whitelist, List<String> reasons) {
        Matcher m = PUBLIC_URL.matcher(text);
        StringBuilder sb = new StringBuilder();
        boolean urlRemoved = false;
        boolean phoneRemoved = false;
        int last = 0;
        while (m.find()) {
            String gap = text.substring(last, m.start());
            String cleanGap = redactPhones(gap);
            phoneRemoved |= !cleanGap.equals(gap);
            sb.append(cleanGap);

            String host = hostOf(m.group());
            boolean drop = host.isEmpty() || whitelist.stream().noneMatch(p -> p.matches(host));
            sb.append(drop ? REDACTED : m.group());
            urlRemoved |= drop;
            last = m.end();
        }
        String tail = text.substring(last);
        String cleanTail = redactPhones(tail);
        phoneRemoved |= !cleanTail.equals(tail);
        sb.append(cleanTail);

        if (urlRemoved) reasons.add("URL removed");
        if (phoneRemoved) reasons.add("Phone number removed");
        return sb.toString();
    }

    private static String redactUrls(String text, Pattern candidates, Predicate<String> redactHost) {
        Matcher m = candidates.matcher(text);
        StringBuilder sb = new StringBuilder();
        while (m.find()) {
            String host = hostOf(m.group());
            m.appendReplacement(sb, Matcher.quoteReplacement(
                    host.isEmpty() || redactHost.test(host) ? REDACTED : m.group()));
        }
        m.appendTail(sb);
        return sb.toString();
    }

    private static String redactPhones(String text) {
        Matcher m = LONG_PHONE.matcher(text);
        StringBuilder sb = new StringBuilder();
        while (m.find()) {
            long digits = m.group().chars().filter(Character::isDigit).count();
            m.appendReplacement(sb, Matcher.quoteReplacement(digits >= 10 ? REDACTED : m.group()));
        }
        m.appendTail(sb);
        return SHORT_PHONE.matcher(sb.toString()).replaceAll(REDACTED);
    }

    static String hostOf(String url) {
        String h = url.toLowerCase(Locale.ROOT);
        int scheme = h.indexOf("://");
        if (scheme >= 0) h = h.substring(scheme + 3);
        for (char stop : new char[]{'/', '?', '#'}) {
            int i = h.indexOf(stop);
            if (i >= 0) h = h.substring(0, i);
        }
        int at = h.lastIndexOf('@');
        if (at >= 0) h = h.substring(at + 1);
        int colon = h.indexOf(':');
        if (colon >= 0) h = h.substring(0, colon);
        while (h.endsWith(".")) h = h.substring(0, h.length() - 1);
        return h;
    }
}

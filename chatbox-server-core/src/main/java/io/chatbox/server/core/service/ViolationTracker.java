package io.chatbox.server.core.service;

import io.chatbox.core.ChatException;
import io.chatbox.server.core.ChatServerConfig;
import io.chatbox.server.spi.CacheKeys;
import io.chatbox.server.spi.ChatCache;
import io.chatbox.server.spi.Counter;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Objects;

/**
 * Counts abuse per origin address and bans repeat offenders automatically.
 */
public final class ViolationTracker {
    private static final Logger logger = LoggerFactory.getLogger(ViolationTracker.class);

    public enum Kind {
        RATE_LIMIT("rate_limit"),
        SPAM_URL("spam_url");

        private final String key;

        Kind(String key) {
            this.key = key;
        }

        public String key() {
            return key;
        }
    }

    private final ChatCache cache;
    private final CacheKeys keys;
    private final BanService bans;
    private final ChatServerConfig config;

    public ViolationTracker(ChatCache cache, CacheKeys keys, BanService bans, ChatServerConfig config) {
        this.cache = Objects.requireNonNull(cache, "cache");
        this.keys = Objects.requireNonNull(keys, "keys");
        this.bans = Objects.requireNonNull(bans, "bans");
        this.config = Objects.requireNonNull(config, "config");
    }

    /**
     * Records one violation. Returns {@code true} when it pushed the origin over the threshold and an automatic
     * ban was issued.
     */
    public boolean record(Kind kind, String originAddress) {
        if (originAddress == null || originAddress.isBlank()) {
            return false;
        }
        String key = keys.violations(kind.key(), originAddress);
        Counter counter;
        try {
            counter = cache.increment(key, config.violationWindow());
        } catch (ChatException.TransientStore e) {
            logger.warn("Violation counter unavailable for {}", originAddress, e);
            return false;
        }
        logger.debug("Violation {} #{} from {}", kind.key(), counter.count(), originAddress);
        if (counter.count() < config.violationThreshold()) {
            return false;
        }
        boolean banned = false;
        if (bans.activeAddressBan(originAddress).isEmpty()) {
            bans.banAddress(originAddress, "Automatic ban: repeated " + kind.key() + " violations", "system",
                    config.autoBanDuration());
            logger.warn("Auto-banned {} after {} {} violations", originAddress, counter.count(), kind.key());
            banned = true;
        }
        try {
            cache.delete(key);
        } catch (ChatException.TransientStore e) {
            logger.warn("Could not reset violation counter {}", key, e);
        }
        return banned;
    }
}

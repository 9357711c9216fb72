package io.chatbox.server.core.service;

import io.chatbox.core.ChatException;
import io.chatbox.core.Profile;
import io.chatbox.server.core.ChatServerConfig;
import io.chatbox.server.spi.ChatStore;
import io.chatbox.server.spi.SyntheticIdentity;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.List;
import java.util.Objects;

/**
 * Administrator-managed roster padding.
 *
 * <p>{@link #balance()} toggles identities so that real plus synthetic users reach the {@code minimum_users}
 * setting, and withdraws padding as real users arrive.
 */
public final class SyntheticRosterService {
    private static final Logger logger = LoggerFactory.getLogger(SyntheticRosterService.class);

    private final ChatStore store;
    private final PresenceManager presence;
    private final SettingsService settings;
    private final ChatServerConfig config;

    public SyntheticRosterService(ChatStore store, PresenceManager presence, SettingsService settings,
                                  ChatServerConfig config) {
        this.store = Objects.requireNonNull(store, "store");
        this.presence = Objects.requireNonNull(presence, "presence");
        this.settings = Objects.requireNonNull(settings, "settings");
        this.config = Objects.requireNonNull(config, "config");
    }

    public List<SyntheticIdentity> list() {
        return store.syntheticIdentities();
    }

    public SyntheticIdentity add(String nickname, Integer age, String sex, String location, boolean active) {
        String name = PresenceManager.normalizeNickname(nickname, config.maxNicknameLength());
        if (age != null && (age < Profile.MIN_AGE || age > Profile.MAX_AGE)) {
            throw new ChatException.Validation("age must be between " + Profile.MIN_AGE + " and " + Profile.MAX_AGE);
        }
        presence.names().requireAvailable(name, null, true);
        SyntheticIdentity created = store.createSyntheticIdentity(name, age, blankToNull(sex), blankToNull(location),
                active);
        logger.info("Added synthetic user {} (active={})", created.nickname(), active);
        if (active) presence.publishRoster();
        return created;
    }

    public void setActive(long id, boolean active) {
        if (!store.setSyntheticIdentityActive(id, active)) {
            throw new ChatException.NotFound("synthetic user " + id + " not found");
        }
        presence.publishRoster();
    }

    public void delete(long id) {
        if (!store.deleteSyntheticIdentity(id)) {
            throw new ChatException.NotFound("synthetic user " + id + " not found");
        }
        presence.publishRoster();
    }

    /**
     * Activates or deactivates identities so the displayed roster holds at least {@code minimum_users} entries.
     * Does nothing while the setting is zero.
     *
     * @return number of identities toggled
     */
    public int balance() {
        int minimum = settings.getInt(SettingsService.MINIMUM_USERS, 0);
        if (minimum <= 0) {
            return 0;
        }
        int wanted = Math.max(0, minimum - presence.liveUserCount());
        List<SyntheticIdentity> all = store.syntheticIdentities();
        int active = (int) all.stream().filter(SyntheticIdentity::active).count();
        int changed = 0;
        for (SyntheticIdentity s : all) {
            if (active < wanted && !s.active()) {
                store.setSyntheticIdentityActive(s.id(), true);
                active++;
                changed++;
            } else if (active > wanted && s.active()) {
                store.setSyntheticIdentityActive(s.id(), false);
                active--;
                changed++;
            }
        }
        if (changed > 0) {
            logger.info("Balanced synthetic roster: {} active for minimum {}", active, minimum);
            presence.publishRoster();
        }
        return changed;
    }

    private static String blankToNull(String s) {
        return s == null || s.isBlank() ? null : s.trim();
    }
}

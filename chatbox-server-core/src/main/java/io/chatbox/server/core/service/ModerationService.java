package io.chatbox.server.core.service;

import io.chatbox.core.ChatException;
import io.chatbox.core.ChatMessage;
import io.chatbox.core.Role;
import io.chatbox.server.spi.AccountRecord;
import io.chatbox.server.spi.AddressBan;
import io.chatbox.server.spi.NicknameBan;
import io.chatbox.server.spi.SessionRecord;
import io.chatbox.server.spi.SyntheticIdentity;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * Role-checked moderation entry points. The caller is identified by a live session bound to an active account.
 */
public final class ModerationService {
    private static final Logger logger = LoggerFactory.getLogger(ModerationService.class);

    private final PresenceManager presence;
    private final AccountService accounts;
    private final MessageService messages;
    private final BanService bans;
    private final SettingsService settings;
    private final SyntheticRosterService synthetic;

    public ModerationService(PresenceManager presence, AccountService accounts, MessageService messages,
                             BanService bans, SettingsService settings, SyntheticRosterService synthetic) {
        this.presence = Objects.requireNonNull(presence, "presence");
        this.accounts = Objects.requireNonNull(accounts, "accounts");
        this.messages = Objects.requireNonNull(messages, "messages");
        this.bans = Objects.requireNonNull(bans, "bans");
        this.settings = Objects.requireNonNull(settings, "settings");
        this.synthetic = Objects.requireNonNull(synthetic, "synthetic");
    }

    /**
     * @throws ChatException.Auth when the session is missing, expired or not signed in
     * @throws ChatException.Forbidden when the account role is below {@code minimum}
     */
    public AccountRecord authorize(String sessionId, Role minimum) {
        SessionRecord session = presence.liveSession(sessionId)
                .orElseThrow(() -> new ChatException.Auth("moderation requires a signed-in session"));
        if (session.accountId() == null) {
            throw new ChatException.Auth("moderation requires a signed-in session");
        }
        AccountRecord account = accounts.find(session.accountId())
                .filter(AccountRecord::active)
                .orElseThrow(() -> new ChatException.Auth("account is no longer active"));
        if (!account.role().atLeast(minimum)) {
            throw new ChatException.Forbidden(minimum.wireName() + " role required");
        }
        return account;
    }

    public void deleteMessage(String callerSessionId, String messageId) {
        AccountRecord actor = authorize(callerSessionId, Role.MODERATOR);
        messages.delete(messageId);
        logger.info("{} deleted message {}", actor.username(), messageId);
    }

    public List<String> kick(String callerSessionId, String username) {
        AccountRecord actor = authorize(callerSessionId, Role.MODERATOR);
        requireNotSelf(actor, username);
        List<String> sessions = presence.kick(username);
        logger.info("{} kicked {}", actor.username(), username);
        return sessions;
    }

    public int clear(String callerSessionId) {
        AccountRecord actor = authorize(callerSessionId, Role.ADMINISTRATOR);
        int n = messages.clear();
        logger.info("{} cleared the chat", actor.username());
        return n;
    }

    public List<ChatMessage> listMessages(String callerSessionId, int limit, int offset) {
        authorize(callerSessionId, Role.MODERATOR);
        return messages.listAll(limit, offset);
    }

    public long countMessages(String callerSessionId) {
        authorize(callerSessionId, Role.MODERATOR);
        return messages.count();
    }

    /**
     * @param duration {@code null} for a permanent ban
     */
    public AddressBan banAddress(String callerSessionId, String address, String reason, Duration duration) {
        AccountRecord actor = authorize(callerSessionId, Role.ADMINISTRATOR);
        return bans.banAddress(address, reason, actor.username(), duration);
    }

    public boolean unbanAddress(String callerSessionId, String address) {
        authorize(callerSessionId, Role.ADMINISTRATOR);
        return bans.unbanAddress(address);
    }

    /** Bans a nickname and disconnects whoever currently holds it. */
    public NicknameBan banNickname(String callerSessionId, String nickname, String reason) {
        AccountRecord actor = authorize(callerSessionId, Role.ADMINISTRATOR);
        requireNotSelf(actor, nickname);
        NicknameBan ban = bans.banNickname(nickname, reason, actor.username());
        if (presence.latestLiveSession(ban.nickname()).isPresent()) {
            presence.kick(ban.nickname());
        }
        return ban;
    }

    public boolean unbanNickname(String callerSessionId, String nickname) {
        authorize(callerSessionId, Role.ADMINISTRATOR);
        return bans.unbanNickname(nickname);
    }

    public List<AddressBan> addressBans(String callerSessionId) {
        authorize(callerSessionId, Role.ADMINISTRATOR);
        return bans.addressBans();
    }

    public List<NicknameBan> nicknameBans(String callerSessionId) {
        authorize(callerSessionId, Role.ADMINISTRATOR);
        return bans.nicknameBans();
    }

    public void updateSettings(String callerSessionId, Map<String, String> values) {
        AccountRecord actor = authorize(callerSessionId, Role.ADMINISTRATOR);
        settings.update(values);
        logger.info("{} updated settings {}", actor.username(), values.keySet());
    }

    public List<SyntheticIdentity> syntheticUsers(String callerSessionId) {
        authorize(callerSessionId, Role.ADMINISTRATOR);
        return synthetic.list();
    }

    public SyntheticIdentity addSyntheticUser(String callerSessionId, String nickname, Integer age, String sex,
                                              String location, boolean active) {
        authorize(callerSessionId, Role.ADMINISTRATOR);
        return synthetic.add(nickname, age, sex, location, active);
    }

    public void setSyntheticUserActive(String callerSessionId, long id, boolean active) {
        authorize(callerSessionId, Role.ADMINISTRATOR);
        synthetic.setActive(id, active);
    }

    public void deleteSyntheticUser(String callerSessionId, long id) {
        authorize(callerSessionId, Role.ADMINISTRATOR);
        synthetic.delete(id);
    }

    private static void requireNotSelf(AccountRecord actor, String username) {
        if (username != null && username.trim().equalsIgnoreCase(actor.username())) {
            throw new ChatException.Validation("cannot moderate yourself");
        }
    }
}

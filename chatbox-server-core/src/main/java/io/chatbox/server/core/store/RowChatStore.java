package io.chatbox.server.core.store;

import io.chatbox.core.ChatException;
import io.chatbox.core.ChatMessage;
import io.chatbox.core.PrivateChatMessage;
import io.chatbox.core.Role;
import io.chatbox.json.spi.JsonCodec;
import io.chatbox.server.spi.AccountRecord;
import io.chatbox.server.spi.AddressBan;
import io.chatbox.server.spi.AttachmentRecord;
import io.chatbox.server.spi.ChatStore;
import io.chatbox.server.spi.ClaimOutcome;
import io.chatbox.server.spi.NewMessage;
import io.chatbox.server.spi.NewPrivateMessage;
import io.chatbox.server.spi.NicknameBan;
import io.chatbox.server.spi.SessionRecord;
import io.chatbox.server.spi.SyntheticIdentity;
import io.chatbox.server.spi.UrlList;

import java.nio.file.Path;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.Comparator;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.locks.ReentrantLock;
import java.util.function.Supplier;

/**
 * {@link ChatStore} over an ordered {@link RowStore}.
 *
 * <p>Table layout (one key prefix per table, numeric ids zero-padded):
 * <ul>
 *   <li>{@code session:<sessionId>} → {@link SessionRecord}</li>
 *   <li>{@code msg:<seq>} → {@link ChatMessage}, {@code msgid:<messageId>} → seq</li>
 *   <li>{@code pm:<id>} → {@link PrivateChatMessage}</li>
 *   <li>{@code att:<ref>}, {@code acct:<id>}, {@code acctname:<lower>}, {@code setting:<key>},
 *       {@code url:<list>:<pattern>}, {@code ban:addr:<address>}, {@code ban:nick:<lower>},
 *       {@code synthetic:<id>}, {@code seq:<name>}</li>
 * </ul>
 *
 * <p>Writes are serialized by one lock, which makes every compound operation atomic. Reads go straight to the
 * row store.
 */
public final class RowChatStore implements ChatStore {

    private static final String SESSION = "session:";
    private static final String MSG = "msg:";
    private static final String MSG_ID = "msgid:";
    private static final String PM = "pm:";
    private static final String ATT = "att:";
    private static final String ACCT = "acct:";
    private static final String ACCT_NAME = "acctname:";
    private static final String SETTING = "setting:";
    private static final String URL = "url:";
    private static final String BAN_ADDR = "ban:addr:";
    private static final String BAN_NICK = "ban:nick:";
    private static final String SYNTHETIC = "synthetic:";
    private static final String SEQ = "seq:";

    private final RowStore rows;
    private final ReentrantLock writeLock = new ReentrantLock();

    public RowChatStore(RowStore rows) {
        this.rows = Objects.requireNonNull(rows, "rows");
    }

    public static RowChatStore inMemory() {
        return new RowChatStore(new InMemoryRowStore());
    }

    public static RowChatStore rocksDb(Path baseDir, JsonCodec codec) {
        return new RowChatStore(new RocksDbRowStore(baseDir, codec));
    }

    @Override
    public void ping() {
        rows.ping();
    }

    @Override
    public void close() {
        rows.close();
    }

    // ===== Sessions =====

    @Override
    public ClaimOutcome claimSession(SessionRecord candidate, Instant liveSince, boolean allowShared) {
        Objects.requireNonNull(candidate, "candidate");
        return locked(() -> {
            if (!allowShared) {
                for (SessionRecord holder : sessionsForUsername(candidate.username())) {
                    if (!holder.sessionId().equals(candidate.sessionId()) && holder.isLive(liveSince)) {
                        return new ClaimOutcome(ClaimOutcome.Status.CONFLICT, holder);
                    }
                }
            }
            Optional<SessionRecord> existing = rows.get(SESSION + candidate.sessionId(), SessionRecord.class);
            SessionRecord stored = candidate;
            ClaimOutcome.Status status = ClaimOutcome.Status.CREATED;
            if (existing.isPresent()) {
                status = ClaimOutcome.Status.REFRESHED;
                if (sameName(existing.get().username(), candidate.username())) {
                    stored = new SessionRecord(candidate.sessionId(), candidate.username(), candidate.originAddress(),
                            candidate.accountId(), candidate.role(), existing.get().joinedAt(),
                            candidate.lastHeartbeat(), candidate.profile());
                }
            }
            rows.put(SESSION + stored.sessionId(), stored);
            return new ClaimOutcome(status, stored);
        });
    }

    @Override
    public Optional<SessionRecord> findSession(String sessionId) {
        return rows.get(SESSION + sessionId, SessionRecord.class);
    }

    @Override
    public List<SessionRecord> sessionsForUsername(String username) {
        List<SessionRecord> out = new ArrayList<>();
        for (SessionRecord s : rows.scan(SESSION, SessionRecord.class)) {
            if (sameName(s.username(), username)) out.add(s);
        }
        return out;
    }

    @Override
    public boolean touchSession(String username, String sessionId, Instant now, Instant liveSince) {
        return locked(() -> {
            Optional<SessionRecord> existing = rows.get(SESSION + sessionId, SessionRecord.class);
            if (existing.isEmpty() || !sameName(existing.get().username(), username)
                    || !existing.get().isLive(liveSince)) {
                return false;
            }
            rows.put(SESSION + sessionId, existing.get().withHeartbeat(now));
            return true;
        });
    }

    @Override
    public List<SessionRecord> liveSessions(Instant liveSince) {
        List<SessionRecord> out = new ArrayList<>();
        for (SessionRecord s : rows.scan(SESSION, SessionRecord.class)) {
            if (s.isLive(liveSince)) out.add(s);
        }
        return out;
    }

    @Override
    public List<SessionRecord> deleteSessionsIdleSince(Instant threshold) {
        return locked(() -> {
            List<SessionRecord> removed = new ArrayList<>();
            for (SessionRecord s : rows.scan(SESSION, SessionRecord.class)) {
                // re-read: a heartbeat may have landed since the scan
                Optional<SessionRecord> current = rows.get(SESSION + s.sessionId(), SessionRecord.class);
                if (current.isPresent() && current.get().lastHeartbeat().isBefore(threshold)) {
                    rows.delete(SESSION + s.sessionId());
                    removed.add(current.get());
                }
            }
            return removed;
        });
    }

    @Override
    public Optional<SessionRecord> deleteSession(String sessionId) {
        return locked(() -> {
            Optional<SessionRecord> existing = rows.get(SESSION + sessionId, SessionRecord.class);
            existing.ifPresent(s -> rows.delete(SESSION + sessionId));
            return existing;
        });
    }

    @Override
    public List<SessionRecord> deleteSessionsForUsername(String username) {
        return locked(() -> {
            List<SessionRecord> removed = sessionsForUsername(username);
            for (SessionRecord s : removed) {
                rows.delete(SESSION + s.sessionId());
            }
            return removed;
        });
    }

    // ===== Public messages =====

    @Override
    public ChatMessage appendMessage(NewMessage m) {
        Objects.requireNonNull(m, "message");
        return locked(() -> {
            if (rows.get(MSG_ID + m.messageId(), Long.class).isPresent()) {
                throw new ChatException.Conflict("duplicate message id " + m.messageId());
            }
            long seq = nextId("messages");
            ChatMessage stored = new ChatMessage(seq, m.messageId(), m.username(), m.accountId(), m.text(),
                    m.replyTo(), m.replyPreview(), m.originAddress(), m.createdAt(), false);
            rows.put(msgKey(seq), stored);
            rows.put(MSG_ID + m.messageId(), seq);
            return stored;
        });
    }

    @Override
    public Optional<ChatMessage> findMessage(String messageId) {
        return rows.get(MSG_ID + messageId, Long.class).flatMap(seq -> rows.get(msgKey(seq), ChatMessage.class));
    }

    @Override
    public List<ChatMessage> recentMessages(int limit) {
        List<ChatMessage> newestFirst = rows.scanDescending(MSG, ChatMessage.class, limit, m -> !m.deleted());
        List<ChatMessage> out = new ArrayList<>(newestFirst);
        Collections.reverse(out);
        return out;
    }

    @Override
    public List<ChatMessage> messagesAfter(long sequenceId, int limit) {
        return rows.scanAfter(MSG, msgKey(Math.max(0, sequenceId)), ChatMessage.class, limit, m -> !m.deleted());
    }

    @Override
    public long latestSequence() {
        return rows.get(SEQ + "messages", Long.class).orElse(0L);
    }

    @Override
    public Set<Long> deletedAmong(Collection<Long> sequenceIds) {
        Set<Long> out = new HashSet<>();
        for (Long seq : sequenceIds) {
            Optional<ChatMessage> row = rows.get(msgKey(seq), ChatMessage.class);
            if (row.isEmpty() || row.get().deleted()) out.add(seq);
        }
        return out;
    }

    @Override
    public boolean softDeleteMessage(String messageId) {
        return locked(() -> {
            Optional<ChatMessage> existing = findMessage(messageId);
            if (existing.isEmpty() || existing.get().deleted()) {
                return false;
            }
            rows.put(msgKey(existing.get().sequenceId()), existing.get().markDeleted());
            return true;
        });
    }

    @Override
    public int softDeleteAllMessages() {
        return locked(() -> {
            int n = 0;
            for (ChatMessage m : rows.scan(MSG, ChatMessage.class)) {
                if (!m.deleted()) {
                    rows.put(msgKey(m.sequenceId()), m.markDeleted());
                    n++;
                }
            }
            return n;
        });
    }

    @Override
    public List<ChatMessage> listMessages(int limit, int offset) {
        List<ChatMessage> page = rows.scanDescending(MSG, ChatMessage.class, offset + limit, m -> true);
        return page.size() <= offset ? List.of() : List.copyOf(page.subList(offset, page.size()));
    }

    @Override
    public long countMessages() {
        return rows.scan(MSG, ChatMessage.class).size();
    }

    @Override
    public int purgeDeletedMessagesBefore(Instant threshold) {
        return locked(() -> {
            int n = 0;
            for (ChatMessage m : rows.scan(MSG, ChatMessage.class)) {
                if (m.deleted() && m.createdAt().isBefore(threshold)) {
                    rows.delete(msgKey(m.sequenceId()));
                    rows.delete(MSG_ID + m.messageId());
                    n++;
                }
            }
            return n;
        });
    }

    // ===== Private messages =====

    @Override
    public PrivateChatMessage appendPrivateMessage(NewPrivateMessage m) {
        Objects.requireNonNull(m, "message");
        return locked(() -> {
            AttachmentRecord attachment = null;
            if (m.attachmentRef() != null) {
                attachment = findAttachment(m.attachmentRef())
                        .filter(a -> a.messageId() == null)
                        .orElseThrow(() -> new ChatException.Conflict(
                                "attachment " + m.attachmentRef() + " is missing or already attached"));
            }
            long id = nextId("private_messages");
            PrivateChatMessage stored = new PrivateChatMessage(id, m.fromUsername(), m.fromSessionId(),
                    m.fromAccountId(), m.toUsername(), m.toSessionId(), m.toAccountId(), m.text(),
                    m.attachmentRef(), m.createdAt(), null);
            rows.put(pmKey(id), stored);
            if (attachment != null) {
                rows.put(ATT + attachment.ref(), attachment.linkedTo(id));
            }
            return stored;
        });
    }

    @Override
    public Optional<PrivateChatMessage> findPrivateMessage(long id) {
        return rows.get(pmKey(id), PrivateChatMessage.class);
    }

    @Override
    public List<PrivateChatMessage> conversation(String username, String sessionId, String withUsername, int limit) {
        List<PrivateChatMessage> newestFirst = rows.scanDescending(PM, PrivateChatMessage.class, limit, pm ->
                (pm.isFrom(username, sessionId) && sameName(pm.toUsername(), withUsername))
                        || (sameName(pm.fromUsername(), withUsername) && pm.isTo(username, sessionId)));
        List<PrivateChatMessage> out = new ArrayList<>(newestFirst);
        Collections.reverse(out);
        return out;
    }

    @Override
    public List<PrivateChatMessage> recentPrivateMessages(String username, String sessionId, int limit) {
        List<PrivateChatMessage> newestFirst = rows.scanDescending(PM, PrivateChatMessage.class, limit,
                pm -> pm.involves(username, sessionId));
        List<PrivateChatMessage> out = new ArrayList<>(newestFirst);
        Collections.reverse(out);
        return out;
    }

    @Override
    public int markPrivateMessagesRead(String username, String sessionId, String fromUsername, Instant at) {
        return locked(() -> {
            int n = 0;
            for (PrivateChatMessage pm : rows.scan(PM, PrivateChatMessage.class)) {
                if (pm.readAt() == null && pm.isTo(username, sessionId) && sameName(pm.fromUsername(), fromUsername)) {
                    rows.put(pmKey(pm.id()), pm.withReadAt(at));
                    n++;
                }
            }
            return n;
        });
    }

    // ===== Attachments =====

    @Override
    public void putAttachment(AttachmentRecord attachment) {
        locked(() -> {
            rows.put(ATT + attachment.ref(), attachment);
            return null;
        });
    }

    @Override
    public Optional<AttachmentRecord> findAttachment(String ref) {
        return rows.get(ATT + ref, AttachmentRecord.class);
    }

    @Override
    public List<AttachmentRecord> deleteAttachmentsExpiredBefore(Instant now) {
        return locked(() -> {
            List<AttachmentRecord> removed = new ArrayList<>();
            for (AttachmentRecord a : rows.scan(ATT, AttachmentRecord.class)) {
                if (a.isExpired(now)) {
                    rows.delete(ATT + a.ref());
                    removed.add(a);
                }
            }
            return removed;
        });
    }

    // ===== Accounts =====

    @Override
    public AccountRecord createAccount(String username, String displayName, String email, Role role,
                                       String passwordHash, Instant now) {
        return locked(() -> {
            if (rows.get(ACCT_NAME + lower(username), Long.class).isPresent()) {
                throw new ChatException.Conflict("account already exists: " + username);
            }
            long id = nextId("accounts");
            AccountRecord account = new AccountRecord(id, username, displayName, email, role, passwordHash, true,
                    now, null);
            rows.put(idKey(ACCT, id), account);
            rows.put(ACCT_NAME + lower(username), id);
            return account;
        });
    }

    @Override
    public Optional<AccountRecord> findAccount(long id) {
        return rows.get(idKey(ACCT, id), AccountRecord.class);
    }

    @Override
    public Optional<AccountRecord> findAccountByUsername(String username) {
        return rows.get(ACCT_NAME + lower(username), Long.class).flatMap(this::findAccount);
    }

    @Override
    public List<AccountRecord> accounts() {
        return rows.scan(ACCT, AccountRecord.class);
    }

    @Override
    public void updateAccount(AccountRecord account) {
        locked(() -> {
            if (findAccount(account.id()).isEmpty()) {
                throw new ChatException.NotFound("no account " + account.id());
            }
            rows.put(idKey(ACCT, account.id()), account);
            return null;
        });
    }

    // ===== Settings =====

    @Override
    public Map<String, String> settings() {
        Map<String, String> out = new LinkedHashMap<>();
        for (SettingRow row : rows.scan(SETTING, SettingRow.class)) {
            out.put(row.key(), row.value());
        }
        return out;
    }

    @Override
    public void putSettings(Map<String, String> values) {
        locked(() -> {
            values.forEach((k, v) -> rows.put(SETTING + k, new SettingRow(k, v)));
            return null;
        });
    }

    @Override
    public List<String> urlPatterns(UrlList list) {
        return rows.scan(urlPrefix(list), String.class);
    }

    @Override
    public boolean addUrlPattern(UrlList list, String pattern) {
        String normalized = lower(pattern.trim());
        return locked(() -> {
            String key = urlPrefix(list) + normalized;
            if (rows.get(key, String.class).isPresent()) return false;
            rows.put(key, normalized);
            return true;
        });
    }

    @Override
    public boolean removeUrlPattern(UrlList list, String pattern) {
        return locked(() -> rows.delete(urlPrefix(list) + lower(pattern.trim())));
    }

    // ===== Bans =====

    @Override
    public void putAddressBan(AddressBan ban) {
        locked(() -> {
            rows.put(BAN_ADDR + ban.originAddress(), ban);
            return null;
        });
    }

    @Override
    public Optional<AddressBan> findAddressBan(String originAddress, Instant now) {
        if (originAddress == null) return Optional.empty();
        return rows.get(BAN_ADDR + originAddress, AddressBan.class).filter(b -> b.isActive(now));
    }

    @Override
    public boolean removeAddressBan(String originAddress) {
        return locked(() -> rows.delete(BAN_ADDR + originAddress));
    }

    @Override
    public List<AddressBan> addressBans() {
        return rows.scan(BAN_ADDR, AddressBan.class);
    }

    @Override
    public int deleteAddressBansExpiredBefore(Instant now) {
        return locked(() -> {
            int n = 0;
            for (AddressBan ban : rows.scan(BAN_ADDR, AddressBan.class)) {
                if (!ban.isActive(now)) {
                    rows.delete(BAN_ADDR + ban.originAddress());
                    n++;
                }
            }
            return n;
        });
    }

    @Override
    public void putNicknameBan(NicknameBan ban) {
        locked(() -> {
            rows.put(BAN_NICK + lower(ban.nickname()), ban);
            return null;
        });
    }

    @Override
    public Optional<NicknameBan> findNicknameBan(String nickname) {
        return rows.get(BAN_NICK + lower(nickname), NicknameBan.class);
    }

    @Override
    public boolean removeNicknameBan(String nickname) {
        return locked(() -> rows.delete(BAN_NICK + lower(nickname)));
    }

    @Override
    public List<NicknameBan> nicknameBans() {
        return rows.scan(BAN_NICK, NicknameBan.class);
    }

    // ===== Synthetic identities =====

    @Override
    public SyntheticIdentity createSyntheticIdentity(String nickname, Integer age, String sex, String location,
                                                     boolean active) {
        return locked(() -> {
            boolean taken = rows.scan(SYNTHETIC, SyntheticIdentity.class).stream()
                    .anyMatch(s -> sameName(s.nickname(), nickname));
            if (taken) {
                throw new ChatException.Conflict("synthetic identity already exists: " + nickname);
            }
            long id = nextId("synthetic");
            SyntheticIdentity identity = new SyntheticIdentity(id, nickname, age, sex, location, active);
            rows.put(idKey(SYNTHETIC, id), identity);
            return identity;
        });
    }

    @Override
    public Optional<SyntheticIdentity> findSyntheticIdentity(long id) {
        return rows.get(idKey(SYNTHETIC, id), SyntheticIdentity.class);
    }

    @Override
    public List<SyntheticIdentity> syntheticIdentities() {
        List<SyntheticIdentity> out = new ArrayList<>(rows.scan(SYNTHETIC, SyntheticIdentity.class));
        out.sort(Comparator.comparingLong(SyntheticIdentity::id));
        return out;
    }

    @Override
    public boolean setSyntheticIdentityActive(long id, boolean active) {
        return locked(() -> {
            Optional<SyntheticIdentity> existing = findSyntheticIdentity(id);
            if (existing.isEmpty()) return false;
            rows.put(idKey(SYNTHETIC, id), existing.get().withActive(active));
            return true;
        });
    }

    @Override
    public boolean deleteSyntheticIdentity(long id) {
        return locked(() -> rows.delete(idKey(SYNTHETIC, id)));
    }

    // ===== internals =====

    /** Stored setting row; key kept alongside the value so a prefix scan yields both. */
    public record SettingRow(String key, String value) {}

    private long nextId(String name) {
        long next = rows.get(SEQ + name, Long.class).orElse(0L) + 1;
        rows.put(SEQ + name, next);
        return next;
    }

    private <T> T locked(Supplier<T> action) {
        writeLock.lock();
        try {
            return action.get();
        } finally {
            writeLock.unlock();
        }
    }

    private static String msgKey(long seq) {
        return idKey(MSG, seq);
    }

    private static String pmKey(long id) {
        return idKey(PM, id);
    }

    private static String idKey(String prefix, long id) {
        return prefix + String.format(Locale.ROOT, "%019d", id);
    }

    private static String urlPrefix(UrlList list) {
        return URL + list.name().toLowerCase(Locale.ROOT) + ":";
    }

    private static boolean sameName(String a, String b) {
        return a != null && a.equalsIgnoreCase(b);
    }

    private static String lower(String s) {
        return s.toLowerCase(Locale.ROOT);
    }
}

package io.chatbox.server.spi;

import io.chatbox.core.ChatMessage;
import io.chatbox.core.PrivateChatMessage;
import io.chatbox.core.Role;

import java.time.Instant;
import java.util.Collection;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

/**
 * Durable store SPI.
 *
 * <p>Implementations must be thread-safe. Compound operations ({@link #claimSession}, {@link #touchSession},
 * {@link #deleteSessionsIdleSince}, {@link #appendPrivateMessage}) are atomic with respect to each other. A store that
 * cannot be reached throws {@link io.chatbox.core.ChatException.TransientStore}.
 *
 * <p>Username comparisons are case-insensitive throughout.
 */
public interface ChatStore extends AutoCloseable {

    /** Verifies the store is reachable. */
    void ping();

    // ===== Sessions =====

    /**
     * Atomically binds {@code candidate.username()} to {@code candidate.sessionId()}.
     *
     * <p>Another session holding the same username with a heartbeat at or after {@code liveSince} causes
     * {@link ClaimOutcome.Status#CONFLICT} unless {@code allowShared}. Otherwise the row keyed by session id is
     * upserted, keeping the original {@code joinedAt} when the session already held the same username.
     */
    ClaimOutcome claimSession(SessionRecord candidate, Instant liveSince, boolean allowShared);

    Optional<SessionRecord> findSession(String sessionId);

    List<SessionRecord> sessionsForUsername(String username);

    /**
     * Refreshes the heartbeat only when a row for exactly this (username, session) exists and is still live at
     * {@code liveSince}. An expired row stays expired until the sweep removes it.
     */
    boolean touchSession(String username, String sessionId, Instant now, Instant liveSince);

    List<SessionRecord> liveSessions(Instant liveSince);

    /** Deletes and returns rows whose heartbeat is strictly before {@code threshold}, re-checked per row. */
    List<SessionRecord> deleteSessionsIdleSince(Instant threshold);

    Optional<SessionRecord> deleteSession(String sessionId);

    List<SessionRecord> deleteSessionsForUsername(String username);

    // ===== Public messages =====

    /** Persists the message and assigns the next sequence id. */
    ChatMessage appendMessage(NewMessage message);

    Optional<ChatMessage> findMessage(String messageId);

    /** Newest {@code limit} non-deleted messages, oldest first. */
    List<ChatMessage> recentMessages(int limit);

    /** Non-deleted messages with sequence id greater than {@code sequenceId}, oldest first. */
    List<ChatMessage> messagesAfter(long sequenceId, int limit);

    /** Highest sequence id ever assigned, deleted rows included; 0 when empty. */
    long latestSequence();

    /** Returns those of {@code sequenceIds} that are soft-deleted or unknown to the store. */
    Set<Long> deletedAmong(Collection<Long> sequenceIds);

    boolean softDeleteMessage(String messageId);

    int softDeleteAllMessages();

    /** All rows, deleted included, newest first. */
    List<ChatMessage> listMessages(int limit, int offset);

    long countMessages();

    int purgeDeletedMessagesBefore(Instant threshold);

    // ===== Private messages =====

    /**
     * Stores a private message. When it carries an attachment reference, the attachment is linked to the new row in
     * the same atomic step.
     *
     * @throws io.chatbox.core.ChatException.Conflict when the attachment is missing or already linked; nothing is
     *         stored
     */
    PrivateChatMessage appendPrivateMessage(NewPrivateMessage message);

    Optional<PrivateChatMessage> findPrivateMessage(long id);

    /**
     * Rows where ({@code username}, {@code sessionId}) sent to {@code withUsername}, or {@code withUsername} sent
     * to ({@code username}, {@code sessionId}); oldest first.
     */
    List<PrivateChatMessage> conversation(String username, String sessionId, String withUsername, int limit);

    /** Newest {@code limit} rows involving ({@code username}, {@code sessionId}), oldest first. */
    List<PrivateChatMessage> recentPrivateMessages(String username, String sessionId, int limit);

    int markPrivateMessagesRead(String username, String sessionId, String fromUsername, Instant at);

    // ===== Attachments =====

    void putAttachment(AttachmentRecord attachment);

    Optional<AttachmentRecord> findAttachment(String ref);

    List<AttachmentRecord> deleteAttachmentsExpiredBefore(Instant now);

    // ===== Accounts =====

    /** Creates an account; throws {@link io.chatbox.core.ChatException.Conflict} when the username exists. */
    AccountRecord createAccount(String username, String displayName, String email, Role role, String passwordHash,
                                Instant now);

    Optional<AccountRecord> findAccount(long id);

    Optional<AccountRecord> findAccountByUsername(String username);

    List<AccountRecord> accounts();

    void updateAccount(AccountRecord account);

    // ===== Settings =====

    Map<String, String> settings();

    void putSettings(Map<String, String> values);

    List<String> urlPatterns(UrlList list);

    boolean addUrlPattern(UrlList list, String pattern);

    boolean removeUrlPattern(UrlList list, String pattern);

    // ===== Bans =====

    void putAddressBan(AddressBan ban);

    /** Active ban for the address, ignoring expired rows. */
    Optional<AddressBan> findAddressBan(String originAddress, Instant now);

    boolean removeAddressBan(String originAddress);

    List<AddressBan> addressBans();

    int deleteAddressBansExpiredBefore(Instant now);

    void putNicknameBan(NicknameBan ban);

    Optional<NicknameBan> findNicknameBan(String nickname);

    boolean removeNicknameBan(String nickname);

    List<NicknameBan> nicknameBans();

    // ===== Synthetic identities =====

    SyntheticIdentity createSyntheticIdentity(String nickname, Integer age, String sex, String location, boolean active);

    Optional<SyntheticIdentity> findSyntheticIdentity(long id);

    List<SyntheticIdentity> syntheticIdentities();

    boolean setSyntheticIdentityActive(long id, boolean active);

    boolean deleteSyntheticIdentity(long id);

    @Override
    default void close() {
    }
}

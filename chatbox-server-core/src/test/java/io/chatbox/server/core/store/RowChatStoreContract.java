package io.chatbox.server.core.store;

import io.chatbox.core.ChatException;
import io.chatbox.core.ChatMessage;
import io.chatbox.core.PrivateChatMessage;
import io.chatbox.core.Profile;
import io.chatbox.core.Role;
import io.chatbox.server.spi.AccountRecord;
import io.chatbox.server.spi.AddressBan;
import io.chatbox.server.spi.AttachmentRecord;
import io.chatbox.server.spi.ClaimOutcome;
import io.chatbox.server.spi.NewMessage;
import io.chatbox.server.spi.NewPrivateMessage;
import io.chatbox.server.spi.SessionRecord;
import io.chatbox.server.spi.UrlList;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

/**
 * Behaviour shared by every {@link RowChatStore} backend.
 */
abstract class RowChatStoreContract {

    static final Instant T0 = Instant.parse("2026-03-01T12:00:00Z");

    RowChatStore store;

    abstract RowChatStore newStore() throws Exception;

    @BeforeEach
    void openStore() throws Exception {
        store = newStore();
    }

    @AfterEach
    void closeStore() {
        store.close();
    }

    @Test
    void claimRejectsSecondLiveSessionAndAcceptsTheHolderAgain() {
        assertThat(store.claimSession(session("s1", "alice", T0), T0.minusSeconds(300), false).status())
                .isEqualTo(ClaimOutcome.Status.CREATED);

        ClaimOutcome other = store.claimSession(session("s2", "ALICE", T0), T0.minusSeconds(300), false);
        assertThat(other.status()).isEqualTo(ClaimOutcome.Status.CONFLICT);
        assertThat(other.session().sessionId()).isEqualTo("s1");

        ClaimOutcome again = store.claimSession(session("s1", "alice", T0.plusSeconds(10)), T0.minusSeconds(300), false);
        assertThat(again.status()).isEqualTo(ClaimOutcome.Status.REFRESHED);
        assertThat(again.session().joinedAt()).isEqualTo(T0);
        assertThat(again.session().lastHeartbeat()).isEqualTo(T0.plusSeconds(10));
    }

    @Test
    void staleHolderDoesNotBlockAClaim() {
        store.claimSession(session("s1", "alice", T0), T0.minusSeconds(300), false);

        Instant later = T0.plus(Duration.ofMinutes(10));
        ClaimOutcome outcome = store.claimSession(session("s2", "alice", later), later.minusSeconds(300), false);

        assertThat(outcome.succeeded()).isTrue();
    }

    @Test
    void sharedClaimLetsSeveralSessionsHoldOneName() {
        store.claimSession(session("a", "root", T0), T0.minusSeconds(300), true);
        ClaimOutcome second = store.claimSession(session("b", "root", T0), T0.minusSeconds(300), true);

        assertThat(second.succeeded()).isTrue();
        assertThat(store.sessionsForUsername("root")).hasSize(2);
    }

    @Test
    void touchRequiresTheExactPair() {
        store.claimSession(session("s1", "alice", T0), T0.minusSeconds(300), false);

        assertThat(store.touchSession("bob", "s1", T0.plusSeconds(5), T0.minusSeconds(295))).isFalse();
        assertThat(store.touchSession("Alice", "s1", T0.plusSeconds(5), T0.minusSeconds(295))).isTrue();
        assertThat(store.findSession("s1")).get().extracting(SessionRecord::lastHeartbeat)
                .isEqualTo(T0.plusSeconds(5));
    }

    @Test
    void touchLeavesAnExpiredRowExpired() {
        store.claimSession(session("s1", "alice", T0), T0.minusSeconds(300), false);
        Instant later = T0.plusSeconds(360);

        assertThat(store.touchSession("alice", "s1", later, later.minusSeconds(300))).isFalse();
        assertThat(store.findSession("s1")).get().extracting(SessionRecord::lastHeartbeat).isEqualTo(T0);
        assertThat(store.liveSessions(later.minusSeconds(300))).isEmpty();
    }

    @Test
    void idleSweepRemovesOnlyStaleRows() {
        store.claimSession(session("old", "carol", T0), T0.minusSeconds(300), false);
        store.claimSession(session("new", "dave", T0.plusSeconds(400)), T0, false);

        List<SessionRecord> removed = store.deleteSessionsIdleSince(T0.plusSeconds(100));

        assertThat(removed).extracting(SessionRecord::sessionId).containsExactly("old");
        assertThat(store.findSession("new")).isPresent();
    }

    @Test
    void messagesGetIncreasingSequenceIds() {
        ChatMessage a = store.appendMessage(message("m1", "first"));
        ChatMessage b = store.appendMessage(message("m2", "second"));
        ChatMessage c = store.appendMessage(message("m3", "third"));

        assertThat(List.of(a.sequenceId(), b.sequenceId(), c.sequenceId())).isSorted().doesNotHaveDuplicates();
        assertThat(store.recentMessages(2)).extracting(ChatMessage::messageId).containsExactly("m2", "m3");
        assertThat(store.messagesAfter(a.sequenceId(), 10)).extracting(ChatMessage::messageId)
                .containsExactly("m2", "m3");
        assertThat(store.latestSequence()).isEqualTo(c.sequenceId());
    }

    @Test
    void duplicateMessageIdIsRejected() {
        store.appendMessage(message("m1", "first"));

        assertThatThrownBy(() -> store.appendMessage(message("m1", "again")))
                .isInstanceOf(ChatException.Conflict.class);
    }

    @Test
    void softDeletedMessagesDisappearFromReadsButKeepTheirSequence() {
        ChatMessage a = store.appendMessage(message("m1", "keep"));
        ChatMessage b = store.appendMessage(message("m2", "drop"));

        assertThat(store.softDeleteMessage("m2")).isTrue();
        assertThat(store.softDeleteMessage("m2")).isFalse();

        assertThat(store.recentMessages(10)).extracting(ChatMessage::messageId).containsExactly("m1");
        assertThat(store.messagesAfter(0, 10)).extracting(ChatMessage::messageId).containsExactly("m1");
        assertThat(store.latestSequence()).isEqualTo(b.sequenceId());
        assertThat(store.deletedAmong(List.of(a.sequenceId(), b.sequenceId(), 999L)))
                .containsExactlyInAnyOrder(b.sequenceId(), 999L);
        assertThat(store.listMessages(10, 0)).hasSize(2);
        assertThat(store.countMessages()).isEqualTo(2);
    }

    @Test
    void purgeRemovesOldDeletedRows() {
        store.appendMessage(message("m1", "x"));
        store.softDeleteAllMessages();

        assertThat(store.purgeDeletedMessagesBefore(T0.plusSeconds(1))).isEqualTo(1);
        assertThat(store.countMessages()).isZero();
        assertThat(store.findMessage("m1")).isEmpty();
    }

    @Test
    void privateConversationIsScopedToTheSession() {
        store.appendPrivateMessage(pm("alice", "a1", "bob", "b1", "to old bob"));
        store.appendPrivateMessage(pm("bob", "b1", "alice", "a1", "reply"));
        store.appendPrivateMessage(pm("alice", "a1", "bob", "b2", "to new bob"));

        List<PrivateChatMessage> newBob = store.conversation("bob", "b2", "alice", 50);
        assertThat(newBob).extracting(PrivateChatMessage::text).containsExactly("to new bob");

        List<PrivateChatMessage> alice = store.conversation("alice", "a1", "bob", 50);
        assertThat(alice).extracting(PrivateChatMessage::text).containsExactly("to old bob", "reply", "to new bob");

        assertThat(store.markPrivateMessagesRead("bob", "b1", "alice", T0)).isEqualTo(1);
        assertThat(store.recentPrivateMessages("bob", "b1", 10)).hasSize(2);
    }

    @Test
    void attachmentLinksOnlyOnce() {
        store.putAttachment(new AttachmentRecord("att_1", "/tmp/x", 3, "image/png", "alice", "a1", T0,
                T0.plusSeconds(60), null));

        PrivateChatMessage first = store.appendPrivateMessage(withAttachment("att_1"));
        assertThat(store.findAttachment("att_1")).get().extracting(AttachmentRecord::messageId)
                .isEqualTo(first.id());

        assertThatThrownBy(() -> store.appendPrivateMessage(withAttachment("att_1")))
                .isInstanceOf(ChatException.Conflict.class);
        assertThatThrownBy(() -> store.appendPrivateMessage(withAttachment("att_missing")))
                .isInstanceOf(ChatException.Conflict.class);
        assertThat(store.conversation("alice", "a1", "bob", 50)).extracting(PrivateChatMessage::id)
                .containsExactly(first.id());

        assertThat(store.deleteAttachmentsExpiredBefore(T0.plusSeconds(61))).hasSize(1);
        assertThat(store.findAttachment("att_1")).isEmpty();
    }

    @Test
    void accountNamesAreUniqueIgnoringCase() {
        AccountRecord created = store.createAccount("Mod", "The Mod", null, Role.MODERATOR, "hash", T0);

        assertThat(store.findAccountByUsername("mod")).get().extracting(AccountRecord::id).isEqualTo(created.id());
        assertThatThrownBy(() -> store.createAccount("MOD", null, null, Role.SIMPLE_USER, "hash", T0))
                .isInstanceOf(ChatException.Conflict.class);
    }

    @Test
    void expiredAddressBansAreIgnoredAndSwept() {
        store.putAddressBan(new AddressBan("10.0.0.1", "spam", "system", T0, T0.plusSeconds(60)));
        store.putAddressBan(new AddressBan("10.0.0.2", "abuse", "admin", T0, null));

        assertThat(store.findAddressBan("10.0.0.1", T0.plusSeconds(30))).isPresent();
        assertThat(store.findAddressBan("10.0.0.1", T0.plusSeconds(61))).isEmpty();
        assertThat(store.deleteAddressBansExpiredBefore(T0.plusSeconds(61))).isEqualTo(1);
        assertThat(store.addressBans()).extracting(AddressBan::originAddress).containsExactly("10.0.0.2");
    }

    @Test
    void settingsAndUrlListsPersist() {
        store.putSettings(Map.of("chat_mode", "both"));
        assertThat(store.addUrlPattern(UrlList.WHITELIST, "example.com")).isTrue();
        assertThat(store.addUrlPattern(UrlList.WHITELIST, "example.com")).isFalse();

        assertThat(store.settings()).containsEntry("chat_mode", "both");
        assertThat(store.urlPatterns(UrlList.WHITELIST)).containsExactly("example.com");
        assertThat(store.urlPatterns(UrlList.BLACKLIST)).isEmpty();
    }

    @Test
    void syntheticIdentitiesCanBeToggled() {
        long id = store.createSyntheticIdentity("Luna", 25, "f", "Paris", false).id();

        assertThat(store.setSyntheticIdentityActive(id, true)).isTrue();
        assertThat(store.findSyntheticIdentity(id)).get().matches(s -> s.active());
        assertThat(store.deleteSyntheticIdentity(id)).isTrue();
        assertThat(store.syntheticIdentities()).isEmpty();
    }

    static SessionRecord session(String sessionId, String username, Instant at) {
        return new SessionRecord(sessionId, username, "127.0.0.1", null, Role.SIMPLE_USER, at, at, Profile.empty());
    }

    static NewMessage message(String id, String text) {
        return new NewMessage(id, "alice", null, text, null, null, "127.0.0.1", T0);
    }

    static NewPrivateMessage withAttachment(String ref) {
        return new NewPrivateMessage("alice", "a1", null, "bob", "b1", null, null, ref, T0);
    }

    static NewPrivateMessage pm(String from, String fromSid, String to, String toSid, String text) {
        return new NewPrivateMessage(from, fromSid, null, to, toSid, null, text, null, T0);
    }
}

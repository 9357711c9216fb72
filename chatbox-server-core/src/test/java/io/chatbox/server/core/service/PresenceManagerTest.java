package io.chatbox.server.core.service;

import io.chatbox.core.ChatEvent;
import io.chatbox.core.ChatException;
import io.chatbox.core.Profile;
import io.chatbox.core.Role;
import io.chatbox.core.RosterEntry;
import io.chatbox.core.RosterSnapshot;
import io.chatbox.server.core.ChatEngine;
import io.chatbox.server.core.MutableClock;
import io.chatbox.server.core.TestEngines;
import io.chatbox.server.spi.AccountRecord;
import io.chatbox.server.spi.SessionRecord;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.concurrent.Callable;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class PresenceManagerTest {

    private MutableClock clock;
    private ChatEngine engine;
    private PresenceManager presence;

    @BeforeEach
    void setUp() {
        clock = MutableClock.startingAt("2026-03-01T12:00:00Z");
        engine = TestEngines.inMemory(clock);
        presence = engine.presence();
    }

    @Test
    void secondSessionCannotTakeALiveNickname() {
        presence.register("Alice", "S1", "10.0.0.1", null);

        assertThatThrownBy(() -> presence.register("alice", "S2", "10.0.0.2", null))
                .isInstanceOf(ChatException.Conflict.class);

        SessionRecord again = presence.register("Alice", "S1", "10.0.0.1", null);
        assertThat(again.sessionId()).isEqualTo("S1");
        assertThat(presence.roster().users()).extracting(RosterEntry::username).containsExactly("Alice");
    }

    @Test
    void expiredHolderReleasesTheNickname() {
        presence.register("alice", "S1", "10.0.0.1", null);
        clock.advance(Duration.ofMinutes(6));

        assertThat(presence.register("alice", "S2", "10.0.0.2", null).sessionId()).isEqualTo("S2");
    }

    @Test
    void heartbeatKeepsTheSessionLive() {
        presence.register("alice", "S1", "10.0.0.1", null);
        clock.advance(Duration.ofMinutes(4));
        assertThat(presence.heartbeat("alice", "S1")).isTrue();
        clock.advance(Duration.ofMinutes(4));

        assertThatThrownBy(() -> presence.register("alice", "S2", "10.0.0.2", null))
                .isInstanceOf(ChatException.Conflict.class);
        assertThat(presence.heartbeat("alice", "other")).isFalse();
    }

    @Test
    void heartbeatCannotReviveAnExpiredSession() {
        presence.register("alice", "S1", "10.0.0.1", null);
        clock.advance(Duration.ofMinutes(6));
        presence.register("alice", "S2", "10.0.0.2", null);

        assertThat(presence.heartbeat("alice", "S1")).isFalse();
        assertThat(engine.store().liveSessions(presence.liveSince()))
                .extracting(SessionRecord::sessionId).containsExactly("S2");
        assertThat(presence.heartbeat("alice", "S2")).isTrue();
    }

    @Test
    void displayNamesCannotShadowAnotherIdentity() {
        engine.accounts().create("bob", null, null, Role.SIMPLE_USER, "password1");
        engine.synthetic().add("Luna", 25, "f", "Paris", true);
        presence.register("Guesty", "G1", null, null);

        assertThatThrownBy(() -> engine.accounts().create("carol", "BOB", null, Role.SIMPLE_USER, "password1"))
                .isInstanceOf(ChatException.Conflict.class);
        assertThatThrownBy(() -> engine.accounts().create("dave", "guesty", null, Role.SIMPLE_USER, "password1"))
                .isInstanceOf(ChatException.Conflict.class);
        assertThatThrownBy(() -> engine.accounts().create("erin", "luna", null, Role.SIMPLE_USER, "password1"))
                .isInstanceOf(ChatException.Conflict.class);
        assertThatThrownBy(() -> engine.accounts().create("GUESTY", null, null, Role.SIMPLE_USER, "password1"))
                .isInstanceOf(ChatException.Conflict.class);

        AccountRecord carol = engine.accounts().create("carol", "Caz", null, Role.SIMPLE_USER, "password1");
        assertThatThrownBy(() -> engine.accounts().create("frank", "caz", null, Role.SIMPLE_USER, "password1"))
                .isInstanceOf(ChatException.Conflict.class);
        assertThatThrownBy(() -> engine.accounts().updateDisplayName(carol.id(), "Bob"))
                .isInstanceOf(ChatException.Conflict.class);
        assertThat(engine.accounts().updateDisplayName(carol.id(), "CAZ").displayName()).isEqualTo("CAZ");

        presence.login("carol", "password1", "C1", null);
        assertThatThrownBy(() -> presence.register("bob", "C1", null, null))
                .isInstanceOf(ChatException.Conflict.class);
    }

    @Test
    void concurrentGuestsRacingForOneNameProduceExactlyOneWinner() throws Exception {
        int racers = 8;
        List<Callable<Boolean>> tasks = new ArrayList<>();
        CountDownLatch start = new CountDownLatch(1);
        for (int i = 0; i < racers; i++) {
            String sid = "bob-" + i;
            tasks.add(() -> {
                start.await();
                try {
                    presence.register("bob", sid, "10.0.0." + sid.length(), null);
                    return true;
                } catch (ChatException.Conflict e) {
                    return false;
                }
            });
        }
        ExecutorService pool = Executors.newFixedThreadPool(racers);
        try {
            List<Future<Boolean>> futures = new ArrayList<>();
            for (Callable<Boolean> task : tasks) {
                futures.add(pool.submit(task));
            }
            start.countDown();
            int winners = 0;
            for (Future<Boolean> f : futures) {
                if (f.get(10, TimeUnit.SECONDS)) winners++;
            }
            assertThat(winners).isEqualTo(1);
        } finally {
            pool.shutdownNow();
        }
        assertThat(engine.store().sessionsForUsername("bob")).hasSize(1);
    }

    @Test
    void elevatedAccountMayHoldSeveralSessions() throws Exception {
        engine.accounts().create("root", null, null, Role.ROOT, "correct-horse");

        ExecutorService pool = Executors.newFixedThreadPool(2);
        try {
            Future<SessionRecord> a = pool.submit(() -> presence.login("root", "correct-horse", "R1", "10.0.0.1"));
            Future<SessionRecord> b = pool.submit(() -> presence.login("root", "correct-horse", "R2", "10.0.0.2"));
            assertThat(a.get(10, TimeUnit.SECONDS).role()).isEqualTo(Role.ROOT);
            assertThat(b.get(10, TimeUnit.SECONDS).role()).isEqualTo(Role.ROOT);
        } finally {
            pool.shutdownNow();
        }
        assertThat(presence.roster().users()).extracting(RosterEntry::username).containsExactly("root");
    }

    @Test
    void guestsCannotUseReservedOrRegisteredNames() {
        engine.accounts().create("moddy", "Captain", null, Role.MODERATOR, "password1");
        engine.synthetic().add("Luna", 25, "f", "Paris", true);

        assertThatThrownBy(() -> presence.register("Admin", "S1", null, null))
                .isInstanceOf(ChatException.Validation.class);
        assertThatThrownBy(() -> presence.register("MODDY", "S1", null, null))
                .isInstanceOf(ChatException.Conflict.class);
        assertThatThrownBy(() -> presence.register("captain", "S1", null, null))
                .isInstanceOf(ChatException.Conflict.class);
        assertThatThrownBy(() -> presence.register("luna", "S1", null, null))
                .isInstanceOf(ChatException.Conflict.class);
    }

    @Test
    void signedInSessionKeepsItsAccountName() {
        engine.accounts().create("moddy", "Captain", null, Role.MODERATOR, "password1");
        presence.login("moddy", "password1", "S1", "10.0.0.1");

        assertThat(presence.register("Captain", "S1", "10.0.0.1", null).accountId()).isNotNull();
        assertThatThrownBy(() -> presence.register("somebody", "S1", "10.0.0.1", null))
                .isInstanceOf(ChatException.Conflict.class);
    }

    @Test
    void nicknameValidation() {
        assertThatThrownBy(() -> presence.register("   ", "S1", null, null))
                .isInstanceOf(ChatException.Validation.class);
        assertThatThrownBy(() -> presence.register("x".repeat(51), "S1", null, null))
                .isInstanceOf(ChatException.Validation.class);
        assertThatThrownBy(() -> presence.register("bad\u0007name", "S1", null, null))
                .isInstanceOf(ChatException.Validation.class);
        assertThatThrownBy(() -> presence.register("alice", " ", null, null))
                .isInstanceOf(ChatException.Validation.class);
    }

    @Test
    void profileRulesFollowSettings() {
        assertThatThrownBy(() -> presence.register("kid", "S1", null, new Profile(12, "Rome", "m")))
                .isInstanceOf(ChatException.Validation.class);

        engine.settings().update(Map.of(SettingsService.REQUIRE_PROFILE, "true"));
        assertThatThrownBy(() -> presence.register("anon", "S2", null, null))
                .isInstanceOf(ChatException.Validation.class);
        assertThat(presence.register("anon", "S2", null, new Profile(30, "Rome", "m")).profile().location())
                .isEqualTo("Rome");
    }

    @Test
    void kickEndsSessionsAndBlocksReRegistration() {
        List<ChatEvent> events = new CopyOnWriteArrayList<>();
        engine.bus().subscribe(events::add);
        presence.register("troll", "S1", "10.0.0.9", null);

        List<String> kicked = presence.kick("TROLL");

        assertThat(kicked).containsExactly("S1");
        assertThat(events).anySatisfy(e -> assertThat(e).isEqualTo(new ChatEvent.ForceDisconnect("troll", List.of("S1"))));
        assertThat(presence.roster().users()).isEmpty();
        assertThatThrownBy(() -> presence.register("troll", "S1", "10.0.0.9", null))
                .isInstanceOf(ChatException.Forbidden.class);
        assertThat(presence.register("troll", "S3", "10.0.0.9", null).sessionId()).isEqualTo("S3");
        assertThatThrownBy(() -> presence.kick("nobody")).isInstanceOf(ChatException.NotFound.class);
    }

    @Test
    void rosterShowsOneRowPerNameAndPadsWithSynthetics() {
        engine.accounts().create("root", null, null, Role.ROOT, "correct-horse");
        presence.login("root", "correct-horse", "R1", null);
        clock.advance(Duration.ofSeconds(5));
        presence.login("root", "correct-horse", "R2", null);
        presence.register("zed", "Z1", null, new Profile(40, "Oslo", "m"));
        engine.synthetic().add("Luna", 25, "f", "Paris", true);
        engine.synthetic().add("Off", null, null, null, false);

        RosterSnapshot roster = presence.roster();

        assertThat(roster.users()).extracting(RosterEntry::username).containsExactly("Luna", "root", "zed");
        assertThat(roster.count()).isEqualTo(3);
        assertThat(roster.realCount()).isEqualTo(2);
        assertThat(roster.users().get(1).joinedAt()).isEqualTo(clock.instant().minusSeconds(5));
        assertThat(roster.users().get(0).synthetic()).isTrue();
    }

    @Test
    void sweepRemovesIdleSessionsAndRepublishesRoster() {
        List<ChatEvent> events = new CopyOnWriteArrayList<>();
        presence.register("alice", "S1", null, null);
        engine.bus().subscribe(events::add);
        clock.advance(Duration.ofMinutes(6));

        assertThat(presence.sweepExpired()).isEqualTo(1);
        assertThat(events).hasSize(1).first().isInstanceOf(ChatEvent.Roster.class);
        assertThat(presence.sweepExpired()).isZero();
    }

    @Test
    void logoutFreesTheNameAtOnce() {
        presence.register("alice", "S1", null, null);

        assertThat(presence.logout("S1")).isTrue();
        assertThat(presence.register("alice", "S2", null, null).sessionId()).isEqualTo("S2");
        assertThat(presence.logout("S1")).isFalse();
    }

    @Test
    void wrongPasswordIsAnAuthError() {
        engine.accounts().create("root", null, null, Role.ROOT, "correct-horse");

        assertThatThrownBy(() -> presence.login("root", "wrong-horse", "R1", null))
                .isInstanceOf(ChatException.Auth.class);
    }
}

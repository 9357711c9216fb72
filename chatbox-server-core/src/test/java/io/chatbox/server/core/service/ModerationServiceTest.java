package io.chatbox.server.core.service;

import io.chatbox.core.ChatException;
import io.chatbox.core.ChatMessage;
import io.chatbox.core.ChatMode;
import io.chatbox.core.Role;
import io.chatbox.server.core.ChatEngine;
import io.chatbox.server.core.MutableClock;
import io.chatbox.server.core.TestEngines;
import io.chatbox.server.spi.AccountRecord;
import io.chatbox.server.spi.NicknameBan;
import io.chatbox.server.spi.SyntheticIdentity;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class ModerationServiceTest {

    private MutableClock clock;
    private ChatEngine engine;
    private ModerationService moderation;

    @BeforeEach
    void setUp() {
        clock = MutableClock.startingAt("2026-03-01T12:00:00Z");
        engine = TestEngines.inMemory(clock);
        moderation = engine.moderation();
        engine.accounts().create("mod1", null, null, Role.MODERATOR, "password1");
        engine.accounts().create("admin1", null, null, Role.ADMINISTRATOR, "password1");
        engine.presence().login("mod1", "password1", "M1", "10.0.0.50");
        engine.presence().login("admin1", "password1", "AD1", "10.0.0.51");
        engine.presence().register("guest", "G1", "10.0.0.1", null);
    }

    @Test
    void authorizeChecksSessionAccountAndRole() {
        assertThat(moderation.authorize("M1", Role.MODERATOR).username()).isEqualTo("mod1");
        assertThatThrownBy(() -> moderation.authorize("M1", Role.ADMINISTRATOR))
                .isInstanceOf(ChatException.Forbidden.class);
        assertThatThrownBy(() -> moderation.authorize("G1", Role.MODERATOR))
                .isInstanceOf(ChatException.Auth.class);
        assertThatThrownBy(() -> moderation.authorize("missing", Role.MODERATOR))
                .isInstanceOf(ChatException.Auth.class);

        clock.advance(Duration.ofMinutes(6));
        assertThatThrownBy(() -> moderation.authorize("M1", Role.MODERATOR))
                .isInstanceOf(ChatException.Auth.class);
    }

    @Test
    void deactivatedAccountLosesModerationRights() {
        AccountRecord mod = engine.accounts().authenticate("mod1", "password1");
        engine.accounts().setActive(mod.id(), false);

        assertThatThrownBy(() -> moderation.authorize("M1", Role.MODERATOR))
                .isInstanceOf(ChatException.Auth.class);
    }

    @Test
    void moderatorDeletesMessagesAndKicksGuests() {
        ChatMessage m = engine.messages().post("guest", "G1", "10.0.0.1", "rude", null);

        moderation.deleteMessage("M1", m.messageId());
        assertThat(engine.messages().history(10)).isEmpty();

        assertThat(moderation.kick("M1", "guest")).containsExactly("G1");
        assertThat(engine.presence().roster().contains("guest")).isFalse();
        assertThatThrownBy(() -> moderation.kick("M1", "MOD1"))
                .isInstanceOf(ChatException.Validation.class)
                .hasMessage("cannot moderate yourself");
    }

    @Test
    void clearingNeedsAnAdministrator() {
        engine.messages().post("guest", "G1", "10.0.0.1", "a", null);

        assertThatThrownBy(() -> moderation.clear("M1")).isInstanceOf(ChatException.Forbidden.class);
        assertThat(moderation.clear("AD1")).isEqualTo(1);
        assertThat(moderation.countMessages("M1")).isEqualTo(1);
        assertThat(moderation.listMessages("M1", 10, 0)).singleElement().matches(ChatMessage::deleted);
    }

    @Test
    void nicknameBanDisconnectsTheCurrentHolder() {
        moderation.banNickname("AD1", "guest", "spam");

        assertThat(engine.presence().roster().contains("guest")).isFalse();
        assertThat(moderation.nicknameBans("AD1")).extracting(NicknameBan::bannedBy).containsExactly("admin1");
        assertThatThrownBy(() -> engine.presence().register("guest", "G9", "10.0.0.9", null))
                .isInstanceOf(ChatException.Forbidden.class);

        assertThat(moderation.unbanNickname("AD1", "guest")).isTrue();
        assertThat(engine.presence().register("guest", "G9", "10.0.0.9", null).sessionId()).isEqualTo("G9");
    }

    @Test
    void addressBansAreAdministratorOnly() {
        assertThatThrownBy(() -> moderation.banAddress("M1", "10.0.0.1", "spam", null))
                .isInstanceOf(ChatException.Forbidden.class);

        moderation.banAddress("AD1", "10.0.0.1", "spam", Duration.ofHours(2));

        assertThat(moderation.addressBans("AD1")).singleElement()
                .satisfies(b -> assertThat(b.bannedBy()).isEqualTo("admin1"));
        assertThatThrownBy(() -> engine.messages().post("guest", "G1", "10.0.0.1", "hi", null))
                .isInstanceOf(ChatException.Forbidden.class);
        assertThat(moderation.unbanAddress("AD1", "10.0.0.1")).isTrue();
    }

    @Test
    void administratorManagesSettingsAndSyntheticUsers() {
        moderation.updateSettings("AD1", Map.of(SettingsService.CHAT_MODE, "both"));
        assertThat(engine.settings().chatMode()).isEqualTo(ChatMode.BOTH);

        SyntheticIdentity luna = moderation.addSyntheticUser("AD1", "Luna", 22, "f", "Lyon", true);
        moderation.setSyntheticUserActive("AD1", luna.id(), false);
        assertThat(moderation.syntheticUsers("AD1")).singleElement().matches(s -> !s.active());
        moderation.deleteSyntheticUser("AD1", luna.id());
        assertThat(moderation.syntheticUsers("AD1")).isEmpty();

        assertThatThrownBy(() -> moderation.updateSettings("M1", Map.of(SettingsService.CHAT_MODE, "public")))
                .isInstanceOf(ChatException.Forbidden.class);
    }
}

package io.chatbox.server.core.service;

import io.chatbox.core.ChatException;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class HostPatternTest {

    @Test
    void plainPatternMatchesApexAndSubdomains() {
        HostPattern p = HostPattern.of("Example.com");

        assertThat(p.matches("example.com")).isTrue();
        assertThat(p.matches("www.example.com")).isTrue();
        assertThat(p.matches("notexample.com")).isFalse();
    }

    @Test
    void leadingWildcardBehavesLikeTheBase() {
        HostPattern p = HostPattern.of("*.youtube.com");

        assertThat(p.matches("youtube.com")).isTrue();
        assertThat(p.matches("m.youtube.com")).isTrue();
        assertThat(p.matches("youtube.co")).isFalse();
    }

    @Test
    void innerWildcardMatchesWithinTheHost() {
        HostPattern p = HostPattern.of("cdn*.example.net");

        assertThat(p.matches("cdn7.example.net")).isTrue();
        assertThat(p.matches("static.example.net")).isFalse();
    }

    @Test
    void normalizeStripsSchemePathAndPort() {
        assertThat(HostPattern.normalize(" HTTPS://Spotify.com:443/track/1 ")).isEqualTo("spotify.com");
    }

    @Test
    void bareWildcardIsRejected() {
        assertThatThrownBy(() -> HostPattern.normalize("*")).isInstanceOf(ChatException.Validation.class);
        assertThatThrownBy(() -> HostPattern.normalize("  ")).isInstanceOf(ChatException.Validation.class);
    }
}

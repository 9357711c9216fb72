package io.chatbox.server.core.service;

import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class PasswordHasherTest {

    private final PasswordHasher hasher = new PasswordHasher(1_000);

    @Test
    void hashesAreSaltedAndVerifiable() {
        String a = hasher.hash("s3cret-pass".toCharArray());
        String b = hasher.hash("s3cret-pass".toCharArray());

        assertThat(a).isNotEqualTo(b);
        assertThat(hasher.verify("s3cret-pass".toCharArray(), a)).isTrue();
        assertThat(hasher.verify("s3cret-pasS".toCharArray(), a)).isFalse();
    }

    @Test
    void verifyHonoursTheEncodedIterationCount() {
        String encoded = new PasswordHasher(2_000).hash("pw-12345".toCharArray());

        assertThat(hasher.verify("pw-12345".toCharArray(), encoded)).isTrue();
    }

    @Test
    void malformedHashesNeverVerify() {
        assertThat(hasher.verify("x".toCharArray(), null)).isFalse();
        assertThat(hasher.verify("x".toCharArray(), "plain")).isFalse();
        assertThat(hasher.verify("x".toCharArray(), "pbkdf2$abc$AAAA$AAAA")).isFalse();
        assertThat(hasher.verify("x".toCharArray(), "bcrypt$10$AAAA$AAAA")).isFalse();
    }

    @Test
    void iterationsMustBePositive() {
        assertThatThrownBy(() -> new PasswordHasher(0)).isInstanceOf(IllegalArgumentException.class);
    }
}

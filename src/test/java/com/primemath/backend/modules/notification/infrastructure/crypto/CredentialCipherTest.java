package com.primemath.backend.modules.notification.infrastructure.crypto;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import java.nio.charset.StandardCharsets;
import java.util.Base64;

import org.junit.jupiter.api.Test;

class CredentialCipherTest {

    private static final String KEY = Base64.getEncoder()
            .encodeToString("0123456789abcdef0123456789abcdef".getBytes(StandardCharsets.UTF_8));
    private static final String OTHER_KEY = Base64.getEncoder()
            .encodeToString("fedcba9876543210fedcba9876543210".getBytes(StandardCharsets.UTF_8));

    private final CredentialCipher cipher = new CredentialCipher(KEY);

    @Test
    void decryptReturnsOriginalSecret() {
        String encrypted = cipher.encrypt("NCS-secret-키");

        assertThat(encrypted).doesNotContain("NCS-secret");
        assertThat(cipher.decrypt(encrypted)).isEqualTo("NCS-secret-키");
    }

    @Test
    void encryptUsesFreshIvEachTime() {
        assertThat(cipher.encrypt("same")).isNotEqualTo(cipher.encrypt("same"));
    }

    @Test
    void decryptWithDifferentKeyFails() {
        String encrypted = cipher.encrypt("api-key");

        assertThatThrownBy(() -> new CredentialCipher(OTHER_KEY).decrypt(encrypted))
                .isInstanceOf(IllegalStateException.class);
    }

    @Test
    void truncatedCiphertextFails() {
        assertThatThrownBy(() -> cipher.decrypt("AAAA")).isInstanceOf(IllegalStateException.class);
    }

    @Test
    void keyMustBeThirtyTwoBytes() {
        String shortKey = Base64.getEncoder().encodeToString(new byte[16]);

        assertThatThrownBy(() -> new CredentialCipher(shortKey))
                .isInstanceOf(IllegalStateException.class)
                .hasMessageContaining("32 bytes");
        assertThatThrownBy(() -> new CredentialCipher(" "))
                .isInstanceOf(IllegalStateException.class);
    }
}

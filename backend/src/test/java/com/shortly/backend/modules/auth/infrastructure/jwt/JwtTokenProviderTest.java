package com.shortly.backend.modules.auth.infrastructure.jwt;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import java.nio.charset.StandardCharsets;
import java.util.Base64;

import org.junit.jupiter.api.Test;

class JwtTokenProviderTest {

    @Test
    void base64SecretIsDecoded() {
        byte[] raw = new byte[32];
        for (int i = 0; i < raw.length; i++) {
            raw[i] = (byte) i;
        }

        JwtTokenProvider provider = new JwtTokenProvider(Base64.getEncoder().encodeToString(raw));

        assertThat(provider.getSecretKey().getEncoded()).isEqualTo(raw);
        assertThat(provider.getSecretKey().getAlgorithm()).isEqualTo("HmacSHA256");
    }

    @Test
    void nonBase64SecretFallsBackToUtf8Bytes() {
        String secret = "plain-text-secret-with-dashes-and-enough-length";

        JwtTokenProvider provider = new JwtTokenProvider(secret);

        assertThat(provider.getSecretKey().getEncoded()).isEqualTo(secret.getBytes(StandardCharsets.UTF_8));
    }

    @Test
    void shortOrMissingSecretIsRefused() {
        assertThatThrownBy(() -> new JwtTokenProvider("too-short"))
                .isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> new JwtTokenProvider(" "))
                .isInstanceOf(IllegalArgumentException.class);
    }
}

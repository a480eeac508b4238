package com.unihousing.backend.modules.auth.infrastructure.jwt;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import java.nio.charset.StandardCharsets;
import java.util.Base64;

import org.junit.jupiter.api.Test;

class JwtTokenProviderTest {

    @Test
    void base64SecretIsDecoded() {
        byte[] raw = new byte[JwtTokenProvider.MIN_KEY_BYTES];
        for (int i = 0; i < raw.length; i++) {
            raw[i] = (byte) i;
        }

        JwtTokenProvider provider = new JwtTokenProvider(Base64.getEncoder().encodeToString(raw));

        assertThat(provider.getSecretKey().getEncoded()).isEqualTo(raw);
    }

    @Test
    void plainSecretUsesUtf8Bytes() {
        String secret = "plain-text-secret-with-dashes-0123456789";

        JwtTokenProvider provider = new JwtTokenProvider(secret);

        assertThat(provider.getSecretKey().getEncoded()).isEqualTo(secret.getBytes(StandardCharsets.UTF_8));
    }

    @Test
    void shortSecretIsRefused() {
        assertThatThrownBy(() -> new JwtTokenProvider("too-short"))
                .isInstanceOf(IllegalStateException.class);
        assertThatThrownBy(() -> new JwtTokenProvider(" "))
                .isInstanceOf(IllegalStateException.class);
    }
}

package com.unihousing.backend.modules.auth.application;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.OffsetDateTime;
import java.time.ZoneOffset;
import java.util.Date;

import com.unihousing.backend.modules.auth.infrastructure.jwt.JwtTokenProvider;

import io.jsonwebtoken.Jwts;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

class JwtTokenServiceTest {

    private static final String SECRET = "unit-test-signing-secret-0123456789-abcdef";
    private static final Instant NOW = OffsetDateTime.parse("2025-01-01T08:00:00Z").toInstant();
    private static final long TTL_MILLIS = 900_000L;

    private final JwtTokenProvider provider = new JwtTokenProvider(SECRET);

    private JwtTokenService serviceAt(Instant instant) {
        return new JwtTokenService(provider, TTL_MILLIS, Clock.fixed(instant, ZoneOffset.UTC));
    }

    @Test
    void issuedTokenParsesBackToSubjectAndRole() {
        JwtTokenService service = serviceAt(NOW);

        JwtTokenService.IssuedToken issued = service.issueAccessToken(42L, "student");
        JwtTokenService.ParsedToken parsed = service.parseAccessToken(issued.token());

        assertThat(parsed.subjectId()).isEqualTo(42L);
        assertThat(parsed.role()).isEqualTo("student");
        assertThat(issued.expiresAt()).isEqualTo(OffsetDateTime.ofInstant(NOW.plusMillis(TTL_MILLIS), ZoneOffset.UTC));
        assertThat(parsed.expiresAt()).isEqualTo(issued.expiresAt());
    }

    @Test
    void expiredTokenIsRejected() {
        String token = serviceAt(NOW).issueAccessToken(42L, "student").token();

        assertThatThrownBy(() -> serviceAt(NOW.plus(Duration.ofHours(1))).parseAccessToken(token))
                .isInstanceOf(JwtTokenService.InvalidTokenException.class);
    }

    @Test
    void tokenSignedWithAnotherKeyIsRejected() {
        JwtTokenService other = new JwtTokenService(
                new JwtTokenProvider("another-signing-secret-for-tests-9876543210"),
                TTL_MILLIS,
                Clock.fixed(NOW, ZoneOffset.UTC)
        );
        String token = other.issueAccessToken(42L, "student").token();

        assertThatThrownBy(() -> serviceAt(NOW).parseAccessToken(token))
                .isInstanceOf(JwtTokenService.InvalidTokenException.class);
    }

    @Test
    @DisplayName("tokens without a role claim are rejected")
    void missingRoleIsRejected() {
        String token = Jwts.builder()
                .subject("42")
                .issuedAt(Date.from(NOW))
                .expiration(Date.from(NOW.plusSeconds(600)))
                .signWith(provider.getSecretKey(), Jwts.SIG.HS256)
                .compact();

        assertThatThrownBy(() -> serviceAt(NOW).parseAccessToken(token))
                .isInstanceOf(JwtTokenService.InvalidTokenException.class);
    }

    @Test
    void nonNumericSubjectIsRejected() {
        String token = Jwts.builder()
                .subject("alice")
                .claim(JwtTokenService.ROLE_CLAIM, "student")
                .expiration(Date.from(NOW.plusSeconds(600)))
                .signWith(provider.getSecretKey(), Jwts.SIG.HS256)
                .compact();

        assertThatThrownBy(() -> serviceAt(NOW).parseAccessToken(token))
                .isInstanceOf(JwtTokenService.InvalidTokenException.class);
    }

    @Test
    void garbageIsRejected() {
        assertThatThrownBy(() -> serviceAt(NOW).parseAccessToken("not.a.token"))
                .isInstanceOf(JwtTokenService.InvalidTokenException.class);
    }
}

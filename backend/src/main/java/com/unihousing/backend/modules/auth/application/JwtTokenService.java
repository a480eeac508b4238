package com.unihousing.backend.modules.auth.application;

import java.time.Clock;
import java.time.Instant;
import java.time.OffsetDateTime;
import java.util.Date;

import com.unihousing.backend.modules.auth.infrastructure.jwt.JwtTokenProvider;

import io.jsonwebtoken.Claims;
import io.jsonwebtoken.JwtException;
import io.jsonwebtoken.Jwts;
import io.jsonwebtoken.Jwts.SIG;
import javax.crypto.SecretKey;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Service;

/**
 * Issues and verifies HS256 access tokens. The subject is the numeric account id and the
 * {@code role} claim carries the account kind ({@code student}, {@code manager}, ...).
 */
@Service
public class JwtTokenService {

    static final String ROLE_CLAIM = "role";

    private final JwtTokenProvider tokenProvider;
    private final long accessTokenTtlMillis;
    private final Clock clock;

    public JwtTokenService(
            JwtTokenProvider tokenProvider,
            @Value("${jwt.expiration:900000}") long accessTokenTtlMillis,
            Clock clock
    ) {
        this.tokenProvider = tokenProvider;
        this.accessTokenTtlMillis = accessTokenTtlMillis;
        this.clock = clock;
    }

    public IssuedToken issueAccessToken(Long subjectId, String role) {
        if (subjectId == null || role == null || role.isBlank()) {
            throw new IllegalArgumentException("subjectId and role are required");
        }
        Instant now = clock.instant();
        Instant expiry = now.plusMillis(accessTokenTtlMillis);

        SecretKey key = tokenProvider.getSecretKey();

        String token = Jwts.builder()
                .subject(subjectId.toString())
                .issuedAt(Date.from(now))
                .expiration(Date.from(expiry))
                .claim(ROLE_CLAIM, role)
                .signWith(key, SIG.HS256)
                .compact();

        return new IssuedToken(token, OffsetDateTime.ofInstant(expiry, clock.getZone()));
    }

    public ParsedToken parseAccessToken(String token) {
        try {
            Claims claims = Jwts.parser()
                    .verifyWith(tokenProvider.getSecretKey())
                    .clock(() -> Date.from(clock.instant()))
                    .build()
                    .parseSignedClaims(token)
                    .getPayload();

            Long subjectId = Long.valueOf(claims.getSubject());
            String role = claims.get(ROLE_CLAIM, String.class);
            if (role == null || role.isBlank()) {
                throw new InvalidTokenException("Access token has no role claim", null);
            }
            Instant issuedAt = claims.getIssuedAt() != null ? claims.getIssuedAt().toInstant() : clock.instant();
            Instant expiresAt = claims.getExpiration() != null ? claims.getExpiration().toInstant() : issuedAt;

            return new ParsedToken(
                    subjectId,
                    role,
                    OffsetDateTime.ofInstant(issuedAt, clock.getZone()),
                    OffsetDateTime.ofInstant(expiresAt, clock.getZone())
            );
        } catch (JwtException | IllegalArgumentException e) {
            // NumberFormatException from a non-numeric subject lands here as well
            throw new InvalidTokenException("Invalid access token", e);
        }
    }

    public record IssuedToken(String token, OffsetDateTime expiresAt) {
    }

    public record ParsedToken(Long subjectId, String role, OffsetDateTime issuedAt, OffsetDateTime expiresAt) {
    }

    public static class InvalidTokenException extends RuntimeException {
        public InvalidTokenException(String message, Throwable cause) {
            super(message, cause);
        }
    }
}

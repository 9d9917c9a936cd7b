package com.investorportal.backend.modules.auth.application;

import java.security.SecureRandom;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.Date;
import java.util.HexFormat;
import java.util.UUID;

import com.investorportal.backend.global.config.AuthProperties;
import com.investorportal.backend.global.error.AuthenticationProblemException;
import com.investorportal.backend.modules.auth.infrastructure.jwt.JwtTokenProvider;

import io.jsonwebtoken.Claims;
import io.jsonwebtoken.JwtException;
import io.jsonwebtoken.Jwts;
import io.jsonwebtoken.Jwts.SIG;
import org.springframework.stereotype.Service;

/**
 * Issues and verifies signed tokens. Pure with respect to storage: refresh token validity
 * is decided by the session store, not here.
 */
@Service
public class JwtTokenService {

    static final Duration DEFAULT_ACCESS_LIFETIME = Duration.ofSeconds(900);
    static final Duration DEFAULT_REFRESH_LIFETIME = Duration.ofDays(7);

    private static final String CLAIM_EMAIL = "email";
    private static final String CLAIM_TYPE = "type";
    private static final String REFRESH_TYPE = "refresh";
    private static final int JTI_BYTES = 16;

    private final JwtTokenProvider tokenProvider;
    private final Duration accessTokenLifetime;
    private final Duration refreshTokenLifetime;
    private final Clock clock;
    private final SecureRandom secureRandom = new SecureRandom();

    public JwtTokenService(JwtTokenProvider tokenProvider, AuthProperties properties, Clock clock) {
        this.tokenProvider = tokenProvider;
        this.accessTokenLifetime = TokenLifetime.parse(properties.jwt().accessExpiration(), DEFAULT_ACCESS_LIFETIME);
        this.refreshTokenLifetime = TokenLifetime.parse(properties.jwt().refreshExpiration(), DEFAULT_REFRESH_LIFETIME);
        this.clock = clock;
    }

    public IssuedToken issueAccessToken(UUID userId, String email) {
        Instant now = clock.instant();
        String token = Jwts.builder()
                .subject(userId.toString())
                .claim(CLAIM_EMAIL, email)
                .issuedAt(Date.from(now))
                .expiration(Date.from(now.plus(accessTokenLifetime)))
                .signWith(tokenProvider.getAccessKey(), SIG.HS256)
                .compact();
        return new IssuedToken(token, accessTokenLifetime.toSeconds());
    }

    public String issueRefreshToken(UUID userId) {
        Instant now = clock.instant();
        byte[] jti = new byte[JTI_BYTES];
        secureRandom.nextBytes(jti);
        return Jwts.builder()
                .subject(userId.toString())
                .claim(CLAIM_TYPE, REFRESH_TYPE)
                .id(HexFormat.of().formatHex(jti))
                .issuedAt(Date.from(now))
                .expiration(Date.from(now.plus(refreshTokenLifetime)))
                .signWith(tokenProvider.getRefreshKey(), SIG.HS256)
                .compact();
    }

    public AccessTokenClaims verifyAccessToken(String token) {
        if (token == null || token.isBlank()) {
            throw AuthenticationProblemException.invalidToken();
        }
        try {
            Claims claims = Jwts.parser()
                    .verifyWith(tokenProvider.getAccessKey())
                    .clock(() -> Date.from(clock.instant()))
                    .build()
                    .parseSignedClaims(token)
                    .getPayload();

            if (REFRESH_TYPE.equals(claims.get(CLAIM_TYPE, String.class))
                    || claims.getSubject() == null
                    || claims.getExpiration() == null) {
                throw AuthenticationProblemException.invalidToken();
            }
            UUID userId = UUID.fromString(claims.getSubject());
            String email = claims.get(CLAIM_EMAIL, String.class);
            Instant issuedAt = claims.getIssuedAt() != null ? claims.getIssuedAt().toInstant() : null;
            Instant expiresAt = claims.getExpiration().toInstant();
            return new AccessTokenClaims(userId, email, issuedAt, expiresAt);
        } catch (JwtException | IllegalArgumentException e) {
            throw AuthenticationProblemException.invalidToken(e);
        }
    }

    public Duration accessTokenLifetime() {
        return accessTokenLifetime;
    }

    public Duration refreshTokenLifetime() {
        return refreshTokenLifetime;
    }

    public record IssuedToken(String token, long expiresInSeconds) {
    }

    public record AccessTokenClaims(UUID userId, String email, Instant issuedAt, Instant expiresAt) {
    }
}

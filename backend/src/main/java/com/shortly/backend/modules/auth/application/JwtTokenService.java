package com.shortly.backend.modules.auth.application;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.Date;
import java.util.UUID;

import com.shortly.backend.modules.auth.application.TokenVerificationException.Reason;
import com.shortly.backend.modules.auth.infrastructure.jwt.JwtTokenProvider;

import io.jsonwebtoken.Claims;
import io.jsonwebtoken.ExpiredJwtException;
import io.jsonwebtoken.JwtException;
import io.jsonwebtoken.JwtParser;
import io.jsonwebtoken.Jwts;
import io.jsonwebtoken.Jwts.SIG;
import io.jsonwebtoken.security.SignatureException;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Service;

/**
 * Signs and verifies the two token kinds. Access tokens carry the full identity so the hot path
 * needs no storage; refresh tokens carry only the session id.
 */
@Service
public class JwtTokenService {

    static final String CLAIM_TOKEN_TYPE = "typ";
    static final String CLAIM_NAME = "name";
    static final String CLAIM_EMAIL = "email";
    static final String CLAIM_SESSION_ID = "sid";
    static final String TYPE_ACCESS = "access";
    static final String TYPE_REFRESH = "refresh";

    private final JwtTokenProvider tokenProvider;
    private final Duration accessTokenTtl;
    private final Duration refreshTokenTtl;
    private final Clock clock;
    private final JwtParser parser;

    public JwtTokenService(
            JwtTokenProvider tokenProvider,
            @Value("${jwt.access-expiration:900000}") long accessTokenTtlMillis,
            @Value("${jwt.refresh-expiration:604800000}") long refreshTokenTtlMillis,
            Clock clock
    ) {
        this.tokenProvider = tokenProvider;
        this.accessTokenTtl = Duration.ofMillis(accessTokenTtlMillis);
        this.refreshTokenTtl = Duration.ofMillis(refreshTokenTtlMillis);
        this.clock = clock;
        this.parser = Jwts.parser()
                .verifyWith(tokenProvider.getSecretKey())
                .clock(() -> Date.from(clock.instant()))
                .build();
    }

    public String issueAccessToken(UUID userId, String name, String email, UUID sessionId) {
        Instant now = clock.instant();
        return Jwts.builder()
                .subject(userId.toString())
                .issuedAt(Date.from(now))
                .expiration(Date.from(now.plus(accessTokenTtl)))
                .claim(CLAIM_TOKEN_TYPE, TYPE_ACCESS)
                .claim(CLAIM_NAME, name)
                .claim(CLAIM_EMAIL, email)
                .claim(CLAIM_SESSION_ID, sessionId.toString())
                .signWith(tokenProvider.getSecretKey(), SIG.HS256)
                .compact();
    }

    public String issueRefreshToken(UUID sessionId) {
        Instant now = clock.instant();
        return Jwts.builder()
                .issuedAt(Date.from(now))
                .expiration(Date.from(now.plus(refreshTokenTtl)))
                .claim(CLAIM_TOKEN_TYPE, TYPE_REFRESH)
                .claim(CLAIM_SESSION_ID, sessionId.toString())
                .signWith(tokenProvider.getSecretKey(), SIG.HS256)
                .compact();
    }

    public TokenPair issueTokenPair(UUID userId, String name, String email, UUID sessionId) {
        return new TokenPair(
                issueAccessToken(userId, name, email, sessionId),
                accessTokenTtl,
                issueRefreshToken(sessionId),
                refreshTokenTtl
        );
    }

    public AccessTokenClaims verifyAccessToken(String token) {
        Claims claims = parse(token, TYPE_ACCESS);
        try {
            return new AccessTokenClaims(
                    UUID.fromString(claims.getSubject()),
                    claims.get(CLAIM_NAME, String.class),
                    claims.get(CLAIM_EMAIL, String.class),
                    UUID.fromString(claims.get(CLAIM_SESSION_ID, String.class)),
                    claims.getIssuedAt().toInstant(),
                    claims.getExpiration().toInstant()
            );
        } catch (RuntimeException e) {
            throw new TokenVerificationException(Reason.MALFORMED, "Access token claims are incomplete", e);
        }
    }

    public RefreshTokenClaims verifyRefreshToken(String token) {
        Claims claims = parse(token, TYPE_REFRESH);
        try {
            return new RefreshTokenClaims(
                    UUID.fromString(claims.get(CLAIM_SESSION_ID, String.class)),
                    claims.getIssuedAt().toInstant(),
                    claims.getExpiration().toInstant()
            );
        } catch (RuntimeException e) {
            throw new TokenVerificationException(Reason.MALFORMED, "Refresh token claims are incomplete", e);
        }
    }

    private Claims parse(String token, String expectedType) {
        if (token == null || token.isBlank()) {
            throw new TokenVerificationException(Reason.MALFORMED, "Token is empty");
        }
        Claims claims;
        try {
            claims = parser.parseSignedClaims(token).getPayload();
        } catch (ExpiredJwtException e) {
            throw new TokenVerificationException(Reason.EXPIRED, "Token expired", e);
        } catch (SignatureException e) {
            throw new TokenVerificationException(Reason.INVALID_SIGNATURE, "Token signature mismatch", e);
        } catch (JwtException | IllegalArgumentException e) {
            throw new TokenVerificationException(Reason.MALFORMED, "Token could not be parsed", e);
        }
        if (!expectedType.equals(claims.get(CLAIM_TOKEN_TYPE, String.class))) {
            throw new TokenVerificationException(Reason.WRONG_TYPE, "Expected a " + expectedType + " token");
        }
        return claims;
    }
}

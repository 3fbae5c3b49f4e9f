package com.shortly.backend.modules.auth.application;

import java.util.Optional;

import com.shortly.backend.global.security.AuthenticatedUser;
import com.shortly.backend.modules.auth.domain.AppUser;
import com.shortly.backend.modules.auth.domain.UserSession;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;
import org.springframework.util.StringUtils;

/**
 * Decides who a request belongs to from its access and refresh cookies.
 *
 * <ol>
 *     <li>no cookies: anonymous, nothing written</li>
 *     <li>valid access token: identity from its claims, no storage read</li>
 *     <li>otherwise a refresh token naming a valid session of an existing user: a fresh token
 *     pair is minted for the same session</li>
 *     <li>anything else: anonymous and both cookies cleared</li>
 * </ol>
 *
 * Authentication failures never escape as errors; storage failures do.
 */
@Service
public class AuthenticationOrchestrator {

    private static final Logger log = LoggerFactory.getLogger(AuthenticationOrchestrator.class);

    private final JwtTokenService jwtTokenService;
    private final SessionService sessionService;
    private final CredentialService credentialService;

    public AuthenticationOrchestrator(JwtTokenService jwtTokenService, SessionService sessionService,
                                      CredentialService credentialService) {
        this.jwtTokenService = jwtTokenService;
        this.sessionService = sessionService;
        this.credentialService = credentialService;
    }

    public AuthenticationResult authenticate(String accessToken, String refreshToken) {
        boolean hasAccess = StringUtils.hasText(accessToken);
        boolean hasRefresh = StringUtils.hasText(refreshToken);

        if (!hasAccess && !hasRefresh) {
            return AuthenticationResult.anonymous();
        }

        if (hasAccess) {
            try {
                AccessTokenClaims claims = jwtTokenService.verifyAccessToken(accessToken);
                return AuthenticationResult.authenticated(new AuthenticatedUser(
                        claims.userId(), claims.name(), claims.email(), claims.sessionId()));
            } catch (TokenVerificationException ex) {
                log.debug("Access token rejected | reason={}", ex.getReason());
            }
        }

        if (hasRefresh) {
            Optional<AuthenticationResult> refreshed = refresh(refreshToken);
            if (refreshed.isPresent()) {
                return refreshed.get();
            }
        }

        return AuthenticationResult.anonymousClearingCookies();
    }

    private Optional<AuthenticationResult> refresh(String refreshToken) {
        RefreshTokenClaims claims;
        try {
            claims = jwtTokenService.verifyRefreshToken(refreshToken);
        } catch (TokenVerificationException ex) {
            log.info("Refresh token rejected | reason={}", ex.getReason());
            return Optional.empty();
        }

        Optional<UserSession> session = sessionService.findValidById(claims.sessionId());
        if (session.isEmpty()) {
            log.info("Refresh denied, session missing or revoked | sessionId={}", claims.sessionId());
            return Optional.empty();
        }

        Optional<AppUser> user = credentialService.findById(session.get().getUserId());
        if (user.isEmpty()) {
            log.warn("Refresh denied, session owner missing | sessionId={} userId={}",
                    claims.sessionId(), session.get().getUserId());
            return Optional.empty();
        }

        AppUser owner = user.get();
        TokenPair tokens = jwtTokenService.issueTokenPair(owner.getId(), owner.getName(), owner.getEmail(),
                claims.sessionId());
        log.debug("Tokens refreshed | sessionId={} userId={}", claims.sessionId(), owner.getId());
        return Optional.of(AuthenticationResult.refreshed(
                new AuthenticatedUser(owner.getId(), owner.getName(), owner.getEmail(), claims.sessionId()),
                tokens));
    }
}

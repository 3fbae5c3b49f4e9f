package com.shortly.backend.modules.auth.application;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.verifyNoInteractions;
import static org.mockito.Mockito.when;

import java.time.Duration;
import java.time.Instant;
import java.util.Optional;
import java.util.UUID;

import com.shortly.backend.global.security.AuthenticatedUser;
import com.shortly.backend.modules.auth.application.AuthenticationResult.CookieAction;
import com.shortly.backend.modules.auth.application.TokenVerificationException.Reason;
import com.shortly.backend.modules.auth.domain.AppUser;
import com.shortly.backend.modules.auth.domain.UserSession;
import com.shortly.backend.support.TestEntities;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.dao.DataAccessResourceFailureException;

@ExtendWith(MockitoExtension.class)
class AuthenticationOrchestratorTest {

    private static final UUID USER_ID = UUID.fromString("00000000-0000-0000-0000-000000000001");
    private static final UUID SESSION_ID = UUID.fromString("00000000-0000-0000-0000-0000000000aa");
    private static final Instant NOW = Instant.parse("2025-03-01T10:00:00Z");

    @Mock
    private JwtTokenService jwtTokenService;

    @Mock
    private SessionService sessionService;

    @Mock
    private CredentialService credentialService;

    private AuthenticationOrchestrator orchestrator;
    private AppUser ada;

    @BeforeEach
    void setUp() {
        orchestrator = new AuthenticationOrchestrator(jwtTokenService, sessionService, credentialService);
        ada = TestEntities.user(USER_ID, "Ada", "ada@example.com", "hash");
    }

    @Test
    void noCookiesIsAnonymousWithoutCookieChanges() {
        AuthenticationResult result = orchestrator.authenticate(null, "");

        assertThat(result.isAuthenticated()).isFalse();
        assertThat(result.cookieAction()).isEqualTo(CookieAction.NONE);
        verifyNoInteractions(jwtTokenService, sessionService, credentialService);
    }

    @Test
    void validAccessTokenAuthenticatesWithoutTouchingStorage() {
        when(jwtTokenService.verifyAccessToken("access")).thenReturn(new AccessTokenClaims(
                USER_ID, "Ada", "ada@example.com", SESSION_ID, NOW, NOW.plus(Duration.ofMinutes(15))));

        AuthenticationResult result = orchestrator.authenticate("access", "refresh");

        assertThat(result.user()).contains(new AuthenticatedUser(USER_ID, "Ada", "ada@example.com", SESSION_ID));
        assertThat(result.cookieAction()).isEqualTo(CookieAction.NONE);
        verify(jwtTokenService, never()).verifyRefreshToken(any());
        verifyNoInteractions(sessionService, credentialService);
    }

    @Test
    void expiredAccessTokenWithValidSessionReissuesBothTokens() {
        when(jwtTokenService.verifyAccessToken("stale"))
                .thenThrow(new TokenVerificationException(Reason.EXPIRED, "expired"));
        stubValidRefresh();
        TokenPair fresh = new TokenPair("new-access", Duration.ofMinutes(15), "new-refresh", Duration.ofDays(7));
        when(jwtTokenService.issueTokenPair(USER_ID, "Ada", "ada@example.com", SESSION_ID)).thenReturn(fresh);

        AuthenticationResult result = orchestrator.authenticate("stale", "refresh");

        assertThat(result.cookieAction()).isEqualTo(CookieAction.REISSUE);
        assertThat(result.reissuedTokens()).isEqualTo(fresh);
        assertThat(result.user()).contains(new AuthenticatedUser(USER_ID, "Ada", "ada@example.com", SESSION_ID));
    }

    @Test
    void missingAccessTokenWithValidSessionReissues() {
        stubValidRefresh();
        TokenPair fresh = new TokenPair("new-access", Duration.ofMinutes(15), "new-refresh", Duration.ofDays(7));
        when(jwtTokenService.issueTokenPair(USER_ID, "Ada", "ada@example.com", SESSION_ID)).thenReturn(fresh);

        AuthenticationResult result = orchestrator.authenticate(null, "refresh");

        assertThat(result.cookieAction()).isEqualTo(CookieAction.REISSUE);
        verify(jwtTokenService, never()).verifyAccessToken(any());
    }

    @Test
    void revokedSessionClearsCookies() {
        when(jwtTokenService.verifyRefreshToken("refresh")).thenReturn(refreshClaims());
        when(sessionService.findValidById(SESSION_ID)).thenReturn(Optional.empty());

        AuthenticationResult result = orchestrator.authenticate(null, "refresh");

        assertThat(result.isAuthenticated()).isFalse();
        assertThat(result.cookieAction()).isEqualTo(CookieAction.CLEAR);
        verifyNoInteractions(credentialService);
        verify(jwtTokenService, never()).issueTokenPair(any(), any(), any(), any());
    }

    @Test
    void sessionOwnerMissingClearsCookies() {
        when(jwtTokenService.verifyRefreshToken("refresh")).thenReturn(refreshClaims());
        when(sessionService.findValidById(SESSION_ID)).thenReturn(Optional.of(session()));
        when(credentialService.findById(USER_ID)).thenReturn(Optional.empty());

        AuthenticationResult result = orchestrator.authenticate(null, "refresh");

        assertThat(result.cookieAction()).isEqualTo(CookieAction.CLEAR);
        assertThat(result.user()).isEmpty();
    }

    @Test
    void invalidRefreshTokenClearsCookies() {
        when(jwtTokenService.verifyAccessToken("stale"))
                .thenThrow(new TokenVerificationException(Reason.EXPIRED, "expired"));
        when(jwtTokenService.verifyRefreshToken("forged"))
                .thenThrow(new TokenVerificationException(Reason.INVALID_SIGNATURE, "bad signature"));

        AuthenticationResult result = orchestrator.authenticate("stale", "forged");

        assertThat(result.cookieAction()).isEqualTo(CookieAction.CLEAR);
        verifyNoInteractions(sessionService, credentialService);
    }

    @Test
    void invalidAccessTokenWithoutRefreshTokenClearsCookies() {
        when(jwtTokenService.verifyAccessToken("tampered"))
                .thenThrow(new TokenVerificationException(Reason.INVALID_SIGNATURE, "bad signature"));

        AuthenticationResult result = orchestrator.authenticate("tampered", null);

        assertThat(result.isAuthenticated()).isFalse();
        assertThat(result.cookieAction()).isEqualTo(CookieAction.CLEAR);
    }

    @Test
    void storageFailureDuringRefreshPropagates() {
        when(jwtTokenService.verifyRefreshToken("refresh")).thenReturn(refreshClaims());
        when(sessionService.findValidById(SESSION_ID))
                .thenThrow(new DataAccessResourceFailureException("database down"));

        assertThatThrownBy(() -> orchestrator.authenticate(null, "refresh"))
                .isInstanceOf(DataAccessResourceFailureException.class);
    }

    private void stubValidRefresh() {
        when(jwtTokenService.verifyRefreshToken("refresh")).thenReturn(refreshClaims());
        when(sessionService.findValidById(SESSION_ID)).thenReturn(Optional.of(session()));
        when(credentialService.findById(USER_ID)).thenReturn(Optional.of(ada));
    }

    private RefreshTokenClaims refreshClaims() {
        return new RefreshTokenClaims(SESSION_ID, NOW, NOW.plus(Duration.ofDays(7)));
    }

    private UserSession session() {
        return TestEntities.setId(new UserSession(ada, "127.0.0.1", "JUnit"), SESSION_ID);
    }
}

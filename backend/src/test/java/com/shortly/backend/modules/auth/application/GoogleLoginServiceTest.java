package com.shortly.backend.modules.auth.application;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyBoolean;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.verifyNoInteractions;
import static org.mockito.Mockito.when;

import java.time.Duration;
import java.util.Optional;
import java.util.UUID;

import com.shortly.backend.modules.auth.domain.AppUser;
import com.shortly.backend.modules.auth.domain.OAuthAccount;
import com.shortly.backend.modules.auth.domain.OAuthProvider;
import com.shortly.backend.modules.auth.infrastructure.oauth.GoogleIdentity;
import com.shortly.backend.modules.auth.infrastructure.oauth.GoogleOAuthClient;
import com.shortly.backend.modules.auth.infrastructure.oauth.GoogleOAuthClient.GoogleOAuthException;
import com.shortly.backend.modules.auth.infrastructure.persistence.AppUserRepository;
import com.shortly.backend.modules.auth.infrastructure.persistence.OAuthAccountRepository;
import com.shortly.backend.support.TestEntities;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

@ExtendWith(MockitoExtension.class)
class GoogleLoginServiceTest {

    private static final UUID USER_ID = UUID.fromString("00000000-0000-0000-0000-000000000001");
    private static final GoogleIdentity IDENTITY =
            new GoogleIdentity("google-sub-1", "Ada Lovelace", "ada@example.com", true, "https://img.example/ada.png");
    private static final GoogleIdentity UNVERIFIED_IDENTITY =
            new GoogleIdentity("google-sub-1", "Ada Lovelace", "ada@example.com", false, null);

    @Mock
    private GoogleOAuthClient googleOAuthClient;

    @Mock
    private OAuthAccountRepository oauthAccountRepository;

    @Mock
    private AppUserRepository appUserRepository;

    @Mock
    private CredentialService credentialService;

    @Mock
    private AuthService authService;

    private GoogleLoginService service;
    private AppUser ada;

    @BeforeEach
    void setUp() {
        service = new GoogleLoginService(googleOAuthClient, oauthAccountRepository, appUserRepository,
                credentialService, authService);
        ada = TestEntities.user(USER_ID, "Ada", "ada@example.com", "hash");
    }

    @Test
    void alreadyLinkedAccountResolvesToItsUser() {
        when(oauthAccountRepository.findByProviderAccount(OAuthProvider.GOOGLE, "google-sub-1"))
                .thenReturn(Optional.of(new OAuthAccount(ada, OAuthProvider.GOOGLE, "google-sub-1")));

        assertThat(service.resolveUser(IDENTITY)).isSameAs(ada);

        verifyNoInteractions(appUserRepository, credentialService);
    }

    @Test
    void existingEmailIsLinkedAndAvatarFilled() {
        when(oauthAccountRepository.findByProviderAccount(OAuthProvider.GOOGLE, "google-sub-1"))
                .thenReturn(Optional.empty());
        when(appUserRepository.findByEmail("ada@example.com")).thenReturn(Optional.of(ada));
        when(oauthAccountRepository.existsForUser(USER_ID, OAuthProvider.GOOGLE)).thenReturn(false);

        AppUser resolved = service.resolveUser(IDENTITY);

        assertThat(resolved).isSameAs(ada);
        assertThat(ada.getAvatarUrl()).isEqualTo("https://img.example/ada.png");
        ArgumentCaptor<OAuthAccount> link = ArgumentCaptor.forClass(OAuthAccount.class);
        verify(oauthAccountRepository).save(link.capture());
        assertThat(link.getValue().getProviderAccountId()).isEqualTo("google-sub-1");
        assertThat(link.getValue().getUser()).isSameAs(ada);
        verify(credentialService, never()).createExternal(any(), any(), any(), anyBoolean());
    }

    @Test
    void existingAvatarIsKept() {
        ada.setAvatarUrl("https://img.example/own.png");
        when(oauthAccountRepository.findByProviderAccount(OAuthProvider.GOOGLE, "google-sub-1"))
                .thenReturn(Optional.empty());
        when(appUserRepository.findByEmail("ada@example.com")).thenReturn(Optional.of(ada));
        when(oauthAccountRepository.existsForUser(USER_ID, OAuthProvider.GOOGLE)).thenReturn(false);

        service.resolveUser(IDENTITY);

        assertThat(ada.getAvatarUrl()).isEqualTo("https://img.example/own.png");
        verify(appUserRepository, never()).save(any());
    }

    @Test
    void unknownIdentityCreatesVerifiedPasswordlessUser() {
        AppUser created = TestEntities.user(USER_ID, "Ada Lovelace", "ada@example.com", null);
        created.markEmailVerified();
        when(oauthAccountRepository.findByProviderAccount(OAuthProvider.GOOGLE, "google-sub-1"))
                .thenReturn(Optional.empty());
        when(appUserRepository.findByEmail("ada@example.com")).thenReturn(Optional.empty());
        when(credentialService.createExternal("Ada Lovelace", "ada@example.com", "https://img.example/ada.png", true))
                .thenReturn(created);

        AppUser resolved = service.resolveUser(IDENTITY);

        assertThat(resolved.hasPassword()).isFalse();
        assertThat(resolved.isEmailVerified()).isTrue();
        verify(oauthAccountRepository).save(any(OAuthAccount.class));
    }

    @Test
    void unverifiedGoogleEmailIsNotLinkedToExistingAccount() {
        when(oauthAccountRepository.findByProviderAccount(OAuthProvider.GOOGLE, "google-sub-1"))
                .thenReturn(Optional.empty());
        when(appUserRepository.findByEmail("ada@example.com")).thenReturn(Optional.of(ada));

        assertThatThrownBy(() -> service.resolveUser(UNVERIFIED_IDENTITY))
                .isInstanceOf(OAuthLoginException.class)
                .hasFieldOrPropertyWithValue("detailMessage", GoogleLoginService.UNVERIFIED_EMAIL_MESSAGE);

        verify(oauthAccountRepository, never()).save(any());
        verify(appUserRepository, never()).save(any());
    }

    @Test
    void unverifiedGoogleEmailCreatesUnverifiedUser() {
        AppUser created = TestEntities.user(USER_ID, "Ada Lovelace", "ada@example.com", null);
        when(oauthAccountRepository.findByProviderAccount(OAuthProvider.GOOGLE, "google-sub-1"))
                .thenReturn(Optional.empty());
        when(appUserRepository.findByEmail("ada@example.com")).thenReturn(Optional.empty());
        when(credentialService.createExternal("Ada Lovelace", "ada@example.com", null, false)).thenReturn(created);

        assertThat(service.resolveUser(UNVERIFIED_IDENTITY).isEmailVerified()).isFalse();
        verify(oauthAccountRepository).save(any(OAuthAccount.class));
    }

    @Test
    void failedCodeExchangeBecomesOAuthLoginFailure() {
        when(googleOAuthClient.exchangeCode("code", "verifier"))
                .thenThrow(new GoogleOAuthException("invalid_grant", null));

        assertThatThrownBy(() -> service.completeLogin("code", "verifier", new SessionMetadata(null, null)))
                .isInstanceOf(OAuthLoginException.class)
                .hasFieldOrPropertyWithValue("detailMessage", OAuthLoginException.DEFAULT_MESSAGE);

        verifyNoInteractions(authService);
    }

    @Test
    void successfulCallbackStartsANormalSession() {
        SessionMetadata metadata = new SessionMetadata("203.0.113.7", "JUnit");
        IssuedLogin issued = new IssuedLogin(ada, UUID.randomUUID(),
                new TokenPair("a", Duration.ofMinutes(15), "r", Duration.ofDays(7)));
        when(googleOAuthClient.exchangeCode("code", "verifier")).thenReturn(IDENTITY);
        when(oauthAccountRepository.findByProviderAccount(OAuthProvider.GOOGLE, "google-sub-1"))
                .thenReturn(Optional.of(new OAuthAccount(ada, OAuthProvider.GOOGLE, "google-sub-1")));
        when(authService.startSession(ada, metadata)).thenReturn(issued);

        assertThat(service.completeLogin("code", "verifier", metadata)).isSameAs(issued);
    }
}

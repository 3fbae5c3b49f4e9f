package com.shortly.backend.modules.auth.application;

import java.util.Optional;

import com.shortly.backend.modules.auth.domain.AppUser;
import com.shortly.backend.modules.auth.domain.OAuthAccount;
import com.shortly.backend.modules.auth.domain.OAuthProvider;
import com.shortly.backend.modules.auth.infrastructure.oauth.GoogleIdentity;
import com.shortly.backend.modules.auth.infrastructure.oauth.GoogleOAuthClient;
import com.shortly.backend.modules.auth.infrastructure.oauth.GoogleOAuthClient.GoogleOAuthException;
import com.shortly.backend.modules.auth.infrastructure.persistence.AppUserRepository;
import com.shortly.backend.modules.auth.infrastructure.persistence.OAuthAccountRepository;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

/**
 * Turns a Google callback into a Shortly login: an existing link wins, then an account with the
 * same e-mail gets linked (only when Google has verified that address), otherwise a new account
 * is created. Each store call runs in its own
 * transaction, like the password login.
 */
@Service
public class GoogleLoginService {

    private static final Logger log = LoggerFactory.getLogger(GoogleLoginService.class);

    static final String UNVERIFIED_EMAIL_MESSAGE =
            "Your Google email address is not verified. Please log in with your password instead.";

    private final GoogleOAuthClient googleOAuthClient;
    private final OAuthAccountRepository oauthAccountRepository;
    private final AppUserRepository appUserRepository;
    private final CredentialService credentialService;
    private final AuthService authService;

    public GoogleLoginService(
            GoogleOAuthClient googleOAuthClient,
            OAuthAccountRepository oauthAccountRepository,
            AppUserRepository appUserRepository,
            CredentialService credentialService,
            AuthService authService
    ) {
        this.googleOAuthClient = googleOAuthClient;
        this.oauthAccountRepository = oauthAccountRepository;
        this.appUserRepository = appUserRepository;
        this.credentialService = credentialService;
        this.authService = authService;
    }

    public IssuedLogin completeLogin(String code, String codeVerifier, SessionMetadata metadata) {
        GoogleIdentity identity;
        try {
            identity = googleOAuthClient.exchangeCode(code, codeVerifier);
        } catch (GoogleOAuthException ex) {
            log.warn("Google code exchange failed: {}", ex.getMessage());
            throw new OAuthLoginException();
        }
        AppUser user = resolveUser(identity);
        return authService.startSession(user, metadata);
    }

    public AppUser resolveUser(GoogleIdentity identity) {
        Optional<OAuthAccount> linked = oauthAccountRepository.findByProviderAccount(
                OAuthProvider.GOOGLE, identity.subject());
        if (linked.isPresent()) {
            return linked.get().getUser();
        }

        Optional<AppUser> existing = appUserRepository.findByEmail(identity.email());
        if (existing.isPresent()) {
            AppUser user = existing.get();
            if (!identity.emailVerified()) {
                log.warn("Refused to link unverified Google email to existing user | userId={}", user.getId());
                throw new OAuthLoginException(UNVERIFIED_EMAIL_MESSAGE);
            }
            if (!oauthAccountRepository.existsForUser(user.getId(), OAuthProvider.GOOGLE)) {
                oauthAccountRepository.save(new OAuthAccount(user, OAuthProvider.GOOGLE, identity.subject()));
                log.info("Linked Google account to existing user | userId={}", user.getId());
            }
            if (user.getAvatarUrl() == null && identity.pictureUrl() != null) {
                user.setAvatarUrl(identity.pictureUrl());
                appUserRepository.save(user);
            }
            return user;
        }

        AppUser created;
        try {
            created = credentialService.createExternal(identity.name(), identity.email(), identity.pictureUrl(),
                    identity.emailVerified());
        } catch (DuplicateEmailException ex) {
            throw new OAuthLoginException("An account with this email was created concurrently. Please try again!");
        }
        oauthAccountRepository.save(new OAuthAccount(created, OAuthProvider.GOOGLE, identity.subject()));
        log.info("Created user from Google login | userId={}", created.getId());
        return created;
    }
}

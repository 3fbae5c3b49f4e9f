package com.shortly.backend.modules.auth.application;

import java.util.UUID;

import com.shortly.backend.global.security.AuthenticatedUser;
import com.shortly.backend.modules.auth.domain.AppUser;
import com.shortly.backend.modules.auth.presentation.dto.LoginForm;
import com.shortly.backend.modules.auth.presentation.dto.RegisterForm;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.mail.MailException;
import org.springframework.stereotype.Service;

/**
 * Register, login and logout. Each store call runs in its own transaction; tokens are only
 * handed back once the user and session rows exist.
 */
@Service
public class AuthService {

    private static final Logger log = LoggerFactory.getLogger(AuthService.class);

    private final CredentialService credentialService;
    private final SessionService sessionService;
    private final JwtTokenService jwtTokenService;
    private final EmailVerificationService emailVerificationService;

    public AuthService(
            CredentialService credentialService,
            SessionService sessionService,
            JwtTokenService jwtTokenService,
            EmailVerificationService emailVerificationService
    ) {
        this.credentialService = credentialService;
        this.sessionService = sessionService;
        this.jwtTokenService = jwtTokenService;
        this.emailVerificationService = emailVerificationService;
    }

    public IssuedLogin register(RegisterForm form, SessionMetadata metadata) {
        String email = form.normalizedEmail();
        if (credentialService.findByEmail(email).isPresent()) {
            log.info("Registration rejected, email taken");
            throw new UserExistsException();
        }

        AppUser user;
        try {
            user = credentialService.create(new NewUser(form.normalizedName(), email, form.password()));
        } catch (DuplicateEmailException ex) {
            log.info("Registration lost a concurrent insert race for the same email");
            throw new UserExistsException();
        }
        log.info("User registered | userId={}", user.getId());

        IssuedLogin login = startSession(user, metadata);
        sendVerificationCode(user);
        return login;
    }

    public IssuedLogin login(LoginForm form, SessionMetadata metadata) {
        AppUser user = credentialService.findByEmail(form.normalizedEmail())
                .orElseThrow(() -> {
                    log.info("Login failed, unknown email");
                    return new InvalidCredentialsException();
                });

        if (!credentialService.passwordMatches(user, form.password())) {
            log.info("Login failed, bad password | userId={}", user.getId());
            throw new InvalidCredentialsException();
        }

        return startSession(user, metadata);
    }

    /**
     * Creates a session for an already authenticated user and mints the token pair bound to it.
     */
    public IssuedLogin startSession(AppUser user, SessionMetadata metadata) {
        UUID sessionId = sessionService.create(user.getId(), metadata);
        TokenPair tokens = jwtTokenService.issueTokenPair(user.getId(), user.getName(), user.getEmail(), sessionId);
        log.info("Login succeeded | userId={} sessionId={}", user.getId(), sessionId);
        return new IssuedLogin(user, sessionId, tokens);
    }

    public void logout(AuthenticatedUser identity) {
        sessionService.revoke(identity.sessionId());
        log.info("Logout | userId={} sessionId={}", identity.userId(), identity.sessionId());
    }

    /**
     * Revokes every session of the caller, the current one included. Access tokens already handed
     * to other devices keep working until they expire.
     */
    public int logoutEverywhere(AuthenticatedUser identity) {
        int revoked = sessionService.revokeAllForUser(identity.userId());
        log.info("Logout on all devices | userId={} revokedSessions={}", identity.userId(), revoked);
        return revoked;
    }

    private void sendVerificationCode(AppUser user) {
        try {
            emailVerificationService.sendVerificationCode(user.getId());
        } catch (MailException ex) {
            // the user can ask for a new code from the verification page
            log.error("Verification mail failed after registration | userId={}", user.getId(), ex);
        }
    }
}

package com.shortly.backend.modules.auth.application;

import java.security.SecureRandom;
import java.time.Clock;
import java.time.Duration;
import java.time.OffsetDateTime;
import java.util.UUID;

import com.shortly.backend.modules.auth.domain.AppUser;
import com.shortly.backend.modules.auth.domain.EmailVerificationToken;
import com.shortly.backend.modules.auth.infrastructure.mail.VerificationMailSender;
import com.shortly.backend.modules.auth.infrastructure.persistence.AppUserRepository;
import com.shortly.backend.modules.auth.infrastructure.persistence.EmailVerificationTokenRepository;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;
import org.springframework.web.util.UriComponentsBuilder;

/**
 * Issues and checks the 8-digit codes that flip a user's e-mail-verified flag.
 */
@Service
public class EmailVerificationService {

    private static final Logger log = LoggerFactory.getLogger(EmailVerificationService.class);

    static final Duration CODE_TTL = Duration.ofDays(1);
    private static final int CODE_LOWER_BOUND = 10_000_000;
    private static final int CODE_UPPER_BOUND = 100_000_000;

    private final EmailVerificationTokenRepository tokenRepository;
    private final AppUserRepository appUserRepository;
    private final VerificationMailSender mailSender;
    private final Clock clock;
    private final String frontendUrl;
    private final SecureRandom secureRandom = new SecureRandom();

    public EmailVerificationService(
            EmailVerificationTokenRepository tokenRepository,
            AppUserRepository appUserRepository,
            VerificationMailSender mailSender,
            Clock clock,
            @Value("${app.frontend-url:http://localhost:3000}") String frontendUrl
    ) {
        this.tokenRepository = tokenRepository;
        this.appUserRepository = appUserRepository;
        this.mailSender = mailSender;
        this.clock = clock;
        this.frontendUrl = frontendUrl;
    }

    /**
     * Replaces any outstanding code for the user with a new one and mails it.
     * Mail failures propagate so callers can decide whether they are fatal.
     */
    @Transactional
    public void sendVerificationCode(UUID userId) {
        AppUser user = appUserRepository.findById(userId)
                .orElseThrow(() -> new IllegalArgumentException("Unknown user " + userId));

        tokenRepository.deleteByUserId(user.getId());
        String code = generateCode();
        OffsetDateTime now = OffsetDateTime.now(clock);
        tokenRepository.save(new EmailVerificationToken(user, code, now.plus(CODE_TTL)));

        mailSender.send(user.getEmail(), user.getName(), code, buildVerifyLink(user.getEmail(), code));
        log.info("Verification code sent | userId={}", user.getId());
    }

    @Transactional
    public AppUser verify(String email, String code) {
        EmailVerificationToken token = tokenRepository.findUsable(email, code, OffsetDateTime.now(clock))
                .orElseThrow(InvalidVerificationCodeException::new);

        AppUser user = token.getUser();
        user.markEmailVerified();
        appUserRepository.save(user);
        tokenRepository.deleteByUserId(user.getId());
        log.info("Email verified | userId={}", user.getId());
        return user;
    }

    @Transactional
    public int purgeExpiredCodes() {
        return tokenRepository.deleteExpired(OffsetDateTime.now(clock));
    }

    String buildVerifyLink(String email, String code) {
        return UriComponentsBuilder.fromHttpUrl(frontendUrl)
                .path("/verify-email-token")
                .queryParam("token", "{token}")
                .queryParam("email", "{email}")
                .encode()
                .buildAndExpand(code, email)
                .toUriString();
    }

    private String generateCode() {
        return String.valueOf(CODE_LOWER_BOUND + secureRandom.nextInt(CODE_UPPER_BOUND - CODE_LOWER_BOUND));
    }
}

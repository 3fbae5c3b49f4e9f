package com.shortly.backend.modules.auth.presentation;

import java.util.Optional;

import com.shortly.backend.global.security.AuthenticatedUser;
import com.shortly.backend.global.security.SecurityUtils;
import com.shortly.backend.global.web.FlashRedirects;
import com.shortly.backend.modules.auth.application.CredentialService;
import com.shortly.backend.modules.auth.application.EmailVerificationService;
import com.shortly.backend.modules.auth.application.InvalidVerificationCodeException;
import com.shortly.backend.modules.auth.domain.AppUser;
import com.shortly.backend.modules.auth.presentation.dto.VerifyEmailPageResponse;

import jakarta.servlet.http.HttpServletRequest;
import jakarta.servlet.http.HttpServletResponse;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.ResponseEntity;
import org.springframework.mail.MailException;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

@RestController
public class EmailVerificationController {

    private static final Logger log = LoggerFactory.getLogger(EmailVerificationController.class);

    static final String RESENT_MESSAGE = "Verification link sent to your email. Please check your inbox.";
    static final String RESEND_FAILED_MESSAGE = "Failed to send verification email. Please try again later.";
    static final String MALFORMED_LINK_MESSAGE = "Verification link invalid or expired. Please request a new code.";
    static final String VERIFIED_MESSAGE = "Email verified successfully.";

    private static final String VERIFY_PAGE = "/verify-email";

    private final EmailVerificationService emailVerificationService;
    private final CredentialService credentialService;

    public EmailVerificationController(EmailVerificationService emailVerificationService,
                                       CredentialService credentialService) {
        this.emailVerificationService = emailVerificationService;
        this.credentialService = credentialService;
    }

    @GetMapping("/verify-email")
    public ResponseEntity<?> verifyEmailPage(HttpServletRequest request) {
        Optional<AuthenticatedUser> current = SecurityUtils.currentUser();
        if (current.isEmpty()) {
            return FlashRedirects.redirect("/login");
        }
        Optional<AppUser> user = credentialService.findById(current.get().userId());
        if (user.isEmpty()) {
            return FlashRedirects.redirect("/login");
        }
        if (user.get().isEmailVerified()) {
            return FlashRedirects.redirect("/");
        }
        return ResponseEntity.ok(new VerifyEmailPageResponse(
                user.get().getEmail(),
                FlashRedirects.messages(request, FlashRedirects.ERRORS),
                FlashRedirects.messages(request, FlashRedirects.SUCCESS)));
    }

    @PostMapping("/resend-verification-link")
    public ResponseEntity<Void> resendVerificationLink(HttpServletRequest request, HttpServletResponse response) {
        Optional<AppUser> user = SecurityUtils.currentUser()
                .flatMap(current -> credentialService.findById(current.userId()));
        if (user.isEmpty() || user.get().isEmailVerified()) {
            return FlashRedirects.redirect("/");
        }
        try {
            emailVerificationService.sendVerificationCode(user.get().getId());
            return FlashRedirects.redirectWithSuccess(request, response, VERIFY_PAGE, RESENT_MESSAGE);
        } catch (MailException ex) {
            log.error("Resending verification mail failed | userId={}", user.get().getId(), ex);
            return FlashRedirects.redirectWithError(request, response, VERIFY_PAGE, RESEND_FAILED_MESSAGE);
        }
    }

    @GetMapping("/verify-email-token")
    public ResponseEntity<Void> verifyEmailToken(
            @RequestParam(name = "token", required = false) String token,
            @RequestParam(name = "email", required = false) String email,
            HttpServletRequest request,
            HttpServletResponse response
    ) {
        if (!isWellFormedCode(token) || email == null || email.isBlank()) {
            return FlashRedirects.redirectWithError(request, response, VERIFY_PAGE, MALFORMED_LINK_MESSAGE);
        }
        try {
            emailVerificationService.verify(email.trim(), token);
        } catch (InvalidVerificationCodeException ex) {
            return FlashRedirects.redirectWithError(request, response, VERIFY_PAGE, ex.getDetailMessage());
        }
        return FlashRedirects.redirectWithSuccess(request, response, "/profile", VERIFIED_MESSAGE);
    }

    private static boolean isWellFormedCode(String token) {
        return token != null && token.length() == 8 && token.chars().allMatch(Character::isDigit);
    }
}

package com.shortly.backend.modules.auth.presentation;

import java.net.URI;
import java.time.Duration;

import com.shortly.backend.global.security.AuthCookieWriter;
import com.shortly.backend.global.security.SecurityUtils;
import com.shortly.backend.global.web.FlashRedirects;
import com.shortly.backend.modules.auth.application.GoogleLoginService;
import com.shortly.backend.modules.auth.application.IssuedLogin;
import com.shortly.backend.modules.auth.application.OAuthLoginException;
import com.shortly.backend.modules.auth.application.SessionMetadata;
import com.shortly.backend.modules.auth.infrastructure.oauth.GoogleOAuthClient;
import com.shortly.backend.modules.auth.infrastructure.oauth.PkceChallenge;

import jakarta.servlet.http.Cookie;
import jakarta.servlet.http.HttpServletRequest;
import jakarta.servlet.http.HttpServletResponse;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;
import org.springframework.web.util.WebUtils;

@RestController
public class GoogleLoginController {

    private static final Logger log = LoggerFactory.getLogger(GoogleLoginController.class);

    static final String STATE_COOKIE = "google_oauth_state";
    static final String CODE_VERIFIER_COOKIE = "google_code_verifier";
    static final Duration OAUTH_EXCHANGE_TTL = Duration.ofMinutes(10);
    static final String NOT_CONFIGURED_MESSAGE = "Google login is not available right now.";

    private final GoogleOAuthClient googleOAuthClient;
    private final GoogleLoginService googleLoginService;
    private final AuthCookieWriter cookieWriter;

    public GoogleLoginController(GoogleOAuthClient googleOAuthClient,
                                 GoogleLoginService googleLoginService,
                                 AuthCookieWriter cookieWriter) {
        this.googleOAuthClient = googleOAuthClient;
        this.googleLoginService = googleLoginService;
        this.cookieWriter = cookieWriter;
    }

    @GetMapping("/google")
    public ResponseEntity<Void> startGoogleLogin(HttpServletRequest request, HttpServletResponse response) {
        if (SecurityUtils.currentUser().isPresent()) {
            return FlashRedirects.redirect("/");
        }
        if (!googleOAuthClient.isConfigured()) {
            log.warn("Google login requested but no client credentials are configured");
            return FlashRedirects.redirectWithError(request, response, "/login", NOT_CONFIGURED_MESSAGE);
        }

        String state = PkceChallenge.randomValue();
        String codeVerifier = PkceChallenge.randomValue();
        URI authorizationUri = googleOAuthClient.createAuthorizationUri(state, codeVerifier);

        cookieWriter.write(response, STATE_COOKIE, state, OAUTH_EXCHANGE_TTL);
        cookieWriter.write(response, CODE_VERIFIER_COOKIE, codeVerifier, OAUTH_EXCHANGE_TTL);
        return ResponseEntity.status(HttpStatus.FOUND).location(authorizationUri).build();
    }

    @GetMapping("/google/callback")
    public ResponseEntity<Void> googleCallback(
            @RequestParam(name = "code", required = false) String code,
            @RequestParam(name = "state", required = false) String state,
            HttpServletRequest request,
            HttpServletResponse response
    ) {
        String storedState = cookieValue(request, STATE_COOKIE);
        String codeVerifier = cookieValue(request, CODE_VERIFIER_COOKIE);
        cookieWriter.clear(response, STATE_COOKIE);
        cookieWriter.clear(response, CODE_VERIFIER_COOKIE);

        if (code == null || state == null || storedState == null || codeVerifier == null
                || !state.equals(storedState)) {
            log.info("Google callback rejected, missing value or state mismatch");
            return FlashRedirects.redirectWithError(request, response, "/login", OAuthLoginException.DEFAULT_MESSAGE);
        }

        try {
            IssuedLogin login = googleLoginService.completeLogin(code, codeVerifier, SessionMetadata.from(request));
            cookieWriter.writeTokens(response, login.tokens());
            return FlashRedirects.redirect("/");
        } catch (OAuthLoginException ex) {
            return FlashRedirects.redirectWithError(request, response, "/login", ex.getDetailMessage());
        }
    }

    private String cookieValue(HttpServletRequest request, String name) {
        Cookie cookie = WebUtils.getCookie(request, name);
        return cookie != null ? cookie.getValue() : null;
    }
}

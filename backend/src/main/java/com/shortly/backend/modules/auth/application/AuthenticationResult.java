package com.shortly.backend.modules.auth.application;

import java.util.Optional;

import com.shortly.backend.global.security.AuthenticatedUser;

/**
 * Outcome of classifying one request's auth cookies: the identity (if any) and what must happen
 * to the cookies on the response.
 */
public record AuthenticationResult(AuthenticatedUser identity, CookieAction cookieAction, TokenPair reissuedTokens) {

    public enum CookieAction {
        NONE,
        REISSUE,
        CLEAR
    }

    public static AuthenticationResult anonymous() {
        return new AuthenticationResult(null, CookieAction.NONE, null);
    }

    public static AuthenticationResult anonymousClearingCookies() {
        return new AuthenticationResult(null, CookieAction.CLEAR, null);
    }

    public static AuthenticationResult authenticated(AuthenticatedUser identity) {
        return new AuthenticationResult(identity, CookieAction.NONE, null);
    }

    public static AuthenticationResult refreshed(AuthenticatedUser identity, TokenPair tokens) {
        return new AuthenticationResult(identity, CookieAction.REISSUE, tokens);
    }

    public Optional<AuthenticatedUser> user() {
        return Optional.ofNullable(identity);
    }

    public boolean isAuthenticated() {
        return identity != null;
    }
}

package com.shortly.backend.global.security;

import java.time.Duration;

import com.shortly.backend.modules.auth.application.TokenPair;

import jakarta.servlet.http.HttpServletResponse;

import org.springframework.beans.factory.annotation.Value;
import org.springframework.http.HttpHeaders;
import org.springframework.http.ResponseCookie;
import org.springframework.stereotype.Component;

/**
 * Writes and clears the HttpOnly cookies the browser carries between requests.
 */
@Component
public class AuthCookieWriter {

    public static final String ACCESS_TOKEN_COOKIE = "access_token";
    public static final String REFRESH_TOKEN_COOKIE = "refresh_token";
    private static final String SAME_SITE_LAX = "Lax";

    private final boolean secure;

    public AuthCookieWriter(@Value("${app.auth.cookie.secure:true}") boolean secure) {
        this.secure = secure;
    }

    public void writeTokens(HttpServletResponse response, TokenPair tokens) {
        write(response, ACCESS_TOKEN_COOKIE, tokens.accessToken(), tokens.accessTokenTtl());
        write(response, REFRESH_TOKEN_COOKIE, tokens.refreshToken(), tokens.refreshTokenTtl());
    }

    public void clearTokens(HttpServletResponse response) {
        clear(response, ACCESS_TOKEN_COOKIE);
        clear(response, REFRESH_TOKEN_COOKIE);
    }

    public void write(HttpServletResponse response, String name, String value, Duration maxAge) {
        response.addHeader(HttpHeaders.SET_COOKIE, baseCookie(name, value).maxAge(maxAge).build().toString());
    }

    public void clear(HttpServletResponse response, String name) {
        response.addHeader(HttpHeaders.SET_COOKIE, baseCookie(name, "").maxAge(Duration.ZERO).build().toString());
    }

    private ResponseCookie.ResponseCookieBuilder baseCookie(String name, String value) {
        return ResponseCookie.from(name, value)
                .httpOnly(true)
                .secure(secure)
                .path("/")
                .sameSite(SAME_SITE_LAX);
    }
}

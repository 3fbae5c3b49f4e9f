package com.shortly.backend.global.security;

import java.io.IOException;
import java.util.List;

import com.shortly.backend.modules.auth.application.AuthenticationOrchestrator;
import com.shortly.backend.modules.auth.application.AuthenticationResult;

import jakarta.servlet.FilterChain;
import jakarta.servlet.ServletException;
import jakarta.servlet.http.Cookie;
import jakarta.servlet.http.HttpServletRequest;
import jakarta.servlet.http.HttpServletResponse;

import org.springframework.lang.NonNull;
import org.springframework.security.authentication.UsernamePasswordAuthenticationToken;
import org.springframework.security.core.context.SecurityContextHolder;
import org.springframework.security.web.authentication.WebAuthenticationDetailsSource;
import org.springframework.stereotype.Component;
import org.springframework.web.filter.OncePerRequestFilter;
import org.springframework.web.util.WebUtils;

/**
 * Resolves the request identity from the token cookies and always continues the chain.
 * Whether a route needs an identity is up to its handler.
 */
@Component
public class CookieAuthenticationFilter extends OncePerRequestFilter {

    private final AuthenticationOrchestrator orchestrator;
    private final AuthCookieWriter cookieWriter;

    public CookieAuthenticationFilter(AuthenticationOrchestrator orchestrator, AuthCookieWriter cookieWriter) {
        this.orchestrator = orchestrator;
        this.cookieWriter = cookieWriter;
    }

    @Override
    protected void doFilterInternal(@NonNull HttpServletRequest request,
                                    @NonNull HttpServletResponse response,
                                    @NonNull FilterChain filterChain) throws ServletException, IOException {
        AuthenticationResult result = orchestrator.authenticate(
                cookieValue(request, AuthCookieWriter.ACCESS_TOKEN_COOKIE),
                cookieValue(request, AuthCookieWriter.REFRESH_TOKEN_COOKIE));

        switch (result.cookieAction()) {
            case REISSUE -> cookieWriter.writeTokens(response, result.reissuedTokens());
            case CLEAR -> cookieWriter.clearTokens(response);
            case NONE -> {
            }
        }

        result.user().ifPresent(user -> {
            UsernamePasswordAuthenticationToken authentication =
                    new UsernamePasswordAuthenticationToken(user, null, List.of());
            authentication.setDetails(new WebAuthenticationDetailsSource().buildDetails(request));
            SecurityContextHolder.getContext().setAuthentication(authentication);
        });

        filterChain.doFilter(request, response);
    }

    @Override
    protected boolean shouldNotFilter(@NonNull HttpServletRequest request) {
        return request.getServletPath().startsWith("/actuator");
    }

    private String cookieValue(HttpServletRequest request, String name) {
        Cookie cookie = WebUtils.getCookie(request, name);
        return cookie != null ? cookie.getValue() : null;
    }
}

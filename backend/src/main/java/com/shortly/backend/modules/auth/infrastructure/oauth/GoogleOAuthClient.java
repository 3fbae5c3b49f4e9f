package com.shortly.backend.modules.auth.infrastructure.oauth;

import java.io.IOException;
import java.net.URI;
import java.nio.charset.StandardCharsets;
import java.util.Base64;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;

import org.springframework.beans.factory.annotation.Value;
import org.springframework.http.MediaType;
import org.springframework.stereotype.Component;
import org.springframework.util.LinkedMultiValueMap;
import org.springframework.util.MultiValueMap;
import org.springframework.util.StringUtils;
import org.springframework.web.client.RestClient;
import org.springframework.web.client.RestClientException;
import org.springframework.web.util.UriComponentsBuilder;

/**
 * Authorization-code + PKCE exchange against Google. The id_token is taken from the token
 * endpoint response over TLS, so only its payload is decoded.
 */
@Component
public class GoogleOAuthClient {

    static final String AUTHORIZATION_ENDPOINT = "https://accounts.google.com/o/oauth2/v2/auth";
    static final String TOKEN_ENDPOINT = "https://oauth2.googleapis.com/token";
    private static final String SCOPES = "openid profile email";

    private final RestClient restClient;
    private final ObjectMapper objectMapper;
    private final String clientId;
    private final String clientSecret;
    private final String redirectUri;

    public GoogleOAuthClient(
            RestClient.Builder restClientBuilder,
            ObjectMapper objectMapper,
            @Value("${app.oauth.google.client-id:}") String clientId,
            @Value("${app.oauth.google.client-secret:}") String clientSecret,
            @Value("${app.oauth.google.redirect-uri:http://localhost:3000/google/callback}") String redirectUri
    ) {
        this.restClient = restClientBuilder.build();
        this.objectMapper = objectMapper;
        this.clientId = clientId;
        this.clientSecret = clientSecret;
        this.redirectUri = redirectUri;
    }

    public boolean isConfigured() {
        return StringUtils.hasText(clientId) && StringUtils.hasText(clientSecret);
    }

    public URI createAuthorizationUri(String state, String codeVerifier) {
        return UriComponentsBuilder.fromHttpUrl(AUTHORIZATION_ENDPOINT)
                .queryParam("response_type", "code")
                .queryParam("client_id", clientId)
                .queryParam("redirect_uri", redirectUri)
                .queryParam("scope", SCOPES)
                .queryParam("state", state)
                .queryParam("code_challenge", PkceChallenge.s256(codeVerifier))
                .queryParam("code_challenge_method", "S256")
                .encode()
                .build()
                .toUri();
    }

    public GoogleIdentity exchangeCode(String code, String codeVerifier) {
        MultiValueMap<String, String> form = new LinkedMultiValueMap<>();
        form.add("grant_type", "authorization_code");
        form.add("code", code);
        form.add("redirect_uri", redirectUri);
        form.add("client_id", clientId);
        form.add("client_secret", clientSecret);
        form.add("code_verifier", codeVerifier);

        JsonNode response;
        try {
            response = restClient.post()
                    .uri(TOKEN_ENDPOINT)
                    .contentType(MediaType.APPLICATION_FORM_URLENCODED)
                    .accept(MediaType.APPLICATION_JSON)
                    .body(form)
                    .retrieve()
                    .body(JsonNode.class);
        } catch (RestClientException ex) {
            throw new GoogleOAuthException("Token exchange failed", ex);
        }

        String idToken = response != null ? response.path("id_token").asText(null) : null;
        if (!StringUtils.hasText(idToken)) {
            throw new GoogleOAuthException("Token response carried no id_token", null);
        }
        return decodeIdToken(idToken);
    }

    GoogleIdentity decodeIdToken(String idToken) {
        String[] parts = idToken.split("\\.");
        if (parts.length < 2) {
            throw new GoogleOAuthException("id_token is not a JWT", null);
        }
        try {
            byte[] payload = Base64.getUrlDecoder().decode(parts[1]);
            JsonNode claims = objectMapper.readTree(new String(payload, StandardCharsets.UTF_8));
            String subject = claims.path("sub").asText(null);
            String email = claims.path("email").asText(null);
            if (!StringUtils.hasText(subject) || !StringUtils.hasText(email)) {
                throw new GoogleOAuthException("id_token lacks sub or email", null);
            }
            String name = claims.path("name").asText(email);
            boolean emailVerified = claims.path("email_verified").asBoolean(false);
            return new GoogleIdentity(subject, name, email, emailVerified, claims.path("picture").asText(null));
        } catch (IllegalArgumentException | IOException ex) {
            throw new GoogleOAuthException("id_token payload unreadable", ex);
        }
    }

    public static class GoogleOAuthException extends RuntimeException {
        public GoogleOAuthException(String message, Throwable cause) {
            super(message, cause);
        }
    }
}

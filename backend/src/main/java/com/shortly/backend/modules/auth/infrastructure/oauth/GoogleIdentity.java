package com.shortly.backend.modules.auth.infrastructure.oauth;

/**
 * Claims read from Google's id_token. {@code emailVerified} is false when the claim is missing.
 */
public record GoogleIdentity(String subject, String name, String email, boolean emailVerified, String pictureUrl) {
}

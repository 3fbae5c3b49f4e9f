package com.shortly.backend.modules.auth.application;

import java.time.Instant;
import java.util.UUID;

public record AccessTokenClaims(UUID userId, String name, String email, UUID sessionId, Instant issuedAt,
                                Instant expiresAt) {
}

package com.shortly.backend.modules.auth.application;

import java.time.Instant;
import java.util.UUID;

public record RefreshTokenClaims(UUID sessionId, Instant issuedAt, Instant expiresAt) {
}

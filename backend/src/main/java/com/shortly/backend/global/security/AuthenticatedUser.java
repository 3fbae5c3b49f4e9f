package com.shortly.backend.global.security;

import java.util.UUID;

/**
 * Identity placed in the security context for a request authenticated by cookie tokens.
 */
public record AuthenticatedUser(UUID userId, String name, String email, UUID sessionId) {
}

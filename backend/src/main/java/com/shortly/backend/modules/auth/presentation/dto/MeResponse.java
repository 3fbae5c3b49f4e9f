package com.shortly.backend.modules.auth.presentation.dto;

import java.util.UUID;

import com.shortly.backend.global.security.AuthenticatedUser;

public record MeResponse(UUID userId, String name, String email, UUID sessionId) {

    public static MeResponse from(AuthenticatedUser user) {
        return new MeResponse(user.userId(), user.name(), user.email(), user.sessionId());
    }
}

package com.shortly.backend.modules.auth.presentation.dto;

import java.time.OffsetDateTime;
import java.util.List;
import java.util.UUID;

public record UserProfileResponse(
        UUID id,
        String name,
        String email,
        boolean emailVerified,
        String avatarUrl,
        OffsetDateTime createdAt,
        long linkCount,
        List<String> success
) {
}

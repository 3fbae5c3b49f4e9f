package com.shortly.backend.modules.link.presentation.dto;

import java.time.OffsetDateTime;
import java.util.UUID;

import com.shortly.backend.modules.link.domain.ShortLink;

public record ShortLinkResponse(UUID id, String shortCode, String url, OffsetDateTime createdAt) {

    public static ShortLinkResponse from(ShortLink link) {
        return new ShortLinkResponse(link.getId(), link.getShortCode(), link.getUrl(), link.getCreatedAt());
    }
}

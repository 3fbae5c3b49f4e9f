package com.shortly.backend.modules.link.presentation.dto;

import java.util.List;

import com.shortly.backend.modules.auth.presentation.dto.MeResponse;

public record HomePageResponse(
        MeResponse user,
        List<ShortLinkResponse> links,
        List<String> errors,
        List<String> success
) {
}

package com.shortly.backend.modules.link.presentation.dto;

import java.util.List;

public record EditLinkPageResponse(ShortLinkResponse link, List<String> errors) {
}

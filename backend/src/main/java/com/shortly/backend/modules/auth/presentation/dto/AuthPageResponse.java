package com.shortly.backend.modules.auth.presentation.dto;

import java.util.List;

public record AuthPageResponse(String page, List<String> errors, List<String> success) {
}

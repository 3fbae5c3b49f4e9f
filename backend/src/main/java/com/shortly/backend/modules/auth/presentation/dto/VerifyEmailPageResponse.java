package com.shortly.backend.modules.auth.presentation.dto;

import java.util.List;

public record VerifyEmailPageResponse(String email, List<String> errors, List<String> success) {
}

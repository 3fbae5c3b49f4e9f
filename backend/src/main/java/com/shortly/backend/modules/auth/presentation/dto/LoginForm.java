package com.shortly.backend.modules.auth.presentation.dto;

import java.util.List;

import jakarta.validation.constraints.Email;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.Size;

public record LoginForm(
        @NotBlank(message = "Email is required")
        @Email(message = "Please enter a valid email address")
        @Size(max = 100, message = "Email must be no more than 100 characters")
        String email,

        @NotBlank(message = "Password is required")
        @Size(max = 100, message = "Password must be no more than 100 characters")
        String password
) {

    public static final List<String> FIELD_ORDER = List.of("email", "password");

    public String normalizedEmail() {
        return email.trim();
    }
}

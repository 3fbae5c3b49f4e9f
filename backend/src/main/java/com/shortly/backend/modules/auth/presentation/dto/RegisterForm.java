package com.shortly.backend.modules.auth.presentation.dto;

import java.util.List;

import jakarta.validation.constraints.Email;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.Size;

public record RegisterForm(
        @NotBlank(message = "Name is required")
        @Size(min = 3, max = 100, message = "Name must be between 3 and 100 characters long")
        String name,

        @NotBlank(message = "Email is required")
        @Email(message = "Please enter a valid email address")
        @Size(max = 100, message = "Email must be no more than 100 characters")
        String email,

        @NotBlank(message = "Password is required")
        @Size(min = 6, max = 100, message = "Password must be between 6 and 100 characters long")
        String password
) {

    public static final List<String> FIELD_ORDER = List.of("name", "email", "password");

    public String normalizedName() {
        return name.trim();
    }

    public String normalizedEmail() {
        return email.trim();
    }
}

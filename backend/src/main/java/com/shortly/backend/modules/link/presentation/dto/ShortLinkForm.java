package com.shortly.backend.modules.link.presentation.dto;

import java.util.List;

import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.Pattern;
import jakarta.validation.constraints.Size;

import org.hibernate.validator.constraints.URL;

public record ShortLinkForm(
        @NotBlank(message = "URL is required")
        @URL(regexp = "^(?i)https?:.*", message = "Please enter a valid URL")
        @Size(max = 2048, message = "URL cannot be longer than 2048 characters")
        String url,

        @Pattern(regexp = "^$|^[A-Za-z0-9_-]{3,16}$",
                message = "Short code must be 3 to 16 letters, digits, '-' or '_'")
        String shortCode
) {

    public static final List<String> FIELD_ORDER = List.of("url", "shortCode");
}

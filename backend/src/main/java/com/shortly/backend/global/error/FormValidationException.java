package com.shortly.backend.global.error;

import java.util.List;
import java.util.Objects;

import org.springframework.http.HttpStatus;
import org.springframework.validation.BindingResult;
import org.springframework.validation.FieldError;

/**
 * A submitted form failed validation. Carries only the first violation, in the form's field order.
 */
public class FormValidationException extends ProblemException {

    private static final String DEFAULT_MESSAGE = "Validation error";

    public FormValidationException(String message) {
        super(HttpStatus.UNPROCESSABLE_ENTITY, "VALIDATION_ERROR", message);
    }

    public static void throwIfInvalid(BindingResult bindingResult, List<String> fieldOrder) {
        if (!bindingResult.hasErrors()) {
            return;
        }
        String message = fieldOrder.stream()
                .map(bindingResult::getFieldError)
                .filter(Objects::nonNull)
                .map(FieldError::getDefaultMessage)
                .filter(Objects::nonNull)
                .findFirst()
                .orElse(DEFAULT_MESSAGE);
        throw new FormValidationException(message);
    }
}

package com.shortly.backend.global.error;

import static org.assertj.core.api.Assertions.assertThatCode;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import java.util.List;

import org.junit.jupiter.api.Test;
import org.springframework.validation.BeanPropertyBindingResult;
import org.springframework.validation.BindingResult;
import org.springframework.validation.FieldError;

class FormValidationExceptionTest {

    private static final List<String> FIELD_ORDER = List.of("name", "email", "password");

    @Test
    void firstViolationInFieldOrderWins() {
        BindingResult result = new BeanPropertyBindingResult(new Object(), "form");
        result.addError(new FieldError("form", "password", "Password too short"));
        result.addError(new FieldError("form", "email", "Please enter a valid email address"));

        assertThatThrownBy(() -> FormValidationException.throwIfInvalid(result, FIELD_ORDER))
                .isInstanceOf(FormValidationException.class)
                .hasFieldOrPropertyWithValue("detailMessage", "Please enter a valid email address")
                .hasFieldOrPropertyWithValue("code", "VALIDATION_ERROR");
    }

    @Test
    void globalErrorsOnlyFallBackToGenericMessage() {
        BindingResult result = new BeanPropertyBindingResult(new Object(), "form");
        result.reject("broken");

        assertThatThrownBy(() -> FormValidationException.throwIfInvalid(result, FIELD_ORDER))
                .hasFieldOrPropertyWithValue("detailMessage", "Validation error");
    }

    @Test
    void validFormPasses() {
        BindingResult result = new BeanPropertyBindingResult(new Object(), "form");

        assertThatCode(() -> FormValidationException.throwIfInvalid(result, FIELD_ORDER)).doesNotThrowAnyException();
    }
}

package com.shortly.backend.modules.auth.application;

import com.shortly.backend.global.error.ProblemException;

import org.springframework.http.HttpStatus;

public class InvalidVerificationCodeException extends ProblemException {

    public InvalidVerificationCodeException() {
        super(HttpStatus.BAD_REQUEST, "INVALID_VERIFICATION_CODE",
                "Verification code is invalid or expired. Please request a new code.");
    }
}

package com.shortly.backend.modules.auth.application;

import com.shortly.backend.global.error.ProblemException;

import org.springframework.http.HttpStatus;

/**
 * Deliberately the same for an unknown e-mail and a wrong password.
 */
public class InvalidCredentialsException extends ProblemException {

    public InvalidCredentialsException() {
        super(HttpStatus.UNAUTHORIZED, "INVALID_CREDENTIALS", "Invalid email or password.");
    }
}

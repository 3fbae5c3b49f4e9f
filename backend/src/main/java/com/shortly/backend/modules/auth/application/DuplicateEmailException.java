package com.shortly.backend.modules.auth.application;

/**
 * The e-mail unique constraint rejected an insert.
 */
public class DuplicateEmailException extends RuntimeException {

    public DuplicateEmailException(String email, Throwable cause) {
        super("Email already registered: " + email, cause);
    }
}

package com.shortly.backend.modules.auth.application;

import com.shortly.backend.global.error.ProblemException;

import org.springframework.http.HttpStatus;

public class OAuthLoginException extends ProblemException {

    public static final String DEFAULT_MESSAGE =
            "Couldn't login with Google because of invalid login attempt. Please try again!";

    public OAuthLoginException() {
        this(DEFAULT_MESSAGE);
    }

    public OAuthLoginException(String detail) {
        super(HttpStatus.UNAUTHORIZED, "OAUTH_LOGIN_FAILED", detail);
    }
}

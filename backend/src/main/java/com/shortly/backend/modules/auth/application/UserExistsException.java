package com.shortly.backend.modules.auth.application;

import com.shortly.backend.global.error.ProblemException;

import org.springframework.http.HttpStatus;

public class UserExistsException extends ProblemException {

    public UserExistsException() {
        super(HttpStatus.CONFLICT, "USER_EXISTS", "User already exists.");
    }
}

package com.shortly.backend.modules.link.application;

import com.shortly.backend.global.error.ProblemException;

import org.springframework.http.HttpStatus;

public class ShortLinkNotFoundException extends ProblemException {

    public ShortLinkNotFoundException() {
        super(HttpStatus.NOT_FOUND, "SHORT_LINK_NOT_FOUND", "Short link not found");
    }
}

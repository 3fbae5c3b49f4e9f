package com.shortly.backend.modules.link.application;

import com.shortly.backend.global.error.ProblemException;

import org.springframework.http.HttpStatus;

public class ShortLinkExistsException extends ProblemException {

    public ShortLinkExistsException() {
        super(HttpStatus.CONFLICT, "SHORT_CODE_EXISTS", "Url with that shortcode already exists, please choose another");
    }
}

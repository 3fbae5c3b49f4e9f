package com.shortly.backend.modules.auth.application;

import java.util.UUID;

import com.shortly.backend.modules.auth.domain.AppUser;

/**
 * A freshly started session and the tokens bound to it, ready to be set as cookies.
 */
public record IssuedLogin(AppUser user, UUID sessionId, TokenPair tokens) {
}

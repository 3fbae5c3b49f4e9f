package com.shortly.backend.modules.auth.domain;

public enum OAuthProvider {
    GOOGLE
}

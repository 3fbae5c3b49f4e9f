package com.shortly.backend.modules.auth.application;

import java.time.Duration;

public record TokenPair(String accessToken, Duration accessTokenTtl, String refreshToken, Duration refreshTokenTtl) {
}

package com.shortly.backend.modules.auth.application;

public record NewUser(String name, String email, String rawPassword) {
}

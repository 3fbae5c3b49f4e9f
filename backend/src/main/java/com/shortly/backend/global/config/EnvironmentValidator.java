package com.shortly.backend.global.config;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import java.util.Optional;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.context.event.ApplicationReadyEvent;
import org.springframework.context.event.EventListener;
import org.springframework.core.env.Environment;
import org.springframework.stereotype.Component;

/**
 * Fails startup when required settings are missing or obviously unsafe.
 */
@Component
public class EnvironmentValidator {

    private static final Logger log = LoggerFactory.getLogger(EnvironmentValidator.class);

    static final String LOCAL_DEV_SECRET = "local-dev-jwt-secret-change-me-before-deploying";
    private static final int MIN_SECRET_LENGTH = 32;

    private final Environment environment;

    public EnvironmentValidator(Environment environment) {
        this.environment = environment;
    }

    @EventListener(ApplicationReadyEvent.class)
    public void validateEnvironment() {
        List<String> problems = new ArrayList<>();

        for (String key : List.of("spring.datasource.url", "jwt.secret")) {
            String value = environment.getProperty(key);
            if (value == null || value.isBlank()) {
                problems.add(key + ": required");
            }
        }

        Optional.ofNullable(environment.getProperty("jwt.secret"))
                .filter(secret -> !secret.isBlank())
                .ifPresent(secret -> {
                    if (secret.length() < MIN_SECRET_LENGTH) {
                        problems.add("jwt.secret: must be at least " + MIN_SECRET_LENGTH + " characters");
                    }
                    if (secret.equals(LOCAL_DEV_SECRET) && !isLocalProfile()) {
                        problems.add("jwt.secret: the local development secret is not allowed outside the local profile");
                    }
                });

        // access: 1 minute to 1 hour, refresh: 1 hour to 30 days (milliseconds)
        checkRange("jwt.access-expiration", 60_000L, 3_600_000L, problems);
        checkRange("jwt.refresh-expiration", 3_600_000L, 2_592_000_000L, problems);

        if (!problems.isEmpty()) {
            problems.forEach(problem -> log.error("Invalid configuration | {}", problem));
            throw new IllegalStateException("Configuration validation failed: " + String.join("; ", problems));
        }
        log.info("Configuration validated");
    }

    private void checkRange(String key, long min, long max, List<String> problems) {
        String raw = environment.getProperty(key);
        if (raw == null) {
            return;
        }
        try {
            long value = Long.parseLong(raw.trim());
            if (value < min || value > max) {
                problems.add(key + ": must be between " + min + " and " + max + " milliseconds");
            }
        } catch (NumberFormatException e) {
            problems.add(key + ": must be a number");
        }
    }

    private boolean isLocalProfile() {
        return Arrays.asList(environment.getActiveProfiles()).contains("local");
    }
}

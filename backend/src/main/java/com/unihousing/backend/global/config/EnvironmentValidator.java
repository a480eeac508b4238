package com.unihousing.backend.global.config;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.context.event.ApplicationStartedEvent;
import org.springframework.context.event.EventListener;
import org.springframework.core.env.Environment;
import org.springframework.scheduling.support.CronExpression;
import org.springframework.stereotype.Component;

/**
 * Checks the externally supplied configuration once the context is up and refuses to serve
 * traffic when a required key is missing or malformed.
 */
@Component
public class EnvironmentValidator {

    private static final Logger log = LoggerFactory.getLogger(EnvironmentValidator.class);

    static final String DEV_JWT_SECRET = "dev-only-unihousing-jwt-secret-change-me-0123456789";
    private static final long MIN_EXPIRATION_MILLIS = 300_000L;
    private static final long MAX_EXPIRATION_MILLIS = 86_400_000L;

    private static final String[] REQUIRED_KEYS = {
            "spring.datasource.url",
            "jwt.secret",
            "jwt.expiration",
            "app.cors.allowed-origins"
    };

    private final Environment environment;

    public EnvironmentValidator(Environment environment) {
        this.environment = environment;
    }

    @EventListener(ApplicationStartedEvent.class)
    public void validateEnvironment() {
        List<String> problems = collectProblems();
        if (!problems.isEmpty()) {
            problems.forEach(problem -> log.error("Configuration problem: {}", problem));
            throw new IllegalStateException("Invalid configuration: " + String.join("; ", problems));
        }
        if (DEV_JWT_SECRET.equals(environment.getProperty("jwt.secret"))) {
            log.warn("jwt.secret is the development default; set JWT_SECRET before deploying");
        }
        log.info("Environment configuration validated");
    }

    List<String> collectProblems() {
        List<String> problems = new ArrayList<>();

        for (String key : REQUIRED_KEYS) {
            String value = Optional.ofNullable(environment.getProperty(key)).map(String::trim).orElse("");
            if (value.isEmpty()) {
                problems.add(key + " is missing");
            }
        }

        String expiration = environment.getProperty("jwt.expiration");
        if (expiration != null && !expiration.isBlank()) {
            try {
                long millis = Long.parseLong(expiration.trim());
                if (millis < MIN_EXPIRATION_MILLIS || millis > MAX_EXPIRATION_MILLIS) {
                    problems.add("jwt.expiration must be between " + MIN_EXPIRATION_MILLIS
                            + " and " + MAX_EXPIRATION_MILLIS + " milliseconds");
                }
            } catch (NumberFormatException ex) {
                problems.add("jwt.expiration must be a number");
            }
        }

        String cron = environment.getProperty("app.attendance.absence-cron");
        if (cron != null && !CronExpression.isValidExpression(cron)) {
            problems.add("app.attendance.absence-cron is not a valid cron expression");
        }
        return problems;
    }
}

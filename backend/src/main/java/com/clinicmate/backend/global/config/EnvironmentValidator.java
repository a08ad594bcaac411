package com.clinicmate.backend.global.config;

import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.Set;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.context.event.ApplicationReadyEvent;
import org.springframework.context.event.EventListener;
import org.springframework.core.env.Environment;
import org.springframework.stereotype.Component;

/**
 * Refuses to finish startup when required settings are missing or the signing secrets are unsafe.
 */
@Component
public class EnvironmentValidator {

    private static final Logger log = LoggerFactory.getLogger(EnvironmentValidator.class);

    static final int MIN_SECRET_BYTES = 32;
    static final long MIN_ACCESS_TTL_MILLIS = 300_000L;
    static final long MAX_ACCESS_TTL_MILLIS = 86_400_000L;

    private static final String[] REQUIRED_KEYS = {
            "spring.datasource.url",
            "jwt.secret",
            "jwt.expiration",
            "jwt.refresh-expiration"
    };
    private static final Set<String> PLACEHOLDER_SECRETS = Set.of(
            "change-me-in-production",
            "dev-jwt-secret-change-me-in-production-0000"
    );

    private final Environment environment;

    public EnvironmentValidator(Environment environment) {
        this.environment = environment;
    }

    @EventListener(ApplicationReadyEvent.class)
    public void validateEnvironment() {
        List<String> problems = validate();
        if (!problems.isEmpty()) {
            log.error("Environment validation failed:");
            problems.forEach(problem -> log.error("  - {}", problem));
            throw new IllegalStateException("Environment validation failed: " + String.join("; ", problems));
        }
        log.info("Environment validation passed");
    }

    List<String> validate() {
        List<String> problems = new ArrayList<>();

        for (String key : REQUIRED_KEYS) {
            if (property(key).isEmpty()) {
                problems.add(key + ": required");
            }
        }

        property("jwt.secret").ifPresent(secret -> checkSecret("jwt.secret", secret, problems));
        property("jwt.refresh-secret").ifPresent(secret -> checkSecret("jwt.refresh-secret", secret, problems));

        Optional<Long> accessTtl = longProperty("jwt.expiration", problems);
        accessTtl.ifPresent(ttl -> {
            if (ttl < MIN_ACCESS_TTL_MILLIS || ttl > MAX_ACCESS_TTL_MILLIS) {
                problems.add("jwt.expiration: must be between " + MIN_ACCESS_TTL_MILLIS + " and "
                        + MAX_ACCESS_TTL_MILLIS + " ms");
            }
        });
        Optional<Long> refreshTtl = longProperty("jwt.refresh-expiration", problems);
        if (accessTtl.isPresent() && refreshTtl.isPresent() && refreshTtl.get() <= accessTtl.get()) {
            problems.add("jwt.refresh-expiration: must be longer than jwt.expiration");
        }

        return problems;
    }

    private void checkSecret(String key, String secret, List<String> problems) {
        if (PLACEHOLDER_SECRETS.contains(secret)) {
            problems.add(key + ": replace the placeholder with a random value");
        } else if (secret.getBytes(StandardCharsets.UTF_8).length < MIN_SECRET_BYTES) {
            problems.add(key + ": must be at least " + MIN_SECRET_BYTES + " bytes for HS256");
        }
    }

    private Optional<Long> longProperty(String key, List<String> problems) {
        Optional<String> raw = property(key);
        if (raw.isEmpty()) {
            return Optional.empty();
        }
        try {
            return Optional.of(Long.parseLong(raw.get()));
        } catch (NumberFormatException e) {
            problems.add(key + ": must be a number");
            return Optional.empty();
        }
    }

    private Optional<String> property(String key) {
        return Optional.ofNullable(environment.getProperty(key))
                .map(String::trim)
                .filter(value -> !value.isEmpty());
    }
}

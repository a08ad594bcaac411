package com.clinicmate.backend.modules.auth.application;

import java.time.Duration;
import java.util.List;
import java.util.Locale;
import java.util.Set;
import java.util.stream.Collectors;

import org.springframework.boot.context.properties.ConfigurationProperties;

/**
 * Tunables of the login flow bound from {@code clinicmate.auth.*}. Missing groups fall back to the
 * defaults below so tests can pass {@code null} for the parts they do not exercise.
 */
@ConfigurationProperties("clinicmate.auth")
public record AuthPolicyProperties(
        Lockout lockout,
        Mfa mfa,
        Password password,
        Cookies cookies,
        Session session
) {

    public AuthPolicyProperties {
        lockout = lockout != null ? lockout : new Lockout(0, null);
        mfa = mfa != null ? mfa : new Mfa(null, null, 0, null, null, null, null, 0, null);
        password = password != null ? password : new Password(0, null, 0);
        cookies = cookies != null ? cookies : new Cookies(null);
        session = session != null ? session : new Session(null, null);
    }

    public record Lockout(int maxFailedAttempts, Duration lockDuration) {
        public Lockout {
            maxFailedAttempts = maxFailedAttempts > 0 ? maxFailedAttempts : 5;
            lockDuration = lockDuration != null ? lockDuration : Duration.ofMinutes(15);
        }
    }

    public record Mfa(
            List<String> requiredRoles,
            String issuer,
            int backupCodeCount,
            Duration timeStep,
            Integer window,
            Duration challengeTtl,
            Duration setupTtl,
            int maxFailedAttempts,
            Duration cooldown
    ) {
        public Mfa {
            requiredRoles = requiredRoles != null ? List.copyOf(requiredRoles) : List.of();
            issuer = (issuer != null && !issuer.isBlank()) ? issuer : "ClinicMate";
            backupCodeCount = backupCodeCount > 0 ? backupCodeCount : 10;
            timeStep = timeStep != null ? timeStep : Duration.ofSeconds(30);
            window = window != null && window >= 0 ? window : 1;
            challengeTtl = challengeTtl != null ? challengeTtl : Duration.ofMinutes(10);
            setupTtl = setupTtl != null ? setupTtl : Duration.ofMinutes(15);
            maxFailedAttempts = maxFailedAttempts > 0 ? maxFailedAttempts : 5;
            cooldown = cooldown != null ? cooldown : Duration.ofMinutes(15);
        }

        public Set<String> requiredRoleCodes() {
            return requiredRoles.stream()
                    .map(String::trim)
                    .filter(code -> !code.isEmpty())
                    .map(code -> code.toUpperCase(Locale.ROOT))
                    .collect(Collectors.toUnmodifiableSet());
        }
    }

    public record Password(int minLength, Integer minScore, int historyDepth) {
        public Password {
            minLength = minLength > 0 ? minLength : 12;
            minScore = minScore != null ? minScore : 3;
            historyDepth = historyDepth > 0 ? historyDepth : 5;
        }
    }

    public record Cookies(Boolean secure) {
        public Cookies {
            secure = secure != null ? secure : Boolean.TRUE;
        }
    }

    public record Session(Duration cleanupInterval, Duration retention) {
        public Session {
            cleanupInterval = cleanupInterval != null ? cleanupInterval : Duration.ofHours(1);
            retention = retention != null ? retention : Duration.ofDays(30);
        }
    }
}

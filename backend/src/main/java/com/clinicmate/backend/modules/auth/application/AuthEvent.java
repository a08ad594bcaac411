package com.clinicmate.backend.modules.auth.application;

import java.time.Instant;
import java.util.Map;
import java.util.UUID;

/**
 * Domain event emitted after an auth state change, e.g. {@code User.LoggedIn}.
 */
public record AuthEvent(String name, UUID userId, UUID sessionId, Instant occurredAt, Map<String, Object> attributes) {

    public static final String LOGGED_IN = "User.LoggedIn";
    public static final String LOGGED_IN_WITH_MFA = "User.LoggedInWithMfa";
    public static final String LOGGED_OUT = "User.LoggedOut";
    public static final String MFA_INITIATED = "User.MfaInitiated";
    public static final String MFA_ENABLED = "User.MfaEnabled";
    public static final String MFA_DISABLED = "User.MfaDisabled";
    public static final String PASSWORD_CHANGED = "User.PasswordChanged";

    public AuthEvent {
        attributes = attributes != null ? Map.copyOf(attributes) : Map.of();
    }
}

package com.clinicmate.backend.modules.auth.application;

import org.springframework.http.HttpStatus;

/**
 * Stable, client-visible auth failure codes. Messages are deliberately generic.
 */
public enum AuthErrorCode {
    INVALID_CREDENTIALS(HttpStatus.UNAUTHORIZED, "Invalid email or password"),
    ACCOUNT_LOCKED(HttpStatus.LOCKED, "Account is temporarily locked"),
    INVALID_TOKEN(HttpStatus.UNAUTHORIZED, "Invalid or expired token"),
    INVALID_MFA_CODE(HttpStatus.UNAUTHORIZED, "Invalid verification code"),
    MFA_ALREADY_ENABLED(HttpStatus.CONFLICT, "Multi-factor authentication is already enabled"),
    MFA_NOT_ENABLED(HttpStatus.CONFLICT, "Multi-factor authentication is not enabled"),
    MFA_SETUP_NOT_INITIATED(HttpStatus.CONFLICT, "Multi-factor authentication setup has not been started"),
    MFA_LOCKED(HttpStatus.TOO_MANY_REQUESTS, "Too many verification attempts"),
    SESSION_REVOKED_OR_EXPIRED(HttpStatus.UNAUTHORIZED, "Session is no longer valid"),
    PASSWORD_REUSE(HttpStatus.BAD_REQUEST, "Password was used recently"),
    WEAK_PASSWORD(HttpStatus.BAD_REQUEST, "Password does not meet the strength requirements"),
    USER_NOT_FOUND(HttpStatus.NOT_FOUND, "User not found");

    private final HttpStatus status;
    private final String defaultMessage;

    AuthErrorCode(HttpStatus status, String defaultMessage) {
        this.status = status;
        this.defaultMessage = defaultMessage;
    }

    public HttpStatus status() {
        return status;
    }

    public String defaultMessage() {
        return defaultMessage;
    }
}

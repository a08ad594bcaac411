package com.clinicmate.backend.modules.auth.application;

import java.time.Duration;
import java.time.OffsetDateTime;

import com.clinicmate.backend.global.error.RetryableProblemException;

/**
 * Raised while a password lockout ({@link AuthErrorCode#ACCOUNT_LOCKED}) or an MFA cooldown
 * ({@link AuthErrorCode#MFA_LOCKED}) is in force.
 */
public class LockedOutException extends RetryableProblemException {

    private final AuthErrorCode errorCode;
    private final OffsetDateTime lockedUntil;

    public LockedOutException(AuthErrorCode errorCode, OffsetDateTime now, OffsetDateTime lockedUntil) {
        super(errorCode.status(), errorCode.name(), errorCode.defaultMessage(), secondsBetween(now, lockedUntil));
        this.errorCode = errorCode;
        this.lockedUntil = lockedUntil;
    }

    private static long secondsBetween(OffsetDateTime now, OffsetDateTime lockedUntil) {
        long seconds = Duration.between(now, lockedUntil).toSeconds();
        return Math.max(seconds, 1L);
    }

    public AuthErrorCode getErrorCode() {
        return errorCode;
    }

    public OffsetDateTime getLockedUntil() {
        return lockedUntil;
    }
}

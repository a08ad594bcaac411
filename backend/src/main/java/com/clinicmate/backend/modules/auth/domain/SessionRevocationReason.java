package com.clinicmate.backend.modules.auth.domain;

public enum SessionRevocationReason {
    LOGOUT,
    PASSWORD_CHANGE,
    MFA_SESSION_UPGRADE,
    REVOKED_BY_USER,
    EXPIRED
}

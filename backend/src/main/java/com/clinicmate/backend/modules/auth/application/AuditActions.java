package com.clinicmate.backend.modules.auth.application;

/**
 * Audit action types written by the auth flow.
 */
public final class AuditActions {

    public static final String RESOURCE_USER = "USER";
    public static final String RESOURCE_SESSION = "SESSION";

    public static final String LOGIN = "LOGIN";
    public static final String LOGIN_FAILED = "LOGIN_FAILED";
    public static final String MFA_SETUP_REQUIRED_INITIATED = "MFA_SETUP_REQUIRED_INITIATED";
    public static final String MFA_CHALLENGE_ISSUED = "MFA_CHALLENGE_ISSUED";
    public static final String LOGIN_MFA_SUCCESS = "LOGIN_MFA_SUCCESS";
    public static final String MFA_LOGIN_FAILED = "MFA_LOGIN_FAILED";
    public static final String MFA_BACKUP_CODE_USED = "MFA_BACKUP_CODE_USED";
    public static final String MFA_INITIATED = "MFA_INITIATED";
    public static final String MFA_ENABLED = "MFA_ENABLED";
    public static final String MFA_VERIFICATION_FAILED = "MFA_VERIFICATION_FAILED";
    public static final String MFA_DISABLED = "MFA_DISABLED";
    public static final String MFA_DISABLE_FAILED = "MFA_DISABLE_FAILED";
    public static final String TOKEN_REFRESH = "TOKEN_REFRESH";
    public static final String LOGOUT = "LOGOUT";
    public static final String PASSWORD_CHANGE = "PASSWORD_CHANGE";
    public static final String PASSWORD_CHANGE_FAILED = "PASSWORD_CHANGE_FAILED";
    public static final String SESSIONS_REVOKED = "SESSIONS_REVOKED";

    private AuditActions() {
    }
}

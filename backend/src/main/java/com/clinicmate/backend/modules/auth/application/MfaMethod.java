package com.clinicmate.backend.modules.auth.application;

public enum MfaMethod {
    TOTP,
    BACKUP_CODE
}

package com.clinicmate.backend.modules.auth.application;

import java.util.UUID;

import com.clinicmate.backend.global.web.ClientContext;

/**
 * TOTP enrollment and code checks. Failures count against the MFA budget, never the password one.
 */
public interface MfaManager {

    /**
     * Creates a new secret and backup codes, replacing any pending enrollment. MFA stays disabled.
     */
    MfaEnrollment enroll(UUID userId, ClientContext client);

    /**
     * Checks a TOTP code against the stored pending secret and enables MFA on success.
     */
    void verifySetup(UUID userId, String code, ClientContext client);

    /**
     * Checks a TOTP or backup code for a user with MFA enabled. A matching backup code is consumed.
     */
    MfaMethod verifyCode(UUID userId, String code);

    void disable(UUID userId, String code, String reason, ClientContext client);
}

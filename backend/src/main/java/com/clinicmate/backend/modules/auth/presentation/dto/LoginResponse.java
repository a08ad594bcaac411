package com.clinicmate.backend.modules.auth.presentation.dto;

import java.util.UUID;

import com.clinicmate.backend.modules.auth.application.AuthResult;
import com.fasterxml.jackson.annotation.JsonInclude;

/**
 * Either session metadata (tokens travel in cookies) or a temp token for the MFA step.
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record LoginResponse(
        UserProfileResponse user,
        UUID sessionId,
        Long expiresIn,
        Boolean mfaRequired,
        Boolean mfaSetupRequired,
        String tempToken
) {

    public static LoginResponse authenticated(AuthResult result) {
        return new LoginResponse(UserProfileResponse.from(result.user()), result.sessionId(),
                result.expiresInSeconds(), null, null, null);
    }

    public static LoginResponse mfaRequired(String tempToken) {
        return new LoginResponse(null, null, null, Boolean.TRUE, null, tempToken);
    }

    public static LoginResponse mfaSetupRequired(String tempToken) {
        return new LoginResponse(null, null, null, null, Boolean.TRUE, tempToken);
    }
}

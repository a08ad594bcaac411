package com.clinicmate.backend.modules.auth.application;

import com.clinicmate.backend.modules.auth.application.JwtTokenService.IssuedToken;

/**
 * The three ways a correct password can end. Only {@link Authenticated} creates a session.
 */
public sealed interface LoginResult
        permits LoginResult.Authenticated, LoginResult.MfaChallengeRequired, LoginResult.MfaSetupRequired {

    record Authenticated(AuthResult result) implements LoginResult {
    }

    record MfaChallengeRequired(IssuedToken tempToken) implements LoginResult {
    }

    record MfaSetupRequired(IssuedToken tempToken) implements LoginResult {
    }
}

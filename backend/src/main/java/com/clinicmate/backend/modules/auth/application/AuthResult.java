package com.clinicmate.backend.modules.auth.application;

import java.util.UUID;

import com.clinicmate.backend.modules.auth.application.JwtTokenService.IssuedToken;

/**
 * Outcome of a completed login or refresh: tokens for the cookies plus non-secret metadata for the body.
 */
public record AuthResult(UserSummary user, UUID sessionId, IssuedToken accessToken, IssuedToken refreshToken) {

    public long expiresInSeconds() {
        return accessToken.ttl().toSeconds();
    }
}

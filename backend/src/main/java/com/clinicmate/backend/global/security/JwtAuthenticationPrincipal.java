package com.clinicmate.backend.global.security;

import java.util.List;
import java.util.UUID;

import com.clinicmate.backend.modules.auth.application.VerifiedToken;
import com.clinicmate.backend.modules.auth.domain.TokenType;

/**
 * Caller identity established from a verified token. {@code sessionId} is present only for access tokens.
 */
public record JwtAuthenticationPrincipal(
        UUID userId,
        String email,
        TokenType tokenType,
        UUID sessionId,
        List<String> roles,
        List<String> permissions,
        VerifiedToken token
) {

    public boolean isFullyAuthenticated() {
        return tokenType == TokenType.ACCESS;
    }

    public boolean hasPermission(String permissionCode) {
        return permissions.contains(permissionCode);
    }
}

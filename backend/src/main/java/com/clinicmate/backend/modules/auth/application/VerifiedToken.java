package com.clinicmate.backend.modules.auth.application;

import java.time.Instant;
import java.util.List;
import java.util.UUID;

import com.clinicmate.backend.global.web.ClientContext;
import com.clinicmate.backend.modules.auth.domain.TokenType;

/**
 * A token whose signature, expiry and type have been checked. One variant per token type,
 * so callers cannot treat a challenge token as an access token by accident.
 */
public sealed interface VerifiedToken
        permits VerifiedToken.AccessToken, VerifiedToken.RefreshToken,
                VerifiedToken.MfaChallengeToken, VerifiedToken.MfaSetupToken {

    UUID userId();

    Instant expiresAt();

    TokenType type();

    record AccessToken(
            UUID userId,
            String email,
            UUID sessionId,
            List<String> roles,
            List<String> permissions,
            boolean mfaVerified,
            Instant expiresAt
    ) implements VerifiedToken {
        @Override
        public TokenType type() {
            return TokenType.ACCESS;
        }
    }

    record RefreshToken(UUID userId, UUID sessionId, Instant expiresAt) implements VerifiedToken {
        @Override
        public TokenType type() {
            return TokenType.REFRESH;
        }
    }

    record MfaChallengeToken(UUID userId, String email, ClientContext client, Instant expiresAt)
            implements VerifiedToken {
        @Override
        public TokenType type() {
            return TokenType.MFA_CHALLENGE;
        }
    }

    record MfaSetupToken(UUID userId, String email, ClientContext client, Instant expiresAt)
            implements VerifiedToken {
        @Override
        public TokenType type() {
            return TokenType.MFA_SETUP;
        }
    }
}

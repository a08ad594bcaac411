package com.clinicmate.backend.modules.auth.domain;

import java.util.Arrays;
import java.util.Optional;

/**
 * Discriminator carried in the {@code type} claim of every token this service signs.
 */
public enum TokenType {
    ACCESS("access"),
    REFRESH("refresh"),
    MFA_CHALLENGE("mfa_challenge"),
    MFA_SETUP("mfa_setup");

    private final String claimValue;

    TokenType(String claimValue) {
        this.claimValue = claimValue;
    }

    public String claimValue() {
        return claimValue;
    }

    public static Optional<TokenType> fromClaim(String claimValue) {
        return Arrays.stream(values())
                .filter(type -> type.claimValue.equals(claimValue))
                .findFirst();
    }
}

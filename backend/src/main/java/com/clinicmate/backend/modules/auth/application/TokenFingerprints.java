package com.clinicmate.backend.modules.auth.application;

import org.apache.commons.codec.digest.DigestUtils;

/**
 * SHA-256 hex fingerprints of bearer secrets. Only fingerprints are persisted.
 */
public final class TokenFingerprints {

    private TokenFingerprints() {
    }

    public static String of(String secret) {
        return DigestUtils.sha256Hex(secret);
    }
}

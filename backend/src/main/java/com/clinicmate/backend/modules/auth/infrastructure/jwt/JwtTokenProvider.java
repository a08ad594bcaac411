package com.clinicmate.backend.modules.auth.infrastructure.jwt;

import java.nio.charset.StandardCharsets;
import java.util.Base64;

import javax.crypto.SecretKey;
import javax.crypto.spec.SecretKeySpec;

import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Component;

/**
 * Holds the HMAC keys. Refresh tokens are signed with their own key so a leaked access key
 * cannot mint refresh tokens; a blank refresh secret falls back to the access secret.
 */
@Component
public class JwtTokenProvider {

    private static final String HMAC_SHA_256 = "HmacSHA256";

    private final SecretKey secretKey;
    private final SecretKey refreshSecretKey;

    public JwtTokenProvider(
            @Value("${jwt.secret}") String secretString,
            @Value("${jwt.refresh-secret:}") String refreshSecretString
    ) {
        this.secretKey = toKey(secretString);
        this.refreshSecretKey = (refreshSecretString == null || refreshSecretString.isBlank())
                ? secretKey
                : toKey(refreshSecretString);
    }

    private static SecretKey toKey(String secretString) {
        // Base64 디코딩에 실패하면 원문 바이트를 그대로 키로 사용한다.
        byte[] keyBytes;
        try {
            keyBytes = Base64.getDecoder().decode(secretString);
        } catch (IllegalArgumentException ex) {
            keyBytes = secretString.getBytes(StandardCharsets.UTF_8);
        }
        return new SecretKeySpec(keyBytes, HMAC_SHA_256);
    }

    public SecretKey getSecretKey() {
        return secretKey;
    }

    public SecretKey getRefreshSecretKey() {
        return refreshSecretKey;
    }
}

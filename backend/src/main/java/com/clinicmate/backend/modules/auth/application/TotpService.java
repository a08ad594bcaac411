package com.clinicmate.backend.modules.auth.application;

import java.net.URLEncoder;
import java.nio.ByteBuffer;
import java.nio.charset.StandardCharsets;
import java.security.GeneralSecurityException;
import java.security.MessageDigest;
import java.security.SecureRandom;
import java.time.Clock;

import javax.crypto.Mac;
import javax.crypto.spec.SecretKeySpec;

import org.apache.commons.codec.binary.Base32;
import org.springframework.stereotype.Component;

/**
 * RFC 6238 TOTP with HMAC-SHA1, six digits and a configurable step and skew window.
 */
@Component
public class TotpService {

    private static final String ALGORITHM = "HmacSHA1";
    private static final int SECRET_BYTES = 20;
    private static final int CODE_DIGITS = 6;
    private static final int CODE_MODULUS = 1_000_000;

    private final SecureRandom secureRandom = new SecureRandom();
    private final Base32 base32 = new Base32();
    private final long timeStepSeconds;
    private final int window;
    private final String issuer;
    private final Clock clock;

    public TotpService(AuthPolicyProperties properties, Clock clock) {
        this.timeStepSeconds = properties.mfa().timeStep().toSeconds();
        this.window = properties.mfa().window();
        this.issuer = properties.mfa().issuer();
        this.clock = clock;
    }

    public String generateSecret() {
        byte[] secretBytes = new byte[SECRET_BYTES];
        secureRandom.nextBytes(secretBytes);
        return base32.encodeToString(secretBytes).replace("=", "");
    }

    public boolean verify(String secret, String code) {
        if (secret == null || code == null || code.length() != CODE_DIGITS) {
            return false;
        }
        long now = clock.instant().getEpochSecond();
        byte[] presented = code.getBytes(StandardCharsets.US_ASCII);
        boolean matched = false;
        for (int i = -window; i <= window; i++) {
            byte[] expected = generateCode(secret, now + i * timeStepSeconds).getBytes(StandardCharsets.US_ASCII);
            matched |= MessageDigest.isEqual(expected, presented);
        }
        return matched;
    }

    String generateCode(String secret, long epochSeconds) {
        byte[] key = base32.decode(secret);
        byte[] counter = ByteBuffer.allocate(Long.BYTES).putLong(epochSeconds / timeStepSeconds).array();
        byte[] hash;
        try {
            Mac mac = Mac.getInstance(ALGORITHM);
            mac.init(new SecretKeySpec(key, ALGORITHM));
            hash = mac.doFinal(counter);
        } catch (GeneralSecurityException e) {
            throw new IllegalStateException("HmacSHA1 unavailable", e);
        }

        int offset = hash[hash.length - 1] & 0x0F;
        int binary = ((hash[offset] & 0x7F) << 24)
                | ((hash[offset + 1] & 0xFF) << 16)
                | ((hash[offset + 2] & 0xFF) << 8)
                | (hash[offset + 3] & 0xFF);
        return String.format("%0" + CODE_DIGITS + "d", binary % CODE_MODULUS);
    }

    public String otpauthUri(String secret, String accountName) {
        String label = URLEncoder.encode(issuer + ":" + accountName, StandardCharsets.UTF_8).replace("+", "%20");
        String encodedIssuer = URLEncoder.encode(issuer, StandardCharsets.UTF_8).replace("+", "%20");
        return "otpauth://totp/" + label
                + "?secret=" + secret
                + "&issuer=" + encodedIssuer
                + "&algorithm=SHA1&digits=" + CODE_DIGITS
                + "&period=" + timeStepSeconds;
    }
}

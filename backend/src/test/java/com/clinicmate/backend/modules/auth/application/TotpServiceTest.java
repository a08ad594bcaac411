package com.clinicmate.backend.modules.auth.application;

import static org.assertj.core.api.Assertions.assertThat;

import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;

import org.apache.commons.codec.binary.Base32;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.CsvSource;

class TotpServiceTest {

    // "12345678901234567890" in Base32, the RFC 6238 SHA-1 seed
    private static final String RFC_SECRET = "GEZDGNBVGY3TQOJQGEZDGNBVGY3TQOJQ";

    private static TotpService serviceAt(long epochSeconds) {
        Clock clock = Clock.fixed(Instant.ofEpochSecond(epochSeconds), ZoneOffset.UTC);
        return new TotpService(new AuthPolicyProperties(null, null, null, null, null), clock);
    }

    @ParameterizedTest
    @CsvSource({
            "59, 287082",
            "1111111109, 081804",
            "1111111111, 050471",
            "1234567890, 005924",
            "2000000000, 279037"
    })
    void generatesRfc6238Codes(long epochSeconds, String expected) {
        assertThat(serviceAt(0).generateCode(RFC_SECRET, epochSeconds)).isEqualTo(expected);
    }

    @Test
    void acceptsCodesWithinOneStepOfSkew() {
        TotpService service = serviceAt(1111111111L);

        assertThat(service.verify(RFC_SECRET, service.generateCode(RFC_SECRET, 1111111111L))).isTrue();
        assertThat(service.verify(RFC_SECRET, service.generateCode(RFC_SECRET, 1111111111L - 30))).isTrue();
        assertThat(service.verify(RFC_SECRET, service.generateCode(RFC_SECRET, 1111111111L + 30))).isTrue();
    }

    @Test
    void rejectsCodesOutsideTheWindow() {
        TotpService service = serviceAt(1111111111L);

        assertThat(service.verify(RFC_SECRET, service.generateCode(RFC_SECRET, 1111111111L - 90))).isFalse();
        assertThat(service.verify(RFC_SECRET, service.generateCode(RFC_SECRET, 1111111111L + 90))).isFalse();
    }

    @Test
    void rejectsMalformedInput() {
        TotpService service = serviceAt(59);

        assertThat(service.verify(RFC_SECRET, null)).isFalse();
        assertThat(service.verify(RFC_SECRET, "28708")).isFalse();
        assertThat(service.verify(RFC_SECRET, "2870821")).isFalse();
        assertThat(service.verify(null, "287082")).isFalse();
    }

    @Test
    void generatedSecretIsTwentyBytesOfUnpaddedBase32() {
        String secret = serviceAt(0).generateSecret();

        assertThat(secret).doesNotContain("=").matches("[A-Z2-7]+");
        assertThat(new Base32().decode(secret)).hasSize(20);
    }

    @Test
    void otpauthUriCarriesIssuerAndAccount() {
        String uri = serviceAt(0).otpauthUri(RFC_SECRET, "dr.smith@clinic.test");

        assertThat(uri)
                .startsWith("otpauth://totp/ClinicMate%3Adr.smith%40clinic.test?")
                .contains("secret=" + RFC_SECRET)
                .contains("issuer=ClinicMate")
                .contains("digits=6")
                .contains("period=30");
    }
}

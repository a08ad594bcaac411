package com.clinicmate.backend.modules.auth.application;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.OffsetDateTime;
import java.time.ZoneId;
import java.time.ZoneOffset;
import java.util.Date;
import java.util.EnumSet;
import java.util.Set;
import java.util.TreeSet;
import java.util.UUID;

import com.clinicmate.backend.global.web.ClientContext;
import com.clinicmate.backend.modules.auth.application.JwtTokenService.IssuedToken;
import com.clinicmate.backend.modules.auth.domain.TokenType;
import com.clinicmate.backend.modules.auth.infrastructure.jwt.JwtTokenProvider;

import io.jsonwebtoken.Jwts;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

class JwtTokenServiceTest {

    private static final String ACCESS_SECRET = "clinicmate-test-access-secret-0123456789abcdef";
    private static final String REFRESH_SECRET = "clinicmate-test-refresh-secret-0123456789abcdef";
    private static final Instant NOW = OffsetDateTime.parse("2025-01-01T00:00:00Z").toInstant();

    private final UUID userId = UUID.fromString("00000000-0000-0000-0000-000000000201");
    private final UUID sessionId = UUID.fromString("00000000-0000-0000-0000-000000000301");
    private final ResolvedPermissions permissions = new ResolvedPermissions(
            new TreeSet<>(Set.of("DOCTOR")),
            new TreeSet<>(Set.of("patients:*:read", "clinical:notes:write")));

    private MutableClock clock;
    private JwtTokenService service;

    @BeforeEach
    void setUp() {
        clock = new MutableClock(NOW);
        service = newService(new JwtTokenProvider(ACCESS_SECRET, REFRESH_SECRET), "clinicmate");
    }

    private JwtTokenService newService(JwtTokenProvider provider, String issuer) {
        return new JwtTokenService(provider, 900_000L, 604_800_000L, issuer,
                new AuthPolicyProperties(null, null, null, null, null), clock);
    }

    @Test
    void accessTokenRoundTripsItsClaims() {
        IssuedToken issued = service.issueAccessToken(userId, "dr@clinic.test", sessionId, permissions, true);

        VerifiedToken verified = service.verify(issued.value(), EnumSet.of(TokenType.ACCESS));

        assertThat(verified).isInstanceOf(VerifiedToken.AccessToken.class);
        VerifiedToken.AccessToken access = (VerifiedToken.AccessToken) verified;
        assertThat(access.userId()).isEqualTo(userId);
        assertThat(access.sessionId()).isEqualTo(sessionId);
        assertThat(access.roles()).containsExactly("DOCTOR");
        assertThat(access.permissions()).containsExactly("clinical:notes:write", "patients:*:read");
        assertThat(access.mfaVerified()).isTrue();
        assertThat(issued.expiresAt()).isEqualTo(NOW.plus(Duration.ofMinutes(15)));
    }

    @Test
    void challengeTokenIsRejectedWhereOnlyAccessTokensAreAccepted() {
        IssuedToken challenge = service.issueMfaChallengeToken(userId, "dr@clinic.test",
                new ClientContext("10.0.0.1", "JUnit"));

        assertThatThrownBy(() -> service.verify(challenge.value(), EnumSet.of(TokenType.ACCESS)))
                .isInstanceOf(AuthException.class)
                .extracting(ex -> ((AuthException) ex).getErrorCode())
                .isEqualTo(AuthErrorCode.INVALID_TOKEN);
    }

    @Test
    void setupTokenCarriesTheClientItWasIssuedTo() {
        IssuedToken setup = service.issueMfaSetupToken(userId, "dr@clinic.test",
                new ClientContext("10.0.0.1", "JUnit"));

        VerifiedToken verified = service.verify(setup.value(),
                EnumSet.of(TokenType.ACCESS, TokenType.MFA_SETUP));

        assertThat(verified).isInstanceOf(VerifiedToken.MfaSetupToken.class);
        VerifiedToken.MfaSetupToken token = (VerifiedToken.MfaSetupToken) verified;
        assertThat(token.client()).isEqualTo(new ClientContext("10.0.0.1", "JUnit"));
        assertThat(setup.ttl()).isEqualTo(Duration.ofMinutes(15));
    }

    @Test
    void refreshTokenIsNotAcceptedAsAccessToken() {
        IssuedToken refresh = service.issueRefreshToken(userId, sessionId);

        assertThatThrownBy(() -> service.verify(refresh.value(), EnumSet.of(TokenType.ACCESS)))
                .isInstanceOf(AuthException.class);
        assertThat(service.verifyRefreshToken(refresh.value()).sessionId()).isEqualTo(sessionId);
    }

    @Test
    void accessTokenIsNotAcceptedAsRefreshToken() {
        IssuedToken access = service.issueAccessToken(userId, "dr@clinic.test", sessionId, permissions, false);

        assertThatThrownBy(() -> service.verifyRefreshToken(access.value()))
                .isInstanceOf(AuthException.class);
    }

    @Test
    void expiredTokenIsRejected() {
        IssuedToken challenge = service.issueMfaChallengeToken(userId, "dr@clinic.test", ClientContext.UNKNOWN);

        clock.advance(Duration.ofMinutes(11));

        assertThatThrownBy(() -> service.verify(challenge.value(), EnumSet.of(TokenType.MFA_CHALLENGE)))
                .isInstanceOf(AuthException.class)
                .extracting(ex -> ((AuthException) ex).getErrorCode())
                .isEqualTo(AuthErrorCode.INVALID_TOKEN);
    }

    @Test
    void tokenSignedWithAnotherKeyIsRejected() {
        JwtTokenService foreign = newService(
                new JwtTokenProvider("another-clinic-secret-0123456789abcdef-xyz", ""), "clinicmate");
        IssuedToken forged = foreign.issueAccessToken(userId, "dr@clinic.test", sessionId, permissions, true);

        assertThatThrownBy(() -> service.verify(forged.value(), EnumSet.of(TokenType.ACCESS)))
                .isInstanceOf(AuthException.class);
    }

    @Test
    void tokenFromAnotherIssuerIsRejected() {
        JwtTokenService other = newService(new JwtTokenProvider(ACCESS_SECRET, REFRESH_SECRET), "someone-else");
        IssuedToken token = other.issueAccessToken(userId, "dr@clinic.test", sessionId, permissions, true);

        assertThatThrownBy(() -> service.verify(token.value(), EnumSet.of(TokenType.ACCESS)))
                .isInstanceOf(AuthException.class);
    }

    @Test
    void garbageIsRejected() {
        assertThatThrownBy(() -> service.verify("not-a-jwt", EnumSet.of(TokenType.ACCESS)))
                .isInstanceOf(AuthException.class);
        assertThatThrownBy(() -> service.verify(" ", EnumSet.of(TokenType.ACCESS)))
                .isInstanceOf(AuthException.class);
    }

    @Test
    void nonTextTypeClaimIsRejectedAsInvalidToken() {
        JwtTokenProvider provider = new JwtTokenProvider(ACCESS_SECRET, REFRESH_SECRET);
        String token = Jwts.builder()
                .issuer("clinicmate")
                .subject(userId.toString())
                .claim("type", 42)
                .claim("sid", sessionId.toString())
                .issuedAt(Date.from(NOW))
                .expiration(Date.from(NOW.plus(Duration.ofMinutes(5))))
                .signWith(provider.getSecretKey())
                .compact();

        assertThatThrownBy(() -> service.verify(token, EnumSet.of(TokenType.ACCESS)))
                .isInstanceOfSatisfying(AuthException.class,
                        ex -> assertThat(ex.getErrorCode()).isEqualTo(AuthErrorCode.INVALID_TOKEN));
    }

    @Test
    void refreshCannotBeMixedWithOtherTypes() {
        assertThatThrownBy(() -> service.verify("x", EnumSet.of(TokenType.REFRESH, TokenType.ACCESS)))
                .isInstanceOf(IllegalArgumentException.class);
    }

    private static final class MutableClock extends Clock {

        private Instant instant;

        MutableClock(Instant instant) {
            this.instant = instant;
        }

        void advance(Duration duration) {
            instant = instant.plus(duration);
        }

        @Override
        public ZoneId getZone() {
            return ZoneOffset.UTC;
        }

        @Override
        public Clock withZone(ZoneId zone) {
            return this;
        }

        @Override
        public Instant instant() {
            return instant;
        }
    }
}

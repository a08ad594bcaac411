package com.clinicmate.backend.modules.auth.application;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatCode;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

import java.time.Clock;
import java.time.OffsetDateTime;
import java.time.ZoneOffset;
import java.util.Optional;
import java.util.UUID;

import com.clinicmate.backend.global.web.ClientContext;
import com.clinicmate.backend.modules.auth.domain.ClinicUser;
import com.clinicmate.backend.modules.auth.domain.SessionRevocationReason;
import com.clinicmate.backend.modules.auth.domain.UserSession;
import com.clinicmate.backend.modules.auth.infrastructure.persistence.UserSessionRepository;
import com.clinicmate.backend.support.TestIds;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

@ExtendWith(MockitoExtension.class)
class SessionServiceTest {

    private static final OffsetDateTime NOW = OffsetDateTime.parse("2025-01-01T00:00:00Z");

    @Mock
    private UserSessionRepository userSessionRepository;

    private SessionService sessionService;
    private ClinicUser user;
    private final UUID sessionId = UUID.fromString("00000000-0000-0000-0000-000000000701");

    @BeforeEach
    void setUp() {
        sessionService = new SessionService(userSessionRepository,
                new AuthPolicyProperties(null, null, null, null, null),
                Clock.fixed(NOW.toInstant(), ZoneOffset.UTC));

        user = new ClinicUser();
        user.setEmail("nurse@clinic.test");
        TestIds.assign(user, UUID.fromString("00000000-0000-0000-0000-000000000702"));
    }

    @Test
    void createStoresFingerprintsNotTokens() {
        when(userSessionRepository.save(any(UserSession.class))).thenAnswer(invocation -> invocation.getArgument(0));

        UserSession session = sessionService.create(new SessionService.NewSession(
                sessionId, user, "access-token", "refresh-token", NOW.plusDays(7).toInstant(),
                new ClientContext("10.1.2.3", "Firefox"), true));

        assertThat(session.getId()).isEqualTo(sessionId);
        assertThat(session.isNew()).isTrue();
        assertThat(session.getAccessTokenHash()).isEqualTo(TokenFingerprints.of("access-token"));
        assertThat(session.getRefreshTokenHash()).isEqualTo(TokenFingerprints.of("refresh-token"))
                .hasSize(64)
                .doesNotContain("refresh-token");
        assertThat(session.getExpiresAt()).isEqualTo(NOW.plusDays(7));
        assertThat(session.getLastActivityAt()).isEqualTo(NOW);
        assertThat(session.getIpAddress()).isEqualTo("10.1.2.3");
        assertThat(session.isMfaVerified()).isTrue();
    }

    @Test
    void revokedSessionIsNotActive() {
        UserSession session = activeSession();
        session.revoke(NOW.minusMinutes(1), user.getId(), SessionRevocationReason.LOGOUT);
        when(userSessionRepository.findById(sessionId)).thenReturn(Optional.of(session));

        assertThatThrownBy(() -> sessionService.requireActive(sessionId))
                .isInstanceOfSatisfying(AuthException.class, ex -> assertThat(ex.getErrorCode())
                        .isEqualTo(AuthErrorCode.SESSION_REVOKED_OR_EXPIRED));
    }

    @Test
    void sessionExpiringNowIsNotActive() {
        UserSession session = activeSession();
        session.setExpiresAt(NOW);
        when(userSessionRepository.findById(sessionId)).thenReturn(Optional.of(session));

        assertThatThrownBy(() -> sessionService.requireActive(sessionId))
                .isInstanceOf(AuthException.class);
    }

    @Test
    void sessionOfAnotherUserIsRejected() {
        when(userSessionRepository.findById(sessionId)).thenReturn(Optional.of(activeSession()));

        assertThatCode(() -> sessionService.assertActiveFor(sessionId, user.getId())).doesNotThrowAnyException();
        assertThatThrownBy(() -> sessionService.assertActiveFor(sessionId, UUID.randomUUID()))
                .isInstanceOf(AuthException.class);
    }

    @Test
    void sessionOfDeactivatedUserIsRejected() {
        user.setActive(false);
        when(userSessionRepository.findById(sessionId)).thenReturn(Optional.of(activeSession()));

        assertThatThrownBy(() -> sessionService.assertActiveFor(sessionId, user.getId()))
                .isInstanceOf(AuthException.class);
    }

    @Test
    void revokeIsIdempotent() {
        UserSession session = activeSession();
        when(userSessionRepository.findById(sessionId)).thenReturn(Optional.of(session));

        assertThat(sessionService.revoke(sessionId, user.getId(), SessionRevocationReason.LOGOUT)).isTrue();
        assertThat(session.getRevokedAt()).isEqualTo(NOW);
        assertThat(session.getRevokedReason()).isEqualTo(SessionRevocationReason.LOGOUT);

        assertThat(sessionService.revoke(sessionId, user.getId(), SessionRevocationReason.PASSWORD_CHANGE)).isFalse();
        assertThat(session.getRevokedReason()).isEqualTo(SessionRevocationReason.LOGOUT);
    }

    @Test
    void revokeOfUnknownSessionReportsNothingRevoked() {
        when(userSessionRepository.findById(sessionId)).thenReturn(Optional.empty());

        assertThat(sessionService.revoke(sessionId, user.getId(), SessionRevocationReason.LOGOUT)).isFalse();
    }

    @Test
    void refreshReplacesAccessFingerprintAndTouchesActivity() {
        UserSession session = activeSession();
        session.setLastActivityAt(NOW.minusHours(2));

        sessionService.recordRefresh(session, "new-access-token");

        assertThat(session.getAccessTokenHash()).isEqualTo(TokenFingerprints.of("new-access-token"));
        assertThat(session.getLastActivityAt()).isEqualTo(NOW);
    }

    @Test
    void cleanupExpiresThenPurgesPastRetention() {
        when(userSessionRepository.revokeExpired(NOW, SessionRevocationReason.EXPIRED)).thenReturn(3);
        when(userSessionRepository.deleteStale(NOW.minusDays(30))).thenReturn(2);

        SessionService.CleanupResult result = sessionService.cleanupExpired();

        assertThat(result.expired()).isEqualTo(3);
        assertThat(result.deleted()).isEqualTo(2);
    }

    @Test
    void revokeOthersKeepsTheCurrentSession() {
        when(userSessionRepository.revokeOthersForUser(user.getId(), sessionId, NOW, user.getId(),
                SessionRevocationReason.REVOKED_BY_USER)).thenReturn(2);

        assertThat(sessionService.revokeOthers(user.getId(), sessionId, SessionRevocationReason.REVOKED_BY_USER))
                .isEqualTo(2);
        verify(userSessionRepository).revokeOthersForUser(user.getId(), sessionId, NOW, user.getId(),
                SessionRevocationReason.REVOKED_BY_USER);
    }

    private UserSession activeSession() {
        UserSession session = new UserSession(sessionId, user);
        session.setAccessTokenHash(TokenFingerprints.of("a"));
        session.setRefreshTokenHash(TokenFingerprints.of("r"));
        session.setExpiresAt(NOW.plusDays(1));
        session.setLastActivityAt(NOW);
        return session;
    }
}

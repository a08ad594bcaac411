package com.clinicmate.backend.modules.auth.application;

import java.time.Clock;
import java.time.Instant;
import java.time.OffsetDateTime;
import java.time.ZoneOffset;
import java.util.List;
import java.util.Optional;
import java.util.UUID;

import com.clinicmate.backend.global.web.ClientContext;
import com.clinicmate.backend.modules.auth.domain.ClinicUser;
import com.clinicmate.backend.modules.auth.domain.SessionRevocationReason;
import com.clinicmate.backend.modules.auth.domain.UserSession;
import com.clinicmate.backend.modules.auth.infrastructure.persistence.UserSessionRepository;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;
import org.springframework.web.server.ResponseStatusException;

/**
 * Session store. Every lookup goes to the database; revocation state is never cached.
 */
@Service
@Transactional(noRollbackFor = ResponseStatusException.class)
public class SessionService {

    private static final Logger log = LoggerFactory.getLogger(SessionService.class);

    private final UserSessionRepository userSessionRepository;
    private final AuthPolicyProperties properties;
    private final Clock clock;

    public SessionService(UserSessionRepository userSessionRepository, AuthPolicyProperties properties, Clock clock) {
        this.userSessionRepository = userSessionRepository;
        this.properties = properties;
        this.clock = clock;
    }

    public UserSession create(NewSession params) {
        OffsetDateTime now = OffsetDateTime.now(clock);
        UserSession session = new UserSession(params.sessionId(), params.user());
        session.setAccessTokenHash(TokenFingerprints.of(params.accessToken()));
        session.setRefreshTokenHash(TokenFingerprints.of(params.refreshToken()));
        ClientContext client = params.client() != null ? params.client() : ClientContext.UNKNOWN;
        session.setIpAddress(client.ipAddress());
        session.setUserAgent(client.userAgent());
        session.setMfaVerified(params.mfaVerified());
        session.setExpiresAt(OffsetDateTime.ofInstant(params.expiresAt(), ZoneOffset.UTC));
        session.setLastActivityAt(now);
        return userSessionRepository.save(session);
    }

    @Transactional(readOnly = true)
    public Optional<UserSession> findByRefreshFingerprint(String refreshTokenHash) {
        return userSessionRepository.findByRefreshTokenHash(refreshTokenHash);
    }

    @Transactional(readOnly = true)
    public Optional<UserSession> findById(UUID sessionId) {
        return userSessionRepository.findById(sessionId);
    }

    /**
     * Single point read used on every authenticated request.
     */
    @Transactional(readOnly = true, noRollbackFor = ResponseStatusException.class)
    public UserSession requireActive(UUID sessionId) {
        OffsetDateTime now = OffsetDateTime.now(clock);
        return userSessionRepository.findById(sessionId)
                .filter(session -> session.isActiveAt(now))
                .orElseThrow(() -> new AuthException(AuthErrorCode.SESSION_REVOKED_OR_EXPIRED));
    }

    /**
     * Checks that the session behind an access token is live, belongs to the token's subject and
     * that the user is still active.
     */
    @Transactional(readOnly = true, noRollbackFor = ResponseStatusException.class)
    public void assertActiveFor(UUID sessionId, UUID userId) {
        UserSession session = requireActive(sessionId);
        ClinicUser user = session.getUser();
        if (!user.getId().equals(userId) || !user.isActive()) {
            throw new AuthException(AuthErrorCode.SESSION_REVOKED_OR_EXPIRED);
        }
    }

    /**
     * Binds the newly issued access token to the session and bumps its last activity.
     */
    public void recordRefresh(UserSession session, String newAccessToken) {
        session.setAccessTokenHash(TokenFingerprints.of(newAccessToken));
        session.setLastActivityAt(OffsetDateTime.now(clock));
    }

    public boolean revoke(UUID sessionId, UUID revokedBy, SessionRevocationReason reason) {
        Optional<UserSession> found = userSessionRepository.findById(sessionId);
        if (found.isEmpty() || found.get().getRevokedAt() != null) {
            return false;
        }
        found.get().revoke(OffsetDateTime.now(clock), revokedBy, reason);
        log.info("Session {} revoked ({})", sessionId, reason);
        return true;
    }

    public int revokeAll(UUID userId, UUID revokedBy, SessionRevocationReason reason) {
        int revoked = userSessionRepository.revokeAllForUser(userId, OffsetDateTime.now(clock), revokedBy, reason);
        log.info("Revoked {} session(s) of user {} ({})", revoked, userId, reason);
        return revoked;
    }

    public int revokeOthers(UUID userId, UUID keepSessionId, SessionRevocationReason reason) {
        int revoked = userSessionRepository.revokeOthersForUser(
                userId, keepSessionId, OffsetDateTime.now(clock), userId, reason);
        log.info("Revoked {} other session(s) of user {} ({})", revoked, userId, reason);
        return revoked;
    }

    @Transactional(readOnly = true)
    public List<UserSession> listActive(UUID userId) {
        return userSessionRepository.findActiveByUserId(userId, OffsetDateTime.now(clock));
    }

    public CleanupResult cleanupExpired() {
        OffsetDateTime now = OffsetDateTime.now(clock);
        int expired = userSessionRepository.revokeExpired(now, SessionRevocationReason.EXPIRED);
        int deleted = userSessionRepository.deleteStale(now.minus(properties.session().retention()));
        return new CleanupResult(expired, deleted);
    }

    public record NewSession(
            UUID sessionId,
            ClinicUser user,
            String accessToken,
            String refreshToken,
            Instant expiresAt,
            ClientContext client,
            boolean mfaVerified
    ) {
    }

    public record CleanupResult(int expired, int deleted) {
    }
}

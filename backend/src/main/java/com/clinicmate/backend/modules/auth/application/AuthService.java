package com.clinicmate.backend.modules.auth.application;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.OffsetDateTime;
import java.util.HashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;
import java.util.Set;
import java.util.UUID;

import com.clinicmate.backend.global.error.ProblemException;
import com.clinicmate.backend.global.web.ClientContext;
import com.clinicmate.backend.modules.audit.application.AuditLogService;
import com.clinicmate.backend.modules.audit.application.AuditLogService.AuditLogCommand;
import com.clinicmate.backend.modules.auth.application.JwtTokenService.IssuedToken;
import com.clinicmate.backend.modules.auth.domain.ClinicUser;
import com.clinicmate.backend.modules.auth.domain.SessionRevocationReason;
import com.clinicmate.backend.modules.auth.domain.UserSession;
import com.clinicmate.backend.modules.auth.infrastructure.persistence.ClinicUserRepository;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.security.crypto.password.PasswordEncoder;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;
import org.springframework.web.server.ResponseStatusException;

/**
 * Login, refresh, logout, MFA completion and password change. Failure counters and audit rows must
 * survive the thrown problem, hence {@code noRollbackFor}.
 */
@Service
@Transactional(noRollbackFor = ResponseStatusException.class)
public class AuthService {

    private static final Logger log = LoggerFactory.getLogger(AuthService.class);
    private static final int MASKED_EMAIL_MAX_LENGTH = 128;

    private final ClinicUserRepository clinicUserRepository;
    private final PasswordEncoder passwordEncoder;
    private final AccountLockoutGuard lockoutGuard;
    private final PermissionResolver permissionResolver;
    private final MfaManager mfaManager;
    private final JwtTokenService jwtTokenService;
    private final SessionService sessionService;
    private final PasswordPolicyService passwordPolicyService;
    private final AuditLogService auditLogService;
    private final AuthEventPublisher eventPublisher;
    private final Set<String> mfaRequiredRoles;
    private final Clock clock;

    public AuthService(
            ClinicUserRepository clinicUserRepository,
            PasswordEncoder passwordEncoder,
            AccountLockoutGuard lockoutGuard,
            PermissionResolver permissionResolver,
            MfaManager mfaManager,
            JwtTokenService jwtTokenService,
            SessionService sessionService,
            PasswordPolicyService passwordPolicyService,
            AuditLogService auditLogService,
            AuthEventPublisher eventPublisher,
            AuthPolicyProperties properties,
            Clock clock
    ) {
        this.clinicUserRepository = clinicUserRepository;
        this.passwordEncoder = passwordEncoder;
        this.lockoutGuard = lockoutGuard;
        this.permissionResolver = permissionResolver;
        this.mfaManager = mfaManager;
        this.jwtTokenService = jwtTokenService;
        this.sessionService = sessionService;
        this.passwordPolicyService = passwordPolicyService;
        this.auditLogService = auditLogService;
        this.eventPublisher = eventPublisher;
        this.mfaRequiredRoles = properties.mfa().requiredRoleCodes();
        this.clock = clock;
    }

    public LoginResult login(String email, String password, ClientContext client) {
        String normalizedEmail = email == null ? "" : email.trim().toLowerCase(Locale.ROOT);
        ClinicUser user = clinicUserRepository.findByEmailIgnoreCase(normalizedEmail).orElse(null);
        if (user == null || !user.isActive()) {
            UUID actorId = user != null ? user.getId() : null;
            auditFailure(AuditActions.LOGIN_FAILED, maskEmail(normalizedEmail), actorId, null, client,
                    user == null ? "unknown_user" : "inactive_user");
            log.warn("Login rejected for {}: unknown or inactive account", maskEmail(normalizedEmail));
            throw new AuthException(AuthErrorCode.INVALID_CREDENTIALS);
        }

        UUID userId = user.getId();
        try {
            lockoutGuard.assertNotLocked(user);
        } catch (LockedOutException ex) {
            auditFailure(AuditActions.LOGIN_FAILED, userId.toString(), userId, null, client, "account_locked");
            log.warn("Login rejected for user {}: account locked until {}", userId, ex.getLockedUntil());
            throw ex;
        }

        if (!passwordEncoder.matches(password, user.getPasswordHash())) {
            boolean lockedNow = lockoutGuard.recordFailure(userId);
            auditFailure(AuditActions.LOGIN_FAILED, userId.toString(), userId, null, client,
                    lockedNow ? "invalid_password_locked" : "invalid_password");
            log.warn("Login rejected for user {}: invalid password", userId);
            throw new AuthException(AuthErrorCode.INVALID_CREDENTIALS);
        }

        lockoutGuard.reset(userId);
        ResolvedPermissions permissions = permissionResolver.resolve(userId);

        if (!user.isMfaEnabled() && requiresMfa(permissions)) {
            IssuedToken setupToken = jwtTokenService.issueMfaSetupToken(userId, user.getEmail(), client);
            auditSuccess(AuditActions.MFA_SETUP_REQUIRED_INITIATED, userId, null, client, Map.of());
            log.info("User {} must enroll MFA before the first session", userId);
            return new LoginResult.MfaSetupRequired(setupToken);
        }

        if (user.isMfaEnabled()) {
            IssuedToken challengeToken = jwtTokenService.issueMfaChallengeToken(userId, user.getEmail(), client);
            auditSuccess(AuditActions.MFA_CHALLENGE_ISSUED, userId, null, client, Map.of());
            log.info("MFA challenge issued to user {}", userId);
            return new LoginResult.MfaChallengeRequired(challengeToken);
        }

        AuthResult result = completeLogin(user, permissions, client, false,
                AuditActions.LOGIN, AuthEvent.LOGGED_IN, Map.of());
        return new LoginResult.Authenticated(result);
    }

    /**
     * Finishes a login step that was gated on MFA, or enables MFA for an already logged-in user.
     * The presented token decides which: a challenge token checks an enabled factor, a setup token
     * or an access token confirms a pending enrollment.
     */
    public AuthResult verifyMfa(VerifiedToken token, String code, ClientContext client) {
        if (token instanceof VerifiedToken.MfaChallengeToken challenge) {
            return completeMfaChallenge(challenge, code, client);
        }
        if (token instanceof VerifiedToken.MfaSetupToken setup) {
            warnOnClientMismatch(setup.userId(), setup.client(), client);
            return completeMfaSetup(setup.userId(), code, client, null);
        }
        if (token instanceof VerifiedToken.AccessToken access) {
            return completeMfaSetup(access.userId(), code, client, access.sessionId());
        }
        throw new AuthException(AuthErrorCode.INVALID_TOKEN);
    }

    private AuthResult completeMfaChallenge(VerifiedToken.MfaChallengeToken challenge, String code,
                                            ClientContext client) {
        UUID userId = challenge.userId();
        ClinicUser user = requireActiveUser(userId);
        boolean anomaly = warnOnClientMismatch(userId, challenge.client(), client);

        MfaMethod method;
        try {
            method = mfaManager.verifyCode(userId, code);
        } catch (ProblemException ex) {
            auditFailure(AuditActions.MFA_LOGIN_FAILED, userId.toString(), userId, null, client,
                    ex.getCode().toLowerCase(Locale.ROOT));
            log.warn("MFA login failed for user {}: {}", userId, ex.getCode());
            throw ex;
        }

        if (method == MfaMethod.BACKUP_CODE) {
            auditSuccess(AuditActions.MFA_BACKUP_CODE_USED, userId, null, client, Map.of());
        }

        // reload: the MFA check runs bulk updates that detach the earlier instance
        user = requireActiveUser(userId);
        Map<String, Object> detail = new HashMap<>();
        detail.put("method", method.name());
        if (anomaly) {
            detail.put("clientMismatch", true);
        }
        return completeLogin(user, permissionResolver.resolve(userId), client, true,
                AuditActions.LOGIN_MFA_SUCCESS, AuthEvent.LOGGED_IN_WITH_MFA, detail);
    }

    private AuthResult completeMfaSetup(UUID userId, String code, ClientContext client, UUID previousSessionId) {
        requireActiveUser(userId);
        mfaManager.verifySetup(userId, code, client);

        ClinicUser user = requireActiveUser(userId);
        AuthResult result = completeLogin(user, permissionResolver.resolve(userId), client, true,
                AuditActions.LOGIN_MFA_SUCCESS, AuthEvent.LOGGED_IN_WITH_MFA, Map.of("method", "MFA_SETUP"));
        if (previousSessionId != null) {
            sessionService.revoke(previousSessionId, userId, SessionRevocationReason.MFA_SESSION_UPGRADE);
        }
        return result;
    }

    public AuthResult refresh(String refreshToken, ClientContext client) {
        if (refreshToken == null || refreshToken.isBlank()) {
            throw new AuthException(AuthErrorCode.INVALID_TOKEN);
        }
        VerifiedToken.RefreshToken verified = jwtTokenService.verifyRefreshToken(refreshToken);
        OffsetDateTime now = OffsetDateTime.now(clock);

        UserSession session = sessionService.findByRefreshFingerprint(TokenFingerprints.of(refreshToken))
                .orElseThrow(() -> new AuthException(AuthErrorCode.INVALID_TOKEN));
        if (!session.isActiveAt(now)) {
            log.warn("Refresh rejected for session {}: revoked or expired", session.getId());
            throw new AuthException(AuthErrorCode.SESSION_REVOKED_OR_EXPIRED);
        }

        ClinicUser user = session.getUser();
        if (!session.getId().equals(verified.sessionId()) || !user.getId().equals(verified.userId())) {
            log.warn("Refresh rejected for session {}: token subject does not match the session", session.getId());
            throw new AuthException(AuthErrorCode.INVALID_TOKEN);
        }
        if (!user.isActive()) {
            throw new AuthException(AuthErrorCode.SESSION_REVOKED_OR_EXPIRED);
        }

        ResolvedPermissions permissions = permissionResolver.resolve(user.getId());
        IssuedToken accessToken = jwtTokenService.issueAccessToken(
                user.getId(), user.getEmail(), session.getId(), permissions, session.isMfaVerified());
        sessionService.recordRefresh(session, accessToken.value());

        // 리프레시 토큰은 회전하지 않는다: 남은 수명 그대로 같은 쿠키를 다시 내려준다.
        Instant refreshExpiresAt = verified.expiresAt();
        IssuedToken sameRefreshToken = new IssuedToken(refreshToken, refreshExpiresAt,
                Duration.between(clock.instant(), refreshExpiresAt));

        auditSuccess(AuditActions.TOKEN_REFRESH, user.getId(), session.getId(), client, Map.of());
        return new AuthResult(UserSummary.of(user, permissions), session.getId(), accessToken, sameRefreshToken);
    }

    /**
     * Ends the session behind an access token. Challenge tokens have no session yet, so only the
     * logout itself is recorded.
     */
    public void logout(UUID userId, UUID sessionId, String reason, ClientContext client) {
        if (sessionId != null) {
            sessionService.revoke(sessionId, userId, SessionRevocationReason.LOGOUT);
        }
        Map<String, Object> detail = reason == null || reason.isBlank() ? Map.of() : Map.of("reason", reason);
        auditSuccess(AuditActions.LOGOUT, userId, sessionId, client, detail);
        eventPublisher.publish(AuthEvent.LOGGED_OUT, userId, sessionId);
        log.info("User {} logged out of session {}", userId, sessionId);
    }

    @Transactional(readOnly = true)
    public UserSummary currentUser(UUID userId) {
        ClinicUser user = clinicUserRepository.findById(userId)
                .orElseThrow(() -> new AuthException(AuthErrorCode.USER_NOT_FOUND));
        return UserSummary.of(user, permissionResolver.resolve(userId));
    }

    public void changePassword(UUID userId, String currentPassword, String newPassword, ClientContext client) {
        ClinicUser user = clinicUserRepository.findById(userId)
                .orElseThrow(() -> new AuthException(AuthErrorCode.USER_NOT_FOUND));

        try {
            if (!passwordEncoder.matches(currentPassword, user.getPasswordHash())) {
                throw new AuthException(AuthErrorCode.INVALID_CREDENTIALS);
            }
            if (Objects.equals(currentPassword, newPassword)) {
                throw new AuthException(AuthErrorCode.PASSWORD_REUSE);
            }
            passwordPolicyService.assertStrong(newPassword, user);
            passwordPolicyService.assertNotReused(newPassword, user);
        } catch (AuthException ex) {
            auditFailure(AuditActions.PASSWORD_CHANGE_FAILED, userId.toString(), userId, null, client,
                    ex.getErrorCode().name().toLowerCase(Locale.ROOT));
            log.warn("Password change rejected for user {}: {}", userId, ex.getErrorCode());
            throw ex;
        }

        String previousHash = user.getPasswordHash();
        user.setPasswordHash(passwordEncoder.encode(newPassword));
        clinicUserRepository.save(user);
        passwordPolicyService.recordPreviousPassword(user, previousHash);

        int revoked = sessionService.revokeAll(userId, userId, SessionRevocationReason.PASSWORD_CHANGE);
        auditSuccess(AuditActions.PASSWORD_CHANGE, userId, null, client, Map.of("revokedSessions", revoked));
        eventPublisher.publish(AuthEvent.PASSWORD_CHANGED, userId, null);
        log.info("Password changed for user {}", userId);
    }

    @Transactional(readOnly = true)
    public List<SessionView> listSessions(UUID userId, UUID currentSessionId) {
        return sessionService.listActive(userId).stream()
                .map(session -> SessionView.of(session, currentSessionId))
                .toList();
    }

    public int revokeOtherSessions(UUID userId, UUID currentSessionId, ClientContext client) {
        int revoked = sessionService.revokeOthers(userId, currentSessionId, SessionRevocationReason.REVOKED_BY_USER);
        auditSuccess(AuditActions.SESSIONS_REVOKED, userId, currentSessionId, client, Map.of("revoked", revoked));
        return revoked;
    }

    private AuthResult completeLogin(ClinicUser user, ResolvedPermissions permissions, ClientContext client,
                                     boolean mfaVerified, String auditAction, String eventName,
                                     Map<String, Object> detail) {
        UUID userId = user.getId();
        UUID sessionId = UUID.randomUUID();
        IssuedToken accessToken = jwtTokenService.issueAccessToken(
                userId, user.getEmail(), sessionId, permissions, mfaVerified);
        IssuedToken refreshToken = jwtTokenService.issueRefreshToken(userId, sessionId);

        sessionService.create(new SessionService.NewSession(
                sessionId, user, accessToken.value(), refreshToken.value(), refreshToken.expiresAt(),
                client, mfaVerified));
        clinicUserRepository.updateLastLoginAt(userId, OffsetDateTime.now(clock));

        auditSuccess(auditAction, userId, sessionId, client, detail);
        eventPublisher.publish(eventName, userId, sessionId);
        log.info("User {} logged in, session {}", userId, sessionId);
        return new AuthResult(UserSummary.of(user, permissions), sessionId, accessToken, refreshToken);
    }

    private boolean requiresMfa(ResolvedPermissions permissions) {
        return permissions.roles().stream()
                .map(code -> code.toUpperCase(Locale.ROOT))
                .anyMatch(mfaRequiredRoles::contains);
    }

    private ClinicUser requireActiveUser(UUID userId) {
        ClinicUser user = clinicUserRepository.findById(userId)
                .orElseThrow(() -> new AuthException(AuthErrorCode.INVALID_TOKEN));
        if (!user.isActive()) {
            throw new AuthException(AuthErrorCode.INVALID_TOKEN);
        }
        return user;
    }

    private boolean warnOnClientMismatch(UUID userId, ClientContext issuedTo, ClientContext presentedBy) {
        if (issuedTo == null || presentedBy == null) {
            return false;
        }
        boolean ipChanged = issuedTo.ipAddress() != null
                && !Objects.equals(issuedTo.ipAddress(), presentedBy.ipAddress());
        boolean agentChanged = issuedTo.userAgent() != null
                && !Objects.equals(issuedTo.userAgent(), presentedBy.userAgent());
        if (ipChanged || agentChanged) {
            log.warn("MFA token for user {} presented from a different client (ip changed: {}, agent changed: {})",
                    userId, ipChanged, agentChanged);
            return true;
        }
        return false;
    }

    private void auditSuccess(String action, UUID userId, UUID sessionId, ClientContext client,
                              Map<String, Object> detail) {
        auditLogService.record(AuditLogCommand.success(action, AuditActions.RESOURCE_USER, userId.toString(),
                userId, sessionId, client, detail));
    }

    private void auditFailure(String action, String resourceKey, UUID userId, UUID sessionId, ClientContext client,
                              String reason) {
        auditLogService.record(AuditLogCommand.failure(action, AuditActions.RESOURCE_USER, resourceKey,
                userId, sessionId, client, reason));
    }

    /**
     * Audit key for an address that matched no account. Long domains are replaced by their
     * fingerprint so the key always fits the audit column.
     */
    static String maskEmail(String email) {
        int at = email.indexOf('@');
        if (at <= 0) {
            return "***";
        }
        String masked = email.charAt(0) + "***" + email.substring(at);
        if (masked.length() <= MASKED_EMAIL_MAX_LENGTH) {
            return masked;
        }
        return email.charAt(0) + "***@sha256:" + TokenFingerprints.of(email.substring(at + 1));
    }
}

package com.clinicmate.backend.modules.auth.application;

import java.time.Clock;
import java.time.OffsetDateTime;
import java.util.UUID;

import com.clinicmate.backend.modules.auth.domain.ClinicUser;
import com.clinicmate.backend.modules.auth.infrastructure.persistence.ClinicUserRepository;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;
import org.springframework.transaction.annotation.Transactional;
import org.springframework.web.server.ResponseStatusException;

/**
 * Failure budgets for password checks and for MFA code checks. The two budgets are independent.
 * Counters move through single UPDATE statements so concurrent failures are never lost.
 */
@Component
@Transactional(noRollbackFor = ResponseStatusException.class)
public class AccountLockoutGuard {

    private static final Logger log = LoggerFactory.getLogger(AccountLockoutGuard.class);

    private final ClinicUserRepository clinicUserRepository;
    private final AuthPolicyProperties properties;
    private final Clock clock;

    public AccountLockoutGuard(ClinicUserRepository clinicUserRepository, AuthPolicyProperties properties,
                               Clock clock) {
        this.clinicUserRepository = clinicUserRepository;
        this.properties = properties;
        this.clock = clock;
    }

    public boolean isLocked(ClinicUser user) {
        return user.isLockedAt(OffsetDateTime.now(clock));
    }

    public void assertNotLocked(ClinicUser user) {
        OffsetDateTime now = OffsetDateTime.now(clock);
        if (user.isLockedAt(now)) {
            throw new LockedOutException(AuthErrorCode.ACCOUNT_LOCKED, now, user.getLockedUntil());
        }
    }

    /**
     * @return {@code true} when this failure put the account into lockout
     */
    public boolean recordFailure(UUID userId) {
        OffsetDateTime now = OffsetDateTime.now(clock);
        clinicUserRepository.incrementFailedLoginAttempts(userId, now);
        AuthPolicyProperties.Lockout lockout = properties.lockout();
        int locked = clinicUserRepository.lockIfThresholdReached(
                userId, lockout.maxFailedAttempts(), now.plus(lockout.lockDuration()));
        if (locked > 0) {
            log.warn("User {} locked until {} after repeated password failures", userId,
                    now.plus(lockout.lockDuration()));
            return true;
        }
        return false;
    }

    public void reset(UUID userId) {
        clinicUserRepository.resetFailedLoginAttempts(userId);
    }

    public void assertMfaNotLocked(ClinicUser user) {
        OffsetDateTime now = OffsetDateTime.now(clock);
        if (user.isMfaLockedAt(now)) {
            throw new LockedOutException(AuthErrorCode.MFA_LOCKED, now, user.getMfaLockedUntil());
        }
    }

    public boolean recordMfaFailure(UUID userId) {
        OffsetDateTime now = OffsetDateTime.now(clock);
        clinicUserRepository.incrementFailedMfaAttempts(userId);
        AuthPolicyProperties.Mfa mfa = properties.mfa();
        int locked = clinicUserRepository.lockMfaIfThresholdReached(
                userId, mfa.maxFailedAttempts(), now.plus(mfa.cooldown()));
        if (locked > 0) {
            log.warn("MFA verification for user {} cooling down until {}", userId, now.plus(mfa.cooldown()));
            return true;
        }
        return false;
    }

    public void resetMfaFailures(UUID userId) {
        clinicUserRepository.resetFailedMfaAttempts(userId);
    }
}

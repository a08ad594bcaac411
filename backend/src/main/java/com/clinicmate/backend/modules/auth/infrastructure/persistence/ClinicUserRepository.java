package com.clinicmate.backend.modules.auth.infrastructure.persistence;

import java.time.OffsetDateTime;
import java.util.Optional;
import java.util.UUID;

import com.clinicmate.backend.modules.auth.domain.ClinicUser;

import org.springframework.data.jpa.repository.EntityGraph;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Modifying;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;

public interface ClinicUserRepository extends JpaRepository<ClinicUser, UUID> {

    @Query("select cu from ClinicUser cu where lower(cu.email) = lower(:email)")
    Optional<ClinicUser> findByEmailIgnoreCase(@Param("email") String email);

    @EntityGraph(attributePaths = "backupCodeHashes")
    @Query("select cu from ClinicUser cu where cu.id = :id")
    Optional<ClinicUser> findWithBackupCodesById(@Param("id") UUID id);

    @Modifying(clearAutomatically = true, flushAutomatically = true)
    @Query("""
            update ClinicUser cu
               set cu.failedLoginAttempts = cu.failedLoginAttempts + 1,
                   cu.lastFailedLoginAt = :at
             where cu.id = :userId
            """)
    int incrementFailedLoginAttempts(@Param("userId") UUID userId, @Param("at") OffsetDateTime at);

    @Modifying(clearAutomatically = true, flushAutomatically = true)
    @Query("""
            update ClinicUser cu
               set cu.lockedUntil = :lockedUntil
             where cu.id = :userId
               and cu.failedLoginAttempts >= :threshold
            """)
    int lockIfThresholdReached(@Param("userId") UUID userId,
                               @Param("threshold") int threshold,
                               @Param("lockedUntil") OffsetDateTime lockedUntil);

    @Modifying(clearAutomatically = true, flushAutomatically = true)
    @Query("""
            update ClinicUser cu
               set cu.failedLoginAttempts = 0,
                   cu.lockedUntil = null
             where cu.id = :userId
            """)
    int resetFailedLoginAttempts(@Param("userId") UUID userId);

    @Modifying(clearAutomatically = true, flushAutomatically = true)
    @Query("update ClinicUser cu set cu.failedMfaAttempts = cu.failedMfaAttempts + 1 where cu.id = :userId")
    int incrementFailedMfaAttempts(@Param("userId") UUID userId);

    @Modifying(clearAutomatically = true, flushAutomatically = true)
    @Query("""
            update ClinicUser cu
               set cu.mfaLockedUntil = :lockedUntil
             where cu.id = :userId
               and cu.failedMfaAttempts >= :threshold
            """)
    int lockMfaIfThresholdReached(@Param("userId") UUID userId,
                                  @Param("threshold") int threshold,
                                  @Param("lockedUntil") OffsetDateTime lockedUntil);

    @Modifying(clearAutomatically = true, flushAutomatically = true)
    @Query("""
            update ClinicUser cu
               set cu.failedMfaAttempts = 0,
                   cu.mfaLockedUntil = null
             where cu.id = :userId
            """)
    int resetFailedMfaAttempts(@Param("userId") UUID userId);

    @Modifying(clearAutomatically = true, flushAutomatically = true)
    @Query("update ClinicUser cu set cu.lastLoginAt = :at where cu.id = :userId")
    int updateLastLoginAt(@Param("userId") UUID userId, @Param("at") OffsetDateTime at);
}

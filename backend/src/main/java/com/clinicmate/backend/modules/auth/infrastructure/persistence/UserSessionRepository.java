package com.clinicmate.backend.modules.auth.infrastructure.persistence;

import java.time.OffsetDateTime;
import java.util.List;
import java.util.Optional;
import java.util.UUID;

import com.clinicmate.backend.modules.auth.domain.SessionRevocationReason;
import com.clinicmate.backend.modules.auth.domain.UserSession;

import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Modifying;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;

public interface UserSessionRepository extends JpaRepository<UserSession, UUID> {

    Optional<UserSession> findByRefreshTokenHash(String refreshTokenHash);

    @Query("""
            select us
              from UserSession us
             where us.user.id = :userId
               and us.revokedAt is null
               and us.expiresAt > :now
             order by us.lastActivityAt desc
            """)
    List<UserSession> findActiveByUserId(@Param("userId") UUID userId, @Param("now") OffsetDateTime now);

    @Modifying(clearAutomatically = true, flushAutomatically = true)
    @Query("""
            update UserSession us
               set us.revokedAt = :revokedAt,
                   us.revokedBy = :revokedBy,
                   us.revokedReason = :reason
             where us.user.id = :userId
               and us.revokedAt is null
            """)
    int revokeAllForUser(@Param("userId") UUID userId,
                         @Param("revokedAt") OffsetDateTime revokedAt,
                         @Param("revokedBy") UUID revokedBy,
                         @Param("reason") SessionRevocationReason reason);

    @Modifying(clearAutomatically = true, flushAutomatically = true)
    @Query("""
            update UserSession us
               set us.revokedAt = :revokedAt,
                   us.revokedBy = :revokedBy,
                   us.revokedReason = :reason
             where us.user.id = :userId
               and us.revokedAt is null
               and us.id <> :exceptSessionId
            """)
    int revokeOthersForUser(@Param("userId") UUID userId,
                            @Param("exceptSessionId") UUID exceptSessionId,
                            @Param("revokedAt") OffsetDateTime revokedAt,
                            @Param("revokedBy") UUID revokedBy,
                            @Param("reason") SessionRevocationReason reason);

    @Modifying(clearAutomatically = true, flushAutomatically = true)
    @Query("""
            update UserSession us
               set us.revokedAt = :now,
                   us.revokedReason = :reason
             where us.revokedAt is null
               and us.expiresAt <= :now
            """)
    int revokeExpired(@Param("now") OffsetDateTime now, @Param("reason") SessionRevocationReason reason);

    @Modifying(clearAutomatically = true, flushAutomatically = true)
    @Query("""
            delete from UserSession us
             where (us.revokedAt is not null and us.revokedAt < :cutoff)
                or us.expiresAt < :cutoff
            """)
    int deleteStale(@Param("cutoff") OffsetDateTime cutoff);
}

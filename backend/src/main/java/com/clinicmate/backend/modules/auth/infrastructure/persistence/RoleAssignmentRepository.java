package com.clinicmate.backend.modules.auth.infrastructure.persistence;

import java.time.OffsetDateTime;
import java.util.List;
import java.util.UUID;

import com.clinicmate.backend.modules.auth.domain.RoleAssignment;

import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;

public interface RoleAssignmentRepository extends JpaRepository<RoleAssignment, UUID> {

    @Query("""
            select distinct ra
              from RoleAssignment ra
              join fetch ra.role r
              left join fetch r.permissions
             where ra.user.id = :userId
               and ra.active = true
               and ra.revokedAt is null
               and ra.validFrom <= :now
               and (ra.validUntil is null or ra.validUntil > :now)
               and r.active = true
            """)
    List<RoleAssignment> findValidAssignments(@Param("userId") UUID userId, @Param("now") OffsetDateTime now);
}

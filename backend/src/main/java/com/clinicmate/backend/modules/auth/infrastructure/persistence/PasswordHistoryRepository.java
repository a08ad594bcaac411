package com.clinicmate.backend.modules.auth.infrastructure.persistence;

import java.util.List;
import java.util.UUID;

import com.clinicmate.backend.modules.auth.domain.PasswordHistory;

import org.springframework.data.domain.Pageable;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;

public interface PasswordHistoryRepository extends JpaRepository<PasswordHistory, UUID> {

    @Query("""
            select ph.passwordHash
              from PasswordHistory ph
             where ph.user.id = :userId
             order by ph.createdAt desc
            """)
    List<String> findRecentHashes(@Param("userId") UUID userId, Pageable pageable);
}

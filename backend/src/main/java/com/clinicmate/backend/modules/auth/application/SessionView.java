package com.clinicmate.backend.modules.auth.application;

import java.time.OffsetDateTime;
import java.util.UUID;

import com.clinicmate.backend.modules.auth.domain.UserSession;

public record SessionView(
        UUID id,
        String ipAddress,
        String userAgent,
        boolean mfaVerified,
        OffsetDateTime createdAt,
        OffsetDateTime lastActivityAt,
        OffsetDateTime expiresAt,
        boolean current
) {

    public static SessionView of(UserSession session, UUID currentSessionId) {
        return new SessionView(
                session.getId(),
                session.getIpAddress(),
                session.getUserAgent(),
                session.isMfaVerified(),
                session.getCreatedAt(),
                session.getLastActivityAt(),
                session.getExpiresAt(),
                session.getId().equals(currentSessionId)
        );
    }
}

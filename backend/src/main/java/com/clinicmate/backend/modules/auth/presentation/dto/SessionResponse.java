package com.clinicmate.backend.modules.auth.presentation.dto;

import java.time.OffsetDateTime;
import java.util.UUID;

import com.clinicmate.backend.modules.auth.application.SessionView;

public record SessionResponse(
        UUID id,
        String ipAddress,
        String userAgent,
        boolean mfaVerified,
        OffsetDateTime createdAt,
        OffsetDateTime lastActivityAt,
        OffsetDateTime expiresAt,
        boolean current
) {

    public static SessionResponse from(SessionView view) {
        return new SessionResponse(view.id(), view.ipAddress(), view.userAgent(), view.mfaVerified(),
                view.createdAt(), view.lastActivityAt(), view.expiresAt(), view.current());
    }
}

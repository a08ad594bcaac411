package com.clinicmate.backend.modules.auth.presentation.dto;

public record RevokeSessionsResponse(int revoked) {
}

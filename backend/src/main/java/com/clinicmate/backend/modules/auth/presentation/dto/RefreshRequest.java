package com.clinicmate.backend.modules.auth.presentation.dto;

/**
 * Body fallback for clients that cannot hold the refresh cookie.
 */
public record RefreshRequest(String refreshToken) {
}

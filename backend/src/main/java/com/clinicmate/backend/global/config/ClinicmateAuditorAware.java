package com.clinicmate.backend.global.config;

import java.util.Optional;
import java.util.UUID;

import com.clinicmate.backend.global.security.JwtAuthenticationPrincipal;

import org.springframework.data.domain.AuditorAware;
import org.springframework.lang.NonNull;
import org.springframework.security.core.Authentication;
import org.springframework.security.core.context.SecurityContextHolder;

/**
 * Resolves the acting user id for {@code created_by}/{@code updated_by} columns.
 * Only fully authenticated principals count: MFA challenge and setup tokens identify a user who
 * has not finished logging in, so writes made on their behalf stay unattributed.
 */
public class ClinicmateAuditorAware implements AuditorAware<UUID> {

    @Override
    @NonNull
    public Optional<UUID> getCurrentAuditor() {
        Authentication authentication = SecurityContextHolder.getContext().getAuthentication();
        if (authentication == null || !authentication.isAuthenticated()) {
            return Optional.empty();
        }

        if (authentication.getPrincipal() instanceof JwtAuthenticationPrincipal principal
                && principal.isFullyAuthenticated()) {
            return Optional.of(principal.userId());
        }
        return Optional.empty();
    }
}

package com.clinicmate.backend.global.security;

import java.util.UUID;

import com.clinicmate.backend.modules.auth.application.AuthErrorCode;
import com.clinicmate.backend.modules.auth.application.AuthException;

import org.springframework.security.core.Authentication;
import org.springframework.security.core.context.SecurityContextHolder;

public final class SecurityUtils {

    private SecurityUtils() {
    }

    public static JwtAuthenticationPrincipal getCurrentPrincipal() {
        Authentication authentication = SecurityContextHolder.getContext().getAuthentication();
        if (authentication == null || !(authentication.getPrincipal() instanceof JwtAuthenticationPrincipal principal)) {
            throw new AuthException(AuthErrorCode.INVALID_TOKEN);
        }
        return principal;
    }

    public static UUID getCurrentUserId() {
        return getCurrentPrincipal().userId();
    }

    public static boolean hasPermission(String permissionCode) {
        return getCurrentPrincipal().hasPermission(permissionCode);
    }
}

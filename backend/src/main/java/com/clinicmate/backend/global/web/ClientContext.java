package com.clinicmate.backend.global.web;

import jakarta.servlet.http.HttpServletRequest;

/**
 * Network metadata of the caller. Stored on sessions and on MFA temp tokens; never used to authenticate.
 */
public record ClientContext(String ipAddress, String userAgent) {

    private static final int IP_ADDRESS_MAX_LENGTH = 64;
    private static final int USER_AGENT_MAX_LENGTH = 512;

    public static final ClientContext UNKNOWN = new ClientContext(null, null);

    public ClientContext {
        // values also come back from token claims, so bound them to the column sizes here
        ipAddress = clamp(ipAddress, IP_ADDRESS_MAX_LENGTH);
        userAgent = clamp(userAgent, USER_AGENT_MAX_LENGTH);
    }

    public static ClientContext from(HttpServletRequest request) {
        Object cached = request.getAttribute(RequestContextFilter.CLIENT_CONTEXT_ATTRIBUTE);
        if (cached instanceof ClientContext context) {
            return context;
        }
        return new ClientContext(request.getRemoteAddr(), truncate(request.getHeader("User-Agent")));
    }

    static String truncate(String userAgent) {
        return clamp(userAgent, USER_AGENT_MAX_LENGTH);
    }

    private static String clamp(String value, int maxLength) {
        if (value == null || value.isBlank()) {
            return null;
        }
        String trimmed = value.trim();
        return trimmed.length() > maxLength ? trimmed.substring(0, maxLength) : trimmed;
    }
}

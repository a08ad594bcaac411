package com.clinicmate.backend.modules.auth.presentation;

import java.time.Duration;

import com.clinicmate.backend.global.security.JwtAuthenticationFilter;
import com.clinicmate.backend.modules.auth.application.AuthPolicyProperties;
import com.clinicmate.backend.modules.auth.application.AuthResult;

import jakarta.servlet.http.HttpServletResponse;

import org.springframework.http.HttpHeaders;
import org.springframework.http.ResponseCookie;
import org.springframework.stereotype.Component;

/**
 * Token cookies: httpOnly, SameSite=Strict, path {@code /}, max-age equal to the token lifetime.
 */
@Component
public class AuthCookieWriter {

    public static final String ACCESS_TOKEN_COOKIE = JwtAuthenticationFilter.ACCESS_TOKEN_COOKIE;
    public static final String REFRESH_TOKEN_COOKIE = "refresh_token";

    private final boolean secure;

    public AuthCookieWriter(AuthPolicyProperties properties) {
        this.secure = properties.cookies().secure();
    }

    public void writeTokens(HttpServletResponse response, AuthResult result) {
        add(response, ACCESS_TOKEN_COOKIE, result.accessToken().value(), result.accessToken().ttl());
        add(response, REFRESH_TOKEN_COOKIE, result.refreshToken().value(), result.refreshToken().ttl());
    }

    public void clear(HttpServletResponse response) {
        add(response, ACCESS_TOKEN_COOKIE, "", Duration.ZERO);
        add(response, REFRESH_TOKEN_COOKIE, "", Duration.ZERO);
    }

    private void add(HttpServletResponse response, String name, String value, Duration maxAge) {
        ResponseCookie cookie = ResponseCookie.from(name, value)
                .httpOnly(true)
                .secure(secure)
                .sameSite("Strict")
                .path("/")
                .maxAge(maxAge.isNegative() ? Duration.ZERO : maxAge)
                .build();
        response.addHeader(HttpHeaders.SET_COOKIE, cookie.toString());
    }
}

package com.clinicmate.backend.global.security;

import java.io.IOException;
import java.util.ArrayList;
import java.util.EnumSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

import com.clinicmate.backend.global.error.ProblemException;
import com.clinicmate.backend.modules.auth.application.JwtTokenService;
import com.clinicmate.backend.modules.auth.application.PermissionResolver;
import com.clinicmate.backend.modules.auth.application.ResolvedPermissions;
import com.clinicmate.backend.modules.auth.application.SessionService;
import com.clinicmate.backend.modules.auth.application.VerifiedToken;
import com.clinicmate.backend.modules.auth.domain.TokenType;

import jakarta.servlet.FilterChain;
import jakarta.servlet.ServletException;
import jakarta.servlet.http.Cookie;
import jakarta.servlet.http.HttpServletRequest;
import jakarta.servlet.http.HttpServletResponse;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.HttpHeaders;
import org.springframework.security.authentication.UsernamePasswordAuthenticationToken;
import org.springframework.security.core.GrantedAuthority;
import org.springframework.security.core.authority.SimpleGrantedAuthority;
import org.springframework.security.core.context.SecurityContextHolder;
import org.springframework.security.web.authentication.WebAuthenticationDetailsSource;
import org.springframework.stereotype.Component;
import org.springframework.web.filter.OncePerRequestFilter;

/**
 * Authenticates requests from the {@code access_token} cookie or a bearer header. Each path accepts a
 * fixed set of token types; access tokens are additionally bound to a live session on every request.
 */
@Component
public class JwtAuthenticationFilter extends OncePerRequestFilter {

    private static final Logger log = LoggerFactory.getLogger(JwtAuthenticationFilter.class);

    public static final String ACCESS_TOKEN_COOKIE = "access_token";
    private static final String BEARER_PREFIX = "Bearer ";

    private static final Set<TokenType> ACCESS_ONLY = EnumSet.of(TokenType.ACCESS);
    private static final Map<String, Set<TokenType>> ACCEPTED_TYPES_BY_PATH = Map.of(
            "/auth/logout", EnumSet.of(TokenType.ACCESS, TokenType.MFA_CHALLENGE),
            "/auth/mfa/enable", EnumSet.of(TokenType.ACCESS, TokenType.MFA_SETUP),
            "/auth/mfa/verify", EnumSet.of(TokenType.ACCESS, TokenType.MFA_SETUP, TokenType.MFA_CHALLENGE)
    );
    private static final Set<String> PUBLIC_PATHS = Set.of("/auth/login", "/auth/refresh");

    private final JwtTokenService jwtTokenService;
    private final SessionService sessionService;
    private final PermissionResolver permissionResolver;
    private final ProblemResponseWriter problemResponseWriter;

    public JwtAuthenticationFilter(
            JwtTokenService jwtTokenService,
            SessionService sessionService,
            PermissionResolver permissionResolver,
            ProblemResponseWriter problemResponseWriter
    ) {
        this.jwtTokenService = jwtTokenService;
        this.sessionService = sessionService;
        this.permissionResolver = permissionResolver;
        this.problemResponseWriter = problemResponseWriter;
    }

    @Override
    protected void doFilterInternal(HttpServletRequest request, HttpServletResponse response, FilterChain filterChain)
            throws ServletException, IOException {

        String token = resolveToken(request);
        if (token != null) {
            try {
                Set<TokenType> accepted = ACCEPTED_TYPES_BY_PATH.getOrDefault(pathOf(request), ACCESS_ONLY);
                VerifiedToken verified = jwtTokenService.verify(token, accepted);
                authenticate(request, token, verified);
            } catch (ProblemException ex) {
                SecurityContextHolder.clearContext();
                log.debug("Rejected token on {}: {}", pathOf(request), ex.getCode());
                problemResponseWriter.write(request, response, ex);
                return;
            }
        }

        filterChain.doFilter(request, response);
    }

    private void authenticate(HttpServletRequest request, String rawToken, VerifiedToken verified) {
        JwtAuthenticationPrincipal principal;
        List<GrantedAuthority> authorities = new ArrayList<>();

        if (verified instanceof VerifiedToken.AccessToken access) {
            sessionService.assertActiveFor(access.sessionId(), access.userId());
            ResolvedPermissions resolved = permissionResolver.resolve(access.userId());
            resolved.roles().forEach(role -> authorities.add(new SimpleGrantedAuthority("ROLE_" + role)));
            resolved.permissions().forEach(code -> authorities.add(new SimpleGrantedAuthority(code)));
            principal = new JwtAuthenticationPrincipal(access.userId(), access.email(), TokenType.ACCESS,
                    access.sessionId(), List.copyOf(resolved.roles()), List.copyOf(resolved.permissions()), access);
        } else if (verified instanceof VerifiedToken.MfaChallengeToken challenge) {
            principal = new JwtAuthenticationPrincipal(challenge.userId(), challenge.email(),
                    TokenType.MFA_CHALLENGE, null, List.of(), List.of(), challenge);
        } else if (verified instanceof VerifiedToken.MfaSetupToken setup) {
            principal = new JwtAuthenticationPrincipal(setup.userId(), setup.email(),
                    TokenType.MFA_SETUP, null, List.of(), List.of(), setup);
        } else {
            throw new IllegalStateException("Refresh tokens never authenticate requests");
        }

        UsernamePasswordAuthenticationToken authentication =
                new UsernamePasswordAuthenticationToken(principal, rawToken, authorities);
        authentication.setDetails(new WebAuthenticationDetailsSource().buildDetails(request));
        SecurityContextHolder.getContext().setAuthentication(authentication);
    }

    static String resolveToken(HttpServletRequest request) {
        Cookie[] cookies = request.getCookies();
        if (cookies != null) {
            for (Cookie cookie : cookies) {
                if (ACCESS_TOKEN_COOKIE.equals(cookie.getName()) && cookie.getValue() != null
                        && !cookie.getValue().isBlank()) {
                    return cookie.getValue();
                }
            }
        }

        String authorization = request.getHeader(HttpHeaders.AUTHORIZATION);
        if (authorization != null && authorization.startsWith(BEARER_PREFIX)) {
            String token = authorization.substring(BEARER_PREFIX.length()).trim();
            return token.isEmpty() ? null : token;
        }
        return null;
    }

    private static String pathOf(HttpServletRequest request) {
        String uri = request.getRequestURI();
        String contextPath = request.getContextPath();
        if (contextPath != null && !contextPath.isEmpty() && uri.startsWith(contextPath)) {
            uri = uri.substring(contextPath.length());
        }
        return uri.length() > 1 && uri.endsWith("/") ? uri.substring(0, uri.length() - 1) : uri;
    }

    @Override
    protected boolean shouldNotFilter(HttpServletRequest request) {
        if (request.getMethod().equalsIgnoreCase("OPTIONS")) {
            return true;
        }
        String path = pathOf(request);
        return PUBLIC_PATHS.contains(path) || path.startsWith("/actuator/health")
                || path.startsWith("/v3/api-docs") || path.startsWith("/swagger-ui");
    }
}

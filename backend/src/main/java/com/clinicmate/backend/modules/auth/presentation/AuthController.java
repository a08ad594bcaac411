package com.clinicmate.backend.modules.auth.presentation;

import java.util.List;

import com.clinicmate.backend.global.security.JwtAuthenticationPrincipal;
import com.clinicmate.backend.global.security.SecurityUtils;
import com.clinicmate.backend.global.web.ClientContext;
import com.clinicmate.backend.modules.auth.application.AuthResult;
import com.clinicmate.backend.modules.auth.application.AuthService;
import com.clinicmate.backend.modules.auth.application.LoginResult;
import com.clinicmate.backend.modules.auth.presentation.dto.ChangePasswordRequest;
import com.clinicmate.backend.modules.auth.presentation.dto.LoginRequest;
import com.clinicmate.backend.modules.auth.presentation.dto.LoginResponse;
import com.clinicmate.backend.modules.auth.presentation.dto.LogoutRequest;
import com.clinicmate.backend.modules.auth.presentation.dto.RefreshRequest;
import com.clinicmate.backend.modules.auth.presentation.dto.RevokeSessionsResponse;
import com.clinicmate.backend.modules.auth.presentation.dto.SessionResponse;
import com.clinicmate.backend.modules.auth.presentation.dto.UserProfileResponse;

import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.responses.ApiResponse;
import io.swagger.v3.oas.annotations.responses.ApiResponses;

import jakarta.servlet.http.HttpServletRequest;
import jakarta.servlet.http.HttpServletResponse;
import jakarta.validation.Valid;

import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.CookieValue;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

@RestController
@RequestMapping("/auth")
public class AuthController {

    private final AuthService authService;
    private final AuthCookieWriter cookieWriter;

    public AuthController(AuthService authService, AuthCookieWriter cookieWriter) {
        this.authService = authService;
        this.cookieWriter = cookieWriter;
    }

    @Operation(summary = "Log in", description = "Checks credentials and either opens a session or asks for the MFA step.")
    @ApiResponses({
            @ApiResponse(responseCode = "200", description = "Session opened or MFA step required"),
            @ApiResponse(responseCode = "401", description = "Invalid credentials"),
            @ApiResponse(responseCode = "423", description = "Account temporarily locked")
    })
    @PostMapping("/login")
    public ResponseEntity<LoginResponse> login(
            @Valid @RequestBody LoginRequest request,
            HttpServletRequest httpRequest,
            HttpServletResponse httpResponse
    ) {
        LoginResult result = authService.login(request.email(), request.password(), ClientContext.from(httpRequest));
        if (result instanceof LoginResult.MfaSetupRequired setup) {
            return ResponseEntity.ok(LoginResponse.mfaSetupRequired(setup.tempToken().value()));
        }
        if (result instanceof LoginResult.MfaChallengeRequired challenge) {
            return ResponseEntity.ok(LoginResponse.mfaRequired(challenge.tempToken().value()));
        }
        AuthResult authenticated = ((LoginResult.Authenticated) result).result();
        cookieWriter.writeTokens(httpResponse, authenticated);
        return ResponseEntity.ok(LoginResponse.authenticated(authenticated));
    }

    @Operation(summary = "Refresh the access token", description = "Uses the refresh_token cookie; the refresh token itself is not rotated.")
    @PostMapping("/refresh")
    public ResponseEntity<LoginResponse> refresh(
            @CookieValue(name = AuthCookieWriter.REFRESH_TOKEN_COOKIE, required = false) String refreshCookie,
            @RequestBody(required = false) RefreshRequest request,
            HttpServletRequest httpRequest,
            HttpServletResponse httpResponse
    ) {
        String refreshToken = refreshCookie;
        if ((refreshToken == null || refreshToken.isBlank()) && request != null) {
            refreshToken = request.refreshToken();
        }
        AuthResult result = authService.refresh(refreshToken, ClientContext.from(httpRequest));
        cookieWriter.writeTokens(httpResponse, result);
        return ResponseEntity.ok(LoginResponse.authenticated(result));
    }

    @Operation(summary = "Log out", description = "Revokes the current session and clears the token cookies.")
    @PostMapping("/logout")
    public ResponseEntity<Void> logout(
            @Valid @RequestBody(required = false) LogoutRequest request,
            HttpServletRequest httpRequest,
            HttpServletResponse httpResponse
    ) {
        JwtAuthenticationPrincipal principal = SecurityUtils.getCurrentPrincipal();
        authService.logout(principal.userId(), principal.sessionId(),
                request != null ? request.reason() : null, ClientContext.from(httpRequest));
        cookieWriter.clear(httpResponse);
        return ResponseEntity.noContent().build();
    }

    @Operation(summary = "Current user profile")
    @GetMapping("/me")
    public ResponseEntity<UserProfileResponse> me() {
        return ResponseEntity.ok(UserProfileResponse.from(authService.currentUser(SecurityUtils.getCurrentUserId())));
    }

    @Operation(summary = "Change password", description = "Revokes every session of the user, including this one.")
    @ApiResponses({
            @ApiResponse(responseCode = "204", description = "Password changed"),
            @ApiResponse(responseCode = "400", description = "Weak or reused password"),
            @ApiResponse(responseCode = "401", description = "Current password is wrong")
    })
    @PostMapping("/change-password")
    public ResponseEntity<Void> changePassword(
            @Valid @RequestBody ChangePasswordRequest request,
            HttpServletRequest httpRequest,
            HttpServletResponse httpResponse
    ) {
        authService.changePassword(SecurityUtils.getCurrentUserId(), request.currentPassword(),
                request.newPassword(), ClientContext.from(httpRequest));
        cookieWriter.clear(httpResponse);
        return ResponseEntity.noContent().build();
    }

    @Operation(summary = "List active sessions of the current user")
    @GetMapping("/sessions")
    public ResponseEntity<List<SessionResponse>> sessions() {
        JwtAuthenticationPrincipal principal = SecurityUtils.getCurrentPrincipal();
        List<SessionResponse> sessions = authService.listSessions(principal.userId(), principal.sessionId()).stream()
                .map(SessionResponse::from)
                .toList();
        return ResponseEntity.ok(sessions);
    }

    @Operation(summary = "Revoke every other session of the current user")
    @PostMapping("/sessions/revoke-others")
    public ResponseEntity<RevokeSessionsResponse> revokeOtherSessions(HttpServletRequest httpRequest) {
        JwtAuthenticationPrincipal principal = SecurityUtils.getCurrentPrincipal();
        int revoked = authService.revokeOtherSessions(principal.userId(), principal.sessionId(),
                ClientContext.from(httpRequest));
        return ResponseEntity.ok(new RevokeSessionsResponse(revoked));
    }
}

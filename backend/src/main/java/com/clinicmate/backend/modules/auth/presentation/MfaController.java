package com.clinicmate.backend.modules.auth.presentation;

import com.clinicmate.backend.global.security.JwtAuthenticationPrincipal;
import com.clinicmate.backend.global.security.SecurityUtils;
import com.clinicmate.backend.global.web.ClientContext;
import com.clinicmate.backend.modules.auth.application.AuthResult;
import com.clinicmate.backend.modules.auth.application.AuthService;
import com.clinicmate.backend.modules.auth.application.MfaManager;
import com.clinicmate.backend.modules.auth.presentation.dto.LoginResponse;
import com.clinicmate.backend.modules.auth.presentation.dto.MessageResponse;
import com.clinicmate.backend.modules.auth.presentation.dto.MfaCodeRequest;
import com.clinicmate.backend.modules.auth.presentation.dto.MfaDisableRequest;
import com.clinicmate.backend.modules.auth.presentation.dto.MfaEnableResponse;

import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.responses.ApiResponse;
import io.swagger.v3.oas.annotations.responses.ApiResponses;

import jakarta.servlet.http.HttpServletRequest;
import jakarta.servlet.http.HttpServletResponse;
import jakarta.validation.Valid;

import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

@RestController
@RequestMapping("/auth/mfa")
public class MfaController {

    private final MfaManager mfaManager;
    private final AuthService authService;
    private final AuthCookieWriter cookieWriter;

    public MfaController(MfaManager mfaManager, AuthService authService, AuthCookieWriter cookieWriter) {
        this.mfaManager = mfaManager;
        this.authService = authService;
        this.cookieWriter = cookieWriter;
    }

    @Operation(summary = "Start MFA enrollment", description = "Accepts an access token or an MFA setup token.")
    @ApiResponses({
            @ApiResponse(responseCode = "200", description = "Secret, QR code and backup codes issued"),
            @ApiResponse(responseCode = "409", description = "MFA already enabled")
    })
    @PostMapping("/enable")
    public ResponseEntity<MfaEnableResponse> enable(HttpServletRequest httpRequest) {
        JwtAuthenticationPrincipal principal = SecurityUtils.getCurrentPrincipal();
        return ResponseEntity.ok(MfaEnableResponse.from(
                mfaManager.enroll(principal.userId(), ClientContext.from(httpRequest))));
    }

    @Operation(summary = "Verify an MFA code",
            description = "Completes enrollment (setup or access token) or a login challenge (challenge token).")
    @ApiResponses({
            @ApiResponse(responseCode = "200", description = "Session opened"),
            @ApiResponse(responseCode = "401", description = "Invalid code"),
            @ApiResponse(responseCode = "429", description = "Too many attempts")
    })
    @PostMapping("/verify")
    public ResponseEntity<LoginResponse> verify(
            @Valid @RequestBody MfaCodeRequest request,
            HttpServletRequest httpRequest,
            HttpServletResponse httpResponse
    ) {
        JwtAuthenticationPrincipal principal = SecurityUtils.getCurrentPrincipal();
        AuthResult result = authService.verifyMfa(principal.token(), request.code(), ClientContext.from(httpRequest));
        cookieWriter.writeTokens(httpResponse, result);
        return ResponseEntity.ok(LoginResponse.authenticated(result));
    }

    @Operation(summary = "Disable MFA", description = "Requires a current TOTP or backup code.")
    @PostMapping("/disable")
    public ResponseEntity<MessageResponse> disable(
            @Valid @RequestBody MfaDisableRequest request,
            HttpServletRequest httpRequest
    ) {
        mfaManager.disable(SecurityUtils.getCurrentUserId(), request.code(), request.reason(),
                ClientContext.from(httpRequest));
        return ResponseEntity.ok(new MessageResponse("Multi-factor authentication disabled"));
    }
}

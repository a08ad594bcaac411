package com.clinicmate.backend.modules.auth.presentation.dto;

import java.util.List;

import com.clinicmate.backend.modules.auth.application.MfaEnrollment;

public record MfaEnableResponse(String secret, String qrCodeDataUrl, List<String> backupCodes) {

    public static MfaEnableResponse from(MfaEnrollment enrollment) {
        return new MfaEnableResponse(enrollment.secret(), enrollment.qrCodeDataUrl(), enrollment.backupCodes());
    }
}

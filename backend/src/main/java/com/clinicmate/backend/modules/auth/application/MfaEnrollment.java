package com.clinicmate.backend.modules.auth.application;

import java.util.List;

/**
 * Pending enrollment handed to the user once. Backup codes are only ever stored hashed.
 */
public record MfaEnrollment(String secret, String otpauthUri, String qrCodeDataUrl, List<String> backupCodes) {
}

package com.clinicmate.backend.modules.auth.application;

import java.security.SecureRandom;
import java.util.ArrayList;
import java.util.HexFormat;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Set;
import java.util.UUID;
import java.util.regex.Pattern;

import com.clinicmate.backend.global.web.ClientContext;
import com.clinicmate.backend.modules.audit.application.AuditLogService;
import com.clinicmate.backend.modules.audit.application.AuditLogService.AuditLogCommand;
import com.clinicmate.backend.modules.auth.domain.ClinicUser;
import com.clinicmate.backend.modules.auth.infrastructure.persistence.ClinicUserRepository;
import com.clinicmate.backend.modules.auth.infrastructure.qr.QrCodeRenderer;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;
import org.springframework.web.server.ResponseStatusException;

@Service
@Transactional(noRollbackFor = ResponseStatusException.class)
public class MfaService implements MfaManager {

    private static final Logger log = LoggerFactory.getLogger(MfaService.class);

    private static final Pattern TOTP_CODE = Pattern.compile("\\d{6}");
    private static final int BACKUP_CODE_BYTES = 4;

    private final ClinicUserRepository clinicUserRepository;
    private final TotpService totpService;
    private final QrCodeRenderer qrCodeRenderer;
    private final AccountLockoutGuard lockoutGuard;
    private final AuditLogService auditLogService;
    private final AuthEventPublisher eventPublisher;
    private final AuthPolicyProperties properties;
    private final SecureRandom secureRandom = new SecureRandom();

    public MfaService(
            ClinicUserRepository clinicUserRepository,
            TotpService totpService,
            QrCodeRenderer qrCodeRenderer,
            AccountLockoutGuard lockoutGuard,
            AuditLogService auditLogService,
            AuthEventPublisher eventPublisher,
            AuthPolicyProperties properties
    ) {
        this.clinicUserRepository = clinicUserRepository;
        this.totpService = totpService;
        this.qrCodeRenderer = qrCodeRenderer;
        this.lockoutGuard = lockoutGuard;
        this.auditLogService = auditLogService;
        this.eventPublisher = eventPublisher;
        this.properties = properties;
    }

    @Override
    public MfaEnrollment enroll(UUID userId, ClientContext client) {
        ClinicUser user = loadUser(userId);
        if (user.isMfaEnabled()) {
            throw new AuthException(AuthErrorCode.MFA_ALREADY_ENABLED);
        }

        String secret = totpService.generateSecret();
        List<String> backupCodes = generateBackupCodes();
        Set<String> hashes = new LinkedHashSet<>();
        backupCodes.forEach(code -> hashes.add(TokenFingerprints.of(code)));

        user.setMfaSecret(secret);
        user.replaceBackupCodeHashes(hashes);
        clinicUserRepository.save(user);

        String otpauthUri = totpService.otpauthUri(secret, user.getEmail());
        String qrCodeDataUrl = qrCodeRenderer.toPngDataUrl(otpauthUri);

        auditLogService.record(AuditLogCommand.success(AuditActions.MFA_INITIATED, AuditActions.RESOURCE_USER,
                userId.toString(), userId, null, client, Map.of()));
        eventPublisher.publish(AuthEvent.MFA_INITIATED, userId, null);
        log.info("MFA enrollment started for user {}", userId);
        return new MfaEnrollment(secret, otpauthUri, qrCodeDataUrl, backupCodes);
    }

    @Override
    public void verifySetup(UUID userId, String code, ClientContext client) {
        ClinicUser user = loadUser(userId);
        if (user.isMfaEnabled()) {
            throw new AuthException(AuthErrorCode.MFA_ALREADY_ENABLED);
        }
        if (user.getMfaSecret() == null) {
            throw new AuthException(AuthErrorCode.MFA_SETUP_NOT_INITIATED);
        }
        lockoutGuard.assertMfaNotLocked(user);

        if (!totpService.verify(user.getMfaSecret(), normalizeTotp(code))) {
            lockoutGuard.recordMfaFailure(userId);
            auditLogService.record(AuditLogCommand.failure(AuditActions.MFA_VERIFICATION_FAILED,
                    AuditActions.RESOURCE_USER, userId.toString(), userId, null, client, "invalid_totp"));
            log.warn("MFA setup verification failed for user {}", userId);
            throw new AuthException(AuthErrorCode.INVALID_MFA_CODE);
        }

        user.setMfaEnabled(true);
        clinicUserRepository.save(user);
        lockoutGuard.resetMfaFailures(userId);

        auditLogService.record(AuditLogCommand.success(AuditActions.MFA_ENABLED, AuditActions.RESOURCE_USER,
                userId.toString(), userId, null, client, Map.of()));
        eventPublisher.publish(AuthEvent.MFA_ENABLED, userId, null);
        log.info("MFA enabled for user {}", userId);
    }

    @Override
    public MfaMethod verifyCode(UUID userId, String code) {
        ClinicUser user = loadUser(userId);
        if (!user.isMfaEnabled() || user.getMfaSecret() == null) {
            throw new AuthException(AuthErrorCode.MFA_NOT_ENABLED);
        }
        lockoutGuard.assertMfaNotLocked(user);

        if (totpService.verify(user.getMfaSecret(), normalizeTotp(code))) {
            lockoutGuard.resetMfaFailures(userId);
            return MfaMethod.TOTP;
        }

        String backupHash = code == null ? null : TokenFingerprints.of(normalizeBackupCode(code));
        if (backupHash != null && user.getBackupCodeHashes().remove(backupHash)) {
            clinicUserRepository.save(user);
            lockoutGuard.resetMfaFailures(userId);
            log.info("Backup code consumed for user {}, {} left", userId, user.getBackupCodeHashes().size());
            return MfaMethod.BACKUP_CODE;
        }

        lockoutGuard.recordMfaFailure(userId);
        throw new AuthException(AuthErrorCode.INVALID_MFA_CODE);
    }

    @Override
    public void disable(UUID userId, String code, String reason, ClientContext client) {
        try {
            verifyCode(userId, code);
        } catch (AuthException ex) {
            auditLogService.record(AuditLogCommand.failure(AuditActions.MFA_DISABLE_FAILED,
                    AuditActions.RESOURCE_USER, userId.toString(), userId, null, client,
                    ex.getErrorCode().name().toLowerCase(Locale.ROOT)));
            log.warn("MFA disable rejected for user {}: {}", userId, ex.getErrorCode());
            throw ex;
        }

        // verifyCode may have cleared the persistence context
        ClinicUser user = loadUser(userId);
        user.setMfaEnabled(false);
        user.setMfaSecret(null);
        user.replaceBackupCodeHashes(Set.of());
        clinicUserRepository.save(user);

        auditLogService.record(AuditLogCommand.success(AuditActions.MFA_DISABLED, AuditActions.RESOURCE_USER,
                userId.toString(), userId, null, client,
                reason == null || reason.isBlank() ? Map.of() : Map.of("reason", reason)));
        eventPublisher.publish(AuthEvent.MFA_DISABLED, userId, null);
        log.info("MFA disabled for user {}", userId);
    }

    private ClinicUser loadUser(UUID userId) {
        return clinicUserRepository.findWithBackupCodesById(userId)
                .orElseThrow(() -> new AuthException(AuthErrorCode.USER_NOT_FOUND));
    }

    private List<String> generateBackupCodes() {
        HexFormat hex = HexFormat.of().withUpperCase();
        Set<String> codes = new LinkedHashSet<>();
        while (codes.size() < properties.mfa().backupCodeCount()) {
            byte[] bytes = new byte[BACKUP_CODE_BYTES];
            secureRandom.nextBytes(bytes);
            codes.add(hex.formatHex(bytes));
        }
        return new ArrayList<>(codes);
    }

    private static String normalizeTotp(String code) {
        if (code == null) {
            return null;
        }
        String trimmed = code.replace(" ", "").trim();
        return TOTP_CODE.matcher(trimmed).matches() ? trimmed : null;
    }

    static String normalizeBackupCode(String code) {
        return code.replace("-", "").replace(" ", "").trim().toUpperCase(Locale.ROOT);
    }
}

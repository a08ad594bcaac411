package com.clinicmate.backend.modules.auth.application;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.Mockito.doThrow;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

import java.time.Clock;
import java.time.OffsetDateTime;
import java.time.ZoneOffset;
import java.util.LinkedHashSet;
import java.util.Optional;
import java.util.Set;
import java.util.UUID;

import com.clinicmate.backend.global.web.ClientContext;
import com.clinicmate.backend.modules.audit.application.AuditLogService;
import com.clinicmate.backend.modules.audit.application.AuditLogService.AuditLogCommand;
import com.clinicmate.backend.modules.auth.domain.ClinicUser;
import com.clinicmate.backend.modules.auth.infrastructure.persistence.ClinicUserRepository;
import com.clinicmate.backend.modules.auth.infrastructure.qr.QrCodeRenderer;
import com.clinicmate.backend.support.TestIds;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

@ExtendWith(MockitoExtension.class)
class MfaServiceTest {

    private static final OffsetDateTime NOW = OffsetDateTime.parse("2025-01-01T00:00:00Z");
    private static final String SECRET = "GEZDGNBVGY3TQOJQGEZDGNBVGY3TQOJQ";
    private static final ClientContext CLIENT = new ClientContext("10.0.0.7", "JUnit");

    @Mock
    private ClinicUserRepository clinicUserRepository;

    @Mock
    private QrCodeRenderer qrCodeRenderer;

    @Mock
    private AccountLockoutGuard lockoutGuard;

    @Mock
    private AuditLogService auditLogService;

    @Mock
    private AuthEventPublisher eventPublisher;

    private TotpService totpService;
    private MfaService mfaService;
    private ClinicUser user;
    private UUID userId;

    @BeforeEach
    void setUp() {
        AuthPolicyProperties properties = new AuthPolicyProperties(null, null, null, null, null);
        totpService = new TotpService(properties, Clock.fixed(NOW.toInstant(), ZoneOffset.UTC));
        mfaService = new MfaService(clinicUserRepository, totpService, qrCodeRenderer, lockoutGuard,
                auditLogService, eventPublisher, properties);

        userId = UUID.fromString("00000000-0000-0000-0000-000000000801");
        user = new ClinicUser();
        user.setEmail("surgeon@clinic.test");
        TestIds.assign(user, userId);
        when(clinicUserRepository.findWithBackupCodesById(userId)).thenReturn(Optional.of(user));
    }

    @Test
    void enrollIssuesSecretQrCodeAndHashedBackupCodes() {
        when(qrCodeRenderer.toPngDataUrl(anyString())).thenReturn("data:image/png;base64,AAAA");

        MfaEnrollment enrollment = mfaService.enroll(userId, CLIENT);

        assertThat(enrollment.secret()).isEqualTo(user.getMfaSecret());
        assertThat(enrollment.otpauthUri()).startsWith("otpauth://totp/").contains(enrollment.secret());
        assertThat(enrollment.qrCodeDataUrl()).isEqualTo("data:image/png;base64,AAAA");
        assertThat(enrollment.backupCodes()).hasSize(10).allMatch(code -> code.matches("[0-9A-F]{8}"));
        assertThat(user.getBackupCodeHashes())
                .hasSize(10)
                .containsExactlyInAnyOrderElementsOf(
                        enrollment.backupCodes().stream().map(TokenFingerprints::of).toList());
        assertThat(user.isMfaEnabled()).isFalse();
        verify(clinicUserRepository).save(user);
        verify(eventPublisher).publish(AuthEvent.MFA_INITIATED, userId, null);
    }

    @Test
    void enrollRefusesWhenAlreadyEnabled() {
        user.setMfaEnabled(true);

        assertThatThrownBy(() -> mfaService.enroll(userId, CLIENT))
                .isInstanceOfSatisfying(AuthException.class,
                        ex -> assertThat(ex.getErrorCode()).isEqualTo(AuthErrorCode.MFA_ALREADY_ENABLED));
    }

    @Test
    void setupVerificationEnablesMfa() {
        user.setMfaSecret(SECRET);

        mfaService.verifySetup(userId, currentCode(), CLIENT);

        assertThat(user.isMfaEnabled()).isTrue();
        verify(lockoutGuard).resetMfaFailures(userId);
        verify(eventPublisher).publish(AuthEvent.MFA_ENABLED, userId, null);
    }

    @Test
    void setupVerificationWithoutEnrollmentFails() {
        assertThatThrownBy(() -> mfaService.verifySetup(userId, "123456", CLIENT))
                .isInstanceOfSatisfying(AuthException.class,
                        ex -> assertThat(ex.getErrorCode()).isEqualTo(AuthErrorCode.MFA_SETUP_NOT_INITIATED));
    }

    @Test
    void wrongSetupCodeCountsAgainstTheMfaBudget() {
        user.setMfaSecret(SECRET);

        assertThatThrownBy(() -> mfaService.verifySetup(userId, wrongCode(), CLIENT))
                .isInstanceOfSatisfying(AuthException.class,
                        ex -> assertThat(ex.getErrorCode()).isEqualTo(AuthErrorCode.INVALID_MFA_CODE));

        assertThat(user.isMfaEnabled()).isFalse();
        verify(lockoutGuard).recordMfaFailure(userId);
        ArgumentCaptor<AuditLogCommand> audit = ArgumentCaptor.forClass(AuditLogCommand.class);
        verify(auditLogService).record(audit.capture());
        assertThat(audit.getValue().actionType()).isEqualTo(AuditActions.MFA_VERIFICATION_FAILED);
        assertThat(audit.getValue().success()).isFalse();
    }

    @Test
    void totpCodeIsAccepted() {
        enableWithBackupCodes("A1B2C3D4");

        assertThat(mfaService.verifyCode(userId, currentCode())).isEqualTo(MfaMethod.TOTP);
        verify(lockoutGuard).resetMfaFailures(userId);
    }

    @Test
    void backupCodeWorksExactlyOnce() {
        enableWithBackupCodes("A1B2C3D4", "0F0F0F0F");

        assertThat(mfaService.verifyCode(userId, "a1b2-c3d4")).isEqualTo(MfaMethod.BACKUP_CODE);
        assertThat(user.getBackupCodeHashes()).containsExactly(TokenFingerprints.of("0F0F0F0F"));

        assertThatThrownBy(() -> mfaService.verifyCode(userId, "A1B2C3D4"))
                .isInstanceOfSatisfying(AuthException.class,
                        ex -> assertThat(ex.getErrorCode()).isEqualTo(AuthErrorCode.INVALID_MFA_CODE));
        verify(lockoutGuard).recordMfaFailure(userId);
    }

    @Test
    void codeCheckFailsWhenMfaIsNotEnabled() {
        assertThatThrownBy(() -> mfaService.verifyCode(userId, "123456"))
                .isInstanceOfSatisfying(AuthException.class,
                        ex -> assertThat(ex.getErrorCode()).isEqualTo(AuthErrorCode.MFA_NOT_ENABLED));
    }

    @Test
    void cooldownStopsVerificationBeforeTheCodeIsChecked() {
        enableWithBackupCodes("A1B2C3D4");
        doThrow(new LockedOutException(AuthErrorCode.MFA_LOCKED, NOW, NOW.plusMinutes(5)))
                .when(lockoutGuard).assertMfaNotLocked(user);

        assertThatThrownBy(() -> mfaService.verifyCode(userId, "A1B2C3D4"))
                .isInstanceOf(LockedOutException.class);

        assertThat(user.getBackupCodeHashes()).hasSize(1);
        verify(lockoutGuard, never()).recordMfaFailure(any());
    }

    @Test
    void disableWithValidCodeClearsEverything() {
        enableWithBackupCodes("A1B2C3D4");

        mfaService.disable(userId, currentCode(), "lost phone", CLIENT);

        assertThat(user.isMfaEnabled()).isFalse();
        assertThat(user.getMfaSecret()).isNull();
        assertThat(user.getBackupCodeHashes()).isEmpty();
        verify(eventPublisher).publish(AuthEvent.MFA_DISABLED, userId, null);
    }

    @Test
    void disableWithWrongCodeIsAuditedAndRejected() {
        enableWithBackupCodes("A1B2C3D4");

        assertThatThrownBy(() -> mfaService.disable(userId, wrongCode(), null, CLIENT))
                .isInstanceOf(AuthException.class);

        assertThat(user.isMfaEnabled()).isTrue();
        ArgumentCaptor<AuditLogCommand> audit = ArgumentCaptor.forClass(AuditLogCommand.class);
        verify(auditLogService).record(audit.capture());
        assertThat(audit.getValue().actionType()).isEqualTo(AuditActions.MFA_DISABLE_FAILED);
    }

    private void enableWithBackupCodes(String... codes) {
        user.setMfaEnabled(true);
        user.setMfaSecret(SECRET);
        Set<String> hashes = new LinkedHashSet<>();
        for (String code : codes) {
            hashes.add(TokenFingerprints.of(code));
        }
        user.replaceBackupCodeHashes(hashes);
    }

    private String currentCode() {
        return totpService.generateCode(SECRET, NOW.toEpochSecond());
    }

    private String wrongCode() {
        // a code five steps away is outside the one-step window
        return totpService.generateCode(SECRET, NOW.toEpochSecond() + 150);
    }
}

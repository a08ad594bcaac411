package com.clinicmate.backend.modules.audit.application;

import java.time.Clock;
import java.time.OffsetDateTime;
import java.util.HashMap;
import java.util.Map;
import java.util.Objects;
import java.util.UUID;

import com.clinicmate.backend.global.web.ClientContext;
import com.clinicmate.backend.global.web.RequestContextFilter;
import com.clinicmate.backend.modules.audit.domain.AuditLog;
import com.clinicmate.backend.modules.audit.infrastructure.AuditLogRepository;
import com.clinicmate.backend.modules.auth.domain.ClinicUser;

import jakarta.persistence.EntityManager;

import org.slf4j.MDC;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

/**
 * Write-only audit sink. Joins the caller's transaction, so callers that must keep failure
 * records across a thrown problem commit with {@code noRollbackFor}.
 */
@Service
public class AuditLogService {

    private final AuditLogRepository auditLogRepository;
    private final EntityManager entityManager;
    private final Clock clock;

    public AuditLogService(AuditLogRepository auditLogRepository, EntityManager entityManager, Clock clock) {
        this.auditLogRepository = auditLogRepository;
        this.entityManager = entityManager;
        this.clock = clock;
    }

    @Transactional
    public void record(AuditLogCommand command) {
        Objects.requireNonNull(command.actionType(), "actionType is required");
        Objects.requireNonNull(command.resourceType(), "resourceType is required");
        Objects.requireNonNull(command.resourceKey(), "resourceKey is required");

        AuditLog auditLog = new AuditLog();
        auditLog.setActionType(command.actionType());
        auditLog.setResourceType(command.resourceType());
        auditLog.setResourceKey(command.resourceKey());

        if (command.actorUserId() != null) {
            ClinicUser actorReference = entityManager.getReference(ClinicUser.class, command.actorUserId());
            auditLog.setActor(actorReference);
        }

        auditLog.setSessionId(command.sessionId());
        auditLog.setRequestId(MDC.get(RequestContextFilter.MDC_REQUEST_ID));
        ClientContext client = command.client() != null ? command.client() : ClientContext.UNKNOWN;
        auditLog.setIpAddress(client.ipAddress());
        auditLog.setUserAgent(client.userAgent());
        auditLog.setSuccess(command.success());
        auditLog.setReason(command.reason());

        if (command.detail() != null && !command.detail().isEmpty()) {
            auditLog.setDetail(new HashMap<>(command.detail()));
        }
        auditLog.setCreatedAt(OffsetDateTime.now(clock));

        auditLogRepository.save(auditLog);
    }

    public record AuditLogCommand(
            String actionType,
            String resourceType,
            String resourceKey,
            UUID actorUserId,
            UUID sessionId,
            ClientContext client,
            boolean success,
            String reason,
            Map<String, Object> detail
    ) {

        public static AuditLogCommand success(String actionType, String resourceType, String resourceKey,
                                              UUID actorUserId, UUID sessionId, ClientContext client,
                                              Map<String, Object> detail) {
            return new AuditLogCommand(actionType, resourceType, resourceKey, actorUserId, sessionId,
                    client, true, null, detail);
        }

        public static AuditLogCommand failure(String actionType, String resourceType, String resourceKey,
                                              UUID actorUserId, UUID sessionId, ClientContext client,
                                              String reason) {
            return new AuditLogCommand(actionType, resourceType, resourceKey, actorUserId, sessionId,
                    client, false, reason, Map.of());
        }
    }
}

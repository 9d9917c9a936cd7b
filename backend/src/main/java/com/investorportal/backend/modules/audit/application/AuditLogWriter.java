package com.investorportal.backend.modules.audit.application;

import java.time.Clock;
import java.time.OffsetDateTime;
import java.util.HashMap;
import java.util.Objects;

import com.investorportal.backend.modules.audit.domain.AuditLog;
import com.investorportal.backend.modules.audit.infrastructure.AuditLogRepository;

import org.springframework.stereotype.Component;
import org.springframework.transaction.annotation.Propagation;
import org.springframework.transaction.annotation.Transactional;

/**
 * Persists audit entries in their own transaction so a failed insert never marks the
 * caller's transaction rollback-only.
 */
@Component
public class AuditLogWriter {

    private final AuditLogRepository auditLogRepository;
    private final Clock clock;

    public AuditLogWriter(AuditLogRepository auditLogRepository, Clock clock) {
        this.auditLogRepository = auditLogRepository;
        this.clock = clock;
    }

    @Transactional(propagation = Propagation.REQUIRES_NEW)
    public void write(AuditEvent event) {
        Objects.requireNonNull(event.action(), "action is required");

        AuditLog auditLog = new AuditLog();
        auditLog.setAction(event.action().name());
        auditLog.setUserId(event.userId());
        auditLog.setResource(event.resource());
        auditLog.setIpAddress(event.ipAddress());
        auditLog.setUserAgent(event.userAgent());
        if (event.details() != null && !event.details().isEmpty()) {
            auditLog.setDetails(new HashMap<>(event.details()));
        }
        auditLog.setCreatedAt(OffsetDateTime.now(clock));

        auditLogRepository.save(auditLog);
    }
}

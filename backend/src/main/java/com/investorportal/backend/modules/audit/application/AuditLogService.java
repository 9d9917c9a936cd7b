package com.investorportal.backend.modules.audit.application;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

/**
 * Fire-and-forget audit trail. Recording never fails the operation being audited.
 */
@Service
public class AuditLogService {

    private static final Logger log = LoggerFactory.getLogger(AuditLogService.class);

    private final AuditLogWriter auditLogWriter;

    public AuditLogService(AuditLogWriter auditLogWriter) {
        this.auditLogWriter = auditLogWriter;
    }

    public void record(AuditEvent event) {
        try {
            auditLogWriter.write(event);
        } catch (RuntimeException ex) {
            log.warn("Failed to record audit event {} for user {}", event.action(), event.userId(), ex);
        }
    }
}

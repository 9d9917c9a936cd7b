package com.investorportal.backend.modules.audit.application;

import java.util.Map;
import java.util.UUID;

import com.investorportal.backend.global.web.ClientMetadata;
import com.investorportal.backend.modules.audit.domain.AuditAction;

public record AuditEvent(
        AuditAction action,
        UUID userId,
        String resource,
        String ipAddress,
        String userAgent,
        Map<String, Object> details
) {

    public static AuditEvent of(AuditAction action, UUID userId, String resource, ClientMetadata client) {
        return of(action, userId, resource, client, Map.of());
    }

    public static AuditEvent of(AuditAction action, UUID userId, String resource, ClientMetadata client,
                                Map<String, Object> details) {
        ClientMetadata source = client != null ? client : ClientMetadata.NONE;
        return new AuditEvent(action, userId, resource, source.ipAddress(), source.userAgent(), details);
    }
}

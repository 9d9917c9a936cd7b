package com.investorportal.backend.modules.rbac.presentation.dto;

import java.time.OffsetDateTime;
import java.util.UUID;

import com.investorportal.backend.modules.rbac.domain.RoleAssignment;

import com.fasterxml.jackson.annotation.JsonProperty;

public record RoleAssignmentResponse(
        UUID id,
        UUID roleId,
        String roleName,
        UUID assignedBy,
        String reason,
        OffsetDateTime expiresAt,
        @JsonProperty("isActive") boolean isActive,
        OffsetDateTime createdAt,
        UUID revokedBy,
        String revokeReason,
        OffsetDateTime revokedAt
) {

    public static RoleAssignmentResponse from(RoleAssignment assignment) {
        return new RoleAssignmentResponse(
                assignment.getId(),
                assignment.getRole().getId(),
                assignment.getRole().getName(),
                assignment.getAssignedBy(),
                assignment.getReason(),
                assignment.getExpiresAt(),
                assignment.isActive(),
                assignment.getCreatedAt(),
                assignment.getRevokedBy(),
                assignment.getRevokeReason(),
                assignment.getRevokedAt()
        );
    }
}

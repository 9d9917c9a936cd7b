package com.investorportal.backend.modules.rbac.presentation.dto;

import java.time.OffsetDateTime;
import java.util.List;
import java.util.UUID;

import jakarta.validation.constraints.NotEmpty;
import jakarta.validation.constraints.Size;

public record BulkAssignRolesRequest(
        @NotEmpty(message = "userIds must not be empty")
        @Size(max = 500, message = "at most 500 users per request")
        List<UUID> userIds,
        @Size(max = 500) String reason,
        OffsetDateTime expiresAt
) {
}

package com.investorportal.backend.modules.rbac.presentation.dto;

import java.time.OffsetDateTime;
import java.util.UUID;

import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Size;

public record AssignRoleRequest(
        @NotNull(message = "userId is required") UUID userId,
        @Size(max = 500) String reason,
        OffsetDateTime expiresAt
) {
}

package com.investorportal.backend.modules.rbac.presentation.dto;

import java.time.OffsetDateTime;
import java.util.List;
import java.util.UUID;

public record UserRolesResponse(
        UUID userId,
        String email,
        List<HeldRole> roles
) {

    public record HeldRole(UUID roleId, String name, OffsetDateTime assignedAt) {
    }
}

package com.investorportal.backend.modules.rbac.presentation.dto;

import java.util.List;
import java.util.UUID;

import com.investorportal.backend.modules.rbac.domain.PermissionMatch;

public record PermissionCheckResponse(
        UUID userId,
        List<String> permissions,
        PermissionMatch match,
        boolean granted
) {
}

package com.investorportal.backend.modules.rbac.presentation.dto;

import java.util.List;
import java.util.UUID;

/**
 * {@code granted} is true when the user holds at least one of {@code roles}.
 */
public record RoleCheckResponse(
        UUID userId,
        List<String> roles,
        boolean granted
) {
}

package com.investorportal.backend.modules.rbac.presentation.dto;

import java.util.List;

import com.investorportal.backend.modules.rbac.domain.PermissionMatch;

import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotEmpty;
import jakarta.validation.constraints.Size;

/**
 * @param match {@code ALL} when omitted
 */
public record CheckPermissionsRequest(
        @NotEmpty(message = "permissions must not be empty")
        @Size(max = 50)
        List<@NotBlank String> permissions,
        PermissionMatch match
) {
}

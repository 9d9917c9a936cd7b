package com.investorportal.backend.modules.rbac.presentation.dto;

import jakarta.validation.constraints.Pattern;
import jakarta.validation.constraints.Size;

import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * Partial update; {@code null} fields are left unchanged.
 */
public record UpdatePermissionRequest(
        @Size(max = 100)
        @Pattern(regexp = "^[A-Z][A-Z0-9_]*$", message = "name must be upper snake case")
        String name,
        @Size(max = 255) String description,
        @Size(max = 64) String resource,
        @Size(max = 64) String action,
        @JsonProperty("isActive") Boolean isActive
) {
}

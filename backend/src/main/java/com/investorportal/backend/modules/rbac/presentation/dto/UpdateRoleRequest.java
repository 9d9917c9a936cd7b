package com.investorportal.backend.modules.rbac.presentation.dto;

import jakarta.validation.constraints.Pattern;
import jakarta.validation.constraints.Size;

import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * Partial update; {@code null} fields are left unchanged.
 */
public record UpdateRoleRequest(
        @Size(max = 64, message = "name must be at most 64 characters")
        @Pattern(regexp = "^[A-Z][A-Z0-9_]*$", message = "name must be upper snake case")
        String name,
        @Size(max = 255) String description,
        @JsonProperty("isDefault") Boolean isDefault
) {
}

package com.investorportal.backend.modules.rbac.presentation.dto;

import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.Pattern;
import jakarta.validation.constraints.Size;

public record CreatePermissionRequest(
        @NotBlank(message = "name is required")
        @Size(max = 100)
        @Pattern(regexp = "^[A-Z][A-Z0-9_]*$", message = "name must be upper snake case")
        String name,
        @Size(max = 255) String description,
        @Size(max = 64) String resource,
        @Size(max = 64) String action
) {
}

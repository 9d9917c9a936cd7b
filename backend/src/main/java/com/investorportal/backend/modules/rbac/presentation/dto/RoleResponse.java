package com.investorportal.backend.modules.rbac.presentation.dto;

import java.time.OffsetDateTime;
import java.util.UUID;

import com.investorportal.backend.modules.rbac.domain.Role;

import com.fasterxml.jackson.annotation.JsonProperty;

public record RoleResponse(
        UUID id,
        String name,
        String description,
        @JsonProperty("isActive") boolean isActive,
        @JsonProperty("isDefault") boolean isDefault,
        OffsetDateTime createdAt,
        OffsetDateTime updatedAt
) {

    public static RoleResponse from(Role role) {
        return new RoleResponse(
                role.getId(),
                role.getName(),
                role.getDescription(),
                role.isActive(),
                role.isDefaultRole(),
                role.getCreatedAt(),
                role.getUpdatedAt()
        );
    }
}

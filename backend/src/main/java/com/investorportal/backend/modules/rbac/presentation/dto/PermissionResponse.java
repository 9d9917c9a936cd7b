package com.investorportal.backend.modules.rbac.presentation.dto;

import java.util.UUID;

import com.investorportal.backend.modules.rbac.domain.Permission;

import com.fasterxml.jackson.annotation.JsonProperty;

public record PermissionResponse(
        UUID id,
        String name,
        String description,
        String resource,
        String action,
        @JsonProperty("isActive") boolean isActive
) {

    public static PermissionResponse from(Permission permission) {
        return new PermissionResponse(
                permission.getId(),
                permission.getName(),
                permission.getDescription(),
                permission.getResource(),
                permission.getAction(),
                permission.isActive()
        );
    }
}

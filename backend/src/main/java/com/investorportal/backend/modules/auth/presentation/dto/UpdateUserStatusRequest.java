package com.investorportal.backend.modules.auth.presentation.dto;

import jakarta.validation.constraints.NotNull;

import com.fasterxml.jackson.annotation.JsonProperty;

public record UpdateUserStatusRequest(
        @NotNull(message = "isActive is required")
        @JsonProperty("isActive") Boolean isActive
) {
}

package com.investorportal.backend.modules.auth.presentation.dto;

import java.util.UUID;

import com.fasterxml.jackson.annotation.JsonProperty;

public record UserStatusResponse(
        UUID userId,
        String email,
        @JsonProperty("isActive") boolean isActive,
        int revokedSessions
) {
}

package com.investorportal.backend.modules.auth.presentation.dto;

import java.time.OffsetDateTime;
import java.util.List;
import java.util.UUID;

import com.fasterxml.jackson.annotation.JsonProperty;

public record UserProfileResponse(
        UUID userId,
        String email,
        String firstName,
        String lastName,
        @JsonProperty("isVerified") boolean isVerified,
        String phone,
        String timezone,
        List<String> roles,
        List<String> permissions,
        OffsetDateTime lastLoginAt,
        OffsetDateTime createdAt
) {
}

package com.investorportal.backend.modules.auth.presentation.dto;

import java.util.List;
import java.util.UUID;

/**
 * Token pair handed out by register, login and refresh. {@code expiresIn} is the access token lifetime in seconds.
 */
public record AuthResponse(
        String accessToken,
        String refreshToken,
        String tokenType,
        long expiresIn,
        PrincipalSummary user
) {
    public static final String DEFAULT_TOKEN_TYPE = "Bearer";

    public record PrincipalSummary(
            UUID id,
            String email,
            String firstName,
            String lastName,
            List<String> roles,
            List<String> permissions
    ) {
    }
}

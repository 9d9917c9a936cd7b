package com.investorportal.backend.global.security;

import java.util.Set;
import java.util.UUID;

/**
 * Subject of an authenticated request with its effective roles and permissions.
 * Computed per request and never persisted.
 */
public record AuthenticatedPrincipal(
        UUID userId,
        String email,
        Set<String> roles,
        Set<String> permissions,
        boolean active
) {

    public AuthenticatedPrincipal {
        roles = roles == null ? Set.of() : Set.copyOf(roles);
        permissions = permissions == null ? Set.of() : Set.copyOf(permissions);
    }

    public boolean hasRole(String role) {
        return roles.contains(role);
    }

    public boolean hasPermission(String permission) {
        return permissions.contains(permission);
    }
}

package com.investorportal.backend.modules.rbac.domain;

import java.util.Arrays;
import java.util.LinkedHashSet;
import java.util.Set;

/**
 * Requirements a route places on its caller. Categories combine with AND; an empty category
 * is satisfied by anyone. A public policy ignores every category.
 */
public record AccessPolicy(
        boolean publicRoute,
        Set<String> requireAllRoles,
        Set<String> requireAnyRole,
        Set<String> requireAllPermissions,
        Set<String> requireAnyPermission
) {

    private static final AccessPolicy PUBLIC = new AccessPolicy(true, Set.of(), Set.of(), Set.of(), Set.of());
    private static final AccessPolicy AUTHENTICATED = new AccessPolicy(false, Set.of(), Set.of(), Set.of(), Set.of());

    public AccessPolicy {
        requireAllRoles = immutable(requireAllRoles);
        requireAnyRole = immutable(requireAnyRole);
        requireAllPermissions = immutable(requireAllPermissions);
        requireAnyPermission = immutable(requireAnyPermission);
    }

    public static AccessPolicy publicAccess() {
        return PUBLIC;
    }

    public static AccessPolicy authenticated() {
        return AUTHENTICATED;
    }

    public static AccessPolicy allRoles(String... roles) {
        return builder().requireAllRoles(roles).build();
    }

    public static AccessPolicy anyRole(String... roles) {
        return builder().requireAnyRole(roles).build();
    }

    public static AccessPolicy allPermissions(String... permissions) {
        return builder().requireAllPermissions(permissions).build();
    }

    public static AccessPolicy anyPermission(String... permissions) {
        return builder().requireAnyPermission(permissions).build();
    }

    public static Builder builder() {
        return new Builder();
    }

    private static Set<String> immutable(Set<String> values) {
        if (values == null || values.isEmpty()) {
            return Set.of();
        }
        return Set.copyOf(values);
    }

    public static final class Builder {

        private final Set<String> allRoles = new LinkedHashSet<>();
        private final Set<String> anyRole = new LinkedHashSet<>();
        private final Set<String> allPermissions = new LinkedHashSet<>();
        private final Set<String> anyPermission = new LinkedHashSet<>();

        private Builder() {
        }

        public Builder requireAllRoles(String... roles) {
            allRoles.addAll(Arrays.asList(roles));
            return this;
        }

        public Builder requireAnyRole(String... roles) {
            anyRole.addAll(Arrays.asList(roles));
            return this;
        }

        public Builder requireAllPermissions(String... permissions) {
            allPermissions.addAll(Arrays.asList(permissions));
            return this;
        }

        public Builder requireAnyPermission(String... permissions) {
            anyPermission.addAll(Arrays.asList(permissions));
            return this;
        }

        public AccessPolicy build() {
            return new AccessPolicy(false, allRoles, anyRole, allPermissions, anyPermission);
        }
    }
}

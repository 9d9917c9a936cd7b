package com.investorportal.backend.modules.rbac.application;

import java.util.Collection;
import java.util.Set;
import java.util.UUID;

import com.investorportal.backend.modules.rbac.infrastructure.persistence.RolePermissionRepository;
import com.investorportal.backend.modules.rbac.infrastructure.persistence.UserRoleRepository;

import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

/**
 * Computes a user's effective roles and the union of their permissions. Evaluated on every
 * call so grants and revocations take effect on the next request.
 */
@Service
@Transactional(readOnly = true)
public class RolePermissionAggregator {

    private final UserRoleRepository userRoleRepository;
    private final RolePermissionRepository rolePermissionRepository;

    public RolePermissionAggregator(UserRoleRepository userRoleRepository,
                                    RolePermissionRepository rolePermissionRepository) {
        this.userRoleRepository = userRoleRepository;
        this.rolePermissionRepository = rolePermissionRepository;
    }

    public ResolvedAuthorities resolve(UUID userId) {
        Set<String> roles = Set.copyOf(userRoleRepository.findEffectiveRoleNames(userId));
        Set<String> permissions = Set.copyOf(rolePermissionRepository.findEffectivePermissionNames(userId));
        return new ResolvedAuthorities(roles, permissions);
    }

    public boolean hasRole(UUID userId, String role) {
        return resolve(userId).roles().contains(role);
    }

    public boolean hasAnyRole(UUID userId, Collection<String> roles) {
        Set<String> held = resolve(userId).roles();
        return roles.stream().anyMatch(held::contains);
    }

    public boolean hasAllPermissions(UUID userId, Collection<String> permissions) {
        return resolve(userId).permissions().containsAll(permissions);
    }

    public boolean hasAnyPermission(UUID userId, Collection<String> permissions) {
        Set<String> held = resolve(userId).permissions();
        return permissions.stream().anyMatch(held::contains);
    }

    public record ResolvedAuthorities(Set<String> roles, Set<String> permissions) {
    }
}

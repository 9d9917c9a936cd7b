package com.investorportal.backend.modules.rbac.application;

import java.util.List;
import java.util.UUID;

import com.investorportal.backend.global.error.NotFoundProblemException;
import com.investorportal.backend.modules.auth.infrastructure.persistence.PortalUserRepository;
import com.investorportal.backend.modules.rbac.domain.PermissionMatch;
import com.investorportal.backend.modules.rbac.presentation.dto.PermissionCheckResponse;
import com.investorportal.backend.modules.rbac.presentation.dto.RoleCheckResponse;

import org.springframework.lang.NonNull;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

/**
 * Answers "does this user hold ..." questions for administrators and for callers asking about themselves.
 * Answers reflect the same effective authorities the route checks use.
 */
@Service
@Transactional(readOnly = true)
public class AccessCheckService {

    private final PortalUserRepository portalUserRepository;
    private final RolePermissionAggregator rolePermissionAggregator;

    public AccessCheckService(PortalUserRepository portalUserRepository, RolePermissionAggregator rolePermissionAggregator) {
        this.portalUserRepository = portalUserRepository;
        this.rolePermissionAggregator = rolePermissionAggregator;
    }

    public PermissionCheckResponse checkPermissions(@NonNull UUID userId, @NonNull List<String> permissions, PermissionMatch match) {
        requireUser(userId);
        PermissionMatch mode = match != null ? match : PermissionMatch.ALL;
        boolean granted = mode == PermissionMatch.ANY
                ? rolePermissionAggregator.hasAnyPermission(userId, permissions)
                : rolePermissionAggregator.hasAllPermissions(userId, permissions);
        return new PermissionCheckResponse(userId, List.copyOf(permissions), mode, granted);
    }

    public RoleCheckResponse checkRole(@NonNull UUID userId, @NonNull String roleName) {
        requireUser(userId);
        return new RoleCheckResponse(userId, List.of(roleName), rolePermissionAggregator.hasRole(userId, roleName));
    }

    public RoleCheckResponse checkAnyRole(@NonNull UUID userId, @NonNull List<String> roleNames) {
        requireUser(userId);
        return new RoleCheckResponse(userId, List.copyOf(roleNames), rolePermissionAggregator.hasAnyRole(userId, roleNames));
    }

    private void requireUser(UUID userId) {
        if (!portalUserRepository.existsById(userId)) {
            throw new NotFoundProblemException("rbac.user_not_found", "User not found");
        }
    }
}

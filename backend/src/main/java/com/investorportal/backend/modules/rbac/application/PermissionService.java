package com.investorportal.backend.modules.rbac.application;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.UUID;

import com.investorportal.backend.global.error.ConflictProblemException;
import com.investorportal.backend.global.error.NotFoundProblemException;
import com.investorportal.backend.global.error.ValidationProblemException;
import com.investorportal.backend.global.web.ClientMetadata;
import com.investorportal.backend.modules.audit.application.AuditEvent;
import com.investorportal.backend.modules.audit.application.AuditLogService;
import com.investorportal.backend.modules.audit.domain.AuditAction;
import com.investorportal.backend.modules.rbac.domain.Permission;
import com.investorportal.backend.modules.rbac.domain.Role;
import com.investorportal.backend.modules.rbac.domain.RolePermission;
import com.investorportal.backend.modules.rbac.infrastructure.persistence.PermissionRepository;
import com.investorportal.backend.modules.rbac.infrastructure.persistence.RolePermissionRepository;
import com.investorportal.backend.modules.rbac.infrastructure.persistence.RoleRepository;
import com.investorportal.backend.modules.rbac.presentation.dto.PermissionResponse;

import org.springframework.lang.NonNull;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

@Service
@Transactional
public class PermissionService {

    private final PermissionRepository permissionRepository;
    private final RoleRepository roleRepository;
    private final RolePermissionRepository rolePermissionRepository;
    private final AuditLogService auditLogService;

    public PermissionService(
            PermissionRepository permissionRepository,
            RoleRepository roleRepository,
            RolePermissionRepository rolePermissionRepository,
            AuditLogService auditLogService
    ) {
        this.permissionRepository = permissionRepository;
        this.roleRepository = roleRepository;
        this.rolePermissionRepository = rolePermissionRepository;
        this.auditLogService = auditLogService;
    }

    public PermissionResponse createPermission(@NonNull CreatePermissionCommand command, ClientMetadata client) {
        String name = command.name().trim();
        if (permissionRepository.existsByName(name)) {
            throw new ConflictProblemException("rbac.permission_name_taken", "Permission " + name + " already exists");
        }

        Permission permission = new Permission();
        permission.setName(name);
        permission.setDescription(command.description());
        permission.setResource(command.resource());
        permission.setAction(command.action());
        permission.setActive(true);
        Permission saved = permissionRepository.save(permission);

        auditLogService.record(AuditEvent.of(AuditAction.PERMISSION_CREATED, command.actorId(), "permission:" + saved.getId(), client,
                Map.of("name", saved.getName())));
        return PermissionResponse.from(saved);
    }

    /**
     * Partial update; {@code null} fields are left unchanged. Setting {@code isActive} to false
     * follows the same rules as {@link #deactivatePermission}.
     */
    public PermissionResponse updatePermission(@NonNull UUID permissionId, @NonNull UpdatePermissionCommand command,
                                               ClientMetadata client) {
        Permission permission = findPermission(permissionId);
        Map<String, Object> changes = new LinkedHashMap<>();

        if (command.name() != null && !command.name().trim().equals(permission.getName())) {
            String name = command.name().trim();
            if (permissionRepository.existsByNameAndIdNot(name, permissionId)) {
                throw new ConflictProblemException("rbac.permission_name_taken", "Permission " + name + " already exists");
            }
            changes.put("name", name);
            permission.setName(name);
        }
        if (command.description() != null) {
            changes.put("description", command.description());
            permission.setDescription(command.description());
        }
        if (command.resource() != null) {
            changes.put("resource", command.resource());
            permission.setResource(command.resource());
        }
        if (command.action() != null) {
            changes.put("action", command.action());
            permission.setAction(command.action());
        }
        if (command.isActive() != null && command.isActive() != permission.isActive()) {
            if (!command.isActive()) {
                requireUnassigned(permission);
            }
            changes.put("isActive", command.isActive());
            permission.setActive(command.isActive());
        }

        auditLogService.record(AuditEvent.of(AuditAction.PERMISSION_UPDATED, command.actorId(), "permission:" + permissionId,
                client, changes));
        return PermissionResponse.from(permission);
    }

    /**
     * Soft-deletes a permission. Refused while any role still holds an active grant of it.
     */
    public void deactivatePermission(@NonNull UUID permissionId, UUID actorId, ClientMetadata client) {
        Permission permission = findPermission(permissionId);
        requireUnassigned(permission);
        permission.setActive(false);
        auditLogService.record(AuditEvent.of(AuditAction.PERMISSION_DEACTIVATED, actorId, "permission:" + permissionId, client,
                Map.of("name", permission.getName())));
    }

    @Transactional(readOnly = true)
    public List<PermissionResponse> listPermissions(boolean includeInactive) {
        List<Permission> permissions = includeInactive
                ? permissionRepository.findAllByOrderByNameAsc()
                : permissionRepository.findByActiveTrueOrderByNameAsc();
        return permissions.stream().map(PermissionResponse::from).toList();
    }

    /**
     * Grants a permission to a role, reactivating an earlier grant when one exists.
     */
    public void assignPermissionToRole(@NonNull UUID roleId, @NonNull UUID permissionId, UUID actorId, ClientMetadata client) {
        Role role = roleRepository.findById(roleId)
                .filter(Role::isActive)
                .orElseThrow(() -> new NotFoundProblemException("rbac.role_not_found", "Role not found or inactive"));
        Permission permission = permissionRepository.findById(permissionId)
                .filter(Permission::isActive)
                .orElseThrow(() -> new NotFoundProblemException("rbac.permission_not_found", "Permission not found or inactive"));

        RolePermission grant = rolePermissionRepository.findByRoleIdAndPermissionId(roleId, permissionId).orElse(null);
        if (grant != null && grant.isActive()) {
            throw new ConflictProblemException("rbac.permission_already_assigned",
                    "Role " + role.getName() + " already has permission " + permission.getName());
        }
        if (grant == null) {
            grant = new RolePermission();
            grant.setRole(role);
            grant.setPermission(permission);
        }
        grant.setActive(true);
        rolePermissionRepository.save(grant);

        auditLogService.record(AuditEvent.of(AuditAction.PERMISSION_ASSIGNED, actorId, "role:" + roleId, client,
                Map.of("permissionId", permissionId.toString(), "permissionName", permission.getName())));
    }

    public void revokePermissionFromRole(@NonNull UUID roleId, @NonNull UUID permissionId, UUID actorId, ClientMetadata client) {
        RolePermission grant = rolePermissionRepository.findByRoleIdAndPermissionId(roleId, permissionId)
                .filter(RolePermission::isActive)
                .orElseThrow(() -> new NotFoundProblemException("rbac.permission_not_assigned", "Role does not have this permission"));

        grant.setActive(false);

        auditLogService.record(AuditEvent.of(AuditAction.PERMISSION_REVOKED, actorId, "role:" + roleId, client,
                Map.of("permissionId", permissionId.toString(), "permissionName", grant.getPermission().getName())));
    }

    private Permission findPermission(UUID permissionId) {
        return permissionRepository.findById(permissionId)
                .orElseThrow(() -> new NotFoundProblemException("rbac.permission_not_found", "Permission not found"));
    }

    private void requireUnassigned(Permission permission) {
        if (rolePermissionRepository.existsActiveByPermissionId(permission.getId())) {
            throw new ValidationProblemException("rbac.permission_in_use",
                    "Cannot deactivate a permission that is granted to roles. Revoke all grants first.");
        }
    }

    public record UpdatePermissionCommand(String name, String description, String resource, String action,
                                          Boolean isActive, UUID actorId) {
    }

    public record CreatePermissionCommand(String name, String description, String resource, String action, UUID actorId) {
    }
}

package com.investorportal.backend.modules.rbac.application;

import java.time.Clock;
import java.time.OffsetDateTime;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.UUID;

import com.investorportal.backend.global.error.ConflictProblemException;
import com.investorportal.backend.global.error.NotFoundProblemException;
import com.investorportal.backend.global.error.ProblemException;
import com.investorportal.backend.global.error.ValidationProblemException;
import com.investorportal.backend.global.web.ClientMetadata;
import com.investorportal.backend.modules.audit.application.AuditEvent;
import com.investorportal.backend.modules.audit.application.AuditLogService;
import com.investorportal.backend.modules.audit.domain.AuditAction;
import com.investorportal.backend.modules.rbac.application.RoleAssignmentService.AssignRoleCommand;
import com.investorportal.backend.modules.rbac.domain.Role;
import com.investorportal.backend.modules.rbac.infrastructure.persistence.RoleRepository;
import com.investorportal.backend.modules.rbac.infrastructure.persistence.UserRoleRepository;
import com.investorportal.backend.modules.rbac.presentation.dto.RoleResponse;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.dao.DataAccessException;
import org.springframework.lang.NonNull;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Propagation;
import org.springframework.transaction.annotation.Transactional;

@Service
@Transactional
public class RoleService {

    private static final Logger log = LoggerFactory.getLogger(RoleService.class);

    private final RoleRepository roleRepository;
    private final UserRoleRepository userRoleRepository;
    private final RoleAssignmentService roleAssignmentService;
    private final AuditLogService auditLogService;
    private final Clock clock;

    public RoleService(
            RoleRepository roleRepository,
            UserRoleRepository userRoleRepository,
            RoleAssignmentService roleAssignmentService,
            AuditLogService auditLogService,
            Clock clock
    ) {
        this.roleRepository = roleRepository;
        this.userRoleRepository = userRoleRepository;
        this.roleAssignmentService = roleAssignmentService;
        this.auditLogService = auditLogService;
        this.clock = clock;
    }

    /**
     * Creates a role. A new default role takes the flag from whichever role held it.
     */
    public RoleResponse createRole(@NonNull CreateRoleCommand command, ClientMetadata client) {
        String name = command.name().trim();
        if (roleRepository.existsByName(name)) {
            throw new ConflictProblemException("rbac.role_name_taken", "Role " + name + " already exists");
        }
        if (command.isDefault()) {
            roleRepository.clearDefault(OffsetDateTime.now(clock));
        }

        Role role = new Role();
        role.setName(name);
        role.setDescription(command.description());
        role.setActive(true);
        role.setDefaultRole(command.isDefault());
        Role saved = roleRepository.save(role);

        auditLogService.record(AuditEvent.of(AuditAction.ROLE_CREATED, command.actorId(), "role:" + saved.getId(), client,
                Map.of("name", saved.getName(), "isDefault", saved.isDefaultRole())));
        return RoleResponse.from(saved);
    }

    public RoleResponse updateRole(@NonNull UUID roleId, @NonNull UpdateRoleCommand command, ClientMetadata client) {
        Role role = findRole(roleId);
        Map<String, Object> changes = new LinkedHashMap<>();

        if (command.name() != null && !command.name().trim().equals(role.getName())) {
            String name = command.name().trim();
            if (roleRepository.existsByNameAndIdNot(name, roleId)) {
                throw new ConflictProblemException("rbac.role_name_taken", "Role " + name + " already exists");
            }
            changes.put("name", name);
            role.setName(name);
        }
        if (command.description() != null) {
            changes.put("description", command.description());
            role.setDescription(command.description());
        }
        if (command.isDefault() != null && command.isDefault() != role.isDefaultRole()) {
            if (command.isDefault()) {
                if (!role.isActive()) {
                    throw new ValidationProblemException("rbac.role_inactive", "An inactive role cannot be the default role");
                }
                roleRepository.clearDefaultExcept(roleId, OffsetDateTime.now(clock));
            }
            changes.put("isDefault", command.isDefault());
            role.setDefaultRole(command.isDefault());
        }

        auditLogService.record(AuditEvent.of(AuditAction.ROLE_UPDATED, command.actorId(), "role:" + roleId, client, changes));
        return RoleResponse.from(role);
    }

    /**
     * Soft-deletes a role. The default role and roles still held by users are refused.
     */
    public void deactivateRole(@NonNull UUID roleId, UUID actorId, ClientMetadata client) {
        Role role = findRole(roleId);
        if (role.isDefaultRole()) {
            throw new ValidationProblemException("rbac.default_role_protected", "Cannot deactivate the default role");
        }
        if (userRoleRepository.existsActiveByRoleId(roleId)) {
            throw new ValidationProblemException("rbac.role_in_use",
                    "Cannot deactivate a role that is assigned to users. Revoke all assignments first.");
        }
        role.setActive(false);
        auditLogService.record(AuditEvent.of(AuditAction.ROLE_DEACTIVATED, actorId, "role:" + roleId, client,
                Map.of("name", role.getName())));
    }

    @Transactional(readOnly = true)
    public List<RoleResponse> listRoles(boolean includeInactive) {
        List<Role> roles = includeInactive
                ? roleRepository.findAllByOrderByNameAsc()
                : roleRepository.findByActiveTrueOrderByNameAsc();
        return roles.stream().map(RoleResponse::from).toList();
    }

    @Transactional(readOnly = true)
    public RoleResponse getRole(@NonNull UUID roleId) {
        return RoleResponse.from(findRole(roleId));
    }

    @Transactional(readOnly = true)
    public RoleResponse getRoleByName(@NonNull String name) {
        return roleRepository.findByName(name)
                .map(RoleResponse::from)
                .orElseThrow(() -> new NotFoundProblemException("rbac.role_not_found", "Role not found"));
    }

    @Transactional(readOnly = true)
    public Optional<RoleResponse> getDefaultRole() {
        return roleRepository.findFirstByDefaultRoleTrueAndActiveTrue().map(RoleResponse::from);
    }

    /**
     * Assigns one role to many users, each in its own transaction. A failing user is reported
     * and does not undo the others.
     */
    @Transactional(propagation = Propagation.NOT_SUPPORTED)
    public BulkAssignmentResult bulkAssignRoles(@NonNull BulkAssignCommand command, ClientMetadata client) {
        roleRepository.findById(command.roleId())
                .filter(Role::isActive)
                .orElseThrow(() -> new NotFoundProblemException("rbac.role_not_found", "Role not found or inactive"));

        int successCount = 0;
        List<BulkAssignmentResult.Failure> failures = new ArrayList<>();
        for (UUID userId : command.userIds()) {
            try {
                roleAssignmentService.assignRole(
                        new AssignRoleCommand(userId, command.roleId(), command.assignedBy(), command.reason(), command.expiresAt()),
                        client);
                successCount++;
            } catch (ProblemException ex) {
                failures.add(new BulkAssignmentResult.Failure(userId, ex.getDetailMessage()));
            } catch (DataAccessException ex) {
                log.warn("Bulk role assignment failed for user {} and role {}", userId, command.roleId(), ex);
                failures.add(new BulkAssignmentResult.Failure(userId, "Assignment failed"));
            }
        }
        return new BulkAssignmentResult(successCount, failures);
    }

    private Role findRole(UUID roleId) {
        return roleRepository.findById(roleId)
                .orElseThrow(() -> new NotFoundProblemException("rbac.role_not_found", "Role not found"));
    }

    public record CreateRoleCommand(String name, String description, boolean isDefault, UUID actorId) {
    }

    public record UpdateRoleCommand(String name, String description, Boolean isDefault, UUID actorId) {
    }

    public record BulkAssignCommand(UUID roleId, List<UUID> userIds, UUID assignedBy, String reason, OffsetDateTime expiresAt) {
    }
}

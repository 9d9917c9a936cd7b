package com.investorportal.backend.modules.rbac.application;

import java.time.Clock;
import java.time.OffsetDateTime;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.UUID;

import com.investorportal.backend.global.config.AuthProperties;
import com.investorportal.backend.global.error.ConflictProblemException;
import com.investorportal.backend.global.error.NotFoundProblemException;
import com.investorportal.backend.global.web.ClientMetadata;
import com.investorportal.backend.modules.audit.application.AuditEvent;
import com.investorportal.backend.modules.audit.application.AuditLogService;
import com.investorportal.backend.modules.audit.domain.AuditAction;
import com.investorportal.backend.modules.auth.domain.PortalUser;
import com.investorportal.backend.modules.auth.infrastructure.persistence.PortalUserRepository;
import com.investorportal.backend.modules.rbac.domain.Role;
import com.investorportal.backend.modules.rbac.domain.RoleAssignment;
import com.investorportal.backend.modules.rbac.domain.UserRole;
import com.investorportal.backend.modules.rbac.infrastructure.persistence.RoleAssignmentRepository;
import com.investorportal.backend.modules.rbac.infrastructure.persistence.RoleRepository;
import com.investorportal.backend.modules.rbac.infrastructure.persistence.UserRoleRepository;
import com.investorportal.backend.modules.rbac.presentation.dto.RoleAssignmentResponse;
import com.investorportal.backend.modules.rbac.presentation.dto.UserRolesResponse;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.lang.NonNull;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

/**
 * Grants and revokes roles. The user-role holding and its assignment history record change together
 * in one transaction.
 */
@Service
@Transactional
public class RoleAssignmentService {

    private static final Logger log = LoggerFactory.getLogger(RoleAssignmentService.class);
    private static final String DEFAULT_ROLE_REASON = "Default role on registration";

    private final PortalUserRepository portalUserRepository;
    private final RoleRepository roleRepository;
    private final UserRoleRepository userRoleRepository;
    private final RoleAssignmentRepository roleAssignmentRepository;
    private final AuditLogService auditLogService;
    private final AuthProperties authProperties;
    private final Clock clock;

    public RoleAssignmentService(
            PortalUserRepository portalUserRepository,
            RoleRepository roleRepository,
            UserRoleRepository userRoleRepository,
            RoleAssignmentRepository roleAssignmentRepository,
            AuditLogService auditLogService,
            AuthProperties authProperties,
            Clock clock
    ) {
        this.portalUserRepository = portalUserRepository;
        this.roleRepository = roleRepository;
        this.userRoleRepository = userRoleRepository;
        this.roleAssignmentRepository = roleAssignmentRepository;
        this.auditLogService = auditLogService;
        this.authProperties = authProperties;
        this.clock = clock;
    }

    public void assignRole(@NonNull AssignRoleCommand command, ClientMetadata client) {
        PortalUser user = portalUserRepository.findById(command.userId())
                .orElseThrow(() -> new NotFoundProblemException("rbac.user_not_found", "User not found"));
        Role role = roleRepository.findById(command.roleId())
                .filter(Role::isActive)
                .orElseThrow(() -> new NotFoundProblemException("rbac.role_not_found", "Role not found or inactive"));

        grant(user, role, command.assignedBy(), command.reason(), command.expiresAt());

        Map<String, Object> details = new LinkedHashMap<>();
        details.put("roleId", role.getId().toString());
        details.put("roleName", role.getName());
        if (command.assignedBy() != null) {
            details.put("assignedBy", command.assignedBy().toString());
        }
        if (command.reason() != null) {
            details.put("reason", command.reason());
        }
        auditLogService.record(AuditEvent.of(AuditAction.ROLE_ASSIGNED, user.getId(), "user:" + user.getId(), client, details));
    }

    public void revokeRole(@NonNull RevokeRoleCommand command, ClientMetadata client) {
        UserRole userRole = userRoleRepository.findByUserIdAndRoleId(command.userId(), command.roleId())
                .filter(UserRole::isActive)
                .orElseThrow(() -> new NotFoundProblemException("rbac.role_not_assigned", "User does not hold this role"));

        OffsetDateTime now = OffsetDateTime.now(clock);
        userRole.setActive(false);
        roleAssignmentRepository.findOpen(command.userId(), command.roleId())
                .ifPresent(assignment -> assignment.close(command.revokedBy(), command.reason(), now));

        Map<String, Object> details = new LinkedHashMap<>();
        details.put("roleId", command.roleId().toString());
        details.put("roleName", userRole.getRole().getName());
        if (command.revokedBy() != null) {
            details.put("revokedBy", command.revokedBy().toString());
        }
        if (command.reason() != null) {
            details.put("reason", command.reason());
        }
        auditLogService.record(AuditEvent.of(AuditAction.ROLE_REVOKED, command.userId(), "user:" + command.userId(), client, details));
    }

    /**
     * Grants the active default role, or the configured fallback role by name, to a new user.
     *
     * @return the granted role name, empty when neither role exists
     */
    public Optional<String> assignDefaultRole(@NonNull PortalUser user, ClientMetadata client) {
        Optional<Role> defaultRole = roleRepository.findFirstByDefaultRoleTrueAndActiveTrue()
                .or(() -> roleRepository.findByName(authProperties.defaultRole()).filter(Role::isActive));
        if (defaultRole.isEmpty()) {
            log.warn("No default role available; user {} registered without roles", user.getId());
            return Optional.empty();
        }

        Role role = defaultRole.get();
        grant(user, role, null, DEFAULT_ROLE_REASON, null);
        auditLogService.record(AuditEvent.of(AuditAction.ROLE_ASSIGNED, user.getId(), "user:" + user.getId(), client,
                Map.of("roleId", role.getId().toString(), "roleName", role.getName(), "reason", DEFAULT_ROLE_REASON)));
        return Optional.of(role.getName());
    }

    @Transactional(readOnly = true)
    public UserRolesResponse getUserRoles(@NonNull UUID userId) {
        PortalUser user = portalUserRepository.findById(userId)
                .orElseThrow(() -> new NotFoundProblemException("rbac.user_not_found", "User not found"));
        List<UserRolesResponse.HeldRole> roles = userRoleRepository.findActiveByUserId(userId).stream()
                .map(userRole -> new UserRolesResponse.HeldRole(
                        userRole.getRole().getId(),
                        userRole.getRole().getName(),
                        userRole.getAssignedAt()))
                .toList();
        return new UserRolesResponse(user.getId(), user.getEmail(), roles);
    }

    @Transactional(readOnly = true)
    public List<RoleAssignmentResponse> getAssignmentHistory(@NonNull UUID userId) {
        if (!portalUserRepository.existsById(userId)) {
            throw new NotFoundProblemException("rbac.user_not_found", "User not found");
        }
        return roleAssignmentRepository.findHistoryByUserId(userId).stream()
                .map(RoleAssignmentResponse::from)
                .toList();
    }

    private void grant(PortalUser user, Role role, UUID assignedBy, String reason, OffsetDateTime expiresAt) {
        OffsetDateTime now = OffsetDateTime.now(clock);
        UserRole userRole = userRoleRepository.findByUserIdAndRoleId(user.getId(), role.getId())
                .orElse(null);
        if (userRole != null && userRole.isActive()) {
            throw new ConflictProblemException("rbac.role_already_assigned", "User already holds role " + role.getName());
        }
        if (userRole == null) {
            userRole = new UserRole();
            userRole.setUser(user);
            userRole.setRole(role);
        }
        userRole.setActive(true);
        userRole.setAssignedAt(now);
        userRoleRepository.save(userRole);

        RoleAssignment assignment = new RoleAssignment();
        assignment.setUser(user);
        assignment.setRole(role);
        assignment.setAssignedBy(assignedBy);
        assignment.setReason(reason);
        assignment.setExpiresAt(expiresAt);
        roleAssignmentRepository.save(assignment);
    }

    public record AssignRoleCommand(UUID userId, UUID roleId, UUID assignedBy, String reason, OffsetDateTime expiresAt) {
    }

    public record RevokeRoleCommand(UUID userId, UUID roleId, UUID revokedBy, String reason) {
    }
}

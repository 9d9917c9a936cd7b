package com.investorportal.backend.modules.rbac.application;

import static org.assertj.core.api.Assertions.assertThat;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

import java.time.Clock;
import java.time.Instant;
import java.time.OffsetDateTime;
import java.time.ZoneOffset;
import java.util.List;
import java.util.Optional;
import java.util.UUID;

import com.investorportal.backend.global.error.ConflictProblemException;
import com.investorportal.backend.global.error.NotFoundProblemException;
import com.investorportal.backend.global.web.ClientMetadata;
import com.investorportal.backend.modules.audit.application.AuditEvent;
import com.investorportal.backend.modules.audit.application.AuditLogService;
import com.investorportal.backend.modules.audit.domain.AuditAction;
import com.investorportal.backend.modules.auth.domain.PortalUser;
import com.investorportal.backend.modules.auth.infrastructure.persistence.PortalUserRepository;
import com.investorportal.backend.modules.rbac.application.RoleAssignmentService.AssignRoleCommand;
import com.investorportal.backend.modules.rbac.application.RoleAssignmentService.RevokeRoleCommand;
import com.investorportal.backend.modules.rbac.domain.Role;
import com.investorportal.backend.modules.rbac.domain.RoleAssignment;
import com.investorportal.backend.modules.rbac.domain.UserRole;
import com.investorportal.backend.modules.rbac.infrastructure.persistence.RoleAssignmentRepository;
import com.investorportal.backend.modules.rbac.infrastructure.persistence.RoleRepository;
import com.investorportal.backend.modules.rbac.infrastructure.persistence.UserRoleRepository;
import com.investorportal.backend.support.TestAuthProperties;
import com.investorportal.backend.support.TestEntities;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.mockito.junit.jupiter.MockitoSettings;
import org.mockito.quality.Strictness;

@ExtendWith(MockitoExtension.class)
@MockitoSettings(strictness = Strictness.LENIENT)
class RoleAssignmentServiceTest {

    private static final Instant NOW = Instant.parse("2026-03-02T09:00:00Z");
    private static final OffsetDateTime NOW_UTC = OffsetDateTime.ofInstant(NOW, ZoneOffset.UTC);

    @Mock
    private PortalUserRepository portalUserRepository;

    @Mock
    private RoleRepository roleRepository;

    @Mock
    private UserRoleRepository userRoleRepository;

    @Mock
    private RoleAssignmentRepository roleAssignmentRepository;

    @Mock
    private AuditLogService auditLogService;

    private RoleAssignmentService roleAssignmentService;
    private PortalUser user;
    private Role analyst;
    private final UUID adminId = UUID.randomUUID();

    @BeforeEach
    void setUp() {
        roleAssignmentService = new RoleAssignmentService(
                portalUserRepository,
                roleRepository,
                userRoleRepository,
                roleAssignmentRepository,
                auditLogService,
                TestAuthProperties.defaults(),
                Clock.fixed(NOW, ZoneOffset.UTC)
        );

        user = new PortalUser();
        user.setEmail("ada@example.com");
        TestEntities.withId(user, UUID.randomUUID());
        when(portalUserRepository.findById(user.getId())).thenReturn(Optional.of(user));

        analyst = role("ANALYST", true);
        when(userRoleRepository.findByUserIdAndRoleId(any(), any())).thenReturn(Optional.empty());
    }

    @Test
    void assignRoleCreatesHoldingAndHistoryEntry() {
        OffsetDateTime expiresAt = NOW_UTC.plusDays(30);

        roleAssignmentService.assignRole(
                new AssignRoleCommand(user.getId(), analyst.getId(), adminId, "Coverage rotation", expiresAt), ClientMetadata.NONE);

        ArgumentCaptor<UserRole> holding = ArgumentCaptor.forClass(UserRole.class);
        verify(userRoleRepository).save(holding.capture());
        assertThat(holding.getValue().getUser()).isSameAs(user);
        assertThat(holding.getValue().getRole()).isSameAs(analyst);
        assertThat(holding.getValue().isActive()).isTrue();
        assertThat(holding.getValue().getAssignedAt()).isEqualTo(NOW_UTC);

        ArgumentCaptor<RoleAssignment> history = ArgumentCaptor.forClass(RoleAssignment.class);
        verify(roleAssignmentRepository).save(history.capture());
        assertThat(history.getValue().getAssignedBy()).isEqualTo(adminId);
        assertThat(history.getValue().getReason()).isEqualTo("Coverage rotation");
        assertThat(history.getValue().getExpiresAt()).isEqualTo(expiresAt);

        ArgumentCaptor<AuditEvent> audit = ArgumentCaptor.forClass(AuditEvent.class);
        verify(auditLogService).record(audit.capture());
        assertThat(audit.getValue().action()).isEqualTo(AuditAction.ROLE_ASSIGNED);
        assertThat(audit.getValue().resource()).isEqualTo("user:" + user.getId());
        assertThat(audit.getValue().details()).containsEntry("roleName", "ANALYST");
    }

    @Test
    void assigningHeldRoleIsConflict() {
        UserRole held = holding(analyst, true);
        when(userRoleRepository.findByUserIdAndRoleId(user.getId(), analyst.getId())).thenReturn(Optional.of(held));

        ConflictProblemException exception = assertThrows(ConflictProblemException.class,
                () -> roleAssignmentService.assignRole(
                        new AssignRoleCommand(user.getId(), analyst.getId(), adminId, null, null), ClientMetadata.NONE));

        assertThat(exception.getCode()).isEqualTo("rbac.role_already_assigned");
        verify(roleAssignmentRepository, never()).save(any());
    }

    @Test
    void previouslyRevokedHoldingIsReactivated() {
        UserRole revoked = holding(analyst, false);
        when(userRoleRepository.findByUserIdAndRoleId(user.getId(), analyst.getId())).thenReturn(Optional.of(revoked));

        roleAssignmentService.assignRole(
                new AssignRoleCommand(user.getId(), analyst.getId(), adminId, null, null), ClientMetadata.NONE);

        assertThat(revoked.isActive()).isTrue();
        verify(userRoleRepository).save(revoked);
    }

    @Test
    void assignRoleRejectsUnknownUserAndInactiveRole() {
        Role retired = role("RETIRED", false);

        NotFoundProblemException unknownUser = assertThrows(NotFoundProblemException.class,
                () -> roleAssignmentService.assignRole(
                        new AssignRoleCommand(UUID.randomUUID(), analyst.getId(), adminId, null, null), ClientMetadata.NONE));
        NotFoundProblemException inactiveRole = assertThrows(NotFoundProblemException.class,
                () -> roleAssignmentService.assignRole(
                        new AssignRoleCommand(user.getId(), retired.getId(), adminId, null, null), ClientMetadata.NONE));

        assertThat(unknownUser.getCode()).isEqualTo("rbac.user_not_found");
        assertThat(inactiveRole.getCode()).isEqualTo("rbac.role_not_found");
    }

    @Test
    void revokeRoleDeactivatesHoldingAndClosesOpenAssignment() {
        UserRole held = holding(analyst, true);
        RoleAssignment open = new RoleAssignment();
        when(userRoleRepository.findByUserIdAndRoleId(user.getId(), analyst.getId())).thenReturn(Optional.of(held));
        when(roleAssignmentRepository.findOpen(user.getId(), analyst.getId())).thenReturn(Optional.of(open));

        roleAssignmentService.revokeRole(
                new RevokeRoleCommand(user.getId(), analyst.getId(), adminId, "Left the desk"), ClientMetadata.NONE);

        assertThat(held.isActive()).isFalse();
        assertThat(open.isActive()).isFalse();
        assertThat(open.getRevokedBy()).isEqualTo(adminId);
        assertThat(open.getRevokeReason()).isEqualTo("Left the desk");
        assertThat(open.getRevokedAt()).isEqualTo(NOW_UTC);
    }

    @Test
    void revokingRoleNotHeldIsNotFound() {
        when(userRoleRepository.findByUserIdAndRoleId(user.getId(), analyst.getId()))
                .thenReturn(Optional.of(holding(analyst, false)));

        NotFoundProblemException exception = assertThrows(NotFoundProblemException.class,
                () -> roleAssignmentService.revokeRole(
                        new RevokeRoleCommand(user.getId(), analyst.getId(), adminId, null), ClientMetadata.NONE));

        assertThat(exception.getCode()).isEqualTo("rbac.role_not_assigned");
        verify(auditLogService, never()).record(any());
    }

    @Test
    void defaultRoleFlagWinsOverConfiguredName() {
        Role flagged = role("PREMIUM_INVESTOR", true);
        when(roleRepository.findFirstByDefaultRoleTrueAndActiveTrue()).thenReturn(Optional.of(flagged));

        Optional<String> granted = roleAssignmentService.assignDefaultRole(user, ClientMetadata.NONE);

        assertThat(granted).contains("PREMIUM_INVESTOR");
        verify(roleRepository, never()).findByName(any());
    }

    @Test
    void configuredRoleNameIsUsedWhenNoRoleIsFlagged() {
        Role investor = role("INVESTOR", true);
        when(roleRepository.findFirstByDefaultRoleTrueAndActiveTrue()).thenReturn(Optional.empty());
        when(roleRepository.findByName("INVESTOR")).thenReturn(Optional.of(investor));

        assertThat(roleAssignmentService.assignDefaultRole(user, ClientMetadata.NONE)).contains("INVESTOR");
        verify(userRoleRepository).save(any(UserRole.class));
    }

    @Test
    void registrationWithoutAnyDefaultRoleGrantsNothing() {
        when(roleRepository.findFirstByDefaultRoleTrueAndActiveTrue()).thenReturn(Optional.empty());
        when(roleRepository.findByName("INVESTOR")).thenReturn(Optional.empty());

        assertThat(roleAssignmentService.assignDefaultRole(user, ClientMetadata.NONE)).isEmpty();
        verify(userRoleRepository, never()).save(any());
        verify(auditLogService, never()).record(any());
    }

    @Test
    void userRolesListsActiveHoldings() {
        UserRole held = holding(analyst, true);
        held.setAssignedAt(NOW_UTC);
        when(userRoleRepository.findActiveByUserId(user.getId())).thenReturn(List.of(held));

        var response = roleAssignmentService.getUserRoles(user.getId());

        assertThat(response.email()).isEqualTo("ada@example.com");
        assertThat(response.roles()).singleElement()
                .satisfies(role -> assertThat(role.name()).isEqualTo("ANALYST"));
    }

    @Test
    void historyForUnknownUserIsNotFound() {
        assertThrows(NotFoundProblemException.class,
                () -> roleAssignmentService.getAssignmentHistory(UUID.randomUUID()));
    }

    private Role role(String name, boolean active) {
        Role role = new Role();
        role.setName(name);
        role.setActive(active);
        TestEntities.withId(role, UUID.randomUUID());
        when(roleRepository.findById(role.getId())).thenReturn(Optional.of(role));
        return role;
    }

    private UserRole holding(Role role, boolean active) {
        UserRole userRole = new UserRole();
        userRole.setUser(user);
        userRole.setRole(role);
        userRole.setActive(active);
        return userRole;
    }
}

package com.investorportal.backend.modules.rbac;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.assertj.core.api.Assertions.tuple;

import java.util.List;
import java.util.UUID;

import com.investorportal.backend.global.error.ConflictProblemException;
import com.investorportal.backend.global.web.ClientMetadata;
import com.investorportal.backend.modules.auth.domain.PortalUser;
import com.investorportal.backend.modules.auth.infrastructure.persistence.PortalUserRepository;
import com.investorportal.backend.modules.rbac.application.AccessCheckService;
import com.investorportal.backend.modules.rbac.application.BulkAssignmentResult;
import com.investorportal.backend.modules.rbac.application.PermissionService;
import com.investorportal.backend.modules.rbac.application.PermissionService.CreatePermissionCommand;
import com.investorportal.backend.modules.rbac.application.PermissionService.UpdatePermissionCommand;
import com.investorportal.backend.modules.rbac.application.RoleAssignmentService;
import com.investorportal.backend.modules.rbac.application.RoleAssignmentService.AssignRoleCommand;
import com.investorportal.backend.modules.rbac.application.RoleAssignmentService.RevokeRoleCommand;
import com.investorportal.backend.modules.rbac.application.RolePermissionAggregator;
import com.investorportal.backend.modules.rbac.application.RolePermissionAggregator.ResolvedAuthorities;
import com.investorportal.backend.modules.rbac.application.RoleService;
import com.investorportal.backend.modules.rbac.application.RoleService.BulkAssignCommand;
import com.investorportal.backend.modules.rbac.application.RoleService.CreateRoleCommand;
import com.investorportal.backend.modules.rbac.domain.PermissionMatch;
import com.investorportal.backend.modules.rbac.infrastructure.persistence.RoleRepository;
import com.investorportal.backend.modules.rbac.presentation.dto.PermissionResponse;
import com.investorportal.backend.modules.rbac.presentation.dto.RoleAssignmentResponse;
import com.investorportal.backend.modules.rbac.presentation.dto.RoleResponse;
import com.investorportal.backend.support.AbstractPostgresIntegrationTest;

import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.context.SpringBootTest;

@SpringBootTest
class RbacIntegrationTest extends AbstractPostgresIntegrationTest {

    @Autowired
    private RoleService roleService;

    @Autowired
    private RoleAssignmentService roleAssignmentService;

    @Autowired
    private PermissionService permissionService;

    @Autowired
    private RolePermissionAggregator rolePermissionAggregator;

    @Autowired
    private AccessCheckService accessCheckService;

    @Autowired
    private RoleRepository roleRepository;

    @Autowired
    private PortalUserRepository portalUserRepository;

    @Test
    void seededCatalogHasUserAsDefault() {
        assertThat(roleService.getDefaultRole()).map(RoleResponse::name).contains("USER");
        assertThat(roleService.getRoleByName("INVESTOR").isDefault()).isFalse();
        assertThat(roleService.listRoles(false)).extracting(RoleResponse::name)
                .containsExactly("ADMIN", "INVESTOR", "USER");
    }

    @Test
    void atMostOneRoleIsDefault() {
        RoleResponse first = roleService.createRole(new CreateRoleCommand("R", "first", true, null), ClientMetadata.NONE);
        RoleResponse second = roleService.createRole(new CreateRoleCommand("R2", "second", true, null), ClientMetadata.NONE);

        assertThat(roleService.getRole(first.id()).isDefault()).isFalse();
        assertThat(roleService.getRole(second.id()).isDefault()).isTrue();
        assertThat(roleService.getRoleByName("USER").isDefault()).isFalse();
        assertThat(roleService.listRoles(true)).filteredOn(RoleResponse::isDefault)
                .extracting(RoleResponse::name)
                .containsExactly("R2");
    }

    @Test
    void resolveUnionsPermissionsAcrossHeldRoles() {
        PortalUser user = newUser("union@example.com");
        assign(user, "ADMIN");
        assign(user, "USER");

        ResolvedAuthorities authorities = rolePermissionAggregator.resolve(user.getId());

        assertThat(authorities.roles()).containsExactlyInAnyOrder("ADMIN", "USER");
        assertThat(authorities.permissions()).contains("CREATE_USER", "VIEW_USER_DASHBOARD");
    }

    @Test
    void revokedRoleAndDeactivatedGrantStopContributing() {
        PortalUser user = newUser("revoked@example.com");
        UUID investorId = roleRepository.findByName("INVESTOR").orElseThrow().getId();
        UUID userRoleId = roleRepository.findByName("USER").orElseThrow().getId();
        assign(user, "INVESTOR");
        assign(user, "USER");

        roleAssignmentService.revokeRole(new RevokeRoleCommand(user.getId(), investorId, null, "Account closed"), ClientMetadata.NONE);
        UUID dashboard = permissionService.listPermissions(false).stream()
                .filter(permission -> permission.name().equals("VIEW_USER_DASHBOARD"))
                .findFirst()
                .orElseThrow()
                .id();
        permissionService.revokePermissionFromRole(userRoleId, dashboard, null, ClientMetadata.NONE);

        ResolvedAuthorities authorities = rolePermissionAggregator.resolve(user.getId());
        assertThat(authorities.roles()).containsExactly("USER");
        assertThat(authorities.permissions()).containsExactly("VIEW_PORTFOLIO");
        assertThat(roleAssignmentService.getAssignmentHistory(user.getId()))
                .filteredOn(entry -> entry.roleName().equals("INVESTOR"))
                .singleElement()
                .satisfies(entry -> assertThat(entry.revokeReason()).isEqualTo("Account closed"));
    }

    @Test
    void bulkAssignmentKeepsSuccessfulGrantsWhenOthersFail() {
        PortalUser fresh = newUser("fresh@example.com");
        PortalUser holder = newUser("holder@example.com");
        UUID missing = UUID.randomUUID();
        assign(holder, "USER");
        UUID userRoleId = roleRepository.findByName("USER").orElseThrow().getId();

        BulkAssignmentResult result = roleService.bulkAssignRoles(
                new BulkAssignCommand(userRoleId, List.of(fresh.getId(), holder.getId(), missing), null, "Batch", null),
                ClientMetadata.NONE);

        assertThat(result.successCount()).isEqualTo(1);
        assertThat(result.failures()).extracting(BulkAssignmentResult.Failure::userId)
                .containsExactly(holder.getId(), missing);
        assertThat(rolePermissionAggregator.hasRole(fresh.getId(), "USER")).isTrue();
    }

    @Test
    void roleHeldByUsersCannotBeDeactivated() {
        PortalUser user = newUser("holder@example.com");
        RoleResponse analyst = roleService.createRole(new CreateRoleCommand("ANALYST", null, false, null), ClientMetadata.NONE);
        roleAssignmentService.assignRole(new AssignRoleCommand(user.getId(), analyst.id(), null, null, null), ClientMetadata.NONE);

        assertThatThrownBy(() -> roleService.deactivateRole(analyst.id(), null, ClientMetadata.NONE))
                .extracting("code")
                .isEqualTo("rbac.role_in_use");

        roleAssignmentService.revokeRole(new RevokeRoleCommand(user.getId(), analyst.id(), null, null), ClientMetadata.NONE);
        roleService.deactivateRole(analyst.id(), null, ClientMetadata.NONE);

        assertThat(roleService.getRole(analyst.id()).isActive()).isFalse();
        assertThat(roleService.listRoles(false)).extracting(RoleResponse::name).doesNotContain("ANALYST");
    }

    @Test
    void historyListsEveryGrant() {
        PortalUser user = newUser("history@example.com");
        assign(user, "USER");
        assign(user, "INVESTOR");

        assertThat(roleAssignmentService.getAssignmentHistory(user.getId()))
                .extracting(RoleAssignmentResponse::roleName, RoleAssignmentResponse::isActive)
                .containsExactlyInAnyOrder(tuple("USER", true), tuple("INVESTOR", true));
    }

    @Test
    void grantedPermissionCannotBeDeactivatedUntilRevoked() {
        PortalUser user = newUser("reports@example.com");
        assign(user, "USER");
        UUID userRoleId = roleRepository.findByName("USER").orElseThrow().getId();
        PermissionResponse reports = permissionService.createPermission(
                new CreatePermissionCommand("EXPORT_REPORTS", "Export reports", "REPORT", "EXPORT", null), ClientMetadata.NONE);
        permissionService.assignPermissionToRole(userRoleId, reports.id(), null, ClientMetadata.NONE);
        assertThat(rolePermissionAggregator.resolve(user.getId()).permissions()).contains("EXPORT_REPORTS");

        assertThatThrownBy(() -> permissionService.deactivatePermission(reports.id(), null, ClientMetadata.NONE))
                .extracting("code")
                .isEqualTo("rbac.permission_in_use");
        assertThatThrownBy(() -> permissionService.updatePermission(reports.id(),
                new UpdatePermissionCommand(null, null, null, null, false, null), ClientMetadata.NONE))
                .extracting("code")
                .isEqualTo("rbac.permission_in_use");

        permissionService.revokePermissionFromRole(userRoleId, reports.id(), null, ClientMetadata.NONE);
        permissionService.deactivatePermission(reports.id(), null, ClientMetadata.NONE);

        assertThat(permissionService.listPermissions(false)).extracting(PermissionResponse::name).doesNotContain("EXPORT_REPORTS");
        assertThatThrownBy(() -> permissionService.assignPermissionToRole(userRoleId, reports.id(), null, ClientMetadata.NONE))
                .extracting("code")
                .isEqualTo("rbac.permission_not_found");

        PermissionResponse reactivated = permissionService.updatePermission(reports.id(),
                new UpdatePermissionCommand("EXPORT_PORTFOLIO_REPORTS", null, null, null, true, null), ClientMetadata.NONE);
        assertThat(reactivated.isActive()).isTrue();
        assertThat(reactivated.name()).isEqualTo("EXPORT_PORTFOLIO_REPORTS");
    }

    @Test
    void renamingPermissionOntoExistingNameConflicts() {
        PermissionResponse reports = permissionService.createPermission(
                new CreatePermissionCommand("EXPORT_REPORTS", null, null, null, null), ClientMetadata.NONE);

        assertThatThrownBy(() -> permissionService.updatePermission(reports.id(),
                new UpdatePermissionCommand("VIEW_PORTFOLIO", null, null, null, null, null), ClientMetadata.NONE))
                .isInstanceOf(ConflictProblemException.class);
    }

    @Test
    void accessChecksReflectEffectiveAuthorities() {
        PortalUser user = newUser("checks@example.com");
        assign(user, "INVESTOR");

        assertThat(accessCheckService.checkRole(user.getId(), "INVESTOR").granted()).isTrue();
        assertThat(accessCheckService.checkRole(user.getId(), "ADMIN").granted()).isFalse();
        assertThat(accessCheckService.checkAnyRole(user.getId(), List.of("ADMIN", "INVESTOR")).granted()).isTrue();
        assertThat(accessCheckService.checkPermissions(user.getId(), List.of("VIEW_PORTFOLIO", "CREATE_PORTFOLIO"), null)
                .granted()).isTrue();
        assertThat(accessCheckService.checkPermissions(user.getId(), List.of("VIEW_PORTFOLIO", "DELETE_PORTFOLIO"),
                PermissionMatch.ALL).granted()).isFalse();
        assertThat(accessCheckService.checkPermissions(user.getId(), List.of("VIEW_PORTFOLIO", "DELETE_PORTFOLIO"),
                PermissionMatch.ANY).granted()).isTrue();
        assertThatThrownBy(() -> accessCheckService.checkRole(UUID.randomUUID(), "ADMIN"))
                .extracting("code")
                .isEqualTo("rbac.user_not_found");
    }

    private PortalUser newUser(String email) {
        PortalUser user = new PortalUser();
        user.setEmail(email);
        user.setPasswordHash("$2a$04$abcdefghijklmnopqrstuu5Z8.YkR0h1Zr1Ck5Kq3uVnq8n8j4bHq");
        return portalUserRepository.save(user);
    }

    private void assign(PortalUser user, String roleName) {
        UUID roleId = roleRepository.findByName(roleName).orElseThrow().getId();
        roleAssignmentService.assignRole(new AssignRoleCommand(user.getId(), roleId, null, null, null), ClientMetadata.NONE);
    }
}

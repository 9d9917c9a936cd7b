package com.investorportal.backend.modules.rbac.presentation;

import java.util.List;
import java.util.UUID;

import com.investorportal.backend.global.security.AuthenticatedPrincipal;
import com.investorportal.backend.modules.rbac.application.AuthorizationEvaluator;
import com.investorportal.backend.modules.rbac.application.RoleAssignmentService;
import com.investorportal.backend.modules.rbac.domain.AccessPolicy;
import com.investorportal.backend.modules.rbac.domain.PortalAuthorities;
import com.investorportal.backend.modules.rbac.presentation.dto.RoleAssignmentResponse;
import com.investorportal.backend.modules.rbac.presentation.dto.UserRolesResponse;

import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.responses.ApiResponse;
import io.swagger.v3.oas.annotations.responses.ApiResponses;
import io.swagger.v3.oas.annotations.tags.Tag;

import org.springframework.http.ResponseEntity;
import org.springframework.security.core.annotation.AuthenticationPrincipal;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

@Tag(name = "Roles")
@RestController
@RequestMapping("/admin/users/{userId}")
public class UserRoleController {

    // Holdings of another user are an administrator concern.
    static final AccessPolicy OTHER_USER_ROLES = AccessPolicy.builder()
            .requireAllRoles(PortalAuthorities.ROLE_ADMIN)
            .requireAnyPermission(PortalAuthorities.VIEW_USER, PortalAuthorities.VIEW_ROLE)
            .build();

    private final RoleAssignmentService roleAssignmentService;
    private final AuthorizationEvaluator authorizationEvaluator;

    public UserRoleController(RoleAssignmentService roleAssignmentService, AuthorizationEvaluator authorizationEvaluator) {
        this.roleAssignmentService = roleAssignmentService;
        this.authorizationEvaluator = authorizationEvaluator;
    }

    @Operation(summary = "Roles currently held by a user", description = "Non-administrators may only read their own holdings.")
    @ApiResponses({
            @ApiResponse(responseCode = "200", description = "Found"),
            @ApiResponse(responseCode = "403", description = "Another user's holdings without administrator rights")
    })
    @GetMapping("/roles")
    public ResponseEntity<UserRolesResponse> getUserRoles(
            @PathVariable("userId") UUID userId,
            @AuthenticationPrincipal AuthenticatedPrincipal principal
    ) {
        if (!userId.equals(principal.userId())) {
            authorizationEvaluator.enforce(OTHER_USER_ROLES, principal);
        }
        return ResponseEntity.ok(roleAssignmentService.getUserRoles(userId));
    }

    @Operation(summary = "Role assignment history of a user", description = "Newest first, including revoked assignments.")
    @GetMapping("/role-history")
    public ResponseEntity<List<RoleAssignmentResponse>> getRoleHistory(@PathVariable("userId") UUID userId) {
        return ResponseEntity.ok(roleAssignmentService.getAssignmentHistory(userId));
    }
}

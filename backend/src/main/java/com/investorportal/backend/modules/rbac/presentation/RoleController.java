package com.investorportal.backend.modules.rbac.presentation;

import java.util.List;
import java.util.UUID;

import com.investorportal.backend.global.error.NotFoundProblemException;
import com.investorportal.backend.global.security.SecurityUtils;
import com.investorportal.backend.global.web.ClientMetadata;
import com.investorportal.backend.modules.rbac.application.AccessCheckService;
import com.investorportal.backend.modules.rbac.application.BulkAssignmentResult;
import com.investorportal.backend.modules.rbac.application.RoleAssignmentService;
import com.investorportal.backend.modules.rbac.application.RoleAssignmentService.AssignRoleCommand;
import com.investorportal.backend.modules.rbac.application.RoleAssignmentService.RevokeRoleCommand;
import com.investorportal.backend.modules.rbac.application.RoleService;
import com.investorportal.backend.modules.rbac.application.RoleService.BulkAssignCommand;
import com.investorportal.backend.modules.rbac.application.RoleService.CreateRoleCommand;
import com.investorportal.backend.modules.rbac.application.RoleService.UpdateRoleCommand;
import com.investorportal.backend.modules.rbac.presentation.dto.AssignRoleRequest;
import com.investorportal.backend.modules.rbac.presentation.dto.BulkAssignRolesRequest;
import com.investorportal.backend.modules.rbac.presentation.dto.CreateRoleRequest;
import com.investorportal.backend.modules.rbac.presentation.dto.RoleCheckResponse;
import com.investorportal.backend.modules.rbac.presentation.dto.RoleResponse;
import com.investorportal.backend.modules.rbac.presentation.dto.UpdateRoleRequest;

import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.responses.ApiResponse;
import io.swagger.v3.oas.annotations.responses.ApiResponses;
import io.swagger.v3.oas.annotations.tags.Tag;

import jakarta.servlet.http.HttpServletRequest;
import jakarta.validation.Valid;

import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.DeleteMapping;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.PutMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

@Tag(name = "Roles", description = "Role catalog and role assignments")
@RestController
@RequestMapping("/admin/roles")
public class RoleController {

    private final RoleService roleService;
    private final RoleAssignmentService roleAssignmentService;
    private final AccessCheckService accessCheckService;

    public RoleController(RoleService roleService, RoleAssignmentService roleAssignmentService,
                          AccessCheckService accessCheckService) {
        this.roleService = roleService;
        this.roleAssignmentService = roleAssignmentService;
        this.accessCheckService = accessCheckService;
    }

    @Operation(summary = "List roles")
    @GetMapping
    public ResponseEntity<List<RoleResponse>> listRoles(
            @RequestParam(name = "includeInactive", defaultValue = "false") boolean includeInactive
    ) {
        return ResponseEntity.ok(roleService.listRoles(includeInactive));
    }

    @Operation(summary = "Get a role")
    @ApiResponses({
            @ApiResponse(responseCode = "200", description = "Found"),
            @ApiResponse(responseCode = "404", description = "No such role")
    })
    @GetMapping("/{roleId}")
    public ResponseEntity<RoleResponse> getRole(@PathVariable("roleId") UUID roleId) {
        return ResponseEntity.ok(roleService.getRole(roleId));
    }

    @Operation(summary = "Get the default role", description = "The active role granted on registration.")
    @ApiResponses({
            @ApiResponse(responseCode = "200", description = "Found"),
            @ApiResponse(responseCode = "404", description = "No default role configured")
    })
    @GetMapping("/default")
    public ResponseEntity<RoleResponse> getDefaultRole() {
        return roleService.getDefaultRole()
                .map(ResponseEntity::ok)
                .orElseThrow(() -> new NotFoundProblemException("rbac.default_role_not_found", "No default role configured"));
    }

    @Operation(summary = "Get a role by name")
    @GetMapping("/name/{name}")
    public ResponseEntity<RoleResponse> getRoleByName(@PathVariable("name") String name) {
        return ResponseEntity.ok(roleService.getRoleByName(name));
    }

    @Operation(summary = "Check whether a user holds a role")
    @GetMapping("/check/{userId}/{roleName}")
    public ResponseEntity<RoleCheckResponse> checkRole(
            @PathVariable("userId") UUID userId,
            @PathVariable("roleName") String roleName
    ) {
        return ResponseEntity.ok(accessCheckService.checkRole(userId, roleName));
    }

    @Operation(summary = "Check whether a user holds any of the given roles")
    @GetMapping("/check/{userId}")
    public ResponseEntity<RoleCheckResponse> checkAnyRole(
            @PathVariable("userId") UUID userId,
            @RequestParam(name = "anyOf") List<String> anyOf
    ) {
        return ResponseEntity.ok(accessCheckService.checkAnyRole(userId, anyOf));
    }

    @Operation(summary = "Create a role", description = "Creating a default role clears the flag on the previous default.")
    @ApiResponses({
            @ApiResponse(responseCode = "201", description = "Created"),
            @ApiResponse(responseCode = "409", description = "Name already taken")
    })
    @PostMapping
    public ResponseEntity<RoleResponse> createRole(@Valid @RequestBody CreateRoleRequest request, HttpServletRequest httpRequest) {
        RoleResponse response = roleService.createRole(
                new CreateRoleCommand(request.name(), request.description(), request.isDefault(), SecurityUtils.getCurrentUserId()),
                ClientMetadata.from(httpRequest));
        return ResponseEntity.status(HttpStatus.CREATED).body(response);
    }

    @Operation(summary = "Update a role")
    @ApiResponses({
            @ApiResponse(responseCode = "200", description = "Updated"),
            @ApiResponse(responseCode = "404", description = "No such role"),
            @ApiResponse(responseCode = "409", description = "Name already taken")
    })
    @PutMapping("/{roleId}")
    public ResponseEntity<RoleResponse> updateRole(
            @PathVariable("roleId") UUID roleId,
            @Valid @RequestBody UpdateRoleRequest request,
            HttpServletRequest httpRequest
    ) {
        RoleResponse response = roleService.updateRole(roleId,
                new UpdateRoleCommand(request.name(), request.description(), request.isDefault(), SecurityUtils.getCurrentUserId()),
                ClientMetadata.from(httpRequest));
        return ResponseEntity.ok(response);
    }

    @Operation(summary = "Deactivate a role")
    @ApiResponses({
            @ApiResponse(responseCode = "204", description = "Deactivated"),
            @ApiResponse(responseCode = "400", description = "Default role or role still assigned"),
            @ApiResponse(responseCode = "404", description = "No such role")
    })
    @DeleteMapping("/{roleId}")
    public ResponseEntity<Void> deactivateRole(@PathVariable("roleId") UUID roleId, HttpServletRequest httpRequest) {
        roleService.deactivateRole(roleId, SecurityUtils.getCurrentUserId(), ClientMetadata.from(httpRequest));
        return ResponseEntity.noContent().build();
    }

    @Operation(summary = "Assign a role to a user")
    @ApiResponses({
            @ApiResponse(responseCode = "204", description = "Assigned"),
            @ApiResponse(responseCode = "404", description = "User missing or role inactive"),
            @ApiResponse(responseCode = "409", description = "User already holds the role")
    })
    @PostMapping("/{roleId}/assignments")
    public ResponseEntity<Void> assignRole(
            @PathVariable("roleId") UUID roleId,
            @Valid @RequestBody AssignRoleRequest request,
            HttpServletRequest httpRequest
    ) {
        roleAssignmentService.assignRole(
                new AssignRoleCommand(request.userId(), roleId, SecurityUtils.getCurrentUserId(), request.reason(), request.expiresAt()),
                ClientMetadata.from(httpRequest));
        return ResponseEntity.noContent().build();
    }

    @Operation(summary = "Revoke a role from a user")
    @ApiResponses({
            @ApiResponse(responseCode = "204", description = "Revoked"),
            @ApiResponse(responseCode = "404", description = "User does not hold the role")
    })
    @DeleteMapping("/{roleId}/assignments/{userId}")
    public ResponseEntity<Void> revokeRole(
            @PathVariable("roleId") UUID roleId,
            @PathVariable("userId") UUID userId,
            @RequestParam(name = "reason", required = false) String reason,
            HttpServletRequest httpRequest
    ) {
        roleAssignmentService.revokeRole(
                new RevokeRoleCommand(userId, roleId, SecurityUtils.getCurrentUserId(), reason),
                ClientMetadata.from(httpRequest));
        return ResponseEntity.noContent().build();
    }

    @Operation(summary = "Assign a role to many users", description = "Each user succeeds or fails independently.")
    @PostMapping("/{roleId}/bulk-assignments")
    public ResponseEntity<BulkAssignmentResult> bulkAssign(
            @PathVariable("roleId") UUID roleId,
            @Valid @RequestBody BulkAssignRolesRequest request,
            HttpServletRequest httpRequest
    ) {
        BulkAssignmentResult result = roleService.bulkAssignRoles(
                new BulkAssignCommand(roleId, request.userIds(), SecurityUtils.getCurrentUserId(), request.reason(), request.expiresAt()),
                ClientMetadata.from(httpRequest));
        return ResponseEntity.ok(result);
    }
}

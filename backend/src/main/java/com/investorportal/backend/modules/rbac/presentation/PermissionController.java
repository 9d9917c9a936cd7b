package com.investorportal.backend.modules.rbac.presentation;

import java.util.List;
import java.util.UUID;

import com.investorportal.backend.global.security.AuthenticatedPrincipal;
import com.investorportal.backend.global.security.SecurityUtils;
import com.investorportal.backend.global.web.ClientMetadata;
import com.investorportal.backend.modules.rbac.application.AccessCheckService;
import com.investorportal.backend.modules.rbac.application.PermissionService;
import com.investorportal.backend.modules.rbac.application.PermissionService.CreatePermissionCommand;
import com.investorportal.backend.modules.rbac.application.PermissionService.UpdatePermissionCommand;
import com.investorportal.backend.modules.rbac.presentation.dto.CheckPermissionsRequest;
import com.investorportal.backend.modules.rbac.presentation.dto.CreatePermissionRequest;
import com.investorportal.backend.modules.rbac.presentation.dto.PermissionCheckResponse;
import com.investorportal.backend.modules.rbac.presentation.dto.PermissionResponse;
import com.investorportal.backend.modules.rbac.presentation.dto.UpdatePermissionRequest;

import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.responses.ApiResponse;
import io.swagger.v3.oas.annotations.responses.ApiResponses;
import io.swagger.v3.oas.annotations.tags.Tag;

import jakarta.servlet.http.HttpServletRequest;
import jakarta.validation.Valid;

import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.security.core.annotation.AuthenticationPrincipal;
import org.springframework.web.bind.annotation.DeleteMapping;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.PutMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

@Tag(name = "Permissions", description = "Permission catalog and role grants")
@RestController
public class PermissionController {

    private final PermissionService permissionService;
    private final AccessCheckService accessCheckService;

    public PermissionController(PermissionService permissionService, AccessCheckService accessCheckService) {
        this.permissionService = permissionService;
        this.accessCheckService = accessCheckService;
    }

    @Operation(summary = "List permissions")
    @GetMapping("/admin/permissions")
    public ResponseEntity<List<PermissionResponse>> listPermissions(
            @RequestParam(name = "includeInactive", defaultValue = "false") boolean includeInactive
    ) {
        return ResponseEntity.ok(permissionService.listPermissions(includeInactive));
    }

    @Operation(summary = "Create a permission")
    @ApiResponses({
            @ApiResponse(responseCode = "201", description = "Created"),
            @ApiResponse(responseCode = "409", description = "Name already taken")
    })
    @PostMapping("/admin/permissions")
    public ResponseEntity<PermissionResponse> createPermission(
            @Valid @RequestBody CreatePermissionRequest request,
            HttpServletRequest httpRequest
    ) {
        PermissionResponse response = permissionService.createPermission(
                new CreatePermissionCommand(request.name(), request.description(), request.resource(), request.action(),
                        SecurityUtils.getCurrentUserId()),
                ClientMetadata.from(httpRequest));
        return ResponseEntity.status(HttpStatus.CREATED).body(response);
    }

    @Operation(summary = "Update a permission")
    @ApiResponses({
            @ApiResponse(responseCode = "200", description = "Updated"),
            @ApiResponse(responseCode = "400", description = "Deactivating a permission still granted to roles"),
            @ApiResponse(responseCode = "404", description = "No such permission"),
            @ApiResponse(responseCode = "409", description = "Name already taken")
    })
    @PutMapping("/admin/permissions/{permissionId}")
    public ResponseEntity<PermissionResponse> updatePermission(
            @PathVariable("permissionId") UUID permissionId,
            @Valid @RequestBody UpdatePermissionRequest request,
            HttpServletRequest httpRequest
    ) {
        PermissionResponse response = permissionService.updatePermission(permissionId,
                new UpdatePermissionCommand(request.name(), request.description(), request.resource(), request.action(),
                        request.isActive(), SecurityUtils.getCurrentUserId()),
                ClientMetadata.from(httpRequest));
        return ResponseEntity.ok(response);
    }

    @Operation(summary = "Deactivate a permission")
    @ApiResponses({
            @ApiResponse(responseCode = "204", description = "Deactivated"),
            @ApiResponse(responseCode = "400", description = "Still granted to roles"),
            @ApiResponse(responseCode = "404", description = "No such permission")
    })
    @DeleteMapping("/admin/permissions/{permissionId}")
    public ResponseEntity<Void> deactivatePermission(@PathVariable("permissionId") UUID permissionId, HttpServletRequest httpRequest) {
        permissionService.deactivatePermission(permissionId, SecurityUtils.getCurrentUserId(), ClientMetadata.from(httpRequest));
        return ResponseEntity.noContent().build();
    }

    @Operation(summary = "Check the caller's own permissions")
    @PostMapping("/admin/permissions/check/me")
    public ResponseEntity<PermissionCheckResponse> checkOwnPermissions(
            @Valid @RequestBody CheckPermissionsRequest request,
            @AuthenticationPrincipal AuthenticatedPrincipal principal
    ) {
        return ResponseEntity.ok(accessCheckService.checkPermissions(principal.userId(), request.permissions(), request.match()));
    }

    @Operation(summary = "Check a user's permissions")
    @ApiResponses({
            @ApiResponse(responseCode = "200", description = "Checked"),
            @ApiResponse(responseCode = "404", description = "No such user")
    })
    @PostMapping("/admin/permissions/check/{userId}")
    public ResponseEntity<PermissionCheckResponse> checkUserPermissions(
            @PathVariable("userId") UUID userId,
            @Valid @RequestBody CheckPermissionsRequest request
    ) {
        return ResponseEntity.ok(accessCheckService.checkPermissions(userId, request.permissions(), request.match()));
    }

    @Operation(summary = "Grant a permission to a role")
    @ApiResponses({
            @ApiResponse(responseCode = "204", description = "Granted"),
            @ApiResponse(responseCode = "404", description = "Role or permission missing or inactive"),
            @ApiResponse(responseCode = "409", description = "Already granted")
    })
    @PostMapping("/admin/roles/{roleId}/permissions/{permissionId}")
    public ResponseEntity<Void> assignPermission(
            @PathVariable("roleId") UUID roleId,
            @PathVariable("permissionId") UUID permissionId,
            HttpServletRequest httpRequest
    ) {
        permissionService.assignPermissionToRole(roleId, permissionId, SecurityUtils.getCurrentUserId(),
                ClientMetadata.from(httpRequest));
        return ResponseEntity.noContent().build();
    }

    @Operation(summary = "Revoke a permission from a role")
    @DeleteMapping("/admin/roles/{roleId}/permissions/{permissionId}")
    public ResponseEntity<Void> revokePermission(
            @PathVariable("roleId") UUID roleId,
            @PathVariable("permissionId") UUID permissionId,
            HttpServletRequest httpRequest
    ) {
        permissionService.revokePermissionFromRole(roleId, permissionId, SecurityUtils.getCurrentUserId(),
                ClientMetadata.from(httpRequest));
        return ResponseEntity.noContent().build();
    }
}

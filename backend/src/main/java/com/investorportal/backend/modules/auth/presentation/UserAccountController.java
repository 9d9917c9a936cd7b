package com.investorportal.backend.modules.auth.presentation;

import java.util.UUID;

import com.investorportal.backend.global.security.SecurityUtils;
import com.investorportal.backend.global.web.ClientMetadata;
import com.investorportal.backend.modules.auth.application.AuthService;
import com.investorportal.backend.modules.auth.presentation.dto.UpdateUserStatusRequest;
import com.investorportal.backend.modules.auth.presentation.dto.UserStatusResponse;

import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.responses.ApiResponse;
import io.swagger.v3.oas.annotations.responses.ApiResponses;
import io.swagger.v3.oas.annotations.tags.Tag;

import jakarta.servlet.http.HttpServletRequest;
import jakarta.validation.Valid;

import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.PatchMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RestController;

@Tag(name = "Users", description = "Account administration")
@RestController
public class UserAccountController {

    private final AuthService authService;

    public UserAccountController(AuthService authService) {
        this.authService = authService;
    }

    @Operation(summary = "Activate or deactivate an account", description = "Deactivation revokes all of the user's sessions.")
    @ApiResponses({
            @ApiResponse(responseCode = "200", description = "Updated"),
            @ApiResponse(responseCode = "400", description = "Deactivating one's own account"),
            @ApiResponse(responseCode = "404", description = "No such user")
    })
    @PatchMapping("/admin/users/{userId}/status")
    public ResponseEntity<UserStatusResponse> updateStatus(
            @PathVariable("userId") UUID userId,
            @Valid @RequestBody UpdateUserStatusRequest request,
            HttpServletRequest httpRequest
    ) {
        return ResponseEntity.ok(authService.updateUserStatus(userId, request.isActive(),
                SecurityUtils.getCurrentUserId(), ClientMetadata.from(httpRequest)));
    }
}

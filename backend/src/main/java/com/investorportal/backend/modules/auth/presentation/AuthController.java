package com.investorportal.backend.modules.auth.presentation;

import java.util.Map;

import com.investorportal.backend.global.security.SecurityUtils;
import com.investorportal.backend.global.web.ClientMetadata;
import com.investorportal.backend.modules.auth.application.AuthService;
import com.investorportal.backend.modules.auth.presentation.dto.AuthResponse;
import com.investorportal.backend.modules.auth.presentation.dto.LoginRequest;
import com.investorportal.backend.modules.auth.presentation.dto.LogoutRequest;
import com.investorportal.backend.modules.auth.presentation.dto.RefreshRequest;
import com.investorportal.backend.modules.auth.presentation.dto.RegisterRequest;

import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.responses.ApiResponse;
import io.swagger.v3.oas.annotations.responses.ApiResponses;
import io.swagger.v3.oas.annotations.tags.Tag;

import jakarta.servlet.http.HttpServletRequest;
import jakarta.validation.Valid;

import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RestController;

@Tag(name = "Auth", description = "Registration, login and session lifecycle")
@RestController
public class AuthController {

    private final AuthService authService;

    public AuthController(AuthService authService) {
        this.authService = authService;
    }

    @Operation(summary = "Register a new account")
    @ApiResponses({
            @ApiResponse(responseCode = "201", description = "Registered and logged in"),
            @ApiResponse(responseCode = "409", description = "Email already in use")
    })
    @PostMapping("/auth/register")
    public ResponseEntity<AuthResponse> register(@Valid @RequestBody RegisterRequest request, HttpServletRequest httpRequest) {
        AuthResponse response = authService.register(request, ClientMetadata.from(httpRequest));
        return ResponseEntity.status(HttpStatus.CREATED).body(response);
    }

    @Operation(summary = "Log in with email and password")
    @ApiResponses({
            @ApiResponse(responseCode = "200", description = "Logged in"),
            @ApiResponse(responseCode = "401", description = "Invalid credentials")
    })
    @PostMapping("/auth/login")
    public ResponseEntity<AuthResponse> login(@Valid @RequestBody LoginRequest request, HttpServletRequest httpRequest) {
        return ResponseEntity.ok(authService.login(request, ClientMetadata.from(httpRequest)));
    }

    @Operation(summary = "Exchange a refresh token for a new token pair", description = "The presented refresh token is revoked.")
    @ApiResponses({
            @ApiResponse(responseCode = "200", description = "Rotated"),
            @ApiResponse(responseCode = "401", description = "Invalid, expired or already used refresh token")
    })
    @PostMapping("/auth/refresh")
    public ResponseEntity<AuthResponse> refresh(@Valid @RequestBody RefreshRequest request, HttpServletRequest httpRequest) {
        return ResponseEntity.ok(authService.refresh(request.refreshToken(), ClientMetadata.from(httpRequest)));
    }

    @Operation(summary = "Log out the current device")
    @PostMapping("/auth/logout")
    public ResponseEntity<Void> logout(@Valid @RequestBody LogoutRequest request, HttpServletRequest httpRequest) {
        authService.logout(request.refreshToken(), ClientMetadata.from(httpRequest));
        return ResponseEntity.noContent().build();
    }

    @Operation(summary = "Log out every device of the caller")
    @PostMapping("/auth/logout-all")
    public ResponseEntity<Map<String, Integer>> logoutAll(HttpServletRequest httpRequest) {
        int revoked = authService.logoutAll(SecurityUtils.getCurrentUserId(), ClientMetadata.from(httpRequest));
        return ResponseEntity.ok(Map.of("revokedSessions", revoked));
    }
}

package com.investorportal.backend.modules.auth.presentation;

import com.investorportal.backend.global.security.AuthenticatedPrincipal;
import com.investorportal.backend.modules.auth.application.AuthService;
import com.investorportal.backend.modules.auth.presentation.dto.UserProfileResponse;

import io.swagger.v3.oas.annotations.tags.Tag;

import org.springframework.http.ResponseEntity;
import org.springframework.security.core.annotation.AuthenticationPrincipal;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RestController;

@Tag(name = "Auth")
@RestController
public class ProfileController {

    private final AuthService authService;

    public ProfileController(AuthService authService) {
        this.authService = authService;
    }

    @GetMapping("/auth/me")
    public ResponseEntity<UserProfileResponse> currentUser(@AuthenticationPrincipal AuthenticatedPrincipal principal) {
        return ResponseEntity.ok(authService.loadProfile(principal.userId()));
    }
}

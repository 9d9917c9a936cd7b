package com.investorportal.backend.modules.auth.presentation.dto;

import jakarta.validation.constraints.Email;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.Size;

public record RegisterRequest(
        @NotBlank(message = "email is required") @Email(message = "email must be valid") @Size(max = 320) String email,
        @NotBlank(message = "password is required") @Size(min = 8, max = 128, message = "password must be 8 to 128 characters") String password,
        @Size(max = 100) String firstName,
        @Size(max = 100) String lastName
) {
}

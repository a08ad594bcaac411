package com.clinicmate.backend.modules.auth.presentation.dto;

import jakarta.validation.constraints.Email;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.Size;

public record LoginRequest(
        @NotBlank(message = "email is required") @Email @Size(max = 320) String email,
        @NotBlank(message = "password is required") @Size(max = 256) String password
) {
}

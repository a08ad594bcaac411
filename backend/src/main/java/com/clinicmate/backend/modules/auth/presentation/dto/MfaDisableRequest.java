package com.clinicmate.backend.modules.auth.presentation.dto;

import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.Size;

public record MfaDisableRequest(
        @NotBlank(message = "code is required") @Size(max = 32) String code,
        @Size(max = 255) String reason
) {
}

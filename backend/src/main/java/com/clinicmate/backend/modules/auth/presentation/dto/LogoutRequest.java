package com.clinicmate.backend.modules.auth.presentation.dto;

import jakarta.validation.constraints.Size;

public record LogoutRequest(@Size(max = 255) String reason) {
}

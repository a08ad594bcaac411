package com.clinicmate.backend.modules.auth.presentation.dto;

public record MessageResponse(String message) {
}

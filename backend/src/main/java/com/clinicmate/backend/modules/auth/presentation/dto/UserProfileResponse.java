package com.clinicmate.backend.modules.auth.presentation.dto;

import java.util.List;
import java.util.UUID;

import com.clinicmate.backend.modules.auth.application.UserSummary;
import com.fasterxml.jackson.annotation.JsonInclude;

@JsonInclude(JsonInclude.Include.NON_NULL)
public record UserProfileResponse(
        UUID id,
        String email,
        String firstName,
        String lastName,
        List<String> roles,
        List<String> permissions,
        boolean mfaEnabled,
        UUID departmentId,
        String employeeId
) {

    public static UserProfileResponse from(UserSummary user) {
        return new UserProfileResponse(
                user.id(),
                user.email(),
                user.firstName(),
                user.lastName(),
                user.roles(),
                user.permissions(),
                user.mfaEnabled(),
                user.departmentId(),
                user.employeeId()
        );
    }
}

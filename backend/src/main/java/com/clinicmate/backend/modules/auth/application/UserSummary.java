package com.clinicmate.backend.modules.auth.application;

import java.util.List;
import java.util.UUID;

import com.clinicmate.backend.modules.auth.domain.ClinicUser;

public record UserSummary(
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

    public static UserSummary of(ClinicUser user, ResolvedPermissions resolved) {
        return new UserSummary(
                user.getId(),
                user.getEmail(),
                user.getFirstName(),
                user.getLastName(),
                List.copyOf(resolved.roles()),
                List.copyOf(resolved.permissions()),
                user.isMfaEnabled(),
                user.getDepartmentId(),
                user.getEmployeeId()
        );
    }
}

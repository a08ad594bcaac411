package com.clinicmate.backend.modules.auth.application;

import java.time.Clock;
import java.time.OffsetDateTime;
import java.util.Collection;
import java.util.List;
import java.util.SortedSet;
import java.util.TreeSet;
import java.util.UUID;

import com.clinicmate.backend.modules.auth.domain.Permission;
import com.clinicmate.backend.modules.auth.domain.RoleAssignment;
import com.clinicmate.backend.modules.auth.infrastructure.persistence.RoleAssignmentRepository;

import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

/**
 * Unions the permissions of every role reachable through an assignment that is active, inside its
 * validity window and points at an active role. Roles only add; nothing subtracts.
 */
@Service
@Transactional(readOnly = true)
public class PermissionResolver {

    private final RoleAssignmentRepository roleAssignmentRepository;
    private final Clock clock;

    public PermissionResolver(RoleAssignmentRepository roleAssignmentRepository, Clock clock) {
        this.roleAssignmentRepository = roleAssignmentRepository;
        this.clock = clock;
    }

    public ResolvedPermissions resolve(UUID userId) {
        OffsetDateTime now = OffsetDateTime.now(clock);
        List<RoleAssignment> assignments = roleAssignmentRepository.findValidAssignments(userId, now);

        SortedSet<String> roles = new TreeSet<>();
        SortedSet<String> permissions = new TreeSet<>();
        for (RoleAssignment assignment : assignments) {
            // the query filters too; repeated here so a stale row can never widen access
            if (!assignment.isValidAt(now) || !assignment.getRole().isActive()) {
                continue;
            }
            roles.add(assignment.getRole().getCode());
            for (Permission permission : assignment.getRole().getPermissions()) {
                permissions.add(permission.getCode());
            }
        }
        return new ResolvedPermissions(roles, permissions);
    }

    public boolean hasPermission(UUID userId, String permissionCode) {
        return resolve(userId).hasPermission(permissionCode);
    }

    public boolean hasAnyPermission(UUID userId, Collection<String> permissionCodes) {
        return resolve(userId).hasAnyPermission(permissionCodes);
    }

    public boolean hasAllPermissions(UUID userId, Collection<String> permissionCodes) {
        return resolve(userId).hasAllPermissions(permissionCodes);
    }
}

package com.clinicmate.backend.modules.auth.application;

import java.util.Collection;
import java.util.Collections;
import java.util.SortedSet;
import java.util.TreeSet;

/**
 * Effective roles and permissions of a user at one instant. Permission checks are exact code matches.
 */
public record ResolvedPermissions(SortedSet<String> roles, SortedSet<String> permissions) {

    public static final ResolvedPermissions NONE = new ResolvedPermissions(new TreeSet<>(), new TreeSet<>());

    public ResolvedPermissions {
        roles = Collections.unmodifiableSortedSet(new TreeSet<>(roles));
        permissions = Collections.unmodifiableSortedSet(new TreeSet<>(permissions));
    }

    public boolean hasRole(String roleCode) {
        return roles.contains(roleCode);
    }

    public boolean hasPermission(String permissionCode) {
        return permissions.contains(permissionCode);
    }

    public boolean hasAnyPermission(Collection<String> permissionCodes) {
        return permissionCodes.stream().anyMatch(permissions::contains);
    }

    public boolean hasAllPermissions(Collection<String> permissionCodes) {
        return permissions.containsAll(permissionCodes);
    }
}

package com.warden.security;

import java.util.List;
import java.util.Set;
import java.util.UUID;

/**
 * What an authenticated caller may access.
 * <p>
 * Built once per call from the caller's claims and store rows. A caller
 * without a user row gets {@link #empty(boolean)}: it is not an error to be
 * unknown, later checks reject the call if the permissions are insufficient.
 *
 * @param userId         the caller's user id (null when the user row does not exist yet)
 * @param projectIds     projects the caller holds a role on
 * @param roleBindings   every role binding of the caller
 * @param organizationId organisation of the first role binding (nullable)
 * @param superadmin     whether the caller's claims carry the superadmin realm role
 */
public record UserPermissions(
        UUID userId,
        Set<UUID> projectIds,
        List<RoleBinding> roleBindings,
        UUID organizationId,
        boolean superadmin
) {

    public UserPermissions {
        projectIds = projectIds == null ? Set.of() : Set.copyOf(projectIds);
        roleBindings = roleBindings == null ? List.of() : List.copyOf(roleBindings);
    }

    /** Permissions for a caller with no user row. */
    public static UserPermissions empty(boolean superadmin) {
        return new UserPermissions(null, Set.of(), List.of(), null, superadmin);
    }

    public boolean hasProject(UUID projectId) {
        return projectIds.contains(projectId);
    }

    /** Whether any role binding makes the caller an administrator of {@code projectId}. */
    public boolean isAdminOn(UUID projectId) {
        return roleBindings.stream().anyMatch(binding -> binding.isAdminOn(projectId));
    }
}

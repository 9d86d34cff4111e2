package com.warden.security;

import java.util.UUID;

/**
 * Checks a caller's permissions against a target project.
 * <p>
 * Superadmins pass every check, including owner-only ones.
 */
public final class ProjectAccessEnforcer {

    static final String NOT_AUTHORIZED = "user is not authorized to access this project";
    static final String NOT_ADMIN = "user is not an administrator on this project";

    private ProjectAccessEnforcer() {
        // utility class
    }

    /**
     * Verifies that the caller may act on the project.
     *
     * @param permissions the caller's permissions
     * @param projectId   the resolved target project
     * @param ownerOnly   whether administrator rights on the project are required
     * @throws ProjectAccessDeniedException if access is not allowed
     */
    public static void enforce(UserPermissions permissions, UUID projectId, boolean ownerOnly) {
        if (permissions.superadmin()) {
            return;
        }
        if (!permissions.hasProject(projectId)) {
            throw new ProjectAccessDeniedException(projectId, NOT_AUTHORIZED);
        }
        if (ownerOnly && !permissions.isAdminOn(projectId)) {
            throw new ProjectAccessDeniedException(projectId, NOT_ADMIN);
        }
    }
}

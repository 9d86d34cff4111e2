package com.warden.security;

import java.util.UUID;

/**
 * A role held by a user, as loaded from the store.
 *
 * @param role           the role granted
 * @param isAdmin        whether the binding grants administrator rights
 * @param organizationId root project of the tree the binding belongs to
 * @param projectId      project the binding applies to (nullable for organisation-wide bindings)
 */
public record RoleBinding(Role role, boolean isAdmin, UUID organizationId, UUID projectId) {

    /** Whether this binding makes its holder an administrator of {@code project}. */
    public boolean isAdminOn(UUID project) {
        return isAdmin && project != null && project.equals(projectId);
    }
}

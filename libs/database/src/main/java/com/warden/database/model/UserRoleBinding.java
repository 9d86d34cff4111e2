package com.warden.database.model;

import java.util.UUID;

/**
 * Stored grant of a role on a project.
 *
 * @param organizationId root project of {@code projectId}
 */
public record UserRoleBinding(
        UUID userId, UUID projectId, UUID organizationId, String role, boolean isAdmin) {}

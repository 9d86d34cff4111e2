package com.warden.database.model;

import java.util.UUID;

/**
 * A role binding on a project together with the subject of the user holding it.
 */
public record RoleAssignment(UUID userId, String subject, UUID projectId, String role, boolean isAdmin) {}

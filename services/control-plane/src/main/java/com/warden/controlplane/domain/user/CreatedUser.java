package com.warden.controlplane.domain.user;

import java.time.Instant;
import java.util.UUID;

/**
 * Result of enrolling a user.
 *
 * @param projectId first project the user was made admin of, null when none was provisioned
 */
public record CreatedUser(
        UUID userId, String subject, UUID projectId, String projectName, Instant createdAt) {}

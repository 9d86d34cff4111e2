package com.warden.database.model;

import java.time.Instant;
import java.util.UUID;

/** An outstanding invitation to join a project with a role. */
public record Invitation(
        String code,
        String email,
        String role,
        UUID projectId,
        UUID sponsorUserId,
        Instant createdAt,
        Instant updatedAt) {}

package com.warden.database.model;

import java.time.Instant;
import java.util.UUID;

/**
 * Profile header row. Per-entity rules live in {@link EntityProfile}.
 *
 * @param remediate action mode string, nullable when unset
 * @param alert     action mode string, nullable when unset
 */
public record Profile(
        UUID id,
        UUID projectId,
        String provider,
        String name,
        String remediate,
        String alert,
        Instant createdAt,
        Instant updatedAt) {}

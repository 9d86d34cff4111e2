package com.warden.database.model;

import java.time.Instant;
import java.util.UUID;

/**
 * @param definition JSON-encoded rule type definition
 * @param guidance   sanitised markdown shown on failing evaluations
 */
public record RuleType(
        UUID id,
        UUID projectId,
        String provider,
        String name,
        String description,
        String definition,
        String guidance,
        Instant createdAt,
        Instant updatedAt) {}

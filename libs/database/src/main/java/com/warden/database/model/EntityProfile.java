package com.warden.database.model;

import java.time.Instant;
import java.util.UUID;

/**
 * Rules a profile applies to one entity kind.
 *
 * @param contextualRules JSON array of rule references, in declaration order
 */
public record EntityProfile(
        UUID id, UUID profileId, String entity, String contextualRules, Instant createdAt) {}

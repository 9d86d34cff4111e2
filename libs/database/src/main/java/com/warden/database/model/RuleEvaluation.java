package com.warden.database.model;

import java.time.Instant;
import java.util.UUID;

/**
 * Latest evaluation of one rule against one entity, joined with the repository and artifact
 * columns used to describe the entity. The joined columns are null when the entity row is missing
 * or of another kind.
 */
public record RuleEvaluation(
        UUID id,
        UUID profileId,
        UUID ruleTypeId,
        String ruleTypeName,
        String ruleName,
        String entityKind,
        UUID entityId,
        String evalStatus,
        String evalDetails,
        String remediationStatus,
        String remediationDetails,
        String alertStatus,
        String alertDetails,
        Instant lastUpdated,
        String provider,
        String repoOwner,
        String repoName,
        Long repoId,
        String artifactName,
        String artifactType) {}

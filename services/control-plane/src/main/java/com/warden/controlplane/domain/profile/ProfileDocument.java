package com.warden.controlplane.domain.profile;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.warden.controlplane.domain.EntityKind;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;

/**
 * A profile as exchanged with callers: a named set of rules per entity kind.
 *
 * <p>On create and update, {@code projectId} and {@code provider} come from the call's entity
 * context; {@code id} selects the profile to update when set.
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record ProfileDocument(
        @JsonProperty("id") String id,
        @JsonProperty("name") String name,
        @JsonProperty("project_id") String projectId,
        @JsonProperty("provider") String provider,
        @JsonProperty("remediate") String remediate,
        @JsonProperty("alert") String alert,
        @JsonProperty("repository") List<RuleRef> repository,
        @JsonProperty("artifact") List<RuleRef> artifact,
        @JsonProperty("build_environment") List<RuleRef> buildEnvironment,
        @JsonProperty("pull_request") List<RuleRef> pullRequest) {

    /** Rules for one entity kind; never null. */
    public List<RuleRef> rulesFor(EntityKind kind) {
        List<RuleRef> rules =
                switch (kind) {
                    case REPOSITORY -> repository;
                    case ARTIFACT -> artifact;
                    case BUILD_ENVIRONMENT -> buildEnvironment;
                    case PULL_REQUEST -> pullRequest;
                };
        return rules == null ? List.of() : rules;
    }

    /** All rules keyed by entity kind, in declaration order of {@link EntityKind}. */
    public Map<EntityKind, List<RuleRef>> rulesByEntity() {
        Map<EntityKind, List<RuleRef>> rules = new EnumMap<>(EntityKind.class);
        for (EntityKind kind : EntityKind.values()) {
            rules.put(kind, rulesFor(kind));
        }
        return rules;
    }

    /** A copy with every rule carrying its effective name. */
    public ProfileDocument withRuleNames() {
        return new ProfileDocument(
                id,
                name,
                projectId,
                provider,
                remediate,
                alert,
                named(repository),
                named(artifact),
                named(buildEnvironment),
                named(pullRequest));
    }

    /** A copy bound to a stored profile. */
    public ProfileDocument withIdentity(String id, String projectId, String provider) {
        return new ProfileDocument(
                id,
                name,
                projectId,
                provider,
                remediate,
                alert,
                repository,
                artifact,
                buildEnvironment,
                pullRequest);
    }

    private static List<RuleRef> named(List<RuleRef> rules) {
        return rules == null ? null : rules.stream().map(RuleRef::withEffectiveName).toList();
    }
}

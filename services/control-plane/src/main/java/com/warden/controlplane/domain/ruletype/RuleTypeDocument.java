package com.warden.controlplane.domain.ruletype;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * A rule type as exchanged with callers. On create and update, {@code id}, {@code projectId} and
 * {@code provider} are ignored: they come from the stored row and the call's entity context.
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record RuleTypeDocument(
        @JsonProperty("id") String id,
        @JsonProperty("name") String name,
        @JsonProperty("project_id") String projectId,
        @JsonProperty("provider") String provider,
        @JsonProperty("description") String description,
        @JsonProperty("def") RuleTypeDefinition def,
        @JsonProperty("guidance") String guidance) {

    /** A document with only the caller-supplied fields set. */
    public static RuleTypeDocument of(
            String name, String description, RuleTypeDefinition def, String guidance) {
        return new RuleTypeDocument(null, name, null, null, description, def, guidance);
    }
}

package com.warden.controlplane.domain.profile;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.databind.JsonNode;

/**
 * One rule of a profile: a rule type instantiated with a definition and optional parameters.
 *
 * @param type rule type name
 * @param name rule name; an unnamed rule is named after its type
 * @param params parameters validated against the rule type's param schema
 * @param def rule definition validated against the rule type's rule schema
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record RuleRef(
        @JsonProperty("type") String type,
        @JsonProperty("name") String name,
        @JsonProperty("params") JsonNode params,
        @JsonProperty("def") JsonNode def) {

    /** The rule's effective name. */
    public String effectiveName() {
        return name == null || name.isEmpty() ? type : name;
    }

    public RuleRef withEffectiveName() {
        return new RuleRef(type, effectiveName(), params, def);
    }
}

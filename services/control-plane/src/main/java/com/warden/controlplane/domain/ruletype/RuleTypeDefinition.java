package com.warden.controlplane.domain.ruletype;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.databind.JsonNode;

/**
 * How a rule type ingests, evaluates and optionally remediates and alerts.
 *
 * <p>Only the fields the control plane checks are typed; ingest, eval, remediate and alert
 * configuration is kept as raw JSON for the evaluators.
 *
 * @param inEntity entity kind the rule applies to
 * @param ruleSchema JSON Schema of the per-profile rule definition
 * @param paramSchema JSON Schema of the rule parameters (nullable)
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record RuleTypeDefinition(
        @JsonProperty("in_entity") String inEntity,
        @JsonProperty("rule_schema") JsonNode ruleSchema,
        @JsonProperty("param_schema") JsonNode paramSchema,
        @JsonProperty("ingest") JsonNode ingest,
        @JsonProperty("eval") JsonNode eval,
        @JsonProperty("remediate") JsonNode remediate,
        @JsonProperty("alert") JsonNode alert) {}

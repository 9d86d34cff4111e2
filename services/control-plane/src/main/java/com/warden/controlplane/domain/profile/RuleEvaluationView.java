package com.warden.controlplane.domain.profile;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
import java.time.Instant;
import java.util.Map;

/**
 * Latest result of one rule against one entity.
 *
 * @param entityInfo human-readable description of the entity, e.g. repository owner and name
 * @param guidance rule type guidance, set only for failing or erroring evaluations
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record RuleEvaluationView(
        @JsonProperty("profile_id") String profileId,
        @JsonProperty("rule_type_id") String ruleTypeId,
        @JsonProperty("rule_type_name") String ruleTypeName,
        @JsonProperty("rule_name") String ruleName,
        @JsonProperty("entity") String entity,
        @JsonProperty("entity_id") String entityId,
        @JsonProperty("entity_info") Map<String, String> entityInfo,
        @JsonProperty("status") String status,
        @JsonProperty("details") String details,
        @JsonProperty("remediation_status") String remediationStatus,
        @JsonProperty("remediation_details") String remediationDetails,
        @JsonProperty("alert_status") String alertStatus,
        @JsonProperty("alert_details") String alertDetails,
        @JsonProperty("guidance") String guidance,
        @JsonProperty("last_updated") Instant lastUpdated) {}

package com.warden.controlplane.api.ruletype;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.warden.controlplane.api.ContextV1;
import com.warden.controlplane.api.ContextV2;
import com.warden.controlplane.api.HasProjectContext;
import com.warden.controlplane.domain.ruletype.RuleTypeDocument;
import java.util.List;

/** Request and response messages of {@code warden.v1.RuleTypeService}. */
public final class RuleTypeMessages {

    private RuleTypeMessages() {}

    public record CreateRuleTypeRequest(
            @JsonProperty("context") ContextV1 context,
            @JsonProperty("context_v2") ContextV2 contextV2,
            @JsonProperty("rule_type") RuleTypeDocument ruleType)
            implements HasProjectContext {}

    public record UpdateRuleTypeRequest(
            @JsonProperty("context") ContextV1 context,
            @JsonProperty("context_v2") ContextV2 contextV2,
            @JsonProperty("rule_type") RuleTypeDocument ruleType)
            implements HasProjectContext {}

    public record DeleteRuleTypeRequest(
            @JsonProperty("context") ContextV1 context,
            @JsonProperty("context_v2") ContextV2 contextV2,
            @JsonProperty("id") String id)
            implements HasProjectContext {}

    public record ListRuleTypesRequest(
            @JsonProperty("context") ContextV1 context,
            @JsonProperty("context_v2") ContextV2 contextV2)
            implements HasProjectContext {}

    public record GetRuleTypeByNameRequest(
            @JsonProperty("context") ContextV1 context,
            @JsonProperty("context_v2") ContextV2 contextV2,
            @JsonProperty("name") String name)
            implements HasProjectContext {}

    public record GetRuleTypeByIdRequest(
            @JsonProperty("context") ContextV1 context,
            @JsonProperty("context_v2") ContextV2 contextV2,
            @JsonProperty("id") String id)
            implements HasProjectContext {}

    @JsonInclude(JsonInclude.Include.NON_NULL)
    public record RuleTypeResponse(@JsonProperty("rule_type") RuleTypeDocument ruleType) {}

    public record ListRuleTypesResponse(
            @JsonProperty("rule_types") List<RuleTypeDocument> ruleTypes) {}
}

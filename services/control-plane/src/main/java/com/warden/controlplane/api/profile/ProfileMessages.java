package com.warden.controlplane.api.profile;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.warden.controlplane.api.ContextV1;
import com.warden.controlplane.api.ContextV2;
import com.warden.controlplane.api.HasProjectContext;
import com.warden.controlplane.domain.profile.EvaluationSelector;
import com.warden.controlplane.domain.profile.ProfileDocument;
import com.warden.controlplane.domain.profile.ProfileStatusView;
import com.warden.controlplane.domain.profile.RuleEvaluationView;
import java.util.List;

/** Request and response messages of {@code warden.v1.ProfileService}. */
public final class ProfileMessages {

    private ProfileMessages() {}

    public record CreateProfileRequest(
            @JsonProperty("context") ContextV1 context,
            @JsonProperty("context_v2") ContextV2 contextV2,
            @JsonProperty("profile") ProfileDocument profile)
            implements HasProjectContext {}

    public record UpdateProfileRequest(
            @JsonProperty("context") ContextV1 context,
            @JsonProperty("context_v2") ContextV2 contextV2,
            @JsonProperty("profile") ProfileDocument profile)
            implements HasProjectContext {}

    public record DeleteProfileRequest(
            @JsonProperty("context") ContextV1 context,
            @JsonProperty("context_v2") ContextV2 contextV2,
            @JsonProperty("id") String id)
            implements HasProjectContext {}

    public record ListProfilesRequest(
            @JsonProperty("context") ContextV1 context,
            @JsonProperty("context_v2") ContextV2 contextV2)
            implements HasProjectContext {}

    public record GetProfileByIdRequest(
            @JsonProperty("context") ContextV1 context,
            @JsonProperty("context_v2") ContextV2 contextV2,
            @JsonProperty("id") String id)
            implements HasProjectContext {}

    public record GetProfileByNameRequest(
            @JsonProperty("context") ContextV1 context,
            @JsonProperty("context_v2") ContextV2 contextV2,
            @JsonProperty("name") String name)
            implements HasProjectContext {}

    /**
     * Status of one profile, optionally narrowed to one entity or one rule.
     *
     * @param entity entity whose evaluations to return; {@code null} for all
     * @param ruleName rule whose evaluations to return; {@code null} for all
     */
    public record GetProfileStatusByNameRequest(
            @JsonProperty("context") ContextV1 context,
            @JsonProperty("context_v2") ContextV2 contextV2,
            @JsonProperty("name") String name,
            @JsonProperty("entity") EntityTypedId entity,
            @JsonProperty("rule_name") String ruleName)
            implements HasProjectContext {

        EvaluationSelector evaluationSelector() {
            if (entity == null) {
                return new EvaluationSelector(null, null, ruleName);
            }
            return new EvaluationSelector(entity.type(), entity.id(), ruleName);
        }
    }

    public record GetProfileStatusByProjectRequest(
            @JsonProperty("context") ContextV1 context,
            @JsonProperty("context_v2") ContextV2 contextV2)
            implements HasProjectContext {}

    /** @param type entity kind, e.g. {@code repository} */
    public record EntityTypedId(@JsonProperty("type") String type, @JsonProperty("id") String id) {}

    @JsonInclude(JsonInclude.Include.NON_NULL)
    public record ProfileResponse(@JsonProperty("profile") ProfileDocument profile) {}

    public record ListProfilesResponse(
            @JsonProperty("profiles") List<ProfileDocument> profiles) {}

    public record GetProfileStatusByNameResponse(
            @JsonProperty("profile_status") ProfileStatusView profileStatus,
            @JsonProperty("rule_evaluation_status") List<RuleEvaluationView> evaluations) {}

    public record GetProfileStatusByProjectResponse(
            @JsonProperty("profile_status") List<ProfileStatusView> profileStatus) {}
}

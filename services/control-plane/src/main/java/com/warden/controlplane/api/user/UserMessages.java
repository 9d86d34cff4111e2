package com.warden.controlplane.api.user;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.warden.controlplane.api.ContextV1;
import com.warden.controlplane.api.ContextV2;
import com.warden.controlplane.api.HasProjectContext;
import com.warden.controlplane.api.ProjectSummary;
import java.time.Instant;
import java.util.List;

/** Request and response messages of {@code warden.v1.UserService}. */
public final class UserMessages {

    private UserMessages() {}

    public record CreateUserRequest() {}

    @JsonInclude(JsonInclude.Include.NON_NULL)
    public record CreateUserResponse(
            @JsonProperty("id") String id,
            @JsonProperty("subject") String subject,
            @JsonProperty("project_id") String projectId,
            @JsonProperty("project_name") String projectName,
            @JsonProperty("created_at") Instant createdAt) {}

    public record GetUserRequest() {}

    public record GetUserResponse(
            @JsonProperty("user") UserRecord user,
            @JsonProperty("projects") List<ProjectSummary> projects,
            @JsonProperty("project_roles") List<ProjectRole> projectRoles) {}

    @JsonInclude(JsonInclude.Include.NON_NULL)
    public record UserRecord(
            @JsonProperty("id") String id,
            @JsonProperty("subject") String subject,
            @JsonProperty("display_name") String displayName,
            @JsonProperty("created_at") Instant createdAt) {}

    public record ProjectRole(
            @JsonProperty("project_id") String projectId,
            @JsonProperty("role") String role) {}

    public record DeleteUserRequest() {}

    public record CreateInvitationRequest(
            @JsonProperty("context") ContextV1 context,
            @JsonProperty("context_v2") ContextV2 contextV2,
            @JsonProperty("email") String email,
            @JsonProperty("role") String role)
            implements HasProjectContext {}

    public record CreateInvitationResponse(
            @JsonProperty("code") String code,
            @JsonProperty("email") String email,
            @JsonProperty("role") String role,
            @JsonProperty("project_id") String projectId,
            @JsonProperty("expires_at") Instant expiresAt) {}

    /** @param accept {@code true} to join the project, {@code false} to decline */
    public record ResolveInvitationRequest(
            @JsonProperty("code") String code, @JsonProperty("accept") boolean accept) {}

    @JsonInclude(JsonInclude.Include.NON_NULL)
    public record ResolveInvitationResponse(
            @JsonProperty("role") String role,
            @JsonProperty("project") String project,
            @JsonProperty("project_display") String projectDisplay,
            @JsonProperty("email") String email,
            @JsonProperty("is_accepted") boolean accepted) {}
}

package com.warden.controlplane.api.permissions;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.warden.controlplane.api.ContextV1;
import com.warden.controlplane.api.ContextV2;
import com.warden.controlplane.api.HasProjectContext;
import java.util.List;

/** Request and response messages of {@code warden.v1.PermissionsService}. */
public final class PermissionsMessages {

    private PermissionsMessages() {}

    public record RoleInfo(
            @JsonProperty("name") String name,
            @JsonProperty("display_name") String displayName,
            @JsonProperty("description") String description) {}

    /** @param project filled in on responses; requests target the context project */
    @JsonInclude(JsonInclude.Include.NON_NULL)
    public record RoleAssignmentMessage(
            @JsonProperty("role") String role,
            @JsonProperty("subject") String subject,
            @JsonProperty("project") String project) {}

    public record ListRolesRequest(
            @JsonProperty("context") ContextV1 context,
            @JsonProperty("context_v2") ContextV2 contextV2)
            implements HasProjectContext {}

    public record ListRolesResponse(@JsonProperty("roles") List<RoleInfo> roles) {}

    public record ListRoleAssignmentsRequest(
            @JsonProperty("context") ContextV1 context,
            @JsonProperty("context_v2") ContextV2 contextV2)
            implements HasProjectContext {}

    public record ListRoleAssignmentsResponse(
            @JsonProperty("role_assignments") List<RoleAssignmentMessage> roleAssignments) {}

    public record AssignRoleRequest(
            @JsonProperty("context") ContextV1 context,
            @JsonProperty("context_v2") ContextV2 contextV2,
            @JsonProperty("role_assignment") RoleAssignmentMessage roleAssignment)
            implements HasProjectContext {}

    public record AssignRoleResponse(
            @JsonProperty("role_assignment") RoleAssignmentMessage roleAssignment) {}

    public record RemoveRoleRequest(
            @JsonProperty("context") ContextV1 context,
            @JsonProperty("context_v2") ContextV2 contextV2,
            @JsonProperty("role_assignment") RoleAssignmentMessage roleAssignment)
            implements HasProjectContext {}

    public record RemoveRoleResponse(
            @JsonProperty("role_assignment") RoleAssignmentMessage roleAssignment) {}
}

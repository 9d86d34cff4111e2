package com.warden.controlplane.api.project;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.warden.controlplane.api.ContextV1;
import com.warden.controlplane.api.ContextV2;
import com.warden.controlplane.api.HasProjectContext;
import com.warden.controlplane.api.ProjectSummary;
import java.util.List;

/** Request and response messages of {@code warden.v1.ProjectService}. */
public final class ProjectMessages {

    private ProjectMessages() {}

    /** Creates {@code name} as a child of the context project. */
    public record CreateProjectRequest(
            @JsonProperty("context") ContextV1 context,
            @JsonProperty("context_v2") ContextV2 contextV2,
            @JsonProperty("name") String name)
            implements HasProjectContext {}

    public record CreateProjectResponse(@JsonProperty("project") ProjectSummary project) {}

    public record ListProjectsRequest() {}

    public record ListChildProjectsRequest(
            @JsonProperty("context") ContextV1 context,
            @JsonProperty("context_v2") ContextV2 contextV2)
            implements HasProjectContext {}

    public record ListProjectsResponse(@JsonProperty("projects") List<ProjectSummary> projects) {}

    public record DeleteProjectRequest(
            @JsonProperty("context") ContextV1 context,
            @JsonProperty("context_v2") ContextV2 contextV2)
            implements HasProjectContext {}

    public record DeleteProjectResponse(@JsonProperty("project_id") String projectId) {}
}

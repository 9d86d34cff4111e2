package com.warden.controlplane.api;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.warden.controlplane.domain.project.ProjectMetadata;
import com.warden.database.model.Project;
import java.time.Instant;

/** A project as returned by the user and project APIs. */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record ProjectSummary(
        @JsonProperty("project_id") String projectId,
        @JsonProperty("name") String name,
        @JsonProperty("display_name") String displayName,
        @JsonProperty("parent_id") String parentId,
        @JsonProperty("created_at") Instant createdAt) {

    public static ProjectSummary of(ObjectMapper mapper, Project project) {
        return new ProjectSummary(
                project.id().toString(),
                project.name(),
                ProjectMetadata.displayName(mapper, project),
                project.parentId() == null ? null : project.parentId().toString(),
                project.createdAt());
    }
}

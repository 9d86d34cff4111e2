package com.warden.controlplane.domain.project;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.warden.controlplane.domain.ServiceException;
import com.warden.database.model.Project;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * The free-form metadata document stored with a project. Only {@code public.display_name} is
 * interpreted.
 */
public final class ProjectMetadata {

    private static final Logger log = LoggerFactory.getLogger(ProjectMetadata.class);

    private ProjectMetadata() {
        // utility class
    }

    public static String withDisplayName(ObjectMapper mapper, String displayName) {
        ObjectNode metadata = mapper.createObjectNode();
        metadata.putObject("public").put("display_name", displayName);
        try {
            return mapper.writeValueAsString(metadata);
        } catch (JsonProcessingException e) {
            throw ServiceException.internal("cannot encode project metadata", e);
        }
    }

    /** The display name, falling back to the project name when unset or unreadable. */
    public static String displayName(ObjectMapper mapper, Project project) {
        if (project.metadata() == null || project.metadata().isBlank()) {
            return project.name();
        }
        try {
            JsonNode name = mapper.readTree(project.metadata()).path("public").path("display_name");
            return name.isTextual() && !name.asText().isEmpty() ? name.asText() : project.name();
        } catch (JsonProcessingException e) {
            log.warn("Unreadable metadata on project {}", project.id(), e);
            return project.name();
        }
    }
}

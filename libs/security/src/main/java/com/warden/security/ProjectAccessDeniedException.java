package com.warden.security;

import java.util.UUID;

/**
 * Thrown when a caller targets a project it may not access, or needs
 * administrator rights on it and has none.
 * <p>
 * The message is safe to return to the caller.
 */
public class ProjectAccessDeniedException extends RuntimeException {

    private final UUID projectId;

    public ProjectAccessDeniedException(UUID projectId, String message) {
        super(message);
        this.projectId = projectId;
    }

    public UUID projectId() {
        return projectId;
    }
}

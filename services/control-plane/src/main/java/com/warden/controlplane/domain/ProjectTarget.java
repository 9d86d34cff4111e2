package com.warden.controlplane.domain;

import java.util.Objects;
import java.util.UUID;

/**
 * The project a call names and the provider it asked for, before the caller is authorized.
 *
 * @param projectId requested or default project
 * @param requestedProvider provider name from the request, null when omitted
 */
public record ProjectTarget(UUID projectId, String requestedProvider) {

    public ProjectTarget {
        Objects.requireNonNull(projectId, "projectId must not be null");
    }
}

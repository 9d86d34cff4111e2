package com.warden.controlplane.domain;

import java.util.Objects;
import java.util.Optional;
import java.util.UUID;

/**
 * The project and provider a call acts on, resolved once per call before the handler runs.
 *
 * @param projectId resolved project
 * @param provider provider name, null when the project has no provider and none was requested
 */
public record EntityContext(UUID projectId, String provider) {

    public EntityContext {
        Objects.requireNonNull(projectId, "projectId must not be null");
    }

    public Optional<String> providerIfSet() {
        return provider == null || provider.isEmpty() ? Optional.empty() : Optional.of(provider);
    }

    /** The provider name, or {@code NotFound "provider not found"} when the context has none. */
    public String requireProvider() {
        return providerIfSet().orElseThrow(() -> ServiceException.notFound("provider not found"));
    }
}

package com.warden.database.model;

import java.time.Instant;
import java.util.List;
import java.util.UUID;

/**
 * A configured source-code or artifact provider of a project.
 *
 * @param providerClass provider implementation, e.g. {@code github-app}
 * @param traits        capabilities the provider implements, e.g. {@code git}, {@code rest}
 * @param definition    opaque JSON configuration
 */
public record Provider(
        UUID id,
        UUID projectId,
        String name,
        String providerClass,
        List<String> traits,
        String version,
        String definition,
        Instant createdAt) {

    public Provider {
        traits = traits == null ? List.of() : List.copyOf(traits);
    }
}

package com.warden.controlplane.domain;

import com.warden.database.model.Provider;
import java.util.List;
import java.util.Optional;

/** Picks the provider a call refers to among the providers of its project. */
public final class ProviderResolver {

    private ProviderResolver() {
        // utility class
    }

    /**
     * Resolves the requested provider.
     *
     * <ul>
     *   <li>A name must match a provider of the project.
     *   <li>Without a name, a project with exactly one provider resolves to it.
     *   <li>Without a name, a project with no provider resolves to empty.
     * </ul>
     *
     * @param providers providers of the project
     * @param requestedName requested provider name, null or empty when omitted
     * @throws ServiceException {@code BAD_REQUEST} when the name matches nothing or the choice is
     *     ambiguous
     */
    public static Optional<Provider> resolve(List<Provider> providers, String requestedName) {
        if (requestedName != null && !requestedName.isEmpty()) {
            return Optional.of(
                    find(providers, requestedName)
                            .orElseThrow(
                                    () -> ServiceException.badRequest("invalid provider name")));
        }
        if (providers.size() == 1) {
            return Optional.of(providers.get(0));
        }
        if (providers.isEmpty()) {
            return Optional.empty();
        }
        throw ServiceException.badRequest(
                String.format(
                        "cannot infer provider, there are %d providers available",
                        providers.size()));
    }

    /** Lookup by exact name; empty means the caller may provision a new provider. */
    public static Optional<Provider> find(List<Provider> providers, String name) {
        return providers.stream().filter(p -> p.name().equals(name)).findFirst();
    }
}

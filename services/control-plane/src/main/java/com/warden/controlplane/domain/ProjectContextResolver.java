package com.warden.controlplane.domain;

import com.warden.database.Store;
import com.warden.database.StoreException;
import com.warden.database.model.Provider;
import com.warden.security.UserPermissions;
import java.util.List;
import java.util.UUID;

/**
 * Turns the request context of a project-scoped call into an {@link EntityContext}.
 *
 * <p>The project is the v2 {@code project_id} when given, otherwise the v1 {@code project},
 * otherwise the only project the caller holds. A given id must be well-formed, even when the other
 * version carries a valid one. Access to the project is not checked here, so the provider is
 * only resolved once the call has been authorized.
 */
public class ProjectContextResolver {

    private final Store store;

    public ProjectContextResolver(Store store) {
        this.store = store;
    }

    /**
     * Resolves the project and the requested provider name. Providers are not read, so nothing
     * about the project is revealed before the caller is authorized.
     */
    public ProjectTarget resolveTarget(ContextSelector selector, UserPermissions permissions) {
        if (selector == null || selector.isEmpty()) {
            throw ServiceException.badRequest("context cannot be nil");
        }
        return new ProjectTarget(
                resolveProject(selector, permissions), requestedProvider(selector));
    }

    /** Picks the provider of an authorized target; see {@link ProviderResolver#resolve}. */
    public EntityContext resolveProvider(ProjectTarget target) {
        List<Provider> providers;
        try {
            providers = store.querier().listProvidersByProjectId(target.projectId());
        } catch (StoreException e) {
            throw ServiceException.internal("cannot list providers of project", e);
        }
        String provider =
                ProviderResolver.resolve(providers, target.requestedProvider())
                        .map(Provider::name)
                        .orElse(null);
        return new EntityContext(target.projectId(), provider);
    }

    /** Both steps at once, for callers that have already checked access. */
    public EntityContext resolve(ContextSelector selector, UserPermissions permissions) {
        return resolveProvider(resolveTarget(selector, permissions));
    }

    static UUID resolveProject(ContextSelector selector, UserPermissions permissions) {
        if (selector.v2() != null && hasText(selector.v2().project())) {
            return parseProject(selector.v2().project());
        }
        if (selector.v1() != null && hasText(selector.v1().project())) {
            return parseProject(selector.v1().project());
        }
        if (permissions.projectIds().size() == 1) {
            return permissions.projectIds().iterator().next();
        }
        throw ServiceException.badRequest("cannot get default project");
    }

    private static String requestedProvider(ContextSelector selector) {
        if (selector.v2() != null && hasText(selector.v2().provider())) {
            return selector.v2().provider();
        }
        if (selector.v1() != null && hasText(selector.v1().provider())) {
            return selector.v1().provider();
        }
        return null;
    }

    private static UUID parseProject(String value) {
        return Uuids.parse(value)
                .orElseThrow(() -> ServiceException.badRequest("malformed project ID"));
    }

    private static boolean hasText(String value) {
        return value != null && !value.isBlank();
    }
}

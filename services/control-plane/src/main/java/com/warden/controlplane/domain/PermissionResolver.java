package com.warden.controlplane.domain;

import com.warden.database.NoRowsException;
import com.warden.database.Querier;
import com.warden.database.Store;
import com.warden.database.StoreException;
import com.warden.database.model.Project;
import com.warden.database.model.User;
import com.warden.database.model.UserRoleBinding;
import com.warden.security.Role;
import com.warden.security.RoleBinding;
import com.warden.security.TokenClaims;
import com.warden.security.UserPermissions;
import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Optional;
import java.util.Set;
import java.util.UUID;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Loads what an authenticated caller may access.
 *
 * <p>An unknown subject is not an error: the caller gets empty permissions, and project-scoped
 * calls are then rejected by the authorization stage. Store failures are logged and also yield
 * empty permissions.
 */
public class PermissionResolver {

    private static final Logger log = LoggerFactory.getLogger(PermissionResolver.class);

    private final Store store;

    public PermissionResolver(Store store) {
        this.store = store;
    }

    public UserPermissions resolve(TokenClaims claims) {
        boolean superadmin = claims.isSuperadmin();
        Querier querier = store.querier();
        try {
            User user = querier.getUserBySubject(claims.subject());

            Set<UUID> projectIds = new LinkedHashSet<>();
            for (Project project : querier.getUserProjects(user.id())) {
                projectIds.add(project.id());
            }

            List<RoleBinding> bindings = new ArrayList<>();
            for (UserRoleBinding row : querier.getUserRoles(user.id())) {
                Optional<Role> role = Role.fromString(row.role());
                if (role.isEmpty()) {
                    log.warn("Ignoring unknown role {} bound to user {}", row.role(), user.id());
                    continue;
                }
                bindings.add(
                        new RoleBinding(
                                role.get(), row.isAdmin(), row.organizationId(), row.projectId()));
            }

            UUID organizationId = bindings.isEmpty() ? null : bindings.get(0).organizationId();
            return new UserPermissions(user.id(), projectIds, bindings, organizationId, superadmin);
        } catch (NoRowsException e) {
            log.debug("No user row for subject {}, using empty permissions", claims.subject());
            return UserPermissions.empty(superadmin);
        } catch (StoreException e) {
            log.error("Failed to load permissions for subject {}", claims.subject(), e);
            return UserPermissions.empty(superadmin);
        }
    }
}

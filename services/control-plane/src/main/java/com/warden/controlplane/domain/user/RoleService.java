package com.warden.controlplane.domain.user;

import com.warden.controlplane.domain.EntityContext;
import com.warden.controlplane.domain.ServiceException;
import com.warden.controlplane.domain.project.ProjectService;
import com.warden.database.NoRowsException;
import com.warden.database.Querier;
import com.warden.database.Store;
import com.warden.database.StoreException;
import com.warden.database.Transaction;
import com.warden.database.model.RoleAssignment;
import com.warden.database.model.User;
import com.warden.security.Role;
import java.util.List;
import java.util.UUID;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Direct role grants on a project. A user may hold several roles on one project; a project never
 * loses its last administrator through {@link #remove}.
 */
public class RoleService {

    private static final Logger log = LoggerFactory.getLogger(RoleService.class);

    private final Store store;

    public RoleService(Store store) {
        this.store = store;
    }

    /** Every role a grant can name, in declaration order. */
    public List<Role> listRoles() {
        return List.of(Role.values());
    }

    public List<RoleAssignment> listAssignments(EntityContext context) {
        try {
            return store.querier().listRoleAssignmentsByProject(context.projectId());
        } catch (StoreException e) {
            throw ServiceException.internal("failed to list role assignments", e);
        }
    }

    public RoleAssignment assign(EntityContext context, String subject, String roleName) {
        Role role = parse(subject, roleName);
        try (Transaction tx = store.beginTransaction()) {
            Querier querier = store.querierWithTransaction(tx);
            User user = user(querier, subject);
            UUID organization = ProjectService.organizationOf(querier, context.projectId());
            try {
                querier.createRoleBinding(
                        new Querier.NewRoleBinding(
                                user.id(),
                                context.projectId(),
                                organization,
                                role.value(),
                                role.isAdmin()));
            } catch (StoreException e) {
                if (store.isUniqueViolation(e)) {
                    throw ServiceException.conflict(
                            "user already has the role " + role.value() + " on the project");
                }
                throw e;
            }
            store.commit(tx);
            log.info("Granted {} on project {} to user {}",
                    role.value(), context.projectId(), user.id());
            return new RoleAssignment(
                    user.id(), user.subject(), context.projectId(), role.value(), role.isAdmin());
        } catch (StoreException e) {
            throw ServiceException.internal("failed to assign role", e);
        }
    }

    public RoleAssignment remove(EntityContext context, String subject, String roleName) {
        Role role = parse(subject, roleName);
        try (Transaction tx = store.beginTransaction()) {
            Querier querier = store.querierWithTransaction(tx);
            User user = user(querier, subject);
            int removed = querier.deleteRoleBinding(user.id(), context.projectId(), role.value());
            if (removed == 0) {
                throw ServiceException.notFound("role assignment not found");
            }
            // rolled back on close
            if (role.isAdmin() && querier.countProjectAdmins(context.projectId()) == 0) {
                throw ServiceException.precondition(
                        "cannot remove the last administrator of the project");
            }
            store.commit(tx);
            log.info("Revoked {} on project {} from user {}",
                    role.value(), context.projectId(), user.id());
            return new RoleAssignment(
                    user.id(), user.subject(), context.projectId(), role.value(), role.isAdmin());
        } catch (StoreException e) {
            throw ServiceException.internal("failed to remove role", e);
        }
    }

    private static Role parse(String subject, String roleName) {
        if (subject == null || subject.isEmpty() || roleName == null || roleName.isEmpty()) {
            throw ServiceException.badRequest("role and subject must be specified");
        }
        return Role.fromString(roleName)
                .orElseThrow(() -> ServiceException.badRequest("invalid role " + roleName));
    }

    private static User user(Querier querier, String subject) {
        try {
            return querier.getUserBySubject(subject);
        } catch (NoRowsException e) {
            throw ServiceException.notFound("user not found");
        }
    }
}

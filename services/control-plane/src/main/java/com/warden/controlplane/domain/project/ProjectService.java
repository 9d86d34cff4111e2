package com.warden.controlplane.domain.project;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.warden.controlplane.domain.EntityContext;
import com.warden.controlplane.domain.Names;
import com.warden.controlplane.domain.ServiceException;
import com.warden.database.NoRowsException;
import com.warden.database.Querier;
import com.warden.database.Store;
import com.warden.database.StoreException;
import com.warden.database.Transaction;
import com.warden.database.model.Project;
import com.warden.security.Role;
import com.warden.security.UserPermissions;
import java.util.List;
import java.util.Optional;
import java.util.UUID;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/** Sub-project management within a project tree. */
public class ProjectService {

    private static final Logger log = LoggerFactory.getLogger(ProjectService.class);

    private final Store store;
    private final ObjectMapper mapper;

    public ProjectService(Store store, ObjectMapper mapper) {
        this.store = store;
        this.mapper = mapper;
    }

    /**
     * Creates a child of the context project. The caller becomes its admin when they have a user
     * record.
     */
    public Project createChild(EntityContext context, UserPermissions caller, String name) {
        Optional<String> problem = Names.checkDnsStyle(name);
        if (problem.isPresent()) {
            throw ServiceException.badRequest("invalid project name: " + problem.get());
        }
        try (Transaction tx = store.beginTransaction()) {
            Querier querier = store.querierWithTransaction(tx);
            UUID organization = organizationOf(querier, context.projectId());
            if (childExists(querier, context.projectId(), name)) {
                throw ServiceException.conflict("project " + name + " already exists");
            }
            Project child;
            try {
                child =
                        querier.createProject(
                                context.projectId(),
                                name,
                                ProjectMetadata.withDisplayName(mapper, name));
            } catch (StoreException e) {
                if (store.isUniqueViolation(e)) {
                    throw ServiceException.conflict("project " + name + " already exists");
                }
                throw e;
            }
            if (caller.userId() != null) {
                querier.createRoleBinding(
                        new Querier.NewRoleBinding(
                                caller.userId(),
                                child.id(),
                                organization,
                                Role.ADMIN.value(),
                                true));
            }
            store.commit(tx);
            log.info("Created project {} under {}", child.id(), context.projectId());
            return child;
        } catch (StoreException e) {
            throw ServiceException.internal("failed to create project", e);
        }
    }

    /** The context project and its descendants. */
    public List<Project> listChildren(EntityContext context) {
        try {
            return store.querier().getChildrenProjects(context.projectId());
        } catch (StoreException e) {
            throw ServiceException.internal("failed to list projects", e);
        }
    }

    /** Projects the caller holds a role on; empty for callers without a user record. */
    public List<Project> listForCaller(UserPermissions caller) {
        if (caller.userId() == null) {
            return List.of();
        }
        try {
            return store.querier().getUserProjects(caller.userId());
        } catch (StoreException e) {
            throw ServiceException.internal("failed to list projects", e);
        }
    }

    /** Deletes a sub-project with its descendants. Top-level projects cannot be deleted here. */
    public void delete(EntityContext context) {
        try (Transaction tx = store.beginTransaction()) {
            Querier querier = store.querierWithTransaction(tx);
            Project project;
            try {
                project = querier.getProjectById(context.projectId());
            } catch (NoRowsException e) {
                throw ServiceException.notFound("project not found");
            }
            if (project.isRoot()) {
                throw ServiceException.precondition("cannot delete a top-level project");
            }
            querier.deleteProject(project.id());
            store.commit(tx);
            log.info("Deleted project {}", project.id());
        } catch (StoreException e) {
            throw ServiceException.internal("failed to delete project", e);
        }
    }

    /**
     * Root of the tree containing {@code projectId}.
     *
     * @throws ServiceException {@code BAD_REQUEST} when the parent chain loops back on itself
     */
    public static UUID organizationOf(Querier querier, UUID projectId) {
        try {
            List<UUID> chain = querier.getParentProjects(projectId);
            UUID top = chain.get(chain.size() - 1);
            if (!querier.getProjectById(top).isRoot()) {
                throw ServiceException.badRequest(
                        "project hierarchy of " + projectId + " contains a cycle");
            }
            return top;
        } catch (NoRowsException e) {
            throw ServiceException.notFound("project not found");
        }
    }

    private static boolean childExists(Querier querier, UUID parentId, String name) {
        try {
            querier.getChildProjectByName(parentId, name);
            return true;
        } catch (NoRowsException e) {
            return false;
        }
    }
}

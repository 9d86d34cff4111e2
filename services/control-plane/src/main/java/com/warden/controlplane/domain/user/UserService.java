package com.warden.controlplane.domain.user;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.warden.controlplane.domain.ServiceException;
import com.warden.controlplane.domain.project.ProjectMetadata;
import com.warden.database.NoRowsException;
import com.warden.database.Querier;
import com.warden.database.Store;
import com.warden.database.StoreException;
import com.warden.database.Transaction;
import com.warden.database.model.Project;
import com.warden.database.model.Provider;
import com.warden.database.model.ProviderInstallation;
import com.warden.database.model.User;
import com.warden.security.Role;
import com.warden.security.TokenClaims;
import java.security.SecureRandom;
import java.util.HexFormat;
import java.util.List;
import java.util.random.RandomGenerator;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Enrolment of users on first sign-in, and their removal.
 *
 * <p>A new user whose token carries a forge id claims the app installations they made before
 * enrolling: each becomes a project with a {@code github-app} provider. Without pending
 * installations the user gets one default project named after them. Either way the user is admin
 * of the projects created for them.
 */
public class UserService {

    private static final Logger log = LoggerFactory.getLogger(UserService.class);

    static final int MAX_NAME_ATTEMPTS = 10;

    static final String GITHUB_APP_CLASS = "github-app";

    private static final List<String> GITHUB_APP_TRAITS =
            List.of("github", "git", "rest", "repo-lister");

    private final Store store;
    private final ObjectMapper mapper;
    private final RandomGenerator random;

    public UserService(Store store, ObjectMapper mapper) {
        this(store, mapper, new SecureRandom());
    }

    UserService(Store store, ObjectMapper mapper, RandomGenerator random) {
        this.store = store;
        this.mapper = mapper;
        this.random = random;
    }

    /**
     * Enrols the caller. A project name taken by a concurrent enrolment rolls the attempt back and
     * retries with a suffixed name, up to {@value #MAX_NAME_ATTEMPTS} times.
     */
    public CreatedUser create(TokenClaims claims) {
        for (int attempt = 1; ; attempt++) {
            try {
                return enrol(claims, attempt > 1);
            } catch (ProjectNameTakenException e) {
                if (attempt >= MAX_NAME_ATTEMPTS) {
                    throw ServiceException.exhausted(
                            "cannot find a free project name for " + e.name);
                }
                log.info(
                        "Project name {} was taken while enrolling {}, retrying",
                        e.name,
                        claims.subject());
            }
        }
    }

    private CreatedUser enrol(TokenClaims claims, boolean suffixed) {
        try (Transaction tx = store.beginTransaction()) {
            Querier querier = store.querierWithTransaction(tx);
            User user;
            try {
                user =
                        querier.createUser(
                                claims.subject(), claims.preferredUsernameIfSet().orElse(null));
            } catch (StoreException e) {
                if (store.isUniqueViolation(e)) {
                    throw ServiceException.conflict("user already exists");
                }
                throw e;
            }

            Project first = null;
            if (claims.forgeIdIfSet().isPresent()) {
                List<ProviderInstallation> pending =
                        querier.getUnclaimedInstallationsByUser(claims.forgeIdIfSet().get());
                for (ProviderInstallation installation : pending) {
                    Project project =
                            claimInstallation(querier, user, installation, suffixed);
                    if (first == null) {
                        first = project;
                    }
                }
            }
            if (first == null) {
                String baseName =
                        claims.preferredUsernameIfSet().orElse(claims.subject());
                first = createOwnedProject(querier, user, baseName, suffixed);
            }

            store.commit(tx);
            log.info("Enrolled user {} with project {}", user.id(), first.id());
            return new CreatedUser(
                    user.id(), user.subject(), first.id(), first.name(), user.createdAt());
        } catch (StoreException e) {
            throw ServiceException.internal("failed to create user", e);
        }
    }

    public UserAccount get(TokenClaims claims) {
        try {
            Querier querier = store.querier();
            User user = querier.getUserBySubject(claims.subject());
            return new UserAccount(
                    user, querier.getUserProjects(user.id()), querier.getUserRoles(user.id()));
        } catch (NoRowsException e) {
            throw ServiceException.notFound("user not found");
        } catch (StoreException e) {
            throw ServiceException.internal("failed to get user", e);
        }
    }

    public void delete(TokenClaims claims) {
        try (Transaction tx = store.beginTransaction()) {
            Querier querier = store.querierWithTransaction(tx);
            User user;
            try {
                user = querier.getUserBySubject(claims.subject());
            } catch (NoRowsException e) {
                throw ServiceException.notFound("user not found");
            }
            querier.deleteUser(user.id());
            store.commit(tx);
            log.info("Deleted user {}", user.id());
        } catch (StoreException e) {
            throw ServiceException.internal("failed to delete user", e);
        }
    }

    private Project claimInstallation(
            Querier querier, User user, ProviderInstallation installation, boolean suffixed) {
        Project project =
                createOwnedProject(
                        querier, user, "github-" + installation.organizationId(), suffixed);
        Provider provider =
                querier.createProvider(
                        new Querier.NewProvider(
                                project.id(),
                                GITHUB_APP_CLASS,
                                GITHUB_APP_CLASS,
                                GITHUB_APP_TRAITS,
                                "v1",
                                "{}"));
        boolean claimed =
                querier.claimInstallation(
                        installation.appInstallationId(), project.id(), provider.id());
        if (!claimed) {
            throw ServiceException.conflict(
                    "installation " + installation.appInstallationId() + " was already claimed");
        }
        log.info("User {} claimed installation {} as project {}",
                user.id(), installation.appInstallationId(), project.id());
        return project;
    }

    /** Creates a root project under the first free variant of {@code baseName}. */
    private Project createOwnedProject(
            Querier querier, User user, String baseName, boolean suffixed) {
        String name = availableName(querier, baseName, suffixed);
        Project project;
        try {
            project =
                    querier.createProject(
                            null, name, ProjectMetadata.withDisplayName(mapper, name));
        } catch (StoreException e) {
            if (store.isUniqueViolation(e)) {
                throw new ProjectNameTakenException(name, e);
            }
            throw e;
        }
        querier.createRoleBinding(
                new Querier.NewRoleBinding(
                        user.id(), project.id(), project.id(), Role.ADMIN.value(), true));
        return project;
    }

    String availableName(Querier querier, String baseName) {
        return availableName(querier, baseName, false);
    }

    /** With {@code suffixed}, the bare {@code baseName} is not tried. */
    String availableName(Querier querier, String baseName, boolean suffixed) {
        String candidate = suffixed ? baseName + "-" + randomSuffix() : baseName;
        for (int attempt = 0; attempt < MAX_NAME_ATTEMPTS; attempt++) {
            if (!rootProjectExists(querier, candidate)) {
                return candidate;
            }
            candidate = baseName + "-" + randomSuffix();
        }
        throw ServiceException.exhausted("cannot find a free project name for " + baseName);
    }

    private String randomSuffix() {
        byte[] bytes = new byte[2];
        for (int i = 0; i < bytes.length; i++) {
            bytes[i] = (byte) random.nextInt(256);
        }
        return HexFormat.of().formatHex(bytes);
    }

    private static boolean rootProjectExists(Querier querier, String name) {
        try {
            querier.getProjectByName(name);
            return true;
        } catch (NoRowsException e) {
            return false;
        }
    }

    /** A root project name was taken between the availability check and the insert. */
    private static final class ProjectNameTakenException extends RuntimeException {

        private final String name;

        ProjectNameTakenException(String name, Throwable cause) {
            super("project name " + name + " is taken", cause);
            this.name = name;
        }
    }
}

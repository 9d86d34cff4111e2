package com.warden.controlplane.domain.user;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.warden.controlplane.domain.EntityContext;
import com.warden.controlplane.domain.ServiceException;
import com.warden.controlplane.domain.project.ProjectMetadata;
import com.warden.controlplane.domain.project.ProjectService;
import com.warden.database.NoRowsException;
import com.warden.database.Querier;
import com.warden.database.Store;
import com.warden.database.StoreException;
import com.warden.database.Transaction;
import com.warden.database.model.Invitation;
import com.warden.database.model.Project;
import com.warden.database.model.User;
import com.warden.security.Role;
import com.warden.security.TokenClaims;
import java.security.SecureRandom;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.Base64;
import java.util.Optional;
import java.util.UUID;
import java.util.regex.Pattern;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Invitations to join a project with a role.
 *
 * <p>An invitation is single-use: resolving it, accepted or declined, deletes it. Accepting
 * replaces whatever roles the invitee held on the project with the invited one.
 */
public class InvitationService {

    private static final Logger log = LoggerFactory.getLogger(InvitationService.class);

    private static final Pattern EMAIL = Pattern.compile("^[^@\\s]+@[^@\\s]+$");

    private static final int CODE_BYTES = 24;

    private final Store store;
    private final ObjectMapper mapper;
    private final Clock clock;
    private final Duration expiry;
    private final SecureRandom random = new SecureRandom();

    public InvitationService(Store store, ObjectMapper mapper, Clock clock, Duration expiry) {
        this.store = store;
        this.mapper = mapper;
        this.clock = clock;
        this.expiry = expiry;
    }

    /** Invites {@code email} to the context project. The sponsor must be enrolled. */
    public Invitation create(
            EntityContext context, TokenClaims sponsor, String email, String role) {
        Role invitedRole =
                Role.fromString(role)
                        .orElseThrow(() -> ServiceException.badRequest("invalid role " + role));
        if (email == null || !EMAIL.matcher(email).matches()) {
            throw ServiceException.badRequest("invalid email address");
        }
        try {
            Querier querier = store.querier();
            User sponsorUser;
            try {
                sponsorUser = querier.getUserBySubject(sponsor.subject());
            } catch (NoRowsException e) {
                throw ServiceException.notFound("user not found");
            }
            Invitation invitation =
                    querier.createInvitation(
                            new Querier.NewInvitation(
                                    newCode(),
                                    email,
                                    invitedRole.value(),
                                    context.projectId(),
                                    sponsorUser.id()));
            log.info("User {} invited a new {} to project {}",
                    sponsorUser.id(), invitedRole.value(), context.projectId());
            return invitation;
        } catch (StoreException e) {
            throw ServiceException.internal("failed to create invitation", e);
        }
    }

    /** Instant after which the invitation can no longer be resolved. */
    public Instant expiresAt(Invitation invitation) {
        return invitation.updatedAt().plus(expiry);
    }

    /**
     * Accepts or declines an invitation on behalf of the caller. Callers without a user record
     * are enrolled when they accept.
     */
    public InvitationResolution resolve(TokenClaims caller, String code, boolean accept) {
        try (Transaction tx = store.beginTransaction()) {
            Querier querier = store.querierWithTransaction(tx);
            Invitation invitation;
            try {
                invitation = querier.getInvitationByCode(code);
            } catch (NoRowsException e) {
                throw ServiceException.notFound("invitation not found or already used");
            }

            Optional<User> user = findUser(querier, caller.subject());
            if (user.isPresent() && user.get().id().equals(invitation.sponsorUserId())) {
                throw ServiceException.badRequest("user cannot resolve their own invitation");
            }
            if (expiresAt(invitation).isBefore(clock.instant())) {
                throw ServiceException.forbidden("invitation expired");
            }
            Project project;
            try {
                project = querier.getProjectById(invitation.projectId());
            } catch (NoRowsException e) {
                throw ServiceException.notFound("project not found");
            }

            if (accept) {
                User member = user.isPresent() ? user.get() : enroll(querier, caller);
                grant(querier, member, project, invitation.role());
            }
            querier.deleteInvitation(code);
            store.commit(tx);
            log.info("Invitation to project {} {}", project.id(), accept ? "accepted" : "declined");
            return new InvitationResolution(
                    invitation.role(),
                    project.id(),
                    ProjectMetadata.displayName(mapper, project),
                    invitation.email(),
                    accept);
        } catch (StoreException e) {
            throw ServiceException.internal("failed to resolve invitation", e);
        }
    }

    private void grant(Querier querier, User member, Project project, String roleName) {
        Role role =
                Role.fromString(roleName)
                        .orElseThrow(
                                () -> ServiceException.internal("invitation has unknown role"));
        boolean sameRole =
                querier.getUserRoles(member.id()).stream()
                        .anyMatch(
                                binding ->
                                        binding.projectId().equals(project.id())
                                                && binding.role().equals(role.value()));
        if (sameRole) {
            throw ServiceException.conflict("user already has the same role in the project");
        }
        UUID organization = ProjectService.organizationOf(querier, project.id());
        querier.deleteRoleBindingsForProject(member.id(), project.id());
        querier.createRoleBinding(
                new Querier.NewRoleBinding(
                        member.id(), project.id(), organization, role.value(), role.isAdmin()));
    }

    private User enroll(Querier querier, TokenClaims caller) {
        try {
            return querier.createUser(
                    caller.subject(), caller.preferredUsernameIfSet().orElse(null));
        } catch (StoreException e) {
            if (store.isUniqueViolation(e)) {
                throw ServiceException.conflict("user already exists");
            }
            throw e;
        }
    }

    private static Optional<User> findUser(Querier querier, String subject) {
        try {
            return Optional.of(querier.getUserBySubject(subject));
        } catch (NoRowsException e) {
            return Optional.empty();
        }
    }

    private String newCode() {
        byte[] bytes = new byte[CODE_BYTES];
        random.nextBytes(bytes);
        return Base64.getUrlEncoder().withoutPadding().encodeToString(bytes);
    }
}

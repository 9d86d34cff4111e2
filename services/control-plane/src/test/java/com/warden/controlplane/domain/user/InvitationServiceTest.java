package com.warden.controlplane.domain.user;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.warden.controlplane.TestDatabase;
import com.warden.controlplane.config.ControlPlaneConfig;
import com.warden.controlplane.domain.EntityContext;
import com.warden.controlplane.domain.ErrorKind;
import com.warden.controlplane.domain.ServiceException;
import com.warden.database.NoRowsException;
import com.warden.database.model.Invitation;
import com.warden.database.model.Project;
import com.warden.database.model.User;
import com.warden.database.model.UserRoleBinding;
import com.warden.security.Role;
import com.warden.security.TokenClaims;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.Set;
import org.assertj.core.api.ThrowableAssert.ThrowingCallable;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

class InvitationServiceTest {

    private static final Duration EXPIRY = Duration.ofDays(7);

    private final ObjectMapper mapper = ControlPlaneConfig.jsonMapper();

    private TestDatabase db;
    private InvitationService service;
    private Project project;
    private EntityContext context;
    private User owner;

    @BeforeEach
    void setUp() {
        db = TestDatabase.create();
        service = new InvitationService(db.store(), mapper, Clock.systemUTC(), EXPIRY);
        project = db.rootProject("acme");
        context = new EntityContext(project.id(), null);
        owner = db.user("owner");
        db.bind(owner, project, Role.ADMIN);
    }

    private static TokenClaims claims(String subject) {
        return new TokenClaims(
                subject, subject, null, Set.of(), "issuer", Instant.now().plusSeconds(60));
    }

    private static void assertFails(ThrowingCallable call, ErrorKind kind, String message) {
        assertThatThrownBy(call)
                .isInstanceOfSatisfying(
                        ServiceException.class,
                        e -> {
                            assertThat(e.kind()).isEqualTo(kind);
                            assertThat(e.getMessage()).contains(message);
                        });
    }

    private List<UserRoleBinding> bindingsOf(String subject) {
        User user = db.querier().getUserBySubject(subject);
        return db.querier().getUserRoles(user.id());
    }

    @Test
    @DisplayName("creates an invitation with an unguessable code and an expiry")
    void create() {
        Invitation invitation =
                service.create(context, claims("owner"), "bob@example.com", "editor");

        assertThat(invitation.code()).hasSize(32);
        assertThat(invitation.role()).isEqualTo("editor");
        assertThat(service.expiresAt(invitation)).isEqualTo(invitation.updatedAt().plus(EXPIRY));
        assertThat(db.querier().getInvitationByCode(invitation.code()).email())
                .isEqualTo("bob@example.com");
    }

    @Test
    @DisplayName("validates role, email and sponsor")
    void createValidation() {
        assertFails(
                () -> service.create(context, claims("owner"), "bob@example.com", "owner"),
                ErrorKind.BAD_REQUEST,
                "invalid role owner");
        assertFails(
                () -> service.create(context, claims("owner"), "not-an-email", "viewer"),
                ErrorKind.BAD_REQUEST,
                "invalid email address");
        assertFails(
                () -> service.create(context, claims("ghost"), "bob@example.com", "viewer"),
                ErrorKind.NOT_FOUND,
                "user not found");
    }

    @Test
    @DisplayName("accepting enrols the invitee and grants the role once")
    void acceptIsIdempotent() {
        Invitation invitation =
                service.create(context, claims("owner"), "bob@example.com", "editor");

        InvitationResolution first = service.resolve(claims("bob"), invitation.code(), true);

        assertThat(first.accepted()).isTrue();
        assertThat(first.projectId()).isEqualTo(project.id());
        assertThat(first.projectDisplay()).isEqualTo("acme");
        List<UserRoleBinding> afterFirst = bindingsOf("bob");
        assertThat(afterFirst)
                .singleElement()
                .satisfies(binding -> assertThat(binding.role()).isEqualTo("editor"));

        assertFails(
                () -> service.resolve(claims("bob"), invitation.code(), true),
                ErrorKind.NOT_FOUND,
                "invitation not found or already used");
        assertThat(bindingsOf("bob")).isEqualTo(afterFirst);
        assertThatThrownBy(() -> db.querier().getInvitationByCode(invitation.code()))
                .isInstanceOf(NoRowsException.class);
    }

    @Test
    @DisplayName("accepting replaces the invitee's previous roles on the project")
    void acceptReplacesRoles() {
        User bob = db.user("bob");
        db.bind(bob, project, Role.VIEWER);
        Invitation invitation =
                service.create(context, claims("owner"), "bob@example.com", "admin");

        service.resolve(claims("bob"), invitation.code(), true);

        assertThat(bindingsOf("bob"))
                .singleElement()
                .satisfies(
                        binding -> {
                            assertThat(binding.role()).isEqualTo("admin");
                            assertThat(binding.isAdmin()).isTrue();
                            assertThat(binding.organizationId()).isEqualTo(project.id());
                        });
    }

    @Test
    @DisplayName("accepting a role already held is a conflict and keeps the invitation")
    void sameRole() {
        User bob = db.user("bob");
        db.bind(bob, project, Role.EDITOR);
        Invitation invitation =
                service.create(context, claims("owner"), "bob@example.com", "editor");

        assertFails(
                () -> service.resolve(claims("bob"), invitation.code(), true),
                ErrorKind.CONFLICT,
                "same role");
        assertThat(db.querier().getInvitationByCode(invitation.code())).isNotNull();
    }

    @Test
    @DisplayName("declining deletes the invitation without granting anything")
    void decline() {
        Invitation invitation =
                service.create(context, claims("owner"), "bob@example.com", "editor");

        InvitationResolution resolution = service.resolve(claims("bob"), invitation.code(), false);

        assertThat(resolution.accepted()).isFalse();
        assertThatThrownBy(() -> db.querier().getUserBySubject("bob"))
                .isInstanceOf(NoRowsException.class);
        assertThatThrownBy(() -> db.querier().getInvitationByCode(invitation.code()))
                .isInstanceOf(NoRowsException.class);
    }

    @Test
    @DisplayName("the sponsor cannot resolve their own invitation")
    void sponsorCannotResolve() {
        Invitation invitation =
                service.create(context, claims("owner"), "me@example.com", "viewer");

        assertFails(
                () -> service.resolve(claims("owner"), invitation.code(), true),
                ErrorKind.BAD_REQUEST,
                "their own invitation");
    }

    @Test
    @DisplayName("an expired invitation cannot be resolved")
    void expired() {
        Invitation invitation =
                service.create(context, claims("owner"), "bob@example.com", "editor");
        InvitationService later =
                new InvitationService(
                        db.store(),
                        mapper,
                        Clock.offset(Clock.systemUTC(), EXPIRY.plusDays(1)),
                        EXPIRY);

        assertFails(
                () -> later.resolve(claims("bob"), invitation.code(), true),
                ErrorKind.FORBIDDEN,
                "invitation expired");
    }
}

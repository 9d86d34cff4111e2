package com.warden.database.jdbc;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.warden.database.NoRowsException;
import com.warden.database.Querier;
import com.warden.database.Querier.EvaluationFilter;
import com.warden.database.Querier.NewInvitation;
import com.warden.database.Querier.NewProfile;
import com.warden.database.Querier.NewProvider;
import com.warden.database.Querier.NewRoleBinding;
import com.warden.database.Querier.NewRuleType;
import com.warden.database.Transaction;
import com.warden.database.UniqueViolationException;
import com.warden.database.model.EntityProfile;
import com.warden.database.model.Profile;
import com.warden.database.model.Project;
import com.warden.database.model.Provider;
import com.warden.database.model.RuleEvaluation;
import com.warden.database.model.RuleType;
import com.warden.database.model.User;
import java.sql.Timestamp;
import java.time.Clock;
import java.time.Instant;
import java.util.List;
import java.util.UUID;
import org.flywaydb.core.Flyway;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.jdbc.datasource.DriverManagerDataSource;

@DisplayName("JdbcStore")
class JdbcStoreTest {

    private JdbcTemplate jdbc;
    private JdbcStore store;
    private Querier q;

    @BeforeEach
    void setUp() {
        DriverManagerDataSource dataSource =
                new DriverManagerDataSource(
                        "jdbc:h2:mem:"
                                + UUID.randomUUID()
                                + ";MODE=PostgreSQL;DB_CLOSE_DELAY=-1",
                        "sa",
                        "");
        Flyway.configure().dataSource(dataSource).locations("classpath:db/migration").load().migrate();
        jdbc = new JdbcTemplate(dataSource);
        store = new JdbcStore(dataSource, new ObjectMapper(), Clock.systemUTC());
        q = store.querier();
    }

    @Nested
    @DisplayName("users and role bindings")
    class Users {

        @Test
        @DisplayName("creates and finds a user by subject")
        void createsAndFindsUser() {
            User created = q.createUser("sub-1", "alice");

            User found = q.getUserBySubject("sub-1");

            assertThat(found.id()).isEqualTo(created.id());
            assertThat(found.displayName()).isEqualTo("alice");
        }

        @Test
        @DisplayName("reports a missing user as NoRowsException")
        void missingUser() {
            assertThatThrownBy(() -> q.getUserBySubject("nobody"))
                    .isInstanceOf(NoRowsException.class);
        }

        @Test
        @DisplayName("reports a duplicate subject as a unique violation")
        void duplicateSubject() {
            q.createUser("sub-1", null);

            assertThatThrownBy(() -> q.createUser("sub-1", null))
                    .isInstanceOf(UniqueViolationException.class)
                    .satisfies(e -> assertThat(store.isUniqueViolation(e)).isTrue());
        }

        @Test
        @DisplayName("lists the projects and roles of a user")
        void listsProjectsAndRoles() {
            User user = q.createUser("sub-1", null);
            Project root = q.createProject(null, "acme", null);
            Project other = q.createProject(null, "other", null);
            q.createRoleBinding(new NewRoleBinding(user.id(), root.id(), root.id(), "admin", true));

            assertThat(q.getUserProjects(user.id())).extracting(Project::id).containsExactly(root.id());
            assertThat(q.getUserRoles(user.id()))
                    .singleElement()
                    .satisfies(
                            b -> {
                                assertThat(b.role()).isEqualTo("admin");
                                assertThat(b.isAdmin()).isTrue();
                                assertThat(b.organizationId()).isEqualTo(root.id());
                            });
            assertThat(q.deleteRoleBindingsForProject(user.id(), other.id())).isZero();
            assertThat(q.deleteRoleBindingsForProject(user.id(), root.id())).isEqualTo(1);
            assertThat(q.getUserRoles(user.id())).isEmpty();
        }

        @Test
        @DisplayName("lists, counts and deletes the role assignments of a project")
        void roleAssignments() {
            User bob = q.createUser("bob", null);
            User alice = q.createUser("alice", null);
            Project root = q.createProject(null, "acme", null);
            q.createRoleBinding(new NewRoleBinding(alice.id(), root.id(), root.id(), "admin", true));
            q.createRoleBinding(new NewRoleBinding(bob.id(), root.id(), root.id(), "viewer", false));
            q.createRoleBinding(new NewRoleBinding(bob.id(), root.id(), root.id(), "editor", false));

            assertThat(q.listRoleAssignmentsByProject(root.id()))
                    .extracting(a -> a.subject() + ":" + a.role())
                    .containsExactly("alice:admin", "bob:editor", "bob:viewer");
            assertThat(q.countProjectAdmins(root.id())).isEqualTo(1);

            assertThat(q.deleteRoleBinding(bob.id(), root.id(), "admin")).isZero();
            assertThat(q.deleteRoleBinding(bob.id(), root.id(), "viewer")).isEqualTo(1);
            assertThat(q.deleteRoleBinding(alice.id(), root.id(), "admin")).isEqualTo(1);

            assertThat(q.countProjectAdmins(root.id())).isZero();
            assertThat(q.listRoleAssignmentsByProject(root.id()))
                    .singleElement()
                    .satisfies(a -> assertThat(a.userId()).isEqualTo(bob.id()));
        }

        @Test
        @DisplayName("deleting a user removes their role bindings")
        void deleteCascades() {
            User user = q.createUser("sub-1", null);
            Project root = q.createProject(null, "acme", null);
            q.createRoleBinding(new NewRoleBinding(user.id(), root.id(), root.id(), "viewer", false));

            q.deleteUser(user.id());

            Integer bindings =
                    jdbc.queryForObject("SELECT COUNT(*) FROM user_role_bindings", Integer.class);
            assertThat(bindings).isZero();
        }
    }

    @Nested
    @DisplayName("projects")
    class Projects {

        @Test
        @DisplayName("walks the tree in both directions")
        void walksTree() {
            Project root = q.createProject(null, "acme", "{\"description\":\"root\"}");
            Project child = q.createProject(root.id(), "team", null);
            Project grandchild = q.createProject(child.id(), "squad", null);

            assertThat(q.getParentProjects(grandchild.id()))
                    .containsExactly(grandchild.id(), child.id(), root.id());
            assertThat(q.getChildrenProjects(root.id()))
                    .extracting(Project::id)
                    .containsExactly(root.id(), child.id(), grandchild.id());
            assertThat(q.getChildProjectByName(root.id(), "team").id()).isEqualTo(child.id());
            assertThat(q.getProjectByName("acme").metadata()).contains("root");
        }

        @Test
        @DisplayName("rejects duplicate sibling names")
        void duplicateSibling() {
            Project root = q.createProject(null, "acme", null);
            q.createProject(root.id(), "team", null);

            assertThatThrownBy(() -> q.createProject(root.id(), "team", null))
                    .isInstanceOf(UniqueViolationException.class);
        }

        @Test
        @DisplayName("rejects a second root with the same name in any case")
        void duplicateRoot() {
            q.createProject(null, "acme", null);

            assertThatThrownBy(() -> q.createProject(null, "ACME", null))
                    .isInstanceOf(UniqueViolationException.class);
            assertThat(q.getProjectByName("Acme").name()).isEqualTo("acme");
        }

        @Test
        @DisplayName("allows a child to share the name of a root")
        void childNamedLikeRoot() {
            Project root = q.createProject(null, "acme", null);

            Project child = q.createProject(root.id(), "acme", null);

            assertThat(q.getProjectByName("acme").id()).isEqualTo(root.id());
            assertThat(q.getChildProjectByName(root.id(), "acme").id()).isEqualTo(child.id());
        }

        @Test
        @DisplayName("deleting a project removes its descendants")
        void deleteCascades() {
            Project root = q.createProject(null, "acme", null);
            Project child = q.createProject(root.id(), "team", null);

            q.deleteProject(root.id());

            assertThatThrownBy(() -> q.getProjectById(child.id()))
                    .isInstanceOf(NoRowsException.class);
        }
    }

    @Nested
    @DisplayName("providers and installations")
    class Providers {

        @Test
        @DisplayName("stores provider traits and finds providers by name")
        void findsProviders() {
            Project a = q.createProject(null, "a", null);
            Project b = q.createProject(null, "b", null);
            q.createProvider(
                    new NewProvider(a.id(), "github-app-acme", "github-app", List.of("git", "rest"), "v1", null));
            q.createProvider(new NewProvider(b.id(), "dockerhub", "dockerhub", List.of("image-lister"), "v1", null));

            List<Provider> all = q.findProviders(List.of(a.id(), b.id()), null);
            List<Provider> named = q.findProviders(List.of(a.id(), b.id()), "dockerhub");

            assertThat(all).hasSize(2);
            assertThat(named).singleElement().extracting(Provider::projectId).isEqualTo(b.id());
            assertThat(q.getProviderByName(a.id(), "github-app-acme").traits())
                    .containsExactly("git", "rest");
            assertThat(q.findProviders(List.of(), null)).isEmpty();
        }

        @Test
        @DisplayName("claims a pending installation only once")
        void claimsInstallationOnce() {
            jdbc.update(
                    "INSERT INTO provider_installations (app_installation_id, organization_id, enrolling_user_id) VALUES (?, ?, ?)",
                    42L,
                    7L,
                    "1234");
            Project project = q.createProject(null, "acme", null);
            Provider provider =
                    q.createProvider(new NewProvider(project.id(), "gh", "github-app", List.of(), "v1", "{}"));

            assertThat(q.getUnclaimedInstallationsByUser("1234")).hasSize(1);
            assertThat(q.claimInstallation(42L, project.id(), provider.id())).isTrue();
            assertThat(q.claimInstallation(42L, project.id(), provider.id())).isFalse();
            assertThat(q.getUnclaimedInstallationsByUser("1234")).isEmpty();
        }
    }

    @Nested
    @DisplayName("rule types and profiles")
    class RuleTypesAndProfiles {

        private Project project;
        private RuleType ruleType;

        @BeforeEach
        void createRuleType() {
            project = q.createProject(null, "acme", null);
            ruleType =
                    q.createRuleType(
                            new NewRuleType(project.id(), "github", "secret_scanning", "desc", "{}", null));
        }

        @Test
        @DisplayName("tracks which profiles instantiate a rule type")
        void tracksInstantiations() {
            Profile profile = q.createProfile(new NewProfile(project.id(), "github", "baseline", "on", null));
            EntityProfile repos = q.createProfileForEntity(profile.id(), "repository", "[]");
            q.upsertRuleInstantiation(repos.id(), ruleType.id());
            q.upsertRuleInstantiation(repos.id(), ruleType.id());

            assertThat(q.listProfilesInstantiatingRuleType(ruleType.id())).containsExactly("baseline");

            q.deleteRuleInstantiation(repos.id(), ruleType.id());
            assertThat(q.listProfilesInstantiatingRuleType(ruleType.id())).isEmpty();
        }

        @Test
        @DisplayName("upserting an entity profile keeps its id")
        void upsertKeepsId() {
            Profile profile = q.createProfile(new NewProfile(project.id(), "github", "baseline", null, null));
            EntityProfile first = q.upsertProfileForEntity(profile.id(), "repository", "[]");

            EntityProfile second = q.upsertProfileForEntity(profile.id(), "repository", "[{\"type\":\"x\"}]");

            assertThat(second.id()).isEqualTo(first.id());
            assertThat(q.listProfileEntities(profile.id()))
                    .singleElement()
                    .extracting(EntityProfile::contextualRules)
                    .isEqualTo("[{\"type\":\"x\"}]");
        }

        @Test
        @DisplayName("creates a pending status with each profile")
        void createsStatus() {
            Profile profile = q.createProfile(new NewProfile(project.id(), "github", "baseline", null, null));

            assertThat(q.getProfileStatusByNameAndProject(project.id(), "baseline").status())
                    .isEqualTo("pending");
            assertThat(q.getProfileStatusByProject(project.id()))
                    .singleElement()
                    .satisfies(s -> assertThat(s.profileId()).isEqualTo(profile.id()));
        }

        @Test
        @DisplayName("updates rule types in place")
        void updatesRuleType() {
            RuleType updated = q.updateRuleType(ruleType.id(), "new desc", "{\"a\":1}", "guide");

            assertThat(updated.description()).isEqualTo("new desc");
            assertThat(q.getRuleTypeByName(project.id(), "secret_scanning").guidance()).isEqualTo("guide");
            assertThatThrownBy(() -> q.updateRuleType(UUID.randomUUID(), "", "{}", ""))
                    .isInstanceOf(NoRowsException.class);
        }

        @Test
        @DisplayName("locks and updates a profile")
        void locksAndUpdatesProfile() {
            Profile profile = q.createProfile(new NewProfile(project.id(), "github", "baseline", "off", null));

            try (Transaction tx = store.beginTransaction()) {
                Querier txq = store.querierWithTransaction(tx);
                Profile locked = txq.getProfileByNameAndLock(project.id(), "baseline");
                txq.updateProfile(project.id(), locked.id(), "on", "dry_run");
                store.commit(tx);
            }

            Profile reloaded = q.getProfileById(project.id(), profile.id());
            assertThat(reloaded.remediate()).isEqualTo("on");
            assertThat(reloaded.alert()).isEqualTo("dry_run");
        }

        @Test
        @DisplayName("joins repository details onto rule evaluations")
        void joinsRepositoryDetails() {
            Profile profile = q.createProfile(new NewProfile(project.id(), "github", "baseline", null, null));
            UUID repoId = UUID.randomUUID();
            jdbc.update(
                    "INSERT INTO repositories (id, project_id, provider, repo_owner, repo_name, repo_id) VALUES (?, ?, ?, ?, ?, ?)",
                    repoId,
                    project.id(),
                    "github",
                    "acme",
                    "widgets",
                    99L);
            insertEvaluation(profile.id(), "secret_scanning", "repository", repoId);
            insertEvaluation(profile.id(), "other_name", "repository", UUID.randomUUID());

            List<RuleEvaluation> all =
                    q.listRuleEvaluationsByProfileId(profile.id(), EvaluationFilter.ALL);
            List<RuleEvaluation> filtered =
                    q.listRuleEvaluationsByProfileId(
                            profile.id(), new EvaluationFilter("repository", repoId, null));

            assertThat(all).hasSize(2);
            assertThat(filtered)
                    .singleElement()
                    .satisfies(
                            e -> {
                                assertThat(e.repoOwner()).isEqualTo("acme");
                                assertThat(e.repoName()).isEqualTo("widgets");
                                assertThat(e.repoId()).isEqualTo(99L);
                                assertThat(e.ruleTypeName()).isEqualTo("secret_scanning");
                            });

            q.deleteRuleStatusesForProfileAndRuleType(profile.id(), ruleType.id(), "other_name");
            assertThat(q.listRuleEvaluationsByProfileId(profile.id(), EvaluationFilter.ALL)).hasSize(1);
        }

        private void insertEvaluation(UUID profileId, String ruleName, String kind, UUID entityId) {
            jdbc.update(
                    """
                    INSERT INTO rule_evaluations
                        (id, profile_id, rule_type_id, rule_name, entity_kind, entity_id, eval_status, last_updated)
                    VALUES (?, ?, ?, ?, ?, ?, ?, ?)
                    """,
                    UUID.randomUUID(),
                    profileId,
                    ruleType.id(),
                    ruleName,
                    kind,
                    entityId,
                    "failure",
                    Timestamp.from(Instant.now()));
        }
    }

    @Nested
    @DisplayName("transactions")
    class Transactions {

        @Test
        @DisplayName("commit makes writes visible")
        void commitPersists() {
            try (Transaction tx = store.beginTransaction()) {
                store.querierWithTransaction(tx).createUser("sub-tx", null);
                store.commit(tx);
                assertThat(tx.isActive()).isFalse();
            }

            assertThat(q.getUserBySubject("sub-tx")).isNotNull();
        }

        @Test
        @DisplayName("closing without commit rolls back")
        void closeRollsBack() {
            try (Transaction tx = store.beginTransaction()) {
                store.querierWithTransaction(tx).createUser("sub-tx", null);
            }

            assertThatThrownBy(() -> q.getUserBySubject("sub-tx")).isInstanceOf(NoRowsException.class);
        }

        @Test
        @DisplayName("explicit rollback discards writes")
        void rollbackDiscards() {
            Transaction tx = store.beginTransaction();
            store.querierWithTransaction(tx).createProject(null, "acme", null);
            store.rollback(tx);

            assertThatThrownBy(() -> q.getProjectByName("acme")).isInstanceOf(NoRowsException.class);
            assertThatThrownBy(() -> store.querierWithTransaction(tx))
                    .isInstanceOf(IllegalStateException.class);
        }
    }

    @Test
    @DisplayName("creates, reads and deletes invitations")
    void invitations() {
        User sponsor = q.createUser("sponsor", null);
        Project project = q.createProject(null, "acme", null);
        q.createInvitation(new NewInvitation("code-1", "bob@example.com", "editor", project.id(), sponsor.id()));

        assertThat(q.getInvitationByCode("code-1").role()).isEqualTo("editor");

        q.deleteInvitation("code-1");
        assertThatThrownBy(() -> q.getInvitationByCode("code-1")).isInstanceOf(NoRowsException.class);
    }

    @Test
    @DisplayName("ping succeeds against a live database")
    void ping() {
        assertThat(store.ping()).isTrue();
    }
}

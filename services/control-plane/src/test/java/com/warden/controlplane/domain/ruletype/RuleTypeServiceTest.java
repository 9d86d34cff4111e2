package com.warden.controlplane.domain.ruletype;

import static com.warden.controlplane.TestRuleTypes.SEVERITY_SCHEMA;
import static com.warden.controlplane.TestRuleTypes.definition;
import static com.warden.controlplane.TestRuleTypes.repositoryProfile;
import static com.warden.controlplane.TestRuleTypes.rule;
import static com.warden.controlplane.TestRuleTypes.ruleType;
import static com.warden.controlplane.TestRuleTypes.severityRuleType;
import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.Mockito.mock;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.warden.controlplane.TestDatabase;
import com.warden.controlplane.config.ControlPlaneConfig;
import com.warden.controlplane.domain.EntityContext;
import com.warden.controlplane.domain.ErrorKind;
import com.warden.controlplane.domain.ServiceException;
import com.warden.controlplane.domain.profile.ProfileService;
import com.warden.controlplane.domain.profile.ProfileValidator;
import com.warden.database.model.Project;
import com.warden.eventmodel.EventPublisher;
import java.util.UUID;
import org.assertj.core.api.ThrowableAssert.ThrowingCallable;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

class RuleTypeServiceTest {

    private final ObjectMapper mapper = ControlPlaneConfig.jsonMapper();

    private TestDatabase db;
    private RuleTypeService service;
    private ProfileService profiles;
    private EntityContext context;

    @BeforeEach
    void setUp() {
        db = TestDatabase.create();
        Project project = db.rootProject("acme");
        db.provider(project.id(), "github");
        context = new EntityContext(project.id(), "github");
        service = new RuleTypeService(db.store(), mapper);
        profiles =
                new ProfileService(
                        db.store(),
                        new ProfileValidator(mapper),
                        mock(EventPublisher.class),
                        mapper,
                        "test");
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

    private void instantiate(String ruleTypeName, String profileName) {
        profiles.create(
                context,
                repositoryProfile(
                        profileName, rule(ruleTypeName, null, "{\"severity\": \"low\"}")));
    }

    @Test
    @DisplayName("creates a rule type bound to the context project and provider")
    void create() {
        RuleTypeDocument created = service.create(context, severityRuleType("secret_scanning"));

        assertThat(created.id()).isNotBlank();
        assertThat(created.projectId()).isEqualTo(context.projectId().toString());
        assertThat(created.provider()).isEqualTo("github");
        assertThat(created.def().inEntity()).isEqualTo("repository");
        assertThat(service.getByName(context, "secret_scanning")).isEqualTo(created);
    }

    @Test
    @DisplayName("refuses a second rule type with the same name")
    void createDuplicate() {
        service.create(context, severityRuleType("secret_scanning"));

        assertFails(
                () -> service.create(context, severityRuleType("secret_scanning")),
                ErrorKind.CONFLICT,
                "already exists");
    }

    @Test
    @DisplayName("lists only the context project's rule types")
    void list() {
        service.create(context, severityRuleType("a"));
        service.create(context, severityRuleType("b"));
        Project other = db.rootProject("other");
        service.create(new EntityContext(other.id(), null), severityRuleType("c"));

        assertThat(service.list(context))
                .extracting(RuleTypeDocument::name)
                .containsExactlyInAnyOrder("a", "b");
    }

    @Test
    @DisplayName("hides rule types of other projects from lookups by id")
    void getByIdOtherProject() {
        RuleTypeDocument created = service.create(context, severityRuleType("a"));
        Project other = db.rootProject("other");

        assertFails(
                () -> service.getById(new EntityContext(other.id(), null), created.id()),
                ErrorKind.NOT_FOUND,
                "not found");
        assertFails(
                () -> service.getById(context, "nope"),
                ErrorKind.BAD_REQUEST,
                "invalid rule type ID");
        assertThat(service.getById(context, created.id()).name()).isEqualTo("a");
    }

    @Nested
    @DisplayName("update")
    class Update {

        @Test
        @DisplayName("allows any valid change while no profile uses the rule type")
        void unusedRuleType() {
            service.create(context, severityRuleType("secret_scanning"));

            RuleTypeDocument updated =
                    service.update(
                            context,
                            ruleType(
                                    "secret_scanning",
                                    definition(
                                            "repository",
                                            SEVERITY_SCHEMA.replace("\"low\", ", ""),
                                            null)));

            assertThat(updated.def().ruleSchema().toString()).doesNotContain("low");
        }

        @Test
        @DisplayName("rejects removing an enum value a profile may rely on")
        void incompatibleSchema() {
            service.create(context, severityRuleType("secret_scanning"));
            instantiate("secret_scanning", "baseline");

            assertFails(
                    () ->
                            service.update(
                                    context,
                                    ruleType(
                                            "secret_scanning",
                                            definition(
                                                    "repository",
                                                    SEVERITY_SCHEMA.replace("\"low\", ", ""),
                                                    null))),
                    ErrorKind.BAD_REQUEST,
                    "Rule schema update is invalid");
        }

        @Test
        @DisplayName("rejects a new required parameter while in use")
        void incompatibleParams() {
            service.create(context, severityRuleType("secret_scanning"));
            instantiate("secret_scanning", "baseline");

            assertFails(
                    () ->
                            service.update(
                                    context,
                                    ruleType(
                                            "secret_scanning",
                                            definition(
                                                    "repository",
                                                    SEVERITY_SCHEMA,
                                                    "{\"required\": [\"branch\"]}"))),
                    ErrorKind.BAD_REQUEST,
                    "Parameter schema update is invalid");
        }

        @Test
        @DisplayName("accepts a relaxing change while in use")
        void compatibleSchema() {
            service.create(context, severityRuleType("secret_scanning"));
            instantiate("secret_scanning", "baseline");

            RuleTypeDocument updated =
                    service.update(
                            context,
                            ruleType(
                                    "secret_scanning",
                                    definition(
                                            "repository",
                                            SEVERITY_SCHEMA.replace(
                                                    "\"high\"]", "\"high\", \"critical\"]"),
                                            null)));

            assertThat(updated.def().ruleSchema().toString()).contains("critical");
        }

        @Test
        @DisplayName("rejects changing the entity of a rule type in use")
        void entityChange() {
            service.create(context, severityRuleType("secret_scanning"));
            instantiate("secret_scanning", "baseline");

            assertFails(
                    () ->
                            service.update(
                                    context,
                                    ruleType(
                                            "secret_scanning",
                                            definition("artifact", SEVERITY_SCHEMA, null))),
                    ErrorKind.PRECONDITION,
                    "baseline");
        }

        @Test
        @DisplayName("reports an unknown rule type as not found")
        void unknown() {
            assertFails(
                    () -> service.update(context, severityRuleType("missing")),
                    ErrorKind.NOT_FOUND,
                    "rule type missing not found");
        }
    }

    @Nested
    @DisplayName("delete")
    class Delete {

        @Test
        @DisplayName("removes an unused rule type")
        void unused() {
            RuleTypeDocument created = service.create(context, severityRuleType("a"));

            service.deleteById(context, created.id());

            assertFails(
                    () -> service.getByName(context, "a"), ErrorKind.NOT_FOUND, "not found");
        }

        @Test
        @DisplayName("refuses while a profile instantiates the rule type, naming the profile")
        void inUse() {
            RuleTypeDocument created = service.create(context, severityRuleType("secret_scanning"));
            instantiate("secret_scanning", "baseline");

            assertFails(
                    () -> service.deleteById(context, created.id()),
                    ErrorKind.PRECONDITION,
                    "baseline");
            assertThat(service.getById(context, created.id())).isNotNull();
        }

        @Test
        @DisplayName("succeeds once the profile is gone")
        void afterProfileDeleted() {
            RuleTypeDocument created = service.create(context, severityRuleType("secret_scanning"));
            instantiate("secret_scanning", "baseline");
            profiles.delete(context, profiles.getByName(context, "baseline").id());

            service.deleteById(context, created.id());

            assertThat(service.list(context)).isEmpty();
        }

        @Test
        @DisplayName("reports an unknown id as not found")
        void unknown() {
            assertFails(
                    () -> service.deleteById(context, UUID.randomUUID().toString()),
                    ErrorKind.NOT_FOUND,
                    "not found");
        }
    }
}

package com.warden.database.jdbc;

import static com.warden.database.jdbc.RowMappers.timestamp;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.warden.database.NoRowsException;
import com.warden.database.Querier;
import com.warden.database.StoreException;
import com.warden.database.UniqueViolationException;
import com.warden.database.model.EntityProfile;
import com.warden.database.model.Invitation;
import com.warden.database.model.Profile;
import com.warden.database.model.ProfileStatus;
import com.warden.database.model.Project;
import com.warden.database.model.Provider;
import com.warden.database.model.ProviderInstallation;
import com.warden.database.model.RoleAssignment;
import com.warden.database.model.RuleEvaluation;
import com.warden.database.model.RuleType;
import com.warden.database.model.User;
import com.warden.database.model.UserRoleBinding;
import java.time.Clock;
import java.time.Instant;
import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Locale;
import java.util.Set;
import java.util.UUID;
import java.util.function.Supplier;
import org.springframework.dao.DataAccessException;
import org.springframework.dao.DuplicateKeyException;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.jdbc.core.RowMapper;
import org.springframework.jdbc.core.namedparam.MapSqlParameterSource;
import org.springframework.jdbc.core.namedparam.NamedParameterJdbcTemplate;

/**
 * {@link Querier} over a {@link JdbcTemplate}. The template decides the transaction: the pooled
 * data source for auto-commit statements, or a single connection for {@link JdbcStore}
 * transactions.
 *
 * <p>Ids are generated here rather than by the database, so the schema stays portable between
 * PostgreSQL and H2.
 */
final class JdbcQuerier implements Querier {

    private static final String PROVIDER_COLUMNS =
            "id, project_id, name, class, implements, version, definition, created_at";

    private final JdbcTemplate jdbc;
    private final NamedParameterJdbcTemplate named;
    private final ObjectMapper mapper;
    private final RowMapper<Provider> providerMapper;
    private final Clock clock;

    JdbcQuerier(JdbcTemplate jdbc, ObjectMapper mapper, Clock clock) {
        this.jdbc = jdbc;
        this.named = new NamedParameterJdbcTemplate(jdbc);
        this.mapper = mapper;
        this.providerMapper = RowMappers.provider(mapper);
        this.clock = clock;
    }

    // ── Users and role bindings ──

    @Override
    public User getUserBySubject(String subject) {
        return single(
                "user",
                () -> jdbc.query("SELECT * FROM users WHERE subject = ?", RowMappers.USER, subject));
    }

    @Override
    public User createUser(String subject, String displayName) {
        User user = new User(UUID.randomUUID(), subject, displayName, now());
        run(
                "create user",
                () ->
                        jdbc.update(
                                "INSERT INTO users (id, subject, display_name, created_at) VALUES (?, ?, ?, ?)",
                                user.id(),
                                user.subject(),
                                user.displayName(),
                                timestamp(user.createdAt())));
        return user;
    }

    @Override
    public void deleteUser(UUID userId) {
        run("delete user", () -> jdbc.update("DELETE FROM users WHERE id = ?", userId));
    }

    @Override
    public List<Project> getUserProjects(UUID userId) {
        return run(
                "list user projects",
                () ->
                        jdbc.query(
                                """
                                SELECT * FROM projects
                                WHERE id IN (SELECT project_id FROM user_role_bindings WHERE user_id = ?)
                                ORDER BY created_at, name
                                """,
                                RowMappers.PROJECT,
                                userId));
    }

    @Override
    public List<UserRoleBinding> getUserRoles(UUID userId) {
        return run(
                "list user roles",
                () ->
                        jdbc.query(
                                "SELECT * FROM user_role_bindings WHERE user_id = ? ORDER BY project_id, role",
                                RowMappers.ROLE_BINDING,
                                userId));
    }

    @Override
    public void createRoleBinding(NewRoleBinding binding) {
        run(
                "create role binding",
                () ->
                        jdbc.update(
                                """
                                INSERT INTO user_role_bindings (user_id, project_id, organization_id, role, is_admin)
                                VALUES (?, ?, ?, ?, ?)
                                """,
                                binding.userId(),
                                binding.projectId(),
                                binding.organizationId(),
                                binding.role(),
                                binding.isAdmin()));
    }

    @Override
    public int deleteRoleBindingsForProject(UUID userId, UUID projectId) {
        return run(
                "delete role bindings",
                () ->
                        jdbc.update(
                                "DELETE FROM user_role_bindings WHERE user_id = ? AND project_id = ?",
                                userId,
                                projectId));
    }

    @Override
    public int deleteRoleBinding(UUID userId, UUID projectId, String role) {
        return run(
                "delete role binding",
                () ->
                        jdbc.update(
                                "DELETE FROM user_role_bindings WHERE user_id = ? AND project_id = ? AND role = ?",
                                userId,
                                projectId,
                                role));
    }

    @Override
    public List<RoleAssignment> listRoleAssignmentsByProject(UUID projectId) {
        return run(
                "list role assignments",
                () ->
                        jdbc.query(
                                """
                                SELECT b.user_id, u.subject, b.project_id, b.role, b.is_admin
                                FROM user_role_bindings b JOIN users u ON u.id = b.user_id
                                WHERE b.project_id = ?
                                ORDER BY u.subject, b.role
                                """,
                                RowMappers.ROLE_ASSIGNMENT,
                                projectId));
    }

    @Override
    public int countProjectAdmins(UUID projectId) {
        Integer count =
                run(
                        "count project admins",
                        () ->
                                jdbc.queryForObject(
                                        "SELECT COUNT(DISTINCT user_id) FROM user_role_bindings WHERE project_id = ? AND is_admin",
                                        Integer.class,
                                        projectId));
        return count == null ? 0 : count;
    }

    // ── Projects ──

    @Override
    public Project getProjectById(UUID projectId) {
        return single(
                "project",
                () ->
                        jdbc.query(
                                "SELECT * FROM projects WHERE id = ?", RowMappers.PROJECT, projectId));
    }

    @Override
    public Project getProjectByName(String name) {
        return single(
                "project",
                () ->
                        jdbc.query(
                                "SELECT * FROM projects WHERE root_name = LOWER(?)",
                                RowMappers.PROJECT,
                                name));
    }

    @Override
    public Project getChildProjectByName(UUID parentId, String name) {
        return single(
                "project",
                () ->
                        jdbc.query(
                                "SELECT * FROM projects WHERE parent_id = ? AND name = ?",
                                RowMappers.PROJECT,
                                parentId,
                                name));
    }

    @Override
    public List<Project> getChildrenProjects(UUID projectId) {
        List<Project> result = new ArrayList<>();
        Deque<Project> pending = new ArrayDeque<>();
        pending.add(getProjectById(projectId));
        Set<UUID> seen = new LinkedHashSet<>();
        while (!pending.isEmpty()) {
            Project current = pending.removeFirst();
            if (!seen.add(current.id())) {
                continue;
            }
            result.add(current);
            pending.addAll(
                    run(
                            "list child projects",
                            () ->
                                    jdbc.query(
                                            "SELECT * FROM projects WHERE parent_id = ? ORDER BY name",
                                            RowMappers.PROJECT,
                                            current.id())));
        }
        return result;
    }

    @Override
    public List<UUID> getParentProjects(UUID projectId) {
        Set<UUID> chain = new LinkedHashSet<>();
        UUID current = projectId;
        while (current != null && chain.add(current)) {
            current = getProjectById(current).parentId();
        }
        return List.copyOf(chain);
    }

    @Override
    public Project createProject(UUID parentId, String name, String metadata) {
        Project project =
                new Project(UUID.randomUUID(), parentId, name, metadata == null ? "{}" : metadata, now());
        run(
                "create project",
                () ->
                        jdbc.update(
                                "INSERT INTO projects (id, parent_id, name, root_name, metadata, created_at) VALUES (?, ?, ?, ?, ?, ?)",
                                project.id(),
                                project.parentId(),
                                project.name(),
                                parentId == null ? name.toLowerCase(Locale.ROOT) : null,
                                project.metadata(),
                                timestamp(project.createdAt())));
        return project;
    }

    @Override
    public void deleteProject(UUID projectId) {
        run("delete project", () -> jdbc.update("DELETE FROM projects WHERE id = ?", projectId));
    }

    // ── Providers ──

    @Override
    public List<Provider> listProvidersByProjectId(UUID projectId) {
        return run(
                "list providers",
                () ->
                        jdbc.query(
                                "SELECT " + PROVIDER_COLUMNS + " FROM providers WHERE project_id = ? ORDER BY name",
                                providerMapper,
                                projectId));
    }

    @Override
    public Provider getProviderByName(UUID projectId, String name) {
        return single(
                "provider",
                () ->
                        jdbc.query(
                                "SELECT " + PROVIDER_COLUMNS + " FROM providers WHERE project_id = ? AND name = ?",
                                providerMapper,
                                projectId,
                                name));
    }

    @Override
    public Provider getProviderById(UUID providerId) {
        return single(
                "provider",
                () ->
                        jdbc.query(
                                "SELECT " + PROVIDER_COLUMNS + " FROM providers WHERE id = ?",
                                providerMapper,
                                providerId));
    }

    @Override
    public Provider createProvider(NewProvider p) {
        Provider provider =
                new Provider(
                        UUID.randomUUID(),
                        p.projectId(),
                        p.name(),
                        p.providerClass(),
                        p.traits(),
                        p.version(),
                        p.definition() == null ? "{}" : p.definition(),
                        now());
        run(
                "create provider",
                () ->
                        jdbc.update(
                                "INSERT INTO providers (" + PROVIDER_COLUMNS + ") VALUES (?, ?, ?, ?, ?, ?, ?, ?)",
                                provider.id(),
                                provider.projectId(),
                                provider.name(),
                                provider.providerClass(),
                                RowMappers.writeTraits(mapper, provider.traits()),
                                provider.version(),
                                provider.definition(),
                                timestamp(provider.createdAt())));
        return provider;
    }

    @Override
    public List<Provider> findProviders(List<UUID> projectIds, String name) {
        if (projectIds.isEmpty()) {
            return List.of();
        }
        MapSqlParameterSource params = new MapSqlParameterSource("projects", projectIds);
        StringBuilder sql =
                new StringBuilder("SELECT " + PROVIDER_COLUMNS + " FROM providers WHERE project_id IN (:projects)");
        if (name != null && !name.isEmpty()) {
            sql.append(" AND name = :name");
            params.addValue("name", name);
        }
        sql.append(" ORDER BY name");
        return run("find providers", () -> named.query(sql.toString(), params, providerMapper));
    }

    @Override
    public List<ProviderInstallation> getUnclaimedInstallationsByUser(String enrollingUserId) {
        return run(
                "list unclaimed installations",
                () ->
                        jdbc.query(
                                """
                                SELECT * FROM provider_installations
                                WHERE enrolling_user_id = ? AND project_id IS NULL
                                ORDER BY app_installation_id
                                """,
                                RowMappers.INSTALLATION,
                                enrollingUserId));
    }

    @Override
    public boolean claimInstallation(long appInstallationId, UUID projectId, UUID providerId) {
        int updated =
                run(
                        "claim installation",
                        () ->
                                jdbc.update(
                                        """
                                        UPDATE provider_installations SET project_id = ?, provider_id = ?
                                        WHERE app_installation_id = ? AND project_id IS NULL
                                        """,
                                        projectId,
                                        providerId,
                                        appInstallationId));
        return updated == 1;
    }

    // ── Rule types ──

    @Override
    public RuleType createRuleType(NewRuleType r) {
        Instant now = now();
        RuleType ruleType =
                new RuleType(
                        UUID.randomUUID(),
                        r.projectId(),
                        r.provider(),
                        r.name(),
                        nullToEmpty(r.description()),
                        r.definition(),
                        nullToEmpty(r.guidance()),
                        now,
                        now);
        run(
                "create rule type",
                () ->
                        jdbc.update(
                                """
                                INSERT INTO rule_types
                                    (id, project_id, provider, name, description, definition, guidance, created_at, updated_at)
                                VALUES (?, ?, ?, ?, ?, ?, ?, ?, ?)
                                """,
                                ruleType.id(),
                                ruleType.projectId(),
                                ruleType.provider(),
                                ruleType.name(),
                                ruleType.description(),
                                ruleType.definition(),
                                ruleType.guidance(),
                                timestamp(now),
                                timestamp(now)));
        return ruleType;
    }

    @Override
    public RuleType updateRuleType(
            UUID ruleTypeId, String description, String definition, String guidance) {
        int updated =
                run(
                        "update rule type",
                        () ->
                                jdbc.update(
                                        """
                                        UPDATE rule_types SET description = ?, definition = ?, guidance = ?, updated_at = ?
                                        WHERE id = ?
                                        """,
                                        nullToEmpty(description),
                                        definition,
                                        nullToEmpty(guidance),
                                        timestamp(now()),
                                        ruleTypeId));
        if (updated == 0) {
            throw new NoRowsException("rule type not found");
        }
        return getRuleTypeById(ruleTypeId);
    }

    @Override
    public void deleteRuleType(UUID ruleTypeId) {
        run("delete rule type", () -> jdbc.update("DELETE FROM rule_types WHERE id = ?", ruleTypeId));
    }

    @Override
    public RuleType getRuleTypeById(UUID ruleTypeId) {
        return single(
                "rule type",
                () ->
                        jdbc.query(
                                "SELECT * FROM rule_types WHERE id = ?", RowMappers.RULE_TYPE, ruleTypeId));
    }

    @Override
    public RuleType getRuleTypeByName(UUID projectId, String name) {
        return single(
                "rule type",
                () ->
                        jdbc.query(
                                "SELECT * FROM rule_types WHERE project_id = ? AND name = ?",
                                RowMappers.RULE_TYPE,
                                projectId,
                                name));
    }

    @Override
    public List<RuleType> listRuleTypesByProject(UUID projectId) {
        return run(
                "list rule types",
                () ->
                        jdbc.query(
                                "SELECT * FROM rule_types WHERE project_id = ? ORDER BY name",
                                RowMappers.RULE_TYPE,
                                projectId));
    }

    // ── Profiles ──

    @Override
    public Profile createProfile(NewProfile p) {
        Instant now = now();
        Profile profile =
                new Profile(
                        UUID.randomUUID(),
                        p.projectId(),
                        p.provider(),
                        p.name(),
                        p.remediate(),
                        p.alert(),
                        now,
                        now);
        run(
                "create profile",
                () ->
                        jdbc.update(
                                """
                                INSERT INTO profiles
                                    (id, project_id, provider, name, remediate, alert, created_at, updated_at)
                                VALUES (?, ?, ?, ?, ?, ?, ?, ?)
                                """,
                                profile.id(),
                                profile.projectId(),
                                profile.provider(),
                                profile.name(),
                                profile.remediate(),
                                profile.alert(),
                                timestamp(now),
                                timestamp(now)));
        run(
                "create profile status",
                () ->
                        jdbc.update(
                                "INSERT INTO profile_status (profile_id, profile_status, last_updated) VALUES (?, 'pending', ?)",
                                profile.id(),
                                timestamp(now)));
        return profile;
    }

    @Override
    public Profile updateProfile(UUID projectId, UUID profileId, String remediate, String alert) {
        int updated =
                run(
                        "update profile",
                        () ->
                                jdbc.update(
                                        """
                                        UPDATE profiles SET remediate = ?, alert = ?, updated_at = ?
                                        WHERE project_id = ? AND id = ?
                                        """,
                                        remediate,
                                        alert,
                                        timestamp(now()),
                                        projectId,
                                        profileId));
        if (updated == 0) {
            throw new NoRowsException("profile not found");
        }
        return getProfileById(projectId, profileId);
    }

    @Override
    public void deleteProfile(UUID projectId, UUID profileId) {
        run(
                "delete profile",
                () ->
                        jdbc.update(
                                "DELETE FROM profiles WHERE project_id = ? AND id = ?",
                                projectId,
                                profileId));
    }

    @Override
    public Profile getProfileById(UUID projectId, UUID profileId) {
        return single(
                "profile",
                () ->
                        jdbc.query(
                                "SELECT * FROM profiles WHERE project_id = ? AND id = ?",
                                RowMappers.PROFILE,
                                projectId,
                                profileId));
    }

    @Override
    public Profile getProfileByIdAndLock(UUID projectId, UUID profileId) {
        return single(
                "profile",
                () ->
                        jdbc.query(
                                "SELECT * FROM profiles WHERE project_id = ? AND id = ? FOR UPDATE",
                                RowMappers.PROFILE,
                                projectId,
                                profileId));
    }

    @Override
    public Profile getProfileByNameAndLock(UUID projectId, String name) {
        return single(
                "profile",
                () ->
                        jdbc.query(
                                "SELECT * FROM profiles WHERE project_id = ? AND name = ? FOR UPDATE",
                                RowMappers.PROFILE,
                                projectId,
                                name));
    }

    @Override
    public Profile getProfileByProjectAndName(UUID projectId, String name) {
        return single(
                "profile",
                () ->
                        jdbc.query(
                                "SELECT * FROM profiles WHERE project_id = ? AND name = ?",
                                RowMappers.PROFILE,
                                projectId,
                                name));
    }

    @Override
    public List<Profile> listProfilesByProject(UUID projectId) {
        return run(
                "list profiles",
                () ->
                        jdbc.query(
                                "SELECT * FROM profiles WHERE project_id = ? ORDER BY name",
                                RowMappers.PROFILE,
                                projectId));
    }

    @Override
    public EntityProfile createProfileForEntity(
            UUID profileId, String entity, String contextualRules) {
        EntityProfile entityProfile =
                new EntityProfile(UUID.randomUUID(), profileId, entity, contextualRules, now());
        run(
                "create entity profile",
                () ->
                        jdbc.update(
                                """
                                INSERT INTO entity_profiles (id, profile_id, entity, contextual_rules, created_at)
                                VALUES (?, ?, ?, ?, ?)
                                """,
                                entityProfile.id(),
                                profileId,
                                entity,
                                contextualRules,
                                timestamp(entityProfile.createdAt())));
        return entityProfile;
    }

    @Override
    public EntityProfile upsertProfileForEntity(
            UUID profileId, String entity, String contextualRules) {
        int updated =
                run(
                        "update entity profile",
                        () ->
                                jdbc.update(
                                        "UPDATE entity_profiles SET contextual_rules = ? WHERE profile_id = ? AND entity = ?",
                                        contextualRules,
                                        profileId,
                                        entity));
        if (updated == 0) {
            return createProfileForEntity(profileId, entity, contextualRules);
        }
        return single(
                "entity profile",
                () ->
                        jdbc.query(
                                "SELECT * FROM entity_profiles WHERE profile_id = ? AND entity = ?",
                                RowMappers.ENTITY_PROFILE,
                                profileId,
                                entity));
    }

    @Override
    public void deleteProfileForEntity(UUID profileId, String entity) {
        run(
                "delete entity profile",
                () ->
                        jdbc.update(
                                "DELETE FROM entity_profiles WHERE profile_id = ? AND entity = ?",
                                profileId,
                                entity));
    }

    @Override
    public List<EntityProfile> listProfileEntities(UUID profileId) {
        return run(
                "list entity profiles",
                () ->
                        jdbc.query(
                                "SELECT * FROM entity_profiles WHERE profile_id = ? ORDER BY entity",
                                RowMappers.ENTITY_PROFILE,
                                profileId));
    }

    @Override
    public void upsertRuleInstantiation(UUID entityProfileId, UUID ruleTypeId) {
        Integer existing =
                run(
                        "find rule instantiation",
                        () ->
                                jdbc.queryForObject(
                                        "SELECT COUNT(*) FROM rule_instantiations WHERE entity_profile_id = ? AND rule_type_id = ?",
                                        Integer.class,
                                        entityProfileId,
                                        ruleTypeId));
        if (existing != null && existing > 0) {
            return;
        }
        run(
                "create rule instantiation",
                () ->
                        jdbc.update(
                                "INSERT INTO rule_instantiations (id, entity_profile_id, rule_type_id) VALUES (?, ?, ?)",
                                UUID.randomUUID(),
                                entityProfileId,
                                ruleTypeId));
    }

    @Override
    public void deleteRuleInstantiation(UUID entityProfileId, UUID ruleTypeId) {
        run(
                "delete rule instantiation",
                () ->
                        jdbc.update(
                                "DELETE FROM rule_instantiations WHERE entity_profile_id = ? AND rule_type_id = ?",
                                entityProfileId,
                                ruleTypeId));
    }

    @Override
    public List<String> listProfilesInstantiatingRuleType(UUID ruleTypeId) {
        return run(
                "list profiles using rule type",
                () ->
                        jdbc.queryForList(
                                """
                                SELECT DISTINCT p.name
                                FROM profiles p
                                JOIN entity_profiles ep ON ep.profile_id = p.id
                                JOIN rule_instantiations ri ON ri.entity_profile_id = ep.id
                                WHERE ri.rule_type_id = ?
                                ORDER BY p.name
                                """,
                                String.class,
                                ruleTypeId));
    }

    // ── Evaluation status ──

    @Override
    public ProfileStatus getProfileStatusByNameAndProject(UUID projectId, String profileName) {
        return single(
                "profile status",
                () ->
                        jdbc.query(
                                """
                                SELECT s.profile_id, p.name AS profile_name, s.profile_status, s.last_updated
                                FROM profile_status s
                                JOIN profiles p ON p.id = s.profile_id
                                WHERE p.project_id = ? AND p.name = ?
                                """,
                                RowMappers.PROFILE_STATUS,
                                projectId,
                                profileName));
    }

    @Override
    public List<ProfileStatus> getProfileStatusByProject(UUID projectId) {
        return run(
                "list profile statuses",
                () ->
                        jdbc.query(
                                """
                                SELECT s.profile_id, p.name AS profile_name, s.profile_status, s.last_updated
                                FROM profile_status s
                                JOIN profiles p ON p.id = s.profile_id
                                WHERE p.project_id = ?
                                ORDER BY p.name
                                """,
                                RowMappers.PROFILE_STATUS,
                                projectId));
    }

    @Override
    public List<RuleEvaluation> listRuleEvaluationsByProfileId(
            UUID profileId, EvaluationFilter filter) {
        MapSqlParameterSource params = new MapSqlParameterSource("profileId", profileId);
        StringBuilder sql =
                new StringBuilder(
                        """
                        SELECT re.*, rt.name AS rule_type_name,
                               COALESCE(r.provider, ar.provider) AS provider,
                               COALESCE(r.repo_owner, ar.repo_owner) AS repo_owner,
                               COALESCE(r.repo_name, ar.repo_name) AS repo_name,
                               COALESCE(r.repo_id, ar.repo_id) AS repo_id,
                               a.artifact_name, a.artifact_type
                        FROM rule_evaluations re
                        JOIN rule_types rt ON rt.id = re.rule_type_id
                        LEFT JOIN repositories r ON re.entity_kind = 'repository' AND r.id = re.entity_id
                        LEFT JOIN artifacts a ON re.entity_kind = 'artifact' AND a.id = re.entity_id
                        LEFT JOIN repositories ar ON ar.id = a.repository_id
                        WHERE re.profile_id = :profileId
                        """);
        if (filter.entityKind() != null) {
            sql.append(" AND re.entity_kind = :entityKind");
            params.addValue("entityKind", filter.entityKind());
        }
        if (filter.entityId() != null) {
            sql.append(" AND re.entity_id = :entityId");
            params.addValue("entityId", filter.entityId());
        }
        if (filter.ruleName() != null) {
            sql.append(" AND re.rule_name = :ruleName");
            params.addValue("ruleName", filter.ruleName());
        }
        sql.append(" ORDER BY re.rule_name, re.last_updated");
        return run(
                "list rule evaluations",
                () -> named.query(sql.toString(), params, RowMappers.RULE_EVALUATION));
    }

    @Override
    public void deleteRuleStatusesForProfileAndRuleType(
            UUID profileId, UUID ruleTypeId, String ruleName) {
        run(
                "delete rule evaluations",
                () ->
                        jdbc.update(
                                "DELETE FROM rule_evaluations WHERE profile_id = ? AND rule_type_id = ? AND rule_name = ?",
                                profileId,
                                ruleTypeId,
                                ruleName));
    }

    // ── Invitations ──

    @Override
    public Invitation createInvitation(NewInvitation i) {
        Instant now = now();
        Invitation invitation =
                new Invitation(
                        i.code(), i.email(), i.role(), i.projectId(), i.sponsorUserId(), now, now);
        run(
                "create invitation",
                () ->
                        jdbc.update(
                                """
                                INSERT INTO invitations
                                    (code, email, role, project_id, sponsor_user_id, created_at, updated_at)
                                VALUES (?, ?, ?, ?, ?, ?, ?)
                                """,
                                invitation.code(),
                                invitation.email(),
                                invitation.role(),
                                invitation.projectId(),
                                invitation.sponsorUserId(),
                                timestamp(now),
                                timestamp(now)));
        return invitation;
    }

    @Override
    public Invitation getInvitationByCode(String code) {
        return single(
                "invitation",
                () ->
                        jdbc.query(
                                "SELECT * FROM invitations WHERE code = ?", RowMappers.INVITATION, code));
    }

    @Override
    public void deleteInvitation(String code) {
        run("delete invitation", () -> jdbc.update("DELETE FROM invitations WHERE code = ?", code));
    }

    // ── Private Helpers ──

    private Instant now() {
        return clock.instant();
    }

    private static String nullToEmpty(String value) {
        return value == null ? "" : value;
    }

    private static <T> T single(String what, Supplier<List<T>> query) {
        List<T> rows = run("get " + what, query);
        if (rows.isEmpty()) {
            throw new NoRowsException(what + " not found");
        }
        return rows.get(0);
    }

    private static <T> T run(String operation, Supplier<T> statement) {
        try {
            return statement.get();
        } catch (DuplicateKeyException e) {
            throw new UniqueViolationException(operation + ": duplicate key", e);
        } catch (DataAccessException e) {
            throw new StoreException(operation + " failed", e);
        }
    }
}

package com.warden.database.jdbc;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.warden.database.StoreException;
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
import java.sql.ResultSet;
import java.sql.SQLException;
import java.sql.Timestamp;
import java.time.Instant;
import java.util.List;
import java.util.UUID;
import org.springframework.jdbc.core.RowMapper;

/** {@link RowMapper}s for the control-plane tables, one per model record. */
final class RowMappers {

    private static final TypeReference<List<String>> STRING_LIST = new TypeReference<>() {};

    static final RowMapper<User> USER =
            (rs, n) ->
                    new User(
                            uuid(rs, "id"),
                            rs.getString("subject"),
                            rs.getString("display_name"),
                            instant(rs, "created_at"));

    static final RowMapper<Project> PROJECT =
            (rs, n) ->
                    new Project(
                            uuid(rs, "id"),
                            uuid(rs, "parent_id"),
                            rs.getString("name"),
                            rs.getString("metadata"),
                            instant(rs, "created_at"));

    static final RowMapper<UserRoleBinding> ROLE_BINDING =
            (rs, n) ->
                    new UserRoleBinding(
                            uuid(rs, "user_id"),
                            uuid(rs, "project_id"),
                            uuid(rs, "organization_id"),
                            rs.getString("role"),
                            rs.getBoolean("is_admin"));

    static final RowMapper<RoleAssignment> ROLE_ASSIGNMENT =
            (rs, n) ->
                    new RoleAssignment(
                            uuid(rs, "user_id"),
                            rs.getString("subject"),
                            uuid(rs, "project_id"),
                            rs.getString("role"),
                            rs.getBoolean("is_admin"));

    static final RowMapper<ProviderInstallation> INSTALLATION =
            (rs, n) ->
                    new ProviderInstallation(
                            rs.getLong("app_installation_id"),
                            rs.getLong("organization_id"),
                            rs.getString("enrolling_user_id"),
                            uuid(rs, "project_id"),
                            uuid(rs, "provider_id"));

    static final RowMapper<RuleType> RULE_TYPE =
            (rs, n) ->
                    new RuleType(
                            uuid(rs, "id"),
                            uuid(rs, "project_id"),
                            rs.getString("provider"),
                            rs.getString("name"),
                            rs.getString("description"),
                            rs.getString("definition"),
                            rs.getString("guidance"),
                            instant(rs, "created_at"),
                            instant(rs, "updated_at"));

    static final RowMapper<Profile> PROFILE =
            (rs, n) ->
                    new Profile(
                            uuid(rs, "id"),
                            uuid(rs, "project_id"),
                            rs.getString("provider"),
                            rs.getString("name"),
                            rs.getString("remediate"),
                            rs.getString("alert"),
                            instant(rs, "created_at"),
                            instant(rs, "updated_at"));

    static final RowMapper<EntityProfile> ENTITY_PROFILE =
            (rs, n) ->
                    new EntityProfile(
                            uuid(rs, "id"),
                            uuid(rs, "profile_id"),
                            rs.getString("entity"),
                            rs.getString("contextual_rules"),
                            instant(rs, "created_at"));

    static final RowMapper<ProfileStatus> PROFILE_STATUS =
            (rs, n) ->
                    new ProfileStatus(
                            uuid(rs, "profile_id"),
                            rs.getString("profile_name"),
                            rs.getString("profile_status"),
                            instant(rs, "last_updated"));

    static final RowMapper<RuleEvaluation> RULE_EVALUATION =
            (rs, n) -> {
                long repoId = rs.getLong("repo_id");
                Long repoIdOrNull = rs.wasNull() ? null : repoId;
                return new RuleEvaluation(
                        uuid(rs, "id"),
                        uuid(rs, "profile_id"),
                        uuid(rs, "rule_type_id"),
                        rs.getString("rule_type_name"),
                        rs.getString("rule_name"),
                        rs.getString("entity_kind"),
                        uuid(rs, "entity_id"),
                        rs.getString("eval_status"),
                        rs.getString("eval_details"),
                        rs.getString("remediation_status"),
                        rs.getString("remediation_details"),
                        rs.getString("alert_status"),
                        rs.getString("alert_details"),
                        instant(rs, "last_updated"),
                        rs.getString("provider"),
                        rs.getString("repo_owner"),
                        rs.getString("repo_name"),
                        repoIdOrNull,
                        rs.getString("artifact_name"),
                        rs.getString("artifact_type"));
            };

    static final RowMapper<Invitation> INVITATION =
            (rs, n) ->
                    new Invitation(
                            rs.getString("code"),
                            rs.getString("email"),
                            rs.getString("role"),
                            uuid(rs, "project_id"),
                            uuid(rs, "sponsor_user_id"),
                            instant(rs, "created_at"),
                            instant(rs, "updated_at"));

    private RowMappers() {
        // utility class
    }

    static RowMapper<Provider> provider(ObjectMapper mapper) {
        return (rs, n) ->
                new Provider(
                        uuid(rs, "id"),
                        uuid(rs, "project_id"),
                        rs.getString("name"),
                        rs.getString("class"),
                        readTraits(mapper, rs.getString("implements")),
                        rs.getString("version"),
                        rs.getString("definition"),
                        instant(rs, "created_at"));
    }

    static String writeTraits(ObjectMapper mapper, List<String> traits) {
        try {
            return mapper.writeValueAsString(traits == null ? List.of() : traits);
        } catch (JsonProcessingException e) {
            throw new StoreException("cannot encode provider traits", e);
        }
    }

    static Timestamp timestamp(Instant instant) {
        return Timestamp.from(instant);
    }

    private static List<String> readTraits(ObjectMapper mapper, String json) {
        if (json == null || json.isBlank()) {
            return List.of();
        }
        try {
            return mapper.readValue(json, STRING_LIST);
        } catch (JsonProcessingException e) {
            throw new StoreException("stored provider traits are not a JSON array", e);
        }
    }

    private static UUID uuid(ResultSet rs, String column) throws SQLException {
        return rs.getObject(column, UUID.class);
    }

    private static Instant instant(ResultSet rs, String column) throws SQLException {
        Timestamp ts = rs.getTimestamp(column);
        return ts == null ? null : ts.toInstant();
    }
}

package com.warden.database;

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
import java.util.List;
import java.util.UUID;

/**
 * Typed statements over the control-plane schema.
 *
 * <p>Single-row lookups throw {@link NoRowsException} when nothing matches. Inserts colliding with
 * a unique constraint throw {@link UniqueViolationException}. Every other database failure surfaces
 * as {@link StoreException}.
 */
public interface Querier {

    record NewRoleBinding(
            UUID userId, UUID projectId, UUID organizationId, String role, boolean isAdmin) {}

    record NewProvider(
            UUID projectId,
            String name,
            String providerClass,
            List<String> traits,
            String version,
            String definition) {}

    record NewRuleType(
            UUID projectId,
            String provider,
            String name,
            String description,
            String definition,
            String guidance) {}

    record NewProfile(
            UUID projectId, String provider, String name, String remediate, String alert) {}

    record NewInvitation(
            String code, String email, String role, UUID projectId, UUID sponsorUserId) {}

    /** Optional filters for rule evaluations; null fields match everything. */
    record EvaluationFilter(String entityKind, UUID entityId, String ruleName) {

        public static final EvaluationFilter ALL = new EvaluationFilter(null, null, null);
    }

    // ── Users and role bindings ──

    User getUserBySubject(String subject);

    User createUser(String subject, String displayName);

    void deleteUser(UUID userId);

    /** Projects the user holds any role on. */
    List<Project> getUserProjects(UUID userId);

    List<UserRoleBinding> getUserRoles(UUID userId);

    void createRoleBinding(NewRoleBinding binding);

    /** Removes every role the user holds on the project; returns the number removed. */
    int deleteRoleBindingsForProject(UUID userId, UUID projectId);

    /** Removes one role of the user on the project; returns the number removed. */
    int deleteRoleBinding(UUID userId, UUID projectId, String role);

    /** Role bindings held directly on the project, ordered by subject then role. */
    List<RoleAssignment> listRoleAssignmentsByProject(UUID projectId);

    /** Number of distinct users holding an administrator binding on the project. */
    int countProjectAdmins(UUID projectId);

    // ── Projects ──

    Project getProjectById(UUID projectId);

    /** Root project by name, ignoring case. */
    Project getProjectByName(String name);

    Project getChildProjectByName(UUID parentId, String name);

    /** The project and all its descendants, parents before children. */
    List<Project> getChildrenProjects(UUID projectId);

    /** Ids from the project itself up to its root, in that order. */
    List<UUID> getParentProjects(UUID projectId);

    Project createProject(UUID parentId, String name, String metadata);

    void deleteProject(UUID projectId);

    // ── Providers ──

    List<Provider> listProvidersByProjectId(UUID projectId);

    Provider getProviderByName(UUID projectId, String name);

    Provider getProviderById(UUID providerId);

    Provider createProvider(NewProvider provider);

    /** Providers of any of the given projects, optionally restricted to one name. */
    List<Provider> findProviders(List<UUID> projectIds, String name);

    List<ProviderInstallation> getUnclaimedInstallationsByUser(String enrollingUserId);

    /** Binds a pending installation; false when it was already claimed. */
    boolean claimInstallation(long appInstallationId, UUID projectId, UUID providerId);

    // ── Rule types ──

    RuleType createRuleType(NewRuleType ruleType);

    RuleType updateRuleType(UUID ruleTypeId, String description, String definition, String guidance);

    void deleteRuleType(UUID ruleTypeId);

    RuleType getRuleTypeById(UUID ruleTypeId);

    RuleType getRuleTypeByName(UUID projectId, String name);

    List<RuleType> listRuleTypesByProject(UUID projectId);

    // ── Profiles ──

    Profile createProfile(NewProfile profile);

    Profile updateProfile(UUID projectId, UUID profileId, String remediate, String alert);

    void deleteProfile(UUID projectId, UUID profileId);

    Profile getProfileById(UUID projectId, UUID profileId);

    /** Loads the profile and locks its row until the transaction ends. */
    Profile getProfileByIdAndLock(UUID projectId, UUID profileId);

    /** Loads the profile and locks its row until the transaction ends. */
    Profile getProfileByNameAndLock(UUID projectId, String name);

    Profile getProfileByProjectAndName(UUID projectId, String name);

    List<Profile> listProfilesByProject(UUID projectId);

    EntityProfile createProfileForEntity(UUID profileId, String entity, String contextualRules);

    EntityProfile upsertProfileForEntity(UUID profileId, String entity, String contextualRules);

    void deleteProfileForEntity(UUID profileId, String entity);

    List<EntityProfile> listProfileEntities(UUID profileId);

    void upsertRuleInstantiation(UUID entityProfileId, UUID ruleTypeId);

    void deleteRuleInstantiation(UUID entityProfileId, UUID ruleTypeId);

    /** Names of the profiles with at least one rule of the type, sorted. */
    List<String> listProfilesInstantiatingRuleType(UUID ruleTypeId);

    // ── Evaluation status ──

    ProfileStatus getProfileStatusByNameAndProject(UUID projectId, String profileName);

    List<ProfileStatus> getProfileStatusByProject(UUID projectId);

    List<RuleEvaluation> listRuleEvaluationsByProfileId(UUID profileId, EvaluationFilter filter);

    void deleteRuleStatusesForProfileAndRuleType(UUID profileId, UUID ruleTypeId, String ruleName);

    // ── Invitations ──

    Invitation createInvitation(NewInvitation invitation);

    Invitation getInvitationByCode(String code);

    void deleteInvitation(String code);
}

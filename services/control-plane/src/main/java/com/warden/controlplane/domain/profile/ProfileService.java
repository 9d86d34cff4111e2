package com.warden.controlplane.domain.profile;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.warden.controlplane.domain.EntityContext;
import com.warden.controlplane.domain.EntityKind;
import com.warden.controlplane.domain.ServiceException;
import com.warden.controlplane.domain.Uuids;
import com.warden.controlplane.domain.ruletype.RuleTypes;
import com.warden.database.NoRowsException;
import com.warden.database.Querier;
import com.warden.database.Store;
import com.warden.database.StoreException;
import com.warden.database.Transaction;
import com.warden.database.model.EntityProfile;
import com.warden.database.model.Profile;
import com.warden.database.model.ProfileStatus;
import com.warden.database.model.RuleEvaluation;
import com.warden.database.model.RuleType;
import com.warden.eventmodel.EventFactory;
import com.warden.eventmodel.EventPublishException;
import com.warden.eventmodel.EventPublisher;
import com.warden.eventmodel.EventTopic;
import com.warden.observability.CorrelationContextHolder;
import java.util.EnumMap;
import java.util.HashMap;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.UUID;
import java.util.stream.Collectors;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Profile lifecycle and status reporting.
 *
 * <p>Writes run in one transaction: the profile row, its per-entity rules and the rule
 * instantiations that tie it to rule types. After a create or update commits, a {@code
 * profile-initialised} event asks evaluators to re-evaluate the project's entities; a failure to
 * publish is logged and does not fail the call.
 */
public class ProfileService {

    private static final Logger log = LoggerFactory.getLogger(ProfileService.class);

    private static final TypeReference<List<RuleRef>> RULE_LIST = new TypeReference<>() {};

    private static final Set<String> FAILING_STATUSES = Set.of("failure", "error");

    private final Store store;
    private final ProfileValidator validator;
    private final EventPublisher events;
    private final ObjectMapper mapper;
    private final String producer;

    public ProfileService(
            Store store,
            ProfileValidator validator,
            EventPublisher events,
            ObjectMapper mapper,
            String producer) {
        this.store = store;
        this.validator = validator;
        this.events = events;
        this.mapper = mapper;
        this.producer = producer;
    }

    public ProfileDocument create(EntityContext context, ProfileDocument profile) {
        String provider = requireProvider(context);
        ProfileDocument created;
        try (Transaction tx = store.beginTransaction()) {
            Querier querier = store.querierWithTransaction(tx);
            Map<String, RuleType> ruleTypes =
                    validator.validate(querier, context.projectId(), provider, profile);
            ProfileDocument named = profile.withRuleNames();

            Profile row;
            try {
                row =
                        querier.createProfile(
                                new Querier.NewProfile(
                                        context.projectId(),
                                        provider,
                                        named.name(),
                                        ActionMode.fromString(named.remediate()).storedValue(),
                                        ActionMode.fromString(named.alert()).storedValue()));
            } catch (StoreException e) {
                if (store.isUniqueViolation(e)) {
                    throw ServiceException.conflict("profile already exists");
                }
                throw e;
            }

            for (Map.Entry<EntityKind, List<RuleRef>> entry : named.rulesByEntity().entrySet()) {
                if (entry.getValue().isEmpty()) {
                    continue;
                }
                EntityProfile entityProfile =
                        querier.createProfileForEntity(
                                row.id(), entry.getKey().value(), encodeRules(entry.getValue()));
                instantiate(querier, entityProfile, entry.getValue(), ruleTypes);
            }
            store.commit(tx);
            log.info("Created profile {} in project {}", row.name(), row.projectId());
            created = toDocument(row, named.rulesByEntity());
        } catch (StoreException e) {
            throw ServiceException.internal("failed to create profile", e);
        }
        publishInitialised(context.projectId(), provider);
        return created;
    }

    public ProfileDocument update(EntityContext context, ProfileDocument profile) {
        ProfileDocument updated;
        String provider;
        try (Transaction tx = store.beginTransaction()) {
            Querier querier = store.querierWithTransaction(tx);
            validator.checkDocument(profile);
            ProfileDocument named = profile.withRuleNames();

            Profile existing = lock(querier, context, named);
            if (!existing.name().equals(named.name())) {
                throw ServiceException.badRequest(
                        "invalid profile update: cannot change profile name");
            }
            if (context.provider() != null
                    && existing.provider() != null
                    && !existing.provider().equals(context.provider())) {
                throw ServiceException.badRequest(
                        "invalid profile update: cannot change profile provider");
            }
            provider = existing.provider() != null ? existing.provider() : context.provider();
            Map<String, RuleType> ruleTypes =
                    validator.validate(querier, context.projectId(), provider, profile);
            Map<EntityKind, List<RuleRef>> previousRules = loadRules(querier, existing.id());

            Profile row =
                    querier.updateProfile(
                            context.projectId(),
                            existing.id(),
                            ActionMode.fromString(named.remediate()).storedValue(),
                            ActionMode.fromString(named.alert()).storedValue());

            Map<EntityKind, UUID> entityProfileIds = new EnumMap<>(EntityKind.class);
            for (Map.Entry<EntityKind, List<RuleRef>> entry : named.rulesByEntity().entrySet()) {
                if (entry.getValue().isEmpty()) {
                    querier.deleteProfileForEntity(existing.id(), entry.getKey().value());
                    continue;
                }
                EntityProfile entityProfile =
                        querier.upsertProfileForEntity(
                                existing.id(),
                                entry.getKey().value(),
                                encodeRules(entry.getValue()));
                instantiate(querier, entityProfile, entry.getValue(), ruleTypes);
                entityProfileIds.put(entry.getKey(), entityProfile.id());
            }
            removeStaleRules(
                    querier, context, existing, previousRules, named, entityProfileIds);

            store.commit(tx);
            log.info("Updated profile {} in project {}", row.name(), row.projectId());
            updated = toDocument(row, named.rulesByEntity());
        } catch (StoreException e) {
            throw ServiceException.internal("failed to update profile", e);
        }
        publishInitialised(context.projectId(), provider);
        return updated;
    }

    public void delete(EntityContext context, String id) {
        UUID profileId = parseProfileId(id);
        try (Transaction tx = store.beginTransaction()) {
            Querier querier = store.querierWithTransaction(tx);
            Profile profile = load(querier, context, profileId);
            querier.deleteProfile(context.projectId(), profileId);
            store.commit(tx);
            log.info("Deleted profile {} from project {}", profile.name(), profile.projectId());
        } catch (StoreException e) {
            throw ServiceException.internal("failed to delete profile", e);
        }
    }

    public List<ProfileDocument> list(EntityContext context) {
        try {
            Querier querier = store.querier();
            return querier.listProfilesByProject(context.projectId()).stream()
                    .map(row -> toDocument(row, loadRules(querier, row.id())))
                    .toList();
        } catch (StoreException e) {
            throw ServiceException.internal("failed to list profiles", e);
        }
    }

    public ProfileDocument getById(EntityContext context, String id) {
        UUID profileId = parseProfileId(id);
        try {
            Querier querier = store.querier();
            Profile row = load(querier, context, profileId);
            return toDocument(row, loadRules(querier, row.id()));
        } catch (StoreException e) {
            throw ServiceException.internal("failed to get profile", e);
        }
    }

    public ProfileDocument getByName(EntityContext context, String name) {
        try {
            Querier querier = store.querier();
            Profile row = querier.getProfileByProjectAndName(context.projectId(), name);
            return toDocument(row, loadRules(querier, row.id()));
        } catch (NoRowsException e) {
            throw ServiceException.notFound("profile not found");
        } catch (StoreException e) {
            throw ServiceException.internal("failed to get profile", e);
        }
    }

    /**
     * Aggregate status of a profile with its latest rule evaluations. Evaluations not yet complete
     * are left out; failing ones carry their rule type's guidance.
     */
    public ProfileStatusReport statusByName(
            EntityContext context, String profileName, EvaluationSelector selector) {
        Querier.EvaluationFilter filter = toFilter(selector);
        Querier querier = store.querier();
        ProfileStatus status;
        try {
            status = querier.getProfileStatusByNameAndProject(context.projectId(), profileName);
        } catch (NoRowsException e) {
            throw ServiceException.notFound("profile status not found");
        } catch (StoreException e) {
            throw ServiceException.internal("failed to get profile status", e);
        }

        List<RuleEvaluation> rows;
        try {
            rows = querier.listRuleEvaluationsByProfileId(status.profileId(), filter);
        } catch (StoreException e) {
            throw ServiceException.internal("failed to list rule evaluations", e);
        }
        Map<UUID, Optional<String>> guidance = new HashMap<>();
        List<RuleEvaluationView> evaluations =
                rows.stream()
                        .filter(ProfileService::isComplete)
                        .map(row -> toEvaluationView(row, context, guidance))
                        .toList();
        return new ProfileStatusReport(toStatusView(status), evaluations);
    }

    public List<ProfileStatusView> statusByProject(EntityContext context) {
        try {
            return store.querier().getProfileStatusByProject(context.projectId()).stream()
                    .map(ProfileService::toStatusView)
                    .toList();
        } catch (StoreException e) {
            throw ServiceException.internal("failed to get profile status", e);
        }
    }

    private String requireProvider(EntityContext context) {
        String name = context.requireProvider();
        try {
            store.querier().getProviderByName(context.projectId(), name);
        } catch (NoRowsException e) {
            throw ServiceException.notFound("provider not found");
        }
        return name;
    }

    private static void instantiate(
            Querier querier,
            EntityProfile entityProfile,
            List<RuleRef> rules,
            Map<String, RuleType> ruleTypes) {
        Set<UUID> instantiated = new HashSet<>();
        for (RuleRef rule : rules) {
            RuleType ruleType = ruleTypes.get(rule.type());
            if (ruleType != null && instantiated.add(ruleType.id())) {
                querier.upsertRuleInstantiation(entityProfile.id(), ruleType.id());
            }
        }
    }

    /**
     * Drops instantiations of rule types an entity no longer uses, and the evaluation status of
     * rules that are gone from the profile.
     */
    private void removeStaleRules(
            Querier querier,
            EntityContext context,
            Profile profile,
            Map<EntityKind, List<RuleRef>> previousRules,
            ProfileDocument current,
            Map<EntityKind, UUID> entityProfileIds) {
        Set<RuleKey> currentKeys = new HashSet<>();
        for (List<RuleRef> rules : current.rulesByEntity().values()) {
            rules.forEach(rule -> currentKeys.add(RuleKey.of(rule)));
        }

        List<UUID> projects = querier.getParentProjects(context.projectId());
        Map<String, Optional<RuleType>> resolved = new HashMap<>();
        Set<RuleKey> removedStatuses = new HashSet<>();
        for (Map.Entry<EntityKind, List<RuleRef>> entry : previousRules.entrySet()) {
            Set<String> currentTypes =
                    current.rulesFor(entry.getKey()).stream()
                            .map(RuleRef::type)
                            .collect(Collectors.toSet());
            UUID entityProfileId = entityProfileIds.get(entry.getKey());
            Set<UUID> uninstantiated = new HashSet<>();
            for (RuleRef rule : entry.getValue()) {
                Optional<RuleType> ruleType =
                        resolved.computeIfAbsent(
                                rule.type(),
                                type ->
                                        RuleTypes.findVisible(
                                                querier, projects, type, profile.provider()));
                if (ruleType.isEmpty()) {
                    log.debug("Rule type {} of profile {} no longer exists", rule.type(),
                            profile.name());
                    continue;
                }
                UUID ruleTypeId = ruleType.get().id();
                if (entityProfileId != null
                        && !currentTypes.contains(rule.type())
                        && uninstantiated.add(ruleTypeId)) {
                    querier.deleteRuleInstantiation(entityProfileId, ruleTypeId);
                }
                RuleKey key = RuleKey.of(rule);
                if (!currentKeys.contains(key) && removedStatuses.add(key)) {
                    querier.deleteRuleStatusesForProfileAndRuleType(
                            profile.id(), ruleTypeId, key.name());
                }
            }
        }
    }

    private static Profile lock(Querier querier, EntityContext context, ProfileDocument profile) {
        try {
            if (profile.id() != null && !profile.id().isEmpty()) {
                return querier.getProfileByIdAndLock(
                        context.projectId(), parseProfileId(profile.id()));
            }
            return querier.getProfileByNameAndLock(context.projectId(), profile.name());
        } catch (NoRowsException e) {
            throw ServiceException.notFound("profile not found");
        }
    }

    private static Profile load(Querier querier, EntityContext context, UUID profileId) {
        try {
            return querier.getProfileById(context.projectId(), profileId);
        } catch (NoRowsException e) {
            throw ServiceException.notFound("profile not found");
        }
    }

    private static UUID parseProfileId(String id) {
        return Uuids.parse(id).orElseThrow(() -> ServiceException.badRequest("invalid profile ID"));
    }

    private Map<EntityKind, List<RuleRef>> loadRules(Querier querier, UUID profileId) {
        Map<EntityKind, List<RuleRef>> rules = new EnumMap<>(EntityKind.class);
        for (EntityProfile entityProfile : querier.listProfileEntities(profileId)) {
            Optional<EntityKind> kind = EntityKind.fromString(entityProfile.entity());
            if (kind.isEmpty()) {
                log.warn("Ignoring rules of unknown entity {} in profile {}",
                        entityProfile.entity(), profileId);
                continue;
            }
            rules.put(kind.get(), decodeRules(entityProfile));
        }
        return rules;
    }

    private String encodeRules(List<RuleRef> rules) {
        try {
            return mapper.writeValueAsString(rules);
        } catch (JsonProcessingException e) {
            throw ServiceException.internal("cannot encode profile rules", e);
        }
    }

    private List<RuleRef> decodeRules(EntityProfile entityProfile) {
        try {
            return mapper.readValue(entityProfile.contextualRules(), RULE_LIST);
        } catch (JsonProcessingException e) {
            throw ServiceException.internal(
                    "cannot decode rules of profile " + entityProfile.profileId(), e);
        }
    }

    private static ProfileDocument toDocument(Profile row, Map<EntityKind, List<RuleRef>> rules) {
        return new ProfileDocument(
                row.id().toString(),
                row.name(),
                row.projectId().toString(),
                row.provider(),
                row.remediate(),
                row.alert(),
                rulesOrNull(rules, EntityKind.REPOSITORY),
                rulesOrNull(rules, EntityKind.ARTIFACT),
                rulesOrNull(rules, EntityKind.BUILD_ENVIRONMENT),
                rulesOrNull(rules, EntityKind.PULL_REQUEST));
    }

    private static List<RuleRef> rulesOrNull(
            Map<EntityKind, List<RuleRef>> rules, EntityKind kind) {
        List<RuleRef> entityRules = rules.get(kind);
        return entityRules == null || entityRules.isEmpty() ? null : entityRules;
    }

    private static Querier.EvaluationFilter toFilter(EvaluationSelector selector) {
        if (selector == null) {
            return Querier.EvaluationFilter.ALL;
        }
        String entityKind = null;
        if (hasText(selector.entityType())) {
            entityKind =
                    EntityKind.fromString(selector.entityType())
                            .map(EntityKind::value)
                            .orElseThrow(
                                    () ->
                                            ServiceException.badRequest(
                                                    String.format(
                                                            "invalid entity type %s, please use"
                                                                    + " one of %s",
                                                            selector.entityType(),
                                                            EntityKind.knownValues())));
        }
        UUID entityId = null;
        if (hasText(selector.entityId())) {
            entityId =
                    Uuids.parse(selector.entityId())
                            .orElseThrow(
                                    () ->
                                            ServiceException.badRequest(
                                                    "invalid entity ID in selector"));
        }
        String ruleName = hasText(selector.ruleName()) ? selector.ruleName() : null;
        return new Querier.EvaluationFilter(entityKind, entityId, ruleName);
    }

    private static boolean isComplete(RuleEvaluation row) {
        return row.evalStatus() != null
                && row.evalDetails() != null
                && row.remediationStatus() != null
                && row.lastUpdated() != null;
    }

    private RuleEvaluationView toEvaluationView(
            RuleEvaluation row, EntityContext context, Map<UUID, Optional<String>> guidanceCache) {
        String guidance = null;
        if (FAILING_STATUSES.contains(row.evalStatus())) {
            guidance = guidanceCache.computeIfAbsent(row.ruleTypeId(), this::loadGuidance)
                    .orElse(null);
        }
        Map<String, String> entityInfo =
                EntityKind.fromString(row.entityKind())
                        .map(kind -> kind.describe(row, context.provider()))
                        .orElseGet(() -> providerOnly(row, context));
        return new RuleEvaluationView(
                row.profileId().toString(),
                row.ruleTypeId().toString(),
                row.ruleTypeName(),
                row.ruleName(),
                row.entityKind(),
                row.entityId().toString(),
                entityInfo,
                row.evalStatus(),
                row.evalDetails(),
                row.remediationStatus(),
                row.remediationDetails(),
                row.alertStatus(),
                row.alertDetails(),
                guidance,
                row.lastUpdated());
    }

    private Optional<String> loadGuidance(UUID ruleTypeId) {
        try {
            return Optional.of(store.querier().getRuleTypeById(ruleTypeId).guidance());
        } catch (StoreException e) {
            log.warn("Cannot load guidance of rule type {}", ruleTypeId, e);
            return Optional.empty();
        }
    }

    private static Map<String, String> providerOnly(RuleEvaluation row, EntityContext context) {
        Map<String, String> info = new LinkedHashMap<>();
        String provider = row.provider() != null ? row.provider() : context.provider();
        if (provider != null) {
            info.put("provider", provider);
        }
        return info;
    }

    private static ProfileStatusView toStatusView(ProfileStatus status) {
        return new ProfileStatusView(
                status.profileId().toString(),
                status.profileName(),
                status.status(),
                status.lastUpdated());
    }

    private void publishInitialised(UUID projectId, String provider) {
        try {
            events.publish(
                    EventFactory.profileInitialised(
                            producer,
                            provider,
                            projectId.toString(),
                            CorrelationContextHolder.correlationId().orElse(null)));
        } catch (EventPublishException e) {
            log.error("Failed to publish {} for project {}",
                    EventTopic.PROFILE_INITIALISED.value(), projectId, e);
        }
    }

    private static boolean hasText(String value) {
        return value != null && !value.isBlank();
    }

    private record RuleKey(String type, String name) {

        static RuleKey of(RuleRef rule) {
            return new RuleKey(rule.type(), rule.effectiveName());
        }
    }
}

package com.warden.controlplane.domain.ruletype;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.warden.controlplane.domain.EntityContext;
import com.warden.controlplane.domain.ServiceException;
import com.warden.controlplane.domain.Uuids;
import com.warden.database.NoRowsException;
import com.warden.database.Querier;
import com.warden.database.Store;
import com.warden.database.StoreException;
import com.warden.database.Transaction;
import com.warden.database.model.RuleType;
import java.util.List;
import java.util.Objects;
import java.util.UUID;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Create, update, delete and read rule types of a project.
 *
 * <p>Rule types that profiles instantiate may only change in ways that keep existing rule
 * definitions and parameters valid: their entity kind is fixed and their schemas may only relax.
 */
public class RuleTypeService {

    private static final Logger log = LoggerFactory.getLogger(RuleTypeService.class);

    private final Store store;
    private final ObjectMapper mapper;

    public RuleTypeService(Store store, ObjectMapper mapper) {
        this.store = store;
        this.mapper = mapper;
    }

    public RuleTypeDocument create(EntityContext context, RuleTypeDocument ruleType) {
        RuleTypeValidator.validate(ruleType);
        String definition = encode(ruleType.def());

        try (Transaction tx = store.beginTransaction()) {
            Querier querier = store.querierWithTransaction(tx);
            if (exists(querier, context.projectId(), ruleType.name())) {
                throw alreadyExists(ruleType.name());
            }
            RuleType created;
            try {
                created =
                        querier.createRuleType(
                                new Querier.NewRuleType(
                                        context.projectId(),
                                        context.provider(),
                                        ruleType.name(),
                                        Objects.requireNonNullElse(ruleType.description(), ""),
                                        definition,
                                        Objects.requireNonNullElse(ruleType.guidance(), "")));
            } catch (StoreException e) {
                if (store.isUniqueViolation(e)) {
                    throw alreadyExists(ruleType.name());
                }
                throw e;
            }
            store.commit(tx);
            log.info("Created rule type {} in project {}", created.name(), created.projectId());
            return toDocument(created);
        } catch (StoreException e) {
            throw ServiceException.internal("failed to create rule type", e);
        }
    }

    public RuleTypeDocument update(EntityContext context, RuleTypeDocument ruleType) {
        RuleTypeValidator.validate(ruleType);
        String definition = encode(ruleType.def());

        try (Transaction tx = store.beginTransaction()) {
            Querier querier = store.querierWithTransaction(tx);
            RuleType existing;
            try {
                existing = querier.getRuleTypeByName(context.projectId(), ruleType.name());
            } catch (NoRowsException e) {
                throw ServiceException.notFound("rule type " + ruleType.name() + " not found");
            }

            List<String> profiles = querier.listProfilesInstantiatingRuleType(existing.id());
            if (!profiles.isEmpty()) {
                checkInstantiatedUpdate(existing, ruleType.def(), profiles);
            }

            RuleType updated =
                    querier.updateRuleType(
                            existing.id(),
                            Objects.requireNonNullElse(ruleType.description(), ""),
                            definition,
                            Objects.requireNonNullElse(ruleType.guidance(), ""));
            store.commit(tx);
            log.info("Updated rule type {} in project {}", updated.name(), updated.projectId());
            return toDocument(updated);
        } catch (StoreException e) {
            throw ServiceException.internal("failed to update rule type", e);
        }
    }

    public void deleteById(EntityContext context, String id) {
        UUID ruleTypeId = parseRuleTypeId(id);

        try (Transaction tx = store.beginTransaction()) {
            Querier querier = store.querierWithTransaction(tx);
            RuleType ruleType = load(querier, context, ruleTypeId);
            List<String> profiles = querier.listProfilesInstantiatingRuleType(ruleTypeId);
            if (!profiles.isEmpty()) {
                throw ServiceException.precondition(
                        String.format(
                                "cannot delete: rule type %s is used by profiles %s",
                                ruleType.id(), String.join(", ", profiles)));
            }
            querier.deleteRuleType(ruleTypeId);
            store.commit(tx);
            log.info("Deleted rule type {} from project {}", ruleType.name(), ruleType.projectId());
        } catch (StoreException e) {
            throw ServiceException.internal("failed to delete rule type", e);
        }
    }

    public List<RuleTypeDocument> list(EntityContext context) {
        List<RuleType> ruleTypes;
        try {
            ruleTypes = store.querier().listRuleTypesByProject(context.projectId());
        } catch (StoreException e) {
            throw ServiceException.unknown("failed to get rule types", e);
        }
        return ruleTypes.stream().map(this::toDocument).toList();
    }

    public RuleTypeDocument getByName(EntityContext context, String name) {
        try {
            return toDocument(store.querier().getRuleTypeByName(context.projectId(), name));
        } catch (NoRowsException e) {
            throw ServiceException.notFound("rule type " + name + " not found");
        } catch (StoreException e) {
            throw ServiceException.unknown("failed to get rule type", e);
        }
    }

    public RuleTypeDocument getById(EntityContext context, String id) {
        UUID ruleTypeId = parseRuleTypeId(id);
        try {
            return toDocument(load(store.querier(), context, ruleTypeId));
        } catch (StoreException e) {
            throw ServiceException.unknown("failed to get rule type", e);
        }
    }

    RuleTypeDefinition decode(RuleType ruleType) {
        return RuleTypes.decode(mapper, ruleType);
    }

    private void checkInstantiatedUpdate(
            RuleType existing, RuleTypeDefinition newDef, List<String> profiles) {
        RuleTypeDefinition oldDef = decode(existing);
        if (!Objects.equals(oldDef.inEntity(), newDef.inEntity())) {
            throw ServiceException.precondition(
                    String.format(
                            "cannot change entity of rule type %s: used by profiles %s",
                            existing.name(), String.join(", ", profiles)));
        }
        try {
            SchemaUpdateValidator.checkCompatible(oldDef.ruleSchema(), newDef.ruleSchema());
        } catch (SchemaUpdateException e) {
            throw ServiceException.badRequest(
                    "Rule schema update is invalid: " + e.getMessage(), e);
        }
        try {
            SchemaUpdateValidator.checkCompatible(oldDef.paramSchema(), newDef.paramSchema());
        } catch (SchemaUpdateException e) {
            throw ServiceException.badRequest(
                    "Parameter schema update is invalid: " + e.getMessage(), e);
        }
    }

    /** Loads a rule type of the context project; other projects' rule types are not found. */
    private static RuleType load(Querier querier, EntityContext context, UUID ruleTypeId) {
        RuleType ruleType;
        try {
            ruleType = querier.getRuleTypeById(ruleTypeId);
        } catch (NoRowsException e) {
            throw ServiceException.notFound("rule type " + ruleTypeId + " not found");
        }
        if (!ruleType.projectId().equals(context.projectId())) {
            throw ServiceException.notFound("rule type " + ruleTypeId + " not found");
        }
        return ruleType;
    }

    private static UUID parseRuleTypeId(String id) {
        return Uuids.parse(id)
                .orElseThrow(() -> ServiceException.badRequest("invalid rule type ID"));
    }

    private static boolean exists(Querier querier, UUID projectId, String name) {
        try {
            querier.getRuleTypeByName(projectId, name);
            return true;
        } catch (NoRowsException e) {
            return false;
        }
    }

    private static ServiceException alreadyExists(String name) {
        return ServiceException.conflict("rule type " + name + " already exists");
    }

    private String encode(RuleTypeDefinition def) {
        try {
            return mapper.writeValueAsString(def);
        } catch (JsonProcessingException e) {
            throw ServiceException.internal("cannot encode rule type definition", e);
        }
    }

    RuleTypeDocument toDocument(RuleType ruleType) {
        return new RuleTypeDocument(
                ruleType.id().toString(),
                ruleType.name(),
                ruleType.projectId().toString(),
                ruleType.provider(),
                ruleType.description(),
                decode(ruleType),
                ruleType.guidance());
    }
}

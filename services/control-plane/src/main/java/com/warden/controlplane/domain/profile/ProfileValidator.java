package com.warden.controlplane.domain.profile;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.warden.controlplane.domain.EntityKind;
import com.warden.controlplane.domain.Names;
import com.warden.controlplane.domain.ServiceException;
import com.warden.controlplane.domain.ruletype.JsonSchemas;
import com.warden.controlplane.domain.ruletype.RuleTypeDefinition;
import com.warden.controlplane.domain.ruletype.RuleTypes;
import com.warden.database.Querier;
import com.warden.database.model.RuleType;
import java.util.HashMap;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.UUID;

/**
 * Validates a profile against its shape, its rule naming constraints and the rule types it
 * instantiates.
 *
 * <p>Checks run in order: shape, rule names, rule entity kinds, rule definitions and parameters.
 * The first failure is reported as {@code BAD_REQUEST}.
 */
public class ProfileValidator {

    private final ObjectMapper mapper;

    public ProfileValidator(ObjectMapper mapper) {
        this.mapper = mapper;
    }

    /**
     * Validates {@code profile} as it would be stored in {@code projectId}.
     *
     * @return the rule type of every rule, keyed by rule type name
     */
    public Map<String, RuleType> validate(
            Querier querier, UUID projectId, String provider, ProfileDocument profile) {
        checkDocument(profile);

        List<UUID> projects = querier.getParentProjects(projectId);
        Map<String, Optional<RuleType>> resolved = new HashMap<>();
        Map<String, RuleTypeDefinition> definitions = new HashMap<>();
        for (Map.Entry<EntityKind, List<RuleRef>> entry : profile.rulesByEntity().entrySet()) {
            for (RuleRef rule : entry.getValue()) {
                Optional<RuleType> ruleType =
                        resolved.computeIfAbsent(
                                rule.type(),
                                type -> RuleTypes.findVisible(querier, projects, type, provider));
                if (ruleType.isEmpty()) {
                    continue;
                }
                RuleTypeDefinition def =
                        definitions.computeIfAbsent(
                                rule.type(), type -> RuleTypes.decode(mapper, ruleType.get()));
                if (!entry.getKey().value().equals(def.inEntity())) {
                    throw ServiceException.badRequest(
                            String.format(
                                    "profile failed rule validation: rule type %s expects entity"
                                            + " %s, but was given entity %s",
                                    rule.type(), def.inEntity(), entry.getKey().value()));
                }
            }
        }

        Map<String, RuleType> ruleTypes = new LinkedHashMap<>();
        for (List<RuleRef> rules : profile.rulesByEntity().values()) {
            for (RuleRef rule : rules) {
                Optional<RuleType> ruleType = resolved.get(rule.type());
                if (ruleType.isEmpty()) {
                    throw invalidRule(rule, "cannot find rule type " + rule.type());
                }
                checkRule(rule, definitions.get(rule.type()));
                ruleTypes.put(rule.type(), ruleType.get());
            }
        }
        return ruleTypes;
    }

    /** Checks what can be checked without the store: shape, names and rule names. */
    public void checkDocument(ProfileDocument profile) {
        Optional<String> shapeProblem = checkShape(profile);
        if (shapeProblem.isPresent()) {
            throw ServiceException.badRequest("invalid profile: " + shapeProblem.get());
        }
        for (EntityKind kind : EntityKind.values()) {
            Optional<String> problem = checkRuleNames(kind, profile.rulesFor(kind));
            if (problem.isPresent()) {
                throw ServiceException.badRequest(
                        "profile failed rule name validation: " + problem.get());
            }
        }
    }

    static Optional<String> checkShape(ProfileDocument profile) {
        if (profile == null) {
            return Optional.of("profile cannot be nil");
        }
        if (profile.name() == null || profile.name().isEmpty()) {
            return Optional.of("profile name cannot be empty");
        }
        Optional<String> nameProblem = Names.checkDnsStyle(profile.name());
        if (nameProblem.isPresent()) {
            return nameProblem;
        }
        for (EntityKind kind : EntityKind.values()) {
            List<RuleRef> rules = profile.rulesFor(kind);
            for (int i = 0; i < rules.size(); i++) {
                RuleRef rule = rules.get(i);
                if (rule == null || rule.type() == null || rule.type().isEmpty()) {
                    return Optional.of(
                            String.format(
                                    "%s rule %d is invalid: rule type cannot be empty",
                                    kind.value(), i));
                }
                if (rule.def() == null || rule.def().isNull()) {
                    return Optional.of(
                            String.format(
                                    "%s rule %d is invalid: rule def cannot be nil",
                                    kind.value(), i));
                }
            }
        }
        return Optional.empty();
    }

    /**
     * Naming constraints within one entity kind. An unnamed rule is named after its type, so:
     * a name may not match another rule type, two unnamed rules may not share a type, and a
     * given name may not repeat any other rule's name, given or implied.
     */
    static Optional<String> checkRuleNames(EntityKind kind, List<RuleRef> rules) {
        Set<String> types = new HashSet<>();
        Set<String> unnamedTypes = new HashSet<>();
        for (RuleRef rule : rules) {
            String name = rule.name() == null ? "" : rule.name();
            types.add(rule.type());
            if (types.contains(name) && !name.equals(rule.type())) {
                return Optional.of(
                        String.format(
                                "rule name '%s' conflicts with a rule type in entity '%s', rule"
                                        + " name cannot match other rule types",
                                name, kind.value()));
            }
            if (name.isEmpty() && !unnamedTypes.add(rule.type())) {
                return Optional.of(
                        String.format(
                                "multiple rules with empty name and same type in entity '%s',"
                                        + " add unique names to rules",
                                kind.value()));
            }
        }

        Map<String, String> typeByName = new HashMap<>();
        for (RuleRef rule : rules) {
            String name = rule.name();
            if (name == null || name.isEmpty()) {
                continue;
            }
            String existingType = typeByName.get(name);
            if (existingType != null) {
                if (existingType.equals(rule.type())) {
                    return Optional.of(
                            String.format(
                                    "multiple rules of same type with same name '%s' in entity"
                                            + " '%s', assign unique names to rules",
                                    name, kind.value()));
                }
                return Optional.of(
                        String.format(
                                "rule name '%s' conflicts with rule name of type '%s' in entity"
                                        + " '%s', assign unique names to rules",
                                name, existingType, kind.value()));
            }
            if (name.equals(rule.type()) && unnamedTypes.contains(rule.type())) {
                return Optional.of(
                        String.format(
                                "rule name '%s' conflicts with default rule name of unnamed rule"
                                        + " in entity '%s', assign unique names to rules",
                                name, kind.value()));
            }
            typeByName.put(name, rule.type());
        }
        return Optional.empty();
    }

    private static void checkRule(RuleRef rule, RuleTypeDefinition def) {
        Optional<String> problem = JsonSchemas.validate(def.ruleSchema(), rule.def());
        if (problem.isPresent()) {
            throw invalidRule(rule, problem.get());
        }
        if (def.paramSchema() == null || def.paramSchema().isNull()) {
            return;
        }
        if (rule.params() == null || rule.params().isNull()) {
            throw invalidRule(rule, "params cannot be nil");
        }
        problem = JsonSchemas.validate(def.paramSchema(), rule.params());
        if (problem.isPresent()) {
            throw invalidRule(rule, problem.get());
        }
    }

    private static ServiceException invalidRule(RuleRef rule, String problem) {
        return ServiceException.badRequest(
                String.format("profile contained invalid rule '%s': %s", rule.type(), problem));
    }
}

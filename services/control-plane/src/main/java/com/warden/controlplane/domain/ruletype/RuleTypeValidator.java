package com.warden.controlplane.domain.ruletype;

import com.fasterxml.jackson.databind.JsonNode;
import com.warden.controlplane.domain.EntityKind;
import com.warden.controlplane.domain.Names;
import com.warden.controlplane.domain.ServiceException;
import java.util.Optional;
import java.util.Set;

/** Static checks on a rule type document, before any store access. */
public final class RuleTypeValidator {

    private static final Set<String> DIFF_TYPES = Set.of("", "dep", "full");

    private RuleTypeValidator() {
        // utility class
    }

    /**
     * Validates name, definition and guidance.
     *
     * @throws ServiceException with kind {@code BAD_REQUEST} describing the first problem
     */
    public static void validate(RuleTypeDocument ruleType) {
        if (ruleType == null) {
            throw ServiceException.badRequest("invalid rule type: rule type is nil");
        }
        String name = ruleType.name();
        if (name == null || name.isEmpty()) {
            throw ServiceException.badRequest("invalid rule type: rule type name is empty");
        }
        Optional<String> problem = Names.checkNamespaced(name);
        if (problem.isPresent()) {
            throw ServiceException.badRequest("invalid rule type: " + problem.get());
        }
        if (ruleType.def() == null) {
            throw ServiceException.badRequest("invalid rule type: rule type definition is nil");
        }
        problem = checkDefinition(ruleType.def());
        if (problem.isPresent()) {
            throw ServiceException.badRequest("invalid rule type definition: " + problem.get());
        }
        GuidanceSanitizer.check(ruleType.guidance());
    }

    static Optional<String> checkDefinition(RuleTypeDefinition def) {
        if (EntityKind.fromString(def.inEntity()).isEmpty()) {
            return Optional.of("invalid entity type: " + def.inEntity());
        }
        if (isMissing(def.ruleSchema())) {
            return Optional.of("rule schema is nil");
        }
        Optional<String> schemaProblem = JsonSchemas.checkWellFormed(def.ruleSchema());
        if (schemaProblem.isPresent()) {
            return Optional.of("rule schema is not a valid JSON schema: " + schemaProblem.get());
        }
        if (!isMissing(def.paramSchema())) {
            schemaProblem = JsonSchemas.checkWellFormed(def.paramSchema());
            if (schemaProblem.isPresent()) {
                return Optional.of(
                        "param schema is not a valid JSON schema: " + schemaProblem.get());
            }
        }
        if (isMissing(def.ingest())) {
            return Optional.of("data ingest is nil");
        }
        if ("diff".equals(def.ingest().path("type").asText())) {
            JsonNode diff = def.ingest().get("diff");
            if (isMissing(diff)) {
                return Optional.of("diff ingest is nil");
            }
            String diffType = diff.path("type").asText("");
            if (!DIFF_TYPES.contains(diffType)) {
                return Optional.of("diffing type is invalid: " + diffType);
            }
        }
        if (isMissing(def.eval())) {
            return Optional.of("data eval is nil");
        }
        return Optional.empty();
    }

    static boolean isMissing(JsonNode node) {
        return node == null || node.isNull() || node.isMissingNode();
    }
}

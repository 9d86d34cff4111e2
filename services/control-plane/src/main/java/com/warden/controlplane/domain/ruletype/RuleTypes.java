package com.warden.controlplane.domain.ruletype;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.warden.controlplane.domain.ServiceException;
import com.warden.database.NoRowsException;
import com.warden.database.Querier;
import com.warden.database.model.RuleType;
import java.util.List;
import java.util.Optional;
import java.util.UUID;

/** Lookup and decoding of stored rule types. */
public final class RuleTypes {

    private RuleTypes() {
        // utility class
    }

    public static RuleTypeDefinition decode(ObjectMapper mapper, RuleType ruleType) {
        try {
            return mapper.readValue(ruleType.definition(), RuleTypeDefinition.class);
        } catch (JsonProcessingException e) {
            throw ServiceException.internal("cannot decode rule type " + ruleType.name(), e);
        }
    }

    /**
     * Finds a rule type visible from a project: its own or one of its ancestors', nearest first.
     * Rule types bound to another provider than {@code provider} are not visible.
     *
     * @param projects the project followed by its ancestors, as returned by {@link
     *     Querier#getParentProjects(UUID)}
     * @param provider provider of the caller's context; null matches any rule type
     */
    public static Optional<RuleType> findVisible(
            Querier querier, List<UUID> projects, String name, String provider) {
        for (UUID projectId : projects) {
            RuleType candidate;
            try {
                candidate = querier.getRuleTypeByName(projectId, name);
            } catch (NoRowsException e) {
                continue;
            }
            if (provider == null
                    || candidate.provider() == null
                    || candidate.provider().equals(provider)) {
                return Optional.of(candidate);
            }
        }
        return Optional.empty();
    }
}

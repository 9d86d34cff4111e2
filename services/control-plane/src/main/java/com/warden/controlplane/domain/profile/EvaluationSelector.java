package com.warden.controlplane.domain.profile;

/**
 * Optional narrowing of the evaluations returned with a profile status. Blank fields match
 * everything.
 *
 * @param entityType entity kind wire name
 * @param entityId entity id
 * @param ruleName rule name
 */
public record EvaluationSelector(String entityType, String entityId, String ruleName) {

    public static final EvaluationSelector ALL = new EvaluationSelector(null, null, null);
}

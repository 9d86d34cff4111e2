package com.warden.controlplane.domain.ruletype;

import static com.warden.controlplane.TestRuleTypes.SEVERITY_SCHEMA;
import static com.warden.controlplane.TestRuleTypes.definition;
import static com.warden.controlplane.TestRuleTypes.json;
import static com.warden.controlplane.TestRuleTypes.ruleType;
import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatCode;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import com.warden.controlplane.domain.ServiceException;
import org.junit.jupiter.api.Test;

class RuleTypeValidatorTest {

    @Test
    void acceptsNamespacedName() {
        assertThatCode(
                        () ->
                                RuleTypeValidator.validate(
                                        ruleType(
                                                "acme/secret_scanning",
                                                definition("repository", SEVERITY_SCHEMA, null))))
                .doesNotThrowAnyException();
    }

    @Test
    void rejectsMissingRuleType() {
        assertThatThrownBy(() -> RuleTypeValidator.validate(null))
                .isInstanceOf(ServiceException.class)
                .hasMessage("invalid rule type: rule type is nil");
    }

    @Test
    void rejectsBadNames() {
        RuleTypeDefinition def = definition("repository", SEVERITY_SCHEMA, null);

        assertThatThrownBy(() -> RuleTypeValidator.validate(ruleType("", def)))
                .hasMessage("invalid rule type: rule type name is empty");
        assertThatThrownBy(() -> RuleTypeValidator.validate(ruleType("a/b/c", def)))
                .hasMessageContaining("more than one slash");
        assertThatThrownBy(() -> RuleTypeValidator.validate(ruleType("-leading", def)))
                .hasMessageContaining("name may only contain");
    }

    @Test
    void rejectsUnknownEntity() {
        assertThatThrownBy(
                        () ->
                                RuleTypeValidator.validate(
                                        ruleType(
                                                "rt",
                                                definition("cluster", SEVERITY_SCHEMA, null))))
                .hasMessage("invalid rule type definition: invalid entity type: cluster");
    }

    @Test
    void rejectsMalformedRuleSchema() {
        assertThatThrownBy(
                        () ->
                                RuleTypeValidator.validate(
                                        ruleType(
                                                "rt",
                                                definition("repository", "{\"type\": 12}", null))))
                .hasMessageStartingWith(
                        "invalid rule type definition: rule schema is not a valid JSON schema");
    }

    @Test
    void requiresIngestAndEval() {
        RuleTypeDefinition noIngest =
                new RuleTypeDefinition(
                        "repository", json(SEVERITY_SCHEMA), null, null, json("{}"), null, null);
        RuleTypeDefinition noEval =
                new RuleTypeDefinition(
                        "repository",
                        json(SEVERITY_SCHEMA),
                        null,
                        json("{\"type\": \"git\"}"),
                        null,
                        null,
                        null);

        assertThat(RuleTypeValidator.checkDefinition(noIngest)).contains("data ingest is nil");
        assertThat(RuleTypeValidator.checkDefinition(noEval)).contains("data eval is nil");
    }

    @Test
    void checksDiffIngest() {
        RuleTypeDefinition badDiff =
                new RuleTypeDefinition(
                        "pull_request",
                        json(SEVERITY_SCHEMA),
                        null,
                        json("{\"type\": \"diff\", \"diff\": {\"type\": \"partial\"}}"),
                        json("{\"type\": \"rego\"}"),
                        null,
                        null);
        RuleTypeDefinition missingDiff =
                new RuleTypeDefinition(
                        "pull_request",
                        json(SEVERITY_SCHEMA),
                        null,
                        json("{\"type\": \"diff\"}"),
                        json("{\"type\": \"rego\"}"),
                        null,
                        null);

        assertThat(RuleTypeValidator.checkDefinition(badDiff))
                .contains("diffing type is invalid: partial");
        assertThat(RuleTypeValidator.checkDefinition(missingDiff)).contains("diff ingest is nil");
    }

    @Test
    void checksGuidance() {
        RuleTypeDocument withHtml =
                RuleTypeDocument.of(
                        "rt",
                        "",
                        definition("repository", SEVERITY_SCHEMA, null),
                        "<script>alert(1)</script>");

        assertThatThrownBy(() -> RuleTypeValidator.validate(withHtml))
                .isInstanceOf(ServiceException.class)
                .hasMessageContaining("HTML");
    }
}

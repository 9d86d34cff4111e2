package com.warden.controlplane.domain.ruletype;

import static org.assertj.core.api.Assertions.assertThatCode;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

class SchemaUpdateValidatorTest {

    private static final ObjectMapper MAPPER = new ObjectMapper();

    private static final String SEVERITY =
            """
            {
              "type": "object",
              "properties": {
                "severity": {"type": "string", "enum": ["low", "medium", "high"]},
                "branch": {"type": "string", "maxLength": 64}
              },
              "required": ["branch"]
            }
            """;

    private static JsonNode json(String value) {
        try {
            return MAPPER.readTree(value);
        } catch (JsonProcessingException e) {
            throw new IllegalArgumentException(e);
        }
    }

    private static void assertCompatible(String oldSchema, String newSchema) {
        JsonNode before = json(oldSchema);
        JsonNode after = json(newSchema);

        assertThatCode(() -> SchemaUpdateValidator.checkCompatible(before, after))
                .doesNotThrowAnyException();
    }

    @Nested
    @DisplayName("accepts")
    class Accepts {

        @Test
        void identicalSchema() {
            assertCompatible(SEVERITY, SEVERITY);
        }

        @Test
        void addedEnumValue() {
            assertCompatible(
                    SEVERITY,
                    SEVERITY.replace("\"high\"]", "\"high\", \"critical\"]"));
        }

        @Test
        void addedOptionalProperty() {
            assertCompatible(
                    SEVERITY,
                    SEVERITY.replace(
                            "\"branch\": {", "\"labels\": {\"type\": \"array\"}, \"branch\": {"));
        }

        @Test
        void droppedRequiredField() {
            assertCompatible(
                    SEVERITY,
                    SEVERITY.replace("\"required\": [\"branch\"]", "\"required\": []"));
        }

        @Test
        void relaxedUpperBound() {
            assertCompatible(SEVERITY, SEVERITY.replace("64", "128"));
        }

        @Test
        void widenedIntegerToNumber() {
            assertCompatible("{\"type\": \"integer\"}", "{\"type\": \"number\"}");
        }

        @Test
        void emptyNewSchema() {
            assertCompatible(SEVERITY, "{}");
        }

        @Test
        void constraintsAddedToEmptySchemaWithoutRequiredFields() {
            assertCompatible("{}", "{\"type\": \"object\", \"properties\": {\"a\": {}}}");
        }
    }

    @Nested
    @DisplayName("rejects")
    class Rejects {

        @Test
        @DisplayName("removing an enum value")
        void removedEnumValue() {
            assertThatThrownBy(
                            () ->
                                    SchemaUpdateValidator.checkCompatible(
                                            json(SEVERITY),
                                            json(SEVERITY.replace("\"low\", ", ""))))
                    .isInstanceOf(SchemaUpdateException.class)
                    .hasMessageContaining("cannot remove enum values")
                    .hasMessageContaining("low")
                    .extracting(e -> ((SchemaUpdateException) e).path())
                    .isEqualTo("$.severity");
        }

        @Test
        @DisplayName("adding a required field")
        void addedRequiredField() {
            assertThatThrownBy(
                            () ->
                                    SchemaUpdateValidator.checkCompatible(
                                            json(SEVERITY),
                                            json(
                                                    SEVERITY.replace(
                                                            "[\"branch\"]",
                                                            "[\"branch\", \"severity\"]"))))
                    .isInstanceOf(SchemaUpdateException.class)
                    .hasMessageContaining("cannot add required fields");
        }

        @Test
        @DisplayName("adding a required field to an empty schema")
        void requiredFieldOnEmptySchema() {
            assertThatThrownBy(
                            () ->
                                    SchemaUpdateValidator.checkCompatible(
                                            json("{}"), json("{\"required\": [\"a\"]}")))
                    .isInstanceOf(SchemaUpdateException.class);
        }

        @Test
        @DisplayName("removing a property")
        void removedProperty() {
            assertThatThrownBy(
                            () ->
                                    SchemaUpdateValidator.checkCompatible(
                                            json(SEVERITY),
                                            json(
                                                    """
                                                    {"type": "object",
                                                     "properties": {"branch": {"type": "string"}}}
                                                    """)))
                    .isInstanceOf(SchemaUpdateException.class)
                    .hasMessageContaining("cannot remove property severity");
        }

        @Test
        @DisplayName("tightening a bound")
        void tightenedBound() {
            assertThatThrownBy(
                            () ->
                                    SchemaUpdateValidator.checkCompatible(
                                            json(SEVERITY), json(SEVERITY.replace("64", "32"))))
                    .isInstanceOf(SchemaUpdateException.class)
                    .hasMessageContaining("cannot decrease maxLength");
        }

        @Test
        @DisplayName("changing a type")
        void changedType() {
            assertThatThrownBy(
                            () ->
                                    SchemaUpdateValidator.checkCompatible(
                                            json("{\"type\": \"string\"}"),
                                            json("{\"type\": \"integer\"}")))
                    .isInstanceOf(SchemaUpdateException.class)
                    .hasMessageContaining("cannot remove type string");
        }

        @Test
        @DisplayName("adding a pattern")
        void addedPattern() {
            assertThatThrownBy(
                            () ->
                                    SchemaUpdateValidator.checkCompatible(
                                            json("{\"type\": \"string\"}"),
                                            json("{\"type\": \"string\", \"pattern\": \"^v\"}")))
                    .isInstanceOf(SchemaUpdateException.class)
                    .hasMessageContaining("cannot add pattern constraint");
        }
    }
}

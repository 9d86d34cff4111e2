package com.warden.controlplane.domain.ruletype;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.NullNode;
import com.networknt.schema.JsonSchema;
import com.networknt.schema.JsonSchemaException;
import com.networknt.schema.JsonSchemaFactory;
import com.networknt.schema.SchemaId;
import com.networknt.schema.SchemaLocation;
import com.networknt.schema.SpecVersion;
import com.networknt.schema.ValidationMessage;
import java.util.Optional;
import java.util.Set;
import java.util.stream.Collectors;

/** JSON Schema (draft 7) checks for rule and parameter schemas. */
public final class JsonSchemas {

    private static final JsonSchemaFactory FACTORY =
            JsonSchemaFactory.getInstance(SpecVersion.VersionFlag.V7);

    private static final JsonSchema META_SCHEMA =
            FACTORY.getSchema(SchemaLocation.of(SchemaId.V7));

    private JsonSchemas() {
        // utility class
    }

    /** Checks that {@code schema} is itself a valid draft 7 schema. */
    public static Optional<String> checkWellFormed(JsonNode schema) {
        return describe(META_SCHEMA.validate(schema));
    }

    /**
     * Validates {@code document} against {@code schema}. A missing document is validated as JSON
     * {@code null}.
     */
    public static Optional<String> validate(JsonNode schema, JsonNode document) {
        JsonSchema compiled;
        try {
            compiled = FACTORY.getSchema(schema);
        } catch (JsonSchemaException e) {
            return Optional.of("invalid json schema: " + e.getMessage());
        }
        JsonNode target = document == null ? NullNode.getInstance() : document;
        return describe(compiled.validate(target));
    }

    private static Optional<String> describe(Set<ValidationMessage> errors) {
        if (errors.isEmpty()) {
            return Optional.empty();
        }
        String joined =
                errors.stream()
                        .map(ValidationMessage::getMessage)
                        .sorted()
                        .collect(Collectors.joining("; "));
        return Optional.of("invalid json schema: " + joined);
    }
}

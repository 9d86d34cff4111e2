package com.warden.controlplane.domain.ruletype;

import com.fasterxml.jackson.databind.JsonNode;
import java.util.ArrayList;
import java.util.Iterator;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Decides whether a JSON Schema may replace another without invalidating documents the old one
 * accepted. Used when a rule type that profiles already instantiate is updated: the new schema
 * may relax constraints but never tighten them.
 *
 * <p>The check is structural and conservative. Constraints are compared keyword by keyword;
 * anything that cannot be shown to be at least as permissive is rejected.
 */
public final class SchemaUpdateValidator {

    private static final List<String> LOWER_BOUNDS =
            List.of("minimum", "exclusiveMinimum", "minLength", "minItems", "minProperties");

    private static final List<String> UPPER_BOUNDS =
            List.of("maximum", "exclusiveMaximum", "maxLength", "maxItems", "maxProperties");

    private static final List<String> FIXED_KEYWORDS =
            List.of("pattern", "const", "format", "multipleOf");

    private static final String ROOT = "$";

    private SchemaUpdateValidator() {
        // utility class
    }

    /**
     * Throws {@link SchemaUpdateException} naming the first incompatible change.
     *
     * <p>An empty new schema accepts everything. When the old schema is empty only new top-level
     * required fields are rejected; other added constraints are accepted, since nothing could have
     * been validated against an empty schema.
     */
    public static void checkCompatible(JsonNode oldSchema, JsonNode newSchema) {
        if (isUnconstrained(newSchema)) {
            return;
        }
        if (isUnconstrained(oldSchema)) {
            if (!stringSet(newSchema.get("required")).isEmpty()) {
                throw new SchemaUpdateException(ROOT, "cannot add required fields");
            }
            return;
        }
        check(ROOT, oldSchema, newSchema);
    }

    private static void check(String path, JsonNode oldSchema, JsonNode newSchema) {
        if (isUnconstrained(newSchema)) {
            return;
        }
        if (newSchema.isBoolean()) {
            // only "false" remains here
            if (!(oldSchema != null && oldSchema.isBoolean() && !oldSchema.asBoolean())) {
                throw new SchemaUpdateException(path, "cannot reject every value");
            }
            return;
        }
        if (isUnconstrained(oldSchema)) {
            throw new SchemaUpdateException(path, "cannot constrain an unconstrained value");
        }
        if (oldSchema.isBoolean()) {
            // old schema is "false": nothing was ever accepted
            return;
        }
        checkTypes(path, oldSchema, newSchema);
        checkRequired(path, oldSchema, newSchema);
        checkProperties(path, oldSchema, newSchema);
        checkAdditionalProperties(path, oldSchema, newSchema);
        checkEnum(path, oldSchema, newSchema);
        checkBounds(path, oldSchema, newSchema);
        checkFixedKeywords(path, oldSchema, newSchema);
        checkItems(path, oldSchema, newSchema);
    }

    private static void checkTypes(String path, JsonNode oldSchema, JsonNode newSchema) {
        Set<String> newTypes = typesOf(newSchema);
        if (newTypes == null) {
            return;
        }
        Set<String> oldTypes = typesOf(oldSchema);
        if (oldTypes == null) {
            throw new SchemaUpdateException(path, "cannot add type constraint " + newTypes);
        }
        for (String type : oldTypes) {
            boolean covered =
                    newTypes.contains(type)
                            || ("integer".equals(type) && newTypes.contains("number"));
            if (!covered) {
                throw new SchemaUpdateException(path, "cannot remove type " + type);
            }
        }
    }

    private static void checkRequired(String path, JsonNode oldSchema, JsonNode newSchema) {
        Set<String> added = stringSet(newSchema.get("required"));
        added.removeAll(stringSet(oldSchema.get("required")));
        if (!added.isEmpty()) {
            throw new SchemaUpdateException(path, "cannot add required fields " + added);
        }
    }

    private static void checkProperties(String path, JsonNode oldSchema, JsonNode newSchema) {
        JsonNode oldProperties = oldSchema.get("properties");
        if (oldProperties == null || !oldProperties.isObject()) {
            return;
        }
        JsonNode newProperties = newSchema.get("properties");
        Iterator<Map.Entry<String, JsonNode>> fields = oldProperties.fields();
        while (fields.hasNext()) {
            Map.Entry<String, JsonNode> field = fields.next();
            JsonNode replacement = newProperties == null ? null : newProperties.get(field.getKey());
            if (replacement == null) {
                throw new SchemaUpdateException(
                        path, "cannot remove property " + field.getKey());
            }
            check(path + "." + field.getKey(), field.getValue(), replacement);
        }
    }

    private static void checkAdditionalProperties(
            String path, JsonNode oldSchema, JsonNode newSchema) {
        JsonNode newValue = newSchema.get("additionalProperties");
        if (newValue == null) {
            return;
        }
        check(path + ".additionalProperties", oldSchema.get("additionalProperties"), newValue);
    }

    private static void checkEnum(String path, JsonNode oldSchema, JsonNode newSchema) {
        JsonNode newEnum = newSchema.get("enum");
        if (newEnum == null) {
            return;
        }
        JsonNode oldEnum = oldSchema.get("enum");
        if (oldEnum == null) {
            throw new SchemaUpdateException(path, "cannot add enum constraint");
        }
        List<JsonNode> removed = new ArrayList<>();
        for (JsonNode value : oldEnum) {
            if (!contains(newEnum, value)) {
                removed.add(value);
            }
        }
        if (!removed.isEmpty()) {
            throw new SchemaUpdateException(path, "cannot remove enum values " + removed);
        }
    }

    private static void checkBounds(String path, JsonNode oldSchema, JsonNode newSchema) {
        for (String keyword : LOWER_BOUNDS) {
            JsonNode newBound = newSchema.get(keyword);
            if (newBound == null) {
                continue;
            }
            JsonNode oldBound = requireExisting(path, keyword, oldSchema);
            if (compare(path, keyword, newBound, oldBound) > 0) {
                throw new SchemaUpdateException(path, "cannot increase " + keyword);
            }
        }
        for (String keyword : UPPER_BOUNDS) {
            JsonNode newBound = newSchema.get(keyword);
            if (newBound == null) {
                continue;
            }
            JsonNode oldBound = requireExisting(path, keyword, oldSchema);
            if (compare(path, keyword, newBound, oldBound) < 0) {
                throw new SchemaUpdateException(path, "cannot decrease " + keyword);
            }
        }
    }

    private static void checkFixedKeywords(String path, JsonNode oldSchema, JsonNode newSchema) {
        for (String keyword : FIXED_KEYWORDS) {
            JsonNode newValue = newSchema.get(keyword);
            if (newValue == null) {
                continue;
            }
            JsonNode oldValue = requireExisting(path, keyword, oldSchema);
            if (!oldValue.equals(newValue)) {
                throw new SchemaUpdateException(path, "cannot change " + keyword);
            }
        }
    }

    private static void checkItems(String path, JsonNode oldSchema, JsonNode newSchema) {
        JsonNode newItems = newSchema.get("items");
        if (newItems == null) {
            return;
        }
        JsonNode oldItems = requireExisting(path, "items", oldSchema);
        if (newItems.isArray() || oldItems.isArray()) {
            if (!newItems.isArray() || !oldItems.isArray() || newItems.size() > oldItems.size()) {
                throw new SchemaUpdateException(path, "cannot change items layout");
            }
            for (int i = 0; i < newItems.size(); i++) {
                check(path + "[" + i + "]", oldItems.get(i), newItems.get(i));
            }
            return;
        }
        check(path + "[]", oldItems, newItems);
    }

    private static JsonNode requireExisting(String path, String keyword, JsonNode oldSchema) {
        JsonNode oldValue = oldSchema.get(keyword);
        if (oldValue == null) {
            throw new SchemaUpdateException(path, "cannot add " + keyword + " constraint");
        }
        return oldValue;
    }

    private static int compare(String path, String keyword, JsonNode left, JsonNode right) {
        if (!left.isNumber() || !right.isNumber()) {
            if (left.equals(right)) {
                return 0;
            }
            throw new SchemaUpdateException(path, "cannot change " + keyword);
        }
        return left.decimalValue().compareTo(right.decimalValue());
    }

    /** Declared types, the implied {@code object} type, or null when unconstrained. */
    private static Set<String> typesOf(JsonNode schema) {
        JsonNode type = schema.get("type");
        if (type == null) {
            boolean objectShaped =
                    schema.has("properties")
                            || schema.has("required")
                            || schema.has("additionalProperties");
            return objectShaped ? Set.of("object") : null;
        }
        if (type.isArray()) {
            return stringSet(type);
        }
        return Set.of(type.asText());
    }

    private static Set<String> stringSet(JsonNode array) {
        Set<String> values = new LinkedHashSet<>();
        if (array != null && array.isArray()) {
            array.forEach(value -> values.add(value.asText()));
        }
        return values;
    }

    private static boolean contains(JsonNode array, JsonNode value) {
        for (JsonNode candidate : array) {
            if (candidate.equals(value)) {
                return true;
            }
        }
        return false;
    }

    private static boolean isUnconstrained(JsonNode schema) {
        return schema == null
                || schema.isNull()
                || (schema.isObject() && schema.isEmpty())
                || (schema.isBoolean() && schema.asBoolean());
    }
}

package io.pipevar.core.model;

import com.fasterxml.jackson.databind.JsonNode;
import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.stream.Collectors;

/**
 * Recursive, immutable type descriptor. A tagged union over scalar, array and object nodes: the
 * {@link SchemaType} tag decides which of the remaining fields are meaningful.
 *
 * <ul>
 * <li>scalar ({@code string}, {@code int}, {@code float}, {@code boolean}): optional
 * {@code enumValues}; empty means unconstrained.</li>
 * <li>{@code array}: {@code itemSchema} describes every element; {@code null} leaves items
 * unchecked.</li>
 * <li>{@code object}: {@code propertySchemas} maps property names to child schemas; an empty map
 * accepts any properties unchecked.</li>
 * </ul>
 *
 * <p>
 * Nodes are built bottom-up from already constructed children, so a schema tree is always finite.
 */
public record SchemaNode(
        SchemaType type,
        String description,
        List<JsonNode> enumValues,
        SchemaNode itemSchema,
        Map<String, SchemaNode> propertySchemas) {

    public SchemaNode {
        Objects.requireNonNull(type, "type must not be null");
        description = description == null ? "" : description;
        if (enumValues == null || enumValues.isEmpty()) {
            enumValues = List.of();
        } else {
            if (!type.isScalar()) {
                throw new IllegalArgumentException("enum is only allowed on scalar types, got " + type.wireName());
            }
            List<JsonNode> copies = new ArrayList<>(enumValues.size());
            for (JsonNode value : enumValues) {
                copies.add(Objects.requireNonNull(value, "enum values must not be null").deepCopy());
            }
            enumValues = Collections.unmodifiableList(copies);
        }
        if (itemSchema != null && type != SchemaType.ARRAY) {
            throw new IllegalArgumentException("itemSchema is only allowed on array, got " + type.wireName());
        }
        if (propertySchemas == null || propertySchemas.isEmpty()) {
            propertySchemas = Map.of();
        } else {
            if (type != SchemaType.OBJECT) {
                throw new IllegalArgumentException(
                        "propertySchemas is only allowed on object, got " + type.wireName());
            }
            propertySchemas = Collections.unmodifiableMap(new LinkedHashMap<>(propertySchemas));
        }
    }

    public static SchemaNode scalar(SchemaType type) {
        return new SchemaNode(type, null, null, null, null);
    }

    public static SchemaNode string() {
        return scalar(SchemaType.STRING);
    }

    public static SchemaNode integer() {
        return scalar(SchemaType.INT);
    }

    public static SchemaNode floating() {
        return scalar(SchemaType.FLOAT);
    }

    public static SchemaNode bool() {
        return scalar(SchemaType.BOOLEAN);
    }

    public static SchemaNode arrayOf(SchemaNode itemSchema) {
        return new SchemaNode(SchemaType.ARRAY, null, null, itemSchema, null);
    }

    public static SchemaNode object(Map<String, SchemaNode> propertySchemas) {
        return new SchemaNode(SchemaType.OBJECT, null, null, null, propertySchemas);
    }

    /** Object schema accepting any properties. */
    public static SchemaNode anyObject() {
        return object(Map.of());
    }

    public SchemaNode withDescription(String newDescription) {
        return new SchemaNode(type, newDescription, enumValues, itemSchema, propertySchemas);
    }

    public SchemaNode withEnum(List<JsonNode> values) {
        return new SchemaNode(type, description, values, itemSchema, propertySchemas);
    }

    /**
     * Short human-readable summary used in violations, e.g. {@code int}, {@code array<string>},
     * {@code object{branch, timeout}} or {@code string enum["a", "b"]}.
     */
    public String summary() {
        switch (type) {
            case ARRAY:
                return itemSchema == null ? "array" : "array<" + itemSchema.summary() + ">";
            case OBJECT:
                if (propertySchemas.isEmpty()) {
                    return "object";
                }
                return "object{" + String.join(", ", propertySchemas.keySet()) + "}";
            default:
                if (enumValues.isEmpty()) {
                    return type.wireName();
                }
                return type.wireName() + " enum"
                        + enumValues.stream().map(JsonNode::toString).collect(Collectors.joining(", ", "[", "]"));
        }
    }
}

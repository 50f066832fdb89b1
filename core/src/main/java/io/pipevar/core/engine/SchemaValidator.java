package io.pipevar.core.engine;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.NullNode;
import io.pipevar.core.model.SchemaNode;
import io.pipevar.core.model.ValidationReport;
import io.pipevar.core.model.Violation;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * Checks values against a {@link SchemaNode} tree.
 *
 * <ul>
 * <li>scalars: the runtime type must match ({@code int} accepts integral numbers, {@code float}
 * any number); a non-empty enum requires membership, numbers compared by value.</li>
 * <li>arrays: every element is checked against the item schema; paths carry {@code [i]}.</li>
 * <li>objects: every declared property that is present is checked. Absent or {@code null}
 * properties and undeclared properties are accepted.</li>
 * </ul>
 *
 * <p>
 * Validation never mutates the value and never throws for bad data; all findings are returned.
 * Thread-safe: stateless.
 */
public final class SchemaValidator {

    /**
     * Validates {@code value} against {@code schema}.
     *
     * @param schema the schema tree, not null
     * @param value  the value; {@code null} is treated as JSON null
     * @return the report, empty when the value conforms
     */
    public ValidationReport validate(SchemaNode schema, JsonNode value) {
        Objects.requireNonNull(schema, "schema must not be null");
        List<Violation> violations = new ArrayList<>();
        check(schema, value == null ? NullNode.getInstance() : value, new ArrayList<>(), violations);
        return violations.isEmpty() ? ValidationReport.valid() : new ValidationReport(violations);
    }

    private static void check(SchemaNode schema, JsonNode value, List<String> path, List<Violation> out) {
        switch (schema.type()) {
            case STRING:
                checkScalar(schema, value, value.isTextual(), path, out);
                break;
            case INT:
                checkScalar(schema, value, value.isIntegralNumber(), path, out);
                break;
            case FLOAT:
                checkScalar(schema, value, value.isNumber(), path, out);
                break;
            case BOOLEAN:
                checkScalar(schema, value, value.isBoolean(), path, out);
                break;
            case ARRAY:
                if (!value.isArray()) {
                    out.add(typeMismatch(schema, value, path));
                    return;
                }
                if (schema.itemSchema() != null) {
                    for (int i = 0; i < value.size(); i++) {
                        path.add(Violation.indexSegment(i));
                        check(schema.itemSchema(), value.get(i), path, out);
                        path.remove(path.size() - 1);
                    }
                }
                break;
            case OBJECT:
                if (!value.isObject()) {
                    out.add(typeMismatch(schema, value, path));
                    return;
                }
                for (Map.Entry<String, SchemaNode> property : schema.propertySchemas().entrySet()) {
                    JsonNode child = value.get(property.getKey());
                    if (child == null || child.isNull()) {
                        continue;
                    }
                    path.add(Violation.propertySegment(property.getKey()));
                    check(property.getValue(), child, path, out);
                    path.remove(path.size() - 1);
                }
                break;
            default:
                throw new IllegalStateException("Unknown schema type: " + schema.type());
        }
    }

    private static void checkScalar(
            SchemaNode schema, JsonNode value, boolean typeMatches, List<String> path, List<Violation> out) {
        if (!typeMatches) {
            out.add(typeMismatch(schema, value, path));
            return;
        }
        if (schema.enumValues().isEmpty()) {
            return;
        }
        for (JsonNode allowed : schema.enumValues()) {
            if (JsonNodeUtils.sameValue(allowed, value)) {
                return;
            }
        }
        out.add(new Violation(
                path,
                schema.summary(),
                JsonNodeUtils.typeTag(value),
                "Value " + value + " at " + Violation.pointer(path) + " is not one of " + schema.enumValues()));
    }

    private static Violation typeMismatch(SchemaNode schema, JsonNode value, List<String> path) {
        String actual = JsonNodeUtils.typeTag(value);
        return new Violation(
                path,
                schema.summary(),
                actual,
                "Expected " + schema.type().wireName() + " at " + Violation.pointer(path) + " but found " + actual);
    }
}

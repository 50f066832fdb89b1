package io.pipevar.core.model;

import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.JsonNodeFactory;
import com.fasterxml.jackson.databind.node.ObjectNode;
import java.util.List;

/**
 * Outcome of validating one value against a {@link SchemaNode}. An empty violation list means the
 * value conforms. Sibling violations are all reported; none suppresses another.
 */
public record ValidationReport(List<Violation> violations) {

    private static final ValidationReport VALID = new ValidationReport(List.of());

    public ValidationReport {
        violations = violations == null ? List.of() : List.copyOf(violations);
    }

    public static ValidationReport valid() {
        return VALID;
    }

    public boolean isValid() {
        return violations.isEmpty();
    }

    /**
     * Renders the report as {@code {"valid": false, "violations": [...]}}; each violation carries
     * {@code path}, {@code pointer}, {@code expected}, {@code actual} and {@code message}.
     */
    public ObjectNode toJson() {
        ObjectNode root = JsonNodeFactory.instance.objectNode();
        root.put("valid", isValid());
        ArrayNode list = root.putArray("violations");
        for (Violation violation : violations) {
            ObjectNode entry = list.addObject();
            ArrayNode path = entry.putArray("path");
            violation.path().forEach(path::add);
            entry.put("pointer", violation.pointer());
            entry.put("expected", violation.expected());
            entry.put("actual", violation.actual());
            entry.put("message", violation.message());
        }
        return root;
    }
}

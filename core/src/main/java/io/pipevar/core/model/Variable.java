package io.pipevar.core.model;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.JsonNodeFactory;
import java.util.Objects;

/**
 * A declared node input. The kind is fixed at creation; resolution derives a new value and never
 * touches {@code rawValue}, which is deep-copied on the way in.
 *
 * @param kind         how the variable is resolved
 * @param rawValue     the declared value; for templates string leaves may carry {@code ${...}}
 * @param deferredType the registered resolver code, present only for {@link VariableKind#DEFERRED}
 */
public record Variable(VariableKind kind, JsonNode rawValue, String deferredType) {

    public Variable {
        Objects.requireNonNull(kind, "kind must not be null");
        rawValue = rawValue == null ? JsonNodeFactory.instance.nullNode() : rawValue.deepCopy();
        if (kind == VariableKind.DEFERRED) {
            if (deferredType == null || deferredType.isEmpty()) {
                throw new IllegalArgumentException("deferred variables require a deferredType");
            }
        } else if (deferredType != null) {
            throw new IllegalArgumentException("deferredType is only allowed on deferred variables, got kind " + kind);
        }
    }

    public static Variable literal(JsonNode value) {
        return new Variable(VariableKind.LITERAL, value, null);
    }

    public static Variable literal(String value) {
        return literal(JsonNodeFactory.instance.textNode(value));
    }

    public static Variable template(JsonNode value) {
        return new Variable(VariableKind.TEMPLATE, value, null);
    }

    public static Variable template(String template) {
        return template(JsonNodeFactory.instance.textNode(template));
    }

    public static Variable deferred(String deferredType, JsonNode seed) {
        return new Variable(VariableKind.DEFERRED, seed, deferredType);
    }

    public static Variable deferred(String deferredType, String seed) {
        return deferred(deferredType, JsonNodeFactory.instance.textNode(seed));
    }

    /** Returns a defensive copy of the raw value. */
    @Override
    public JsonNode rawValue() {
        return rawValue.deepCopy();
    }

    /** True when resolution needs to look at other context entries. */
    public boolean hasDependencies() {
        return kind != VariableKind.LITERAL;
    }
}

package io.pipevar.core.spec;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.JsonNodeFactory;
import com.fasterxml.jackson.databind.node.ObjectNode;
import io.pipevar.core.error.SpecParseException;
import io.pipevar.core.model.Variable;
import io.pipevar.core.model.VariableKind;
import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Set;

/**
 * Reads and writes variables in their wire form:
 *
 * <pre>
 * { "type": "plain" | "splice" | "lazy", "value": &lt;any JSON&gt;, "custom_type": "&lt;code&gt;" }
 * </pre>
 *
 * A missing {@code value} reads as JSON null. {@code custom_type} is required for {@code lazy}
 * and rejected otherwise.
 */
public final class VariableParser {

    static final String TYPE = "type";
    static final String VALUE = "value";
    static final String CUSTOM_TYPE = "custom_type";

    private static final Set<String> KNOWN_KEYS = Set.of(TYPE, VALUE, CUSTOM_TYPE);

    /**
     * Parses one variable document.
     *
     * @param wire   the variable object
     * @param label  where the variable sits, for error messages (e.g. {@code inputs.branch})
     * @param source file path or other origin label
     * @throws SpecParseException if the document is malformed
     */
    public Variable parse(JsonNode wire, String label, String source) {
        if (wire == null || !wire.isObject()) {
            throw new SpecParseException("Variable '" + label + "' must be an object with a 'type' field", source);
        }
        List<String> unknown = WireKeys.unknownKeys(wire, KNOWN_KEYS);
        if (!unknown.isEmpty()) {
            throw new SpecParseException(WireKeys.describeUnknown(unknown, label, KNOWN_KEYS), source);
        }

        JsonNode typeNode = wire.get(TYPE);
        if (typeNode == null || !typeNode.isTextual()) {
            throw new SpecParseException("Missing or invalid required field: '" + label + ".type'", source);
        }
        VariableKind kind = VariableKind.fromWireName(typeNode.asText())
                .orElseThrow(() -> new SpecParseException(
                        "Unknown variable type '" + typeNode.asText() + "' for '" + label
                                + "'. Expected one of: plain, splice, lazy",
                        source));

        JsonNode value = wire.get(VALUE);
        JsonNode customType = wire.get(CUSTOM_TYPE);
        if (kind == VariableKind.DEFERRED) {
            if (customType == null || !customType.isTextual() || customType.asText().isEmpty()) {
                throw new SpecParseException("'" + label + "' is lazy and requires a 'custom_type'", source);
            }
            return Variable.deferred(customType.asText(), value);
        }
        if (customType != null) {
            throw new SpecParseException(
                    "'custom_type' is only allowed on lazy variables, found on '" + label + "' of type "
                            + kind.wireName(),
                    source);
        }
        return kind == VariableKind.TEMPLATE ? Variable.template(value) : Variable.literal(value);
    }

    /**
     * Parses a mapping of name to variable document, preserving declaration order.
     *
     * @param prefix label prefix for error messages, e.g. {@code inputs}
     */
    public Map<String, Variable> parseAll(JsonNode mapping, String prefix, String source) {
        Map<String, Variable> variables = new LinkedHashMap<>();
        if (mapping == null || mapping.isNull()) {
            return variables;
        }
        if (!mapping.isObject()) {
            throw new SpecParseException("'" + prefix + "' must be a mapping of name to variable", source);
        }
        Iterator<Map.Entry<String, JsonNode>> fields = mapping.fields();
        while (fields.hasNext()) {
            Map.Entry<String, JsonNode> field = fields.next();
            variables.put(field.getKey(), parse(field.getValue(), prefix + "." + field.getKey(), source));
        }
        return variables;
    }

    /** Writes a variable in wire form. A null value is written explicitly. */
    public ObjectNode toWire(Variable variable) {
        Objects.requireNonNull(variable, "variable must not be null");
        ObjectNode node = JsonNodeFactory.instance.objectNode();
        node.put(TYPE, variable.kind().wireName());
        node.set(VALUE, variable.rawValue());
        if (variable.deferredType() != null) {
            node.put(CUSTOM_TYPE, variable.deferredType());
        }
        return node;
    }

    public ObjectNode toWire(Map<String, Variable> variables) {
        ObjectNode node = JsonNodeFactory.instance.objectNode();
        variables.forEach((name, variable) -> node.set(name, toWire(variable)));
        return node;
    }
}

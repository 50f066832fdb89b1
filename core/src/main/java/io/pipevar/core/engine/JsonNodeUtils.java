package io.pipevar.core.engine;

import com.fasterxml.jackson.databind.JsonNode;
import java.util.Locale;

/**
 * Shared JSON node utility methods used by the template evaluator and the schema validator.
 *
 * <p>
 * Thread-safe: stateless utility class.
 */
public final class JsonNodeUtils {

    private JsonNodeUtils() {}

    /**
     * Determines if a JsonNode is truthy in template conditions.
     *
     * <ul>
     * <li>{@code null}, {@code NullNode}, {@code MissingNode} → falsy</li>
     * <li>{@code BooleanNode(false)} → falsy</li>
     * <li>{@code BooleanNode(true)} → truthy</li>
     * <li>{@code TextNode("")} → falsy (empty string)</li>
     * <li>Any other non-null node → truthy</li>
     * </ul>
     *
     * @param node the value to check
     * @return true if the value is truthy
     */
    public static boolean isTruthy(JsonNode node) {
        if (node == null || node.isNull() || node.isMissingNode()) {
            return false;
        }
        if (node.isBoolean()) {
            return node.booleanValue();
        }
        if (node.isTextual()) {
            return !node.asText().isEmpty();
        }
        // Any other non-null value is truthy
        return true;
    }

    /**
     * Returns the type tag used in violations and error messages: {@code string}, {@code int},
     * {@code float}, {@code boolean}, {@code array}, {@code object} or {@code null}.
     */
    public static String typeTag(JsonNode node) {
        if (node == null || node.isNull() || node.isMissingNode()) {
            return "null";
        }
        if (node.isTextual()) {
            return "string";
        }
        if (node.isIntegralNumber()) {
            return "int";
        }
        if (node.isNumber()) {
            return "float";
        }
        if (node.isBoolean()) {
            return "boolean";
        }
        if (node.isArray()) {
            return "array";
        }
        if (node.isObject()) {
            return "object";
        }
        // binary and POJO nodes do not occur in parsed documents
        return node.getNodeType().name().toLowerCase(Locale.ROOT);
    }

    /**
     * Value equality with numeric normalisation: {@code 1}, {@code 1L} and {@code 1.0} are the same
     * value. Non-numeric nodes fall back to structural {@link JsonNode#equals(Object)}.
     */
    public static boolean sameValue(JsonNode a, JsonNode b) {
        if (a == null || b == null) {
            return a == b;
        }
        if (a.isNumber() && b.isNumber()) {
            return compareNumbers(a, b) == 0;
        }
        return a.equals(b);
    }

    /** Numeric ordering of two number nodes; integral pairs compare exactly. */
    public static int compareNumbers(JsonNode a, JsonNode b) {
        if (a.isIntegralNumber() && b.isIntegralNumber()) {
            return a.bigIntegerValue().compareTo(b.bigIntegerValue());
        }
        return Double.compare(a.doubleValue(), b.doubleValue());
    }

    /**
     * Renders a value for embedding in surrounding template text: strings verbatim, scalars by
     * their JSON text, containers as compact JSON.
     */
    public static String renderText(JsonNode node) {
        if (node == null || node.isMissingNode()) {
            return "null";
        }
        if (node.isValueNode()) {
            return node.asText();
        }
        return node.toString();
    }
}

package io.pipevar.core.engine.template;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.BooleanNode;
import com.fasterxml.jackson.databind.node.JsonNodeFactory;
import io.pipevar.core.engine.JsonNodeUtils;

/**
 * Runtime semantics of the template operators. Integral operands stay integral for {@code + - * %};
 * {@code /} always produces a floating-point result.
 */
final class Operators {

    private static final JsonNodeFactory NODES = JsonNodeFactory.instance;

    private Operators() {}

    static JsonNode property(JsonNode target, String name, EvalScope scope) {
        if (!target.isObject()) {
            throw scope.fail("Cannot read property '" + name + "' of " + JsonNodeUtils.typeTag(target));
        }
        JsonNode value = target.get(name);
        if (value == null) {
            throw scope.fail("No property '" + name + "'");
        }
        return value;
    }

    static JsonNode index(JsonNode target, JsonNode index, EvalScope scope) {
        if (target.isArray()) {
            if (!index.isIntegralNumber() || !index.canConvertToInt()) {
                throw scope.fail("Array index must be an int, got " + JsonNodeUtils.typeTag(index));
            }
            int i = index.intValue();
            int effective = i < 0 ? target.size() + i : i;
            if (effective < 0 || effective >= target.size()) {
                throw scope.fail("Index " + i + " out of range for array of size " + target.size());
            }
            return target.get(effective);
        }
        if (target.isObject()) {
            if (!index.isTextual()) {
                throw scope.fail("Object key must be a string, got " + JsonNodeUtils.typeTag(index));
            }
            return property(target, index.textValue(), scope);
        }
        throw scope.fail("Cannot index into " + JsonNodeUtils.typeTag(target));
    }

    static JsonNode negate(JsonNode value, EvalScope scope) {
        if (!value.isNumber()) {
            throw scope.fail("Cannot negate " + JsonNodeUtils.typeTag(value));
        }
        if (isLong(value)) {
            try {
                return NODES.numberNode(Math.negateExact(value.longValue()));
            } catch (ArithmeticException e) {
                throw scope.fail("Integer overflow");
            }
        }
        return NODES.numberNode(-value.doubleValue());
    }

    static JsonNode binary(ExpressionLexer.TokenType operator, JsonNode left, JsonNode right, EvalScope scope) {
        switch (operator) {
            case PLUS:
                if (left.isTextual() || right.isTextual()) {
                    return NODES.textNode(JsonNodeUtils.renderText(left) + JsonNodeUtils.renderText(right));
                }
                return arithmetic(operator, left, right, scope);
            case MINUS:
            case STAR:
            case SLASH:
            case PERCENT:
                return arithmetic(operator, left, right, scope);
            case EQ:
                return BooleanNode.valueOf(JsonNodeUtils.sameValue(left, right));
            case NE:
                return BooleanNode.valueOf(!JsonNodeUtils.sameValue(left, right));
            case LT:
                return BooleanNode.valueOf(compare(left, right, operator, scope) < 0);
            case LE:
                return BooleanNode.valueOf(compare(left, right, operator, scope) <= 0);
            case GT:
                return BooleanNode.valueOf(compare(left, right, operator, scope) > 0);
            case GE:
                return BooleanNode.valueOf(compare(left, right, operator, scope) >= 0);
            default:
                throw new IllegalStateException("Not a binary operator: " + operator);
        }
    }

    private static JsonNode arithmetic(
            ExpressionLexer.TokenType operator, JsonNode left, JsonNode right, EvalScope scope) {
        if (!left.isNumber() || !right.isNumber()) {
            throw scope.fail("Operator '" + symbol(operator) + "' needs numbers, got "
                    + JsonNodeUtils.typeTag(left) + " and " + JsonNodeUtils.typeTag(right));
        }
        if (operator == ExpressionLexer.TokenType.SLASH) {
            if (right.doubleValue() == 0d) {
                throw scope.fail("Division by zero");
            }
            return NODES.numberNode(left.doubleValue() / right.doubleValue());
        }
        if (isLong(left) && isLong(right)) {
            long a = left.longValue();
            long b = right.longValue();
            try {
                switch (operator) {
                    case PLUS:
                        return NODES.numberNode(Math.addExact(a, b));
                    case MINUS:
                        return NODES.numberNode(Math.subtractExact(a, b));
                    case STAR:
                        return NODES.numberNode(Math.multiplyExact(a, b));
                    default:
                        if (b == 0) {
                            throw scope.fail("Modulo by zero");
                        }
                        return NODES.numberNode(a % b);
                }
            } catch (ArithmeticException e) {
                throw scope.fail("Integer overflow");
            }
        }
        double a = left.doubleValue();
        double b = right.doubleValue();
        switch (operator) {
            case PLUS:
                return NODES.numberNode(a + b);
            case MINUS:
                return NODES.numberNode(a - b);
            case STAR:
                return NODES.numberNode(a * b);
            default:
                if (b == 0d) {
                    throw scope.fail("Modulo by zero");
                }
                return NODES.numberNode(a % b);
        }
    }

    private static int compare(JsonNode left, JsonNode right, ExpressionLexer.TokenType operator, EvalScope scope) {
        if (left.isNumber() && right.isNumber()) {
            return JsonNodeUtils.compareNumbers(left, right);
        }
        if (left.isTextual() && right.isTextual()) {
            return left.textValue().compareTo(right.textValue());
        }
        throw scope.fail("Operator '" + symbol(operator) + "' cannot compare "
                + JsonNodeUtils.typeTag(left) + " and " + JsonNodeUtils.typeTag(right));
    }

    private static boolean isLong(JsonNode node) {
        return node.isIntegralNumber() && node.canConvertToLong();
    }

    private static String symbol(ExpressionLexer.TokenType operator) {
        switch (operator) {
            case PLUS:
                return "+";
            case MINUS:
                return "-";
            case STAR:
                return "*";
            case SLASH:
                return "/";
            case PERCENT:
                return "%";
            case LT:
                return "<";
            case LE:
                return "<=";
            case GT:
                return ">";
            default:
                return ">=";
        }
    }
}

package io.pipevar.core.engine.template;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.BooleanNode;
import io.pipevar.core.engine.JsonNodeUtils;
import java.util.List;
import java.util.function.Consumer;

/** AST of the restricted template expression grammar. */
interface ExpressionNode {

    JsonNode evaluate(EvalScope scope);

    /** Reports every dotted reference chain in this subtree, including untaken ternary branches. */
    void collectReferences(Consumer<List<String>> sink);

    /** A number, string, boolean or null literal. */
    record Literal(JsonNode value) implements ExpressionNode {
        @Override
        public JsonNode evaluate(EvalScope scope) {
            return value;
        }

        @Override
        public void collectReferences(Consumer<List<String>> sink) {}
    }

    /**
     * A dotted identifier chain. The longest prefix bound in the scope is the context key; the
     * remaining segments are property reads on its value.
     */
    record Reference(List<String> path) implements ExpressionNode {

        public Reference {
            path = List.copyOf(path);
        }

        String dotted() {
            return String.join(".", path);
        }

        @Override
        public JsonNode evaluate(EvalScope scope) {
            for (int prefix = path.size(); prefix > 0; prefix--) {
                String key = String.join(".", path.subList(0, prefix));
                JsonNode value = scope.bindings().get(key);
                if (value != null) {
                    for (String property : path.subList(prefix, path.size())) {
                        value = Operators.property(value, property, scope);
                    }
                    return value;
                }
            }
            throw scope.fail("Unknown key '" + dotted() + "'");
        }

        @Override
        public void collectReferences(Consumer<List<String>> sink) {
            sink.accept(path);
        }
    }

    /** {@code target.name} where target is not a plain reference chain. */
    record Property(ExpressionNode target, String name) implements ExpressionNode {
        @Override
        public JsonNode evaluate(EvalScope scope) {
            return Operators.property(target.evaluate(scope), name, scope);
        }

        @Override
        public void collectReferences(Consumer<List<String>> sink) {
            target.collectReferences(sink);
        }
    }

    /** {@code target[index]}. */
    record Index(ExpressionNode target, ExpressionNode index) implements ExpressionNode {
        @Override
        public JsonNode evaluate(EvalScope scope) {
            return Operators.index(target.evaluate(scope), index.evaluate(scope), scope);
        }

        @Override
        public void collectReferences(Consumer<List<String>> sink) {
            target.collectReferences(sink);
            index.collectReferences(sink);
        }
    }

    /** {@code !operand} or {@code -operand}. */
    record Unary(ExpressionLexer.TokenType operator, ExpressionNode operand) implements ExpressionNode {
        @Override
        public JsonNode evaluate(EvalScope scope) {
            JsonNode value = operand.evaluate(scope);
            if (operator == ExpressionLexer.TokenType.NOT) {
                return BooleanNode.valueOf(!JsonNodeUtils.isTruthy(value));
            }
            return Operators.negate(value, scope);
        }

        @Override
        public void collectReferences(Consumer<List<String>> sink) {
            operand.collectReferences(sink);
        }
    }

    /** Arithmetic, concatenation and comparison operators. */
    record Binary(ExpressionLexer.TokenType operator, ExpressionNode left, ExpressionNode right)
            implements ExpressionNode {
        @Override
        public JsonNode evaluate(EvalScope scope) {
            return Operators.binary(operator, left.evaluate(scope), right.evaluate(scope), scope);
        }

        @Override
        public void collectReferences(Consumer<List<String>> sink) {
            left.collectReferences(sink);
            right.collectReferences(sink);
        }
    }

    /** Short-circuit {@code &&} / {@code ||}, yielding a boolean. */
    record Logical(boolean and, ExpressionNode left, ExpressionNode right) implements ExpressionNode {
        @Override
        public JsonNode evaluate(EvalScope scope) {
            boolean leftTruthy = JsonNodeUtils.isTruthy(left.evaluate(scope));
            if (and ? !leftTruthy : leftTruthy) {
                return BooleanNode.valueOf(leftTruthy);
            }
            return BooleanNode.valueOf(JsonNodeUtils.isTruthy(right.evaluate(scope)));
        }

        @Override
        public void collectReferences(Consumer<List<String>> sink) {
            left.collectReferences(sink);
            right.collectReferences(sink);
        }
    }

    /** {@code condition ? whenTrue : whenFalse}; only the selected branch is evaluated. */
    record Conditional(ExpressionNode condition, ExpressionNode whenTrue, ExpressionNode whenFalse)
            implements ExpressionNode {
        @Override
        public JsonNode evaluate(EvalScope scope) {
            return JsonNodeUtils.isTruthy(condition.evaluate(scope))
                    ? whenTrue.evaluate(scope)
                    : whenFalse.evaluate(scope);
        }

        @Override
        public void collectReferences(Consumer<List<String>> sink) {
            condition.collectReferences(sink);
            whenTrue.collectReferences(sink);
            whenFalse.collectReferences(sink);
        }
    }
}

package io.pipevar.core.engine.template;

import com.fasterxml.jackson.databind.JsonNode;
import io.pipevar.core.spi.CompiledExpression;
import io.pipevar.core.spi.ExpressionEngine;
import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Set;

/**
 * Built-in expression engine: reference substitution, string concatenation, arithmetic, indexing,
 * comparisons and a ternary. There are no function or method calls, so evaluation cannot reach
 * host-language objects.
 */
public final class RestrictedExpressionEngine implements ExpressionEngine {

    /** Engine identifier. */
    public static final String ENGINE_ID = "restricted";

    @Override
    public String id() {
        return ENGINE_ID;
    }

    @Override
    public CompiledExpression compile(String expression) {
        Objects.requireNonNull(expression, "expression must not be null");
        return new RestrictedCompiledExpression(expression, ExpressionParser.parse(expression));
    }

    /** Thread-safe compiled expression handle; the AST is immutable. */
    private static final class RestrictedCompiledExpression implements CompiledExpression {

        private final String source;
        private final ExpressionNode root;
        private final List<List<String>> referencePaths;

        RestrictedCompiledExpression(String source, ExpressionNode root) {
            this.source = source;
            this.root = root;
            List<List<String>> paths = new ArrayList<>();
            root.collectReferences(paths::add);
            this.referencePaths = Collections.unmodifiableList(paths);
        }

        @Override
        public String source() {
            return source;
        }

        @Override
        public Set<String> references(Set<String> visibleKeys) {
            Set<String> keys = new LinkedHashSet<>();
            for (List<String> path : referencePaths) {
                keys.add(keyFor(path, visibleKeys));
            }
            return keys;
        }

        @Override
        public JsonNode evaluate(Map<String, JsonNode> bindings) {
            return root.evaluate(new EvalScope(bindings, source));
        }

        private static String keyFor(List<String> path, Set<String> visibleKeys) {
            for (int prefix = path.size(); prefix > 0; prefix--) {
                String candidate = String.join(".", path.subList(0, prefix));
                if (visibleKeys.contains(candidate)) {
                    return candidate;
                }
            }
            return String.join(".", path);
        }

        @Override
        public String toString() {
            return "RestrictedCompiledExpression[" + source + "]";
        }
    }
}

package io.pipevar.core.spi;

import com.fasterxml.jackson.databind.JsonNode;
import java.util.Map;
import java.util.Set;

/**
 * An immutable, thread-safe compiled expression produced by {@link ExpressionEngine#compile(String)}.
 */
public interface CompiledExpression {

    /** The expression text this handle was compiled from. */
    String source();

    /**
     * Returns the reference keys this expression reads, given the keys visible in the context. A
     * dotted reference {@code a.b.c} denotes the longest visible prefix ({@code a.b.c}, {@code a.b}
     * or {@code a}); when none is visible the whole chain is reported so the caller can flag it as
     * missing.
     *
     * @param visibleKeys keys of the resolution context
     * @return referenced keys in order of first appearance
     */
    Set<String> references(Set<String> visibleKeys);

    /**
     * Evaluates this expression against the given bindings.
     *
     * @param bindings resolved values by reference key
     * @return the result, never {@code null} (JSON null is {@code NullNode})
     * @throws io.pipevar.core.error.TemplateEvalException if evaluation fails
     */
    JsonNode evaluate(Map<String, JsonNode> bindings);
}

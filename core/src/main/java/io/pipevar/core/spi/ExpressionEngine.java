package io.pipevar.core.spi;

/**
 * Pluggable engine for the expressions found inside {@code ${...}} template markers. The built-in
 * implementation is {@link io.pipevar.core.engine.template.RestrictedExpressionEngine}; alternative
 * grammars can be supplied to {@link io.pipevar.core.engine.template.TemplateEngine}.
 *
 * <p>Implementations MUST be stateless and thread-safe.
 */
public interface ExpressionEngine {

    /**
     * Returns the engine identifier, e.g. {@code "restricted"}.
     *
     * @return a non-null, non-empty engine identifier (lowercase, no spaces)
     */
    String id();

    /**
     * Compiles the given expression into an immutable, thread-safe handle.
     *
     * @param expression the marker content, without the surrounding {@code ${ }}
     * @return a compiled expression ready for evaluation
     * @throws io.pipevar.core.error.TemplateEvalException if the expression is malformed
     */
    CompiledExpression compile(String expression);
}

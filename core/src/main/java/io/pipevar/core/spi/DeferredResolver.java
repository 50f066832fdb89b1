package io.pipevar.core.spi;

import com.fasterxml.jackson.databind.JsonNode;

/**
 * Computes the final value of a deferred variable from its template-resolved seed. Registered under
 * a code in {@link io.pipevar.core.engine.DeferredRegistry}.
 *
 * <p>Resolvers must be a function of the seed plus ambient read-only state (clock, environment).
 * They have no access to the resolution context. Unless documented otherwise they must not share
 * mutable state across invocations.
 */
@FunctionalInterface
public interface DeferredResolver {

    /**
     * @param seed the variable's raw value after template substitution, never {@code null}
     * @return the final value, never {@code null}
     */
    JsonNode resolve(JsonNode seed);
}

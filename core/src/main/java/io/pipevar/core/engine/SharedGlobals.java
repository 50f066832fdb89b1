package io.pipevar.core.engine;

import io.pipevar.core.model.ResolutionResult;
import io.pipevar.core.model.Variable;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;
import java.util.Set;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.atomic.AtomicReference;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Workflow-level globals shared by concurrently resolving node contexts.
 *
 * <p>
 * The globals are resolved in one pass of their own, at most once (single flight): the first
 * caller of {@link #get()} computes the result, concurrent callers wait for it, and every reader
 * observes the same completed, read-only {@link ResolutionResult}. A fatal error (an unknown
 * deferred type, or an {@link Error} escaping a resolver) is cached too and rethrown to every
 * reader.
 *
 * <p>
 * Thread-safe: uses an {@link AtomicReference} to publish the single computation.
 */
public final class SharedGlobals {

    private static final Logger LOG = LoggerFactory.getLogger(SharedGlobals.class);

    private final Map<String, Variable> definitions;
    private final VariableResolver resolver;
    private final AtomicReference<CompletableFuture<ResolutionResult>> result = new AtomicReference<>();

    public SharedGlobals(Map<String, Variable> definitions, VariableResolver resolver) {
        this.definitions = Collections.unmodifiableMap(
                new LinkedHashMap<>(Objects.requireNonNull(definitions, "definitions must not be null")));
        this.resolver = Objects.requireNonNull(resolver, "resolver must not be null");
    }

    /** Names of the declared globals. */
    public Set<String> keys() {
        return definitions.keySet();
    }

    /** True once the single resolution pass has completed, successfully or not. */
    public boolean isResolved() {
        CompletableFuture<ResolutionResult> current = result.get();
        return current != null && current.isDone();
    }

    /**
     * Returns the resolved globals, computing them on first use.
     *
     * @throws io.pipevar.core.error.UnknownDeferredTypeException if a global names an unregistered
     *                                                            resolver
     */
    public ResolutionResult get() {
        CompletableFuture<ResolutionResult> current = result.get();
        if (current == null) {
            CompletableFuture<ResolutionResult> mine = new CompletableFuture<>();
            if (result.compareAndSet(null, mine)) {
                compute(mine);
            }
            current = result.get();
        }
        try {
            return current.join();
        } catch (CompletionException e) {
            if (e.getCause() instanceof RuntimeException) {
                throw (RuntimeException) e.getCause();
            }
            if (e.getCause() instanceof Error) {
                throw (Error) e.getCause();
            }
            throw e;
        }
    }

    private void compute(CompletableFuture<ResolutionResult> target) {
        LOG.info("Resolving shared globals: count={}", definitions.size());
        try {
            ResolutionContext context =
                    ResolutionContext.builder().variables(definitions).build();
            target.complete(resolver.resolveAll(context));
        } catch (RuntimeException e) {
            LOG.error("Shared globals resolution aborted: {}", e.getMessage());
            target.completeExceptionally(e);
        } catch (Error e) {
            // readers waiting on the future must still be released
            LOG.error("Shared globals resolution aborted by error: {}", e.toString());
            target.completeExceptionally(e);
            throw e;
        }
    }
}

package io.pipevar.core.engine;

import com.fasterxml.jackson.databind.JsonNode;
import io.pipevar.core.engine.template.TemplateEngine;
import io.pipevar.core.error.CyclicReferenceException;
import io.pipevar.core.error.DeferredEvalException;
import io.pipevar.core.error.PipevarException;
import io.pipevar.core.error.ResolutionEntryException;
import io.pipevar.core.error.TemplateEvalException;
import io.pipevar.core.error.UnknownDeferredTypeException;
import io.pipevar.core.error.UnresolvedReferenceException;
import io.pipevar.core.model.EntryState;
import io.pipevar.core.model.ResolutionResult;
import io.pipevar.core.model.Variable;
import io.pipevar.core.spi.ResolutionListener;
import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Collection;
import java.util.Deque;
import java.util.HashMap;
import java.util.Iterator;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Set;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Resolves the entries of a {@link ResolutionContext} in dependency order.
 *
 * <p>
 * Resolution is on demand and recursive: resolving a key first resolves every key its template
 * references, then substitutes, then (for deferred variables) invokes the registered resolver on
 * the substituted seed. Results are memoized in the context, so an entry shared by several
 * dependents is computed once per pass. An entry found in the {@code RESOLVING} state while
 * resolving its own dependencies closes a cycle and fails with {@link CyclicReferenceException}.
 *
 * <p>
 * Failures are per entry: a dependent of a failed entry records the same exception, and unrelated
 * entries still resolve. Unknown deferred resolver codes are checked before anything resolves and
 * abort the pass with {@link UnknownDeferredTypeException}.
 *
 * <p>
 * Thread-safe: holds no per-pass state. Each pass uses its own context.
 */
public final class VariableResolver {

    private static final Logger LOG = LoggerFactory.getLogger(VariableResolver.class);

    private final TemplateEngine templateEngine;
    private final DeferredRegistry deferredRegistry;
    private final ResolutionListener listener;

    public VariableResolver(TemplateEngine templateEngine, DeferredRegistry deferredRegistry) {
        this(templateEngine, deferredRegistry, ResolutionListener.NOOP);
    }

    public VariableResolver(
            TemplateEngine templateEngine, DeferredRegistry deferredRegistry, ResolutionListener listener) {
        this.templateEngine = Objects.requireNonNull(templateEngine, "templateEngine must not be null");
        this.deferredRegistry = Objects.requireNonNull(deferredRegistry, "deferredRegistry must not be null");
        this.listener = Objects.requireNonNull(listener, "listener must not be null");
    }

    /** Resolves every entry of the context, collecting per-entry errors. */
    public ResolutionResult resolveAll(ResolutionContext context) {
        return resolveAll(context, ResolutionMode.PARTIAL);
    }

    /**
     * Resolves every entry of the context.
     *
     * @throws UnknownDeferredTypeException if a deferred variable names an unregistered resolver
     * @throws ResolutionEntryException     in {@link ResolutionMode#STRICT} mode, the first entry
     *                                      failure
     */
    public ResolutionResult resolveAll(ResolutionContext context, ResolutionMode mode) {
        return resolveKeys(context, context.keys(), mode);
    }

    /**
     * Resolves the given keys and whatever they depend on. Other entries of the context are left
     * untouched. The result only reports the requested keys.
     *
     * @throws UnknownDeferredTypeException if any deferred variable of the context names an
     *                                      unregistered resolver
     * @throws ResolutionEntryException     in {@link ResolutionMode#STRICT} mode, the first entry
     *                                      failure
     */
    public ResolutionResult resolveKeys(ResolutionContext context, Collection<String> keys, ResolutionMode mode) {
        Objects.requireNonNull(context, "context must not be null");
        Objects.requireNonNull(keys, "keys must not be null");
        Objects.requireNonNull(mode, "mode must not be null");
        long start = System.nanoTime();
        checkDeferredTypes(context);

        List<String> requested = new ArrayList<>(keys);
        for (String key : requested) {
            if (!context.contains(key)) {
                throw new IllegalArgumentException("Key is not part of the resolution context: '" + key + "'");
            }
            try {
                resolveEntry(context, key, null, new ArrayDeque<>());
            } catch (ResolutionEntryException e) {
                if (mode == ResolutionMode.STRICT) {
                    throw e;
                }
            }
        }

        ResolutionResult result = context.snapshot(requested);
        long durationMs = (System.nanoTime() - start) / 1_000_000;
        LOG.info(
                "Resolution pass complete: resolved={}, failed={}, duration_ms={}",
                result.resolvedKeys().size(),
                result.errors().size(),
                durationMs);
        notifyPassCompleted(new ResolutionListener.PassCompletedEvent(
                result.resolvedKeys().size(), result.errors().size(), durationMs));
        return result;
    }

    /**
     * Resolves a single key (and its dependencies) and returns its value.
     *
     * @throws ResolutionEntryException     if the entry fails
     * @throws UnknownDeferredTypeException if a deferred variable names an unregistered resolver
     */
    public JsonNode resolve(ResolutionContext context, String key) {
        return resolveKeys(context, List.of(key), ResolutionMode.STRICT).requireValue(key);
    }

    private void checkDeferredTypes(ResolutionContext context) {
        for (Map.Entry<String, Variable> entry : context.deferredVariables().entrySet()) {
            String type = entry.getValue().deferredType();
            if (!deferredRegistry.hasResolver(type)) {
                LOG.error("Unknown deferred type: key={}, custom_type={}", entry.getKey(), type);
                throw new UnknownDeferredTypeException(type, "entry '" + entry.getKey() + "'");
            }
        }
    }

    /**
     * Resolves {@code key}, recursing into its dependencies.
     *
     * @param requester the entry that referenced {@code key}, or {@code null} at the top level
     * @param path      keys currently being resolved, outermost first
     */
    private JsonNode resolveEntry(ResolutionContext context, String key, String requester, Deque<String> path) {
        EntryState state = context.state(key);
        if (state == null) {
            throw new UnresolvedReferenceException(key, requester);
        }
        switch (state) {
            case RESOLVED:
                return context.value(key);
            case FAILED:
                throw context.error(key);
            case RESOLVING:
                throw new CyclicReferenceException(cyclePath(path, key));
            default:
                break;
        }

        Variable variable = context.variable(key)
                .orElseThrow(() -> new IllegalStateException("Unresolved entry without a declaration: " + key));
        long start = System.nanoTime();
        context.markResolving(key);
        path.addLast(key);
        try {
            JsonNode value = compute(context, key, variable, path);
            context.markResolved(key, value);
            long duration = System.nanoTime() - start;
            LOG.debug("Resolved entry: key={}, kind={}", key, variable.kind());
            notifyResolved(new ResolutionListener.EntryResolvedEvent(key, variable.kind(), duration));
            return value;
        } catch (ResolutionEntryException e) {
            context.markFailed(key, e);
            if (key.equals(e.key())) {
                LOG.warn("Entry failed: key={}, error={}", key, e.getMessage());
            } else {
                LOG.debug("Entry failed through dependency: key={}, origin={}", key, e.key());
            }
            notifyFailed(new ResolutionListener.EntryFailedEvent(key, e));
            throw e;
        } finally {
            path.removeLast();
        }
    }

    private JsonNode compute(ResolutionContext context, String key, Variable variable, Deque<String> path) {
        switch (variable.kind()) {
            case LITERAL:
                return variable.rawValue();
            case TEMPLATE:
                return substitute(context, key, variable.rawValue(), path);
            case DEFERRED:
                JsonNode seed = substitute(context, key, variable.rawValue(), path);
                return invokeDeferred(key, variable.deferredType(), seed);
            default:
                throw new IllegalStateException("Unknown variable kind: " + variable.kind());
        }
    }

    private JsonNode substitute(ResolutionContext context, String key, JsonNode raw, Deque<String> path) {
        Set<String> references;
        try {
            references = templateEngine.references(raw, context.keys());
        } catch (TemplateEvalException e) {
            throw e.forKey(key);
        }
        if (references.isEmpty()) {
            return renderAs(key, raw, Map.of());
        }
        Map<String, JsonNode> bindings = new HashMap<>();
        for (String reference : references) {
            bindings.put(reference, resolveEntry(context, reference, key, path));
        }
        return renderAs(key, raw, bindings);
    }

    private JsonNode renderAs(String key, JsonNode raw, Map<String, JsonNode> bindings) {
        try {
            return templateEngine.render(raw, bindings);
        } catch (TemplateEvalException e) {
            throw e.forKey(key);
        }
    }

    private JsonNode invokeDeferred(String key, String type, JsonNode seed) {
        long start = System.nanoTime();
        JsonNode value;
        try {
            value = deferredRegistry.resolve(type, seed);
        } catch (PipevarException e) {
            throw e;
        } catch (RuntimeException e) {
            throw new DeferredEvalException(
                    "Deferred resolver '" + type + "' failed for entry '" + key + "': " + e.getMessage(), e, type, key);
        }
        long duration = System.nanoTime() - start;
        LOG.debug("Invoked deferred resolver: key={}, custom_type={}", key, type);
        notifyDeferredInvoked(new ResolutionListener.DeferredInvokedEvent(key, type, duration));
        return value;
    }

    /** The cycle closed by re-entering {@code key}: from its first occurrence on the path back to it. */
    private static List<String> cyclePath(Deque<String> path, String key) {
        List<String> cycle = new ArrayList<>();
        boolean inCycle = false;
        Iterator<String> it = path.iterator();
        while (it.hasNext()) {
            String current = it.next();
            if (current.equals(key)) {
                inCycle = true;
            }
            if (inCycle) {
                cycle.add(current);
            }
        }
        cycle.add(key);
        return cycle;
    }

    // --- Listener notification helpers (exception-safe) ---

    private void notifyResolved(ResolutionListener.EntryResolvedEvent event) {
        try {
            listener.onEntryResolved(event);
        } catch (RuntimeException e) {
            LOG.warn("ResolutionListener.onEntryResolved failed", e);
        }
    }

    private void notifyFailed(ResolutionListener.EntryFailedEvent event) {
        try {
            listener.onEntryFailed(event);
        } catch (RuntimeException e) {
            LOG.warn("ResolutionListener.onEntryFailed failed", e);
        }
    }

    private void notifyDeferredInvoked(ResolutionListener.DeferredInvokedEvent event) {
        try {
            listener.onDeferredInvoked(event);
        } catch (RuntimeException e) {
            LOG.warn("ResolutionListener.onDeferredInvoked failed", e);
        }
    }

    private void notifyPassCompleted(ResolutionListener.PassCompletedEvent event) {
        try {
            listener.onPassCompleted(event);
        } catch (RuntimeException e) {
            LOG.warn("ResolutionListener.onPassCompleted failed", e);
        }
    }
}

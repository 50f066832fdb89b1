package io.pipevar.core.spi;

import io.pipevar.core.error.ResolutionEntryException;
import io.pipevar.core.model.VariableKind;

/**
 * SPI for observability hooks on resolution passes.
 *
 * <p>
 * Integrations bridge these events to metrics or tracing systems; the core has no telemetry
 * dependency. Implementations MUST be thread-safe and non-blocking. Exceptions thrown by listeners
 * are caught and logged by the resolver and do NOT affect resolution.
 *
 * <p>
 * All methods have empty defaults so listeners override only what they need.
 */
public interface ResolutionListener {

    /** A no-op listener. */
    ResolutionListener NOOP = new ResolutionListener() {};

    /** Called when a context entry reaches the resolved state. */
    default void onEntryResolved(EntryResolvedEvent event) {}

    /** Called once per entry that fails in a pass (including dependents of failed entries). */
    default void onEntryFailed(EntryFailedEvent event) {}

    /** Called after a deferred resolver was invoked for an entry. */
    default void onDeferredInvoked(DeferredInvokedEvent event) {}

    /** Called when {@code resolveAll} finishes without a fatal error. */
    default void onPassCompleted(PassCompletedEvent event) {}

    // --- Event records ---

    /** Event emitted when an entry resolves. */
    record EntryResolvedEvent(String key, VariableKind kind, long durationNanos) {}

    /** Event emitted when an entry fails. */
    record EntryFailedEvent(String key, ResolutionEntryException error) {}

    /** Event emitted after a deferred resolver ran. */
    record DeferredInvokedEvent(String key, String deferredType, long durationNanos) {}

    /** Event emitted at the end of a pass. */
    record PassCompletedEvent(int resolvedCount, int failedCount, long durationMs) {}
}

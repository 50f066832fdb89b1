package io.pipevar.core.engine;

/**
 * Failure policy of a resolution pass.
 *
 * <ul>
 * <li>{@link #PARTIAL}: per-entry failures are collected and returned next to the resolved
 * entries (default).</li>
 * <li>{@link #STRICT}: the first per-entry failure is thrown and aborts the pass.</li>
 * </ul>
 */
public enum ResolutionMode {
    /** Collect per-entry errors (default). */
    PARTIAL,

    /** Throw the first per-entry error. */
    STRICT
}

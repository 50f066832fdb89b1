package io.pipevar.core.model;

/** Lifecycle of a context entry within one resolution pass. */
public enum EntryState {
    UNRESOLVED,
    RESOLVING,
    RESOLVED,
    FAILED
}

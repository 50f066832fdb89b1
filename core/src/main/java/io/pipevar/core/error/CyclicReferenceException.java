package io.pipevar.core.error;

import java.util.List;

/**
 * Thrown when the dependency graph of a resolution pass contains a cycle. The cycle path starts and
 * ends with the same key, e.g. {@code [a, b, a]}. URN: {@code urn:pipevar:error:cyclic-reference}
 */
public final class CyclicReferenceException extends ResolutionEntryException {

    private static final long serialVersionUID = 1L;

    public static final String URN = "urn:pipevar:error:cyclic-reference";

    private final List<String> cycle;

    public CyclicReferenceException(List<String> cycle) {
        super("Cyclic reference: " + String.join(" -> ", cycle), cycle.isEmpty() ? null : cycle.get(0));
        this.cycle = List.copyOf(cycle);
    }

    /** The full cycle path; first and last elements are the same key. */
    public List<String> cycle() {
        return cycle;
    }

    @Override
    public String urn() {
        return URN;
    }
}

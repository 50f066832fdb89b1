package io.pipevar.core.error;

/**
 * Thrown when a registered deferred resolver fails while computing a value from its seed. URN:
 * {@code urn:pipevar:error:deferred-eval-failed}
 */
public final class DeferredEvalException extends ResolutionEntryException {

    private static final long serialVersionUID = 1L;

    public static final String URN = "urn:pipevar:error:deferred-eval-failed";

    private final String deferredType;

    public DeferredEvalException(String message, String deferredType, String key) {
        super(message, key);
        this.deferredType = deferredType;
    }

    public DeferredEvalException(String message, Throwable cause, String deferredType, String key) {
        super(message, cause, key);
        this.deferredType = deferredType;
    }

    /** The resolver code that failed. */
    public String deferredType() {
        return deferredType;
    }

    @Override
    public String urn() {
        return URN;
    }
}

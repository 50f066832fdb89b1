package io.pipevar.core.error;

/**
 * Thrown when a deferred variable names a resolver code that is not registered. This is a
 * deployment error, not a data error, so it aborts the whole pass.
 */
public final class UnknownDeferredTypeException extends ConfigurationException {

    private static final long serialVersionUID = 1L;

    private final String deferredType;

    public UnknownDeferredTypeException(String deferredType, String source) {
        super("No deferred resolver registered for type: '" + deferredType + "'", source);
        this.deferredType = deferredType;
    }

    /** The unregistered resolver code. */
    public String deferredType() {
        return deferredType;
    }
}

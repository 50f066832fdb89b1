package io.pipevar.core.error;

/**
 * Abstract parent for recoverable per-entry resolution errors. The resolver records these against
 * the failing reference key and keeps resolving unrelated entries. Each concrete subclass declares
 * a stable {@code URN} used in structured reports.
 */
public abstract class ResolutionEntryException extends PipevarException {

    private static final long serialVersionUID = 1L;

    private final String key;

    protected ResolutionEntryException(String message, String key) {
        super(message, Phase.RESOLUTION);
        this.key = key;
    }

    protected ResolutionEntryException(String message, Throwable cause, String key) {
        super(message, cause, Phase.RESOLUTION);
        this.key = key;
    }

    /** The reference key whose resolution failed, or {@code null} outside a resolution pass. */
    public String key() {
        return key;
    }

    /** Stable error type identifier for this failure category. */
    public abstract String urn();
}

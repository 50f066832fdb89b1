package io.pipevar.core.error;

/**
 * Abstract base for all pipevar exceptions. Never thrown directly; use the concrete subclasses
 * under {@link ConfigurationException} or {@link ResolutionEntryException}.
 */
public abstract class PipevarException extends RuntimeException {

    private static final long serialVersionUID = 1L;

    /** Phase in which the error occurred. */
    public enum Phase {
        CONFIGURATION,
        RESOLUTION
    }

    private final Phase phase;

    protected PipevarException(String message, Phase phase) {
        super(message);
        this.phase = phase;
    }

    protected PipevarException(String message, Throwable cause, Phase phase) {
        super(message, cause);
        this.phase = phase;
    }

    /** Human-readable error description (alias for {@link #getMessage()}). */
    public String detail() {
        return getMessage();
    }

    /** The phase in which the error occurred. */
    public Phase phase() {
        return phase;
    }
}

package io.pipevar.core.error;

/**
 * Abstract parent for fatal configuration errors: unknown or duplicate deferred resolvers and
 * malformed declarations. These abort the whole resolution pass instead of being isolated to one
 * entry. Carries a {@code source} field identifying the file, resource or registry that caused the
 * error.
 */
public abstract class ConfigurationException extends PipevarException {

    private static final long serialVersionUID = 1L;

    private final String source;

    protected ConfigurationException(String message, String source) {
        super(message, Phase.CONFIGURATION);
        this.source = source;
    }

    protected ConfigurationException(String message, Throwable cause, String source) {
        super(message, cause, Phase.CONFIGURATION);
        this.source = source;
    }

    /** The file path or resource identifier that caused the error, or {@code null}. */
    public String source() {
        return source;
    }
}

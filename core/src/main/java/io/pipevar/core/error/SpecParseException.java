package io.pipevar.core.error;

/**
 * Thrown when a node declaration or variable wire document has invalid syntax, unknown keys or
 * missing required fields.
 */
public final class SpecParseException extends ConfigurationException {

    private static final long serialVersionUID = 1L;

    public SpecParseException(String message, String source) {
        super(message, source);
    }

    public SpecParseException(String message, Throwable cause, String source) {
        super(message, cause, source);
    }
}

package io.pipevar.core.error;

/** Thrown when a schema wire document is malformed or semantically invalid. */
public final class SchemaParseException extends ConfigurationException {

    private static final long serialVersionUID = 1L;

    public SchemaParseException(String message, String source) {
        super(message, source);
    }

    public SchemaParseException(String message, Throwable cause, String source) {
        super(message, cause, source);
    }
}

package io.pipevar.core.error;

/** Thrown when a deferred resolver code is registered twice. */
public final class DuplicateResolverException extends ConfigurationException {

    private static final long serialVersionUID = 1L;

    public DuplicateResolverException(String code) {
        super("A deferred resolver is already registered for code: '" + code + "'", "deferred-registry");
    }
}

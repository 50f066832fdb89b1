package io.pipevar.core.error;

/**
 * Thrown when an entry references a key that is absent from the resolution context. URN: {@code
 * urn:pipevar:error:unresolved-reference}
 */
public final class UnresolvedReferenceException extends ResolutionEntryException {

    private static final long serialVersionUID = 1L;

    public static final String URN = "urn:pipevar:error:unresolved-reference";

    private final String missingKey;

    public UnresolvedReferenceException(String missingKey, String requestingKey) {
        super("Entry '" + requestingKey + "' references unknown key '" + missingKey + "'", requestingKey);
        this.missingKey = missingKey;
    }

    /** The reference key that could not be found. */
    public String missingKey() {
        return missingKey;
    }

    @Override
    public String urn() {
        return URN;
    }
}

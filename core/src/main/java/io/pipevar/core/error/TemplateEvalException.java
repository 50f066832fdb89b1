package io.pipevar.core.error;

/**
 * Thrown when a template expression is malformed or fails at runtime (unknown key, missing
 * property, operator type error). URN: {@code urn:pipevar:error:template-eval-failed}
 */
public final class TemplateEvalException extends ResolutionEntryException {

    private static final long serialVersionUID = 1L;

    public static final String URN = "urn:pipevar:error:template-eval-failed";

    private final String reason;
    private final String expression;

    public TemplateEvalException(String reason, String expression) {
        this(reason, expression, null);
    }

    public TemplateEvalException(String reason, String expression, String key) {
        super(reason + " in expression '" + expression + "'", key);
        this.reason = reason;
        this.expression = expression;
    }

    /** The offending expression text (the content of a {@code ${...}} marker, or the template). */
    public String expression() {
        return expression;
    }

    /** The failure reason without the expression suffix. */
    public String reason() {
        return reason;
    }

    /** Returns a copy of this error attributed to the given context entry. */
    public TemplateEvalException forKey(String entryKey) {
        TemplateEvalException copy = new TemplateEvalException(reason, expression, entryKey);
        if (getCause() != null) {
            copy.initCause(getCause());
        }
        copy.setStackTrace(getStackTrace());
        return copy;
    }

    @Override
    public String urn() {
        return URN;
    }
}

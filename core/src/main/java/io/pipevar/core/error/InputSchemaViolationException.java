package io.pipevar.core.error;

import io.pipevar.core.model.ValidationReport;

/**
 * Thrown in strict validation mode when resolved node inputs do not conform to the node's declared
 * input schema. URN: {@code urn:pipevar:error:schema-validation-failed}
 */
public final class InputSchemaViolationException extends ResolutionEntryException {

    private static final long serialVersionUID = 1L;

    public static final String URN = "urn:pipevar:error:schema-validation-failed";

    private final transient ValidationReport report;

    public InputSchemaViolationException(String nodeId, ValidationReport report) {
        super(
                "Inputs of node '" + nodeId + "' violate the input schema: " + report.violations().size()
                        + " violation(s), first: " + report.violations().get(0).message(),
                nodeId);
        this.report = report;
    }

    /** The full validation report. */
    public ValidationReport report() {
        return report;
    }

    @Override
    public String urn() {
        return URN;
    }
}

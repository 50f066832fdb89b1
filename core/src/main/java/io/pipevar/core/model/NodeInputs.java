package io.pipevar.core.model;

import com.fasterxml.jackson.databind.node.ObjectNode;
import io.pipevar.core.error.ResolutionEntryException;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Resolved inputs for one node execution. The task handler decides whether failed inputs or schema
 * violations block execution; {@link #isReady()} is the common answer.
 *
 * @param nodeId      the node the inputs belong to
 * @param values      resolved inputs as a JSON object, keyed by input name
 * @param errors      per-input failures
 * @param inputReport validation of {@code values} against the node's input schema
 */
public record NodeInputs(
        String nodeId, ObjectNode values, Map<String, ResolutionEntryException> errors, ValidationReport inputReport) {

    public NodeInputs {
        values = values.deepCopy();
        errors = errors == null ? Map.of() : Collections.unmodifiableMap(new LinkedHashMap<>(errors));
        inputReport = inputReport == null ? ValidationReport.valid() : inputReport;
    }

    /** True when every input resolved and the inputs satisfy the input schema. */
    public boolean isReady() {
        return errors.isEmpty() && inputReport.isValid();
    }
}

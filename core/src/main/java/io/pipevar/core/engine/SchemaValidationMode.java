package io.pipevar.core.engine;

/**
 * Schema validation mode for node inputs.
 *
 * <ul>
 * <li>{@link #STRICT}: a non-empty input report is raised as
 * {@link io.pipevar.core.error.InputSchemaViolationException}.</li>
 * <li>{@link #LENIENT}: the report is returned with the inputs and the caller decides
 * (default).</li>
 * </ul>
 */
public enum SchemaValidationMode {
    /** Throw when inputs violate the input schema. */
    STRICT,

    /** Return the report alongside the inputs (default). */
    LENIENT
}

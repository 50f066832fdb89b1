package io.pipevar.core.engine;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.JsonNodeFactory;
import com.fasterxml.jackson.databind.node.ObjectNode;
import io.pipevar.core.error.InputSchemaViolationException;
import io.pipevar.core.model.NodeInputs;
import io.pipevar.core.model.NodeSpec;
import io.pipevar.core.model.ResolutionResult;
import io.pipevar.core.model.ValidationReport;
import java.util.Objects;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.slf4j.MDC;

/**
 * Entry point for task handlers: resolves a node's declared inputs against its scope and checks
 * them, and later its output, against the node's schemas.
 *
 * <p>
 * The node id is put in the MDC under {@value #MDC_NODE_ID} for the duration of a call.
 *
 * <p>
 * Thread-safe: every call builds its own {@link ResolutionContext}.
 */
public final class NodeInputResolver {

    private static final Logger LOG = LoggerFactory.getLogger(NodeInputResolver.class);

    /** MDC key carrying the node being resolved. */
    public static final String MDC_NODE_ID = "nodeId";

    private final VariableResolver resolver;
    private final SchemaValidator validator;
    private final ResolverOptions options;

    public NodeInputResolver(VariableResolver resolver, SchemaValidator validator) {
        this(resolver, validator, ResolverOptions.DEFAULT);
    }

    public NodeInputResolver(VariableResolver resolver, SchemaValidator validator, ResolverOptions options) {
        this.resolver = Objects.requireNonNull(resolver, "resolver must not be null");
        this.validator = Objects.requireNonNull(validator, "validator must not be null");
        this.options = Objects.requireNonNull(options, "options must not be null");
    }

    public ResolverOptions options() {
        return options;
    }

    /**
     * Resolves the node's inputs. The scope holds everything the inputs may reference (globals,
     * parent values, prior node outputs); the inputs themselves are added to it under their names.
     *
     * @param spec  the node declaration
     * @param scope entries visible to the node; consumed by this call
     * @return resolved inputs, per-input failures and the input schema report
     * @throws io.pipevar.core.error.UnknownDeferredTypeException if an input or scope entry names
     *                                                            an unregistered resolver
     * @throws io.pipevar.core.error.ResolutionEntryException     in strict resolution mode, the
     *                                                            first failed input
     * @throws InputSchemaViolationException                      in strict validation mode, when the
     *                                                            inputs violate the input schema
     */
    public NodeInputs resolveInputs(NodeSpec spec, ResolutionContext.Builder scope) {
        Objects.requireNonNull(spec, "spec must not be null");
        Objects.requireNonNull(scope, "scope must not be null");
        MDC.put(MDC_NODE_ID, spec.id());
        try {
            ResolutionContext context = scope.variables(spec.inputs()).build();
            ResolutionResult result =
                    resolver.resolveKeys(context, spec.inputs().keySet(), options.resolutionMode());

            ObjectNode values = JsonNodeFactory.instance.objectNode();
            result.values().forEach(values::set);
            ValidationReport report = spec.inputSchema() == null
                    ? ValidationReport.valid()
                    : validator.validate(spec.inputSchema(), values);

            LOG.info(
                    "Node inputs resolved: node_id={}, resolved={}, failed={}, violations={}",
                    spec.id(),
                    result.resolvedKeys().size(),
                    result.errors().size(),
                    report.violations().size());
            if (!report.isValid()) {
                if (options.validationMode() == SchemaValidationMode.STRICT) {
                    throw new InputSchemaViolationException(spec.id(), report);
                }
                LOG.warn("Node inputs violate input schema: node_id={}, report={}", spec.id(), report.toJson());
            }
            return new NodeInputs(spec.id(), values, result.errors(), report);
        } finally {
            MDC.remove(MDC_NODE_ID);
        }
    }

    /**
     * Validates a node's output against its output schema. Always lenient: the report is returned
     * to the caller.
     */
    public ValidationReport validateOutput(NodeSpec spec, JsonNode output) {
        Objects.requireNonNull(spec, "spec must not be null");
        if (spec.outputSchema() == null) {
            return ValidationReport.valid();
        }
        MDC.put(MDC_NODE_ID, spec.id());
        try {
            ValidationReport report = validator.validate(spec.outputSchema(), output);
            if (!report.isValid()) {
                LOG.warn(
                        "Node output violates output schema: node_id={}, violations={}",
                        spec.id(),
                        report.violations().size());
            }
            return report;
        } finally {
            MDC.remove(MDC_NODE_ID);
        }
    }
}

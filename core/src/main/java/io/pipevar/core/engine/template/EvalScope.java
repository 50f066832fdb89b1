package io.pipevar.core.engine.template;

import com.fasterxml.jackson.databind.JsonNode;
import io.pipevar.core.error.TemplateEvalException;
import java.util.Map;

/** Bindings and source text for one expression evaluation. */
record EvalScope(Map<String, JsonNode> bindings, String source) {

    TemplateEvalException fail(String reason) {
        return new TemplateEvalException(reason, source);
    }
}

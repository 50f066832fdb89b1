package io.pipevar.core.engine.template;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.JsonNodeFactory;
import com.fasterxml.jackson.databind.node.ObjectNode;
import io.pipevar.core.error.TemplateEvalException;
import io.pipevar.core.spi.ExpressionEngine;
import java.util.Iterator;
import java.util.LinkedHashSet;
import java.util.Map;
import java.util.Objects;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Extracts references from, and substitutes markers in, structured template values. Every string
 * leaf at any depth of an array or object is a template; object field names and non-string leaves
 * pass through unchanged.
 *
 * <p>
 * Thread-safe. Compiled templates are cached per engine instance up to {@link #MAX_CACHED_TEMPLATES}
 * distinct strings.
 */
public final class TemplateEngine {

    /** Upper bound on cached compiled templates; beyond it templates are compiled per call. */
    public static final int MAX_CACHED_TEMPLATES = 4096;

    private final ExpressionEngine expressionEngine;
    private final Map<String, CompiledTemplate> cache = new ConcurrentHashMap<>();

    /** Creates a template engine backed by the {@link RestrictedExpressionEngine}. */
    public TemplateEngine() {
        this(new RestrictedExpressionEngine());
    }

    public TemplateEngine(ExpressionEngine expressionEngine) {
        this.expressionEngine = Objects.requireNonNull(expressionEngine, "expressionEngine must not be null");
    }

    /** The expression engine used for marker contents. */
    public ExpressionEngine expressionEngine() {
        return expressionEngine;
    }

    /**
     * Compiles a single template string.
     *
     * @throws TemplateEvalException if a marker is malformed
     */
    public CompiledTemplate compile(String text) {
        Objects.requireNonNull(text, "text must not be null");
        CompiledTemplate cached = cache.get(text);
        if (cached != null) {
            return cached;
        }
        CompiledTemplate compiled = CompiledTemplate.compile(text, expressionEngine);
        if (cache.size() < MAX_CACHED_TEMPLATES) {
            cache.putIfAbsent(text, compiled);
        }
        return compiled;
    }

    /**
     * Returns every reference key the value depends on, scanning all string leaves.
     *
     * @param value       a structured template value
     * @param visibleKeys keys of the resolution context, used to split dotted references
     * @return referenced keys in order of first appearance
     * @throws TemplateEvalException if any marker is malformed
     */
    public Set<String> references(JsonNode value, Set<String> visibleKeys) {
        Set<String> keys = new LinkedHashSet<>();
        collectReferences(value, visibleKeys, keys);
        return keys;
    }

    /** True if any string leaf of the value contains a marker. */
    public boolean containsMarkers(JsonNode value) {
        if (value == null) {
            return false;
        }
        if (value.isTextual()) {
            return compile(value.textValue()).hasMarkers();
        }
        if (value.isContainerNode()) {
            for (JsonNode child : value) {
                if (containsMarkers(child)) {
                    return true;
                }
            }
        }
        return false;
    }

    /**
     * Substitutes markers in every string leaf and returns a new tree; {@code value} is not
     * modified.
     *
     * @param value    a structured template value
     * @param bindings resolved values by reference key
     * @throws TemplateEvalException if any marker fails to compile or evaluate
     */
    public JsonNode render(JsonNode value, Map<String, JsonNode> bindings) {
        Objects.requireNonNull(bindings, "bindings must not be null");
        if (value == null) {
            return JsonNodeFactory.instance.nullNode();
        }
        if (value.isTextual()) {
            return compile(value.textValue()).render(bindings);
        }
        if (value.isArray()) {
            ArrayNode out = JsonNodeFactory.instance.arrayNode(value.size());
            for (JsonNode element : value) {
                out.add(render(element, bindings));
            }
            return out;
        }
        if (value.isObject()) {
            ObjectNode out = JsonNodeFactory.instance.objectNode();
            Iterator<Map.Entry<String, JsonNode>> fields = value.fields();
            while (fields.hasNext()) {
                Map.Entry<String, JsonNode> field = fields.next();
                out.set(field.getKey(), render(field.getValue(), bindings));
            }
            return out;
        }
        return value.deepCopy();
    }

    private void collectReferences(JsonNode value, Set<String> visibleKeys, Set<String> out) {
        if (value == null) {
            return;
        }
        if (value.isTextual()) {
            out.addAll(compile(value.textValue()).references(visibleKeys));
        } else if (value.isContainerNode()) {
            for (JsonNode child : value) {
                collectReferences(child, visibleKeys, out);
            }
        }
    }
}

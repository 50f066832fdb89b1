package io.pipevar.core.engine.template;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.JsonNodeFactory;
import io.pipevar.core.engine.JsonNodeUtils;
import io.pipevar.core.error.TemplateEvalException;
import io.pipevar.core.spi.CompiledExpression;
import io.pipevar.core.spi.ExpressionEngine;
import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * A template string split into literal text and compiled {@code ${...}} markers. <code>$${</code> is
 * an escape for a literal <code>${</code>. Immutable and thread-safe.
 *
 * <p>
 * A template consisting of exactly one marker evaluates to the marker's raw value (numbers,
 * objects and arrays keep their type); otherwise each marker is rendered into the surrounding text.
 * Rendered values are never scanned for markers again.
 */
public final class CompiledTemplate {

    private final String text;
    private final List<Object> parts;

    private CompiledTemplate(String text, List<Object> parts) {
        this.text = text;
        this.parts = Collections.unmodifiableList(parts);
    }

    /**
     * Splits {@code text} into parts, compiling each marker with the given engine.
     *
     * @throws TemplateEvalException if a marker is unterminated, empty or malformed
     */
    static CompiledTemplate compile(String text, ExpressionEngine engine) {
        List<Object> parts = new ArrayList<>();
        StringBuilder literal = new StringBuilder();
        int i = 0;
        while (i < text.length()) {
            if (text.startsWith("$${", i)) {
                literal.append("${");
                i += 3;
            } else if (text.startsWith("${", i)) {
                int end = findMarkerEnd(text, i + 2);
                if (end < 0) {
                    throw new TemplateEvalException("Unterminated '${' marker", text);
                }
                String expression = text.substring(i + 2, end).trim();
                if (expression.isEmpty()) {
                    throw new TemplateEvalException("Empty '${}' marker", text);
                }
                if (literal.length() > 0) {
                    parts.add(literal.toString());
                    literal.setLength(0);
                }
                parts.add(engine.compile(expression));
                i = end + 1;
            } else {
                literal.append(text.charAt(i));
                i++;
            }
        }
        if (literal.length() > 0) {
            parts.add(literal.toString());
        }
        return new CompiledTemplate(text, parts);
    }

    /** Index of the closing brace, skipping braces inside quoted string literals; -1 if none. */
    private static int findMarkerEnd(String text, int from) {
        char quote = 0;
        for (int i = from; i < text.length(); i++) {
            char c = text.charAt(i);
            if (quote != 0) {
                if (c == '\\') {
                    i++;
                } else if (c == quote) {
                    quote = 0;
                }
            } else if (c == '\'' || c == '"') {
                quote = c;
            } else if (c == '}') {
                return i;
            }
        }
        return -1;
    }

    /** The original template text. */
    public String text() {
        return text;
    }

    /** True if the template contains at least one {@code ${...}} marker. */
    public boolean hasMarkers() {
        return parts.stream().anyMatch(CompiledExpression.class::isInstance);
    }

    /** Reference keys read by all markers, in order of first appearance. */
    public Set<String> references(Set<String> visibleKeys) {
        Set<String> keys = new LinkedHashSet<>();
        for (Object part : parts) {
            if (part instanceof CompiledExpression) {
                keys.addAll(((CompiledExpression) part).references(visibleKeys));
            }
        }
        return keys;
    }

    /**
     * Substitutes every marker.
     *
     * @throws TemplateEvalException if a marker fails to evaluate
     */
    public JsonNode render(Map<String, JsonNode> bindings) {
        if (parts.size() == 1 && parts.get(0) instanceof CompiledExpression) {
            return ((CompiledExpression) parts.get(0)).evaluate(bindings).deepCopy();
        }
        StringBuilder sb = new StringBuilder();
        for (Object part : parts) {
            if (part instanceof CompiledExpression) {
                sb.append(JsonNodeUtils.renderText(((CompiledExpression) part).evaluate(bindings)));
            } else {
                sb.append((String) part);
            }
        }
        return JsonNodeFactory.instance.textNode(sb.toString());
    }

    @Override
    public String toString() {
        return "CompiledTemplate[" + text + "]";
    }
}

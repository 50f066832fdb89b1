package io.pipevar.core.model;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.JsonNodeFactory;
import com.fasterxml.jackson.databind.node.ObjectNode;
import io.pipevar.core.error.ResolutionEntryException;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;
import java.util.Set;

/**
 * Outcome of a resolution pass: successfully resolved values alongside per-entry errors. A key
 * appears in exactly one of the two maps. Both maps keep context insertion order.
 *
 * <p>
 * Read-only: values are copied in and every accessor hands out a fresh copy, so a result can be
 * shared between threads and contexts.
 */
public final class ResolutionResult {

    private final Map<String, JsonNode> values;
    private final Map<String, ResolutionEntryException> errors;

    public ResolutionResult(Map<String, JsonNode> values, Map<String, ResolutionEntryException> errors) {
        this.values = copyOf(Objects.requireNonNull(values, "values"));
        this.errors = Collections.unmodifiableMap(new LinkedHashMap<>(Objects.requireNonNull(errors, "errors")));
    }

    public static ResolutionResult empty() {
        return new ResolutionResult(Map.of(), Map.of());
    }

    /** Copies of the resolved values by reference key. */
    public Map<String, JsonNode> values() {
        return copyOf(values);
    }

    /** Keys that resolved, in context order. */
    public Set<String> resolvedKeys() {
        return values.keySet();
    }

    /** Per-entry failures by reference key. */
    public Map<String, ResolutionEntryException> errors() {
        return errors;
    }

    /** True when every entry resolved. */
    public boolean isComplete() {
        return errors.isEmpty();
    }

    /** The resolved value, or {@code null} if the key failed or is unknown. */
    public JsonNode value(String key) {
        JsonNode value = values.get(key);
        return value == null ? null : value.deepCopy();
    }

    /** The failure for the key, or {@code null} if it resolved or is unknown. */
    public ResolutionEntryException error(String key) {
        return errors.get(key);
    }

    /**
     * Returns the resolved value, rethrowing the entry's own failure when it did not resolve.
     *
     * @throws ResolutionEntryException the recorded failure of the entry
     * @throws IllegalArgumentException if the key was not part of the pass
     */
    public JsonNode requireValue(String key) {
        JsonNode value = values.get(key);
        if (value != null) {
            return value.deepCopy();
        }
        ResolutionEntryException error = errors.get(key);
        if (error != null) {
            throw error;
        }
        throw new IllegalArgumentException("Key was not part of the resolution pass: '" + key + "'");
    }

    /**
     * Renders the result as {@code {"values": {...}, "errors": {"key": {"type": urn, "detail": ...}}}}.
     */
    public ObjectNode toJson() {
        ObjectNode root = JsonNodeFactory.instance.objectNode();
        ObjectNode valueNode = root.putObject("values");
        values.forEach((key, value) -> valueNode.set(key, value.deepCopy()));
        ObjectNode errorNode = root.putObject("errors");
        errors.forEach((key, error) -> {
            ObjectNode entry = errorNode.putObject(key);
            entry.put("type", error.urn());
            entry.put("detail", error.detail());
        });
        return root;
    }

    private static Map<String, JsonNode> copyOf(Map<String, JsonNode> source) {
        Map<String, JsonNode> copy = new LinkedHashMap<>();
        source.forEach((key, value) -> copy.put(key, Objects.requireNonNull(value, "value").deepCopy()));
        return Collections.unmodifiableMap(copy);
    }

    @Override
    public String toString() {
        return "ResolutionResult{resolved=" + values.keySet() + ", failed=" + errors.keySet() + "}";
    }
}

package io.pipevar.core.model;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;

/**
 * A node's declared inputs and its input/output schemas, as handed over by the surrounding workflow
 * definition. Schemas are optional; a missing schema skips validation.
 */
public record NodeSpec(
        String id,
        String description,
        Map<String, Variable> inputs,
        SchemaNode inputSchema,
        SchemaNode outputSchema) {

    public NodeSpec {
        Objects.requireNonNull(id, "id must not be null");
        description = description == null ? "" : description;
        inputs = inputs == null ? Map.of() : Collections.unmodifiableMap(new LinkedHashMap<>(inputs));
    }
}

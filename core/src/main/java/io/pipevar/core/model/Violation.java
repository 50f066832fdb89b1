package io.pipevar.core.model;

import java.util.List;
import java.util.Objects;

/**
 * A single schema mismatch. Violations are data returned by validation, never thrown.
 *
 * @param path     segments from the validated root: property names (see
 *                 {@link #propertySegment(String)}), or {@code [i]} for array indices; empty for the
 *                 root itself
 * @param expected summary of the schema node that was not satisfied
 * @param actual   observed type tag ({@code string}, {@code int}, {@code float}, {@code boolean},
 *                 {@code array}, {@code object} or {@code null})
 * @param message  human-readable description
 */
public record Violation(List<String> path, String expected, String actual, String message) {

    public Violation {
        path = List.copyOf(Objects.requireNonNull(path, "path must not be null"));
        Objects.requireNonNull(expected, "expected must not be null");
        Objects.requireNonNull(actual, "actual must not be null");
        Objects.requireNonNull(message, "message must not be null");
    }

    /** Formats an array index as a path segment. */
    public static String indexSegment(int index) {
        return "[" + index + "]";
    }

    /**
     * Formats a property name as a path segment. Plain names are kept as-is; a name that is empty
     * or contains {@code .}, {@code [}, {@code ]} or {@code '} is quoted as {@code ['name']} with
     * backslash escapes, so it cannot be mistaken for an index or a nested path.
     */
    public static String propertySegment(String name) {
        Objects.requireNonNull(name, "name must not be null");
        boolean plain = !name.isEmpty()
                && name.chars().noneMatch(c -> c == '.' || c == '[' || c == ']' || c == '\'' || c == '\\');
        if (plain) {
            return name;
        }
        return "['" + name.replace("\\", "\\\\").replace("'", "\\'") + "']";
    }

    /**
     * Renders the path as {@code $}, {@code $.timeout}, {@code $.items[0].name} or
     * {@code $['a.b']}.
     */
    public String pointer() {
        return pointer(path);
    }

    /** Renders a path the same way as {@link #pointer()}. */
    public static String pointer(List<String> path) {
        StringBuilder sb = new StringBuilder("$");
        for (String segment : path) {
            if (!segment.startsWith("[")) {
                sb.append('.');
            }
            sb.append(segment);
        }
        return sb.toString();
    }
}

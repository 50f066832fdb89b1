package io.pipevar.core.model;

import java.util.Arrays;
import java.util.Optional;

/**
 * How a declared variable turns into a concrete value. Each kind has a wire name used in workflow
 * definitions:
 *
 * <ul>
 * <li>{@link #LITERAL} ({@code plain}): the raw value is returned unchanged.</li>
 * <li>{@link #TEMPLATE} ({@code splice}): {@code ${...}} markers in string leaves are substituted.
 * </li>
 * <li>{@link #DEFERRED} ({@code lazy}): the raw value is template-substituted into a seed, then
 * handed to a registered resolver.</li>
 * </ul>
 */
public enum VariableKind {
    LITERAL("plain"),
    TEMPLATE("splice"),
    DEFERRED("lazy");

    private final String wireName;

    VariableKind(String wireName) {
        this.wireName = wireName;
    }

    /** The {@code type} value used in the variable wire format. */
    public String wireName() {
        return wireName;
    }

    /** Looks up a kind by its wire name. */
    public static Optional<VariableKind> fromWireName(String name) {
        return Arrays.stream(values()).filter(k -> k.wireName.equals(name)).findFirst();
    }
}

package io.pipevar.core.engine;

import java.util.Objects;

/**
 * Options for {@link NodeInputResolver}.
 *
 * <p>
 * Immutable and thread-safe.
 *
 * @param resolutionMode failure policy for input resolution (default: {@link ResolutionMode#PARTIAL})
 * @param validationMode input schema enforcement (default: {@link SchemaValidationMode#LENIENT})
 */
public record ResolverOptions(ResolutionMode resolutionMode, SchemaValidationMode validationMode) {

    /** Default options: partial resolution, lenient validation. */
    public static final ResolverOptions DEFAULT =
            new ResolverOptions(ResolutionMode.PARTIAL, SchemaValidationMode.LENIENT);

    /** Strict resolution and strict validation. */
    public static final ResolverOptions STRICT =
            new ResolverOptions(ResolutionMode.STRICT, SchemaValidationMode.STRICT);

    public ResolverOptions {
        Objects.requireNonNull(resolutionMode, "resolutionMode must not be null");
        Objects.requireNonNull(validationMode, "validationMode must not be null");
    }
}

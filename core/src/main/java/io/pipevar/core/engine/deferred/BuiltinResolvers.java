package io.pipevar.core.engine.deferred;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.JsonNodeFactory;
import io.pipevar.core.engine.DeferredRegistry;
import io.pipevar.core.spi.DeferredResolver;
import java.time.Clock;
import java.time.ZoneOffset;
import java.time.format.DateTimeFormatter;
import java.util.Objects;
import java.util.function.Function;

/**
 * Deferred resolvers shipped with the core.
 *
 * <ul>
 * <li>{@value #TIMESTAMP}: appends {@code _yyyyMMddHHmmss} (UTC) to a string seed, e.g. a build
 * tag {@code release_20260101093000}. An empty or null seed yields the time alone.</li>
 * <li>{@value #ENV}: reads the environment variable named by a string seed, or by
 * {@code {"name": ..., "default": ...}}.</li>
 * <li>{@value #JSON}: parses a string seed as JSON text.</li>
 * </ul>
 */
public final class BuiltinResolvers {

    public static final String TIMESTAMP = "timestamp";
    public static final String ENV = "env";
    public static final String JSON = "json";

    private static final DateTimeFormatter STAMP_FORMAT =
            DateTimeFormatter.ofPattern("yyyyMMddHHmmss").withZone(ZoneOffset.UTC);
    private static final ObjectMapper MAPPER = new ObjectMapper();

    private BuiltinResolvers() {}

    /** Registers all built-in resolvers; the environment is read through {@link System#getenv(String)}. */
    public static void registerAll(DeferredRegistry registry, Clock clock) {
        registry.register(TIMESTAMP, timestamp(clock));
        registry.register(ENV, env(System::getenv));
        registry.register(JSON, json());
    }

    public static DeferredResolver timestamp(Clock clock) {
        Objects.requireNonNull(clock, "clock must not be null");
        return seed -> {
            String stamp = STAMP_FORMAT.format(clock.instant());
            if (seed.isNull() || (seed.isTextual() && seed.textValue().isEmpty())) {
                return JsonNodeFactory.instance.textNode(stamp);
            }
            if (!seed.isTextual()) {
                throw new IllegalArgumentException("timestamp seed must be a string, got " + seed.getNodeType());
            }
            return JsonNodeFactory.instance.textNode(seed.textValue() + "_" + stamp);
        };
    }

    /**
     * @param lookup read-only view of the environment, {@code System::getenv} in production
     */
    public static DeferredResolver env(Function<String, String> lookup) {
        Objects.requireNonNull(lookup, "lookup must not be null");
        return seed -> {
            String name;
            JsonNode fallback = null;
            if (seed.isTextual()) {
                name = seed.textValue();
            } else if (seed.isObject() && seed.path("name").isTextual()) {
                name = seed.get("name").textValue();
                fallback = seed.get("default");
            } else {
                throw new IllegalArgumentException("env seed must be a variable name or {name, default}");
            }
            String value = lookup.apply(name);
            if (value != null) {
                return JsonNodeFactory.instance.textNode(value);
            }
            if (fallback != null) {
                return fallback.deepCopy();
            }
            throw new IllegalArgumentException("Environment variable '" + name + "' is not set");
        };
    }

    public static DeferredResolver json() {
        return seed -> {
            if (!seed.isTextual()) {
                throw new IllegalArgumentException("json seed must be a string, got " + seed.getNodeType());
            }
            try {
                return MAPPER.readTree(seed.textValue());
            } catch (JsonProcessingException e) {
                throw new IllegalArgumentException("json seed is not valid JSON: " + e.getOriginalMessage(), e);
            }
        };
    }
}

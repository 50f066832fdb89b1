package io.pipevar.core.engine;

import com.fasterxml.jackson.databind.JsonNode;
import io.pipevar.core.engine.deferred.BuiltinResolvers;
import io.pipevar.core.error.DuplicateResolverException;
import io.pipevar.core.error.UnknownDeferredTypeException;
import io.pipevar.core.spi.DeferredResolver;
import java.time.Clock;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.TreeSet;
import java.util.concurrent.ConcurrentHashMap;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Registry of deferred resolvers keyed by code. Populated at process start. Codes are globally
 * unique: registering a code twice is an error, and looking up an unknown code is a fatal
 * configuration error rather than a silent fallback. Thread-safe: registration and lookup can
 * happen concurrently.
 */
public final class DeferredRegistry {

    private static final Logger LOG = LoggerFactory.getLogger(DeferredRegistry.class);

    /** Source label used in configuration errors raised by this registry. */
    static final String SOURCE = "deferred-registry";

    private final Map<String, DeferredResolver> resolvers = new ConcurrentHashMap<>();

    /** Creates a registry pre-populated with {@link BuiltinResolvers} using the UTC system clock. */
    public static DeferredRegistry withBuiltins() {
        return withBuiltins(Clock.systemUTC());
    }

    /** Creates a registry pre-populated with {@link BuiltinResolvers}. */
    public static DeferredRegistry withBuiltins(Clock clock) {
        DeferredRegistry registry = new DeferredRegistry();
        BuiltinResolvers.registerAll(registry, clock);
        return registry;
    }

    /**
     * Registers a resolver under the given code.
     *
     * @param code     the {@code custom_type} value deferred variables use to select it
     * @param resolver the resolver
     * @throws NullPointerException       if code or resolver is null
     * @throws IllegalArgumentException   if code is empty
     * @throws DuplicateResolverException if the code is already registered
     */
    public void register(String code, DeferredResolver resolver) {
        if (code == null) {
            throw new NullPointerException("code must not be null");
        }
        if (resolver == null) {
            throw new NullPointerException("resolver must not be null");
        }
        if (code.isEmpty()) {
            throw new IllegalArgumentException("code must not be empty");
        }
        if (resolvers.putIfAbsent(code, resolver) != null) {
            throw new DuplicateResolverException(code);
        }
        LOG.debug("Registered deferred resolver: code={}", code);
    }

    /**
     * Looks up a resolver by code.
     *
     * @return the resolver, or empty if not registered
     */
    public Optional<DeferredResolver> getResolver(String code) {
        return code == null ? Optional.empty() : Optional.ofNullable(resolvers.get(code));
    }

    /**
     * Looks up a resolver by code, throwing if not found.
     *
     * @throws UnknownDeferredTypeException if no resolver is registered for the code
     */
    public DeferredResolver requireResolver(String code) {
        return getResolver(code).orElseThrow(() -> new UnknownDeferredTypeException(code, SOURCE));
    }

    /**
     * Invokes the resolver registered under {@code code} on the seed.
     *
     * @throws UnknownDeferredTypeException if no resolver is registered for the code
     * @throws IllegalStateException        if the resolver returns {@code null}
     */
    public JsonNode resolve(String code, JsonNode seed) {
        JsonNode value = requireResolver(code).resolve(seed);
        if (value == null) {
            throw new IllegalStateException("Deferred resolver '" + code + "' returned null");
        }
        return value;
    }

    /** Returns {@code true} if a resolver is registered for the code. */
    public boolean hasResolver(String code) {
        return code != null && resolvers.containsKey(code);
    }

    /** Registered codes, sorted. */
    public Set<String> codes() {
        return new TreeSet<>(resolvers.keySet());
    }

    /** Returns the number of registered resolvers. */
    public int size() {
        return resolvers.size();
    }
}

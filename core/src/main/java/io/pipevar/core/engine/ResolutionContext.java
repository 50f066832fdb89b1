package io.pipevar.core.engine;

import com.fasterxml.jackson.databind.JsonNode;
import io.pipevar.core.error.ResolutionEntryException;
import io.pipevar.core.model.EntryState;
import io.pipevar.core.model.ResolutionResult;
import io.pipevar.core.model.Variable;
import io.pipevar.core.model.VariableKind;
import java.util.Collection;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;

/**
 * All named values visible to one resolution pass: workflow globals, parent-scope values, prior
 * node outputs and the node's own declared inputs. Each key is in exactly one {@link EntryState}
 * at any time; resolved values and failures are memoized for the rest of the pass.
 *
 * <p>
 * Built fresh per pass and owned by it. Not thread-safe; concurrent passes each use their own
 * context (see {@link SharedGlobals} for sharing workflow-level globals).
 */
public final class ResolutionContext {

    private final Set<String> keys;
    private final Map<String, Variable> variables;
    private final Map<String, EntryState> states = new LinkedHashMap<>();
    private final Map<String, JsonNode> values = new LinkedHashMap<>();
    private final Map<String, ResolutionEntryException> errors = new LinkedHashMap<>();

    private ResolutionContext(Builder builder) {
        this.keys = Collections.unmodifiableSet(new LinkedHashSet<>(builder.order));
        this.variables = Collections.unmodifiableMap(new LinkedHashMap<>(builder.variables));
        for (String key : keys) {
            if (builder.values.containsKey(key)) {
                states.put(key, EntryState.RESOLVED);
                values.put(key, builder.values.get(key));
            } else if (builder.errors.containsKey(key)) {
                states.put(key, EntryState.FAILED);
                errors.put(key, builder.errors.get(key));
            } else {
                states.put(key, EntryState.UNRESOLVED);
            }
        }
    }

    public static Builder builder() {
        return new Builder();
    }

    /** Every key visible in this pass, in declaration order. */
    public Set<String> keys() {
        return keys;
    }

    public boolean contains(String key) {
        return keys.contains(key);
    }

    /** Current state of the key, or {@code null} if the key is not part of the context. */
    public EntryState state(String key) {
        return states.get(key);
    }

    /** The declared variable behind a key; empty for entries supplied as already-resolved values. */
    public Optional<Variable> variable(String key) {
        return Optional.ofNullable(variables.get(key));
    }

    /** Declared deferred variables, used to check resolver codes before a pass starts. */
    Map<String, Variable> deferredVariables() {
        Map<String, Variable> deferred = new LinkedHashMap<>();
        variables.forEach((key, variable) -> {
            if (variable.kind() == VariableKind.DEFERRED) {
                deferred.put(key, variable);
            }
        });
        return deferred;
    }

    JsonNode value(String key) {
        return values.get(key);
    }

    ResolutionEntryException error(String key) {
        return errors.get(key);
    }

    void markResolving(String key) {
        transition(key, EntryState.UNRESOLVED, EntryState.RESOLVING);
    }

    void markResolved(String key, JsonNode value) {
        transition(key, EntryState.RESOLVING, EntryState.RESOLVED);
        values.put(key, value);
    }

    void markFailed(String key, ResolutionEntryException error) {
        transition(key, EntryState.RESOLVING, EntryState.FAILED);
        errors.put(key, error);
    }

    private void transition(String key, EntryState from, EntryState to) {
        EntryState current = states.get(key);
        if (current != from) {
            throw new IllegalStateException(
                    "Entry '" + key + "' cannot move to " + to + " from " + current + " (expected " + from + ")");
        }
        states.put(key, to);
    }

    /** Snapshot of the given keys' current outcomes; keys still unresolved are left out. */
    ResolutionResult snapshot(Collection<String> selected) {
        Map<String, JsonNode> resolved = new LinkedHashMap<>();
        Map<String, ResolutionEntryException> failed = new LinkedHashMap<>();
        for (String key : selected) {
            if (values.containsKey(key)) {
                resolved.put(key, values.get(key));
            } else if (errors.containsKey(key)) {
                failed.put(key, errors.get(key));
            }
        }
        return new ResolutionResult(resolved, failed);
    }

    /**
     * Collects the entries of a pass. Keys are unique across all sources; declaring a key twice is
     * rejected so that a global cannot be silently shadowed by an input of the same name.
     */
    public static final class Builder {

        private final Set<String> order = new LinkedHashSet<>();
        private final Map<String, Variable> variables = new LinkedHashMap<>();
        private final Map<String, JsonNode> values = new LinkedHashMap<>();
        private final Map<String, ResolutionEntryException> errors = new LinkedHashMap<>();

        private Builder() {}

        /** Adds an already-resolved value (a parent-scope value or a prior node output). */
        public Builder value(String key, JsonNode value) {
            Objects.requireNonNull(value, "value must not be null");
            claim(key);
            values.put(key, value.deepCopy());
            return this;
        }

        public Builder values(Map<String, JsonNode> entries) {
            entries.forEach(this::value);
            return this;
        }

        /**
         * Adds the output object of a previously executed node; templates read its fields as
         * {@code ${nodeId.field}}.
         */
        public Builder nodeOutput(String nodeId, JsonNode output) {
            return value(nodeId, output);
        }

        /** Adds a declared variable to be resolved in this pass. */
        public Builder variable(String key, Variable variable) {
            Objects.requireNonNull(variable, "variable must not be null");
            claim(key);
            variables.put(key, variable);
            return this;
        }

        public Builder variables(Map<String, Variable> entries) {
            entries.forEach(this::variable);
            return this;
        }

        /**
         * Imports workflow-level globals. They are resolved at most once across all passes sharing
         * the store; globals that failed there are failed entries here.
         */
        public Builder globals(SharedGlobals globals) {
            ResolutionResult result = globals.get();
            result.values().forEach(this::value);
            result.errors().forEach((key, error) -> {
                claim(key);
                errors.put(key, error);
            });
            return this;
        }

        public ResolutionContext build() {
            return new ResolutionContext(this);
        }

        private void claim(String key) {
            Objects.requireNonNull(key, "key must not be null");
            if (key.isEmpty()) {
                throw new IllegalArgumentException("key must not be empty");
            }
            if (!order.add(key)) {
                throw new IllegalArgumentException("Duplicate reference key: '" + key + "'");
            }
        }
    }
}

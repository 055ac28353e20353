package io.catena.core.execution;

import java.util.Collections;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;

/// Mutable state of one execution: input, accumulated variables and environment.
///
/// Variables are append-only. Each step's output is stored once under
/// `step_<id>_output`; writing an existing key fails. Conditions, templates and input
/// mappings read through {@link #scope()}, which also exposes the execution input as
/// `input` and the environment overrides as `env`.
///
/// ### Contracts
/// - **Invariant**: a variable, once written, is never replaced or removed
/// - **Invariant**: `depth` is 0 for top-level runs and grows by one per nested chain
///
/// @implNote **Not thread-safe**. A context is owned by the single worker running its
/// execution; steps of one execution never run in parallel.
public final class ExecutionContext {

    public static final String INPUT_KEY = "input";
    public static final String ENV_KEY = "env";

    private final String executionId;
    private final String chainId;
    private final String triggerId;
    private final Map<String, Object> input;
    private final Map<String, String> env;
    private final Map<String, Object> variables;
    private final int depth;
    private int retriesUsed;

    private ExecutionContext(
            String executionId,
            String chainId,
            String triggerId,
            Map<String, Object> input,
            Map<String, String> env,
            Map<String, Object> variables,
            int depth,
            int retriesUsed) {
        this.executionId = Objects.requireNonNull(executionId, "executionId must not be null");
        this.chainId = Objects.requireNonNull(chainId, "chainId must not be null");
        this.triggerId = triggerId;
        this.input =
                input != null
                        ? Collections.unmodifiableMap(new LinkedHashMap<>(input))
                        : Map.of();
        this.env = env != null ? Map.copyOf(env) : Map.of();
        this.variables = variables != null ? new LinkedHashMap<>(variables) : new LinkedHashMap<>();
        this.depth = depth;
        this.retriesUsed = retriesUsed;
    }

    /// Creates the context of a new top-level execution.
    ///
    /// @param executionId execution identifier, not null
    /// @param chainId chain being executed, not null
    /// @param triggerId chain instance the execution belongs to, may be null
    /// @param input trigger input, may be null
    /// @param env environment overrides, may be null
    /// @return fresh context at depth 0, never null
    public static ExecutionContext create(
            String executionId,
            String chainId,
            String triggerId,
            Map<String, Object> input,
            Map<String, String> env) {
        return new ExecutionContext(executionId, chainId, triggerId, input, env, null, 0, 0);
    }

    /// Rebuilds a context from persisted state.
    ///
    /// @return restored context, never null
    public static ExecutionContext restore(
            String executionId,
            String chainId,
            String triggerId,
            Map<String, Object> input,
            Map<String, String> env,
            Map<String, Object> variables,
            int depth,
            int retriesUsed) {
        return new ExecutionContext(
                executionId, chainId, triggerId, input, env, variables, depth, retriesUsed);
    }

    /// Creates the context of a nested chain run.
    ///
    /// The child inherits the environment and trigger id, starts with no variables and
    /// runs one level deeper.
    ///
    /// @param childExecutionId identifier of the nested execution, not null
    /// @param childChainId nested chain, not null
    /// @param childInput input resolved from the parent's mapping, may be null
    /// @return child context, never null
    public ExecutionContext child(
            String childExecutionId, String childChainId, Map<String, Object> childInput) {
        return new ExecutionContext(
                childExecutionId, childChainId, triggerId, childInput, env, null, depth + 1, 0);
    }

    public String getExecutionId() {
        return executionId;
    }

    public String getChainId() {
        return chainId;
    }

    public String getTriggerId() {
        return triggerId;
    }

    public Map<String, Object> getInput() {
        return input;
    }

    public Map<String, String> getEnv() {
        return env;
    }

    /// Returns a read-only view of the accumulated variables.
    ///
    /// @return unmodifiable view, never null
    public Map<String, Object> getVariables() {
        return Collections.unmodifiableMap(variables);
    }

    public int getDepth() {
        return depth;
    }

    /// Returns how many retries this execution has spent against its retry ceiling.
    public int getRetriesUsed() {
        return retriesUsed;
    }

    /// Records one retry against the execution's retry ceiling.
    public void recordRetry() {
        retriesUsed++;
    }

    /// Appends a variable.
    ///
    /// @param key variable name, not null
    /// @param value value, may be null
    /// @throws IllegalStateException if the variable already exists
    public void putVariable(String key, Object value) {
        Objects.requireNonNull(key, "key must not be null");
        if (variables.containsKey(key)) {
            throw new IllegalStateException(
                    "Variable '" + key + "' already written in execution " + executionId);
        }
        variables.put(key, value);
    }

    public boolean hasVariable(String key) {
        return variables.containsKey(key);
    }

    /// Returns the lookup scope for conditions and templates: all variables plus
    /// `input` and `env`.
    ///
    /// @return new unmodifiable map, never null
    public Map<String, Object> scope() {
        Map<String, Object> scope = new HashMap<>(variables);
        scope.putIfAbsent(INPUT_KEY, input);
        scope.putIfAbsent(ENV_KEY, env);
        return Collections.unmodifiableMap(scope);
    }

    /// Returns an independent copy, used for checkpoint snapshots.
    ///
    /// @return copy sharing no mutable state with this context, never null
    public ExecutionContext copy() {
        return new ExecutionContext(
                executionId, chainId, triggerId, input, env, variables, depth, retriesUsed);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (!(o instanceof ExecutionContext that)) {
            return false;
        }
        return depth == that.depth
                && retriesUsed == that.retriesUsed
                && executionId.equals(that.executionId)
                && chainId.equals(that.chainId)
                && Objects.equals(triggerId, that.triggerId)
                && input.equals(that.input)
                && env.equals(that.env)
                && variables.equals(that.variables);
    }

    @Override
    public int hashCode() {
        return Objects.hash(
                executionId, chainId, triggerId, input, env, variables, depth, retriesUsed);
    }

    @Override
    public String toString() {
        return "ExecutionContext{executionId='"
                + executionId
                + "', chainId='"
                + chainId
                + "', depth="
                + depth
                + ", variables="
                + variables.keySet()
                + "}";
    }
}

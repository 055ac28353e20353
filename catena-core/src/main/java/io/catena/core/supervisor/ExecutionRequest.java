package io.catena.core.supervisor;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;

/// Trigger for a new execution.
///
/// @param triggerId chain instance the execution belongs to; at most one execution per
///     trigger id runs at a time, not null
/// @param chainId chain to run, not null
/// @param input trigger input, may be null
/// @param env environment overrides, may be null
public record ExecutionRequest(
        String triggerId, String chainId, Map<String, Object> input, Map<String, String> env) {

    public ExecutionRequest {
        Objects.requireNonNull(triggerId, "triggerId must not be null");
        Objects.requireNonNull(chainId, "chainId must not be null");
        input =
                input != null
                        ? Collections.unmodifiableMap(new LinkedHashMap<>(input))
                        : Map.of();
        env = env != null ? Map.copyOf(env) : Map.of();
    }

    public static ExecutionRequest of(String triggerId, String chainId, Map<String, Object> input) {
        return new ExecutionRequest(triggerId, chainId, input, null);
    }
}

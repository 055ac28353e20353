package io.catena.core.execution;

import java.time.Duration;
import java.time.Instant;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/// Final outcome of an execution.
///
/// @param executionId execution identifier, not null
/// @param chainId executed chain, not null
/// @param status terminal status, not null
/// @param steps step results in execution order, not null
/// @param startedAt when the run (or its resumption) started, not null
/// @param completedAt when the run ended, not null
/// @param durationMs wall time of the run
/// @param output projected output, empty unless completed, not null
/// @param error triggering error message, null when completed
/// @param errorType triggering error code, null when completed
public record ExecutionResult(
        String executionId,
        String chainId,
        ExecutionStatus status,
        List<StepResult> steps,
        Instant startedAt,
        Instant completedAt,
        long durationMs,
        Map<String, Object> output,
        String error,
        String errorType) {

    public ExecutionResult {
        Objects.requireNonNull(executionId, "executionId must not be null");
        Objects.requireNonNull(chainId, "chainId must not be null");
        Objects.requireNonNull(status, "status must not be null");
        Objects.requireNonNull(startedAt, "startedAt must not be null");
        Objects.requireNonNull(completedAt, "completedAt must not be null");
        steps = steps != null ? List.copyOf(steps) : List.of();
        output =
                output != null
                        ? Collections.unmodifiableMap(new LinkedHashMap<>(output))
                        : Map.of();
    }

    public static ExecutionResult completed(
            String executionId,
            String chainId,
            List<StepResult> steps,
            Instant startedAt,
            Instant completedAt,
            Map<String, Object> output) {
        return new ExecutionResult(
                executionId,
                chainId,
                ExecutionStatus.COMPLETED,
                steps,
                startedAt,
                completedAt,
                millisBetween(startedAt, completedAt),
                output,
                null,
                null);
    }

    public static ExecutionResult ended(
            String executionId,
            String chainId,
            ExecutionStatus status,
            List<StepResult> steps,
            Instant startedAt,
            Instant completedAt,
            String error,
            String errorType) {
        return new ExecutionResult(
                executionId,
                chainId,
                status,
                steps,
                startedAt,
                completedAt,
                millisBetween(startedAt, completedAt),
                null,
                error,
                errorType);
    }

    public boolean isSuccess() {
        return status == ExecutionStatus.COMPLETED;
    }

    private static long millisBetween(Instant start, Instant end) {
        return Math.max(0L, Duration.between(start, end).toMillis());
    }
}

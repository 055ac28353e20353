package io.catena.core.execution;

import io.catena.core.routing.RoutingTrace;
import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.Objects;

/// Recorded outcome of one step within an execution.
///
/// @param stepId step identifier, not null
/// @param status `COMPLETED`, `FAILED` or `SKIPPED` once recorded, not null
/// @param startedAt when the first attempt started (or the skip was decided), not null
/// @param completedAt when the step finished, not null
/// @param durationMs wall time between start and completion
/// @param output step output on success, null otherwise
/// @param error failure message on failure, null otherwise
/// @param errorType failure code such as `step_timeout`, null unless failed
/// @param retryCount retries performed after the first attempt
/// @param backoffDelaysMs delay applied before each retry, in order, not null
/// @param skipReason why the step was skipped, null unless skipped
/// @param routing routing decision trace, null when routing was not evaluated
public record StepResult(
        String stepId,
        StepStatus status,
        Instant startedAt,
        Instant completedAt,
        long durationMs,
        Object output,
        String error,
        String errorType,
        int retryCount,
        List<Long> backoffDelaysMs,
        String skipReason,
        RoutingTrace routing) {

    public StepResult {
        Objects.requireNonNull(stepId, "stepId must not be null");
        Objects.requireNonNull(status, "status must not be null");
        Objects.requireNonNull(startedAt, "startedAt must not be null");
        Objects.requireNonNull(completedAt, "completedAt must not be null");
        backoffDelaysMs = backoffDelaysMs != null ? List.copyOf(backoffDelaysMs) : List.of();
    }

    public static StepResult completed(
            String stepId,
            Instant startedAt,
            Instant completedAt,
            Object output,
            int retryCount,
            List<Long> backoffDelaysMs) {
        return new StepResult(
                stepId,
                StepStatus.COMPLETED,
                startedAt,
                completedAt,
                millisBetween(startedAt, completedAt),
                output,
                null,
                null,
                retryCount,
                backoffDelaysMs,
                null,
                null);
    }

    public static StepResult failed(
            String stepId,
            Instant startedAt,
            Instant completedAt,
            String error,
            String errorType,
            int retryCount,
            List<Long> backoffDelaysMs) {
        return new StepResult(
                stepId,
                StepStatus.FAILED,
                startedAt,
                completedAt,
                millisBetween(startedAt, completedAt),
                null,
                error,
                errorType,
                retryCount,
                backoffDelaysMs,
                null,
                null);
    }

    public static StepResult skipped(String stepId, Instant at, String reason) {
        return new StepResult(
                stepId,
                StepStatus.SKIPPED,
                at,
                at,
                0L,
                null,
                null,
                null,
                0,
                List.of(),
                reason,
                null);
    }

    /// Returns a copy carrying the routing trace.
    ///
    /// @param trace routing decision trace, not null
    /// @return new result, never null
    public StepResult withRouting(RoutingTrace trace) {
        return new StepResult(
                stepId,
                status,
                startedAt,
                completedAt,
                durationMs,
                output,
                error,
                errorType,
                retryCount,
                backoffDelaysMs,
                skipReason,
                trace);
    }

    public boolean isSuccess() {
        return status == StepStatus.COMPLETED;
    }

    private static long millisBetween(Instant start, Instant end) {
        return Math.max(0L, Duration.between(start, end).toMillis());
    }
}

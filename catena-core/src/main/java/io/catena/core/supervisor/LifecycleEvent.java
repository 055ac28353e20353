package io.catena.core.supervisor;

import io.catena.core.execution.ExecutionResult;
import io.catena.core.execution.ExecutionStatus;
import io.catena.core.execution.StepResult;
import io.catena.core.execution.StepStatus;
import java.time.Instant;

/// Outbound lifecycle events of top-level executions.
///
/// ### Event Types
/// - `started` - execution began or resumed
/// - `step-completed` - a step result was recorded, including skipped steps
/// - `completed` - execution ended `COMPLETED`
/// - `failed` - execution ended `FAILED`, `TIMEOUT` or `CANCELLED`
///
/// @see LifecycleEventBus
public sealed interface LifecycleEvent {

    String TYPE_STARTED = "started";
    String TYPE_STEP_COMPLETED = "step-completed";
    String TYPE_COMPLETED = "completed";
    String TYPE_FAILED = "failed";

    /// Returns the event type identifier.
    String type();

    String executionId();

    Instant timestamp();

    /// Creates the terminal event matching a result's status.
    ///
    /// @param result final execution result, not null
    /// @return `Completed` for a completed run, `Failed` otherwise
    static LifecycleEvent terminal(ExecutionResult result) {
        if (result.isSuccess()) {
            return new Completed(
                    result.executionId(),
                    result.status(),
                    result.durationMs(),
                    result.completedAt());
        }
        return new Failed(
                result.executionId(),
                result.status(),
                result.durationMs(),
                result.error(),
                result.completedAt());
    }

    record Started(String executionId, String chainId, Instant timestamp)
            implements LifecycleEvent {

        @Override
        public String type() {
            return TYPE_STARTED;
        }
    }

    record StepCompleted(
            String executionId,
            String stepId,
            StepStatus status,
            long durationMs,
            Instant timestamp)
            implements LifecycleEvent {

        static StepCompleted from(String executionId, StepResult result) {
            return new StepCompleted(
                    executionId,
                    result.stepId(),
                    result.status(),
                    result.durationMs(),
                    result.completedAt());
        }

        @Override
        public String type() {
            return TYPE_STEP_COMPLETED;
        }
    }

    record Completed(String executionId, ExecutionStatus status, long durationMs, Instant timestamp)
            implements LifecycleEvent {

        @Override
        public String type() {
            return TYPE_COMPLETED;
        }
    }

    record Failed(
            String executionId,
            ExecutionStatus status,
            long durationMs,
            String error,
            Instant timestamp)
            implements LifecycleEvent {

        @Override
        public String type() {
            return TYPE_FAILED;
        }
    }
}

package io.catena.server.streaming;

import com.fasterxml.jackson.annotation.JsonInclude;
import io.catena.core.supervisor.LifecycleEvent;
import java.time.Instant;
import java.util.Objects;

/// SSE payload describing one lifecycle event of a top-level execution.
///
/// Fields that do not apply to the event type are null and omitted from the JSON.
///
/// @param type event type: `started`, `step-completed`, `completed` or `failed`
/// @param executionId execution the event belongs to, not null
/// @param chainId chain being run, set on `started` only
/// @param stepId step that finished, set on `step-completed` only
/// @param status wire name of the step or execution status
/// @param durationMs elapsed time of the step or execution
/// @param error failure message, set on `failed` only
/// @param timestamp when the event happened, not null
@JsonInclude(JsonInclude.Include.NON_NULL)
public record ExecutionEvent(
        String type,
        String executionId,
        String chainId,
        String stepId,
        String status,
        Long durationMs,
        String error,
        Instant timestamp) {

    public ExecutionEvent {
        Objects.requireNonNull(type, "type must not be null");
        Objects.requireNonNull(executionId, "executionId must not be null");
        Objects.requireNonNull(timestamp, "timestamp must not be null");
    }

    /// Converts a core lifecycle event to its SSE form.
    ///
    /// @param event lifecycle event, not null
    /// @return SSE payload, never null
    public static ExecutionEvent from(LifecycleEvent event) {
        Objects.requireNonNull(event, "event must not be null");
        if (event instanceof LifecycleEvent.Started e) {
            return new ExecutionEvent(
                    e.type(), e.executionId(), e.chainId(), null, null, null, null, e.timestamp());
        }
        if (event instanceof LifecycleEvent.StepCompleted e) {
            return new ExecutionEvent(
                    e.type(),
                    e.executionId(),
                    null,
                    e.stepId(),
                    e.status().wireName(),
                    e.durationMs(),
                    null,
                    e.timestamp());
        }
        if (event instanceof LifecycleEvent.Completed e) {
            return new ExecutionEvent(
                    e.type(),
                    e.executionId(),
                    null,
                    null,
                    e.status().wireName(),
                    e.durationMs(),
                    null,
                    e.timestamp());
        }
        LifecycleEvent.Failed e = (LifecycleEvent.Failed) event;
        return new ExecutionEvent(
                e.type(),
                e.executionId(),
                null,
                null,
                e.status().wireName(),
                e.durationMs(),
                e.error(),
                e.timestamp());
    }

    /// Returns whether this event ends the execution's stream.
    public boolean isTerminal() {
        return LifecycleEvent.TYPE_COMPLETED.equals(type)
                || LifecycleEvent.TYPE_FAILED.equals(type);
    }
}

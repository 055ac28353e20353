package io.catena.core.checkpoint;

import io.catena.core.execution.ExecutionContext;
import io.catena.core.execution.StepResult;
import java.time.Instant;
import java.util.List;
import java.util.Objects;

/// Decrypted execution state captured after a committed step.
///
/// Resuming from a checkpoint re-enters the chain at `nextIndex` with the restored
/// context; steps before it keep their recorded results and are not run again.
///
/// @param context execution context at the time of the checkpoint, not null
/// @param nextIndex index of the next step to run, equal to the step count at the end
/// @param results step results recorded so far, in execution order, not null
/// @param status whether the execution is still resumable, not null
/// @param createdAt when the checkpoint was taken, not null
public record Checkpoint(
        ExecutionContext context,
        int nextIndex,
        List<StepResult> results,
        CheckpointStatus status,
        Instant createdAt) {

    public Checkpoint {
        Objects.requireNonNull(context, "context must not be null");
        Objects.requireNonNull(status, "status must not be null");
        Objects.requireNonNull(createdAt, "createdAt must not be null");
        if (nextIndex < 0) {
            throw new IllegalArgumentException("nextIndex must not be negative: " + nextIndex);
        }
        results = results != null ? List.copyOf(results) : List.of();
    }

    public String executionId() {
        return context.getExecutionId();
    }

    public boolean isResumable() {
        return status == CheckpointStatus.RUNNING;
    }

    /// Returns a copy with the given status.
    public Checkpoint withStatus(CheckpointStatus newStatus) {
        return new Checkpoint(context, nextIndex, results, newStatus, createdAt);
    }
}

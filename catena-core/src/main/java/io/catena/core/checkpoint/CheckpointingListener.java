package io.catena.core.checkpoint;

import io.catena.core.exception.CheckpointWriteException;
import io.catena.core.execution.ExecutionContext;
import io.catena.core.execution.ExecutionListener;
import io.catena.core.execution.ExecutionResult;
import io.catena.core.execution.ExecutionStatus;
import io.catena.core.execution.StepResult;
import java.util.List;
import java.util.Objects;
import java.util.logging.Level;
import java.util.logging.Logger;

/// Listener that persists a checkpoint after every committed step of a top-level run.
///
/// When the run ends the checkpoint is deleted, except after a cancellation: the last
/// checkpoint is then kept and marked `CANCELLED` so it stays inspectable but is not
/// resumed.
///
/// A failed checkpoint write raises {@link CheckpointWriteException}, which fails the run:
/// carrying on without a durable position would replay committed steps after a restart.
public class CheckpointingListener implements ExecutionListener {

    private static final Logger logger = Logger.getLogger(CheckpointingListener.class.getName());

    private final CheckpointManager checkpoints;

    public CheckpointingListener(CheckpointManager checkpoints) {
        this.checkpoints = Objects.requireNonNull(checkpoints, "checkpoints must not be null");
    }

    @Override
    public void onCheckpoint(ExecutionContext context, int nextIndex, List<StepResult> results) {
        if (context.getDepth() != 0) {
            return;
        }
        try {
            checkpoints.save(context, nextIndex, results);
        } catch (RuntimeException e) {
            logger.log(
                    Level.SEVERE,
                    "Checkpoint of execution " + context.getExecutionId() + " not written",
                    e);
            throw new CheckpointWriteException(context.getExecutionId(), e);
        }
    }

    @Override
    public void onExecutionCompleted(ExecutionResult result) {
        try {
            if (result.status() == ExecutionStatus.CANCELLED) {
                checkpoints.markCancelled(result.executionId());
            } else {
                checkpoints.delete(result.executionId());
            }
        } catch (RuntimeException e) {
            logger.log(
                    Level.SEVERE,
                    "Checkpoint cleanup of execution " + result.executionId() + " failed",
                    e);
        }
    }
}

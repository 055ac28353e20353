package io.catena.core.exception;

import java.io.Serial;

/// Thrown when the checkpoint of a running execution cannot be persisted.
///
/// The run fails with this error instead of carrying on without a durable position, since
/// a later restart would replay steps that already ran.
public class CheckpointWriteException extends CatenaException {

    @Serial private static final long serialVersionUID = 2871046513378220419L;

    private final String executionId;

    public CheckpointWriteException(String executionId, Throwable cause) {
        super(
                "Checkpoint for execution '" + executionId + "' could not be written: " + cause,
                cause);
        this.executionId = executionId;
    }

    public String getExecutionId() {
        return executionId;
    }

    @Override
    public String errorType() {
        return "checkpoint_write";
    }
}

package io.catena.core.exception;

import java.io.Serial;

/// Thrown when a stored checkpoint cannot be decrypted or its digest does not match.
///
/// The execution is not resumed from such a checkpoint; it is reported as needing a
/// manual restart.
public class CheckpointIntegrityException extends CatenaException {

    @Serial private static final long serialVersionUID = -8337710463920185526L;

    private final String executionId;

    public CheckpointIntegrityException(String executionId, String message) {
        super("Checkpoint for execution '" + executionId + "' is unusable: " + message);
        this.executionId = executionId;
    }

    public CheckpointIntegrityException(String executionId, String message, Throwable cause) {
        super("Checkpoint for execution '" + executionId + "' is unusable: " + message, cause);
        this.executionId = executionId;
    }

    public String getExecutionId() {
        return executionId;
    }

    @Override
    public String errorType() {
        return "checkpoint_integrity";
    }
}

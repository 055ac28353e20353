package io.catena.core.exception;

import io.catena.core.execution.ExecutionStatus;
import java.io.Serial;

/// Thrown inside a run when its cancellation token fires or its chain deadline passes.
///
/// Never recorded as a step failure: the runner turns it into a `CANCELLED` or
/// `TIMEOUT` execution result.
public class ExecutionAbortedException extends CatenaException {

    @Serial private static final long serialVersionUID = 5009871312251190842L;

    private final ExecutionStatus status;

    public ExecutionAbortedException(ExecutionStatus status, String message) {
        super(message);
        this.status = status;
    }

    /// Returns the terminal status the run ends with.
    ///
    /// @return `CANCELLED` or `TIMEOUT`, never null
    public ExecutionStatus getStatus() {
        return status;
    }

    @Override
    public String errorType() {
        return status.wireName();
    }
}

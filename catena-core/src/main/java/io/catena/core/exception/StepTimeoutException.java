package io.catena.core.exception;

import java.io.Serial;
import java.time.Duration;

/// Thrown when a single step attempt outlives its timeout.
public class StepTimeoutException extends CatenaException {

    @Serial private static final long serialVersionUID = 7716392610948271164L;

    public StepTimeoutException(String stepId, Duration timeout) {
        super("Step '" + stepId + "' timed out after " + timeout.toMillis() + "ms");
    }

    @Override
    public String errorType() {
        return "step_timeout";
    }

    @Override
    public boolean isRetryable() {
        return true;
    }
}

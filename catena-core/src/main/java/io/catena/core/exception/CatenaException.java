package io.catena.core.exception;

import java.io.Serial;

/// Base type of every failure the engine classifies.
///
/// Each subtype carries a stable error-type code that is recorded on failed step and
/// execution results, and declares whether the retry controller may attempt the
/// failing operation again.
///
/// | Type | Code | Retryable |
/// |---|---|---|
/// | {@link ValidationException} | `validation` | no |
/// | {@link StepTimeoutException} | `step_timeout` | yes |
/// | {@link CircuitOpenException} | `circuit_open` | yes |
/// | {@link ExternalCallException} | `external_call` | yes |
/// | {@link MaxRecursionDepthExceededException} | `max_recursion_depth` | no |
/// | {@link ChainNotFoundException} | `chain_not_found` | no |
/// | {@link CheckpointIntegrityException} | `checkpoint_integrity` | no |
/// | {@link CheckpointWriteException} | `checkpoint_write` | no |
public abstract class CatenaException extends RuntimeException {

    @Serial private static final long serialVersionUID = 4410712262945502718L;

    protected CatenaException(String message) {
        super(message);
    }

    protected CatenaException(String message, Throwable cause) {
        super(message, cause);
    }

    /// Returns the stable code identifying this failure class.
    ///
    /// @return error type code, never null
    public abstract String errorType();

    /// Returns whether the retry controller may attempt the operation again.
    ///
    /// @return `true` for transient failures
    public boolean isRetryable() {
        return false;
    }
}

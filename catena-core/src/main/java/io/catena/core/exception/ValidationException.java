package io.catena.core.exception;

import java.io.Serial;

/// Thrown when a chain, step, routing rule or identifier is malformed.
///
/// Raised before any execution starts and never retried.
public class ValidationException extends CatenaException {

    @Serial private static final long serialVersionUID = -2194830271153024017L;

    public ValidationException(String message) {
        super(message);
    }

    @Override
    public String errorType() {
        return "validation";
    }
}

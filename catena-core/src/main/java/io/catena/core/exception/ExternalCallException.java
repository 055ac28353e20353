package io.catena.core.exception;

import java.io.Serial;

/// Thrown when an external collaborator reports failure or throws while serving a step.
public class ExternalCallException extends CatenaException {

    @Serial private static final long serialVersionUID = 1870665923390716643L;

    public ExternalCallException(String message) {
        super(message);
    }

    public ExternalCallException(String message, Throwable cause) {
        super(message, cause);
    }

    @Override
    public String errorType() {
        return "external_call";
    }

    @Override
    public boolean isRetryable() {
        return true;
    }
}

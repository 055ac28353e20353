package io.catena.core.exception;

import java.io.Serial;

/// Thrown instead of calling a dependency whose circuit breaker rejects calls.
public class CircuitOpenException extends CatenaException {

    @Serial private static final long serialVersionUID = -3390215887441726521L;

    private final String dependencyKey;

    public CircuitOpenException(String dependencyKey) {
        super("Circuit breaker is open for dependency '" + dependencyKey + "'");
        this.dependencyKey = dependencyKey;
    }

    public String getDependencyKey() {
        return dependencyKey;
    }

    @Override
    public String errorType() {
        return "circuit_open";
    }

    @Override
    public boolean isRetryable() {
        return true;
    }
}

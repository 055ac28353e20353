package io.catena.core.breaker;

/// State of a circuit breaker.
public enum CircuitState {
    /// Calls pass; consecutive failures are counted.
    CLOSED("closed"),
    /// Calls are rejected until the cool-down elapses.
    OPEN("open"),
    /// A limited number of probe calls test whether the dependency recovered.
    HALF_OPEN("half_open");

    private final String wireName;

    CircuitState(String wireName) {
        this.wireName = wireName;
    }

    public String wireName() {
        return wireName;
    }
}

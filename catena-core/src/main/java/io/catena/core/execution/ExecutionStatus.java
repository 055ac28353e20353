package io.catena.core.execution;

/// Lifecycle state of one execution.
///
/// `PENDING → RUNNING → {COMPLETED, FAILED, CANCELLED, TIMEOUT}`
public enum ExecutionStatus {
    PENDING("pending"),
    RUNNING("running"),
    COMPLETED("completed"),
    FAILED("failed"),
    CANCELLED("cancelled"),
    TIMEOUT("timeout");

    private final String wireName;

    ExecutionStatus(String wireName) {
        this.wireName = wireName;
    }

    public String wireName() {
        return wireName;
    }

    public boolean isTerminal() {
        return this != PENDING && this != RUNNING;
    }
}

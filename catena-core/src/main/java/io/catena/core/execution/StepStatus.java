package io.catena.core.execution;

/// State of a single step within an execution.
///
/// `RUNNING` and `RETRYING` are only observed through listener callbacks; recorded
/// results are `COMPLETED`, `FAILED` or `SKIPPED`.
public enum StepStatus {
    PENDING("pending"),
    RUNNING("running"),
    RETRYING("retrying"),
    COMPLETED("completed"),
    FAILED("failed"),
    SKIPPED("skipped");

    private final String wireName;

    StepStatus(String wireName) {
        this.wireName = wireName;
    }

    public String wireName() {
        return wireName;
    }
}

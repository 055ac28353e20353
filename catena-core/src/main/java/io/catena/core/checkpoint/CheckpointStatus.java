package io.catena.core.checkpoint;

/// Lifecycle marker stored with a checkpoint.
///
/// Recovery re-enters `RUNNING` checkpoints only. A `CANCELLED` checkpoint is kept for
/// inspection after a force-cancel and is never resumed automatically.
public enum CheckpointStatus {
    RUNNING("running"),
    CANCELLED("cancelled");

    private final String wireName;

    CheckpointStatus(String wireName) {
        this.wireName = wireName;
    }

    public String wireName() {
        return wireName;
    }

    /// Parses a wire name.
    ///
    /// @param value wire name, not null
    /// @return matching status, never null
    /// @throws IllegalArgumentException if the name is unknown
    public static CheckpointStatus fromWireName(String value) {
        for (CheckpointStatus status : values()) {
            if (status.wireName.equals(value)) {
                return status;
            }
        }
        throw new IllegalArgumentException("Unknown checkpoint status: " + value);
    }
}

package io.catena.core.checkpoint;

import java.util.List;
import java.util.Optional;

/// Storage for encrypted checkpoint records, one per execution.
///
/// Implementations only move opaque records around; encryption and integrity checks
/// belong to {@link CheckpointManager}. Execution ids reaching a store have already
/// passed allow-list sanitization.
///
/// @see InMemoryCheckpointStore
/// @see FileCheckpointStore
public interface CheckpointStore {

    /// Writes a record, replacing any earlier record for the same execution.
    ///
    /// @param record record to persist, not null
    void save(CheckpointRecord record);

    /// Reads the record of an execution.
    ///
    /// @param executionId sanitized execution id, not null
    /// @return the record, empty if none exists
    Optional<CheckpointRecord> find(String executionId);

    /// Lists the execution ids that have a record.
    ///
    /// @return ids in no particular order, never null
    List<String> list();

    /// Removes the record of an execution. Idempotent.
    ///
    /// @param executionId sanitized execution id, not null
    /// @return true if a record was removed
    boolean delete(String executionId);
}

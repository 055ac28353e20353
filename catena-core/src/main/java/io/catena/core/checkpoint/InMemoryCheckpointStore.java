package io.catena.core.checkpoint;

import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;

/// In-memory checkpoint store (default implementation).
///
/// Thread-safe. Records do not survive a restart, so recovery only sees executions of
/// the current process.
public final class InMemoryCheckpointStore implements CheckpointStore {

    private final Map<String, CheckpointRecord> records = new ConcurrentHashMap<>();

    @Override
    public void save(CheckpointRecord record) {
        Objects.requireNonNull(record, "record must not be null");
        records.put(record.executionId(), record);
    }

    @Override
    public Optional<CheckpointRecord> find(String executionId) {
        Objects.requireNonNull(executionId, "executionId must not be null");
        return Optional.ofNullable(records.get(executionId));
    }

    @Override
    public List<String> list() {
        return List.copyOf(records.keySet());
    }

    @Override
    public boolean delete(String executionId) {
        Objects.requireNonNull(executionId, "executionId must not be null");
        return records.remove(executionId) != null;
    }
}

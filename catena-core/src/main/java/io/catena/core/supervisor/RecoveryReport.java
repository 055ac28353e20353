package io.catena.core.supervisor;

import java.util.List;
import java.util.Map;

/// Outcome of re-entering checkpointed executions at startup.
///
/// @param resumed ids re-submitted from their checkpoints
/// @param skipped ids whose checkpoints were kept after a cancellation
/// @param needsManualRestart ids that could not be resumed, with the reason
public record RecoveryReport(
        List<String> resumed, List<String> skipped, Map<String, String> needsManualRestart) {

    public RecoveryReport {
        resumed = List.copyOf(resumed);
        skipped = List.copyOf(skipped);
        needsManualRestart = Map.copyOf(needsManualRestart);
    }

    public boolean isClean() {
        return needsManualRestart.isEmpty();
    }
}

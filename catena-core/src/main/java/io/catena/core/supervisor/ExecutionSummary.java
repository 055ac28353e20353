package io.catena.core.supervisor;

import io.catena.core.execution.ExecutionStatus;
import java.time.Instant;

/// Point-in-time view of a queued or running execution.
///
/// @param executionId execution id, not null
/// @param chainId chain being run, not null
/// @param triggerId chain instance, not null
/// @param status `PENDING` while queued, `RUNNING` once a worker picked it up
/// @param submittedAt when the request was accepted, not null
/// @param startedAt when a worker started it, null while queued
/// @param currentStepId step currently running, null between steps
/// @param completedSteps number of step results recorded so far
/// @param resumed whether the execution was re-entered from a checkpoint
public record ExecutionSummary(
        String executionId,
        String chainId,
        String triggerId,
        ExecutionStatus status,
        Instant submittedAt,
        Instant startedAt,
        String currentStepId,
        int completedSteps,
        boolean resumed) {}

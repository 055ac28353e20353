package io.catena.core.breaker;

import java.time.Instant;

/// Point-in-time view of one breaker, for the admin surface.
///
/// @param dependencyKey dependency the breaker guards, not null
/// @param state current state, not null
/// @param failureCount consecutive failures while closed
/// @param lastFailureAt time of the most recent failure, null if none
/// @param halfOpenSuccesses consecutive successful probes while half-open
/// @param openedAt when the breaker last opened, null if it never did
public record CircuitBreakerSnapshot(
        String dependencyKey,
        CircuitState state,
        int failureCount,
        Instant lastFailureAt,
        int halfOpenSuccesses,
        Instant openedAt) {}

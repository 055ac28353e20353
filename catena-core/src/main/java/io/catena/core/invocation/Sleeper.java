package io.catena.core.invocation;

import io.catena.core.execution.CancellationToken;
import java.time.Duration;

/// Waits out retry back-off delays.
///
/// Injected so tests can record delays instead of sleeping.
@FunctionalInterface
public interface Sleeper {

    /// Waits for the given duration or until the token is cancelled.
    ///
    /// @param duration time to wait, not null
    /// @param token cancellation token of the execution, not null
    /// @return true if the wait ended because the token was cancelled
    /// @throws InterruptedException if the waiting thread is interrupted
    boolean sleep(Duration duration, CancellationToken token) throws InterruptedException;

    /// Sleeper that blocks on the cancellation token.
    Sleeper SYSTEM = (duration, token) -> token.await(duration);
}

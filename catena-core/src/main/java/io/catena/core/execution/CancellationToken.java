package io.catena.core.execution;

import java.time.Duration;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;

/// Execution-level cancellation signal.
///
/// Cancelling completes an internal future, so every wait the engine performs (step
/// calls, retry back-off) can race against it and return promptly. The first reason
/// passed to {@link #cancel(String)} wins.
///
/// @implNote Thread-safe. Typically cancelled from an admin thread while a worker waits.
public final class CancellationToken {

    private final CompletableFuture<String> signal = new CompletableFuture<>();

    /// Requests cancellation.
    ///
    /// @param reason human-readable reason, not null
    /// @return true if this call cancelled the token, false if it was already cancelled
    public boolean cancel(String reason) {
        return signal.complete(reason);
    }

    public boolean isCancelled() {
        return signal.isDone();
    }

    /// Returns the reason passed to the first {@link #cancel(String)} call.
    ///
    /// @return reason, or null while not cancelled
    public String reason() {
        return signal.getNow(null);
    }

    /// Returns a future that completes with the reason when the token is cancelled.
    ///
    /// @return cancellation future, never null
    public CompletableFuture<String> asFuture() {
        return signal;
    }

    /// Blocks until the token is cancelled or the duration elapses.
    ///
    /// @param duration maximum time to wait, not null
    /// @return true if the token was cancelled
    /// @throws InterruptedException if the waiting thread is interrupted
    public boolean await(Duration duration) throws InterruptedException {
        if (duration.isNegative() || duration.isZero()) {
            return isCancelled();
        }
        try {
            signal.get(duration.toMillis(), TimeUnit.MILLISECONDS);
            return true;
        } catch (TimeoutException e) {
            return false;
        } catch (ExecutionException e) {
            throw new IllegalStateException("Cancellation signal completed exceptionally", e);
        }
    }
}

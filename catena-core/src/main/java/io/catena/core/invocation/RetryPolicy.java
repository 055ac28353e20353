package io.catena.core.invocation;

import java.time.Duration;
import java.util.Objects;

/// Bounded exponential back-off for one step.
///
/// The delay before retry `n` (1-based) is `baseDelay * 2^(n-1)`, capped at `maxDelay`.
///
/// @param maxRetries retries allowed after the first attempt, zero or more
/// @param baseDelay delay before the first retry, not null
/// @param maxDelay upper bound of any single delay, not null
public record RetryPolicy(int maxRetries, Duration baseDelay, Duration maxDelay) {

    public RetryPolicy {
        Objects.requireNonNull(baseDelay, "baseDelay must not be null");
        Objects.requireNonNull(maxDelay, "maxDelay must not be null");
        if (maxRetries < 0) {
            throw new IllegalArgumentException("maxRetries must not be negative");
        }
    }

    /// Returns the delay before a retry.
    ///
    /// @param retryNumber 1 for the first retry
    /// @return back-off delay, never longer than `maxDelay`
    public Duration delayBeforeRetry(int retryNumber) {
        if (retryNumber < 1) {
            throw new IllegalArgumentException("retryNumber starts at 1");
        }
        long base = baseDelay.toMillis();
        int shift = retryNumber - 1;
        long cap = maxDelay.toMillis();
        if (shift >= 62 || base > (cap >> shift)) {
            return maxDelay;
        }
        return Duration.ofMillis(Math.min(base << shift, cap));
    }
}

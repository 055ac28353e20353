package io.catena.core.execution;

import io.catena.core.exception.ExecutionAbortedException;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.Objects;

/// Cancellation token plus chain deadline governing one run.
///
/// Nested chain runs derive a control with the same token and the earlier of the two
/// deadlines, so cancelling or timing out the parent also stops the child.
///
/// @param token cancellation signal shared with the supervisor, not null
/// @param deadline instant after which the run ends with `TIMEOUT`, not null
/// @param clock time source, not null
public record ExecutionControl(CancellationToken token, Instant deadline, Clock clock) {

    public ExecutionControl {
        Objects.requireNonNull(token, "token must not be null");
        Objects.requireNonNull(deadline, "deadline must not be null");
        Objects.requireNonNull(clock, "clock must not be null");
    }

    public static ExecutionControl start(CancellationToken token, Duration timeout, Clock clock) {
        return new ExecutionControl(token, clock.instant().plus(timeout), clock);
    }

    /// Derives the control for a nested run.
    ///
    /// @param timeout the nested chain's own timeout, not null
    /// @return control sharing this token, bounded by both deadlines
    public ExecutionControl nested(Duration timeout) {
        Instant own = clock.instant().plus(timeout);
        return new ExecutionControl(token, own.isBefore(deadline) ? own : deadline, clock);
    }

    /// Returns the time left before the deadline.
    ///
    /// @return remaining time, zero once the deadline has passed
    public Duration remaining() {
        Duration left = Duration.between(clock.instant(), deadline);
        return left.isNegative() ? Duration.ZERO : left;
    }

    public boolean isExpired() {
        return !clock.instant().isBefore(deadline);
    }

    /// Throws if the run must stop: cancellation first, then deadline.
    ///
    /// @throws ExecutionAbortedException with `CANCELLED` or `TIMEOUT`
    public void checkActive() {
        if (token.isCancelled()) {
            throw new ExecutionAbortedException(
                    ExecutionStatus.CANCELLED, "Execution cancelled: " + token.reason());
        }
        if (isExpired()) {
            throw new ExecutionAbortedException(
                    ExecutionStatus.TIMEOUT, "Execution exceeded its chain timeout");
        }
    }
}

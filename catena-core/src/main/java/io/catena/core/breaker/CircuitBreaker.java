package io.catena.core.breaker;

import java.time.Clock;
import java.time.Instant;
import java.util.concurrent.locks.ReentrantLock;
import java.util.logging.Logger;

/// Failure guard for a single dependency.
///
/// ### State machine
/// - `CLOSED`: calls pass. `failureThreshold` consecutive failures open the breaker;
///   a success resets the count.
/// - `OPEN`: calls are rejected. Once `coolDown` has elapsed since opening, the next
///   {@link #tryAcquire()} moves to `HALF_OPEN` and admits exactly one probe.
/// - `HALF_OPEN`: one probe at a time. A failed probe reopens the breaker; a successful
///   one counts towards `halfOpenProbes`, after which the breaker closes.
///
/// Callers must pair every granted {@link #tryAcquire()} with exactly one
/// {@link #recordSuccess()}, {@link #recordFailure()} or {@link #abandon()}.
///
/// @implNote Thread-safe. Each breaker has its own lock, so executions calling different
/// dependencies never contend.
public final class CircuitBreaker {

    private static final Logger logger = Logger.getLogger(CircuitBreaker.class.getName());

    private final String dependencyKey;
    private final CircuitBreakerConfig config;
    private final Clock clock;
    private final ReentrantLock lock = new ReentrantLock();

    private CircuitState state = CircuitState.CLOSED;
    private int failureCount;
    private Instant lastFailureAt;
    private Instant openedAt;
    private int halfOpenSuccesses;
    private boolean probeInFlight;

    CircuitBreaker(String dependencyKey, CircuitBreakerConfig config, Clock clock) {
        this.dependencyKey = dependencyKey;
        this.config = config;
        this.clock = clock;
    }

    public String getDependencyKey() {
        return dependencyKey;
    }

    /// Asks permission for one call.
    ///
    /// @return true if the call may proceed, false if it must be rejected
    public boolean tryAcquire() {
        lock.lock();
        try {
            if (state == CircuitState.CLOSED) {
                return true;
            }
            if (state == CircuitState.OPEN) {
                if (clock.instant().isBefore(openedAt.plus(config.coolDown()))) {
                    return false;
                }
                transition(CircuitState.HALF_OPEN);
                halfOpenSuccesses = 0;
            } else if (probeInFlight) {
                return false;
            }
            probeInFlight = true;
            return true;
        } finally {
            lock.unlock();
        }
    }

    /// Reports a successful call.
    public void recordSuccess() {
        lock.lock();
        try {
            if (state == CircuitState.HALF_OPEN) {
                probeInFlight = false;
                halfOpenSuccesses++;
                if (halfOpenSuccesses >= config.halfOpenProbes()) {
                    transition(CircuitState.CLOSED);
                    failureCount = 0;
                    halfOpenSuccesses = 0;
                }
            } else if (state == CircuitState.CLOSED) {
                failureCount = 0;
            }
        } finally {
            lock.unlock();
        }
    }

    /// Reports a failed call.
    public void recordFailure() {
        lock.lock();
        try {
            lastFailureAt = clock.instant();
            if (state == CircuitState.HALF_OPEN) {
                probeInFlight = false;
                open();
            } else if (state == CircuitState.CLOSED) {
                failureCount++;
                if (failureCount >= config.failureThreshold()) {
                    open();
                }
            }
        } finally {
            lock.unlock();
        }
    }

    /// Releases a granted call whose outcome is unknown because the execution was
    /// cancelled mid-call. Counts neither as success nor as failure.
    public void abandon() {
        lock.lock();
        try {
            if (state == CircuitState.HALF_OPEN) {
                probeInFlight = false;
            }
        } finally {
            lock.unlock();
        }
    }

    /// Forces the breaker back to `CLOSED` with cleared counters.
    public void reset() {
        lock.lock();
        try {
            transition(CircuitState.CLOSED);
            failureCount = 0;
            halfOpenSuccesses = 0;
            probeInFlight = false;
        } finally {
            lock.unlock();
        }
    }

    public CircuitState getState() {
        lock.lock();
        try {
            return state;
        } finally {
            lock.unlock();
        }
    }

    public CircuitBreakerSnapshot snapshot() {
        lock.lock();
        try {
            return new CircuitBreakerSnapshot(
                    dependencyKey, state, failureCount, lastFailureAt, halfOpenSuccesses, openedAt);
        } finally {
            lock.unlock();
        }
    }

    private void open() {
        transition(CircuitState.OPEN);
        openedAt = clock.instant();
        halfOpenSuccesses = 0;
    }

    private void transition(CircuitState next) {
        if (state != next) {
            logger.warning(
                    "Circuit breaker '"
                            + dependencyKey
                            + "' "
                            + state.wireName()
                            + " -> "
                            + next.wireName());
            state = next;
        }
    }
}

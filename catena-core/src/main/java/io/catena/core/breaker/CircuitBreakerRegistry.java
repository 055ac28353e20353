package io.catena.core.breaker;

import java.time.Clock;
import java.util.Comparator;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;

/// Per-dependency circuit breakers shared by all executions of one engine.
///
/// Breakers are created lazily on first use of a dependency key and live as long as the
/// registry. The registry is an ordinary injected object; tests and separate engines
/// each get their own.
///
/// ### Usage
/// {@snippet :
/// CircuitBreakerRegistry registry = new CircuitBreakerRegistry(CircuitBreakerConfig.DEFAULT);
/// CircuitBreaker breaker = registry.forKey("github");
/// if (breaker.tryAcquire()) {
///     // call, then breaker.recordSuccess() or breaker.recordFailure()
/// }
/// }
///
/// @implNote Thread-safe. Lookup uses a ConcurrentHashMap; state changes lock only the
/// affected breaker.
public class CircuitBreakerRegistry {

    private final CircuitBreakerConfig config;
    private final Clock clock;
    private final Map<String, CircuitBreaker> breakers = new ConcurrentHashMap<>();

    public CircuitBreakerRegistry(CircuitBreakerConfig config) {
        this(config, Clock.systemUTC());
    }

    public CircuitBreakerRegistry(CircuitBreakerConfig config, Clock clock) {
        this.config = Objects.requireNonNull(config, "config must not be null");
        this.clock = Objects.requireNonNull(clock, "clock must not be null");
    }

    /// Returns the breaker for a dependency, creating it on first use.
    ///
    /// @param dependencyKey dependency identifier, not null
    /// @return the breaker, never null
    public CircuitBreaker forKey(String dependencyKey) {
        Objects.requireNonNull(dependencyKey, "dependencyKey must not be null");
        return breakers.computeIfAbsent(
                dependencyKey, key -> new CircuitBreaker(key, config, clock));
    }

    /// Returns the state of an existing breaker without creating one.
    ///
    /// @param dependencyKey dependency identifier, not null
    /// @return snapshot, or empty if the dependency was never called
    public Optional<CircuitBreakerSnapshot> inspect(String dependencyKey) {
        Objects.requireNonNull(dependencyKey, "dependencyKey must not be null");
        return Optional.ofNullable(breakers.get(dependencyKey)).map(CircuitBreaker::snapshot);
    }

    /// Returns snapshots of every breaker, ordered by dependency key.
    ///
    /// @return snapshots, never null (may be empty)
    public List<CircuitBreakerSnapshot> snapshots() {
        return breakers.values().stream()
                .map(CircuitBreaker::snapshot)
                .sorted(Comparator.comparing(CircuitBreakerSnapshot::dependencyKey))
                .toList();
    }

    /// Resets an existing breaker to `CLOSED`.
    ///
    /// @param dependencyKey dependency identifier, not null
    /// @return true if the breaker existed
    public boolean reset(String dependencyKey) {
        CircuitBreaker breaker = breakers.get(dependencyKey);
        if (breaker == null) {
            return false;
        }
        breaker.reset();
        return true;
    }

    public CircuitBreakerConfig getConfig() {
        return config;
    }
}

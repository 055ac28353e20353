package io.catena.core.breaker;

import java.time.Duration;
import java.util.Objects;

/// Thresholds shared by every breaker in a registry.
///
/// @param failureThreshold consecutive failures that open a closed breaker, positive
/// @param coolDown time an open breaker rejects calls before allowing a probe, not null
/// @param halfOpenProbes successful probes needed to close again, positive
public record CircuitBreakerConfig(int failureThreshold, Duration coolDown, int halfOpenProbes) {

    public static final CircuitBreakerConfig DEFAULT =
            new CircuitBreakerConfig(5, Duration.ofSeconds(60), 1);

    public CircuitBreakerConfig {
        Objects.requireNonNull(coolDown, "coolDown must not be null");
        if (failureThreshold < 1) {
            throw new IllegalArgumentException("failureThreshold must be positive");
        }
        if (halfOpenProbes < 1) {
            throw new IllegalArgumentException("halfOpenProbes must be positive");
        }
        if (coolDown.isNegative()) {
            throw new IllegalArgumentException("coolDown must not be negative");
        }
    }
}

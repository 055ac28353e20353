package io.catena.core.breaker;

import static org.assertj.core.api.Assertions.assertThat;

import io.catena.core.testing.MutableClock;
import java.time.Duration;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

class CircuitBreakerTest {

    private MutableClock clock;
    private CircuitBreakerRegistry registry;
    private CircuitBreaker breaker;

    @BeforeEach
    void setUp() {
        clock = MutableClock.startingAt("2026-01-01T00:00:00Z");
        registry =
                new CircuitBreakerRegistry(
                        new CircuitBreakerConfig(3, Duration.ofSeconds(60), 1), clock);
        breaker = registry.forKey("payments");
    }

    @Test
    void shouldOpenAfterThresholdConsecutiveFailures() {
        // Given
        failTimes(3);

        // Then
        assertThat(breaker.getState()).isEqualTo(CircuitState.OPEN);
        assertThat(breaker.tryAcquire()).isFalse();
    }

    @Test
    void shouldResetFailureCountOnSuccess() {
        failTimes(2);
        breaker.tryAcquire();
        breaker.recordSuccess();
        failTimes(2);

        assertThat(breaker.getState()).isEqualTo(CircuitState.CLOSED);
        assertThat(breaker.snapshot().failureCount()).isEqualTo(2);
    }

    @Nested
    class HalfOpen {

        @BeforeEach
        void open() {
            failTimes(3);
        }

        @Test
        void shouldAdmitExactlyOneProbeAfterCoolDown() {
            // Given
            clock.advance(Duration.ofSeconds(59));
            assertThat(breaker.tryAcquire()).isFalse();

            // When
            clock.advance(Duration.ofSeconds(1));

            // Then
            assertThat(breaker.tryAcquire()).isTrue();
            assertThat(breaker.getState()).isEqualTo(CircuitState.HALF_OPEN);
            assertThat(breaker.tryAcquire()).isFalse();
        }

        @Test
        void shouldCloseAfterSuccessfulProbe() {
            clock.advance(Duration.ofSeconds(60));
            breaker.tryAcquire();

            breaker.recordSuccess();

            assertThat(breaker.getState()).isEqualTo(CircuitState.CLOSED);
            assertThat(breaker.tryAcquire()).isTrue();
        }

        @Test
        void shouldReopenAfterFailedProbe() {
            clock.advance(Duration.ofSeconds(60));
            breaker.tryAcquire();

            breaker.recordFailure();

            assertThat(breaker.getState()).isEqualTo(CircuitState.OPEN);
            assertThat(breaker.snapshot().openedAt()).isEqualTo(clock.instant());
            assertThat(breaker.tryAcquire()).isFalse();
        }

        @Test
        void shouldReleaseProbeWhenAbandoned() {
            clock.advance(Duration.ofSeconds(60));
            breaker.tryAcquire();

            breaker.abandon();

            assertThat(breaker.getState()).isEqualTo(CircuitState.HALF_OPEN);
            assertThat(breaker.tryAcquire()).isTrue();
        }
    }

    @Test
    void shouldExposeSnapshotsAndResetThroughRegistry() {
        failTimes(3);
        registry.forKey("inventory");

        assertThat(registry.snapshots())
                .extracting(CircuitBreakerSnapshot::dependencyKey)
                .containsExactly("inventory", "payments");
        assertThat(registry.inspect("payments"))
                .get()
                .extracting(CircuitBreakerSnapshot::state)
                .isEqualTo(CircuitState.OPEN);

        assertThat(registry.reset("payments")).isTrue();
        assertThat(breaker.getState()).isEqualTo(CircuitState.CLOSED);
        assertThat(registry.reset("unknown")).isFalse();
        assertThat(registry.inspect("unknown")).isEmpty();
    }

    private void failTimes(int times) {
        for (int i = 0; i < times; i++) {
            if (breaker.tryAcquire()) {
                breaker.recordFailure();
            }
        }
    }
}

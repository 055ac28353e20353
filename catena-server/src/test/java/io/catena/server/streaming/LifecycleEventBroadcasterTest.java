package io.catena.server.streaming;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatCode;

import io.catena.core.execution.ExecutionStatus;
import io.catena.core.execution.StepStatus;
import io.catena.core.supervisor.LifecycleEvent;
import io.smallrye.mutiny.helpers.test.AssertSubscriber;
import java.time.Instant;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

class LifecycleEventBroadcasterTest {

    private static final Instant NOW = Instant.parse("2026-03-01T10:00:00Z");

    private LifecycleEventBroadcaster broadcaster;

    @BeforeEach
    void setUp() {
        broadcaster = new LifecycleEventBroadcaster();
    }

    private static LifecycleEvent started(String executionId) {
        return new LifecycleEvent.Started(executionId, "orders", NOW);
    }

    private static LifecycleEvent stepCompleted(String executionId) {
        return new LifecycleEvent.StepCompleted(
                executionId, "fetch", StepStatus.COMPLETED, 12, NOW);
    }

    private static LifecycleEvent completed(String executionId) {
        return new LifecycleEvent.Completed(executionId, ExecutionStatus.COMPLETED, 40, NOW);
    }

    @Nested
    class Subscribe {

        @Test
        void shouldCreateSubscriptionForExecution() {
            broadcaster.subscribe("exec-1");

            assertThat(broadcaster.hasSubscribers("exec-1")).isTrue();
        }

        @Test
        void shouldReuseExistingProcessorForSameExecutionId() {
            broadcaster.subscribe("exec-1");
            broadcaster.subscribe("exec-1");

            assertThat(broadcaster.activeSubscriptionCount()).isEqualTo(1);
        }
    }

    @Nested
    class Publish {

        @Test
        void shouldDeliverEventsOfFollowedExecutionInOrder() {
            AssertSubscriber<ExecutionEvent> subscriber =
                    broadcaster
                            .subscribe("exec-1")
                            .subscribe()
                            .withSubscriber(AssertSubscriber.create(10));

            broadcaster.onEvent(started("exec-1"));
            broadcaster.onEvent(stepCompleted("exec-1"));

            subscriber.awaitItems(2);
            assertThat(subscriber.getItems())
                    .extracting(ExecutionEvent::type)
                    .containsExactly("started", "step-completed");
        }

        @Test
        void shouldNotRouteEventsOfOtherExecutions() {
            AssertSubscriber<ExecutionEvent> subscriber =
                    broadcaster
                            .subscribe("exec-1")
                            .subscribe()
                            .withSubscriber(AssertSubscriber.create(10));

            broadcaster.onEvent(started("exec-2"));
            broadcaster.onEvent(started("exec-1"));

            subscriber.awaitItems(1);
            assertThat(subscriber.getItems()).hasSize(1);
            assertThat(subscriber.getItems().get(0).executionId()).isEqualTo("exec-1");
        }

        @Test
        void shouldNotFailWhenNoSubscribers() {
            assertThatCode(() -> broadcaster.onEvent(started("exec-1")))
                    .doesNotThrowAnyException();
            assertThat(broadcaster.hasSubscribers("exec-1")).isFalse();
        }

        @Test
        void shouldDeliverEveryExecutionToGlobalSubscribers() {
            AssertSubscriber<ExecutionEvent> subscriber =
                    broadcaster
                            .subscribeAll()
                            .subscribe()
                            .withSubscriber(AssertSubscriber.create(10));

            broadcaster.onEvent(started("exec-1"));
            broadcaster.onEvent(started("exec-2"));
            broadcaster.onEvent(completed("exec-1"));

            subscriber.awaitItems(3);
            assertThat(subscriber.getItems())
                    .extracting(ExecutionEvent::executionId)
                    .containsExactly("exec-1", "exec-2", "exec-1");
            subscriber.assertNotTerminated();
        }
    }

    @Nested
    class Complete {

        @Test
        void shouldCompleteStreamAfterTerminalEvent() {
            AssertSubscriber<ExecutionEvent> subscriber =
                    broadcaster
                            .subscribe("exec-1")
                            .subscribe()
                            .withSubscriber(AssertSubscriber.create(10));

            broadcaster.onEvent(started("exec-1"));
            broadcaster.onEvent(completed("exec-1"));

            subscriber.awaitCompletion();
            assertThat(subscriber.getItems())
                    .extracting(ExecutionEvent::type)
                    .containsExactly("started", "completed");
            assertThat(broadcaster.hasSubscribers("exec-1")).isFalse();
        }

        @Test
        void shouldCompleteEveryStreamOnShutdown() {
            AssertSubscriber<ExecutionEvent> one =
                    broadcaster
                            .subscribe("exec-1")
                            .subscribe()
                            .withSubscriber(AssertSubscriber.create(10));
            AssertSubscriber<ExecutionEvent> all =
                    broadcaster
                            .subscribeAll()
                            .subscribe()
                            .withSubscriber(AssertSubscriber.create(10));

            broadcaster.completeAll();

            one.awaitCompletion();
            all.awaitCompletion();
            assertThat(broadcaster.activeSubscriptionCount()).isZero();
        }
    }
}

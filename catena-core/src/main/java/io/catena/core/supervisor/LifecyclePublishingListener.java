package io.catena.core.supervisor;

import io.catena.core.chain.ChainDefinition;
import io.catena.core.execution.ExecutionContext;
import io.catena.core.execution.ExecutionListener;
import io.catena.core.execution.ExecutionResult;
import io.catena.core.execution.StepResult;
import java.time.Clock;
import java.util.Objects;

/// Translates runner callbacks of top-level runs into lifecycle events on the bus.
public class LifecyclePublishingListener implements ExecutionListener {

    private final LifecycleEventBus bus;
    private final Clock clock;

    public LifecyclePublishingListener(LifecycleEventBus bus, Clock clock) {
        this.bus = Objects.requireNonNull(bus, "bus must not be null");
        this.clock = Objects.requireNonNull(clock, "clock must not be null");
    }

    @Override
    public void onExecutionStarted(
            ExecutionContext context, ChainDefinition chain, int startIndex) {
        bus.publish(
                new LifecycleEvent.Started(
                        context.getExecutionId(), chain.getId(), clock.instant()));
    }

    @Override
    public void onStepCompleted(ExecutionContext context, StepResult result) {
        if (context.getDepth() == 0) {
            bus.publish(LifecycleEvent.StepCompleted.from(context.getExecutionId(), result));
        }
    }

    @Override
    public void onExecutionCompleted(ExecutionResult result) {
        bus.publish(LifecycleEvent.terminal(result));
    }
}

package io.catena.core;

import io.catena.core.breaker.CircuitBreakerRegistry;
import io.catena.core.chain.ChainRegistry;
import io.catena.core.checkpoint.CheckpointManager;
import io.catena.core.execution.ChainRunner;
import io.catena.core.supervisor.ExecutionSupervisor;
import io.catena.core.supervisor.LifecycleEventBus;
import java.util.concurrent.ExecutorService;

/// Container holding the wired engine components.
///
/// Implements {@link AutoCloseable} to stop the worker pool, the step call pool and
/// the lifecycle event dispatcher.
///
/// ### Contracts
/// - **Postcondition**: all getters return the instances passed to the constructor
/// - **Invariant**: component references are immutable after construction
///
/// @apiNote Create instances via {@link CatenaFactory#builder()} rather than direct
/// construction.
///
/// @see CatenaFactory
public final class CatenaEnvironment implements AutoCloseable {

    private final CatenaConfig config;
    private final ChainRegistry chainRegistry;
    private final CircuitBreakerRegistry circuitBreakers;
    private final ChainRunner chainRunner;
    private final CheckpointManager checkpointManager;
    private final LifecycleEventBus eventBus;
    private final ExecutionSupervisor supervisor;
    private final ExecutorService callExecutor;

    public CatenaEnvironment(
            CatenaConfig config,
            ChainRegistry chainRegistry,
            CircuitBreakerRegistry circuitBreakers,
            ChainRunner chainRunner,
            CheckpointManager checkpointManager,
            LifecycleEventBus eventBus,
            ExecutionSupervisor supervisor,
            ExecutorService callExecutor) {
        this.config = config;
        this.chainRegistry = chainRegistry;
        this.circuitBreakers = circuitBreakers;
        this.chainRunner = chainRunner;
        this.checkpointManager = checkpointManager;
        this.eventBus = eventBus;
        this.supervisor = supervisor;
        this.callExecutor = callExecutor;
    }

    public CatenaConfig getConfig() {
        return config;
    }

    /// Returns the registry of chain definitions.
    ///
    /// @return the chain registry, never null
    public ChainRegistry getChainRegistry() {
        return chainRegistry;
    }

    public CircuitBreakerRegistry getCircuitBreakers() {
        return circuitBreakers;
    }

    /// Returns the runner, for running a chain synchronously on the calling thread.
    ///
    /// @return the chain runner, never null
    public ChainRunner getChainRunner() {
        return chainRunner;
    }

    public CheckpointManager getCheckpointManager() {
        return checkpointManager;
    }

    public LifecycleEventBus getEventBus() {
        return eventBus;
    }

    /// Returns the supervisor accepting asynchronous execution requests.
    ///
    /// @return the supervisor, never null
    public ExecutionSupervisor getSupervisor() {
        return supervisor;
    }

    /// Shuts the pools down and stops event delivery.
    ///
    /// @apiNote **Side effects**:
    /// - no new executions are accepted
    /// - running executions finish on their worker threads
    /// - undelivered lifecycle events are discarded
    @Override
    public void close() {
        supervisor.close();
        callExecutor.shutdown();
        eventBus.close();
    }
}

package io.catena.core;

import io.catena.core.breaker.CircuitBreakerConfig;
import io.catena.core.breaker.CircuitBreakerRegistry;
import io.catena.core.chain.ChainRegistry;
import io.catena.core.chain.ChainRepository;
import io.catena.core.chain.InMemoryChainRepository;
import io.catena.core.checkpoint.CheckpointCipher;
import io.catena.core.checkpoint.CheckpointCodec;
import io.catena.core.checkpoint.CheckpointKey;
import io.catena.core.checkpoint.CheckpointManager;
import io.catena.core.checkpoint.CheckpointStore;
import io.catena.core.checkpoint.CheckpointingListener;
import io.catena.core.checkpoint.InMemoryCheckpointStore;
import io.catena.core.execution.ChainRunner;
import io.catena.core.execution.ExecutionListener;
import io.catena.core.invocation.HandlerRegistryDispatcher;
import io.catena.core.invocation.RetryController;
import io.catena.core.invocation.Sleeper;
import io.catena.core.invocation.StepActionDispatcher;
import io.catena.core.invocation.StepInvoker;
import io.catena.core.routing.ConditionEvaluator;
import io.catena.core.routing.RoutingResolver;
import io.catena.core.supervisor.ExecutionSupervisor;
import io.catena.core.supervisor.LifecycleEventBus;
import io.catena.core.supervisor.LifecyclePublishingListener;
import io.catena.core.template.PathTemplateResolver;
import io.catena.core.template.TemplateResolver;
import java.time.Clock;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.logging.Logger;

/// Factory for creating and wiring Catena execution environments.
///
/// Only the checkpoint codec is mandatory; everything else defaults to in-memory
/// implementations and the settings in {@link CatenaConfig}.
///
/// {@snippet :
/// CatenaEnvironment env = CatenaFactory.builder()
///     .config(CatenaConfig.builder().workerPoolSize(8).build())
///     .checkpointCodec(new JacksonCheckpointCodec())
///     .checkpointStore(new FileCheckpointStore(Path.of("/var/lib/catena")))
///     .dispatcher(dispatcher)
///     .build();
/// env.getSupervisor().resumeAll();
/// }
///
/// @see CatenaEnvironment
/// @see CatenaConfig
public final class CatenaFactory {

    private static final Logger logger = Logger.getLogger(CatenaFactory.class.getName());

    private CatenaFactory() {}

    public static Builder builder() {
        return new Builder();
    }

    /// Resolves the checkpoint key from `CATENA_CHECKPOINT_KEY`.
    ///
    /// Without the variable a random key is generated, but only for an
    /// {@link InMemoryCheckpointStore}: checkpoints of a durable store written with a
    /// per-process key could never be decrypted after a restart.
    ///
    /// @param env environment variables, not null
    /// @param store store the key will protect, not null
    /// @return the key, never null
    /// @throws io.catena.core.exception.ValidationException if the variable is malformed
    /// @throws IllegalStateException if the variable is unset and the store is durable
    public static CheckpointKey resolveCheckpointKey(
            Map<String, String> env, CheckpointStore store) {
        Optional<CheckpointKey> configured = CheckpointKey.fromEnvironment(env);
        if (configured.isPresent()) {
            return configured.get();
        }
        if (!(store instanceof InMemoryCheckpointStore)) {
            throw new IllegalStateException(
                    CheckpointKey.ENV_VARIABLE
                            + " must be set when checkpoints are kept in "
                            + store.getClass().getSimpleName());
        }
        logger.warning(
                CheckpointKey.ENV_VARIABLE
                        + " not set, using a random key for in-memory checkpoints");
        return CheckpointKey.random();
    }

    /// Fluent builder for {@link CatenaEnvironment}.
    ///
    /// @implNote **Not thread-safe**. Configure on one thread, then call {@link #build()}.
    public static class Builder {
        private CatenaConfig config = new CatenaConfig();
        private Clock clock = Clock.systemUTC();
        private ChainRepository chainRepository;
        private CheckpointStore checkpointStore;
        private CheckpointKey checkpointKey;
        private CheckpointCodec checkpointCodec;
        private StepActionDispatcher dispatcher;
        private Sleeper sleeper = Sleeper.SYSTEM;
        private final List<ExecutionListener> listeners = new ArrayList<>();

        public Builder config(CatenaConfig config) {
            this.config = Objects.requireNonNull(config, "config must not be null");
            return this;
        }

        public Builder clock(Clock clock) {
            this.clock = Objects.requireNonNull(clock, "clock must not be null");
            return this;
        }

        public Builder chainRepository(ChainRepository chainRepository) {
            this.chainRepository = chainRepository;
            return this;
        }

        public Builder checkpointStore(CheckpointStore checkpointStore) {
            this.checkpointStore = checkpointStore;
            return this;
        }

        public Builder checkpointKey(CheckpointKey checkpointKey) {
            this.checkpointKey = checkpointKey;
            return this;
        }

        public Builder checkpointCodec(CheckpointCodec checkpointCodec) {
            this.checkpointCodec = checkpointCodec;
            return this;
        }

        /// Sets the dispatcher that performs module calls.
        ///
        /// Defaults to an empty {@link HandlerRegistryDispatcher}; every call then fails
        /// as an unknown target.
        public Builder dispatcher(StepActionDispatcher dispatcher) {
            this.dispatcher = dispatcher;
            return this;
        }

        public Builder sleeper(Sleeper sleeper) {
            this.sleeper = Objects.requireNonNull(sleeper, "sleeper must not be null");
            return this;
        }

        /// Adds a listener attached to every top-level run.
        public Builder listener(ExecutionListener listener) {
            listeners.add(Objects.requireNonNull(listener, "listener must not be null"));
            return this;
        }

        /// Wires the environment and starts the lifecycle event dispatcher.
        ///
        /// @return a ready environment, never null
        /// @throws IllegalStateException if no checkpoint codec was set, or a durable store
        ///     was set without a checkpoint key
        /// @throws IllegalArgumentException if the config is invalid
        public CatenaEnvironment build() {
            if (checkpointCodec == null) {
                throw new IllegalStateException("checkpointCodec must be set");
            }
            config.validate();

            ChainRegistry chainRegistry =
                    new ChainRegistry(
                            chainRepository != null
                                    ? chainRepository
                                    : new InMemoryChainRepository());
            CircuitBreakerRegistry breakers =
                    new CircuitBreakerRegistry(
                            new CircuitBreakerConfig(
                                    config.getBreakerFailureThreshold(),
                                    config.getBreakerCoolDown(),
                                    config.getBreakerHalfOpenProbes()),
                            clock);

            ExecutorService callExecutor = Executors.newCachedThreadPool(callThreadFactory());
            StepInvoker invoker =
                    new StepInvoker(
                            dispatcher != null ? dispatcher : new HandlerRegistryDispatcher(),
                            callExecutor);
            TemplateResolver templates = new PathTemplateResolver();
            ConditionEvaluator evaluator = new ConditionEvaluator();
            RetryController retryController =
                    new RetryController(invoker, breakers, config, templates, sleeper, clock);
            ChainRunner runner =
                    new ChainRunner(
                            chainRegistry,
                            retryController,
                            new RoutingResolver(evaluator),
                            evaluator,
                            templates,
                            config,
                            clock);

            CheckpointStore store =
                    checkpointStore != null ? checkpointStore : new InMemoryCheckpointStore();
            CheckpointKey key =
                    checkpointKey != null
                            ? checkpointKey
                            : resolveCheckpointKey(System.getenv(), store);
            CheckpointManager checkpoints =
                    new CheckpointManager(store, checkpointCodec, new CheckpointCipher(key), clock);

            LifecycleEventBus eventBus = new LifecycleEventBus(config.getEventBusCapacity());
            List<ExecutionListener> runListeners = new ArrayList<>();
            runListeners.add(new CheckpointingListener(checkpoints));
            runListeners.add(new LifecyclePublishingListener(eventBus, clock));
            runListeners.addAll(listeners);

            ExecutionSupervisor supervisor =
                    new ExecutionSupervisor(
                            chainRegistry,
                            runner,
                            checkpoints,
                            runListeners,
                            config.getWorkerPoolSize(),
                            clock);
            eventBus.start();

            return new CatenaEnvironment(
                    config,
                    chainRegistry,
                    breakers,
                    runner,
                    checkpoints,
                    eventBus,
                    supervisor,
                    callExecutor);
        }

        private static ThreadFactory callThreadFactory() {
            AtomicInteger counter = new AtomicInteger();
            return task -> {
                Thread thread = new Thread(task, "catena-call-" + counter.incrementAndGet());
                thread.setDaemon(true);
                return thread;
            };
        }
    }
}

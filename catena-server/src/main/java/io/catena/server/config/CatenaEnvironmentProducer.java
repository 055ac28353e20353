package io.catena.server.config;

import io.catena.core.CatenaConfig;
import io.catena.core.CatenaEnvironment;
import io.catena.core.CatenaFactory;
import io.catena.core.checkpoint.CheckpointKey;
import io.catena.core.checkpoint.CheckpointStore;
import io.catena.core.checkpoint.FileCheckpointStore;
import io.catena.core.checkpoint.InMemoryCheckpointStore;
import io.catena.core.invocation.HandlerRegistryDispatcher;
import io.catena.core.invocation.ModuleHandler;
import io.catena.serialization.JacksonCheckpointCodec;
import io.catena.server.execution.LoggingExecutionListener;
import jakarta.annotation.PreDestroy;
import jakarta.enterprise.context.ApplicationScoped;
import jakarta.enterprise.inject.Instance;
import jakarta.enterprise.inject.Produces;
import jakarta.inject.Inject;
import java.nio.file.Path;
import java.time.Duration;
import java.util.Optional;
import org.eclipse.microprofile.config.inject.ConfigProperty;
import org.jboss.logging.Logger;

/// CDI producer for the Catena runtime environment.
///
/// Wires the engine via {@link CatenaFactory}: chain registry, circuit breakers,
/// supervisor, checkpoint manager and lifecycle event bus. Module handlers discovered
/// through CDI are registered on the dispatcher by their target name.
///
/// ### Configuration Properties
/// | Property | Type | Default | Description |
/// |----------|------|---------|-------------|
/// | `catena.workers` | int | `4` | Supervisor worker pool size |
/// | `catena.max-recursion-depth` | int | `10` | Deepest allowed nested chain run |
/// | `catena.checkpoint.dir` | Path | - | Checkpoint directory; in-memory when absent |
/// | `catena.checkpoint.key` | String | - | 64 hex chars, else `CATENA_CHECKPOINT_KEY` |
/// | `catena.breaker.failure-threshold` | int | `5` | Failures before a breaker opens |
/// | `catena.breaker.cool-down` | Duration | `60S` | Open period before a probe |
/// | `catena.breaker.half-open-probes` | int | `1` | Successful probes needed to close |
///
/// A checkpoint directory requires a key from either source; only in-memory checkpoints
/// fall back to a random per-process key.
///
/// @implNote Application-scoped singleton. Thread-safe after initialization.
///
/// @see CatenaEnvironment
/// @see CatenaFactory
@ApplicationScoped
public class CatenaEnvironmentProducer {

    private static final Logger LOG = Logger.getLogger(CatenaEnvironmentProducer.class);

    @ConfigProperty(name = "catena.workers", defaultValue = "4")
    int workers;

    @ConfigProperty(name = "catena.max-recursion-depth", defaultValue = "10")
    int maxRecursionDepth;

    @ConfigProperty(name = "catena.checkpoint.dir")
    Optional<String> checkpointDir;

    @ConfigProperty(name = "catena.checkpoint.key")
    Optional<String> checkpointKey;

    @ConfigProperty(name = "catena.breaker.failure-threshold", defaultValue = "5")
    int breakerFailureThreshold;

    @ConfigProperty(name = "catena.breaker.cool-down", defaultValue = "60S")
    Duration breakerCoolDown;

    @ConfigProperty(name = "catena.breaker.half-open-probes", defaultValue = "1")
    int breakerHalfOpenProbes;

    @Inject Instance<ModuleHandler> moduleHandlers;

    @Inject LoggingExecutionListener loggingListener;

    private CatenaEnvironment catenaEnvironment;

    /// Produces the Catena runtime environment for CDI injection.
    ///
    /// @return configured environment singleton, never null
    /// @throws IllegalArgumentException if a configured value is out of range
    /// @throws IllegalStateException if a checkpoint directory is set without a key
    @Produces
    @ApplicationScoped
    public CatenaEnvironment catenaEnvironment() {
        CheckpointStore store;
        if (checkpointDir.isPresent()) {
            Path directory = Path.of(checkpointDir.get());
            store = new FileCheckpointStore(directory);
            LOG.infov("Using file checkpoints in {0}", directory);
        } else {
            store = new InMemoryCheckpointStore();
            LOG.warn("catena.checkpoint.dir not set; checkpoints are kept in memory only");
        }

        CatenaFactory.Builder factoryBuilder =
                CatenaFactory.builder()
                        .config(buildConfig())
                        .checkpointStore(store)
                        .checkpointCodec(new JacksonCheckpointCodec())
                        .checkpointKey(resolveKey(store))
                        .dispatcher(buildDispatcher())
                        .listener(loggingListener);

        catenaEnvironment = factoryBuilder.build();
        LOG.infov("Configured CatenaEnvironment with {0} workers", workers);
        return catenaEnvironment;
    }

    CatenaConfig buildConfig() {
        return CatenaConfig.builder()
                .workerPoolSize(workers)
                .maxRecursionDepth(maxRecursionDepth)
                .breakerFailureThreshold(breakerFailureThreshold)
                .breakerCoolDown(breakerCoolDown)
                .breakerHalfOpenProbes(breakerHalfOpenProbes)
                .build();
    }

    CheckpointKey resolveKey(CheckpointStore store) {
        if (checkpointKey.isPresent() && !checkpointKey.get().isBlank()) {
            return CheckpointKey.fromHex(checkpointKey.get().trim());
        }
        return CatenaFactory.resolveCheckpointKey(System.getenv(), store);
    }

    HandlerRegistryDispatcher buildDispatcher() {
        HandlerRegistryDispatcher dispatcher = new HandlerRegistryDispatcher();
        for (ModuleHandler handler : moduleHandlers) {
            dispatcher.register(handler);
            LOG.infov("Registered module handler: {0}", handler.getTarget());
        }
        return dispatcher;
    }

    /// Closes the environment to release the worker pools and the event dispatcher.
    @PreDestroy
    public void cleanup() {
        if (catenaEnvironment != null) {
            catenaEnvironment.close();
            LOG.info("CatenaEnvironment closed");
        }
    }
}

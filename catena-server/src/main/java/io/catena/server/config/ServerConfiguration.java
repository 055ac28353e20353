package io.catena.server.config;

import com.fasterxml.jackson.databind.ObjectMapper;
import io.catena.core.CatenaEnvironment;
import io.catena.core.breaker.CircuitBreakerRegistry;
import io.catena.core.chain.ChainRegistry;
import io.catena.core.checkpoint.CheckpointManager;
import io.catena.core.supervisor.ExecutionSupervisor;
import io.catena.core.supervisor.LifecycleEventBus;
import io.catena.serialization.ChainSerializer;
import jakarta.enterprise.context.ApplicationScoped;
import jakarta.enterprise.inject.Produces;
import jakarta.inject.Singleton;

/// CDI configuration for server-specific beans.
///
/// Core components are produced by {@link CatenaEnvironmentProducer} via
/// {@link io.catena.core.CatenaFactory}. This class produces the shared `ObjectMapper`
/// and delegating producers that expose environment components for direct injection.
@ApplicationScoped
public class ServerConfiguration {

    // ========== Utility Beans ==========

    /// Produces the mapper used by REST endpoints, carrying the Catena type handlers.
    @Produces
    @Singleton
    public ObjectMapper objectMapper() {
        return ChainSerializer.createMapper();
    }

    // ========== CatenaEnvironment Component Delegates ==========

    @Produces
    @Singleton
    public ChainRegistry chainRegistry(CatenaEnvironment env) {
        return env.getChainRegistry();
    }

    @Produces
    @Singleton
    public ExecutionSupervisor executionSupervisor(CatenaEnvironment env) {
        return env.getSupervisor();
    }

    @Produces
    @Singleton
    public CircuitBreakerRegistry circuitBreakerRegistry(CatenaEnvironment env) {
        return env.getCircuitBreakers();
    }

    @Produces
    @Singleton
    public CheckpointManager checkpointManager(CatenaEnvironment env) {
        return env.getCheckpointManager();
    }

    @Produces
    @Singleton
    public LifecycleEventBus lifecycleEventBus(CatenaEnvironment env) {
        return env.getEventBus();
    }
}

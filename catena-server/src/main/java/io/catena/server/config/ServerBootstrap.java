package io.catena.server.config;

import io.catena.core.supervisor.ExecutionSupervisor;
import io.catena.core.supervisor.LifecycleEventBus;
import io.catena.core.supervisor.RecoveryReport;
import io.catena.server.streaming.LifecycleEventBroadcaster;
import io.quarkus.runtime.ShutdownEvent;
import io.quarkus.runtime.StartupEvent;
import jakarta.enterprise.context.ApplicationScoped;
import jakarta.enterprise.event.Observes;
import jakarta.inject.Inject;
import org.eclipse.microprofile.config.inject.ConfigProperty;
import org.jboss.logging.Logger;

/// Server bootstrap that connects server components on startup.
///
/// Performs the following, in order:
/// - Subscribes {@link LifecycleEventBroadcaster} to the lifecycle event bus for SSE
/// - Re-enters checkpointed executions via {@link ExecutionSupervisor#resumeAll()}
///   when `catena.recovery.enabled` is true (the default)
///
/// ### Execution Order
/// Runs during Quarkus startup event, after CDI beans are initialized. Executions
/// resumed here publish their events to already connected SSE clients.
///
/// @see ExecutionSupervisor#resumeAll() for the recovery rules
@ApplicationScoped
public class ServerBootstrap {

    private static final Logger LOG = Logger.getLogger(ServerBootstrap.class);

    private final ExecutionSupervisor supervisor;
    private final LifecycleEventBus eventBus;
    private final LifecycleEventBroadcaster broadcaster;
    private final boolean recoveryEnabled;

    private AutoCloseable broadcasterSubscription;

    @Inject
    public ServerBootstrap(
            ExecutionSupervisor supervisor,
            LifecycleEventBus eventBus,
            LifecycleEventBroadcaster broadcaster,
            @ConfigProperty(name = "catena.recovery.enabled", defaultValue = "true")
                    boolean recoveryEnabled) {
        this.supervisor = supervisor;
        this.eventBus = eventBus;
        this.broadcaster = broadcaster;
        this.recoveryEnabled = recoveryEnabled;
    }

    /// Connects the SSE broadcaster and runs checkpoint recovery.
    ///
    /// @param ev the startup event
    void onStart(@Observes StartupEvent ev) {
        LOG.info("Initializing Catena server components...");

        broadcasterSubscription = eventBus.subscribe(broadcaster);
        LOG.info("Registered LifecycleEventBroadcaster for SSE streaming");

        if (recoveryEnabled) {
            RecoveryReport report = supervisor.resumeAll();
            LOG.infov(
                    "Checkpoint recovery: {0} resumed, {1} skipped, {2} need manual restart",
                    report.resumed().size(),
                    report.skipped().size(),
                    report.needsManualRestart().size());
            report.needsManualRestart()
                    .forEach(
                            (id, reason) ->
                                    LOG.warnv("Manual restart needed: {0}: {1}", id, reason));
        } else {
            LOG.info("Checkpoint recovery disabled");
        }

        LOG.info("Catena server initialization complete");
    }

    /// Disconnects the broadcaster and completes open SSE streams.
    ///
    /// @param ev the shutdown event
    void onStop(@Observes ShutdownEvent ev) {
        if (broadcasterSubscription != null) {
            try {
                broadcasterSubscription.close();
            } catch (Exception e) {
                LOG.warnv(e, "Failed to unsubscribe broadcaster: {0}", e.getMessage());
            }
        }
        broadcaster.completeAll();
    }
}

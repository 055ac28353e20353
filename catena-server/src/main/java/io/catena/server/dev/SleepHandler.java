package io.catena.server.dev;

import io.catena.core.invocation.ActionRequest;
import io.catena.core.invocation.ActionResponse;
import io.catena.core.invocation.ModuleHandler;
import jakarta.enterprise.context.ApplicationScoped;
import java.util.Map;
import java.util.concurrent.TimeUnit;
import org.jboss.logging.Logger;

/// Dev-only module handler for crash-recovery manual testing.
///
/// Sleeps for a configurable number of seconds, giving the operator time
/// to kill the server mid-execution and verify that startup recovery
/// resumes the execution from its last checkpoint.
///
/// ### Params
/// | Key               | Type | Default | Description               |
/// |-------------------|------|---------|---------------------------|
/// | `durationSeconds` | int  | `30`    | How long to sleep (s)     |
///
/// ### Manual Test Recipe
///
/// ```
/// 1. Set catena.checkpoint.dir and catena.checkpoint.key
/// 2. Register a chain whose second step calls target "sleep"
/// 3. Trigger it and wait for log: "SleepHandler sleeping for N seconds"
/// 4. kill -9 <server PID>
/// 5. Restart server; recovery resumes the execution at the sleep step
/// 6. Verify GET /api/v1/executions/{id} reports completed
/// ```
@ApplicationScoped
public class SleepHandler implements ModuleHandler {

    private static final Logger LOG = Logger.getLogger(SleepHandler.class);

    public static final String TARGET = "sleep";

    @Override
    public String getTarget() {
        return TARGET;
    }

    @Override
    public ActionResponse handle(ActionRequest request) {
        Object configured = request.params().getOrDefault("durationSeconds", 30);
        int seconds =
                configured instanceof Number n
                        ? n.intValue()
                        : Integer.parseInt(configured.toString());
        LOG.infov(
                "SleepHandler sleeping for {0} seconds (execution={1}, step={2})",
                seconds, request.executionId(), request.stepId());

        try {
            TimeUnit.SECONDS.sleep(seconds);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            return ActionResponse.failure("Sleep interrupted");
        }

        LOG.infov("SleepHandler done (execution={0})", request.executionId());
        return ActionResponse.success(Map.of("slept_seconds", seconds));
    }
}

package io.catena.server.api;

import io.catena.core.breaker.CircuitBreakerRegistry;
import io.catena.core.breaker.CircuitBreakerSnapshot;
import io.catena.server.validation.LogSanitizer;
import jakarta.inject.Inject;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.Size;
import jakarta.ws.rs.GET;
import jakarta.ws.rs.NotFoundException;
import jakarta.ws.rs.POST;
import jakarta.ws.rs.Path;
import jakarta.ws.rs.PathParam;
import jakarta.ws.rs.Produces;
import jakarta.ws.rs.core.MediaType;
import java.util.List;
import org.jboss.logging.Logger;

/// Admin API for the per-dependency circuit breakers.
///
/// Breakers are keyed by module target and created on first use, so a target that was
/// never called has no breaker.
@Path("/api/v1/circuit-breakers")
@Produces(MediaType.APPLICATION_JSON)
public class CircuitBreakerResource {

    private static final Logger LOG = Logger.getLogger(CircuitBreakerResource.class);

    private final CircuitBreakerRegistry breakers;

    @Inject
    public CircuitBreakerResource(CircuitBreakerRegistry breakers) {
        this.breakers = breakers;
    }

    /// Lists every breaker with its state and counters.
    @GET
    public List<CircuitBreakerSnapshot> list() {
        return breakers.snapshots();
    }

    /// Returns one breaker.
    @GET
    @Path("/{dependencyKey}")
    public CircuitBreakerSnapshot get(
            @PathParam("dependencyKey") @NotBlank @Size(max = 256) String dependencyKey) {
        return breakers.inspect(dependencyKey).orElseThrow(() -> notFound(dependencyKey));
    }

    /// Forces a breaker back to `closed` and clears its counters.
    ///
    /// ### Response (200 OK)
    /// ```json
    /// {"dependencyKey": "crm", "state": "closed", "failureCount": 0, ...}
    /// ```
    @POST
    @Path("/{dependencyKey}/reset")
    public CircuitBreakerSnapshot reset(
            @PathParam("dependencyKey") @NotBlank @Size(max = 256) String dependencyKey) {
        if (!breakers.reset(dependencyKey)) {
            throw notFound(dependencyKey);
        }
        LOG.infov("Circuit breaker reset: {0}", LogSanitizer.sanitize(dependencyKey));
        return breakers.inspect(dependencyKey).orElseThrow(() -> notFound(dependencyKey));
    }

    private static NotFoundException notFound(String dependencyKey) {
        return new NotFoundException("No circuit breaker for: " + dependencyKey);
    }
}

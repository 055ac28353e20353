package io.catena.server.validation;

import jakarta.validation.ConstraintViolation;
import jakarta.validation.ConstraintViolationException;
import jakarta.validation.Path;
import jakarta.ws.rs.core.MediaType;
import jakarta.ws.rs.core.Response;
import jakarta.ws.rs.ext.ExceptionMapper;
import jakarta.ws.rs.ext.Provider;
import java.util.Map;
import java.util.stream.Collectors;
import org.jboss.logging.Logger;

/// Maps Bean Validation constraint violations to HTTP 400 JSON responses.
///
/// Replaces the built-in Quarkus mapper so rejected requests carry the same body as
/// every other error of {@link io.catena.server.security.GlobalExceptionMapper}.
///
/// ### Response Format
/// ```json
/// {"error": "chainId: chainId is required", "type": "validation", "status": 400}
/// ```
///
/// @implNote Thread-safe. Stateless.
/// @see ValidId
@Provider
public class ConstraintViolationExceptionMapper
        implements ExceptionMapper<ConstraintViolationException> {

    private static final Logger LOG = Logger.getLogger(ConstraintViolationExceptionMapper.class);

    @Override
    public Response toResponse(ConstraintViolationException exception) {
        String message =
                exception.getConstraintViolations().stream()
                        .map(v -> leafName(v) + ": " + v.getMessage())
                        .sorted()
                        .distinct()
                        .collect(Collectors.joining("; "));

        LOG.debugv("Validation error: {0}", LogSanitizer.sanitize(message));

        return Response.status(Response.Status.BAD_REQUEST)
                .type(MediaType.APPLICATION_JSON)
                .entity(Map.of("error", message, "type", "validation", "status", 400))
                .build();
    }

    /// Returns the last node of the property path: the parameter name for method
    /// parameters, the component name for request bodies.
    private static String leafName(ConstraintViolation<?> violation) {
        String name = null;
        for (Path.Node node : violation.getPropertyPath()) {
            name = node.getName();
        }
        return name != null ? name : "unknown";
    }
}

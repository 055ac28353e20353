package io.catena.server.security;

import io.catena.core.exception.CatenaException;
import io.catena.core.exception.ChainNotFoundException;
import io.catena.core.exception.CheckpointIntegrityException;
import io.catena.core.exception.ValidationException;
import jakarta.ws.rs.WebApplicationException;
import jakarta.ws.rs.core.MediaType;
import jakarta.ws.rs.core.Response;
import jakarta.ws.rs.ext.ExceptionMapper;
import jakarta.ws.rs.ext.Provider;
import java.util.Map;
import org.jboss.logging.Logger;

/// Global exception mapper that prevents stack trace leakage to clients.
///
/// Catches all unhandled exceptions and returns sanitized JSON responses.
/// Full stack traces are logged server-side for server errors.
///
/// ### Status Mapping
/// | Exception | Status |
/// |-----------|--------|
/// | `ValidationException`, `IllegalArgumentException` | 400 |
/// | `ChainNotFoundException` | 404 |
/// | `CheckpointIntegrityException` | 409 |
/// | other `CatenaException` | 422 |
/// | `WebApplicationException` | its own status |
/// | anything else | 500 |
///
/// ### Response Format
/// ```json
/// {"error": "Human-readable message", "type": "validation", "status": 400}
/// ```
///
/// @implNote Thread-safe. Stateless.
@Provider
public class GlobalExceptionMapper implements ExceptionMapper<Throwable> {

    private static final Logger LOG = Logger.getLogger(GlobalExceptionMapper.class);

    static final int UNPROCESSABLE_ENTITY = 422;

    @Override
    public Response toResponse(Throwable exception) {
        if (exception instanceof CatenaException catena) {
            int status = statusOf(catena);
            LOG.debugv("Client error {0}: {1}", status, catena.getMessage());
            return build(status, catena.getMessage(), catena.errorType());
        }

        if (exception instanceof IllegalArgumentException) {
            LOG.debugv("Client error 400: {0}", exception.getMessage());
            return build(400, messageOr(exception.getMessage(), "Bad request"), "bad_request");
        }

        if (exception instanceof WebApplicationException wae) {
            int status = wae.getResponse().getStatus();
            String message = sanitize(status, wae.getMessage());

            if (status >= 500) {
                LOG.errorv(exception, "Server error: {0}", message);
            } else {
                LOG.debugv("Client error {0}: {1}", status, message);
            }
            return build(status, message, status >= 500 ? "internal" : "http_" + status);
        }

        LOG.errorv(exception, "Unhandled exception: {0}", exception.getMessage());
        return build(500, "Internal server error", "internal");
    }

    static int statusOf(CatenaException exception) {
        if (exception instanceof ValidationException) {
            return 400;
        }
        if (exception instanceof ChainNotFoundException) {
            return 404;
        }
        if (exception instanceof CheckpointIntegrityException) {
            return 409;
        }
        return UNPROCESSABLE_ENTITY;
    }

    private static Response build(int status, String message, String type) {
        return Response.status(status)
                .type(MediaType.APPLICATION_JSON)
                .entity(Map.of("error", message, "type", type, "status", status))
                .build();
    }

    private static String messageOr(String raw, String fallback) {
        return raw != null ? raw : fallback;
    }

    private static String sanitize(int status, String raw) {
        return switch (status) {
            case 400 -> messageOr(raw, "Bad request");
            case 404 -> "Resource not found";
            case 405 -> "Method not allowed";
            case 409 -> "Conflict";
            case 415 -> "Unsupported media type";
            default -> {
                if (status >= 500) yield "Internal server error";
                yield messageOr(raw, "Request failed");
            }
        };
    }
}

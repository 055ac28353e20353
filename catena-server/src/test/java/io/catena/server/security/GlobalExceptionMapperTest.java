package io.catena.server.security;

import static org.assertj.core.api.Assertions.assertThat;

import io.catena.core.exception.ChainNotFoundException;
import io.catena.core.exception.CheckpointIntegrityException;
import io.catena.core.exception.CircuitOpenException;
import io.catena.core.exception.ValidationException;
import jakarta.ws.rs.NotFoundException;
import jakarta.ws.rs.core.Response;
import org.assertj.core.api.InstanceOfAssertFactories;
import org.assertj.core.api.MapAssert;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

class GlobalExceptionMapperTest {

    private GlobalExceptionMapper mapper;

    @BeforeEach
    void setUp() {
        mapper = new GlobalExceptionMapper();
    }

    private static MapAssert<Object, Object> assertBody(Response response) {
        return assertThat(response.getEntity()).asInstanceOf(InstanceOfAssertFactories.MAP);
    }

    @Test
    void shouldMapValidationTo400() {
        try (Response response = mapper.toResponse(new ValidationException("bad step"))) {
            assertThat(response.getStatus()).isEqualTo(400);
            assertBody(response)
                    .containsEntry("error", "bad step")
                    .containsEntry("type", "validation");
        }
    }

    @Test
    void shouldMapUnknownChainTo404() {
        try (Response response = mapper.toResponse(new ChainNotFoundException("orders"))) {
            assertThat(response.getStatus()).isEqualTo(404);
            assertBody(response).containsEntry("type", "chain_not_found");
        }
    }

    @Test
    void shouldMapCheckpointIntegrityTo409() {
        var exception = new CheckpointIntegrityException("exec-1", "digest mismatch");

        try (Response response = mapper.toResponse(exception)) {
            assertThat(response.getStatus()).isEqualTo(409);
        }
    }

    @Test
    void shouldMapOtherEngineErrorsTo422() {
        try (Response response = mapper.toResponse(new CircuitOpenException("crm"))) {
            assertThat(response.getStatus()).isEqualTo(422);
            assertBody(response).containsEntry("type", "circuit_open");
        }
    }

    @Test
    void shouldMapIllegalArgumentTo400() {
        var exception = new IllegalArgumentException("Failed to deserialize chain: eof");

        try (Response response = mapper.toResponse(exception)) {
            assertThat(response.getStatus()).isEqualTo(400);
            assertBody(response).containsEntry("type", "bad_request");
        }
    }

    @Test
    void shouldKeepStatusOfWebApplicationException() {
        try (Response response = mapper.toResponse(new NotFoundException("Execution x"))) {
            assertThat(response.getStatus()).isEqualTo(404);
            assertBody(response).containsEntry("error", "Resource not found");
        }
    }

    @Test
    void shouldHideDetailsOfUnexpectedErrors() {
        try (Response response = mapper.toResponse(new IllegalStateException("pool gone"))) {
            assertThat(response.getStatus()).isEqualTo(500);
            assertBody(response)
                    .containsEntry("error", "Internal server error")
                    .containsEntry("type", "internal");
        }
    }
}

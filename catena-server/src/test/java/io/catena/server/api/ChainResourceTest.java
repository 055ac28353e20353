package io.catena.server.api;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import io.catena.core.chain.ChainRegistry;
import io.catena.core.chain.InMemoryChainRepository;
import io.catena.core.exception.ChainNotFoundException;
import io.catena.core.exception.ValidationException;
import io.catena.serialization.ChainSerializer;
import jakarta.ws.rs.BadRequestException;
import jakarta.ws.rs.NotFoundException;
import jakarta.ws.rs.core.Response;
import java.util.List;
import java.util.Map;
import org.assertj.core.api.InstanceOfAssertFactories;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

class ChainResourceTest {

    private static final String ORDERS =
            """
            {"id": "orders", "name": "Order intake", "steps": [
              {"id": "fetch", "target": "crm", "operation": "get"},
              {"type": "chain_call", "id": "bill", "targetChainId": "billing"}
            ]}
            """;

    private static final String BILLING =
            """
            {"id": "billing", "steps": [{"id": "charge", "target": "psp", "operation": "charge"}]}
            """;

    private ChainRegistry registry;
    private ChainResource resource;

    @BeforeEach
    void setUp() {
        registry = new ChainRegistry(new InMemoryChainRepository());
        resource = new ChainResource(registry, ChainSerializer.createMapper());
    }

    @Nested
    class Register {

        @Test
        void shouldRegisterChainAndReturn201() {
            // When
            Object entity;
            try (Response response = resource.register(BILLING)) {
                assertThat(response.getStatus()).isEqualTo(201);
                entity = response.getEntity();
            }

            // Then
            assertThat(entity)
                    .asInstanceOf(InstanceOfAssertFactories.MAP)
                    .containsEntry("id", "billing")
                    .containsEntry("steps", 1);
            assertThat(registry.require("billing").getSteps()).hasSize(1);
        }

        @Test
        void shouldRejectChainReferencingUnknownChain() {
            assertThatThrownBy(() -> resource.register(ORDERS))
                    .isInstanceOf(ValidationException.class)
                    .hasMessageContaining("billing");
            assertThat(registry.list()).isEmpty();
        }

        @Test
        void shouldRejectMalformedJson() {
            assertThatThrownBy(() -> resource.register("{\"id\":"))
                    .isInstanceOf(IllegalArgumentException.class);
        }
    }

    @Nested
    class RegisterBatch {

        @Test
        void shouldRegisterChainsReferencingEachOther() {
            try (Response response = resource.registerBatch("[" + ORDERS + "," + BILLING + "]")) {
                assertThat(response.getStatus()).isEqualTo(201);
            }

            assertThat(registry.list()).hasSize(2);
        }

        @Test
        void shouldRejectNonArrayBody() {
            assertThatThrownBy(() -> resource.registerBatch(BILLING))
                    .isInstanceOf(BadRequestException.class)
                    .hasMessageContaining("array");
        }
    }

    @Nested
    class Query {

        @Test
        void shouldListRegisteredChains() {
            resource.register(BILLING).close();

            List<Map<String, Object>> chains = resource.list();

            assertThat(chains).hasSize(1);
            assertThat(chains.get(0)).containsEntry("name", "billing");
        }

        @Test
        void shouldReturnFullDefinitionAsJson() {
            resource.register(BILLING).close();

            String json;
            try (Response response = resource.get("billing")) {
                assertThat(response.getStatus()).isEqualTo(200);
                json = (String) response.getEntity();
            }

            assertThat(ChainSerializer.fromJson(json).getId()).isEqualTo("billing");
        }

        @Test
        void shouldThrowForUnknownChain() {
            assertThatThrownBy(() -> resource.get("missing"))
                    .isInstanceOf(ChainNotFoundException.class);
        }
    }

    @Nested
    class Delete {

        @Test
        void shouldDeleteChainAndReturn204() {
            resource.register(BILLING).close();

            try (Response response = resource.delete("billing")) {
                assertThat(response.getStatus()).isEqualTo(204);
            }
            assertThat(registry.list()).isEmpty();
        }

        @Test
        void shouldReturn404ForUnknownChain() {
            assertThatThrownBy(() -> resource.delete("missing"))
                    .isInstanceOf(NotFoundException.class);
        }
    }
}

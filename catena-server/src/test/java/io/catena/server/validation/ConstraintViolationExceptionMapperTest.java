package io.catena.server.validation;

import static org.assertj.core.api.Assertions.assertThat;

import jakarta.validation.ConstraintViolationException;
import jakarta.validation.Validation;
import jakarta.validation.Validator;
import jakarta.validation.ValidatorFactory;
import jakarta.validation.constraints.NotBlank;
import jakarta.ws.rs.core.Response;
import java.util.Set;
import org.assertj.core.api.InstanceOfAssertFactories;
import org.junit.jupiter.api.AfterAll;
import org.junit.jupiter.api.BeforeAll;
import org.junit.jupiter.api.Test;

class ConstraintViolationExceptionMapperTest {

    private static ValidatorFactory factory;
    private static Validator validator;

    private final ConstraintViolationExceptionMapper mapper =
            new ConstraintViolationExceptionMapper();

    @BeforeAll
    static void setup() {
        factory = Validation.buildDefaultValidatorFactory();
        validator = factory.getValidator();
    }

    @AfterAll
    static void tearDown() {
        factory.close();
    }

    record TriggerDto(
            @NotBlank(message = "chainId is required") String chainId,
            @ValidId String executionId) {}

    @Test
    void shouldMapViolationsTo400WithLeafNames() {
        // Given
        var violations = validator.validate(new TriggerDto(" ", "exec-1"));
        var exception = new ConstraintViolationException(violations);

        // When
        Object entity;
        try (Response response = mapper.toResponse(exception)) {
            assertThat(response.getStatus()).isEqualTo(400);
            entity = response.getEntity();
        }

        // Then
        assertThat(entity)
                .asInstanceOf(InstanceOfAssertFactories.MAP)
                .containsEntry("error", "chainId: chainId is required")
                .containsEntry("type", "validation")
                .containsEntry("status", 400);
    }

    @Test
    void shouldJoinEveryViolatedField() {
        // Given
        var violations = validator.validate(new TriggerDto(null, "../x"));

        // When
        Object entity;
        try (Response response = mapper.toResponse(new ConstraintViolationException(violations))) {
            entity = response.getEntity();
        }

        // Then
        assertThat(entity)
                .asInstanceOf(InstanceOfAssertFactories.MAP)
                .extractingByKey("error", InstanceOfAssertFactories.STRING)
                .contains("chainId: chainId is required")
                .contains("executionId: must be a valid identifier");
    }

    @Test
    void shouldRespond400WhenViolationSetIsEmpty() {
        try (Response response = mapper.toResponse(new ConstraintViolationException(Set.of()))) {
            assertThat(response.getStatus()).isEqualTo(400);
        }
    }
}

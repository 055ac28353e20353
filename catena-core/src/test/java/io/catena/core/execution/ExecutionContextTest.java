package io.catena.core.execution;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import java.util.Map;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

class ExecutionContextTest {

    @Test
    void shouldExposeInputAndEnvInScope() {
        // Given
        var context =
                ExecutionContext.create(
                        "exec-1",
                        "orders",
                        "t-1",
                        Map.of("orderId", "o-1"),
                        Map.of("REGION", "eu"));
        context.putVariable("step_fetch_output", Map.of("total", 12));

        // When
        var scope = context.scope();

        // Then
        assertThat(scope)
                .containsEntry("input", Map.of("orderId", "o-1"))
                .containsEntry("env", Map.of("REGION", "eu"))
                .containsEntry("step_fetch_output", Map.of("total", 12));
    }

    @Test
    void shouldTreatNullInputAndEnvAsEmpty() {
        var context = ExecutionContext.create("exec-1", "orders", null, null, null);

        assertThat(context.getInput()).isEmpty();
        assertThat(context.getEnv()).isEmpty();
        assertThat(context.getTriggerId()).isNull();
        assertThat(context.getDepth()).isZero();
    }

    @Nested
    class Variables {

        @Test
        void shouldRejectSecondWriteOfSameVariable() {
            var context = ExecutionContext.create("exec-1", "orders", "t-1", Map.of(), Map.of());
            context.putVariable("step_a_output", "first");

            assertThatThrownBy(() -> context.putVariable("step_a_output", "second"))
                    .isInstanceOf(IllegalStateException.class)
                    .hasMessageContaining("step_a_output");
            assertThat(context.getVariables()).containsEntry("step_a_output", "first");
        }

        @Test
        void shouldNotLetVariablesShadowInput() {
            var context =
                    ExecutionContext.create("exec-1", "orders", "t-1", Map.of("a", 1), Map.of());
            context.putVariable("input", "shadow");

            assertThat(context.scope()).containsEntry("input", "shadow");
            assertThat(context.getInput()).containsEntry("a", 1);
        }

        @Test
        void shouldExposeReadOnlyVariables() {
            var context = ExecutionContext.create("exec-1", "orders", "t-1", Map.of(), Map.of());

            assertThatThrownBy(() -> context.getVariables().put("x", 1))
                    .isInstanceOf(UnsupportedOperationException.class);
        }
    }

    @Nested
    class Copies {

        @Test
        void shouldIsolateCopyFromLaterWrites() {
            // Given
            var context = ExecutionContext.create("exec-1", "orders", "t-1", Map.of(), Map.of());
            context.putVariable("step_a_output", 1);

            // When
            var copy = context.copy();
            context.putVariable("step_b_output", 2);

            // Then
            assertThat(copy.getVariables()).containsOnlyKeys("step_a_output");
            assertThat(copy).isNotEqualTo(context);
        }

        @Test
        void shouldStartChildOneLevelDeeperWithInheritedEnv() {
            // Given
            var parent =
                    ExecutionContext.create("exec-1", "orders", "t-1", Map.of(), Map.of("K", "v"));
            parent.putVariable("step_a_output", 1);

            // When
            var child = parent.child("exec-2", "billing", Map.of("amount", 5));

            // Then
            assertThat(child.getDepth()).isEqualTo(1);
            assertThat(child.getTriggerId()).isEqualTo("t-1");
            assertThat(child.getEnv()).containsEntry("K", "v");
            assertThat(child.getInput()).containsEntry("amount", 5);
            assertThat(child.getVariables()).isEmpty();
        }

        @Test
        void shouldRestorePersistedState() {
            var restored =
                    ExecutionContext.restore(
                            "exec-1",
                            "orders",
                            "t-1",
                            Map.of("a", 1),
                            Map.of(),
                            Map.of("step_a_output", "x"),
                            2,
                            3);

            assertThat(restored.getDepth()).isEqualTo(2);
            assertThat(restored.getRetriesUsed()).isEqualTo(3);
            assertThat(restored.hasVariable("step_a_output")).isTrue();
            assertThat(restored).isEqualTo(restored.copy());
        }
    }
}

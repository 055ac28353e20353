package io.catena.serialization;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import io.catena.core.checkpoint.Checkpoint;
import io.catena.core.checkpoint.CheckpointCipher;
import io.catena.core.checkpoint.CheckpointKey;
import io.catena.core.checkpoint.CheckpointManager;
import io.catena.core.checkpoint.CheckpointStatus;
import io.catena.core.checkpoint.FileCheckpointStore;
import io.catena.core.execution.ExecutionContext;
import io.catena.core.execution.StepResult;
import io.catena.core.execution.StepStatus;
import io.catena.core.routing.RoutingTrace;
import java.nio.charset.StandardCharsets;
import java.nio.file.Path;
import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.List;
import java.util.Map;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

class JacksonCheckpointCodecTest {

    private static final Instant T0 = Instant.parse("2026-03-01T10:00:00Z");

    private JacksonCheckpointCodec codec;

    @BeforeEach
    void setUp() {
        codec = new JacksonCheckpointCodec();
    }

    private static ExecutionContext context() {
        ExecutionContext context =
                ExecutionContext.create(
                        "exec-1",
                        "orders",
                        "trigger-7",
                        Map.of("orderId", "o-1", "total", 12.5),
                        Map.of("REGION", "eu"));
        context.putVariable("step_fetch_output", Map.of("score", 72, "tags", List.of("a", "b")));
        context.recordRetry();
        return context;
    }

    private static List<StepResult> results() {
        StepResult fetched =
                StepResult.completed(
                        "fetch", T0, T0.plusMillis(250), Map.of("score", 72), 1, List.of(500L));
        var routed =
                new StepResult(
                        "route",
                        StepStatus.COMPLETED,
                        T0.plusMillis(300),
                        T0.plusMillis(310),
                        10,
                        "ok",
                        null,
                        null,
                        0,
                        List.of(),
                        null,
                        new RoutingTrace(
                                List.of(
                                        new RoutingTrace.RuleEvaluation("low", false),
                                        new RoutingTrace.RuleEvaluation("high", true)),
                                "high",
                                "skip_to_step"));
        StepResult skipped = StepResult.skipped("notify", T0.plusMillis(320), "condition not met");
        return List.of(fetched, routed, skipped);
    }

    // ---------------------------------------------------------------------
    // Encoding
    // ---------------------------------------------------------------------

    @Nested
    class Encoding {

        @Test
        void shouldRestoreEveryCheckpointField() {
            // Given
            var checkpoint = new Checkpoint(context(), 3, results(), CheckpointStatus.RUNNING, T0);

            // When
            Checkpoint restored = codec.decode(codec.encode(checkpoint));

            // Then
            assertThat(restored.context()).isEqualTo(checkpoint.context());
            assertThat(restored.nextIndex()).isEqualTo(3);
            assertThat(restored.status()).isEqualTo(CheckpointStatus.RUNNING);
            assertThat(restored.createdAt()).isEqualTo(T0);
            assertThat(restored.results()).isEqualTo(checkpoint.results());
        }

        @Test
        void shouldKeepDepthAndRetryBudget() {
            ExecutionContext child = context().child("exec-2", "billing", Map.of("amount", 3));
            child.recordRetry();
            child.recordRetry();
            var checkpoint = new Checkpoint(child, 0, List.of(), CheckpointStatus.CANCELLED, T0);

            Checkpoint restored = codec.decode(codec.encode(checkpoint));

            assertThat(restored.context().getDepth()).isEqualTo(1);
            assertThat(restored.context().getRetriesUsed()).isEqualTo(2);
            assertThat(restored.context().getTriggerId()).isEqualTo("trigger-7");
            assertThat(restored.isResumable()).isFalse();
        }

        @Test
        void shouldWriteStatusesAsWireNames() {
            var checkpoint = new Checkpoint(context(), 3, results(), CheckpointStatus.RUNNING, T0);

            String json = new String(codec.encode(checkpoint), StandardCharsets.UTF_8);

            assertThat(json)
                    .contains("\"version\":1")
                    .contains("\"status\":\"running\"")
                    .contains("\"status\":\"completed\"")
                    .contains("\"status\":\"skipped\"")
                    .contains("\"createdAt\":\"2026-03-01T10:00:00Z\"")
                    .doesNotContain("\"success\"")
                    .doesNotContain("\"evaluated\"");
        }
    }

    // ---------------------------------------------------------------------
    // Rejection
    // ---------------------------------------------------------------------

    @Nested
    class Rejection {

        @Test
        void shouldRejectGarbage() {
            assertThatThrownBy(() -> codec.decode("not json".getBytes(StandardCharsets.UTF_8)))
                    .isInstanceOf(IllegalArgumentException.class)
                    .hasMessageContaining("malformed");
        }

        @Test
        void shouldRejectNonObjectPayload() {
            assertThatThrownBy(() -> codec.decode("[1,2]".getBytes(StandardCharsets.UTF_8)))
                    .isInstanceOf(IllegalArgumentException.class)
                    .hasMessageContaining("not a JSON object");
        }

        @Test
        void shouldRejectUnsupportedVersion() {
            var json = "{\"version\":2,\"status\":\"running\"}";

            assertThatThrownBy(() -> codec.decode(json.getBytes(StandardCharsets.UTF_8)))
                    .isInstanceOf(IllegalArgumentException.class)
                    .hasMessageContaining("version: 2");
        }

        @Test
        void shouldRejectMissingContext() {
            var json =
                    "{\"version\":1,\"nextIndex\":0,\"results\":[],\"status\":\"running\","
                            + "\"createdAt\":\"2026-03-01T10:00:00Z\"}";

            assertThatThrownBy(() -> codec.decode(json.getBytes(StandardCharsets.UTF_8)))
                    .isInstanceOf(IllegalArgumentException.class);
        }
    }

    // ---------------------------------------------------------------------
    // Encrypted file storage
    // ---------------------------------------------------------------------

    @Nested
    class EncryptedFileStorage {

        @TempDir Path directory;

        @Test
        void shouldResumeFromCheckpointWrittenToDisk() {
            // Given
            CheckpointKey key = CheckpointKey.random();
            Clock clock = Clock.fixed(T0, ZoneOffset.UTC);
            var writer =
                    new CheckpointManager(
                            new FileCheckpointStore(directory),
                            codec,
                            new CheckpointCipher(key),
                            clock);
            writer.save(context(), 3, results());

            // When
            var reader =
                    new CheckpointManager(
                            new FileCheckpointStore(directory),
                            new JacksonCheckpointCodec(),
                            new CheckpointCipher(key),
                            clock);
            var loaded = reader.load("exec-1");

            // Then
            assertThat(loaded).isPresent();
            assertThat(loaded.get().context()).isEqualTo(context());
            assertThat(loaded.get().results()).hasSize(3);
            assertThat(loaded.get().isResumable()).isTrue();
        }
    }
}

package io.catena.server.dev;

import static org.assertj.core.api.Assertions.assertThat;

import io.catena.core.invocation.ActionRequest;
import java.util.Map;
import org.junit.jupiter.api.Test;

class SleepHandlerTest {

    private final SleepHandler handler = new SleepHandler();

    private static ActionRequest request(Map<String, Object> params) {
        return new ActionRequest("exec-1", "wait", SleepHandler.TARGET, "sleep", params, 5000, 1);
    }

    @Test
    void shouldRegisterUnderSleepTarget() {
        assertThat(handler.getTarget()).isEqualTo("sleep");
    }

    @Test
    void shouldReportSleptSeconds() {
        var response = handler.handle(request(Map.of("durationSeconds", 0)));

        assertThat(response.success()).isTrue();
        assertThat(response.output()).isEqualTo(Map.of("slept_seconds", 0));
    }

    @Test
    void shouldAcceptDurationAsText() {
        var response = handler.handle(request(Map.of("durationSeconds", "0")));

        assertThat(response.success()).isTrue();
    }

    @Test
    void shouldFailWhenInterrupted() {
        Thread.currentThread().interrupt();
        try {
            var response = handler.handle(request(Map.of("durationSeconds", 1)));

            assertThat(response.success()).isFalse();
            assertThat(response.error()).isEqualTo("Sleep interrupted");
        } finally {
            Thread.interrupted();
        }
    }
}

package com.genbridge.gateway.model;

import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

/**
 * Construction rules of the value types the gateway hands out.
 */
class ModelInvariantsTest {

    @Test
    void taskHandle_rejectsBlankIdsAndFailureStatus() {
        assertThatThrownBy(() -> new TaskHandle("", TaskStatus.PENDING, "r1"))
                .isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> new TaskHandle("t1", TaskStatus.PENDING, " "))
                .isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> new TaskHandle("t1", TaskStatus.FAILED, "r1"))
                .isInstanceOf(IllegalArgumentException.class);
    }

    @Test
    void generationResult_requiresArtifacts() {
        assertThatThrownBy(() -> new GenerationResult("t1", List.of(), "r1"))
                .isInstanceOf(IllegalArgumentException.class);
        assertThat(new GenerationResult(null, List.of("u1", "u2"), "r1").primaryArtifact()).isEqualTo("u1");
    }

    @Test
    void fetchOutcome_inProgressRejectsTerminalStatus() {
        assertThatThrownBy(() -> FetchOutcome.inProgress("t1", TaskStatus.SUCCEEDED, "r1"))
                .isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> new FetchOutcome("t1", TaskStatus.CANCELED, "r1", null))
                .isInstanceOf(IllegalArgumentException.class);
    }

    @Test
    void invocationContext_headersCaseInsensitiveAndBlankIdIgnored() {
        InvocationContext ctx = new InvocationContext("  ", Map.of("X-Request-Id", "abc"));

        assertThat(ctx.header("x-request-id")).contains("abc");
        assertThat(ctx.callerRequestId()).isEmpty();
        assertThat(InvocationContext.withRequestId("job-1").callerRequestId()).contains("job-1");
    }
}

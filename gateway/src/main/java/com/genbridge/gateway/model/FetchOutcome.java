package com.genbridge.gateway.model;

import java.util.Objects;
import java.util.Optional;

/**
 * What a single fetch round trip observed.
 *
 * Either the task is still in flight (PENDING, RUNNING or UNKNOWN, no result)
 * or it SUCCEEDED and {@link #result()} holds the artifacts. Terminal failures
 * never appear here; they are raised as exceptions.
 */
public record FetchOutcome(String taskId, TaskStatus status, String requestId, GenerationResult result) {

    public FetchOutcome {
        Objects.requireNonNull(status, "status");
        if (status.isFailure()) {
            throw new IllegalArgumentException("Terminal failures are raised, not returned: " + status);
        }
        if (status == TaskStatus.SUCCEEDED && result == null) {
            throw new IllegalArgumentException("A SUCCEEDED outcome must carry its result");
        }
    }

    public static FetchOutcome inProgress(String taskId, TaskStatus status, String requestId) {
        if (status.isTerminal()) {
            throw new IllegalArgumentException("Not an in-progress status: " + status);
        }
        return new FetchOutcome(taskId, status, requestId, null);
    }

    public static FetchOutcome succeeded(GenerationResult result) {
        return new FetchOutcome(result.taskId(), TaskStatus.SUCCEEDED, result.requestId(), result);
    }

    public boolean finished() {
        return status == TaskStatus.SUCCEEDED;
    }

    public Optional<GenerationResult> resultIfFinished() {
        return Optional.ofNullable(result);
    }
}

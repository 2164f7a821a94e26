package com.genbridge.gateway.model;

import java.util.Objects;

/**
 * Returned by a successful asynchronous submission.
 *
 * @param taskId    opaque provider-issued id; the only key used to fetch the task again
 * @param status    status reported at submission time, never FAILED or CANCELED
 * @param requestId correlation id for this logical job, never blank
 */
public record TaskHandle(String taskId, TaskStatus status, String requestId) {

    public TaskHandle {
        if (taskId == null || taskId.isBlank()) {
            throw new IllegalArgumentException("taskId must not be blank");
        }
        if (requestId == null || requestId.isBlank()) {
            throw new IllegalArgumentException("requestId must not be blank");
        }
        Objects.requireNonNull(status, "status");
        if (status.isFailure()) {
            throw new IllegalArgumentException("A task handle cannot be in terminal failure status " + status);
        }
    }
}

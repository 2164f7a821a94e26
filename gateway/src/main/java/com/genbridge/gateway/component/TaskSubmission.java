package com.genbridge.gateway.component;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.annotation.JsonPropertyDescription;
import com.genbridge.gateway.model.TaskHandle;

/**
 * Output of every asynchronous submit component.
 */
public record TaskSubmission(
        @JsonProperty(value = "task_id", required = true)
        @JsonPropertyDescription("Unique id of the asynchronous task; pass it to the matching fetch tool.")
        String taskId,

        @JsonProperty(value = "task_status", required = true)
        @JsonPropertyDescription("PENDING: queued, RUNNING: in progress, SUCCEEDED: done, "
                + "FAILED: failed, CANCELED: canceled, UNKNOWN: task missing or status unknown.")
        String taskStatus,

        @JsonProperty("request_id")
        @JsonPropertyDescription("Id of this request, for log correlation.")
        String requestId) {

    public static TaskSubmission from(TaskHandle handle) {
        return new TaskSubmission(handle.taskId(), handle.status().name(), handle.requestId());
    }
}

package com.genbridge.gateway.component;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.annotation.JsonPropertyDescription;

/**
 * Input of every fetch component.
 */
public record TaskQuery(
        @JsonProperty(value = "task_id", required = true)
        @JsonPropertyDescription("Id of the task to look up, as returned by the submit tool.")
        String taskId) {

    public TaskQuery {
        InputChecks.requireText(taskId, "task_id");
    }
}

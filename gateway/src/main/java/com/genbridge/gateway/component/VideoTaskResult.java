package com.genbridge.gateway.component;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.annotation.JsonPropertyDescription;
import com.genbridge.gateway.model.FetchOutcome;
import com.genbridge.gateway.model.GenerationResult;

/**
 * Output of the video fetch components. {@code video_url} stays null until
 * the task has SUCCEEDED.
 */
public record VideoTaskResult(
        @JsonProperty(value = "task_id", required = true)
        @JsonPropertyDescription("Task id, same as the input.")
        String taskId,

        @JsonProperty(value = "task_status", required = true)
        @JsonPropertyDescription("Current task status; poll again until it is SUCCEEDED.")
        String taskStatus,

        @JsonProperty("video_url")
        @JsonPropertyDescription("Public URL of the generated MP4 video, valid for 24 hours. Present once SUCCEEDED.")
        String videoUrl,

        @JsonProperty("request_id")
        @JsonPropertyDescription("Id of this request, for log correlation.")
        String requestId) {

    public static VideoTaskResult from(FetchOutcome outcome) {
        String videoUrl = outcome.resultIfFinished().map(GenerationResult::primaryArtifact).orElse(null);
        return new VideoTaskResult(outcome.taskId(), outcome.status().name(), videoUrl, outcome.requestId());
    }
}

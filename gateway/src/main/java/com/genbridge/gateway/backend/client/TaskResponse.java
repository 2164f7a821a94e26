package com.genbridge.gateway.backend.client;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.ArrayList;
import java.util.List;

/**
 * Typed reply of the video-synthesis task API, as returned by {@link TaskClient}.
 *
 * Success:  { "output": { "task_id", "task_status", "video_url"? }, "request_id" }
 * Failure:  { "code": "InvalidApiKey", "message": "...", "request_id" }
 *
 * {@code statusCode} is not part of the JSON body; the client fills it in from
 * the HTTP response.
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public record TaskResponse(
        int statusCode,
        @JsonProperty("request_id") String requestId,
        String code,
        String message,
        Output output) {

    public TaskResponse withStatusCode(int status) {
        return new TaskResponse(status, requestId, code, message, output);
    }

    @JsonIgnoreProperties(ignoreUnknown = true)
    public record Output(
            @JsonProperty("task_id")     String taskId,
            @JsonProperty("task_status") String taskStatus,
            @JsonProperty("video_url")   String videoUrl,
            List<Result> results,
            String code,
            String message) {

        /** Non-empty artifact references: video first, then result entries in order. */
        public List<String> artifactReferences() {
            List<String> refs = new ArrayList<>();
            if (videoUrl != null && !videoUrl.isBlank()) {
                refs.add(videoUrl);
            }
            if (results != null) {
                for (Result r : results) {
                    if (r != null && r.url() != null && !r.url().isBlank()) {
                        refs.add(r.url());
                    }
                }
            }
            return refs;
        }
    }

    @JsonIgnoreProperties(ignoreUnknown = true)
    public record Result(String url, String code, String message) {}
}

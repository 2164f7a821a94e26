package com.genbridge.gateway.component.impl;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.annotation.JsonPropertyDescription;
import com.genbridge.gateway.backend.CapabilityProfile;
import com.genbridge.gateway.backend.TransportFamily;
import com.genbridge.gateway.component.InputChecks;
import com.genbridge.gateway.component.TaskSubmitComponent;
import com.genbridge.gateway.task.AsyncTaskGateway;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Component;

import java.util.List;

import static com.genbridge.gateway.backend.FieldMapping.input;
import static com.genbridge.gateway.backend.FieldMapping.parameter;

/**
 * Submits a reference-video-to-video task (wan2.6-r2v) over REST.
 */
@Component
public class VideoToVideoSubmit extends TaskSubmitComponent<VideoToVideoSubmit.Input> {

    public static final String NAME = "modelstudio_video_to_video_wan26_submit_task";

    private static final String DESCRIPTION = """
            [version: wan2.6] Submits an asynchronous reference-to-video task (wan2.6-r2v).
            Generates a new video featuring the characters of the reference videos; returns a task_id for polling.""";

    public record Input(
            @JsonProperty(value = "prompt", required = true)
            @JsonPropertyDescription("Describes the video to generate. Refer to reference characters as character1, character2, ...")
            String prompt,

            @JsonProperty(value = "reference_video_urls", required = true)
            @JsonPropertyDescription("1 to 3 reference video URLs, one character each; order defines character1, character2, ...")
            List<String> referenceVideoUrls,

            @JsonProperty("negative_prompt")
            @JsonPropertyDescription("Content to avoid, at most 500 characters.")
            String negativePrompt,

            @JsonProperty("size")
            @JsonPropertyDescription("Output resolution, any 720P or 1080P size. Default 1920*1080.")
            String size,

            @JsonProperty("duration")
            @JsonPropertyDescription("Video length in seconds: 5 or 10. Default 5.")
            Integer duration,

            @JsonProperty("shot_type")
            @JsonPropertyDescription("'single' or 'multi' shot. Default 'single'; takes precedence over the prompt.")
            String shotType,

            @JsonProperty("watermark")
            @JsonPropertyDescription("Add the 'AI generated' watermark. Default false.")
            Boolean watermark,

            @JsonProperty("seed")
            @JsonPropertyDescription("Random seed in [0, 2147483647].")
            Integer seed) {

        public Input {
            InputChecks.requireText(prompt, "prompt");
            referenceVideoUrls = InputChecks.requireNonEmpty(referenceVideoUrls, "reference_video_urls");
            if (size == null)      size = "1920*1080";
            if (duration == null)  duration = 5;
            if (shotType == null)  shotType = "single";
            if (watermark == null) watermark = false;
        }
    }

    public VideoToVideoSubmit(AsyncTaskGateway gateway,
                              @Value("${genbridge.models.video-to-video:wan2.6-r2v}") String model) {
        super(NAME, DESCRIPTION, Input.class, gateway,
                CapabilityProfile.builder("wan26_video_to_video")
                        .model(model)
                        .resource("services/aigc/video-generation/video-synthesis")
                        .transport(TransportFamily.REST)
                        .map(input("prompt"),
                             input("reference_video_urls"),
                             input("negative_prompt"),
                             parameter("size"),
                             parameter("duration"),
                             parameter("shot_type"),
                             parameter("watermark"),
                             parameter("seed"))
                        .build());
    }
}

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

import static com.genbridge.gateway.backend.FieldMapping.input;
import static com.genbridge.gateway.backend.FieldMapping.parameter;

@Component
public class ImageToVideoSubmit extends TaskSubmitComponent<ImageToVideoSubmit.Input> {

    public static final String NAME = "modelstudio_image_to_video_wan26_submit_task";

    private static final String DESCRIPTION = """
            [version: wan2.6] Submits an asynchronous image-to-video task (wan2.6-i2v) animating a first-frame image.
            Returns a task_id; poll modelstudio_wan_video_fetch for the video URL.""";

    public record Input(
            @JsonProperty(value = "img_url", required = true)
            @JsonPropertyDescription("First frame image: public URL or Base64 data.")
            String imgUrl,

            @JsonProperty("prompt")
            @JsonPropertyDescription("Describes the motion to generate.")
            String prompt,

            @JsonProperty("negative_prompt")
            @JsonPropertyDescription("Content to avoid.")
            String negativePrompt,

            @JsonProperty("audio_url")
            @JsonPropertyDescription("Optional audio track URL the video is synchronised to.")
            String audioUrl,

            @JsonProperty("resolution")
            @JsonPropertyDescription("Video resolution: 720P or 1080P.")
            String resolution,

            @JsonProperty("duration")
            @JsonPropertyDescription("Video length in seconds.")
            Integer duration,

            @JsonProperty("prompt_extend")
            @JsonPropertyDescription("Let the provider rewrite the prompt.")
            Boolean promptExtend,

            @JsonProperty("shot_type")
            @JsonPropertyDescription("'single' or 'multi' shot.")
            String shotType,

            @JsonProperty("watermark")
            @JsonPropertyDescription("Add a watermark.")
            Boolean watermark,

            @JsonProperty("seed")
            @JsonPropertyDescription("Random seed in [0, 2147483647].")
            Integer seed) {

        public Input {
            InputChecks.requireText(imgUrl, "img_url");
        }
    }

    public ImageToVideoSubmit(AsyncTaskGateway gateway,
                              @Value("${genbridge.models.image-to-video:wan2.6-i2v}") String model) {
        super(NAME, DESCRIPTION, Input.class, gateway,
                CapabilityProfile.builder("wan26_image_to_video")
                        .model(model)
                        .resource("services/aigc/video-generation/video-synthesis")
                        .transport(TransportFamily.REST)
                        .map(input("img_url"),
                             input("prompt"),
                             input("negative_prompt"),
                             input("audio_url"),
                             parameter("resolution"),
                             parameter("duration"),
                             parameter("prompt_extend"),
                             parameter("shot_type"),
                             parameter("watermark"),
                             parameter("seed"))
                        .build());
    }
}

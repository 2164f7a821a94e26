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

/**
 * Submits a first-frame/last-frame video task (wan2.2-kf2v-flash) through the
 * typed task client.
 */
@Component
public class KeyframeToVideoSubmit extends TaskSubmitComponent<KeyframeToVideoSubmit.Input> {

    public static final String NAME = "modelstudio_image_to_video_fl_wan22_submit_task";

    private static final String DESCRIPTION = """
            [version: wan2.2] Submits an asynchronous keyframe-to-video task (wan2.2-kf2v-flash).
            Generates a smooth silent video from a first frame, a last frame and an optional text prompt.
            Returns a task_id; poll the keyframe fetch tool until the task SUCCEEDED.""";

    public record Input(
            @JsonProperty(value = "first_frame_url", required = true)
            @JsonPropertyDescription("First frame image: public URL or Base64 data.")
            String firstFrameUrl,

            @JsonProperty(value = "last_frame_url", required = true)
            @JsonPropertyDescription("Last frame image: public URL or Base64 data.")
            String lastFrameUrl,

            @JsonProperty("prompt")
            @JsonPropertyDescription("Describes the motion or change between the frames, e.g. 'camera slowly pushes in'.")
            String prompt,

            @JsonProperty("negative_prompt")
            @JsonPropertyDescription("Content to avoid, e.g. 'blur, flicker, watermark'.")
            String negativePrompt,

            @JsonProperty("resolution")
            @JsonPropertyDescription("Video resolution: 480P, 720P or 1080P. Provider default 720P.")
            String resolution,

            @JsonProperty("template")
            @JsonPropertyDescription("Effect template name; templates differ per model.")
            String template,

            @JsonProperty("prompt_extend")
            @JsonPropertyDescription("Let the provider rewrite the prompt. Provider default true.")
            Boolean promptExtend,

            @JsonProperty("watermark")
            @JsonPropertyDescription("Add a watermark. Provider default false.")
            Boolean watermark,

            @JsonProperty("seed")
            @JsonPropertyDescription("Random seed in [0, 2147483647].")
            Integer seed) {

        public Input {
            InputChecks.requireText(firstFrameUrl, "first_frame_url");
            InputChecks.requireText(lastFrameUrl, "last_frame_url");
        }
    }

    public KeyframeToVideoSubmit(AsyncTaskGateway gateway,
                                 @Value("${genbridge.models.keyframe-to-video:wan2.2-kf2v-flash}") String model) {
        super(NAME, DESCRIPTION, Input.class, gateway,
                CapabilityProfile.builder("wan22_keyframe_to_video")
                        .model(model)
                        .resource("services/aigc/image2video/video-synthesis")
                        .transport(TransportFamily.CLIENT_LIBRARY)
                        .map(input("first_frame_url"),
                             input("last_frame_url"),
                             input("prompt"),
                             input("negative_prompt"),
                             parameter("resolution"),
                             parameter("prompt_extend"),
                             parameter("watermark"),
                             parameter("seed"),
                             parameter("template"))
                        .build());
    }
}

package com.genbridge.gateway.registry;

import com.genbridge.gateway.component.GenerationComponent;
import com.genbridge.gateway.component.impl.ImageEdit;
import com.genbridge.gateway.component.impl.ImageGeneration;
import com.genbridge.gateway.component.impl.ImageToVideoSubmit;
import com.genbridge.gateway.component.impl.KeyframeToVideoFetch;
import com.genbridge.gateway.component.impl.KeyframeToVideoSubmit;
import com.genbridge.gateway.component.impl.TextToSpeech;
import com.genbridge.gateway.component.impl.TextToVideoSubmit;
import com.genbridge.gateway.component.impl.VideoToVideoSubmit;
import com.genbridge.gateway.component.impl.WanVideoFetch;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.util.LinkedHashMap;
import java.util.Map;
import java.util.stream.Stream;

/**
 * Declares which components ship in which bundle.
 */
@Configuration
public class CapabilityCatalog {

    private static final Logger log = LoggerFactory.getLogger(CapabilityCatalog.class);

    public static final String WAN26_MEDIA           = "modelstudio_wan26_media";
    public static final String WAN22_KEYFRAME_VIDEO  = "modelstudio_wan22_keyframe_video";
    public static final String QWEN_TEXT_TO_SPEECH   = "modelstudio_qwen_text_to_speech";

    private static final String WAN26_INSTRUCTIONS = """
            Wan 2.6 image and video generation.
            Image tools answer directly with image URLs. Video tools are asynchronous: \
            a submit tool returns a task_id, then call modelstudio_wan_video_fetch with it \
            until task_status is SUCCEEDED (typically 1 to 5 minutes). Video URLs expire after 24 hours.""";

    private static final String WAN22_INSTRUCTIONS = """
            Wan 2.2 keyframe-to-video. Submit a first and a last frame, then poll the fetch tool \
            with the returned task_id until task_status is SUCCEEDED.""";

    private static final String TTS_INSTRUCTIONS = """
            Qwen speech synthesis. Returns a URL of the generated audio.""";

    @Bean
    public CapabilityRegistry capabilityRegistry(ImageGeneration imageGeneration,
                                                 TextToVideoSubmit textToVideo,
                                                 ImageToVideoSubmit imageToVideo,
                                                 WanVideoFetch wanVideoFetch,
                                                 ImageEdit imageEdit,
                                                 VideoToVideoSubmit videoToVideo,
                                                 KeyframeToVideoSubmit keyframeSubmit,
                                                 KeyframeToVideoFetch keyframeFetch,
                                                 TextToSpeech textToSpeech) {
        Map<String, CapabilityBundle> bundles = new LinkedHashMap<>();
        bundles.put(WAN26_MEDIA, bundle(WAN26_INSTRUCTIONS,
                imageGeneration, textToVideo, imageToVideo, wanVideoFetch, imageEdit, videoToVideo));
        bundles.put(WAN22_KEYFRAME_VIDEO, bundle(WAN22_INSTRUCTIONS, keyframeSubmit, keyframeFetch));
        bundles.put(QWEN_TEXT_TO_SPEECH, bundle(TTS_INSTRUCTIONS, textToSpeech));

        CapabilityRegistry registry = new CapabilityRegistry(bundles);
        registry.bundles().forEach((name, bundle) ->
                log.info("Registered bundle '{}' with {} component(s)", name, bundle.components().size()));
        return registry;
    }

    static CapabilityBundle bundle(String instructions, GenerationComponent<?, ?>... components) {
        return new CapabilityBundle(instructions,
                Stream.of(components).map(GenerationComponent::spec).toList());
    }
}

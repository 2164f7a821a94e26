package com.genbridge.gateway.component.impl;

import com.genbridge.gateway.backend.CapabilityProfile;
import com.genbridge.gateway.backend.TransportFamily;
import com.genbridge.gateway.component.VideoFetchComponent;
import com.genbridge.gateway.task.AsyncTaskGateway;
import org.springframework.stereotype.Component;

/**
 * Polls a keyframe-to-video task through the typed task client.
 */
@Component
public class KeyframeToVideoFetch extends VideoFetchComponent {

    public static final String NAME = "modelstudio_image_to_video_by_first_and_last_frame_wan22_fetch_result";

    private static final String DESCRIPTION = """
            Fetches the result of a wan2.2-kf2v-flash keyframe-to-video task.
            Input the task_id; returns the task status and, once SUCCEEDED, the video URL.
            Poll after submitting until the status is SUCCEEDED. The video_url is valid for 24 hours.""";

    public KeyframeToVideoFetch(AsyncTaskGateway gateway) {
        super(NAME, DESCRIPTION, gateway,
                CapabilityProfile.builder("wan22_keyframe_to_video")
                        .transport(TransportFamily.CLIENT_LIBRARY)
                        .build());
    }
}

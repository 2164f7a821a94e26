package com.genbridge.gateway.component.impl;

import com.genbridge.gateway.backend.CapabilityProfile;
import com.genbridge.gateway.backend.TransportFamily;
import com.genbridge.gateway.component.VideoFetchComponent;
import com.genbridge.gateway.task.AsyncTaskGateway;
import org.springframework.stereotype.Component;

/**
 * Polls any wan2.6 video task (text, image or reference video input) over REST.
 */
@Component
public class WanVideoFetch extends VideoFetchComponent {

    public static final String NAME = "modelstudio_wan_video_fetch";

    private static final String DESCRIPTION = """
            Fetches the result of a Wan video generation task (text-to-video, image-to-video or video-to-video).
            Returns the task status and, once SUCCEEDED, the video URL (valid for 24 hours).""";

    public WanVideoFetch(AsyncTaskGateway gateway) {
        super(NAME, DESCRIPTION, gateway,
                CapabilityProfile.builder("wan_video")
                        .transport(TransportFamily.REST)
                        .build());
    }
}

package com.genbridge.gateway.component;

import com.genbridge.gateway.backend.CapabilityProfile;
import com.genbridge.gateway.model.InvocationContext;
import com.genbridge.gateway.task.AsyncTaskGateway;

import java.util.concurrent.CompletableFuture;

/**
 * Fetch half of a video capability: one lookup per call, in-progress
 * statuses returned with a null {@code video_url}.
 */
public abstract class VideoFetchComponent extends AbstractGenerationComponent<TaskQuery, VideoTaskResult> {

    private final AsyncTaskGateway  gateway;
    private final CapabilityProfile profile;

    protected VideoFetchComponent(String name, String description,
                                  AsyncTaskGateway gateway, CapabilityProfile profile) {
        super(name, description, TaskQuery.class, VideoTaskResult.class);
        this.gateway = gateway;
        this.profile = profile;
    }

    @Override
    public CompletableFuture<VideoTaskResult> run(TaskQuery input, InvocationContext ctx) {
        return gateway.fetch(profile, input.taskId(), ctx).thenApply(VideoTaskResult::from);
    }
}

package com.genbridge.gateway.component;

import com.genbridge.gateway.backend.CapabilityProfile;
import com.genbridge.gateway.model.GenerationResult;
import com.genbridge.gateway.model.InvocationContext;
import com.genbridge.gateway.task.AsyncTaskGateway;

import java.util.concurrent.CompletableFuture;

/**
 * Capability answered in a single round trip (no task id to poll).
 */
public abstract class SyncGenerationComponent<I, O> extends AbstractGenerationComponent<I, O> {

    private final AsyncTaskGateway  gateway;
    private final CapabilityProfile profile;

    protected SyncGenerationComponent(String name, String description, Class<I> inputType, Class<O> outputType,
                                      AsyncTaskGateway gateway, CapabilityProfile profile) {
        super(name, description, inputType, outputType);
        this.gateway = gateway;
        this.profile = profile;
    }

    public CapabilityProfile profile() {
        return profile;
    }

    @Override
    public CompletableFuture<O> run(I input, InvocationContext ctx) {
        return gateway.generate(profile, input, ctx).thenApply(this::toOutput);
    }

    protected abstract O toOutput(GenerationResult result);
}

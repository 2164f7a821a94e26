package com.genbridge.gateway.component;

import com.genbridge.gateway.backend.CapabilityProfile;
import com.genbridge.gateway.model.InvocationContext;
import com.genbridge.gateway.task.AsyncTaskGateway;

import java.util.concurrent.CompletableFuture;

/**
 * Submit half of an asynchronous capability: the whole behaviour is the
 * capability's {@link CapabilityProfile}; subclasses only declare it.
 */
public abstract class TaskSubmitComponent<I> extends AbstractGenerationComponent<I, TaskSubmission> {

    private final AsyncTaskGateway  gateway;
    private final CapabilityProfile profile;

    protected TaskSubmitComponent(String name, String description, Class<I> inputType,
                                  AsyncTaskGateway gateway, CapabilityProfile profile) {
        super(name, description, inputType, TaskSubmission.class);
        this.gateway = gateway;
        this.profile = profile;
    }

    public CapabilityProfile profile() {
        return profile;
    }

    @Override
    public CompletableFuture<TaskSubmission> run(I input, InvocationContext ctx) {
        return gateway.submit(profile, input, ctx).thenApply(TaskSubmission::from);
    }
}

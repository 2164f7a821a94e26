package com.genbridge.gateway.backend.client;

import com.genbridge.gateway.backend.BackendAdapter;
import com.genbridge.gateway.backend.BackendReply;
import com.genbridge.gateway.backend.ProviderRequest;
import com.genbridge.gateway.backend.RawReply;
import com.genbridge.gateway.backend.ReplyReducer;
import org.springframework.stereotype.Component;

import java.util.concurrent.CompletableFuture;

/**
 * Client-library transport family: delegates to a typed {@link TaskClient}
 * and reduces its reply objects.
 */
@Component
public class ClientLibraryAdapter implements BackendAdapter {

    private final TaskClient   client;
    private final ReplyReducer reducer;

    public ClientLibraryAdapter(TaskClient client, ReplyReducer reducer) {
        this.client  = client;
        this.reducer = reducer;
    }

    @Override
    public CompletableFuture<BackendReply> create(ProviderRequest request, String apiKey) {
        return client.asyncCall(request, apiKey)
                .thenApply(resp -> reducer.reduce(new RawReply.Typed(resp)));
    }

    @Override
    public CompletableFuture<BackendReply> lookup(String taskId, String apiKey) {
        return client.fetch(taskId, apiKey)
                .thenApply(resp -> reducer.reduce(new RawReply.Typed(resp)));
    }
}

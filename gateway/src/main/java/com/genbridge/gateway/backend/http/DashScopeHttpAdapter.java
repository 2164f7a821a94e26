package com.genbridge.gateway.backend.http;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.genbridge.gateway.backend.BackendAdapter;
import com.genbridge.gateway.backend.BackendReply;
import com.genbridge.gateway.backend.ProviderRequest;
import com.genbridge.gateway.backend.RawReply;
import com.genbridge.gateway.backend.ReplyReducer;
import com.genbridge.gateway.error.BackendCallException;
import org.springframework.stereotype.Component;

import java.util.concurrent.CompletableFuture;

/**
 * REST transport family: raw JSON over authenticated HTTP.
 *
 * create → POST {base-url}/{resource}   body {model, input, parameters}
 * lookup → GET  {base-url}/tasks/{taskId}
 */
@Component
public class DashScopeHttpAdapter implements BackendAdapter {

    private final ProviderHttpTransport transport;
    private final ReplyReducer          reducer;
    private final ObjectMapper          json;

    public DashScopeHttpAdapter(ProviderHttpTransport transport, ReplyReducer reducer, ObjectMapper objectMapper) {
        this.transport = transport;
        this.reducer   = reducer;
        this.json      = objectMapper;
    }

    @Override
    public CompletableFuture<BackendReply> create(ProviderRequest request, String apiKey) {
        String body;
        try {
            body = json.writeValueAsString(request.body());
        } catch (JsonProcessingException e) {
            return CompletableFuture.failedFuture(
                    new BackendCallException("Could not serialize payload for " + request.resource(), e));
        }
        return transport.post(request.resource(), body, apiKey, request.async())
                .thenApply(resp -> reducer.reduce(new RawReply.Json(resp.statusCode(), resp.body())));
    }

    @Override
    public CompletableFuture<BackendReply> lookup(String taskId, String apiKey) {
        return transport.getTask(taskId, apiKey)
                .thenApply(resp -> reducer.reduce(new RawReply.Json(resp.statusCode(), resp.body())));
    }
}

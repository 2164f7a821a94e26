package com.genbridge.gateway.backend.client;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.genbridge.gateway.backend.ProviderRequest;
import com.genbridge.gateway.backend.http.ProviderHttpTransport;
import com.genbridge.gateway.error.BackendCallException;
import com.genbridge.gateway.error.ResponseParseException;
import org.springframework.stereotype.Component;

import java.net.http.HttpResponse;
import java.util.concurrent.CompletableFuture;

/**
 * {@link TaskClient} over the DashScope task API, binding replies to
 * {@link TaskResponse} records with Jackson.
 */
@Component
public class HttpTaskClient implements TaskClient {

    private final ProviderHttpTransport transport;
    private final ObjectMapper          json;

    public HttpTaskClient(ProviderHttpTransport transport, ObjectMapper objectMapper) {
        this.transport = transport;
        this.json      = objectMapper;
    }

    @Override
    public CompletableFuture<TaskResponse> asyncCall(ProviderRequest request, String apiKey) {
        String body;
        try {
            body = json.writeValueAsString(request.body());
        } catch (JsonProcessingException e) {
            return CompletableFuture.failedFuture(
                    new BackendCallException("Could not serialize payload for " + request.resource(), e));
        }
        return transport.post(request.resource(), body, apiKey, request.async()).thenApply(this::bind);
    }

    @Override
    public CompletableFuture<TaskResponse> fetch(String taskId, String apiKey) {
        return transport.getTask(taskId, apiKey).thenApply(this::bind);
    }

    private TaskResponse bind(HttpResponse<String> resp) {
        String body = resp.body();
        try {
            TaskResponse parsed = body == null || body.isBlank()
                    ? null
                    : json.readValue(body, TaskResponse.class);
            if (parsed == null) {
                parsed = new TaskResponse(0, null, null, null, null);
            }
            return parsed.withStatusCode(resp.statusCode());
        } catch (JsonProcessingException e) {
            if (resp.statusCode() != 200) {
                return new TaskResponse(resp.statusCode(), null, null, body, null);
            }
            throw new ResponseParseException("Task reply does not match the expected shape", body, e);
        }
    }
}

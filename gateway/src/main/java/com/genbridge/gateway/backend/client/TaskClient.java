package com.genbridge.gateway.backend.client;

import com.genbridge.gateway.backend.ProviderRequest;

import java.util.concurrent.CompletableFuture;

/**
 * Typed client for the provider's task API.
 *
 * This is the "client library" transport family: callers get structured
 * {@link TaskResponse} objects instead of raw JSON. Transport failures
 * complete the future exceptionally; non-200 replies complete normally with
 * {@link TaskResponse#statusCode()} set so the caller can classify them.
 */
public interface TaskClient {

    /** Submit an asynchronous task. */
    CompletableFuture<TaskResponse> asyncCall(ProviderRequest request, String apiKey);

    /** Look up a previously submitted task by id. */
    CompletableFuture<TaskResponse> fetch(String taskId, String apiKey);
}

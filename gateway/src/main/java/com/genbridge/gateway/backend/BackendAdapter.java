package com.genbridge.gateway.backend;

import java.util.concurrent.CompletableFuture;

/**
 * Translation layer between the uniform request/reply model and one
 * provider transport.
 *
 * Implementations perform exactly one provider round trip per call and
 * reduce whatever the provider returned to a {@link BackendReply}. Non-200
 * replies are not errors at this level; they come back with
 * {@code transportOk == false}. I/O failures complete the future
 * exceptionally with a {@link com.genbridge.gateway.error.BackendCallException}.
 */
public interface BackendAdapter {

    CompletableFuture<BackendReply> create(ProviderRequest request, String apiKey);

    CompletableFuture<BackendReply> lookup(String taskId, String apiKey);
}

package com.genbridge.gateway.model;

import java.util.List;

/**
 * Artifacts of a SUCCEEDED generation.
 *
 * The URLs are provider-hosted and expire (typically after 24 hours); they are
 * passed through as-is and never downloaded.
 *
 * @param taskId    provider task id; null for synchronous capabilities that have none
 * @param artifacts artifact references in the order the provider reply listed them
 * @param requestId correlation id, never blank
 */
public record GenerationResult(String taskId, List<String> artifacts, String requestId) {

    public GenerationResult {
        if (artifacts == null || artifacts.isEmpty()) {
            throw new IllegalArgumentException("A generation result needs at least one artifact");
        }
        if (requestId == null || requestId.isBlank()) {
            throw new IllegalArgumentException("requestId must not be blank");
        }
        artifacts = List.copyOf(artifacts);
    }

    /** First artifact; the only one for single-output capabilities such as video. */
    public String primaryArtifact() {
        return artifacts.get(0);
    }
}

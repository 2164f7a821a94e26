package com.genbridge.gateway.error;

/**
 * The provider reported SUCCEEDED but no artifact reference could be found.
 */
public class EmptyResultException extends GenerationException {

    public EmptyResultException(String taskId, String rawPayload) {
        super("Task %s succeeded without any artifact".formatted(taskId), rawPayload);
    }

    @Override
    public String category() {
        return "empty_result";
    }
}

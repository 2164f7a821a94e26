package com.genbridge.gateway.model;

/**
 * Lifecycle of a provider-side generation task.
 *
 * Transitions (provider-owned, observed by polling):
 *   PENDING → RUNNING → SUCCEEDED
 *                     → FAILED
 *   PENDING | RUNNING → CANCELED
 *
 * UNKNOWN means the provider could not classify the task. It is treated as
 * non-terminal: the caller may poll again.
 */
public enum TaskStatus {
    PENDING,
    RUNNING,
    SUCCEEDED,
    FAILED,
    CANCELED,
    UNKNOWN;

    /** True once the task will never transition again. */
    public boolean isTerminal() {
        return this == SUCCEEDED || this == FAILED || this == CANCELED;
    }

    /** True for the terminal states that carry no result. */
    public boolean isFailure() {
        return this == FAILED || this == CANCELED;
    }
}

package com.genbridge.gateway.task;

import com.genbridge.gateway.model.TaskStatus;
import org.springframework.stereotype.Component;

import java.util.Locale;
import java.util.Map;

/**
 * Maps provider status vocabularies onto {@link TaskStatus}.
 *
 * Matching is case-insensitive. Anything not listed maps to UNKNOWN, which
 * callers treat as non-terminal.
 */
@Component
public class StatusNormalizer {

    private static final Map<String, TaskStatus> VOCABULARY = Map.ofEntries(
            Map.entry("PENDING",    TaskStatus.PENDING),
            Map.entry("QUEUED",     TaskStatus.PENDING),
            Map.entry("SUBMITTED",  TaskStatus.PENDING),
            Map.entry("RUNNING",    TaskStatus.RUNNING),
            Map.entry("PROCESSING", TaskStatus.RUNNING),
            Map.entry("SUSPENDED",  TaskStatus.RUNNING),
            Map.entry("SUCCEEDED",  TaskStatus.SUCCEEDED),
            Map.entry("SUCCEED",    TaskStatus.SUCCEEDED),
            Map.entry("SUCCESS",    TaskStatus.SUCCEEDED),
            Map.entry("COMPLETED",  TaskStatus.SUCCEEDED),
            Map.entry("FAILED",     TaskStatus.FAILED),
            Map.entry("FAILURE",    TaskStatus.FAILED),
            Map.entry("ERROR",      TaskStatus.FAILED),
            Map.entry("CANCELED",   TaskStatus.CANCELED),
            Map.entry("CANCELLED",  TaskStatus.CANCELED),
            Map.entry("UNKNOWN",    TaskStatus.UNKNOWN));

    public TaskStatus normalize(String providerStatus) {
        if (providerStatus == null || providerStatus.isBlank()) {
            return TaskStatus.UNKNOWN;
        }
        return VOCABULARY.getOrDefault(providerStatus.strip().toUpperCase(Locale.ROOT), TaskStatus.UNKNOWN);
    }
}

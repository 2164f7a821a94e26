package com.genbridge.gateway.error;

import com.genbridge.gateway.model.TaskStatus;

/**
 * The provider reported the task as FAILED or CANCELED.
 */
public class TerminalTaskFailureException extends GenerationException {

    private final String     taskId;
    private final TaskStatus status;

    public TerminalTaskFailureException(String taskId, TaskStatus status, String rawPayload) {
        super("Task %s ended with status %s".formatted(taskId, status), rawPayload);
        this.taskId = taskId;
        this.status = status;
    }

    public String taskId() { return taskId; }

    public TaskStatus status() { return status; }

    @Override
    public String category() {
        return "terminal_task_failure";
    }
}

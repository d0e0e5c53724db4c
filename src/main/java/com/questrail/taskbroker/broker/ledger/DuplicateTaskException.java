package com.questrail.taskbroker.broker.ledger;

/**
 * Thrown when a task id is admitted while an earlier task with the same id is
 * still pending. Task ids are unique across all producers.
 */
public final class DuplicateTaskException extends RuntimeException
{
    private final String taskId;

    public DuplicateTaskException(String taskId) {
        super("Task id already pending: " + taskId);
        this.taskId = taskId;
    }

    public String taskId() {
        return taskId;
    }
}

package com.questrail.taskbroker.broker.registry;

/**
 * Thrown when an executor id is registered while another live connection
 * already holds it.
 */
public final class DuplicateExecutorException extends RuntimeException
{
    private final String executorId;

    public DuplicateExecutorException(String executorId) {
        super("Executor already registered: " + executorId);
        this.executorId = executorId;
    }

    public String executorId() {
        return executorId;
    }
}

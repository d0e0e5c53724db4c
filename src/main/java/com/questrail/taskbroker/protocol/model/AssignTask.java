package com.questrail.taskbroker.protocol.model;

import java.util.List;
import java.util.Objects;

/**
 * {@code ASSIGN_TASK|task_id|payload}: hands a task to an idle executor.
 */
public record AssignTask(String taskId, String payload) implements ExecutorCommand
{
    public AssignTask {
        Objects.requireNonNull(taskId, "taskId");
        Objects.requireNonNull(payload, "payload");
    }

    @Override
    public MessageType type() {
        return MessageType.ASSIGN_TASK;
    }

    @Override
    public List<String> fields() {
        return List.of(taskId, payload);
    }
}

package com.questrail.taskbroker.protocol.model;

import java.util.List;
import java.util.Objects;

/**
 * {@code TASK_REJECTED|task_id|reason}: a submission was refused at
 * admission and was never dispatched. Any earlier task with the same id is
 * unaffected.
 */
public record TaskRejected(String taskId, String reason) implements ProducerReply
{
    public TaskRejected {
        Objects.requireNonNull(taskId, "taskId");
        Objects.requireNonNull(reason, "reason");
    }

    @Override
    public MessageType type() {
        return MessageType.TASK_REJECTED;
    }

    @Override
    public List<String> fields() {
        return List.of(taskId, reason);
    }
}

package com.questrail.taskbroker.protocol.model;

import java.util.List;
import java.util.Objects;

/**
 * {@code TASK_FAILED|task_id|reason}: an admitted task will never produce a
 * result, either because no executor could be obtained within the retry
 * budget or because the executors holding it were lost.
 */
public record TaskFailed(String taskId, String reason) implements ProducerReply
{
    public TaskFailed {
        Objects.requireNonNull(taskId, "taskId");
        Objects.requireNonNull(reason, "reason");
    }

    @Override
    public MessageType type() {
        return MessageType.TASK_FAILED;
    }

    @Override
    public List<String> fields() {
        return List.of(taskId, reason);
    }
}

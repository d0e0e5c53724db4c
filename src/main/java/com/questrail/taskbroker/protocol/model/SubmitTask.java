package com.questrail.taskbroker.protocol.model;

import java.util.List;
import java.util.Objects;

/**
 * {@code TASK|task_id|payload}: a producer submits one unit of work.
 *
 * <p>The payload is opaque to the broker and is forwarded unchanged.</p>
 */
public record SubmitTask(String taskId, String payload) implements ProducerMessage
{
    public SubmitTask {
        Objects.requireNonNull(taskId, "taskId");
        Objects.requireNonNull(payload, "payload");
    }

    @Override
    public MessageType type() {
        return MessageType.TASK;
    }

    @Override
    public List<String> fields() {
        return List.of(taskId, payload);
    }
}

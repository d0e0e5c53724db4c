package com.questrail.taskbroker.protocol.model;

import java.util.List;
import java.util.Objects;

/**
 * {@code RESULT|task_id|result}: the executor's result, relayed to the
 * producer that submitted the task.
 */
public record DeliverResult(String taskId, String result) implements ProducerReply
{
    public DeliverResult {
        Objects.requireNonNull(taskId, "taskId");
        Objects.requireNonNull(result, "result");
    }

    @Override
    public MessageType type() {
        return MessageType.RESULT;
    }

    @Override
    public List<String> fields() {
        return List.of(taskId, result);
    }
}

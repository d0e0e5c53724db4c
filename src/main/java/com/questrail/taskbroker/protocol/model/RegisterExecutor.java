package com.questrail.taskbroker.protocol.model;

import java.util.List;
import java.util.Objects;

/**
 * {@code REGISTER|executor_id}: the mandatory first line on an executor
 * connection.
 */
public record RegisterExecutor(String executorId) implements ExecutorMessage
{
    public RegisterExecutor {
        Objects.requireNonNull(executorId, "executorId");
    }

    @Override
    public MessageType type() {
        return MessageType.REGISTER;
    }

    @Override
    public List<String> fields() {
        return List.of(executorId);
    }
}

package com.questrail.taskbroker.protocol.model;

import java.util.List;
import java.util.Objects;

/**
 * {@code ACK|executor_id}: confirms a registration. Always written before the
 * executor can be selected for work.
 */
public record RegisterAck(String executorId) implements ExecutorCommand
{
    public RegisterAck {
        Objects.requireNonNull(executorId, "executorId");
    }

    @Override
    public MessageType type() {
        return MessageType.ACK;
    }

    @Override
    public List<String> fields() {
        return List.of(executorId);
    }
}

package com.questrail.taskbroker.protocol.model;

import java.util.List;
import java.util.Objects;

/**
 * {@code TASK_RESULT|task_id|result}: an executor finished the task it was
 * assigned. Receiving this returns the executor to the idle pool.
 */
public record ReportResult(String taskId, String result) implements ExecutorMessage
{
    public ReportResult {
        Objects.requireNonNull(taskId, "taskId");
        Objects.requireNonNull(result, "result");
    }

    @Override
    public MessageType type() {
        return MessageType.TASK_RESULT;
    }

    @Override
    public List<String> fields() {
        return List.of(taskId, result);
    }
}

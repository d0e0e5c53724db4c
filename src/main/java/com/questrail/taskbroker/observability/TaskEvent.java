package com.questrail.taskbroker.observability;

import java.time.Instant;

/**
 * Record representing a step in a task's life inside the broker.
 *
 * @param executorId executor involved, or {@code null} when none is
 * @param detail     free-form context, may be {@code null}
 */
public record TaskEvent(
    Instant timestamp,
    Kind kind,
    String taskId,
    String executorId,
    String detail
) {
    public enum Kind {
        ADMITTED,
        REJECTED,
        ASSIGNED,
        RETRY_SCHEDULED,
        COMPLETED,
        REDELIVERED,
        FAILED,
        ORPHANED,
        RESULT_DISCARDED
    }
}

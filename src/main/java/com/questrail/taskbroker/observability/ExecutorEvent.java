package com.questrail.taskbroker.observability;

import java.time.Instant;

/**
 * Record representing a change in executor pool membership.
 *
 * @param heldTaskId task the executor held when it left, or {@code null}
 */
public record ExecutorEvent(
    Instant timestamp,
    Kind kind,
    String executorId,
    String connectionId,
    String heldTaskId
) {
    public enum Kind {
        REGISTERED,
        REFUSED,
        EVICTED
    }
}

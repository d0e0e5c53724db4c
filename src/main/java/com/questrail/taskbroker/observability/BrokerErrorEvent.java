package com.questrail.taskbroker.observability;

import java.time.Instant;

/**
 * Record representing an unexpected failure in the broker.
 */
public record BrokerErrorEvent(
    Instant timestamp,
    String message,
    Throwable cause
) {
}

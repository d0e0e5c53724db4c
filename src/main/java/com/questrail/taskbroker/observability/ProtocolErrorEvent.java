package com.questrail.taskbroker.observability;

import java.time.Instant;

/**
 * Record representing a malformed or unexpected inbound line.
 *
 * @param line offending line, possibly abbreviated; {@code null} if it
 *             never reached the codec (for example an over-long line)
 */
public record ProtocolErrorEvent(
    Instant timestamp,
    String endpoint,
    String connectionId,
    String line,
    String message
) {
}

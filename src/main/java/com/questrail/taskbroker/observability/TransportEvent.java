package com.questrail.taskbroker.observability;

import java.net.SocketAddress;
import java.time.Instant;

/**
 * Record representing endpoint and connection lifecycle.
 *
 * @param endpoint     endpoint name ({@code producer} or {@code executor})
 * @param connectionId connection id, {@code null} for endpoint-level events
 * @param address      local address for UP, remote address for connection events
 * @param cause        failure cause, {@code null} for orderly transitions
 */
public record TransportEvent(
    Instant timestamp,
    String endpoint,
    Kind kind,
    String connectionId,
    SocketAddress address,
    Throwable cause
) {
    public enum Kind {
        ENDPOINT_UP,
        ENDPOINT_DOWN,
        CONNECTION_OPENED,
        CONNECTION_CLOSED
    }
}

package com.questrail.taskbroker.api;

import com.questrail.taskbroker.transport.ConnectionHandle;

import java.util.Objects;

/**
 * Task
 * =============================================================================
 * One unit of work admitted from a producer connection.
 *
 * <p>Immutable. The broker never inspects the payload; it is forwarded to an
 * executor exactly as received.</p>
 *
 * <p>Instances are compared by identity where it matters: a retry scheduled
 * for one admission of {@code t1} must not act on a later admission that
 * happens to reuse the id {@code t1}. See
 * {@link com.questrail.taskbroker.broker.ledger.PendingWorkLedger}.</p>
 *
 * @param id      opaque task identifier chosen by the producer
 * @param payload opaque work description
 * @param origin  producer connection that must receive the result
 */
public record Task(String id, String payload, ConnectionHandle origin)
{
    public Task {
        Objects.requireNonNull(id, "id");
        Objects.requireNonNull(payload, "payload");
        Objects.requireNonNull(origin, "origin");
    }

    @Override
    public String toString() {
        return "Task[id=" + id + ", payloadLength=" + payload.length() + ", origin=" + origin.id() + ']';
    }
}

package com.questrail.taskbroker.transport;

import java.net.SocketAddress;
import java.util.concurrent.CompletionStage;

/**
 * ConnectionHandle
 * -----------------------------------------------------------------------------
 * Opaque handle for one accepted stream connection.
 *
 * <p>This is the only view the broker core has of a socket. It exists so that
 * the registry, ledger and sessions can be exercised with fake handles, and
 * so that no transport framework type is stored in broker state.</p>
 *
 * <h2>Concurrency</h2>
 * {@link #send(String)} may be called from any thread. Implementations MUST
 * serialize concurrent writers so that lines are never interleaved; a
 * producer connection receives results written from whichever executor
 * session resolved them.
 */
public interface ConnectionHandle
{
    /**
     * Stable identifier, unique among live connections. Used for logging and
     * events; the broker keys its own state by the handle instance, of which
     * an endpoint creates exactly one per connection.
     */
    String id();

    /**
     * Remote peer address, for diagnostics only.
     */
    SocketAddress remoteAddress();

    /**
     * Write one already-encoded, terminated line.
     *
     * @return stage completing when the write is flushed, or exceptionally if
     *         the connection is closed or the write fails
     */
    CompletionStage<Void> send(String line);

    /**
     * Close the connection. Idempotent. The endpoint reports the closure to
     * its listener as usual.
     */
    void close();

    /**
     * Whether the connection can still carry writes.
     */
    boolean isOpen();
}

package com.questrail.taskbroker.transport;

import java.net.SocketAddress;

/**
 * LineEndpointListener
 * -----------------------------------------------------------------------------
 * Callback sink for {@link LineEndpoint}.
 *
 * <p>Callbacks for a single connection are delivered serially and in order:
 * {@code onConnectionOpened}, any number of {@code onLine} /
 * {@code onFramingError}, then exactly one {@code onConnectionClosed}.
 * Callbacks for different connections may run concurrently.</p>
 */
public interface LineEndpointListener
{
    /**
     * The endpoint is listening.
     *
     * @param localAddress bound address
     */
    void onTransportUp(SocketAddress localAddress);

    /**
     * The endpoint stopped listening.
     *
     * @param cause failure cause, or {@code null} for an orderly stop
     */
    void onTransportDown(Throwable cause);

    /**
     * A connection was accepted.
     */
    void onConnectionOpened(ConnectionHandle connection);

    /**
     * One complete line arrived, terminator removed.
     */
    void onLine(ConnectionHandle connection, String line);

    /**
     * Inbound bytes could not be framed into a line (for example the line
     * exceeded the configured maximum length). The offending bytes have been
     * discarded and the connection remains open.
     */
    void onFramingError(ConnectionHandle connection, Throwable cause);

    /**
     * The connection closed.
     *
     * @param cause I/O failure, or {@code null} for an orderly close
     */
    void onConnectionClosed(ConnectionHandle connection, Throwable cause);
}

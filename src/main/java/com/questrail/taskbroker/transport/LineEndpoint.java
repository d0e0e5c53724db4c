package com.questrail.taskbroker.transport;

import java.net.InetSocketAddress;
import java.util.Optional;

/**
 * LineEndpoint
 * -----------------------------------------------------------------------------
 * Port for a listening, line-delimited stream transport (TCP-style).
 *
 * <p>The endpoint accepts connections, splits inbound bytes into UTF-8 lines
 * and reports them, unchanged, to its {@link LineEndpointListener}. Higher
 * layers are responsible for:</p>
 * <ul>
 *   <li>decoding lines into broker messages</li>
 *   <li>owning per-connection session state</li>
 *   <li>deciding when to write and when to close</li>
 * </ul>
 *
 * <p>Implementations may be backed by Netty, plain sockets, or a test harness.</p>
 */
public interface LineEndpoint
{
    /**
     * Bind and begin accepting connections.
     *
     * <p>Returns once the endpoint is listening, after notifying
     * {@link LineEndpointListener#onTransportUp(java.net.SocketAddress)}.</p>
     *
     * @throws IllegalStateException if the listener is missing or binding fails
     */
    void start();

    /**
     * Close every accepted connection and the listening socket, then release
     * transport resources. Each open connection is reported as closed.
     */
    void stop();

    /**
     * Register the listener. Must be called before {@link #start()}.
     */
    void setListener(LineEndpointListener listener);

    /**
     * Bound address while listening; empty before start and after stop.
     * Useful when binding to port 0.
     */
    Optional<InetSocketAddress> localAddress();
}

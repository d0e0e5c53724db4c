package com.questrail.taskbroker.transport;

import com.questrail.taskbroker.internal.time.WallClock;
import com.questrail.taskbroker.observability.BrokerErrorEvent;
import com.questrail.taskbroker.observability.BrokerObservabilitySink;
import com.questrail.taskbroker.observability.ProtocolErrorEvent;
import com.questrail.taskbroker.observability.TransportEvent;

import java.net.SocketAddress;
import java.util.Objects;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;

/**
 * SessionTransportAdapter
 * =============================================================================
 * Binds connections accepted by a {@link LineEndpoint} to {@link LineSession}s.
 *
 * <h2>Inbound path</h2>
 * <pre>
 *   LineEndpoint
 *        → SessionTransportAdapter   (connection handle → session)
 *            → LineSession.onLine / onClosed
 * </pre>
 *
 * <p>One session is created per accepted connection and discarded when the
 * connection closes. A runtime exception thrown by a session is reported as
 * a broker error and does not close the connection; the endpoint keeps
 * reading.</p>
 */
public final class SessionTransportAdapter implements LineEndpointListener {

    private final String endpointName;
    private final LineEndpoint endpoint;
    private final LineSessionFactory sessionFactory;
    private final BrokerObservabilitySink observabilitySink;
    private final WallClock wallClock;

    /** Keyed by handle identity; endpoints hand out one handle per connection. */
    private final ConcurrentMap<ConnectionHandle, LineSession> sessions = new ConcurrentHashMap<>();

    public SessionTransportAdapter(String endpointName,
                                   LineEndpoint endpoint,
                                   LineSessionFactory sessionFactory,
                                   BrokerObservabilitySink observabilitySink,
                                   WallClock wallClock) {
        this.endpointName = Objects.requireNonNull(endpointName, "endpointName");
        this.endpoint = Objects.requireNonNull(endpoint, "endpoint");
        this.sessionFactory = Objects.requireNonNull(sessionFactory, "sessionFactory");
        this.observabilitySink = Objects.requireNonNull(observabilitySink, "observabilitySink");
        this.wallClock = Objects.requireNonNull(wallClock, "wallClock");

        this.endpoint.setListener(this);
    }

    public void start() {
        endpoint.start();
    }

    public void stop() {
        endpoint.stop();
    }

    public LineEndpoint endpoint() {
        return endpoint;
    }

    /**
     * Number of connections that currently own a session.
     */
    public int activeSessions() {
        return sessions.size();
    }

    // -------------------------------------------------------------------------
    // LineEndpointListener
    // -------------------------------------------------------------------------

    @Override
    public void onTransportUp(SocketAddress localAddress) {
        observabilitySink.onTransportEvent(new TransportEvent(
                wallClock.now(), endpointName, TransportEvent.Kind.ENDPOINT_UP, null, localAddress, null));
    }

    @Override
    public void onTransportDown(Throwable cause) {
        observabilitySink.onTransportEvent(new TransportEvent(
                wallClock.now(), endpointName, TransportEvent.Kind.ENDPOINT_DOWN, null, null, cause));
    }

    @Override
    public void onConnectionOpened(ConnectionHandle connection) {
        Objects.requireNonNull(connection, "connection");

        observabilitySink.onTransportEvent(new TransportEvent(
                wallClock.now(), endpointName, TransportEvent.Kind.CONNECTION_OPENED,
                connection.id(), connection.remoteAddress(), null));

        sessions.put(connection, sessionFactory.open(connection));
    }

    @Override
    public void onLine(ConnectionHandle connection, String line) {
        LineSession session = sessions.get(connection);
        if (session == null) {
            return;
        }

        try {
            session.onLine(line);
        } catch (RuntimeException e) {
            observabilitySink.onError(new BrokerErrorEvent(
                    wallClock.now(),
                    endpointName + " session " + connection.id() + " failed to handle a line",
                    e));
        }
    }

    @Override
    public void onFramingError(ConnectionHandle connection, Throwable cause) {
        observabilitySink.onProtocolError(new ProtocolErrorEvent(
                wallClock.now(), endpointName, connection.id(), null, String.valueOf(cause.getMessage())));
    }

    @Override
    public void onConnectionClosed(ConnectionHandle connection, Throwable cause) {
        LineSession session = sessions.remove(connection);

        observabilitySink.onTransportEvent(new TransportEvent(
                wallClock.now(), endpointName, TransportEvent.Kind.CONNECTION_CLOSED,
                connection.id(), connection.remoteAddress(), cause));

        if (session == null) {
            return;
        }

        try {
            session.onClosed(cause);
        } catch (RuntimeException e) {
            observabilitySink.onError(new BrokerErrorEvent(
                    wallClock.now(),
                    endpointName + " session " + connection.id() + " failed during close",
                    e));
        }
    }
}

package com.questrail.taskbroker.transport.tcp.netty;

import com.questrail.taskbroker.transport.ConnectionHandle;
import com.questrail.taskbroker.transport.LineEndpointListener;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.io.BufferedReader;
import java.io.InputStreamReader;
import java.io.OutputStream;
import java.net.InetSocketAddress;
import java.net.Socket;
import java.net.SocketAddress;
import java.nio.charset.StandardCharsets;
import java.util.List;
import java.util.concurrent.BlockingQueue;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.LinkedBlockingQueue;
import java.util.concurrent.TimeUnit;

import static org.junit.jupiter.api.Assertions.*;

/**
 * NettyLineEndpointTest
 * -----------------------------------------------------------------------------
 * Line framing and connection lifecycle over a real loopback socket.
 */
class NettyLineEndpointTest {

    private static final class RecordingListener implements LineEndpointListener {
        final CountDownLatch up = new CountDownLatch(1);
        final BlockingQueue<ConnectionHandle> opened = new LinkedBlockingQueue<>();
        final BlockingQueue<String> lines = new LinkedBlockingQueue<>();
        final List<Throwable> framingErrors = new CopyOnWriteArrayList<>();
        final CountDownLatch closed = new CountDownLatch(1);

        @Override public void onTransportUp(SocketAddress localAddress) { up.countDown(); }
        @Override public void onTransportDown(Throwable cause) { }
        @Override public void onConnectionOpened(ConnectionHandle connection) { opened.add(connection); }
        @Override public void onLine(ConnectionHandle connection, String line) { lines.add(line); }
        @Override public void onFramingError(ConnectionHandle connection, Throwable cause) { framingErrors.add(cause); }
        @Override public void onConnectionClosed(ConnectionHandle connection, Throwable cause) { closed.countDown(); }
    }

    private NettyLineEndpoint endpoint;
    private RecordingListener listener;

    @BeforeEach
    void setUp() {
        endpoint = new NettyLineEndpoint("test", new InetSocketAddress("127.0.0.1", 0), 16);
        listener = new RecordingListener();
        endpoint.setListener(listener);
        endpoint.start();
    }

    @AfterEach
    void tearDown() {
        endpoint.stop();
    }

    private Socket connect() throws Exception {
        Socket socket = new Socket();
        socket.connect(endpoint.localAddress().orElseThrow(), 2000);
        socket.setSoTimeout(5000);
        return socket;
    }

    @Test
    void startBindsAnEphemeralPort() throws InterruptedException {
        assertTrue(listener.up.await(1, TimeUnit.SECONDS));
        assertTrue(endpoint.localAddress().orElseThrow().getPort() > 0);
    }

    @Test
    void linesArriveWithoutTerminators() throws Exception {
        try (Socket socket = connect()) {
            OutputStream out = socket.getOutputStream();
            out.write("TASK|t1|x\r\nACK|e1\n".getBytes(StandardCharsets.UTF_8));
            out.flush();

            assertEquals("TASK|t1|x", listener.lines.poll(2, TimeUnit.SECONDS));
            assertEquals("ACK|e1", listener.lines.poll(2, TimeUnit.SECONDS));
        }
    }

    @Test
    void overlongLineIsReportedAndConnectionSurvives() throws Exception {
        try (Socket socket = connect()) {
            OutputStream out = socket.getOutputStream();
            out.write(("x".repeat(40) + "\nok\n").getBytes(StandardCharsets.UTF_8));
            out.flush();

            assertEquals("ok", listener.lines.poll(2, TimeUnit.SECONDS));
            assertFalse(listener.framingErrors.isEmpty());
        }
    }

    @Test
    void handleWritesReachThePeer() throws Exception {
        try (Socket socket = connect()) {
            ConnectionHandle handle = listener.opened.poll(2, TimeUnit.SECONDS);
            assertNotNull(handle);
            assertTrue(handle.isOpen());

            handle.send("RESULT|t1|15\n").toCompletableFuture().get(2, TimeUnit.SECONDS);

            BufferedReader reader = new BufferedReader(
                    new InputStreamReader(socket.getInputStream(), StandardCharsets.UTF_8));
            assertEquals("RESULT|t1|15", reader.readLine());
        }
    }

    @Test
    void peerCloseIsReportedAndFurtherSendsFail() throws Exception {
        ConnectionHandle handle;
        try (Socket socket = connect()) {
            handle = listener.opened.poll(2, TimeUnit.SECONDS);
            assertNotNull(handle);
        }

        assertTrue(listener.closed.await(2, TimeUnit.SECONDS));
        assertFalse(handle.isOpen());
        assertTrue(handle.send("ACK|e1\n").toCompletableFuture().isCompletedExceptionally());
    }

    @Test
    void closingTheHandleClosesTheSocket() throws Exception {
        try (Socket socket = connect()) {
            ConnectionHandle handle = listener.opened.poll(2, TimeUnit.SECONDS);
            assertNotNull(handle);

            handle.close();

            assertEquals(-1, socket.getInputStream().read());
            assertTrue(listener.closed.await(2, TimeUnit.SECONDS));
        }
    }
}

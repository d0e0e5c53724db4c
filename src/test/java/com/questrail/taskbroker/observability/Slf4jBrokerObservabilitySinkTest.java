package com.questrail.taskbroker.observability;

import ch.qos.logback.classic.Level;
import ch.qos.logback.classic.Logger;
import ch.qos.logback.classic.spi.ILoggingEvent;
import ch.qos.logback.core.read.ListAppender;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.net.InetSocketAddress;
import java.time.Instant;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Checks the log level chosen for each kind of broker event.
 */
class Slf4jBrokerObservabilitySinkTest {

    private final Slf4jBrokerObservabilitySink sink = new Slf4jBrokerObservabilitySink();
    private final Logger logger = (Logger) LoggerFactory.getLogger(Slf4jBrokerObservabilitySink.class);
    private final ListAppender<ILoggingEvent> appender = new ListAppender<>();
    private Level previousLevel;

    @BeforeEach
    void attach() {
        previousLevel = logger.getLevel();
        logger.setLevel(Level.DEBUG);
        appender.start();
        logger.addAppender(appender);
    }

    @AfterEach
    void detach() {
        logger.detachAppender(appender);
        logger.setLevel(previousLevel);
    }

    private Level lastLevel() {
        return appender.list.get(appender.list.size() - 1).getLevel();
    }

    @Test
    void routineTaskTrafficIsDebug() {
        sink.onTaskEvent(new TaskEvent(Instant.EPOCH, TaskEvent.Kind.ASSIGNED, "t1", "e1", null));
        assertEquals(Level.DEBUG, lastLevel());
    }

    @Test
    void lostWorkIsWarn() {
        sink.onTaskEvent(new TaskEvent(Instant.EPOCH, TaskEvent.Kind.FAILED, "t1", null, "executor lost"));
        assertEquals(Level.WARN, lastLevel());

        sink.onExecutorEvent(new ExecutorEvent(Instant.EPOCH, ExecutorEvent.Kind.EVICTED, "e1", "c1", "t1"));
        assertEquals(Level.WARN, lastLevel());
    }

    @Test
    void poolMembershipIsInfo() {
        sink.onExecutorEvent(new ExecutorEvent(Instant.EPOCH, ExecutorEvent.Kind.REGISTERED, "e1", "c1", null));
        assertEquals(Level.INFO, lastLevel());

        sink.onExecutorEvent(new ExecutorEvent(Instant.EPOCH, ExecutorEvent.Kind.EVICTED, "e1", "c1", null));
        assertEquals(Level.INFO, lastLevel());
    }

    @Test
    void endpointFailureIsError() {
        sink.onTransportEvent(new TransportEvent(Instant.EPOCH, "producer", TransportEvent.Kind.ENDPOINT_DOWN,
                null, null, new IOException("bind failed")));
        assertEquals(Level.ERROR, lastLevel());

        sink.onTransportEvent(new TransportEvent(Instant.EPOCH, "producer", TransportEvent.Kind.ENDPOINT_UP,
                null, new InetSocketAddress(8888), null));
        assertEquals(Level.INFO, lastLevel());
    }

    @Test
    void protocolAndBrokerErrors() {
        sink.onProtocolError(new ProtocolErrorEvent(Instant.EPOCH, "executor", "c1", "HELLO", "Unframeable line"));
        assertEquals(Level.WARN, lastLevel());

        sink.onError(new BrokerErrorEvent(Instant.EPOCH, "boom", new IllegalStateException()));
        assertEquals(Level.ERROR, lastLevel());
        assertNotNull(appender.list.get(appender.list.size() - 1).getThrowableProxy());
    }

    @Test
    void nullSinkAcceptsEverything() {
        BrokerObservabilitySink quiet = NullObservabilitySink.INSTANCE;

        assertDoesNotThrow(() -> {
            quiet.onTaskEvent(new TaskEvent(Instant.EPOCH, TaskEvent.Kind.ADMITTED, "t1", null, null));
            quiet.onExecutorEvent(new ExecutorEvent(Instant.EPOCH, ExecutorEvent.Kind.REFUSED, null, "c1", null));
            quiet.onError(new BrokerErrorEvent(Instant.EPOCH, "ignored", null));
        });
    }
}

package com.questrail.taskbroker.broker;

import com.questrail.taskbroker.internal.time.WallClock;
import com.questrail.taskbroker.observability.BrokerErrorEvent;
import com.questrail.taskbroker.observability.BrokerObservabilitySink;
import com.questrail.taskbroker.protocol.LineCodec;
import com.questrail.taskbroker.protocol.ProtocolException;
import com.questrail.taskbroker.protocol.model.BrokerMessage;
import com.questrail.taskbroker.transport.ConnectionHandle;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Objects;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionStage;

/**
 * MessageWriter
 * =============================================================================
 * Outbound path shared by sessions and the dispatch engine:
 *
 * <pre>
 *   BrokerMessage → LineCodec.encode → ConnectionHandle.send
 * </pre>
 *
 * <p>An encode failure is a broker defect (a field that cannot be put on the
 * wire) and is reported as a broker error. A failed write is returned to the
 * caller, which decides whether it matters: a lost {@code ASSIGN_TASK} does,
 * a {@code RESULT} to a producer that already left does not.</p>
 */
public final class MessageWriter {
    private static final Logger log = LoggerFactory.getLogger(MessageWriter.class);

    private final LineCodec codec;
    private final BrokerObservabilitySink observabilitySink;
    private final WallClock wallClock;

    public MessageWriter(LineCodec codec, BrokerObservabilitySink observabilitySink, WallClock wallClock) {
        this.codec = Objects.requireNonNull(codec, "codec");
        this.observabilitySink = Objects.requireNonNull(observabilitySink, "observabilitySink");
        this.wallClock = Objects.requireNonNull(wallClock, "wallClock");
    }

    public CompletionStage<Void> write(ConnectionHandle connection, BrokerMessage message) {
        Objects.requireNonNull(connection, "connection");
        Objects.requireNonNull(message, "message");

        final String line;
        try {
            line = codec.encode(message);
        } catch (ProtocolException e) {
            observabilitySink.onError(new BrokerErrorEvent(
                    wallClock.now(),
                    "Cannot encode " + message.type() + " for connection " + connection.id(),
                    e));
            return CompletableFuture.failedFuture(e);
        }

        CompletionStage<Void> sent = connection.send(line);
        sent.whenComplete((ignored, failure) -> {
            if (failure != null) {
                log.debug("Write of {} to connection {} failed: {}", message.type(), connection.id(), failure.toString());
            }
        });
        return sent;
    }
}

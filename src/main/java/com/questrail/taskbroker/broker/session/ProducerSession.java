package com.questrail.taskbroker.broker.session;

import com.questrail.taskbroker.api.Task;
import com.questrail.taskbroker.broker.MessageWriter;
import com.questrail.taskbroker.broker.dispatch.TaskDispatcher;
import com.questrail.taskbroker.broker.ledger.DuplicateTaskException;
import com.questrail.taskbroker.broker.ledger.PendingWorkLedger;
import com.questrail.taskbroker.internal.time.WallClock;
import com.questrail.taskbroker.observability.BrokerObservabilitySink;
import com.questrail.taskbroker.observability.ProtocolErrorEvent;
import com.questrail.taskbroker.observability.TaskEvent;
import com.questrail.taskbroker.protocol.LineCodec;
import com.questrail.taskbroker.protocol.ProtocolException;
import com.questrail.taskbroker.protocol.model.BrokerMessage;
import com.questrail.taskbroker.protocol.model.SubmitTask;
import com.questrail.taskbroker.protocol.model.TaskRejected;
import com.questrail.taskbroker.transport.ConnectionHandle;
import com.questrail.taskbroker.transport.LineSession;

import java.util.List;
import java.util.Objects;

/**
 * ProducerSession
 * =============================================================================
 * Admission loop for one producer connection.
 *
 * <h2>States</h2>
 * <pre>
 *   OPEN ──(connection closed)──► CLOSED
 * </pre>
 *
 * <p>While OPEN every {@code TASK} line becomes a {@link Task} whose origin is
 * this connection. The task is written to the ledger and handed to the
 * dispatcher; the session never waits for an executor. Results arrive on the
 * connection later, written by whichever executor session resolves the task.</p>
 *
 * <p>Malformed lines and messages a producer may not send are reported and
 * skipped. They never close the connection.</p>
 *
 * <p>On close every task still pending for this producer is dropped from the
 * ledger, so a result that arrives afterwards is discarded rather than
 * written to a dead connection.</p>
 */
public final class ProducerSession implements LineSession
{
    public static final String ENDPOINT = "producer";

    public enum State {
        OPEN,
        CLOSED
    }

    private final ConnectionHandle connection;
    private final LineCodec codec;
    private final PendingWorkLedger ledger;
    private final TaskDispatcher dispatcher;
    private final MessageWriter writer;
    private final BrokerObservabilitySink observabilitySink;
    private final WallClock wallClock;

    private volatile State state = State.OPEN;

    public ProducerSession(ConnectionHandle connection,
                           LineCodec codec,
                           PendingWorkLedger ledger,
                           TaskDispatcher dispatcher,
                           MessageWriter writer,
                           BrokerObservabilitySink observabilitySink,
                           WallClock wallClock)
    {
        this.connection = Objects.requireNonNull(connection, "connection");
        this.codec = Objects.requireNonNull(codec, "codec");
        this.ledger = Objects.requireNonNull(ledger, "ledger");
        this.dispatcher = Objects.requireNonNull(dispatcher, "dispatcher");
        this.writer = Objects.requireNonNull(writer, "writer");
        this.observabilitySink = Objects.requireNonNull(observabilitySink, "observabilitySink");
        this.wallClock = Objects.requireNonNull(wallClock, "wallClock");
    }

    @Override
    public void onLine(String line) {
        if (state != State.OPEN || line.isBlank()) {
            return;
        }

        final BrokerMessage message;
        try {
            message = codec.decode(line);
        } catch (ProtocolException e) {
            protocolError(line, e.getMessage());
            return;
        }

        if (message instanceof SubmitTask submit) {
            admit(submit);
        } else {
            protocolError(line, message.type() + " is not accepted from producers");
        }
    }

    @Override
    public void onClosed(Throwable cause) {
        if (state == State.CLOSED) {
            return;
        }
        state = State.CLOSED;

        List<Task> orphaned = ledger.dropAllFor(connection);
        for (Task task : orphaned) {
            taskEvent(TaskEvent.Kind.ORPHANED, task.id(), "producer " + connection.id() + " disconnected");
        }
    }

    public State state() {
        return state;
    }

    public ConnectionHandle connection() {
        return connection;
    }

    private void admit(SubmitTask submit) {
        Task task = new Task(submit.taskId(), submit.payload(), connection);

        try {
            ledger.put(task);
        } catch (DuplicateTaskException e) {
            taskEvent(TaskEvent.Kind.REJECTED, task.id(), "duplicate task id");
            writer.write(connection, new TaskRejected(task.id(), "duplicate task id"));
            return;
        }

        taskEvent(TaskEvent.Kind.ADMITTED, task.id(), null);
        dispatcher.dispatch(task);
    }

    private void taskEvent(TaskEvent.Kind kind, String taskId, String detail) {
        observabilitySink.onTaskEvent(new TaskEvent(wallClock.now(), kind, taskId, null, detail));
    }

    private void protocolError(String line, String message) {
        observabilitySink.onProtocolError(new ProtocolErrorEvent(
                wallClock.now(), ENDPOINT, connection.id(), LineCodec.abbreviate(line), message));
    }
}

package com.questrail.taskbroker.broker.session;

import com.questrail.taskbroker.api.Task;
import com.questrail.taskbroker.broker.MessageWriter;
import com.questrail.taskbroker.broker.dispatch.TaskDispatcher;
import com.questrail.taskbroker.broker.ledger.PendingTask;
import com.questrail.taskbroker.broker.ledger.PendingWorkLedger;
import com.questrail.taskbroker.broker.registry.DuplicateExecutorException;
import com.questrail.taskbroker.broker.registry.ExecutorRegistry;
import com.questrail.taskbroker.internal.time.WallClock;
import com.questrail.taskbroker.observability.BrokerObservabilitySink;
import com.questrail.taskbroker.observability.ExecutorEvent;
import com.questrail.taskbroker.observability.ProtocolErrorEvent;
import com.questrail.taskbroker.observability.TaskEvent;
import com.questrail.taskbroker.protocol.LineCodec;
import com.questrail.taskbroker.protocol.ProtocolException;
import com.questrail.taskbroker.protocol.model.BrokerMessage;
import com.questrail.taskbroker.protocol.model.DeliverResult;
import com.questrail.taskbroker.protocol.model.RegisterAck;
import com.questrail.taskbroker.protocol.model.RegisterExecutor;
import com.questrail.taskbroker.protocol.model.ReportResult;
import com.questrail.taskbroker.transport.ConnectionHandle;
import com.questrail.taskbroker.transport.LineSession;

import java.util.Objects;
import java.util.Optional;

/**
 * ExecutorSession
 * =============================================================================
 * Registration and result loop for one executor connection.
 *
 * <h2>States</h2>
 * <pre>
 *   REGISTERING ──REGISTER|id──► ACTIVE ──(connection closed)──► CLOSED
 *        │
 *        └──(bad first line / id taken)──► CLOSED
 * </pre>
 *
 * <p>The first non-blank line must be {@code REGISTER|id}. The executor is
 * added to the registry first and {@code ACK|id} is written only once that
 * succeeds, so a connection that loses a race for the same id never sees an
 * ACK. Anything else as the first line, or an id that is already registered,
 * closes the connection without an ACK.</p>
 *
 * <p>Sessions run on the connection's event loop. A dispatch thread that
 * picks up the new executor before the ACK is written has its
 * {@code ASSIGN_TASK} queued onto that same loop, behind the ACK.</p>
 *
 * <p>While ACTIVE the session accepts {@code TASK_RESULT} for the task this
 * executor holds, forwards it to the task's producer and returns the executor
 * to the idle pool. IDLE and BUSY are tracked by the registry. The result is
 * matched against the submission the executor was given: if its producer has
 * gone and another producer has since submitted the same id, the result is
 * discarded and the newer task is left pending.</p>
 *
 * <p>On close the executor is evicted. If it held a task, the task is passed
 * to {@link TaskDispatcher#redeliver(Task, String)}.</p>
 */
public final class ExecutorSession implements LineSession
{
    public static final String ENDPOINT = "executor";

    public enum State {
        REGISTERING,
        ACTIVE,
        CLOSED
    }

    private final ConnectionHandle connection;
    private final LineCodec codec;
    private final ExecutorRegistry registry;
    private final PendingWorkLedger ledger;
    private final TaskDispatcher dispatcher;
    private final MessageWriter writer;
    private final BrokerObservabilitySink observabilitySink;
    private final WallClock wallClock;

    private volatile State state = State.REGISTERING;
    private volatile String executorId;

    public ExecutorSession(ConnectionHandle connection,
                           LineCodec codec,
                           ExecutorRegistry registry,
                           PendingWorkLedger ledger,
                           TaskDispatcher dispatcher,
                           MessageWriter writer,
                           BrokerObservabilitySink observabilitySink,
                           WallClock wallClock)
    {
        this.connection = Objects.requireNonNull(connection, "connection");
        this.codec = Objects.requireNonNull(codec, "codec");
        this.registry = Objects.requireNonNull(registry, "registry");
        this.ledger = Objects.requireNonNull(ledger, "ledger");
        this.dispatcher = Objects.requireNonNull(dispatcher, "dispatcher");
        this.writer = Objects.requireNonNull(writer, "writer");
        this.observabilitySink = Objects.requireNonNull(observabilitySink, "observabilitySink");
        this.wallClock = Objects.requireNonNull(wallClock, "wallClock");
    }

    @Override
    public void onLine(String line) {
        if (line.isBlank()) {
            return;
        }
        switch (state) {
            case REGISTERING -> register(line);
            case ACTIVE -> handleActive(line);
            case CLOSED -> { }
        }
    }

    @Override
    public void onClosed(Throwable cause) {
        State previous = state;
        state = State.CLOSED;

        if (previous != State.ACTIVE) {
            return;
        }

        String id = executorId;
        // Empty when idle at close, or when the dispatch engine evicted first.
        Optional<Task> heldTask = registry.evict(id);
        observabilitySink.onExecutorEvent(new ExecutorEvent(
                wallClock.now(),
                ExecutorEvent.Kind.EVICTED,
                id,
                connection.id(),
                heldTask.map(Task::id).orElse(null)));

        heldTask.ifPresent(task -> dispatcher.redeliver(task, id));
    }

    public State state() {
        return state;
    }

    /**
     * Registered id, or empty before a successful {@code REGISTER}.
     */
    public Optional<String> executorId() {
        return Optional.ofNullable(executorId);
    }

    // ---------------------------------------------------------------------
    // REGISTERING
    // ---------------------------------------------------------------------

    private void register(String line) {
        final BrokerMessage message;
        try {
            message = codec.decode(line);
        } catch (ProtocolException e) {
            refuse(line, null, e.getMessage());
            return;
        }

        if (!(message instanceof RegisterExecutor registration)) {
            refuse(line, null, "expected REGISTER, got " + message.type());
            return;
        }

        String id = registration.executorId();
        if (registry.isRegistered(id)) {
            refuse(line, id, "executor id already registered");
            return;
        }

        try {
            registry.register(id, connection);
        } catch (DuplicateExecutorException e) {
            refuse(line, id, "executor id already registered");
            return;
        }

        executorId = id;
        state = State.ACTIVE;
        writer.write(connection, new RegisterAck(id));
        observabilitySink.onExecutorEvent(new ExecutorEvent(
                wallClock.now(), ExecutorEvent.Kind.REGISTERED, id, connection.id(), null));
    }

    private void refuse(String line, String id, String reason) {
        state = State.CLOSED;
        protocolError(line, reason);
        observabilitySink.onExecutorEvent(new ExecutorEvent(
                wallClock.now(), ExecutorEvent.Kind.REFUSED, id, connection.id(), null));
        connection.close();
    }

    // ---------------------------------------------------------------------
    // ACTIVE
    // ---------------------------------------------------------------------

    private void handleActive(String line) {
        final BrokerMessage message;
        try {
            message = codec.decode(line);
        } catch (ProtocolException e) {
            protocolError(line, e.getMessage());
            return;
        }

        if (message instanceof ReportResult report) {
            complete(report);
        } else {
            protocolError(line, message.type() + " is not accepted from executors");
        }
    }

    private void complete(ReportResult report) {
        String id = executorId;
        String taskId = report.taskId();

        Optional<Task> held = registry.taskOf(id);
        if (held.isEmpty() || !held.get().id().equals(taskId)) {
            taskEvent(TaskEvent.Kind.RESULT_DISCARDED, taskId, id, "task is not assigned to this executor");
            return;
        }

        Optional<PendingTask> pending = ledger.take(held.get());
        if (pending.isPresent()) {
            writer.write(pending.get().task().origin(), new DeliverResult(taskId, report.result()));
            taskEvent(TaskEvent.Kind.COMPLETED, taskId, id, null);
        } else {
            taskEvent(TaskEvent.Kind.RESULT_DISCARDED, taskId, id, "producer no longer connected");
        }

        registry.release(id);
    }

    private void taskEvent(TaskEvent.Kind kind, String taskId, String id, String detail) {
        observabilitySink.onTaskEvent(new TaskEvent(wallClock.now(), kind, taskId, id, detail));
    }

    private void protocolError(String line, String message) {
        observabilitySink.onProtocolError(new ProtocolErrorEvent(
                wallClock.now(), ENDPOINT, connection.id(), LineCodec.abbreviate(line), message));
    }
}

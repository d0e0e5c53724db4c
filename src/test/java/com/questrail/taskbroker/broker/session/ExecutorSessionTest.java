package com.questrail.taskbroker.broker.session;

import com.questrail.taskbroker.api.ExecutorState;
import com.questrail.taskbroker.api.Task;
import com.questrail.taskbroker.broker.MessageWriter;
import com.questrail.taskbroker.broker.ledger.PendingWorkLedger;
import com.questrail.taskbroker.broker.registry.ExecutorRegistry;
import com.questrail.taskbroker.observability.ExecutorEvent;
import com.questrail.taskbroker.observability.ProtocolErrorEvent;
import com.questrail.taskbroker.observability.RecordingObservabilitySink;
import com.questrail.taskbroker.observability.TaskEvent;
import com.questrail.taskbroker.protocol.LineCodec;
import com.questrail.taskbroker.transport.FakeConnectionHandle;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.io.IOException;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

import static org.junit.jupiter.api.Assertions.*;

/**
 * ExecutorSessionTest
 * -----------------------------------------------------------------------------
 * Registration handshake, result handling and loss of an executor
 * connection. Dispatch is simulated by acquiring and assigning through the
 * registry directly.
 */
class ExecutorSessionTest {

    private final LineCodec codec = LineCodec.standard();
    private RecordingObservabilitySink sink;
    private ExecutorRegistry registry;
    private PendingWorkLedger ledger;
    private RecordingDispatcher dispatcher;
    private FakeConnectionHandle connection;
    private FakeConnectionHandle producer;
    private ExecutorSession session;

    @BeforeEach
    void setUp() {
        sink = new RecordingObservabilitySink();
        registry = new ExecutorRegistry();
        ledger = new PendingWorkLedger();
        dispatcher = new RecordingDispatcher();
        connection = new FakeConnectionHandle("x1");
        producer = new FakeConnectionHandle("p1");

        MessageWriter writer = new MessageWriter(codec, sink, () -> Instant.EPOCH);
        session = new ExecutorSession(
                connection, codec, registry, ledger, dispatcher, writer, sink, () -> Instant.EPOCH);
    }

    private Task assignTask(String taskId) throws InterruptedException {
        Task task = new Task(taskId, "payload", producer);
        ledger.put(task);
        String executorId = registry.acquire(Duration.ZERO).orElseThrow().id();
        assertTrue(registry.assign(executorId, task));
        return task;
    }

    @Test
    void registerIsAcknowledgedAndExecutorJoinsPool() {
        session.onLine("REGISTER|e1");

        assertEquals(List.of("ACK|e1\n"), connection.sent());
        assertEquals(ExecutorSession.State.ACTIVE, session.state());
        assertEquals(Optional.of("e1"), session.executorId());
        assertEquals(Optional.of(ExecutorState.IDLE), registry.stateOf("e1"));
        assertEquals(1, sink.getExecutorEvents(ExecutorEvent.Kind.REGISTERED).size());
    }

    @Test
    void ackGoesOutOnlyOnceTheExecutorIsRegistered() {
        List<Boolean> registeredAtAck = new ArrayList<>();
        connection.observeSends(line -> registeredAtAck.add(registry.isRegistered("e1")));

        session.onLine("REGISTER|e1");

        assertEquals(List.of(true), registeredAtAck);
    }

    @Test
    void malformedFirstLineClosesWithoutAck() {
        session.onLine("HELLO");

        assertTrue(connection.sent().isEmpty());
        assertEquals(1, connection.closeCount());
        assertEquals(ExecutorSession.State.CLOSED, session.state());
        assertEquals(0, registry.size());
        assertEquals(1, sink.getExecutorEvents(ExecutorEvent.Kind.REFUSED).size());
        assertEquals(1, sink.eventsOfType(ProtocolErrorEvent.class).size());
    }

    @Test
    void firstLineOtherThanRegisterClosesWithoutAck() {
        session.onLine("TASK_RESULT|t1|15");

        assertTrue(connection.sent().isEmpty());
        assertEquals(1, connection.closeCount());
        assertEquals(0, registry.size());
    }

    @Test
    void takenExecutorIdIsRefused() throws InterruptedException {
        FakeConnectionHandle first = new FakeConnectionHandle("x0");
        registry.register("e1", first);

        session.onLine("REGISTER|e1");

        assertTrue(connection.sent().isEmpty());
        assertEquals(1, connection.closeCount());
        assertSame(first, registry.acquire(Duration.ZERO).orElseThrow().connection());
    }

    @Test
    void resultIsForwardedToProducerAndExecutorReleased() throws InterruptedException {
        session.onLine("REGISTER|e1");
        assignTask("t1");

        session.onLine("TASK_RESULT|t1|15");

        assertEquals(List.of("RESULT|t1|15\n"), producer.sent());
        assertTrue(ledger.peek("t1").isEmpty());
        assertEquals(Optional.of(ExecutorState.IDLE), registry.stateOf("e1"));
        assertEquals(1, sink.getTaskEvents(TaskEvent.Kind.COMPLETED).size());
    }

    @Test
    void resultKeepsEmbeddedSeparators() throws InterruptedException {
        session.onLine("REGISTER|e1");
        assignTask("t1");

        session.onLine("TASK_RESULT|t1|a|b");

        assertEquals(List.of("RESULT|t1|a|b\n"), producer.sent());
    }

    @Test
    void resultForTaskNotHeldIsDiscarded() throws InterruptedException {
        session.onLine("REGISTER|e1");
        assignTask("t1");

        session.onLine("TASK_RESULT|t9|x");

        assertTrue(producer.sent().isEmpty());
        assertEquals(Optional.of(ExecutorState.BUSY), registry.stateOf("e1"));
        assertTrue(ledger.peek("t1").isPresent());
        assertEquals(1, sink.getTaskEvents(TaskEvent.Kind.RESULT_DISCARDED).size());
    }

    @Test
    void resultAfterProducerLeftIsDiscardedAndExecutorReleased() throws InterruptedException {
        session.onLine("REGISTER|e1");
        assignTask("t1");
        ledger.dropAllFor(producer);

        session.onLine("TASK_RESULT|t1|15");

        assertTrue(producer.sent().isEmpty());
        assertEquals(Optional.of(ExecutorState.IDLE), registry.stateOf("e1"));
        assertEquals(1, sink.getTaskEvents(TaskEvent.Kind.RESULT_DISCARDED).size());
    }

    @Test
    void resultForEarlierSubmissionDoesNotReachProducerReusingTheId() throws InterruptedException {
        FakeConnectionHandle laterProducer = new FakeConnectionHandle("p2");
        session.onLine("REGISTER|e1");
        assignTask("t1");
        ledger.dropAllFor(producer);
        Task resubmitted = new Task("t1", "other", laterProducer);
        ledger.put(resubmitted);

        session.onLine("TASK_RESULT|t1|result-for-p1");

        assertTrue(laterProducer.sent().isEmpty());
        assertTrue(producer.sent().isEmpty());
        assertTrue(ledger.current(resubmitted).isPresent());
        assertEquals(Optional.of(ExecutorState.IDLE), registry.stateOf("e1"));
        assertEquals(1, sink.getTaskEvents(TaskEvent.Kind.RESULT_DISCARDED).size());
        assertTrue(sink.getTaskEvents(TaskEvent.Kind.COMPLETED).isEmpty());
    }

    @Test
    void malformedLineWhileActiveIsIgnored() {
        session.onLine("REGISTER|e1");
        session.onLine("TASK_RESULT|t1");
        session.onLine("REGISTER|e2");

        assertEquals(0, connection.closeCount());
        assertEquals(ExecutorSession.State.ACTIVE, session.state());
        assertEquals(2, sink.eventsOfType(ProtocolErrorEvent.class).size());
        assertFalse(registry.isRegistered("e2"));
    }

    @Test
    void closeWhileBusyEvictsAndRedelivers() throws InterruptedException {
        session.onLine("REGISTER|e1");
        Task task = assignTask("t1");

        session.onClosed(null);

        assertEquals(ExecutorSession.State.CLOSED, session.state());
        assertFalse(registry.isRegistered("e1"));
        assertEquals(List.of(new RecordingDispatcher.Redelivery(task, "e1")), dispatcher.redelivered());

        ExecutorEvent evicted = sink.getExecutorEvents(ExecutorEvent.Kind.EVICTED).get(0);
        assertEquals("t1", evicted.heldTaskId());
    }

    @Test
    void closeRedeliversTheSubmissionHeldEvenAfterItsIdIsReused() throws InterruptedException {
        session.onLine("REGISTER|e1");
        Task original = assignTask("t1");
        ledger.dropAllFor(producer);
        ledger.put(new Task("t1", "other", new FakeConnectionHandle("p2")));

        session.onClosed(null);

        assertSame(original, dispatcher.redelivered().get(0).task());
    }

    @Test
    void closeWhileIdleOnlyEvicts() {
        session.onLine("REGISTER|e1");

        session.onClosed(new IOException("reset"));

        assertFalse(registry.isRegistered("e1"));
        assertTrue(dispatcher.redelivered().isEmpty());
    }

    @Test
    void closeBeforeRegistrationTouchesNothing() {
        session.onClosed(null);

        assertEquals(ExecutorSession.State.CLOSED, session.state());
        assertTrue(sink.getExecutorEvents(ExecutorEvent.Kind.EVICTED).isEmpty());
    }
}

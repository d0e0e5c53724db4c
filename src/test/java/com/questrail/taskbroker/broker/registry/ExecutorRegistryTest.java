package com.questrail.taskbroker.broker.registry;

import com.questrail.taskbroker.api.ExecutorState;
import com.questrail.taskbroker.api.Task;
import com.questrail.taskbroker.transport.FakeConnectionHandle;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicReference;

import static org.junit.jupiter.api.Assertions.*;

/**
 * ExecutorRegistryTest
 * -----------------------------------------------------------------------------
 * Rotation order, bounded waiting and eviction semantics of the idle pool.
 */
class ExecutorRegistryTest {

    private final ExecutorRegistry registry = new ExecutorRegistry();
    private final Task t1 = new Task("t1", "1,2,3", new FakeConnectionHandle("producer"));

    private void register(String id) {
        registry.register(id, new FakeConnectionHandle("conn-" + id));
    }

    private String acquireNow() throws InterruptedException {
        return registry.acquire(Duration.ZERO).orElseThrow().id();
    }

    @Test
    void newExecutorsAreIdleInRegistrationOrder() {
        register("e1");
        register("e2");
        register("e3");

        assertEquals(3, registry.size());
        assertEquals(3, registry.idleCount());
        assertEquals(List.of("e1", "e2", "e3"), registry.idleOrder());
        assertEquals(Optional.of(ExecutorState.IDLE), registry.stateOf("e2"));
    }

    @Test
    void duplicateIdIsRefusedAndPoolUnchanged() {
        register("e1");

        DuplicateExecutorException e = assertThrows(DuplicateExecutorException.class, () -> register("e1"));
        assertEquals("e1", e.executorId());
        assertEquals(1, registry.size());
        assertEquals(List.of("e1"), registry.idleOrder());
    }

    @Test
    void acquireRotatesThroughExecutors() throws InterruptedException {
        register("e1");
        register("e2");

        String first = acquireNow();
        registry.release(first);
        String second = acquireNow();
        registry.release(second);
        String third = acquireNow();

        assertEquals("e1", first);
        assertEquals("e2", second);
        assertEquals("e1", third);
    }

    @Test
    void releasedExecutorGoesToTheTail() throws InterruptedException {
        register("e1");
        register("e2");
        register("e3");

        String taken = acquireNow();
        assertTrue(registry.release(taken));

        assertEquals(List.of("e2", "e3", "e1"), registry.idleOrder());
    }

    @Test
    void acquireMarksBusyAndAssignRecordsTask() throws InterruptedException {
        register("e1");

        ExecutorHandle handle = registry.acquire(Duration.ZERO).orElseThrow();
        assertEquals("conn-e1", handle.connection().id());
        assertEquals(Optional.of(ExecutorState.BUSY), registry.stateOf("e1"));
        assertEquals(0, registry.idleCount());

        assertTrue(registry.assign("e1", t1));
        assertSame(t1, registry.taskOf("e1").orElseThrow());

        assertTrue(registry.release("e1"));
        assertEquals(Optional.empty(), registry.taskOf("e1"));
        assertEquals(Optional.of(ExecutorState.IDLE), registry.stateOf("e1"));
    }

    @Test
    void assignToIdleOrUnknownExecutorFails() {
        register("e1");

        assertFalse(registry.assign("e1", t1));
        assertFalse(registry.assign("ghost", t1));
    }

    @Test
    void releaseOfIdleOrUnknownExecutorIsRejected() {
        register("e1");

        assertFalse(registry.release("e1"));
        assertFalse(registry.release("ghost"));
        assertEquals(List.of("e1"), registry.idleOrder());
    }

    @Test
    void acquireWithNoIdleExecutorTimesOut() throws InterruptedException {
        long start = System.nanoTime();
        Optional<ExecutorHandle> handle = registry.acquire(50, TimeUnit.MILLISECONDS);
        long elapsed = System.nanoTime() - start;

        assertTrue(handle.isEmpty());
        assertTrue(elapsed >= TimeUnit.MILLISECONDS.toNanos(40), "acquire should wait for the timeout");
    }

    @Test
    void waitingAcquireWakesWhenExecutorRegisters() throws Exception {
        CountDownLatch waiting = new CountDownLatch(1);
        AtomicReference<Optional<ExecutorHandle>> result = new AtomicReference<>();

        Thread acquirer = new Thread(() -> {
            waiting.countDown();
            try {
                result.set(registry.acquire(Duration.ofSeconds(5)));
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
            }
        });
        acquirer.start();

        assertTrue(waiting.await(1, TimeUnit.SECONDS));
        Thread.sleep(50);
        register("late");

        acquirer.join(2000);
        assertFalse(acquirer.isAlive());
        assertEquals("late", result.get().orElseThrow().id());
    }

    @Test
    void acquireIsInterruptible() throws Exception {
        AtomicReference<Throwable> thrown = new AtomicReference<>();

        Thread acquirer = new Thread(() -> {
            try {
                registry.acquire(Duration.ofSeconds(10));
            } catch (InterruptedException e) {
                thrown.set(e);
            }
        });
        acquirer.start();
        Thread.sleep(50);
        acquirer.interrupt();
        acquirer.join(2000);

        assertInstanceOf(InterruptedException.class, thrown.get());
    }

    @Test
    void evictIdleExecutorRemovesItFromRotation() {
        register("e1");
        register("e2");

        assertEquals(Optional.empty(), registry.evict("e1"));
        assertFalse(registry.isRegistered("e1"));
        assertEquals(List.of("e2"), registry.idleOrder());
    }

    @Test
    void evictBusyExecutorReturnsHeldTaskExactlyOnce() throws InterruptedException {
        register("e1");
        acquireNow();
        registry.assign("e1", t1);

        assertSame(t1, registry.evict("e1").orElseThrow());
        assertEquals(Optional.empty(), registry.evict("e1"));
        assertEquals(0, registry.size());
    }

    @Test
    void releaseAfterEvictDoesNotResurrectExecutor() throws InterruptedException {
        register("e1");
        acquireNow();
        registry.evict("e1");

        assertFalse(registry.release("e1"));
        assertFalse(registry.isRegistered("e1"));
        assertEquals(0, registry.idleCount());
    }

    @Test
    void idAcquiredAfterEvictionCanRegisterAgain() {
        register("e1");
        registry.evict("e1");

        register("e1");
        assertTrue(registry.isRegistered("e1"));
    }
}

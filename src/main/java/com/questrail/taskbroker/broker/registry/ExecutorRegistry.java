package com.questrail.taskbroker.broker.registry;

import com.questrail.taskbroker.api.ExecutorState;
import com.questrail.taskbroker.api.Task;
import com.questrail.taskbroker.transport.ConnectionHandle;

import java.time.Duration;
import java.util.ArrayDeque;
import java.util.Deque;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.locks.Condition;
import java.util.concurrent.locks.ReentrantLock;

/**
 * ExecutorRegistry
 * =============================================================================
 * Pool of connected executors and their availability.
 *
 * <h2>Rotation</h2>
 * Idle executors are kept in a deque. {@link #acquire(Duration)} takes the
 * head; {@link #register} and {@link #release} append to the tail. Repeated
 * dispatch with no completions in between therefore walks executors in
 * registration order, and a just-finished executor goes to the back of the
 * line.
 *
 * <h2>State per executor</h2>
 * <pre>
 *   register ──► IDLE ──acquire──► BUSY ──release──► IDLE
 *                  │                 │
 *                  └──── evict ──────┴──► (removed; held task returned)
 * </pre>
 *
 * <h2>Held task</h2>
 * A BUSY executor holds the {@link Task} instance it was assigned, not just
 * its id. Task ids may be reused by a later submission once the earlier one
 * is resolved, so callers compare the instance before acting on it.
 *
 * <h2>Thread Safety</h2>
 * All state is guarded by a single {@link ReentrantLock}; a {@link Condition}
 * wakes acquirers when an executor becomes idle. Dispatch threads acquire,
 * executor sessions release and evict, concurrently.
 */
public final class ExecutorRegistry {

    private final ReentrantLock lock = new ReentrantLock();
    private final Condition idleAvailable = lock.newCondition();

    private final Deque<String> idle = new ArrayDeque<>();
    private final Map<String, Entry> executors = new HashMap<>();

    /**
     * Add a newly registered executor at the tail of the idle pool.
     *
     * @throws DuplicateExecutorException if {@code id} is already registered
     */
    public void register(String id, ConnectionHandle connection) {
        Objects.requireNonNull(id, "id");
        Objects.requireNonNull(connection, "connection");

        lock.lock();
        try {
            if (executors.containsKey(id)) {
                throw new DuplicateExecutorException(id);
            }
            executors.put(id, new Entry(new ExecutorHandle(id, connection)));
            idle.addLast(id);
            idleAvailable.signal();
        } finally {
            lock.unlock();
        }
    }

    /**
     * Remove and return the executor at the head of the idle pool, waiting up
     * to {@code timeout} for one to become idle. The returned executor is
     * BUSY until {@link #release} or {@link #evict}.
     *
     * @param timeout maximum wait; {@link Duration#ZERO} polls without waiting
     * @return the executor, or empty if none became idle in time
     * @throws InterruptedException if the calling thread is interrupted while waiting
     */
    public Optional<ExecutorHandle> acquire(Duration timeout) throws InterruptedException {
        Objects.requireNonNull(timeout, "timeout");

        long remaining = Math.max(0L, timeout.toNanos());
        lock.lockInterruptibly();
        try {
            while (idle.isEmpty()) {
                if (remaining <= 0L) {
                    return Optional.empty();
                }
                remaining = idleAvailable.awaitNanos(remaining);
            }

            Entry entry = executors.get(idle.pollFirst());
            entry.state = ExecutorState.BUSY;
            entry.currentTask = null;
            return Optional.of(entry.handle);
        } finally {
            lock.unlock();
        }
    }

    /**
     * Convenience overload of {@link #acquire(Duration)}.
     */
    public Optional<ExecutorHandle> acquire(long timeout, TimeUnit unit) throws InterruptedException {
        return acquire(Duration.ofNanos(unit.toNanos(timeout)));
    }

    /**
     * Record the task a BUSY executor was given.
     *
     * @return {@code false} if the executor was evicted since it was acquired
     */
    public boolean assign(String id, Task task) {
        Objects.requireNonNull(task, "task");

        lock.lock();
        try {
            Entry entry = executors.get(id);
            if (entry == null || entry.state != ExecutorState.BUSY) {
                return false;
            }
            entry.currentTask = task;
            return true;
        } finally {
            lock.unlock();
        }
    }

    /**
     * Return a BUSY executor to the tail of the idle pool.
     *
     * @return {@code false} if the executor is unknown (evicted) or already idle
     */
    public boolean release(String id) {
        lock.lock();
        try {
            Entry entry = executors.get(id);
            if (entry == null || entry.state == ExecutorState.IDLE) {
                return false;
            }
            entry.state = ExecutorState.IDLE;
            entry.currentTask = null;
            idle.addLast(id);
            idleAvailable.signal();
            return true;
        } finally {
            lock.unlock();
        }
    }

    /**
     * Remove an executor entirely. Whoever receives a task from this call is
     * responsible for resolving that task.
     *
     * @return the task the executor held, if it was BUSY with one
     */
    public Optional<Task> evict(String id) {
        lock.lock();
        try {
            Entry entry = executors.remove(id);
            if (entry == null) {
                return Optional.empty();
            }
            if (entry.state == ExecutorState.IDLE) {
                idle.remove(id);
                return Optional.empty();
            }
            return Optional.ofNullable(entry.currentTask);
        } finally {
            lock.unlock();
        }
    }

    public boolean isRegistered(String id) {
        lock.lock();
        try {
            return executors.containsKey(id);
        } finally {
            lock.unlock();
        }
    }

    public Optional<ExecutorState> stateOf(String id) {
        lock.lock();
        try {
            Entry entry = executors.get(id);
            return entry == null ? Optional.empty() : Optional.of(entry.state);
        } finally {
            lock.unlock();
        }
    }

    /**
     * Task currently held by a BUSY executor.
     */
    public Optional<Task> taskOf(String id) {
        lock.lock();
        try {
            Entry entry = executors.get(id);
            return entry == null ? Optional.empty() : Optional.ofNullable(entry.currentTask);
        } finally {
            lock.unlock();
        }
    }

    public int size() {
        lock.lock();
        try {
            return executors.size();
        } finally {
            lock.unlock();
        }
    }

    public int idleCount() {
        lock.lock();
        try {
            return idle.size();
        } finally {
            lock.unlock();
        }
    }

    /**
     * Snapshot of idle executor ids, head first.
     */
    public List<String> idleOrder() {
        lock.lock();
        try {
            return List.copyOf(idle);
        } finally {
            lock.unlock();
        }
    }

    private static final class Entry {
        private final ExecutorHandle handle;
        private ExecutorState state = ExecutorState.IDLE;
        private Task currentTask;

        private Entry(ExecutorHandle handle) {
            this.handle = handle;
        }
    }
}

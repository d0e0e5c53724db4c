package com.questrail.taskbroker.broker.ledger;

import com.questrail.taskbroker.api.Task;
import com.questrail.taskbroker.transport.ConnectionHandle;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;
import java.util.function.UnaryOperator;

/**
 * PendingWorkLedger
 * =============================================================================
 * Correlation table from task id to the admitted task (and therefore to the
 * producer connection that must receive its result).
 *
 * <h2>Invariants</h2>
 * <ul>
 *   <li>At most one entry per task id. A second {@link #put} for a live id
 *       fails.</li>
 *   <li>{@link #take(Task)} removes atomically, so a result is routed at most
 *       once.</li>
 *   <li>The ledger does not own connections; the producer session sweeps its
 *       entries with {@link #dropAllFor} when its connection closes.</li>
 * </ul>
 *
 * <h2>Admission identity</h2>
 * Operations that take a {@link Task} act only if the live entry holds that
 * very instance. A retry scheduled for an earlier admission of {@code t1}
 * therefore cannot touch a later, unrelated admission of {@code t1}.
 *
 * <h2>Thread Safety</h2>
 * Backed by a {@link ConcurrentHashMap}; operations on different ids do not
 * contend.
 */
public final class PendingWorkLedger {

    private final ConcurrentMap<String, PendingTask> entries = new ConcurrentHashMap<>();

    /**
     * Admit a task.
     *
     * @throws DuplicateTaskException if the id is already pending
     */
    public void put(Task task) {
        Objects.requireNonNull(task, "task");
        if (entries.putIfAbsent(task.id(), PendingTask.admitted(task)) != null) {
            throw new DuplicateTaskException(task.id());
        }
    }

    /**
     * Remove and return the entry only if it still belongs to this admission.
     * A result from an executor that was given an earlier admission of the
     * same id leaves the newer entry untouched.
     */
    public Optional<PendingTask> take(Task task) {
        Objects.requireNonNull(task, "task");
        PendingTask pending = entries.get(task.id());
        if (pending == null || pending.task() != task || !entries.remove(task.id(), pending)) {
            return Optional.empty();
        }
        return Optional.of(pending);
    }

    public Optional<PendingTask> peek(String taskId) {
        return Optional.ofNullable(entries.get(taskId));
    }

    /**
     * Entry for this exact admission, if it is still pending.
     */
    public Optional<PendingTask> current(Task task) {
        PendingTask pending = entries.get(task.id());
        return pending != null && pending.task() == task ? Optional.of(pending) : Optional.empty();
    }

    /**
     * Remove the entry only if it still belongs to this admission.
     *
     * @return {@code true} if an entry was removed
     */
    public boolean drop(Task task) {
        PendingTask pending = entries.get(task.id());
        return pending != null && pending.task() == task && entries.remove(task.id(), pending);
    }

    public Optional<PendingTask> recordDispatchAttempt(Task task) {
        return update(task, PendingTask::withDispatchAttempt);
    }

    public Optional<PendingTask> recordSendFailure(Task task) {
        return update(task, PendingTask::withSendFailure);
    }

    /**
     * Count a redelivery. Also resets the send-failure budget, since the task
     * starts over with a fresh executor.
     */
    public Optional<PendingTask> recordRedelivery(Task task) {
        return update(task, PendingTask::withRedelivery);
    }

    /**
     * Remove every entry whose result was due on {@code producer}.
     *
     * @return the removed tasks
     */
    public List<Task> dropAllFor(ConnectionHandle producer) {
        Objects.requireNonNull(producer, "producer");

        List<Task> dropped = new ArrayList<>();
        for (Map.Entry<String, PendingTask> e : entries.entrySet()) {
            PendingTask pending = e.getValue();
            if (pending.task().origin() == producer && entries.remove(e.getKey(), pending)) {
                dropped.add(pending.task());
            }
        }
        return dropped;
    }

    public int size() {
        return entries.size();
    }

    private Optional<PendingTask> update(Task task, UnaryOperator<PendingTask> change) {
        Objects.requireNonNull(task, "task");

        PendingTask[] updated = new PendingTask[1];
        entries.computeIfPresent(task.id(), (id, pending) -> {
            if (pending.task() != task) {
                return pending;
            }
            updated[0] = change.apply(pending);
            return updated[0];
        });
        return Optional.ofNullable(updated[0]);
    }
}

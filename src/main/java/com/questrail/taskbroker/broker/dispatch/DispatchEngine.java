package com.questrail.taskbroker.broker.dispatch;

import com.questrail.taskbroker.api.Task;
import com.questrail.taskbroker.broker.MessageWriter;
import com.questrail.taskbroker.broker.ledger.PendingTask;
import com.questrail.taskbroker.broker.ledger.PendingWorkLedger;
import com.questrail.taskbroker.broker.registry.ExecutorHandle;
import com.questrail.taskbroker.broker.registry.ExecutorRegistry;
import com.questrail.taskbroker.internal.time.Cancellable;
import com.questrail.taskbroker.internal.time.MonotonicClock;
import com.questrail.taskbroker.internal.time.MonotonicScheduler;
import com.questrail.taskbroker.internal.time.WallClock;
import com.questrail.taskbroker.observability.BrokerErrorEvent;
import com.questrail.taskbroker.observability.BrokerObservabilitySink;
import com.questrail.taskbroker.observability.TaskEvent;
import com.questrail.taskbroker.protocol.model.AssignTask;
import com.questrail.taskbroker.protocol.model.TaskFailed;

import java.time.Duration;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;
import java.util.concurrent.Executor;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * DispatchEngine
 * =============================================================================
 * Moves admitted tasks from the {@link PendingWorkLedger} onto idle executors.
 *
 * <h2>One attempt</h2>
 * <ol>
 *   <li>Count the attempt in the ledger. If the task is no longer there
 *       (completed, failed, or its producer left) the attempt ends.</li>
 *   <li>Wait up to {@link DispatchPolicy#acquireTimeout()} for an idle
 *       executor.</li>
 *   <li>Record the assignment in the registry, then write
 *       {@code ASSIGN_TASK}.</li>
 * </ol>
 *
 * <p>Without an executor the task is retried after
 * {@link DispatchPolicy#backoffAfter(int)} on the {@link MonotonicScheduler},
 * until {@link DispatchPolicy#maxDispatchAttempts()} is reached and the
 * producer receives {@code TASK_FAILED}.</p>
 *
 * <h2>Executor loss</h2>
 * Whoever evicts an executor from the registry and receives its task owns
 * that task. When the {@code ASSIGN_TASK} write fails, the engine evicts the
 * executor and closes its connection; if the executor session got there first
 * the session's {@link #redeliver(Task, String)} call resolves the task
 * instead. A task is therefore never resolved twice.
 *
 * <h2>Threading</h2>
 * {@link #dispatch(Task)} and {@link #redeliver(Task, String)} only hand
 * work to the dispatch {@link Executor}. Attempts may block there while
 * waiting for an executor; session threads never do.
 */
public final class DispatchEngine implements TaskDispatcher
{
    private final ExecutorRegistry registry;
    private final PendingWorkLedger ledger;
    private final MessageWriter writer;
    private final Executor dispatchExecutor;
    private final MonotonicScheduler scheduler;
    private final MonotonicClock clock;
    private final DispatchPolicy policy;
    private final BrokerObservabilitySink observabilitySink;
    private final WallClock wallClock;

    /** Scheduled retries by task id. A retry runs only while its ticket is still mapped. */
    private final ConcurrentMap<String, RetryTicket> scheduledRetries = new ConcurrentHashMap<>();
    private final AtomicBoolean shutdown = new AtomicBoolean(false);

    public DispatchEngine(ExecutorRegistry registry,
                          PendingWorkLedger ledger,
                          MessageWriter writer,
                          Executor dispatchExecutor,
                          MonotonicScheduler scheduler,
                          MonotonicClock clock,
                          DispatchPolicy policy,
                          BrokerObservabilitySink observabilitySink,
                          WallClock wallClock)
    {
        this.registry = Objects.requireNonNull(registry, "registry");
        this.ledger = Objects.requireNonNull(ledger, "ledger");
        this.writer = Objects.requireNonNull(writer, "writer");
        this.dispatchExecutor = Objects.requireNonNull(dispatchExecutor, "dispatchExecutor");
        this.scheduler = Objects.requireNonNull(scheduler, "scheduler");
        this.clock = Objects.requireNonNull(clock, "clock");
        this.policy = Objects.requireNonNull(policy, "policy");
        this.observabilitySink = Objects.requireNonNull(observabilitySink, "observabilitySink");
        this.wallClock = Objects.requireNonNull(wallClock, "wallClock");
    }

    @Override
    public void dispatch(Task task) {
        Objects.requireNonNull(task, "task");
        submit(task);
    }

    @Override
    public void redeliver(Task task, String lostExecutorId) {
        Objects.requireNonNull(task, "task");
        if (shutdown.get()) {
            return;
        }

        Optional<PendingTask> pending = ledger.current(task);
        if (pending.isEmpty()) {
            // Producer already gone, or the id now belongs to a newer submission.
            return;
        }

        if (pending.get().redeliveries() >= policy.maxRedeliveries()) {
            fail(task, "executor lost");
            return;
        }

        if (ledger.recordRedelivery(task).isEmpty()) {
            return;
        }
        taskEvent(TaskEvent.Kind.REDELIVERED, task.id(), lostExecutorId, null);
        submit(task);
    }

    /**
     * Stop accepting work and cancel every scheduled retry. Tasks still in the
     * ledger are left there; the caller is shutting the broker down.
     */
    public void shutdown() {
        if (!shutdown.compareAndSet(false, true)) {
            return;
        }
        for (String taskId : scheduledRetries.keySet()) {
            RetryTicket ticket = scheduledRetries.remove(taskId);
            if (ticket != null) {
                ticket.cancel();
            }
        }
    }

    public boolean isShutdown() {
        return shutdown.get();
    }

    /** Number of retries currently waiting on the scheduler. */
    public int scheduledRetryCount() {
        return scheduledRetries.size();
    }

    // ---------------------------------------------------------------------
    // Attempts
    // ---------------------------------------------------------------------

    private void submit(Task task) {
        if (shutdown.get()) {
            return;
        }
        try {
            dispatchExecutor.execute(() -> attempt(task));
        } catch (RejectedExecutionException e) {
            if (!shutdown.get()) {
                error("Dispatch executor rejected task " + task.id(), e);
            }
        }
    }

    private void attempt(Task task) {
        try {
            attemptOnce(task);
        } catch (RuntimeException e) {
            error("Dispatch of task " + task.id() + " failed", e);
            fail(task, "internal error");
        }
    }

    private void attemptOnce(Task task) {
        if (shutdown.get()) {
            return;
        }

        Optional<PendingTask> pending = ledger.recordDispatchAttempt(task);
        if (pending.isEmpty()) {
            return;
        }

        final Optional<ExecutorHandle> acquired;
        try {
            acquired = registry.acquire(policy.acquireTimeout());
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            retryOrFail(task, pending.get(), "no executor available");
            return;
        }

        if (acquired.isEmpty()) {
            retryOrFail(task, pending.get(), "no executor available");
            return;
        }

        ExecutorHandle executor = acquired.get();

        if (ledger.current(task).isEmpty()) {
            // Resolved while we waited; hand the executor back untouched.
            registry.release(executor.id());
            return;
        }

        if (!registry.assign(executor.id(), task)) {
            // Evicted between acquire and assign, before it held anything.
            afterSendFailure(task);
            return;
        }

        taskEvent(TaskEvent.Kind.ASSIGNED, task.id(), executor.id(), null);
        writer.write(executor.connection(), new AssignTask(task.id(), task.payload()))
                .whenComplete((ignored, failure) -> {
                    if (failure != null) {
                        onAssignFailed(task, executor);
                    }
                });
    }

    private void onAssignFailed(Task task, ExecutorHandle executor) {
        Optional<Task> held = registry.evict(executor.id());
        if (held.isEmpty() || held.get() != task) {
            // The executor session evicted first and owns the task now.
            return;
        }

        // The session reports the eviction once the close reaches it.
        executor.connection().close();

        afterSendFailure(task);
    }

    private void afterSendFailure(Task task) {
        Optional<PendingTask> pending = ledger.recordSendFailure(task);
        if (pending.isEmpty()) {
            return;
        }
        if (pending.get().sendFailures() <= policy.maxSendFailures()) {
            submit(task);
        } else {
            retryOrFail(task, pending.get(), "executor unreachable");
        }
    }

    private void retryOrFail(Task task, PendingTask pending, String reason) {
        if (policy.attemptsExhausted(pending.dispatchAttempts())) {
            fail(task, reason);
            return;
        }
        scheduleRetry(task, policy.backoffAfter(pending.dispatchAttempts()));
    }

    private void scheduleRetry(Task task, Duration delay) {
        if (shutdown.get()) {
            return;
        }

        RetryTicket ticket = new RetryTicket();
        RetryTicket previous = scheduledRetries.put(task.id(), ticket);
        if (previous != null) {
            previous.cancel();
        }

        taskEvent(TaskEvent.Kind.RETRY_SCHEDULED, task.id(), null, "in " + delay.toMillis() + "ms");

        try {
            ticket.timer = scheduler.scheduleAfter(delay, clock, () -> {
                if (scheduledRetries.remove(task.id(), ticket)) {
                    submit(task);
                }
            });
        } catch (RejectedExecutionException e) {
            scheduledRetries.remove(task.id(), ticket);
            if (!shutdown.get()) {
                error("Retry scheduler rejected task " + task.id(), e);
                fail(task, "internal error");
            }
            return;
        }

        if (shutdown.get() && scheduledRetries.remove(task.id(), ticket)) {
            ticket.cancel();
        }
    }

    private void fail(Task task, String reason) {
        if (!ledger.drop(task)) {
            return;
        }
        taskEvent(TaskEvent.Kind.FAILED, task.id(), null, reason);
        writer.write(task.origin(), new TaskFailed(task.id(), reason));
    }

    // ---------------------------------------------------------------------
    // Observability
    // ---------------------------------------------------------------------

    private void taskEvent(TaskEvent.Kind kind, String taskId, String executorId, String detail) {
        observabilitySink.onTaskEvent(new TaskEvent(wallClock.now(), kind, taskId, executorId, detail));
    }

    private void error(String message, Throwable cause) {
        observabilitySink.onError(new BrokerErrorEvent(wallClock.now(), message, cause));
    }

    private static final class RetryTicket
    {
        private volatile Cancellable timer;

        void cancel() {
            Cancellable t = timer;
            if (t != null) {
                t.cancel();
            }
        }
    }
}

package com.questrail.taskbroker.broker.ledger;

import com.questrail.taskbroker.api.Task;

import java.util.Objects;

/**
 * Ledger entry: an admitted task plus the counters the retry policies read.
 *
 * @param dispatchAttempts executor acquisitions attempted so far
 * @param sendFailures     assignments lost because the write to the executor failed
 * @param redeliveries     times the task was re-dispatched after its executor vanished
 */
public record PendingTask(Task task, int dispatchAttempts, int sendFailures, int redeliveries)
{
    public PendingTask {
        Objects.requireNonNull(task, "task");
    }

    static PendingTask admitted(Task task) {
        return new PendingTask(task, 0, 0, 0);
    }

    PendingTask withDispatchAttempt() {
        return new PendingTask(task, dispatchAttempts + 1, sendFailures, redeliveries);
    }

    PendingTask withSendFailure() {
        return new PendingTask(task, dispatchAttempts, sendFailures + 1, redeliveries);
    }

    PendingTask withRedelivery() {
        return new PendingTask(task, dispatchAttempts, 0, redeliveries + 1);
    }
}

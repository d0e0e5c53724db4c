package com.questrail.taskbroker.broker.session;

import com.questrail.taskbroker.api.Task;
import com.questrail.taskbroker.broker.dispatch.TaskDispatcher;

import java.util.ArrayList;
import java.util.List;

/**
 * Test dispatcher that records calls instead of routing work.
 */
final class RecordingDispatcher implements TaskDispatcher {

    record Redelivery(Task task, String lostExecutorId) {}

    private final List<Task> dispatched = new ArrayList<>();
    private final List<Redelivery> redelivered = new ArrayList<>();

    @Override
    public synchronized void dispatch(Task task) {
        dispatched.add(task);
    }

    @Override
    public synchronized void redeliver(Task task, String lostExecutorId) {
        redelivered.add(new Redelivery(task, lostExecutorId));
    }

    synchronized List<Task> dispatched() {
        return List.copyOf(dispatched);
    }

    synchronized List<Redelivery> redelivered() {
        return List.copyOf(redelivered);
    }
}

package com.questrail.taskbroker.broker.dispatch;

import com.questrail.taskbroker.api.Task;

/**
 * TaskDispatcher
 * -----------------------------------------------------------------------------
 * What sessions need from the dispatch side.
 *
 * <p>Both methods return immediately. Selection of an executor, waiting and
 * retrying happen on dispatch threads, never on the calling session's
 * thread.</p>
 */
public interface TaskDispatcher
{
    /**
     * Route an admitted task to an executor. The task must already be in the
     * ledger.
     */
    void dispatch(Task task);

    /**
     * Resolve a task whose executor vanished while holding it: dispatch it
     * again if the redelivery budget allows, otherwise fail it towards the
     * producer.
     *
     * <p>Does nothing if this admission is no longer pending, even when a
     * newer submission with the same id is.</p>
     *
     * @param task            task the executor held, as returned by the registry
     * @param lostExecutorId  executor that was evicted
     */
    void redeliver(Task task, String lostExecutorId);
}

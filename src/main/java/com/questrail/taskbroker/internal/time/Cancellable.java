package com.questrail.taskbroker.internal.time;

/**
 * Cancellable
 * =============================================================================
 * Handle returned for a scheduled dispatch retry.
 *
 * <p>The dispatch engine keeps one of these per waiting task so that a
 * shutdown, or a task that is resolved through another path, can withdraw
 * the pending retry.</p>
 */
public interface Cancellable
{
    /**
     * Attempt to cancel the scheduled task.
     *
     * @return {@code true} if the task will not run; {@code false} if it already
     *         ran or was cancelled earlier
     */
    boolean cancel();
}

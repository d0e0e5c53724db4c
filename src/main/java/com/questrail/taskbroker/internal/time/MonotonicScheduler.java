package com.questrail.taskbroker.internal.time;

import java.time.Duration;
import java.util.Objects;

/**
 * MonotonicScheduler
 * =============================================================================
 * Single scheduling surface used by the dispatch engine for deferred retries.
 *
 * <p>Deadlines are expressed in monotonic nanoseconds, never in wall-clock
 * instants. Implementations run the task at or after the deadline, never
 * before it.</p>
 */
public interface MonotonicScheduler
{
    /**
     * Schedule a task to run at or after the given monotonic deadline.
     *
     * @param deadlineNanos deadline taken from {@link MonotonicClock#nowNanos()}
     * @param task          work to run
     * @return cancellation handle
     */
    Cancellable scheduleAtNanos(long deadlineNanos, Runnable task);

    /**
     * Schedule a retry {@code backoff} from now on the given clock.
     *
     * <p>Backoffs too large to express in nanoseconds, or that would push the
     * deadline past {@link Long#MAX_VALUE}, are clamped to that value: the
     * task is then effectively never due.</p>
     */
    default Cancellable scheduleAfter(Duration backoff, MonotonicClock clock, Runnable task)
    {
        Objects.requireNonNull(backoff, "backoff");
        Objects.requireNonNull(clock, "clock");
        Objects.requireNonNull(task, "task");

        if (backoff.isNegative()) {
            throw new IllegalArgumentException("backoff must be >= 0: " + backoff);
        }

        long now = clock.nowNanos();
        long deadline;
        try {
            deadline = Math.addExact(now, backoff.toNanos());
        } catch (ArithmeticException overflow) {
            deadline = Long.MAX_VALUE;
        }
        return scheduleAtNanos(deadline, task);
    }
}

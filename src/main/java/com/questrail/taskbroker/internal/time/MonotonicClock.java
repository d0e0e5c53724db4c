package com.questrail.taskbroker.internal.time;

/**
 * MonotonicClock
 * =============================================================================
 * Time source for retry backoff and acquisition deadlines.
 *
 * <p>Only elapsed-time arithmetic is meaningful on the returned value. Wall
 * clock time is reserved for event timestamps (see {@link WallClock}).</p>
 */
public interface MonotonicClock
{
    /**
     * Returns a monotonically non-decreasing tick in nanoseconds.
     */
    long nowNanos();
}

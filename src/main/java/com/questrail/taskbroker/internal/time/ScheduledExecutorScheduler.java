package com.questrail.taskbroker.internal.time;

import java.util.Objects;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.ScheduledFuture;
import java.util.concurrent.TimeUnit;

/**
 * ScheduledExecutorScheduler
 * =============================================================================
 * Production {@link MonotonicScheduler} backed by a {@link ScheduledExecutorService}.
 *
 * <p>Monotonic deadlines are converted into relative delays at scheduling
 * time using the supplied clock, so callers must compute deadlines from the
 * same clock instance (normally {@link SystemMonotonicClock#INSTANCE}).</p>
 *
 * <p>The executor is not owned here; the broker runtime shuts it down.</p>
 */
public final class ScheduledExecutorScheduler implements MonotonicScheduler {

    private final ScheduledExecutorService executor;
    private final MonotonicClock clock;

    public ScheduledExecutorScheduler(ScheduledExecutorService executor, MonotonicClock clock) {
        this.executor = Objects.requireNonNull(executor, "executor");
        this.clock = Objects.requireNonNull(clock, "clock");
    }

    @Override
    public Cancellable scheduleAtNanos(long deadlineNanos, Runnable task) {
        Objects.requireNonNull(task, "task");

        // Past deadlines run immediately; a far-off deadline must not wrap to "now".
        long delayNanos;
        try {
            delayNanos = Math.max(0, Math.subtractExact(deadlineNanos, clock.nowNanos()));
        } catch (ArithmeticException overflow) {
            delayNanos = Long.MAX_VALUE;
        }
        ScheduledFuture<?> future = executor.schedule(task, delayNanos, TimeUnit.NANOSECONDS);
        return () -> future.cancel(false);
    }
}

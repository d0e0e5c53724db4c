package com.questrail.taskbroker.broker.dispatch;

import java.time.Duration;
import java.util.Objects;

/**
 * DispatchPolicy
 * -----------------------------------------------------------------------------
 * Timing and retry limits for the {@link DispatchEngine}.
 *
 * <h2>Configuration Parameters</h2>
 * <ul>
 *   <li><b>acquireTimeout</b>: How long one dispatch attempt waits for an idle
 *       executor before giving up and scheduling a retry.</li>
 *   <li><b>retryBackoff</b>: Delay before the first retry.</li>
 *   <li><b>backoffMultiplier</b>: Growth factor applied to the delay for each
 *       further retry; {@code 1.0} gives fixed-interval retries.</li>
 *   <li><b>maxBackoff</b>: Upper bound on any single retry delay.</li>
 *   <li><b>maxDispatchAttempts</b>: Total acquisition attempts before the task
 *       fails with {@code TASK_FAILED}; {@code 0} means unbounded.</li>
 *   <li><b>maxSendFailures</b>: Consecutive failed writes of
 *       {@code ASSIGN_TASK} retried immediately (with a fresh executor) before
 *       falling back to the backoff path.</li>
 *   <li><b>maxRedeliveries</b>: Times a task is dispatched again after the
 *       executor holding it disconnects; {@code 0} fails it at once.</li>
 * </ul>
 */
public record DispatchPolicy(
        Duration acquireTimeout,
        Duration retryBackoff,
        double backoffMultiplier,
        Duration maxBackoff,
        int maxDispatchAttempts,
        int maxSendFailures,
        int maxRedeliveries
) {
    public DispatchPolicy {
        Objects.requireNonNull(acquireTimeout, "acquireTimeout");
        Objects.requireNonNull(retryBackoff, "retryBackoff");
        Objects.requireNonNull(maxBackoff, "maxBackoff");

        if (acquireTimeout.isNegative()) {
            throw new IllegalArgumentException("acquireTimeout must be non-negative");
        }
        if (retryBackoff.isNegative()) {
            throw new IllegalArgumentException("retryBackoff must be non-negative");
        }
        if (!(backoffMultiplier >= 1.0) || Double.isInfinite(backoffMultiplier)) {
            throw new IllegalArgumentException("backoffMultiplier must be a finite value >= 1.0");
        }
        if (maxBackoff.compareTo(retryBackoff) < 0) {
            throw new IllegalArgumentException("maxBackoff must be >= retryBackoff");
        }
        if (maxDispatchAttempts < 0) {
            throw new IllegalArgumentException("maxDispatchAttempts must be >= 0");
        }
        if (maxSendFailures < 0) {
            throw new IllegalArgumentException("maxSendFailures must be >= 0");
        }
        if (maxRedeliveries < 0) {
            throw new IllegalArgumentException("maxRedeliveries must be >= 0");
        }
    }

    /**
     * Typical values:
     * <ul>
     *   <li>acquireTimeout: 5s</li>
     *   <li>retryBackoff: 1s, fixed (multiplier 1.0), maxBackoff 30s</li>
     *   <li>maxDispatchAttempts: 30</li>
     *   <li>maxSendFailures: 3</li>
     *   <li>maxRedeliveries: 1</li>
     * </ul>
     */
    public static DispatchPolicy defaults() {
        return new DispatchPolicy(
                Duration.ofSeconds(5),
                Duration.ofSeconds(1),
                1.0,
                Duration.ofSeconds(30),
                30,
                3,
                1
        );
    }

    /**
     * Whether a task that has made {@code attempts} acquisition attempts may
     * not be retried again.
     */
    public boolean attemptsExhausted(int attempts) {
        return maxDispatchAttempts > 0 && attempts >= maxDispatchAttempts;
    }

    /**
     * Delay before the retry that follows the {@code attempts}-th attempt.
     */
    public Duration backoffAfter(int attempts) {
        int exponent = Math.max(0, attempts - 1);
        double scaled = retryBackoff.toNanos() * Math.pow(backoffMultiplier, exponent);
        long capped = (long) Math.min(scaled, (double) maxBackoff.toNanos());
        return Duration.ofNanos(capped);
    }

    public static Builder builder() {
        return new Builder();
    }

    public static final class Builder {
        private final DispatchPolicy base = defaults();
        private Duration acquireTimeout = base.acquireTimeout;
        private Duration retryBackoff = base.retryBackoff;
        private double backoffMultiplier = base.backoffMultiplier;
        private Duration maxBackoff = base.maxBackoff;
        private int maxDispatchAttempts = base.maxDispatchAttempts;
        private int maxSendFailures = base.maxSendFailures;
        private int maxRedeliveries = base.maxRedeliveries;

        public Builder withAcquireTimeout(Duration acquireTimeout) {
            this.acquireTimeout = acquireTimeout;
            return this;
        }

        public Builder withRetryBackoff(Duration retryBackoff) {
            this.retryBackoff = retryBackoff;
            return this;
        }

        public Builder withBackoffMultiplier(double backoffMultiplier) {
            this.backoffMultiplier = backoffMultiplier;
            return this;
        }

        public Builder withMaxBackoff(Duration maxBackoff) {
            this.maxBackoff = maxBackoff;
            return this;
        }

        public Builder withMaxDispatchAttempts(int maxDispatchAttempts) {
            this.maxDispatchAttempts = maxDispatchAttempts;
            return this;
        }

        public Builder withMaxSendFailures(int maxSendFailures) {
            this.maxSendFailures = maxSendFailures;
            return this;
        }

        public Builder withMaxRedeliveries(int maxRedeliveries) {
            this.maxRedeliveries = maxRedeliveries;
            return this;
        }

        public DispatchPolicy build() {
            return new DispatchPolicy(acquireTimeout, retryBackoff, backoffMultiplier, maxBackoff,
                    maxDispatchAttempts, maxSendFailures, maxRedeliveries);
        }
    }
}

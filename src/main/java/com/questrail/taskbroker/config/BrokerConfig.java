package com.questrail.taskbroker.config;

import com.questrail.taskbroker.broker.dispatch.DispatchPolicy;

import java.time.Duration;
import java.util.Objects;
import java.util.Properties;

/**
 * Aggregated configuration for the broker runtime.
 *
 * <p>Port {@code 0} asks the operating system for an ephemeral port; the bound
 * port is then available from the runtime after start.</p>
 *
 * @param host           interface both endpoints bind to
 * @param producerPort   port producers connect to
 * @param executorPort   port executors connect to
 * @param maxLineLength  longest accepted inbound line, in bytes, excluding the terminator
 * @param dispatchThreads threads running dispatch attempts
 * @param dispatchPolicy retry and timeout limits for dispatch
 */
public record BrokerConfig(
    String host,
    int producerPort,
    int executorPort,
    int maxLineLength,
    int dispatchThreads,
    DispatchPolicy dispatchPolicy
) {
    public static final String DEFAULT_HOST = "localhost";
    public static final int DEFAULT_PRODUCER_PORT = 8888;
    public static final int DEFAULT_EXECUTOR_PORT = 8889;
    public static final int DEFAULT_MAX_LINE_LENGTH = 64 * 1024;
    public static final int DEFAULT_DISPATCH_THREADS = 2;

    public BrokerConfig {
        Objects.requireNonNull(host, "host");
        Objects.requireNonNull(dispatchPolicy, "dispatchPolicy");

        if (host.isBlank()) {
            throw new IllegalArgumentException("host must not be blank");
        }
        requirePort(producerPort, "producerPort");
        requirePort(executorPort, "executorPort");
        if (producerPort != 0 && producerPort == executorPort) {
            throw new IllegalArgumentException("producerPort and executorPort must differ");
        }
        if (maxLineLength <= 0) {
            throw new IllegalArgumentException("maxLineLength must be > 0");
        }
        if (dispatchThreads <= 0) {
            throw new IllegalArgumentException("dispatchThreads must be > 0");
        }
    }

    public static BrokerConfig defaults() {
        return builder().build();
    }

    /**
     * Read a configuration from {@code broker.*} properties. Missing keys keep
     * their defaults.
     *
     * @throws IllegalArgumentException if a value is not a number or fails validation
     */
    public static BrokerConfig fromProperties(Properties properties) {
        Objects.requireNonNull(properties, "properties");

        DispatchPolicy defaults = DispatchPolicy.defaults();
        DispatchPolicy policy = DispatchPolicy.builder()
                .withAcquireTimeout(millis(properties, "broker.dispatch.acquireTimeoutMillis", defaults.acquireTimeout()))
                .withRetryBackoff(millis(properties, "broker.dispatch.retryBackoffMillis", defaults.retryBackoff()))
                .withBackoffMultiplier(decimal(properties, "broker.dispatch.backoffMultiplier", defaults.backoffMultiplier()))
                .withMaxBackoff(millis(properties, "broker.dispatch.maxBackoffMillis", defaults.maxBackoff()))
                .withMaxDispatchAttempts(integer(properties, "broker.dispatch.maxAttempts", defaults.maxDispatchAttempts()))
                .withMaxSendFailures(integer(properties, "broker.dispatch.maxSendFailures", defaults.maxSendFailures()))
                .withMaxRedeliveries(integer(properties, "broker.dispatch.maxRedeliveries", defaults.maxRedeliveries()))
                .build();

        return builder()
                .withHost(properties.getProperty("broker.host", DEFAULT_HOST).trim())
                .withProducerPort(integer(properties, "broker.producer.port", DEFAULT_PRODUCER_PORT))
                .withExecutorPort(integer(properties, "broker.executor.port", DEFAULT_EXECUTOR_PORT))
                .withMaxLineLength(integer(properties, "broker.maxLineLength", DEFAULT_MAX_LINE_LENGTH))
                .withDispatchThreads(integer(properties, "broker.dispatch.threads", DEFAULT_DISPATCH_THREADS))
                .withDispatchPolicy(policy)
                .build();
    }

    public static Builder builder() {
        return new Builder();
    }

    private static void requirePort(int port, String name) {
        if (port < 0 || port > 65535) {
            throw new IllegalArgumentException(name + " must be in [0, 65535]: " + port);
        }
    }

    private static int integer(Properties properties, String key, int defaultValue) {
        String value = properties.getProperty(key);
        if (value == null || value.isBlank()) {
            return defaultValue;
        }
        try {
            return Integer.parseInt(value.trim());
        } catch (NumberFormatException e) {
            throw new IllegalArgumentException("Property " + key + " is not an integer: " + value, e);
        }
    }

    private static double decimal(Properties properties, String key, double defaultValue) {
        String value = properties.getProperty(key);
        if (value == null || value.isBlank()) {
            return defaultValue;
        }
        try {
            return Double.parseDouble(value.trim());
        } catch (NumberFormatException e) {
            throw new IllegalArgumentException("Property " + key + " is not a number: " + value, e);
        }
    }

    private static Duration millis(Properties properties, String key, Duration defaultValue) {
        String value = properties.getProperty(key);
        if (value == null || value.isBlank()) {
            return defaultValue;
        }
        try {
            return Duration.ofMillis(Long.parseLong(value.trim()));
        } catch (NumberFormatException e) {
            throw new IllegalArgumentException("Property " + key + " is not a millisecond count: " + value, e);
        }
    }

    public static final class Builder {
        private String host = DEFAULT_HOST;
        private int producerPort = DEFAULT_PRODUCER_PORT;
        private int executorPort = DEFAULT_EXECUTOR_PORT;
        private int maxLineLength = DEFAULT_MAX_LINE_LENGTH;
        private int dispatchThreads = DEFAULT_DISPATCH_THREADS;
        private DispatchPolicy dispatchPolicy = DispatchPolicy.defaults();

        public Builder withHost(String host) {
            this.host = host;
            return this;
        }

        public Builder withProducerPort(int producerPort) {
            this.producerPort = producerPort;
            return this;
        }

        public Builder withExecutorPort(int executorPort) {
            this.executorPort = executorPort;
            return this;
        }

        public Builder withMaxLineLength(int maxLineLength) {
            this.maxLineLength = maxLineLength;
            return this;
        }

        public Builder withDispatchThreads(int dispatchThreads) {
            this.dispatchThreads = dispatchThreads;
            return this;
        }

        public Builder withDispatchPolicy(DispatchPolicy dispatchPolicy) {
            this.dispatchPolicy = dispatchPolicy;
            return this;
        }

        public BrokerConfig build() {
            return new BrokerConfig(host, producerPort, executorPort, maxLineLength, dispatchThreads, dispatchPolicy);
        }
    }
}

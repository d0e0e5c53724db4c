package com.questrail.taskbroker.observability;

/**
 * Receiver of broker observability events.
 * Implementations can provide logging, metrics, or tracing.
 *
 * <p>Callbacks arrive from Netty event loops, dispatch threads and the retry
 * scheduler concurrently; implementations must be thread-safe and must not
 * block.</p>
 */
public interface BrokerObservabilitySink {
    /**
     * A task moved through its lifecycle (admitted, assigned, completed...).
     */
    void onTaskEvent(TaskEvent event);

    /**
     * An executor registered, was refused, or left the pool.
     */
    void onExecutorEvent(ExecutorEvent event);

    /**
     * An endpoint or connection changed state.
     */
    void onTransportEvent(TransportEvent event);

    /**
     * A line could not be decoded or was not legal on its connection.
     */
    void onProtocolError(ProtocolErrorEvent event);

    /**
     * An unexpected failure inside the broker.
     */
    void onError(BrokerErrorEvent event);
}

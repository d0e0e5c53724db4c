package com.questrail.taskbroker.observability;

/**
 * No-op implementation of BrokerObservabilitySink.
 */
public final class NullObservabilitySink implements BrokerObservabilitySink {
    public static final NullObservabilitySink INSTANCE = new NullObservabilitySink();

    private NullObservabilitySink() {}

    @Override
    public void onTaskEvent(TaskEvent event) {}

    @Override
    public void onExecutorEvent(ExecutorEvent event) {}

    @Override
    public void onTransportEvent(TransportEvent event) {}

    @Override
    public void onProtocolError(ProtocolErrorEvent event) {}

    @Override
    public void onError(BrokerErrorEvent event) {}
}

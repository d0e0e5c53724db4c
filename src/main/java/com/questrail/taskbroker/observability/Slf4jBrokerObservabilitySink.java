package com.questrail.taskbroker.observability;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Production implementation of BrokerObservabilitySink that emits logs via SLF4J.
 *
 * <p>Per-task traffic is logged at DEBUG, pool membership and endpoint
 * lifecycle at INFO, anything that loses or refuses work at WARN.</p>
 */
public final class Slf4jBrokerObservabilitySink implements BrokerObservabilitySink {
    private static final Logger log = LoggerFactory.getLogger(Slf4jBrokerObservabilitySink.class);

    @Override
    public void onTaskEvent(TaskEvent event) {
        switch (event.kind()) {
            case FAILED, ORPHANED, REJECTED -> log.warn("Task {} {}: {}",
                event.taskId(), event.kind(), event.detail());
            case RESULT_DISCARDED -> log.info("Result for task {} from executor {} discarded: {}",
                event.taskId(), event.executorId(), event.detail());
            case REDELIVERED -> log.info("Task {} redelivered after losing executor {}",
                event.taskId(), event.executorId());
            default -> log.debug("Task {} {} (executor={}, detail={})",
                event.taskId(), event.kind(), event.executorId(), event.detail());
        }
    }

    @Override
    public void onExecutorEvent(ExecutorEvent event) {
        switch (event.kind()) {
            case REGISTERED -> log.info("Executor {} registered on connection {}",
                event.executorId(), event.connectionId());
            case REFUSED -> log.warn("Executor registration refused on connection {} (id={})",
                event.connectionId(), event.executorId());
            case EVICTED -> {
                if (event.heldTaskId() != null) {
                    log.warn("Executor {} evicted while holding task {}",
                        event.executorId(), event.heldTaskId());
                } else {
                    log.info("Executor {} evicted", event.executorId());
                }
            }
        }
    }

    @Override
    public void onTransportEvent(TransportEvent event) {
        switch (event.kind()) {
            case ENDPOINT_UP -> log.info("{} endpoint listening on {}", event.endpoint(), event.address());
            case ENDPOINT_DOWN -> {
                if (event.cause() != null) {
                    log.error("{} endpoint down", event.endpoint(), event.cause());
                } else {
                    log.info("{} endpoint stopped", event.endpoint());
                }
            }
            case CONNECTION_OPENED -> log.debug("{} connection {} opened from {}",
                event.endpoint(), event.connectionId(), event.address());
            case CONNECTION_CLOSED -> {
                if (event.cause() != null) {
                    log.info("{} connection {} closed: {}",
                        event.endpoint(), event.connectionId(), event.cause().toString());
                } else {
                    log.debug("{} connection {} closed", event.endpoint(), event.connectionId());
                }
            }
        }
    }

    @Override
    public void onProtocolError(ProtocolErrorEvent event) {
        log.warn("Protocol error on {} connection {}: {} (line: {})",
            event.endpoint(), event.connectionId(), event.message(), event.line());
    }

    @Override
    public void onError(BrokerErrorEvent event) {
        log.error("Broker error: {}", event.message(), event.cause());
    }
}

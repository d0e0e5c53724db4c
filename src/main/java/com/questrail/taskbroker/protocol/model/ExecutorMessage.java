package com.questrail.taskbroker.protocol.model;

/**
 * Messages an executor sends to the broker.
 */
public sealed interface ExecutorMessage extends BrokerMessage
        permits RegisterExecutor, ReportResult {
}

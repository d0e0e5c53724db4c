package com.questrail.taskbroker.protocol.model;

/**
 * Messages the broker sends to an executor.
 */
public sealed interface ExecutorCommand extends BrokerMessage
        permits RegisterAck, AssignTask {
}

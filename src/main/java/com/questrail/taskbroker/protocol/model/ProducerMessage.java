package com.questrail.taskbroker.protocol.model;

/**
 * Messages a producer sends to the broker.
 */
public sealed interface ProducerMessage extends BrokerMessage permits SubmitTask {
}

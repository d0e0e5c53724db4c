package com.questrail.taskbroker.protocol.model;

/**
 * Messages the broker sends to a producer. Every reply concerns exactly one
 * task.
 */
public sealed interface ProducerReply extends BrokerMessage
        permits DeliverResult, TaskFailed, TaskRejected {

    String taskId();
}

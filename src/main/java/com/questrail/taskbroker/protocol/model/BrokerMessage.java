package com.questrail.taskbroker.protocol.model;

import java.util.List;

/**
 * Semantic representation of one line of the broker wire protocol.
 *
 * <h2>Purpose</h2>
 * <p>
 * Sessions, the dispatch engine and tests reason only about
 * {@code BrokerMessage} instances. Tags, separators and line terminators are
 * resolved below this layer, in the codec.
 * </p>
 *
 * <h2>Directionality</h2>
 * <p>
 * Every message travels in exactly one direction, which is encoded in the
 * type hierarchy:
 * </p>
 * <ul>
 *   <li>{@link ProducerMessage}: producer → broker</li>
 *   <li>{@link ProducerReply}: broker → producer</li>
 *   <li>{@link ExecutorMessage}: executor → broker</li>
 *   <li>{@link ExecutorCommand}: broker → executor</li>
 * </ul>
 * <p>
 * A session can therefore only be handed the messages its peer may legally
 * send, and can only write the messages its peer understands.
 * </p>
 */
public sealed interface BrokerMessage
        permits ProducerMessage, ProducerReply, ExecutorMessage, ExecutorCommand {

    /**
     * Wire type of this message.
     */
    MessageType type();

    /**
     * Field values in wire order, excluding the tag. The size always equals
     * {@code type().fieldCount()}.
     */
    List<String> fields();
}

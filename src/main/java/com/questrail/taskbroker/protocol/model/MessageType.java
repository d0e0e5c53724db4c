package com.questrail.taskbroker.protocol.model;

import java.util.Optional;

/**
 * MessageType
 * =============================================================================
 * Closed set of wire tags understood by the broker, with the number of
 * pipe-separated fields that follow each tag.
 *
 * <p>The first field of every message is an identifier (task id or executor
 * id). When a type has more than one field, the last one takes the rest of
 * the line verbatim and may itself contain {@code |}.</p>
 */
public enum MessageType
{
    /** producer → broker: {@code TASK|task_id|payload} */
    TASK(2),
    /** broker → producer: {@code RESULT|task_id|result} */
    RESULT(2),
    /** broker → producer: {@code TASK_FAILED|task_id|reason} */
    TASK_FAILED(2),
    /** broker → producer: {@code TASK_REJECTED|task_id|reason} */
    TASK_REJECTED(2),
    /** executor → broker: {@code REGISTER|executor_id} */
    REGISTER(1),
    /** broker → executor: {@code ACK|executor_id} */
    ACK(1),
    /** broker → executor: {@code ASSIGN_TASK|task_id|payload} */
    ASSIGN_TASK(2),
    /** executor → broker: {@code TASK_RESULT|task_id|result} */
    TASK_RESULT(2);

    private final int fieldCount;

    MessageType(int fieldCount) {
        this.fieldCount = fieldCount;
    }

    /**
     * Wire tag, identical to the constant name.
     */
    public String tag() {
        return name();
    }

    /**
     * Number of fields after the tag.
     */
    public int fieldCount() {
        return fieldCount;
    }

    /**
     * Case-sensitive lookup of a wire tag.
     */
    public static Optional<MessageType> fromTag(String tag) {
        if (tag == null) {
            return Optional.empty();
        }
        for (MessageType type : values()) {
            if (type.name().equals(tag)) {
                return Optional.of(type);
            }
        }
        return Optional.empty();
    }
}

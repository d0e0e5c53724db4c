package com.questrail.taskbroker.protocol.internal.encode;

import com.questrail.taskbroker.protocol.ProtocolException;
import com.questrail.taskbroker.protocol.codec.impl.WireFraming;
import com.questrail.taskbroker.protocol.internal.frame.WireFrame;
import com.questrail.taskbroker.protocol.model.BrokerMessage;

import java.util.List;
import java.util.Objects;

/**
 * BrokerMessageEncoder
 * ============================================================================
 * Converts a semantic {@link BrokerMessage} into a {@link WireFrame}.
 *
 * <p>The encoder refuses to produce a line that the decoder on the other end
 * would read differently:</p>
 * <ul>
 *   <li>no field may contain a line break</li>
 *   <li>the identifier must be non-empty and free of {@code |}</li>
 *   <li>only the last field may contain {@code |}</li>
 * </ul>
 */
public final class BrokerMessageEncoder
{
    /**
     * @throws ProtocolException if a field cannot be represented on the wire
     */
    public WireFrame encode(BrokerMessage message) {
        Objects.requireNonNull(message, "message");

        List<String> fields = message.fields();
        String tag = message.type().tag();

        StringBuilder body = new StringBuilder();
        for (int i = 0; i < fields.size(); i++) {
            String field = fields.get(i);
            boolean last = i == fields.size() - 1;

            if (WireFraming.containsLineBreak(field)) {
                throw new ProtocolException(tag + " field " + i + " contains a line break");
            }
            if (!last && field.indexOf(WireFraming.FIELD_SEPARATOR) >= 0) {
                throw new ProtocolException(tag + " field " + i + " contains '|'");
            }
            if (i == 0 && (field.isEmpty() || field.indexOf(WireFraming.FIELD_SEPARATOR) >= 0)) {
                throw new ProtocolException(tag + " identifier must be non-empty and free of '|'");
            }

            if (i > 0) {
                body.append(WireFraming.FIELD_SEPARATOR);
            }
            body.append(field);
        }

        return new WireFrame(tag, body.toString());
    }
}

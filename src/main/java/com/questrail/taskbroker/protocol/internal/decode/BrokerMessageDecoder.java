package com.questrail.taskbroker.protocol.internal.decode;

import com.questrail.taskbroker.protocol.ProtocolException;
import com.questrail.taskbroker.protocol.codec.impl.WireFraming;
import com.questrail.taskbroker.protocol.internal.frame.WireFrame;
import com.questrail.taskbroker.protocol.model.AssignTask;
import com.questrail.taskbroker.protocol.model.BrokerMessage;
import com.questrail.taskbroker.protocol.model.DeliverResult;
import com.questrail.taskbroker.protocol.model.MessageType;
import com.questrail.taskbroker.protocol.model.RegisterAck;
import com.questrail.taskbroker.protocol.model.RegisterExecutor;
import com.questrail.taskbroker.protocol.model.ReportResult;
import com.questrail.taskbroker.protocol.model.SubmitTask;
import com.questrail.taskbroker.protocol.model.TaskFailed;
import com.questrail.taskbroker.protocol.model.TaskRejected;

import java.util.List;
import java.util.Objects;

/**
 * BrokerMessageDecoder
 * ============================================================================
 * Converts a {@link WireFrame} into a semantic {@link BrokerMessage}.
 *
 * <h2>Architectural Role</h2>
 * This class is the boundary between line mechanics (tags, separators) and
 * message semantics. Sessions never inspect tags or split strings themselves.
 *
 * <h2>Field splitting</h2>
 * The body is split into at most {@link MessageType#fieldCount()} parts. The
 * last part takes the remainder of the line, so payloads and results may
 * contain {@code |}. Fewer parts than required is an error.
 *
 * <h2>Identifier rules</h2>
 * The first field of every message is an identifier. It must be non-empty
 * and must not contain the separator; for single-field messages this means
 * {@code REGISTER|a|b} is rejected rather than read as executor {@code a|b}.
 *
 * <h2>What this decoder does NOT do</h2>
 * <ul>
 *   <li>Check that the message is legal for the connection it arrived on</li>
 *   <li>Perform I/O or keep state</li>
 * </ul>
 */
public final class BrokerMessageDecoder
{
    /**
     * Decodes a frame into a message.
     *
     * @throws ProtocolException on unknown tag, wrong field count or invalid id
     */
    public BrokerMessage decode(WireFrame frame) {
        Objects.requireNonNull(frame, "frame");

        MessageType type = MessageType.fromTag(frame.tag())
                .orElseThrow(() -> new ProtocolException("Unknown message tag: " + frame.tag()));

        List<String> fields = WireFraming.splitBounded(frame.body(), type.fieldCount());
        if (fields.size() != type.fieldCount()) {
            throw new ProtocolException(type.tag() + " expects " + type.fieldCount()
                    + " field(s) but got " + fields.size());
        }

        String id = fields.get(0);
        if (id.isEmpty()) {
            throw new ProtocolException(type.tag() + " has an empty identifier");
        }
        if (id.indexOf(WireFraming.FIELD_SEPARATOR) >= 0) {
            throw new ProtocolException(type.tag() + " identifier contains '|'");
        }

        return switch (type) {
            case TASK -> new SubmitTask(id, fields.get(1));
            case RESULT -> new DeliverResult(id, fields.get(1));
            case TASK_FAILED -> new TaskFailed(id, fields.get(1));
            case TASK_REJECTED -> new TaskRejected(id, fields.get(1));
            case REGISTER -> new RegisterExecutor(id);
            case ACK -> new RegisterAck(id);
            case ASSIGN_TASK -> new AssignTask(id, fields.get(1));
            case TASK_RESULT -> new ReportResult(id, fields.get(1));
        };
    }
}

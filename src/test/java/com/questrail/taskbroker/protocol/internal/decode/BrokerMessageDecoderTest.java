package com.questrail.taskbroker.protocol.internal.decode;

import com.questrail.taskbroker.protocol.ProtocolException;
import com.questrail.taskbroker.protocol.internal.frame.WireFrame;
import com.questrail.taskbroker.protocol.model.AssignTask;
import com.questrail.taskbroker.protocol.model.BrokerMessage;
import com.questrail.taskbroker.protocol.model.DeliverResult;
import com.questrail.taskbroker.protocol.model.RegisterAck;
import com.questrail.taskbroker.protocol.model.RegisterExecutor;
import com.questrail.taskbroker.protocol.model.ReportResult;
import com.questrail.taskbroker.protocol.model.SubmitTask;
import com.questrail.taskbroker.protocol.model.TaskFailed;
import com.questrail.taskbroker.protocol.model.TaskRejected;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

/**
 * BrokerMessageDecoderTest
 * -----------------------------------------------------------------------------
 * Frame → message mapping for every tag, and the ways a frame is refused.
 */
final class BrokerMessageDecoderTest
{
    private final BrokerMessageDecoder decoder = new BrokerMessageDecoder();

    private BrokerMessage decode(String tag, String body) {
        return decoder.decode(new WireFrame(tag, body));
    }

    @Test
    void decodesEveryMessageType()
    {
        assertEquals(new SubmitTask("t1", "1,2,3"), decode("TASK", "t1|1,2,3"));
        assertEquals(new DeliverResult("t1", "6"), decode("RESULT", "t1|6"));
        assertEquals(new TaskFailed("t1", "executor lost"), decode("TASK_FAILED", "t1|executor lost"));
        assertEquals(new TaskRejected("t1", "duplicate task id"), decode("TASK_REJECTED", "t1|duplicate task id"));
        assertEquals(new RegisterExecutor("e1"), decode("REGISTER", "e1"));
        assertEquals(new RegisterAck("e1"), decode("ACK", "e1"));
        assertEquals(new AssignTask("t1", "1,2,3"), decode("ASSIGN_TASK", "t1|1,2,3"));
        assertEquals(new ReportResult("t1", "6"), decode("TASK_RESULT", "t1|6"));
    }

    @Test
    void lastFieldKeepsEmbeddedSeparators()
    {
        SubmitTask task = (SubmitTask) decode("TASK", "t1|a|b|c");
        assertEquals("t1", task.taskId());
        assertEquals("a|b|c", task.payload());
    }

    @Test
    void emptyPayloadIsAllowed()
    {
        assertEquals(new SubmitTask("t1", ""), decode("TASK", "t1|"));
    }

    @Test
    void unknownTagIsRejected()
    {
        ProtocolException e = assertThrows(ProtocolException.class, () -> decode("HELLO", "x"));
        assertTrue(e.getMessage().contains("HELLO"));
    }

    @Test
    void tagsAreCaseSensitive()
    {
        assertThrows(ProtocolException.class, () -> decode("task", "t1|x"));
    }

    @Test
    void missingFieldIsRejected()
    {
        assertThrows(ProtocolException.class, () -> decode("TASK", "t1"));
        assertThrows(ProtocolException.class, () -> decode("TASK_RESULT", "t1"));
    }

    @Test
    void emptyIdentifierIsRejected()
    {
        assertThrows(ProtocolException.class, () -> decode("TASK", "|payload"));
        assertThrows(ProtocolException.class, () -> decode("REGISTER", ""));
    }

    @Test
    void singleFieldIdentifierMustNotContainSeparator()
    {
        assertThrows(ProtocolException.class, () -> decode("REGISTER", "e1|extra"));
    }
}

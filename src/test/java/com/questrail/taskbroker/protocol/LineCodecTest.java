package com.questrail.taskbroker.protocol;

import com.questrail.taskbroker.protocol.model.DeliverResult;
import com.questrail.taskbroker.protocol.model.ReportResult;
import com.questrail.taskbroker.protocol.model.SubmitTask;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

/**
 * LineCodecTest
 * -----------------------------------------------------------------------------
 * End-to-end line ↔ message behaviour of the standard codec.
 */
final class LineCodecTest
{
    private final LineCodec codec = LineCodec.standard();

    @Test
    void decodesProducerLine()
    {
        assertEquals(new SubmitTask("t1", "1,2,3,4,5"), codec.decode("TASK|t1|1,2,3,4,5\r\n"));
    }

    @Test
    void encodesTerminatedLine()
    {
        assertEquals("RESULT|t1|15\n", codec.encode(new DeliverResult("t1", "15")));
    }

    @Test
    void encodedLineDecodesBack()
    {
        ReportResult message = new ReportResult("t7", "ok|partial");
        assertEquals(message, codec.decode(codec.encode(message)));
    }

    @Test
    void unframeableLineThrows()
    {
        ProtocolException e = assertThrows(ProtocolException.class, () -> codec.decode("garbage"));
        assertTrue(e.getMessage().startsWith("Unframeable line"));
    }

    @Test
    void blankLineThrows()
    {
        assertThrows(ProtocolException.class, () -> codec.decode(""));
    }

    @Test
    void abbreviateShortensLongLines()
    {
        String longLine = "TASK|t1|" + "x".repeat(200);
        String shortened = LineCodec.abbreviate(longLine);

        assertEquals(67, shortened.length());
        assertTrue(shortened.endsWith("..."));
        assertEquals("<null>", LineCodec.abbreviate(null));
    }
}

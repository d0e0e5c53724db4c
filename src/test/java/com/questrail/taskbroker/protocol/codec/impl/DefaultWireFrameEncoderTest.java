package com.questrail.taskbroker.protocol.codec.impl;

import com.questrail.taskbroker.protocol.internal.frame.WireFrame;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

final class DefaultWireFrameEncoderTest
{
    private final DefaultWireFrameEncoder encoder = new DefaultWireFrameEncoder();

    @Test
    void joinsTagAndBodyAndTerminatesTheLine()
    {
        assertEquals("ASSIGN_TASK|t1|1,2,3\n", encoder.encode(new WireFrame("ASSIGN_TASK", "t1|1,2,3")));
    }

    @Test
    void encodedLineDecodesToTheSameFrame()
    {
        WireFrame frame = new WireFrame("RESULT", "t9|x|y");
        String line = encoder.encode(frame);

        assertEquals(frame, new DefaultWireFrameDecoder().decode(line).orElseThrow());
    }
}

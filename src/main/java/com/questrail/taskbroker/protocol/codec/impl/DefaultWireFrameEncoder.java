package com.questrail.taskbroker.protocol.codec.impl;

import com.questrail.taskbroker.protocol.codec.WireFrameEncoder;
import com.questrail.taskbroker.protocol.internal.frame.WireFrame;

import java.util.Objects;

/**
 * Concrete {@link WireFrameEncoder}: {@code tag + '|' + body + '\n'}.
 */
public final class DefaultWireFrameEncoder implements WireFrameEncoder
{
    @Override
    public String encode(WireFrame frame)
    {
        Objects.requireNonNull(frame, "frame");
        return frame.tag() + WireFraming.FIELD_SEPARATOR + frame.body() + WireFraming.LINE_TERMINATOR;
    }
}

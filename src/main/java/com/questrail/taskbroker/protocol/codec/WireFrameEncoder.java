package com.questrail.taskbroker.protocol.codec;

import com.questrail.taskbroker.protocol.internal.frame.WireFrame;

/**
 * WireFrameEncoder
 * -----------------------------------------------------------------------------
 * Text-level encoder producing a complete, terminated protocol line.
 *
 * <p>The encoder assumes the frame body has already been validated by the
 * message layer and performs no semantic checks of its own.</p>
 */
public interface WireFrameEncoder
{
    /**
     * @param frame frame to encode
     * @return {@code TAG|body} followed by the line terminator
     */
    String encode(WireFrame frame);
}

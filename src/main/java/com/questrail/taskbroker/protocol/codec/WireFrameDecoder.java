package com.questrail.taskbroker.protocol.codec;

import com.questrail.taskbroker.protocol.internal.frame.WireFrame;

import java.util.Optional;

/**
 * WireFrameDecoder
 * -----------------------------------------------------------------------------
 * Text-level decoder for the pipe-delimited line format.
 *
 * <p>The decoder is responsible only for:</p>
 * <ul>
 *   <li>Removing any line terminator left by the transport</li>
 *   <li>Separating the tag from the body</li>
 * </ul>
 *
 * <p>It does not look up tags, count fields or build messages. Lines that
 * cannot be framed at all (blank, no separator, empty tag) are reported as
 * {@link Optional#empty()}.</p>
 */
public interface WireFrameDecoder
{
    /**
     * Attempt to frame exactly one protocol line.
     *
     * @param line one line as delivered by the transport
     * @return the frame, or empty if the line has no recognisable structure
     */
    Optional<WireFrame> decode(String line);
}

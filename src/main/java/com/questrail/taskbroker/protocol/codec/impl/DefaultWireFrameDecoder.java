package com.questrail.taskbroker.protocol.codec.impl;

import com.questrail.taskbroker.protocol.codec.WireFrameDecoder;
import com.questrail.taskbroker.protocol.internal.frame.WireFrame;

import java.util.Optional;

/**
 * DefaultWireFrameDecoder
 * -----------------------------------------------------------------------------
 * Concrete {@link WireFrameDecoder}.
 *
 * <p>Steps, in order:</p>
 * <ol>
 *   <li>Strip one trailing line terminator, if the transport left it</li>
 *   <li>Reject blank lines</li>
 *   <li>Split at the first {@code |} into tag and body</li>
 * </ol>
 *
 * <p>Every message type carries at least one field, so a line without a
 * separator cannot be framed.</p>
 */
public final class DefaultWireFrameDecoder implements WireFrameDecoder
{
    @Override
    public Optional<WireFrame> decode(String line)
    {
        if (line == null) {
            return Optional.empty();
        }

        String stripped = WireFraming.stripTerminator(line);
        if (stripped.isBlank()) {
            return Optional.empty();
        }

        int sep = stripped.indexOf(WireFraming.FIELD_SEPARATOR);
        if (sep <= 0) {
            return Optional.empty();
        }

        return Optional.of(new WireFrame(stripped.substring(0, sep), stripped.substring(sep + 1)));
    }
}

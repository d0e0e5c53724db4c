package com.questrail.taskbroker.protocol.internal.frame;

import java.util.Objects;

/**
 * WireFrame
 * -----------------------------------------------------------------------------
 * One protocol line after framing, before semantic interpretation.
 *
 * <p>The tag has been separated from the rest of the line; the body is kept
 * verbatim because only the message layer knows how many fields a tag
 * carries, and therefore where the free-form last field begins.</p>
 *
 * <p>A frame is still <em>not</em> a message: the tag may be unknown and the
 * body may have the wrong shape.</p>
 */
public record WireFrame(String tag, String body)
{
    public WireFrame {
        Objects.requireNonNull(tag, "tag");
        Objects.requireNonNull(body, "body");
    }

    @Override
    public String toString() {
        return "WireFrame[tag=" + tag + ", bodyLength=" + body.length() + ']';
    }
}

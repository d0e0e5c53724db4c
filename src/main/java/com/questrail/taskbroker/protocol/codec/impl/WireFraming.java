package com.questrail.taskbroker.protocol.codec.impl;

import java.util.ArrayList;
import java.util.List;

/**
 * WireFraming
 * -----------------------------------------------------------------------------
 * Separator constants and the bounded split shared by the frame and message
 * layers.
 */
public final class WireFraming
{
    public static final char FIELD_SEPARATOR = '|';
    public static final String LINE_TERMINATOR = "\n";

    private WireFraming() {
    }

    /**
     * Remove a single trailing {@code \n}, {@code \r\n} or {@code \r}.
     */
    public static String stripTerminator(String line) {
        int end = line.length();
        if (end > 0 && line.charAt(end - 1) == '\n') {
            end--;
        }
        if (end > 0 && line.charAt(end - 1) == '\r') {
            end--;
        }
        return line.substring(0, end);
    }

    /**
     * Split {@code text} on {@link #FIELD_SEPARATOR} into at most
     * {@code limit} parts. The last part keeps any remaining separators.
     *
     * <p>{@code splitBounded("a|b|c", 2)} returns {@code [a, b|c]};
     * {@code splitBounded("a", 2)} returns {@code [a]}.</p>
     */
    public static List<String> splitBounded(String text, int limit) {
        if (limit < 1) {
            throw new IllegalArgumentException("limit must be >= 1");
        }

        List<String> parts = new ArrayList<>(limit);
        int start = 0;
        while (parts.size() < limit - 1) {
            int sep = text.indexOf(FIELD_SEPARATOR, start);
            if (sep < 0) {
                break;
            }
            parts.add(text.substring(start, sep));
            start = sep + 1;
        }
        parts.add(text.substring(start));
        return parts;
    }

    /**
     * True if the value contains a carriage return or line feed.
     */
    public static boolean containsLineBreak(String value) {
        return value.indexOf('\n') >= 0 || value.indexOf('\r') >= 0;
    }
}

package com.questrail.taskbroker.transport;

/**
 * LineSession
 * -----------------------------------------------------------------------------
 * Per-connection protocol handler driven by a {@link SessionTransportAdapter}.
 *
 * <p>Calls for one connection are serialized: {@link #onLine(String)} is
 * never invoked concurrently with itself or with {@link #onClosed(Throwable)},
 * and nothing is delivered after {@code onClosed}.</p>
 */
public interface LineSession
{
    /**
     * One inbound line, without its terminator.
     */
    void onLine(String line);

    /**
     * The connection has closed.
     *
     * @param cause I/O failure that closed it, or {@code null} for an orderly close
     */
    void onClosed(Throwable cause);
}

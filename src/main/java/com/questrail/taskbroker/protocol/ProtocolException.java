package com.questrail.taskbroker.protocol;

/**
 * Indicates that a line could not be translated to or from a valid broker
 * message.
 *
 * This typically reflects:
 * <ul>
 *   <li>An unknown tag</li>
 *   <li>The wrong number of fields for the tag</li>
 *   <li>An empty identifier, or one containing the field separator</li>
 *   <li>A field containing a line break (encode side)</li>
 * </ul>
 *
 * A protocol error is local to the connection it occurred on. Callers decide
 * whether to log and continue or to close the connection.
 */
public final class ProtocolException extends RuntimeException
{
    public ProtocolException(String message) {
        super(message);
    }

    public ProtocolException(String message, Throwable cause) {
        super(message, cause);
    }
}

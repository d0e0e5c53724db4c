/**
 * Broker Wire Codec Ports
 * =============================================================================
 *
 * <p>Interfaces for the text boundary between transport lines and
 * {@link com.questrail.taskbroker.protocol.internal.frame.WireFrame} instances.</p>
 *
 * <pre>
 *   String line
 *        → WireFrameDecoder
 *            → WireFrame
 *                → BrokerMessageDecoder
 *                    → BrokerMessage
 * </pre>
 *
 * <p>The outbound path is the mirror image through
 * {@code BrokerMessageEncoder} and {@link com.questrail.taskbroker.protocol.codec.WireFrameEncoder}.
 * Both paths are pure and stateless.</p>
 */
package com.questrail.taskbroker.protocol.codec;

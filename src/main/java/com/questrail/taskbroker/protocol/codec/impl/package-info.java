/**
 * Broker Codec (Line-Level Implementation)
 * =============================================================================
 *
 * <p>Concrete line framing for the broker protocol: UTF-8 text, one message
 * per line, fields separated by {@code |}.</p>
 *
 * <pre>
 *   String line
 *        → WireFraming.stripTerminator
 *        → split at first '|'
 *        → WireFrame
 * </pre>
 *
 * <p>This layer never throws for malformed input; unframeable lines come
 * back as {@code Optional.empty()} and the caller reports them.</p>
 */
package com.questrail.taskbroker.protocol.codec.impl;

/**
 * Broker Transport Ports
 * =============================================================================
 *
 * <p>Framework-agnostic boundary between a concrete networking implementation
 * (Netty TCP in production, fakes in tests) and the broker sessions.</p>
 *
 * <p>Everything above this package sees only:</p>
 * <ul>
 *   <li>inbound lines as {@code String}</li>
 *   <li>connections as {@link com.questrail.taskbroker.transport.ConnectionHandle}</li>
 *   <li>endpoint and connection lifecycle callbacks</li>
 * </ul>
 *
 * <h2>Constraints</h2>
 * Endpoint implementations perform I/O and line framing only. They do not
 * decode messages, keep broker state, retry, or close connections on
 * protocol grounds. {@link com.questrail.taskbroker.transport.SessionTransportAdapter}
 * is the single place where connections are bound to sessions.
 */
package com.questrail.taskbroker.transport;

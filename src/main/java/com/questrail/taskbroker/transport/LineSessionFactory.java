package com.questrail.taskbroker.transport;

/**
 * Creates the session that owns a newly accepted connection.
 */
@FunctionalInterface
public interface LineSessionFactory
{
    LineSession open(ConnectionHandle connection);
}

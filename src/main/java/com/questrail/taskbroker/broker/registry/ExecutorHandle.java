package com.questrail.taskbroker.broker.registry;

import com.questrail.taskbroker.transport.ConnectionHandle;

import java.util.Objects;

/**
 * A registered executor as handed out by {@link ExecutorRegistry#acquire}.
 *
 * @param id         executor id announced in {@code REGISTER}
 * @param connection connection owned by the executor's session
 */
public record ExecutorHandle(String id, ConnectionHandle connection)
{
    public ExecutorHandle {
        Objects.requireNonNull(id, "id");
        Objects.requireNonNull(connection, "connection");
    }
}

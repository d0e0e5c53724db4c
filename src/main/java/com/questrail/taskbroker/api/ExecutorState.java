package com.questrail.taskbroker.api;

/**
 * Availability of a registered executor.
 */
public enum ExecutorState
{
    /** In the idle pool, eligible for the next acquisition. */
    IDLE,
    /** Selected by the dispatch engine; waiting for its result. */
    BUSY
}

package com.questrail.taskbroker.internal.time;

import java.time.Instant;

/**
 * WallClock
 * =============================================================================
 * Wall-clock source used only to timestamp observability events.
 *
 * <p>It may jump (NTP, manual adjustment) and therefore never drives
 * backoff or acquisition timing.</p>
 */
@FunctionalInterface
public interface WallClock
{
    Instant now();
}

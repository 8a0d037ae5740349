package com.questrail.interactivity.internal.time;

import java.time.Instant;

/**
 * Wall-clock source used strictly for observability timestamps.
 *
 * <p>
 * This clock may jump. It MUST NOT be used for session deadlines.
 * </p>
 */
public interface WallClock
{
    Instant now();
}

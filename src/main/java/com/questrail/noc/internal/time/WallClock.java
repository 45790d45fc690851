package com.questrail.noc.internal.time;

import java.time.Instant;

/**
 * Wall-clock source used strictly for event timestamps.
 *
 * <p>May jump due to NTP or DST. MUST NOT drive poll deadlines.</p>
 */
public interface WallClock
{
    Instant now();
}

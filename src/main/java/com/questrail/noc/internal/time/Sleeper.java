package com.questrail.noc.internal.time;

import java.time.Duration;

/**
 * Blocks the calling thread between poll attempts.
 *
 * <p>Separated from {@link MonotonicClock} so that tests can replace real
 * sleeping with an advance of a manual clock.</p>
 */
@FunctionalInterface
public interface Sleeper
{
    /**
     * Production sleeper backed by {@link Thread#sleep(long)}.
     */
    Sleeper SYSTEM = duration -> Thread.sleep(duration.toMillis());

    void sleep(Duration duration) throws InterruptedException;
}

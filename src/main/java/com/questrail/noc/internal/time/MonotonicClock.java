package com.questrail.noc.internal.time;

/**
 * MonotonicClock
 * =============================================================================
 * Time source for deadlines, such as the bound on an outlet-state poll.
 *
 * <h2>Binding invariant</h2>
 * Every elapsed-time decision MUST use a monotonic source. Wall-clock time
 * ({@link WallClock}) is only used to stamp observability events.
 */
public interface MonotonicClock
{
    /**
     * Returns a monotonically increasing tick value in nanoseconds. Only the
     * difference between two readings is meaningful.
     */
    long nowNanos();
}

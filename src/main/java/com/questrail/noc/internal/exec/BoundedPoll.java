package com.questrail.noc.internal.exec;

import com.questrail.noc.internal.time.MonotonicClock;
import com.questrail.noc.internal.time.Sleeper;

import java.time.Duration;
import java.util.Objects;
import java.util.function.BooleanSupplier;

/**
 * BoundedPoll
 * =============================================================================
 * Fixed-interval, bounded wait for a hardware state to be observed.
 *
 * <p>Used after a command whose effect is not instantaneous (an outlet
 * reboot, for instance). The condition is evaluated immediately, then again
 * after each fixed interval, until it holds or the total bound has elapsed
 * on the {@link MonotonicClock}.</p>
 *
 * <h2>Outcome model</h2>
 * <ul>
 *   <li>{@code true}: the condition was observed to hold</li>
 *   <li>{@code false}: the bound elapsed first, or the waiting thread was
 *       interrupted (the interrupt flag is restored)</li>
 * </ul>
 * Exhausting the bound is an ordinary outcome, never an exception. Exceptions
 * thrown by the condition itself (a transport failure) propagate unchanged.
 *
 * <p>This class does not retry the command that caused the transition; it
 * only re-reads state.</p>
 */
public final class BoundedPoll
{
    private final MonotonicClock clock;
    private final Sleeper sleeper;
    private final Duration interval;
    private final Duration timeout;

    public BoundedPoll(MonotonicClock clock, Sleeper sleeper, Duration interval, Duration timeout)
    {
        this.clock = Objects.requireNonNull(clock, "clock");
        this.sleeper = Objects.requireNonNull(sleeper, "sleeper");
        this.interval = Objects.requireNonNull(interval, "interval");
        this.timeout = Objects.requireNonNull(timeout, "timeout");

        if (interval.isNegative() || timeout.isNegative()) {
            throw new IllegalArgumentException("interval and timeout must be non-negative");
        }
    }

    /**
     * Polls {@code condition} until it holds or the bound elapses.
     *
     * @return the outcome of the wait; see class documentation
     */
    public Outcome await(BooleanSupplier condition)
    {
        Objects.requireNonNull(condition, "condition");

        final long start = clock.nowNanos();
        final long bound = timeout.toNanos();
        int attempts = 0;

        while (true) {
            attempts++;
            if (condition.getAsBoolean()) {
                return new Outcome(true, attempts);
            }

            long elapsed = clock.nowNanos() - start;
            if (elapsed >= bound) {
                return new Outcome(false, attempts);
            }

            // Never sleep past the deadline.
            Duration pause = interval;
            long remaining = bound - elapsed;
            if (pause.toNanos() > remaining) {
                pause = Duration.ofNanos(remaining);
            }

            try {
                sleeper.sleep(pause);
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                return new Outcome(false, attempts);
            }
        }
    }

    /**
     * Result of a bounded wait.
     *
     * @param satisfied whether the condition was observed to hold
     * @param attempts  how many times the condition was evaluated
     */
    public record Outcome(boolean satisfied, int attempts) {
    }
}

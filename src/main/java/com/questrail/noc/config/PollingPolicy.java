package com.questrail.noc.config;

import java.time.Duration;
import java.util.Objects;

/**
 * PollingPolicy
 * -----------------------------------------------------------------------------
 * Operational timing configuration shared by the switch and PDU facades.
 *
 * <p>This is deliberately <em>operational only</em>. It controls how long the
 * transport waits for a device to answer and how hardware state is re-polled
 * after a command; it never decides whether a command succeeded.</p>
 *
 * <h2>Configuration Parameters</h2>
 * <ul>
 *   <li><b>commandTimeout</b>: Maximum time to wait for the expected prompt
 *       or signal after sending a CLI command. Enforced by the transport, which
 *       is the only place a blocked read can be abandoned safely.</li>
 *   <li><b>livenessTimeout</b>: Maximum time a liveness probe may wait for
 *       the prompt to reappear. Kept short so that {@code isConnected()} is
 *       cheap to call.</li>
 *   <li><b>outletPollInterval</b>: Fixed delay between reads of an outlet's
 *       state while waiting for a commanded transition.</li>
 *   <li><b>outletPollTimeout</b>: Total bound on that wait. When it elapses
 *       the command is reported as not confirmed.</li>
 * </ul>
 */
public record PollingPolicy(
        Duration commandTimeout,
        Duration livenessTimeout,
        Duration outletPollInterval,
        Duration outletPollTimeout
) {
    public PollingPolicy {
        Objects.requireNonNull(commandTimeout, "commandTimeout");
        Objects.requireNonNull(livenessTimeout, "livenessTimeout");
        Objects.requireNonNull(outletPollInterval, "outletPollInterval");
        Objects.requireNonNull(outletPollTimeout, "outletPollTimeout");

        if (commandTimeout.isNegative()) {
            throw new IllegalArgumentException("commandTimeout must be non-negative");
        }
        if (livenessTimeout.isNegative()) {
            throw new IllegalArgumentException("livenessTimeout must be non-negative");
        }
        if (outletPollInterval.isNegative()) {
            throw new IllegalArgumentException("outletPollInterval must be non-negative");
        }
        if (outletPollTimeout.isNegative()) {
            throw new IllegalArgumentException("outletPollTimeout must be non-negative");
        }
    }

    /**
     * Creates a policy with typical defaults:
     * <ul>
     *   <li>commandTimeout: 10s</li>
     *   <li>livenessTimeout: 2s</li>
     *   <li>outletPollInterval: 1s</li>
     *   <li>outletPollTimeout: 30s</li>
     * </ul>
     *
     * <p>The outlet bound is generous because an APC "reboot" cycles the
     * outlet through its configured off delay before it reports on again.</p>
     */
    public static PollingPolicy defaults() {
        return new PollingPolicy(
                Duration.ofSeconds(10),
                Duration.ofSeconds(2),
                Duration.ofSeconds(1),
                Duration.ofSeconds(30)
        );
    }

    /**
     * Returns a copy with a different outlet wait, keeping the CLI timeouts.
     */
    public PollingPolicy withOutletPoll(Duration interval, Duration timeout) {
        return new PollingPolicy(commandTimeout, livenessTimeout, interval, timeout);
    }
}

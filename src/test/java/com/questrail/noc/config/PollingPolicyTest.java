package com.questrail.noc.config;

import org.junit.jupiter.api.Test;

import java.time.Duration;

import static org.junit.jupiter.api.Assertions.*;

/**
 * PollingPolicyTest
 * -----------------------------------------------------------------------------
 * Validates timing policy configuration and factory methods.
 */
class PollingPolicyTest {

    @Test
    void canonicalConstructorAcceptsZeroDurations() {
        PollingPolicy policy = new PollingPolicy(Duration.ZERO, Duration.ZERO, Duration.ZERO, Duration.ZERO);

        assertEquals(Duration.ZERO, policy.commandTimeout());
        assertEquals(Duration.ZERO, policy.outletPollTimeout());
    }

    @Test
    void canonicalConstructorRejectsNulls() {
        assertThrows(NullPointerException.class, () ->
                new PollingPolicy(null, Duration.ZERO, Duration.ZERO, Duration.ZERO));
        assertThrows(NullPointerException.class, () ->
                new PollingPolicy(Duration.ZERO, Duration.ZERO, Duration.ZERO, null));
    }

    @Test
    void canonicalConstructorRejectsNegativeDurations() {
        assertThrows(IllegalArgumentException.class, () ->
                new PollingPolicy(Duration.ofMillis(-1), Duration.ZERO, Duration.ZERO, Duration.ZERO));
        assertThrows(IllegalArgumentException.class, () ->
                new PollingPolicy(Duration.ZERO, Duration.ofMillis(-1), Duration.ZERO, Duration.ZERO));
        assertThrows(IllegalArgumentException.class, () ->
                new PollingPolicy(Duration.ZERO, Duration.ZERO, Duration.ofMillis(-1), Duration.ZERO));
        assertThrows(IllegalArgumentException.class, () ->
                new PollingPolicy(Duration.ZERO, Duration.ZERO, Duration.ZERO, Duration.ofMillis(-1)));
    }

    @Test
    void defaultsFactoryReturnsExpectedValues() {
        PollingPolicy policy = PollingPolicy.defaults();

        assertEquals(Duration.ofSeconds(10), policy.commandTimeout());
        assertEquals(Duration.ofSeconds(2), policy.livenessTimeout());
        assertEquals(Duration.ofSeconds(1), policy.outletPollInterval());
        assertEquals(Duration.ofSeconds(30), policy.outletPollTimeout());
    }

    @Test
    void withOutletPollKeepsCommandTimeouts() {
        PollingPolicy policy = PollingPolicy.defaults()
                .withOutletPoll(Duration.ofMillis(250), Duration.ofSeconds(5));

        assertEquals(Duration.ofSeconds(10), policy.commandTimeout());
        assertEquals(Duration.ofSeconds(2), policy.livenessTimeout());
        assertEquals(Duration.ofMillis(250), policy.outletPollInterval());
        assertEquals(Duration.ofSeconds(5), policy.outletPollTimeout());
    }
}

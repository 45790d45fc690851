package com.questrail.noc.observability;

import java.time.Instant;

/**
 * Record representing an error or anomaly while talking to a device.
 */
public record NocErrorEvent(
    Instant timestamp,
    String host,
    String message,
    Throwable cause
) {
}

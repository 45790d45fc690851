package com.questrail.noc.observability;

import java.time.Instant;

/**
 * Record representing one command exchanged with a device.
 *
 * <p>{@code command} never carries secrets; the enable password is reported
 * as a masked placeholder.</p>
 */
public record CommandEvent(
    Instant timestamp,
    String host,
    String command,
    int outputLength
) {
}

package com.questrail.noc.observability;

import java.time.Instant;

/**
 * Record representing the outcome of verifying a mutating operation.
 *
 * @param operation short operation name, e.g. {@code poe-on}
 * @param target    the normalized port or outlet the operation addressed
 * @param expected  the state the operation intended
 * @param observed  the state read back from the device
 * @param confirmed whether the observed state matched the intent
 */
public record VerificationEvent(
    Instant timestamp,
    String host,
    String operation,
    String target,
    String expected,
    String observed,
    boolean confirmed
) {
}

package com.questrail.noc.switching.model;

import java.util.Locale;
import java.util.Objects;

/**
 * Power-over-Ethernet status of a single port.
 *
 * @param interfaceName shorthand port name
 * @param adminState    configured mode as printed by the device ({@code auto}, {@code off}, {@code static})
 * @param operState     operational state ({@code on}, {@code off}, {@code faulty}, ...)
 * @param maxMilliwatts the port's power ceiling in milliwatts
 */
public record PoeStatusEntry(
        String interfaceName,
        String adminState,
        String operState,
        int maxMilliwatts
) {
    /**
     * Returned when the port could not be found or the switch is not connected.
     */
    public static final PoeStatusEntry UNKNOWN = new PoeStatusEntry("", "unknown", "unknown", 0);

    public PoeStatusEntry {
        Objects.requireNonNull(interfaceName, "interfaceName");
        Objects.requireNonNull(adminState, "adminState");
        Objects.requireNonNull(operState, "operState");
    }

    /**
     * Whether the admin state names the given mode, e.g. {@code auto}.
     */
    public boolean adminStateContains(String mode) {
        return adminState.toLowerCase(Locale.ROOT).contains(mode.toLowerCase(Locale.ROOT));
    }

    /**
     * Whether the port will deliver power to a detected device.
     */
    public boolean isPowerEnabled() {
        return adminStateContains(PoeMode.AUTO.keyword());
    }

    public boolean isUnknown() {
        return this.equals(UNKNOWN);
    }
}

package com.questrail.noc.switching.model;

import java.util.Objects;

/**
 * An active IP Device Tracking binding: which IP address was seen behind
 * which MAC address on which port.
 */
public record IpDeviceTrackingEntry(String ipAddress, MacAddress mac, String interfaceName) {
    public IpDeviceTrackingEntry {
        Objects.requireNonNull(ipAddress, "ipAddress");
        Objects.requireNonNull(mac, "mac");
        Objects.requireNonNull(interfaceName, "interfaceName");
    }
}

package com.questrail.noc.switching.model;

import java.util.Objects;

/**
 * One learned address from the switch MAC address table.
 *
 * @param mac           the learned address
 * @param interfaceName the shorthand name of the port it was learned on
 */
public record MacAddressEntry(MacAddress mac, String interfaceName) {
    public MacAddressEntry {
        Objects.requireNonNull(mac, "mac");
        Objects.requireNonNull(interfaceName, "interfaceName");
    }
}

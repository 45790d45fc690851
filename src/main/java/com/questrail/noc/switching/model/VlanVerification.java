package com.questrail.noc.switching.model;

/**
 * Result of checking a port's VLAN against an expected value.
 *
 * @param matched      whether the port is a member of the expected VLAN
 * @param observedVlan the VLAN the port was found in, or {@code -1} if none
 */
public record VlanVerification(boolean matched, int observedVlan) {
}

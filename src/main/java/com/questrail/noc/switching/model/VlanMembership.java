package com.questrail.noc.switching.model;

import java.util.List;
import java.util.Objects;

/**
 * A VLAN and the access ports assigned to it, as listed by {@code show vlan brief}.
 *
 * @param vlanId           VLAN number
 * @param status           status column ({@code active}, {@code act/unsup}, ...)
 * @param memberInterfaces shorthand names of the member ports, in listing order
 */
public record VlanMembership(int vlanId, String status, List<String> memberInterfaces) {
    public VlanMembership {
        Objects.requireNonNull(status, "status");
        memberInterfaces = List.copyOf(memberInterfaces);
    }

    public boolean contains(String port) {
        return memberInterfaces.stream().anyMatch(member -> PortNames.samePort(member, port));
    }
}

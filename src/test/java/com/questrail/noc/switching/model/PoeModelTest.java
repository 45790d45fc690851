package com.questrail.noc.switching.model;

import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class PoeModelTest {

    @Test
    void poeModeResolvesKeywordsIgnoringCase() {
        assertEquals(PoeMode.AUTO, PoeMode.fromKeyword("auto"));
        assertEquals(PoeMode.STATIC, PoeMode.fromKeyword("STATIC"));
        assertEquals(PoeMode.NEVER, PoeMode.fromKeyword("never"));
        assertThrows(IllegalArgumentException.class, () -> PoeMode.fromKeyword("always"));
        assertThrows(IllegalArgumentException.class, () -> PoeMode.fromKeyword(null));
    }

    @Test
    void adminStateDecidesWhetherPowerIsEnabled() {
        assertTrue(new PoeStatusEntry("Gi1/0/1", "auto", "off", 30_000).isPowerEnabled());
        assertFalse(new PoeStatusEntry("Gi1/0/1", "off", "off", 30_000).isPowerEnabled());
        assertTrue(new PoeStatusEntry("Gi1/0/1", "static", "on", 15_400).adminStateContains("static"));
        assertFalse(PoeStatusEntry.UNKNOWN.isPowerEnabled());
    }

    @Test
    void vlanMembershipCopiesMemberList() {
        List<String> ports = new ArrayList<>(List.of("Gi1/0/1"));
        VlanMembership vlan = new VlanMembership(701, "active", ports);
        ports.add("Gi1/0/2");

        assertEquals(List.of("Gi1/0/1"), vlan.memberInterfaces());
        assertTrue(vlan.contains("GigabitEthernet1/0/1"));
        assertFalse(vlan.contains("Gi1/0/2"));
        assertThrows(UnsupportedOperationException.class, () -> vlan.memberInterfaces().add("Gi1/0/3"));
    }
}

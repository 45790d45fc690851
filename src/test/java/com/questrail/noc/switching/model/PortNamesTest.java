package com.questrail.noc.switching.model;

import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

class PortNamesTest {

    @Test
    void longFormsMapToShorthand() {
        assertEquals("Fa1/0/1", PortNames.shorthand("FastEthernet1/0/1"));
        assertEquals("Gi1/0/1", PortNames.shorthand("GigabitEthernet1/0/1"));
        assertEquals("Ten1/0/1", PortNames.shorthand("TenGigabitEthernet1/0/1"));
    }

    @Test
    void prefixMatchIgnoresCaseAndKeepsRemainder() {
        assertEquals("Gi1/0/48", PortNames.shorthand("gigabitethernet1/0/48"));
        assertEquals("Ten1/1/1", PortNames.shorthand("TENGIGABITETHERNET1/1/1"));
    }

    @Test
    void unknownAndEmptyNamesPassThrough() {
        assertEquals("Gi1/0/1", PortNames.shorthand("Gi1/0/1"));
        assertEquals("Po1", PortNames.shorthand("Po1"));
        assertEquals("CPU", PortNames.shorthand("CPU"));
        assertEquals("", PortNames.shorthand(""));
        assertNull(PortNames.shorthand(null));
    }

    @Test
    void shorthandIsIdempotent() {
        String once = PortNames.shorthand("TenGigabitEthernet2/1/4");
        assertEquals(once, PortNames.shorthand(once));
    }

    @Test
    void physicalPortsAreFastGigabitAndTenGigabit() {
        assertTrue(PortNames.isPhysical("Gi1/0/1"));
        assertTrue(PortNames.isPhysical("FastEthernet0/1"));
        assertTrue(PortNames.isPhysical("Ten1/1/1"));
        assertFalse(PortNames.isPhysical("CPU"));
        assertFalse(PortNames.isPhysical("Po1"));
        assertFalse(PortNames.isPhysical("Vl601"));
        assertFalse(PortNames.isPhysical(null));
    }

    @Test
    void samePortComparesNormalizedNames() {
        assertTrue(PortNames.samePort("GigabitEthernet1/0/1", "Gi1/0/1"));
        assertTrue(PortNames.samePort("gi1/0/1", "Gi1/0/1"));
        assertFalse(PortNames.samePort("Gi1/0/1", "Gi1/0/10"));
        assertFalse(PortNames.samePort(null, "Gi1/0/1"));
    }
}

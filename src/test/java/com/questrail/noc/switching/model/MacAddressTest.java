package com.questrail.noc.switching.model;

import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

class MacAddressTest {

    @Test
    void dottedColonAndDashFormsAreEqual() {
        MacAddress dotted = MacAddress.parse("000b.7866.5240");
        MacAddress colon = MacAddress.parse("00:0B:78:66:52:40");
        MacAddress dash = MacAddress.parse("00-0b-78-66-52-40");

        assertEquals(dotted, colon);
        assertEquals(dotted, dash);
        assertEquals(dotted.hashCode(), dash.hashCode());
    }

    @Test
    void printsLowerCaseColonAndDottedForms() {
        MacAddress mac = MacAddress.parse("6CEC.EB68.C86F");

        assertEquals("6c:ec:eb:68:c8:6f", mac.toString());
        assertEquals("6cec.eb68.c86f", mac.toDottedString());
        assertEquals(0x6cecEb68c86fL, mac.value());
    }

    @Test
    void rejectsMalformedText() {
        assertThrows(IllegalArgumentException.class, () -> MacAddress.parse("000b.7866"));
        assertThrows(IllegalArgumentException.class, () -> MacAddress.parse("00:0b:78:66:52:4g"));
        assertThrows(IllegalArgumentException.class, () -> MacAddress.parse(""));
    }

    @Test
    void ordersByNumericValue() {
        assertTrue(MacAddress.parse("0000.0000.0001").compareTo(MacAddress.parse("0000.0000.0002")) < 0);
    }
}

package com.questrail.noc.switching.internal.parse;

import com.questrail.noc.switching.Fixtures;
import com.questrail.noc.switching.model.IpDeviceTrackingEntry;
import com.questrail.noc.switching.model.MacAddress;
import com.questrail.noc.switching.model.MacAddressEntry;
import com.questrail.noc.switching.model.PoeStatusEntry;
import com.questrail.noc.switching.model.VlanMembership;
import com.questrail.noc.switching.model.VlanVerification;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Optional;
import java.util.stream.Collectors;

import static org.junit.jupiter.api.Assertions.*;

/**
 * SwitchOutputParserTest
 * -----------------------------------------------------------------------------
 * Pins the parser against captured IOS output.
 */
class SwitchOutputParserTest {

    // ---------------------------------------------------------------------
    // MAC address table
    // ---------------------------------------------------------------------

    @Test
    void macTableKeepsOnlyPhysicalPortsSortedByInterface() {
        List<MacAddressEntry> entries =
                SwitchOutputParser.parseMacAddressTable(Fixtures.load(Fixtures.MAC_ADDRESS_TABLE), null);

        assertEquals(
                List.of("Gi1/0/12", "Gi1/0/14", "Gi1/0/2", "Gi1/0/48", "Gi1/0/48"),
                entries.stream().map(MacAddressEntry::interfaceName).collect(Collectors.toList()));
        assertEquals(MacAddress.parse("6cec.eb67.836c"), entries.get(0).mac());
        assertEquals("6c:ec:eb:67:83:6c", entries.get(0).mac().toString());
    }

    @Test
    void macTableDropsIgnoredPortGivenInLongForm() {
        List<MacAddressEntry> entries = SwitchOutputParser.parseMacAddressTable(
                Fixtures.load(Fixtures.MAC_ADDRESS_TABLE), "GigabitEthernet1/0/48");

        assertEquals(3, entries.size());
        assertTrue(entries.stream().noneMatch(e -> e.interfaceName().equals("Gi1/0/48")));
    }

    @Test
    void macTableRowWithTooFewFieldsIsAParseError() {
        String output = "Vlan    Mac Address       Type        Ports\n"
                + " 601    000b.7866.5240    DYNAMIC\n";

        SwitchParseException e = assertThrows(SwitchParseException.class,
                () -> SwitchOutputParser.parseMacAddressTable(output, null));
        assertEquals("601    000b.7866.5240    DYNAMIC", e.line());
    }

    @Test
    void macTableWithOnlyCpuAndPortChannelRowsIsEmpty() {
        String output = "Vlan    Mac Address       Type        Ports\n"
                + "----    -----------       --------    -----\n"
                + " All    0100.0ccc.cccc    STATIC      CPU\n"
                + " All    0180.c200.0000    STATIC      CPU\n"
                + " 601    000b.7866.5240    DYNAMIC     Po1\n"
                + "Total Mac Addresses for this criterion: 3\n";

        assertTrue(SwitchOutputParser.parseMacAddressTable(output, null).isEmpty());
    }

    @Test
    void bannerOnlyOutputYieldsEmptyTables() {
        String output = "show mac address-table\r\n"
                + "          Mac Address Table\r\n"
                + "-------------------------------------------\r\n"
                + "Total Mac Addresses for this criterion: 0\r\n"
                + "sw-lab#";

        assertTrue(SwitchOutputParser.parseMacAddressTable(output, null).isEmpty());
        assertTrue(SwitchOutputParser.parseIpDeviceTracking(output).isEmpty());
        assertTrue(SwitchOutputParser.parseMacAddressTable("", null).isEmpty());
        assertTrue(SwitchOutputParser.parseMacAddressTable(null, null).isEmpty());
    }

    // ---------------------------------------------------------------------
    // IP device tracking
    // ---------------------------------------------------------------------

    @Test
    void ipDeviceTrackingKeepsActiveBindingsWithShorthandInterfaces() {
        List<IpDeviceTrackingEntry> entries =
                SwitchOutputParser.parseIpDeviceTracking(Fixtures.load(Fixtures.IP_DEVICE_TRACKING));

        assertEquals(2, entries.size());

        IpDeviceTrackingEntry first = entries.get(0);
        assertEquals("192.168.1.15", first.ipAddress());
        assertEquals(MacAddress.parse("6c:ec:eb:67:83:6c"), first.mac());
        assertEquals("Gi1/0/12", first.interfaceName());

        assertEquals("Gi1/0/14", entries.get(1).interfaceName());
    }

    @Test
    void ipDeviceTrackingMalformedMacIsAParseError() {
        String output = "192.168.1.12     6cec.eb68.c86f.zz  601  GigabitEthernet1/0/14  ACTIVE";

        assertThrows(SwitchParseException.class, () -> SwitchOutputParser.parseIpDeviceTracking(output));
    }

    // ---------------------------------------------------------------------
    // Power inline
    // ---------------------------------------------------------------------

    @Test
    void powerInlineReadsMaxFromLastFieldWhenDeviceNameHasSpaces() {
        List<PoeStatusEntry> entries = SwitchOutputParser.parsePoeStatus(Fixtures.load(Fixtures.POWER_INLINE));

        assertEquals(4, entries.size());
        assertEquals(new PoeStatusEntry("Gi1/0/1", "auto", "on", 30_000), entries.get(0));
        assertEquals(new PoeStatusEntry("Gi1/0/2", "off", "off", 30_000), entries.get(1));
        assertEquals(new PoeStatusEntry("Gi1/0/4", "static", "on", 15_400), entries.get(3));
    }

    @Test
    void findPoeStatusMatchesLongFormPortAndFallsBackToUnknown() {
        String output = Fixtures.load(Fixtures.POWER_INLINE);

        PoeStatusEntry entry = SwitchOutputParser.findPoeStatus(output, "GigabitEthernet1/0/1");
        assertEquals("Gi1/0/1", entry.interfaceName());
        assertTrue(entry.isPowerEnabled());

        assertFalse(SwitchOutputParser.findPoeStatus(output, "Gi1/0/2").isPowerEnabled());

        PoeStatusEntry missing = SwitchOutputParser.findPoeStatus(output, "Gi2/0/1");
        assertSame(PoeStatusEntry.UNKNOWN, missing);
        assertTrue(missing.isUnknown());
    }

    @Test
    void powerInlineSkipsAdminPowerTableThatFollowsStatusTable() {
        String output = Fixtures.load(Fixtures.POWER_INLINE_TWO_TABLES);

        assertEquals(List.of(new PoeStatusEntry("Gi1/0/1", "auto", "on", 30_000)),
                SwitchOutputParser.parsePoeStatus(output));
        assertTrue(SwitchOutputParser.findPoeStatus(output, "Gi1/0/1").isPowerEnabled());
    }

    @Test
    void powerInlineRowWithTooFewFieldsIsAParseError() {
        assertThrows(SwitchParseException.class,
                () -> SwitchOutputParser.parsePoeStatus("Gi1/0/1   auto   on   15.4"));
    }

    // ---------------------------------------------------------------------
    // VLAN brief
    // ---------------------------------------------------------------------

    @Test
    void vlanBriefFoldsContinuationLinesIntoCurrentVlan() {
        List<VlanMembership> vlans = SwitchOutputParser.parseVlanMembership(Fixtures.load(Fixtures.VLAN_BRIEF));

        assertEquals(List.of(1, 601, 701, 704, 1002, 1003),
                vlans.stream().map(VlanMembership::vlanId).collect(Collectors.toList()));

        VlanMembership v704 = vlans.get(3);
        assertEquals("active", v704.status());
        assertEquals(
                List.of("Gi1/0/2", "Gi1/0/3", "Gi1/0/9", "Gi1/0/10",
                        "Gi1/0/11", "Gi1/0/12", "Gi1/0/13", "Gi1/0/14"),
                v704.memberInterfaces());

        assertTrue(vlans.get(1).memberInterfaces().isEmpty());
        assertEquals("act/unsup", vlans.get(4).status());
    }

    @Test
    void vlanOfFindsContinuationMembers() {
        String output = Fixtures.load(Fixtures.VLAN_BRIEF);

        assertEquals(704, SwitchOutputParser.vlanOf(output, "Gi1/0/14"));
        assertEquals(704, SwitchOutputParser.vlanOf(output, "GigabitEthernet1/0/12"));
        assertEquals(1, SwitchOutputParser.vlanOf(output, "Gi1/0/5"));
        assertEquals(-1, SwitchOutputParser.vlanOf(output, "Gi1/0/47"));
    }

    @Test
    void verifyVlanReportsObservedVlanOnMismatch() {
        String output = "701  NET-701  active  Gi1/0/1, Gi1/0/2";

        assertEquals(new VlanVerification(true, 701), SwitchOutputParser.verifyVlan(output, "Gi1/0/1", 701));
        assertEquals(new VlanVerification(false, 701), SwitchOutputParser.verifyVlan(output, "Gi1/0/1", 702));
        assertEquals(new VlanVerification(false, -1), SwitchOutputParser.verifyVlan(output, "Gi1/0/3", 701));
    }

    @Test
    void vlanCarrierWithTooFewFieldsIsAParseError() {
        assertThrows(SwitchParseException.class,
                () -> SwitchOutputParser.parseVlanMembership("704  NET-704\n"));
    }

    @Test
    void continuationStartingWithPortChannelStaysInCurrentVlan() {
        String output = "VLAN Name                             Status    Ports\n"
                + "---- -------------------------------- --------- -------------------------------\n"
                + "20   TRUNKS                           active    Gi1/0/1, Gi1/0/2, Gi1/0/3, Gi1/0/4\n"
                + "                                                Po1, Po2\n"
                + "30   SPARE                            active\n"
                + "sw-lab#";

        List<VlanMembership> vlans = SwitchOutputParser.parseVlanMembership(output);

        assertEquals(List.of("Gi1/0/1", "Gi1/0/2", "Gi1/0/3", "Gi1/0/4", "Po1", "Po2"),
                vlans.get(0).memberInterfaces());
        assertTrue(vlans.get(1).memberInterfaces().isEmpty());
        assertEquals(20, SwitchOutputParser.vlanOf(output, "Po2"));
    }

    @Test
    void continuationBeforeAnyCarrierIsIgnored() {
        String output = "                 Gi1/0/1, Gi1/0/2\n"
                + "10   USERS   active   Gi1/0/3\n";

        List<VlanMembership> vlans = SwitchOutputParser.parseVlanMembership(output);
        assertEquals(1, vlans.size());
        assertEquals(List.of("Gi1/0/3"), vlans.get(0).memberInterfaces());
    }

    // ---------------------------------------------------------------------
    // Version
    // ---------------------------------------------------------------------

    @Test
    void versionPrefersIosBannerOverBootLoader() {
        assertEquals(Optional.of("15.0(2)SE5"), SwitchOutputParser.parseVersion(Fixtures.load(Fixtures.VERSION)));
    }

    @Test
    void versionFallsBackToAnyVersionLine() {
        assertEquals(Optional.of("12.2(53r)SE"), SwitchOutputParser.parseVersion(
                "BOOTLDR: C3750E Boot Loader (C3750X-HBOOT-M) Version 12.2(53r)SE, RELEASE SOFTWARE (fc3)"));
        assertEquals(Optional.empty(), SwitchOutputParser.parseVersion("% Invalid input detected at '^' marker."));
    }
}

package com.questrail.noc.switching.internal.parse;

import com.questrail.noc.switching.model.IpDeviceTrackingEntry;
import com.questrail.noc.switching.model.MacAddress;
import com.questrail.noc.switching.model.MacAddressEntry;
import com.questrail.noc.switching.model.PoeStatusEntry;
import com.questrail.noc.switching.model.PortNames;
import com.questrail.noc.switching.model.VlanMembership;
import com.questrail.noc.switching.model.VlanVerification;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Optional;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * SwitchOutputParser
 * ============================================================================
 * Converts raw CLI text captured from a switch into typed records.
 *
 * <h2>Architectural Role</h2>
 * This class is the <strong>explicit boundary</strong> between free-text
 * device output and the typed records the command engine reasons about. The
 * engine MUST NOT look at column positions or raw lines itself.
 *
 * <h2>Shared algorithm</h2>
 * Every table parser follows the same shape:
 * <ol>
 *   <li>Split into lines and trim each line</li>
 *   <li>Keep only lines carrying the table's structural fingerprint
 *       (a MAC-address token, or interface notation in the first field);
 *       banners, headers, echoed commands and prompts are skipped</li>
 *   <li>Split the row on whitespace into fixed-position fields</li>
 *   <li>Drop rows the caller never wants (non-physical ports, stale bindings)</li>
 *   <li>Normalize interface fields through {@link PortNames}</li>
 *   <li>Return the records sorted by interface name</li>
 * </ol>
 *
 * <h2>Failure model</h2>
 * A row that carries the fingerprint but has too few fields, or a field of
 * the wrong shape, raises {@link SwitchParseException}. Missing fields are
 * never guessed.
 *
 * <h2>Layout contract</h2>
 * Field positions match IOS 12.2/15.x output for the Catalyst 2960/3750
 * families. There is no format negotiation; tests pin captured output.
 *
 * <p>All methods are pure functions of their arguments.</p>
 */
public final class SwitchOutputParser
{
    private static final Pattern MAC_TOKEN =
            Pattern.compile("\\b[0-9a-fA-F]{4}\\.[0-9a-fA-F]{4}\\.[0-9a-fA-F]{4}\\b");

    private static final Pattern VLAN_ID = Pattern.compile("\\d{1,4}");

    // Gi1/0/1, Fa0/24, Po1, Gi1/0/1.100
    private static final Pattern PORT_TOKEN = Pattern.compile("[A-Za-z][A-Za-z-]*\\d+(?:[/.:]\\d+)*");

    private static final Pattern IOS_VERSION = Pattern.compile("Version\\s+([^,\\s]+)");

    private static final String ACTIVE = "ACTIVE";

    private static final Comparator<MacAddressEntry> MAC_ORDER =
            Comparator.comparing(MacAddressEntry::interfaceName);

    private static final Comparator<IpDeviceTrackingEntry> IPDT_ORDER =
            Comparator.comparing(IpDeviceTrackingEntry::interfaceName);

    private static final Comparator<PoeStatusEntry> POE_ORDER =
            Comparator.comparing(PoeStatusEntry::interfaceName);

    private SwitchOutputParser() {
    }

    // ========================================================================
    // show mac address-table
    // ========================================================================

    /**
     * Parses the output of {@code show mac address-table}.
     *
     * <pre>
     *           Mac Address Table
     * -------------------------------------------
     * Vlan    Mac Address       Type        Ports
     * ----    -----------       --------    -----
     *  All    0100.0ccc.cccc    STATIC      CPU
     *  601    000b.7866.5240    DYNAMIC     Gi1/0/48
     * Total Mac Addresses for this criterion: 59
     * </pre>
     *
     * @param output     raw command output
     * @param ignorePort a port whose entries should be dropped (typically the
     *                   uplink), in either notation; may be {@code null}
     * @return entries on physical ports, sorted by interface name
     */
    public static List<MacAddressEntry> parseMacAddressTable(String output, String ignorePort) {
        final String ignored = PortNames.shorthand(ignorePort);
        List<MacAddressEntry> entries = new ArrayList<>();

        for (String line : lines(output)) {
            if (!MAC_TOKEN.matcher(line).find()) {
                continue;
            }

            String[] values = fields(line, 4, "MAC address table row");
            String port = PortNames.shorthand(values[3]);

            // CPU, port-channels and router ports are not where devices live.
            if (!PortNames.isPhysical(port)) {
                continue;
            }
            if (ignored != null && !ignored.isEmpty() && port.equalsIgnoreCase(ignored)) {
                continue;
            }

            entries.add(new MacAddressEntry(mac(values[1], line), port));
        }

        entries.sort(MAC_ORDER);
        return List.copyOf(entries);
    }

    // ========================================================================
    // show ip device tracking all
    // ========================================================================

    /**
     * Parses the output of {@code show ip device tracking all}.
     *
     * <pre>
     * IP Device Tracking = Enabled
     * -------------------------------------------------------------------
     *   IP Address     MAC Address   Vlan  Interface              STATE
     * -------------------------------------------------------------------
     * 192.168.1.12     6cec.eb68.c86f  601  GigabitEthernet1/0/14  ACTIVE
     * 192.168.1.15     6cec.eb67.836c  601  GigabitEthernet1/0/12  INACTIVE
     * </pre>
     *
     * Only {@code ACTIVE} rows are returned; anything else is a stale binding
     * for a device that has likely been unplugged.
     *
     * @return active bindings, sorted by interface name
     */
    public static List<IpDeviceTrackingEntry> parseIpDeviceTracking(String output) {
        List<IpDeviceTrackingEntry> entries = new ArrayList<>();

        for (String line : lines(output)) {
            if (!MAC_TOKEN.matcher(line).find()) {
                continue;
            }

            String[] values = fields(line, 5, "IP device tracking row");
            if (!ACTIVE.equals(values[4])) {
                continue;
            }

            entries.add(new IpDeviceTrackingEntry(
                    values[0],
                    mac(values[1], line),
                    PortNames.shorthand(values[3])
            ));
        }

        entries.sort(IPDT_ORDER);
        return List.copyOf(entries);
    }

    // ========================================================================
    // show power inline
    // ========================================================================

    /**
     * Parses the output of {@code show power inline [port]}.
     *
     * <pre>
     * Interface Admin  Oper       Power   Device              Class Max
     *                             (Watts)
     * --------- ------ ---------- ------- ------------------- ----- ----
     * Gi1/0/1   auto   on         15.4    Ieee PD             3     30.0
     * Gi1/0/2   off    off        0.0     n/a                 n/a   30.0
     * </pre>
     *
     * The device column may contain spaces, so {@code Max} is read from the
     * last field rather than a fixed index.
     *
     * <p>Catalyst 3750-E/X follow this with a second per-port table:</p>
     *
     * <pre>
     * Interface  AdminPowerMax   AdminConsumption
     *              (Watts)           (Watts)
     * ---------- --------------- --------------------
     * Gi1/0/1              30.0                 15.4
     * </pre>
     *
     * Rows are read only under an {@code Interface Admin Oper} header, or
     * before any {@code Interface} header at all.
     *
     * @return per-port status, sorted by interface name
     */
    public static List<PoeStatusEntry> parsePoeStatus(String output) {
        List<PoeStatusEntry> entries = new ArrayList<>();
        boolean statusTable = true;

        for (String line : lines(output)) {
            if (line.startsWith("Interface")) {
                statusTable = isPoeStatusHeader(line);
                continue;
            }
            if (!statusTable || !startsWithInterface(line)) {
                continue;
            }

            String[] values = fields(line, 7, "power inline row");
            entries.add(new PoeStatusEntry(
                    PortNames.shorthand(values[0]),
                    values[1],
                    values[2],
                    milliwatts(values[values.length - 1], line)
            ));
        }

        entries.sort(POE_ORDER);
        return List.copyOf(entries);
    }

    /**
     * Finds the PoE status of a single port.
     *
     * @return the matching entry, or {@link PoeStatusEntry#UNKNOWN}
     */
    public static PoeStatusEntry findPoeStatus(String output, String port) {
        for (PoeStatusEntry entry : parsePoeStatus(output)) {
            if (PortNames.samePort(entry.interfaceName(), port)) {
                return entry;
            }
        }
        return PoeStatusEntry.UNKNOWN;
    }

    // ========================================================================
    // show vlan brief
    // ========================================================================

    /**
     * Parses the output of {@code show vlan brief}.
     *
     * <pre>
     * VLAN Name                             Status    Ports
     * ---- -------------------------------- --------- -------------------------------
     * 1    default                          active    Gi1/0/3, Gi1/0/4, Gi1/0/5
     *                                                 Gi1/0/6, Gi1/0/7
     * 704  NET-704                          active    Gi1/0/1, Gi1/0/2
     * </pre>
     *
     * A carrier line starts with the VLAN id; any other line following a
     * carrier continues its member list. Only port-shaped tokens are taken
     * from continuation lines, so trailing prompts are ignored.
     *
     * @return memberships in ascending VLAN id
     */
    public static List<VlanMembership> parseVlanMembership(String output) {
        List<VlanMembership> vlans = new ArrayList<>();

        // Fold state for the carrier currently being accumulated.
        int currentId = -1;
        String currentStatus = null;
        List<String> currentPorts = new ArrayList<>();

        for (String line : lines(output)) {
            String first = firstField(line);

            if (VLAN_ID.matcher(first).matches()) {
                if (currentId >= 0) {
                    vlans.add(new VlanMembership(currentId, currentStatus, currentPorts));
                }

                String[] values = fields(line, 3, "VLAN row");
                currentId = Integer.parseInt(values[0]);
                currentStatus = values[2];
                currentPorts = new ArrayList<>();
                for (int i = 3; i < values.length; i++) {
                    addPorts(values[i], currentPorts);
                }
            } else if (currentId >= 0) {
                addPorts(line, currentPorts);
            }
        }

        if (currentId >= 0) {
            vlans.add(new VlanMembership(currentId, currentStatus, currentPorts));
        }

        vlans.sort(Comparator.comparingInt(VlanMembership::vlanId));
        return List.copyOf(vlans);
    }

    /**
     * Returns the VLAN {@code port} is a member of, or {@code -1}.
     */
    public static int vlanOf(String output, String port) {
        for (VlanMembership vlan : parseVlanMembership(output)) {
            if (vlan.contains(port)) {
                return vlan.vlanId();
            }
        }
        return -1;
    }

    /**
     * Checks whether {@code port} is listed among the members of {@code vlanId}.
     *
     * @return whether it matched, together with the VLAN the port was actually
     *         found in ({@code -1} if none)
     */
    public static VlanVerification verifyVlan(String output, String port, int vlanId) {
        int observed = -1;
        boolean matched = false;

        for (VlanMembership vlan : parseVlanMembership(output)) {
            if (vlan.contains(port)) {
                if (observed < 0) {
                    observed = vlan.vlanId();
                }
                if (vlan.vlanId() == vlanId) {
                    matched = true;
                    observed = vlanId;
                }
            }
        }
        return new VlanVerification(matched, observed);
    }

    // ========================================================================
    // show version
    // ========================================================================

    /**
     * Extracts the software version from {@code show version}.
     *
     * <pre>
     * Cisco IOS Software, C3750E Software (C3750E-UNIVERSALK9-M), Version 15.0(2)SE5, RELEASE SOFTWARE (fc1)
     * </pre>
     *
     * The IOS banner line is preferred over boot loader lines, which also
     * carry a {@code Version}.
     *
     * @return the version, e.g. {@code 15.0(2)SE5}, or empty if no banner was found
     */
    public static Optional<String> parseVersion(String output) {
        String fallback = null;
        for (String line : lines(output)) {
            Matcher m = IOS_VERSION.matcher(line);
            if (!m.find()) {
                continue;
            }
            if (line.contains("IOS")) {
                return Optional.of(m.group(1));
            }
            if (fallback == null) {
                fallback = m.group(1);
            }
        }
        return Optional.ofNullable(fallback);
    }

    // ========================================================================
    // Helpers
    // ========================================================================

    private static List<String> lines(String output) {
        if (output == null || output.isEmpty()) {
            return List.of();
        }
        List<String> lines = new ArrayList<>();
        for (String line : output.split("\\R")) {
            String trimmed = line.strip();
            if (!trimmed.isEmpty()) {
                lines.add(trimmed);
            }
        }
        return lines;
    }

    private static String[] fields(String line, int required, String what) {
        String[] values = line.split("\\s+");
        if (values.length < required) {
            throw new SwitchParseException(
                    what + " has " + values.length + " fields, expected at least " + required, line);
        }
        return values;
    }

    private static String firstField(String line) {
        int space = line.indexOf(' ');
        int tab = line.indexOf('\t');
        int end = space < 0 ? tab : (tab < 0 ? space : Math.min(space, tab));
        return end < 0 ? line : line.substring(0, end);
    }

    private static boolean startsWithInterface(String line) {
        return firstField(line).indexOf('/') >= 0;
    }

    private static boolean isPoeStatusHeader(String line) {
        String[] values = line.split("\\s+");
        return values.length >= 3 && values[1].equals("Admin") && values[2].equals("Oper");
    }

    private static void addPorts(String text, List<String> ports) {
        for (String port : text.split("[,\\s]+")) {
            if (PORT_TOKEN.matcher(port).matches()) {
                ports.add(PortNames.shorthand(port));
            }
        }
    }

    private static MacAddress mac(String text, String line) {
        try {
            return MacAddress.parse(text);
        } catch (IllegalArgumentException e) {
            throw new SwitchParseException("Malformed MAC address field", line, e);
        }
    }

    private static int milliwatts(String watts, String line) {
        try {
            return (int) Math.round(Double.parseDouble(watts) * 1000.0);
        } catch (NumberFormatException e) {
            throw new SwitchParseException("Malformed power ceiling field", line, e);
        }
    }
}

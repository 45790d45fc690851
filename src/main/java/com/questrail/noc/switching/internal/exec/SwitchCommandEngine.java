package com.questrail.noc.switching.internal.exec;

import com.questrail.noc.internal.time.WallClock;
import com.questrail.noc.observability.NocObservabilitySink;
import com.questrail.noc.observability.VerificationEvent;
import com.questrail.noc.switching.internal.parse.SwitchOutputParser;
import com.questrail.noc.switching.internal.session.SwitchSession;
import com.questrail.noc.switching.model.IpDeviceTrackingEntry;
import com.questrail.noc.switching.model.MacAddressEntry;
import com.questrail.noc.switching.model.PoeMode;
import com.questrail.noc.switching.model.PoeStatusEntry;
import com.questrail.noc.switching.model.PortNames;
import com.questrail.noc.switching.model.VlanMembership;
import com.questrail.noc.switching.model.VlanVerification;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.function.Predicate;

/**
 * SwitchCommandEngine
 * =============================================================================
 * Implements every switch operation on top of {@link SwitchSession} and
 * {@link SwitchOutputParser}.
 *
 * <h2>Mutating operations: apply, then verify</h2>
 * <pre>
 *   configure terminal → interface P → mutation → end      (apply)
 *   show ... P → parse → compare with intent              (verify)
 * </pre>
 * The apply phase reports nothing about partial failure. If the device
 * rejects a line, the verify phase simply does not observe the intended state
 * and the operation returns {@code false}. A {@code false} result is an
 * expected outcome when commanding hardware, never an exception.
 *
 * <h2>Read operations</h2>
 * Query, parse, return. The software version is memoized per connection.
 *
 * <h2>Normalization rule</h2>
 * A caller's port is normalized once, on entry. The same shorthand name is
 * used in the command text and as the verification key.
 *
 * <h2>Not-connected model</h2>
 * When the session is not ready every operation returns its sentinel:
 * an empty list, {@code -1}, {@link PoeStatusEntry#UNKNOWN},
 * {@link Optional#empty()} or {@code false}.
 *
 * <p>Argument validation happens before any transport interaction.</p>
 */
public final class SwitchCommandEngine
{
    static final String CMD_MAC_ADDRESS_TABLE = "show mac address-table";
    static final String CMD_IPDT = "show ip device tracking all";
    static final String CMD_POWER_INLINE = "show power inline ";
    static final String CMD_VLAN_BRIEF = "show vlan brief";
    static final String CMD_VERSION = "show version";

    static final String CMD_INTERFACE = "interface ";
    static final String CMD_POWER_MODE = "power inline ";
    static final String CMD_ACCESS_MODE = "switchport mode access";
    static final String CMD_ACCESS_VLAN = "switchport access vlan ";

    public static final int MIN_VLAN = 1;
    public static final int MAX_VLAN = 4094;

    private final SwitchSession session;
    private final NocObservabilitySink sink;
    private final WallClock wallClock;

    private String cachedVersion;
    private long cachedVersionConnection = -1;

    public SwitchCommandEngine(SwitchSession session, NocObservabilitySink sink, WallClock wallClock)
    {
        this.session = Objects.requireNonNull(session, "session");
        this.sink = Objects.requireNonNull(sink, "sink");
        this.wallClock = Objects.requireNonNull(wallClock, "wallClock");
    }

    // ========================================================================
    // Reads
    // ========================================================================

    public List<MacAddressEntry> macAddressTable(String ignorePort)
    {
        return session.runQuery(CMD_MAC_ADDRESS_TABLE)
                .map(output -> SwitchOutputParser.parseMacAddressTable(output, ignorePort))
                .orElse(List.of());
    }

    public List<IpDeviceTrackingEntry> ipDeviceTracking()
    {
        return session.runQuery(CMD_IPDT)
                .map(SwitchOutputParser::parseIpDeviceTracking)
                .orElse(List.of());
    }

    public PoeStatusEntry poeStatus(String port)
    {
        String p = requirePort(port);
        return queryPoeStatus(p);
    }

    public int vlan(String port)
    {
        String p = requirePort(port);
        return session.runQuery(CMD_VLAN_BRIEF)
                .map(output -> SwitchOutputParser.vlanOf(output, p))
                .orElse(-1);
    }

    public List<VlanMembership> vlanMemberships()
    {
        return session.runQuery(CMD_VLAN_BRIEF)
                .map(SwitchOutputParser::parseVlanMembership)
                .orElse(List.of());
    }

    /**
     * Software version, queried once per connection.
     */
    public Optional<String> version()
    {
        long connection = session.connectionCount();
        if (cachedVersion != null && cachedVersionConnection == connection) {
            return Optional.of(cachedVersion);
        }

        Optional<String> version = session.runQuery(CMD_VERSION)
                .flatMap(SwitchOutputParser::parseVersion);
        version.ifPresent(v -> {
            cachedVersion = v;
            cachedVersionConnection = connection;
        });
        return version;
    }

    // ========================================================================
    // Apply and verify
    // ========================================================================

    /**
     * Enables PoE on a port ({@code power inline auto}).
     *
     * @return whether the admin state read back contains {@code auto}
     */
    public boolean poeOn(String port)
    {
        String p = requirePort(port);
        return applyPoe(p, "poe-on", List.of(CMD_POWER_MODE + PoeMode.AUTO.keyword()),
                PoeMode.AUTO.keyword(),
                PoeStatusEntry::isPowerEnabled);
    }

    /**
     * Disables PoE on a port ({@code power inline never}).
     *
     * @return whether the admin state read back no longer contains {@code auto}
     */
    public boolean poeOff(String port)
    {
        String p = requirePort(port);
        return applyPoe(p, "poe-off", List.of(CMD_POWER_MODE + PoeMode.NEVER.keyword()),
                "not " + PoeMode.AUTO.keyword(),
                status -> !status.isPowerEnabled());
    }

    /**
     * Sets a PoE mode together with a power ceiling
     * ({@code power inline <mode> max <milliwatts>}).
     *
     * @param mode       {@link PoeMode#AUTO} or {@link PoeMode#STATIC}
     * @param milliwatts the ceiling, positive
     * @return whether the admin state read back contains the mode
     */
    public boolean poeLimit(String port, PoeMode mode, int milliwatts)
    {
        String p = requirePort(port);
        Objects.requireNonNull(mode, "mode");
        if (mode == PoeMode.NEVER) {
            throw new IllegalArgumentException("A power limit requires mode auto or static");
        }
        if (milliwatts <= 0) {
            throw new IllegalArgumentException("milliwatts must be positive (was " + milliwatts + ")");
        }

        return applyPoe(p, "poe-limit",
                List.of(CMD_POWER_MODE + mode.keyword() + " max " + milliwatts),
                mode.keyword(),
                status -> status.adminStateContains(mode.keyword()));
    }

    /**
     * Moves an access port to another VLAN.
     *
     * @return whether the port is listed under {@code vlanId} afterwards
     */
    public boolean changeVlan(String port, int vlanId)
    {
        String p = requirePort(port);
        if (vlanId < MIN_VLAN || vlanId > MAX_VLAN) {
            throw new IllegalArgumentException(
                    "VLAN must be in range " + MIN_VLAN + "-" + MAX_VLAN + " (was " + vlanId + ")");
        }

        boolean applied = session.runConfig(List.of(
                CMD_INTERFACE + p,
                CMD_ACCESS_MODE,
                CMD_ACCESS_VLAN + vlanId
        ));
        if (!applied) {
            return false;
        }

        VlanVerification verification = session.runQuery(CMD_VLAN_BRIEF)
                .map(output -> SwitchOutputParser.verifyVlan(output, p, vlanId))
                .orElse(new VlanVerification(false, -1));

        report("change-vlan", p, String.valueOf(vlanId),
                String.valueOf(verification.observedVlan()), verification.matched());
        return verification.matched();
    }

    // ========================================================================
    // Internals
    // ========================================================================

    private boolean applyPoe(String port,
                             String operation,
                             List<String> mutation,
                             String expected,
                             Predicate<PoeStatusEntry> confirms)
    {
        List<String> lines = new ArrayList<>(mutation.size() + 1);
        lines.add(CMD_INTERFACE + port);
        lines.addAll(mutation);

        if (!session.runConfig(lines)) {
            return false;
        }

        PoeStatusEntry status = queryPoeStatus(port);

        // A port missing from the output confirms nothing, in either direction.
        boolean confirmed = !status.isUnknown() && confirms.test(status);
        report(operation, port, expected, status.adminState(), confirmed);
        return confirmed;
    }

    private PoeStatusEntry queryPoeStatus(String port)
    {
        return session.runQuery(CMD_POWER_INLINE + port)
                .map(output -> SwitchOutputParser.findPoeStatus(output, port))
                .orElse(PoeStatusEntry.UNKNOWN);
    }

    private void report(String operation, String target, String expected, String observed, boolean confirmed)
    {
        sink.onVerification(new VerificationEvent(
                wallClock.now(), session.host(), operation, target, expected, observed, confirmed));
    }

    private static String requirePort(String port)
    {
        if (port == null || port.isBlank()) {
            throw new IllegalArgumentException("port must not be blank");
        }
        return PortNames.shorthand(port.strip());
    }
}

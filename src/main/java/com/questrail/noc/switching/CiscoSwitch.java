package com.questrail.noc.switching;

import com.questrail.noc.api.NetworkSwitch;
import com.questrail.noc.config.SwitchConfig;
import com.questrail.noc.internal.time.SystemWallClock;
import com.questrail.noc.internal.time.WallClock;
import com.questrail.noc.observability.NocObservabilitySink;
import com.questrail.noc.observability.NullObservabilitySink;
import com.questrail.noc.switching.internal.exec.SwitchCommandEngine;
import com.questrail.noc.switching.internal.session.SwitchSession;
import com.questrail.noc.switching.model.IpDeviceTrackingEntry;
import com.questrail.noc.switching.model.MacAddressEntry;
import com.questrail.noc.switching.model.PoeMode;
import com.questrail.noc.switching.model.PoeStatusEntry;
import com.questrail.noc.switching.model.PrivilegeLevel;
import com.questrail.noc.switching.model.VlanMembership;
import com.questrail.noc.switching.transport.ShellConnector;
import com.questrail.noc.switching.transport.ssh.JschShellConnector;

import java.util.List;
import java.util.Objects;
import java.util.Optional;

/**
 * CiscoSwitch
 * =============================================================================
 * Public entry point for an IOS switch reached over SSH.
 *
 * <p>Assembles one {@link SwitchSession} and one {@link SwitchCommandEngine}
 * and delegates to them. It holds no logic of its own beyond applying the
 * configured enable secret on {@link #enable()}.</p>
 *
 * <pre>{@code
 * try (CiscoSwitch sw = CiscoSwitch.builder()
 *         .withConfig(SwitchConfig.builder()
 *                 .withHost("10.0.0.2")
 *                 .withCredentials("noc", "secret")
 *                 .withEnableSecret("enable-secret")
 *                 .build())
 *         .withObservabilitySink(new Slf4jObservabilitySink())
 *         .build()) {
 *     sw.connect();
 *     sw.enable();
 *     boolean confirmed = sw.poeOff("GigabitEthernet1/0/7");
 * }
 * }</pre>
 *
 * Not thread-safe; see {@link SwitchSession}.
 */
public final class CiscoSwitch implements NetworkSwitch
{
    private final SwitchConfig config;
    private final SwitchSession session;
    private final SwitchCommandEngine engine;

    private CiscoSwitch(SwitchConfig config, SwitchSession session, SwitchCommandEngine engine)
    {
        this.config = config;
        this.session = session;
        this.engine = engine;
    }

    public static Builder builder()
    {
        return new Builder();
    }

    // ---------------------------------------------------------------------
    // Lifecycle
    // ---------------------------------------------------------------------

    @Override
    public String host()
    {
        return config.host();
    }

    @Override
    public void connect()
    {
        session.connect();
    }

    /**
     * Escalates using the secret from {@link SwitchConfig#enableSecret()}.
     * No-op when none is configured.
     */
    public void enable()
    {
        config.enableSecret().ifPresent(session::enable);
    }

    @Override
    public void enable(String secret)
    {
        session.enable(secret);
    }

    @Override
    public void disconnect()
    {
        session.disconnect();
    }

    @Override
    public boolean isConnected()
    {
        return session.isConnected();
    }

    public PrivilegeLevel privilegeLevel()
    {
        return session.privilegeLevel();
    }

    /**
     * Disables output paging.
     *
     * @deprecated paging is disabled automatically whenever the session
     *             becomes privileged; calling this is harmless but unnecessary
     */
    @Deprecated
    public void setTerminalLength()
    {
        session.setTerminalLength();
    }

    // ---------------------------------------------------------------------
    // Reads
    // ---------------------------------------------------------------------

    @Override
    public List<IpDeviceTrackingEntry> ipDeviceTracking()
    {
        return engine.ipDeviceTracking();
    }

    @Override
    public List<MacAddressEntry> macAddressTable()
    {
        return engine.macAddressTable(null);
    }

    @Override
    public List<MacAddressEntry> macAddressTable(String ignorePort)
    {
        return engine.macAddressTable(ignorePort);
    }

    @Override
    public PoeStatusEntry poeStatus(String port)
    {
        return engine.poeStatus(port);
    }

    @Override
    public int vlan(String port)
    {
        return engine.vlan(port);
    }

    @Override
    public List<VlanMembership> vlanMemberships()
    {
        return engine.vlanMemberships();
    }

    @Override
    public Optional<String> version()
    {
        return engine.version();
    }

    // ---------------------------------------------------------------------
    // Apply and verify
    // ---------------------------------------------------------------------

    @Override
    public boolean poeOn(String port)
    {
        return engine.poeOn(port);
    }

    @Override
    public boolean poeOff(String port)
    {
        return engine.poeOff(port);
    }

    @Override
    public boolean poeLimit(String port, PoeMode mode, int milliwatts)
    {
        return engine.poeLimit(port, mode, milliwatts);
    }

    @Override
    public boolean changeVlan(String port, int vlanId)
    {
        return engine.changeVlan(port, vlanId);
    }

    @Override
    public String toString()
    {
        return "CiscoSwitch[" + config.host() + ", " + session.state() + "]";
    }

    public static final class Builder
    {
        private SwitchConfig config;
        private ShellConnector connector = new JschShellConnector();
        private NocObservabilitySink sink = NullObservabilitySink.INSTANCE;
        private WallClock wallClock = SystemWallClock.INSTANCE;

        public Builder withConfig(SwitchConfig config)
        {
            this.config = config;
            return this;
        }

        public Builder withConnector(ShellConnector connector)
        {
            this.connector = connector;
            return this;
        }

        public Builder withObservabilitySink(NocObservabilitySink sink)
        {
            this.sink = sink;
            return this;
        }

        public Builder withWallClock(WallClock wallClock)
        {
            this.wallClock = wallClock;
            return this;
        }

        public CiscoSwitch build()
        {
            Objects.requireNonNull(config, "config");
            SwitchSession session = new SwitchSession(config, connector, sink, wallClock);
            SwitchCommandEngine engine = new SwitchCommandEngine(session, sink, wallClock);
            return new CiscoSwitch(config, session, engine);
        }
    }
}

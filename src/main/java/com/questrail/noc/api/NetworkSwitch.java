package com.questrail.noc.api;

import com.questrail.noc.switching.model.IpDeviceTrackingEntry;
import com.questrail.noc.switching.model.MacAddressEntry;
import com.questrail.noc.switching.model.PoeMode;
import com.questrail.noc.switching.model.PoeStatusEntry;
import com.questrail.noc.switching.model.VlanMembership;

import java.util.List;
import java.util.Optional;

/**
 * An Ethernet switch managed through its command line.
 *
 * <p>Operations attempted while not connected (or not yet privileged) return
 * their "not connected" value: an empty list, {@code -1},
 * {@link PoeStatusEntry#UNKNOWN}, {@link Optional#empty()} or {@code false}.
 * Mutating operations return whether a fresh read of the device confirmed
 * the intended state.</p>
 *
 * <p>Port arguments may be given in long form ({@code GigabitEthernet1/0/1})
 * or shorthand ({@code Gi1/0/1}). Ports in returned records are always
 * shorthand.</p>
 */
public interface NetworkSwitch extends AutoCloseable
{
    String host();

    /**
     * @throws DeviceConnectionException if the device cannot be reached or
     *         rejects the login
     */
    void connect();

    void enable(String secret);

    void disconnect();

    /**
     * Actively probes the connection.
     */
    boolean isConnected();

    List<IpDeviceTrackingEntry> ipDeviceTracking();

    List<MacAddressEntry> macAddressTable();

    List<MacAddressEntry> macAddressTable(String ignorePort);

    boolean poeOn(String port);

    boolean poeOff(String port);

    boolean poeLimit(String port, PoeMode mode, int milliwatts);

    PoeStatusEntry poeStatus(String port);

    int vlan(String port);

    List<VlanMembership> vlanMemberships();

    boolean changeVlan(String port, int vlanId);

    Optional<String> version();

    @Override
    default void close()
    {
        disconnect();
    }
}

package com.questrail.noc.api;

import com.questrail.noc.pdu.model.CommStatus;
import com.questrail.noc.pdu.model.LoadState;
import com.questrail.noc.pdu.model.OutletCommand;
import com.questrail.noc.pdu.model.OutletState;
import com.questrail.noc.pdu.model.PduIdentity;
import com.questrail.noc.pdu.model.SensorStatus;
import com.questrail.noc.pdu.model.SensorType;

import java.util.Optional;
import java.util.OptionalDouble;

/**
 * A switched, metered power distribution unit.
 *
 * <p>Every read is a single request to the device; nothing is cached beyond
 * the identity read when the unit is opened. Outlets are numbered from 1.</p>
 *
 * <p>Any operation whose request times out or is refused by the agent throws
 * {@link DeviceConnectionException}.</p>
 */
public interface PowerDistributionUnit extends AutoCloseable
{
    String host();

    PduIdentity identity();

    int numOutlets();

    LoadState loadState();

    /** Aggregate current in amps. */
    double current();

    /** Aggregate power in kilowatts. */
    double power();

    boolean isSensorPresent();

    /**
     * @return the probe name, or empty when no probe is present
     */
    Optional<String> sensorName();

    /**
     * @return {@code false} without touching the device when no probe is present
     */
    boolean setSensorName(String name);

    /** {@link SensorType#NOT_INSTALLED} when no probe is present. */
    SensorType sensorType();

    CommStatus sensorCommStatus();

    /**
     * Temperature in degrees Fahrenheit, or Celsius when
     * {@link #setUseCentigrade(boolean)} is on. Empty without a probe.
     */
    OptionalDouble temperature();

    /** Relative humidity in percent; empty unless the probe measures it. */
    OptionalDouble humidity();

    boolean useCentigrade();

    void setUseCentigrade(boolean useCentigrade);

    SensorStatus temperatureStatus();

    SensorStatus humidityStatus();

    String outletName(int outlet);

    void setOutletName(int outlet, String name);

    OutletState outletStatus(int outlet);

    /**
     * Issues an outlet command and waits, within a bound, for the outlet to
     * reach the command's target state.
     *
     * @return whether the target state was observed before the bound elapsed
     * @throws IllegalArgumentException if {@code outlet} is out of range
     */
    boolean outletCommand(int outlet, OutletCommand command);

    @Override
    void close();
}

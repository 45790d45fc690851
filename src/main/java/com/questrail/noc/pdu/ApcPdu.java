package com.questrail.noc.pdu;

import com.questrail.noc.api.DeviceConnectionException;
import com.questrail.noc.api.PowerDistributionUnit;
import com.questrail.noc.config.PduConfig;
import com.questrail.noc.internal.exec.BoundedPoll;
import com.questrail.noc.internal.time.MonotonicClock;
import com.questrail.noc.internal.time.Sleeper;
import com.questrail.noc.internal.time.SystemMonotonicClock;
import com.questrail.noc.internal.time.SystemWallClock;
import com.questrail.noc.internal.time.WallClock;
import com.questrail.noc.observability.NocErrorEvent;
import com.questrail.noc.observability.NocObservabilitySink;
import com.questrail.noc.observability.NullObservabilitySink;
import com.questrail.noc.observability.VerificationEvent;
import com.questrail.noc.pdu.model.CommStatus;
import com.questrail.noc.pdu.model.LoadState;
import com.questrail.noc.pdu.model.OutletCommand;
import com.questrail.noc.pdu.model.OutletNumber;
import com.questrail.noc.pdu.model.OutletState;
import com.questrail.noc.pdu.model.PduIdentity;
import com.questrail.noc.pdu.model.SensorStatus;
import com.questrail.noc.pdu.model.SensorType;
import com.questrail.noc.pdu.transport.SnmpConnector;
import com.questrail.noc.pdu.transport.SnmpTransport;
import com.questrail.noc.pdu.transport.snmp.Snmp4jTransport;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.time.LocalDate;
import java.time.format.DateTimeFormatter;
import java.time.format.DateTimeParseException;
import java.util.Objects;
import java.util.Optional;
import java.util.OptionalDouble;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicReference;

/**
 * ApcPdu
 * =============================================================================
 * APC switched rack PDU reached over SNMPv2c (PowerNet-MIB {@code rPDU2}).
 *
 * <p>Identity and ratings are read once by {@link #open(PduConfig)}; every
 * other accessor is a single request. Scaled values are converted on the way
 * out: current is reported by the agent in tenths of an amp, power in
 * hundredths of a kilowatt, temperature in tenths of a degree.</p>
 *
 * <h2>Outlet commands</h2>
 * {@link #outletCommand(int, OutletCommand)} writes the command and then
 * re-reads the outlet state at a fixed interval until it matches the
 * command's target state or the bound from
 * {@link com.questrail.noc.config.PollingPolicy} elapses. A reboot must first
 * be seen off and then on again, both within that one bound. Exhausting the
 * bound yields {@code false}; it is not an error.
 *
 * <h2>Probe</h2>
 * Sensor accessors do not touch the device's probe objects unless a probe
 * is reported present; they return "not installed" values instead.
 */
public final class ApcPdu implements PowerDistributionUnit
{
    private static final Logger log = LoggerFactory.getLogger(ApcPdu.class);

    static final DateTimeFormatter MANUFACTURE_DATE = DateTimeFormatter.ofPattern("MM/dd/yyyy");

    private static final double CURRENT_FACTOR = 10.0;
    private static final double POWER_FACTOR = 100.0;
    private static final double TEMPERATURE_FACTOR = 10.0;

    private final PduConfig config;
    private final SnmpTransport transport;
    private final PduIdentity identity;
    private final NocObservabilitySink sink;
    private final WallClock wallClock;
    private final BoundedPoll outletPoll;

    private boolean useCentigrade;

    private ApcPdu(PduConfig config,
                   SnmpTransport transport,
                   PduIdentity identity,
                   NocObservabilitySink sink,
                   WallClock wallClock,
                   BoundedPoll outletPoll)
    {
        this.config = config;
        this.transport = transport;
        this.identity = identity;
        this.sink = sink;
        this.wallClock = wallClock;
        this.outletPoll = outletPoll;
    }

    /**
     * Opens a unit with the SNMP4J transport and production clocks.
     *
     * @throws DeviceConnectionException if the identity cannot be read
     */
    public static ApcPdu open(PduConfig config)
    {
        return builder().withConfig(config).build();
    }

    public static Builder builder()
    {
        return new Builder();
    }

    // ---------------------------------------------------------------------
    // Identity
    // ---------------------------------------------------------------------

    @Override
    public String host()
    {
        return config.host();
    }

    @Override
    public PduIdentity identity()
    {
        return identity;
    }

    @Override
    public int numOutlets()
    {
        return identity.numOutlets();
    }

    // ---------------------------------------------------------------------
    // Load
    // ---------------------------------------------------------------------

    @Override
    public LoadState loadState()
    {
        return LoadState.fromCode(transport.getInt(PowerNetObjects.PHASE_LOAD_STATE));
    }

    @Override
    public double current()
    {
        return transport.getInt(PowerNetObjects.PHASE_CURRENT) / CURRENT_FACTOR;
    }

    @Override
    public double power()
    {
        return transport.getInt(PowerNetObjects.DEVICE_POWER) / POWER_FACTOR;
    }

    // ---------------------------------------------------------------------
    // Probe
    // ---------------------------------------------------------------------

    @Override
    public boolean isSensorPresent()
    {
        return reportedSensorType().isPresent();
    }

    @Override
    public Optional<String> sensorName()
    {
        if (!isSensorPresent()) {
            return Optional.empty();
        }
        return Optional.of(transport.getString(PowerNetObjects.SENSOR_NAME));
    }

    @Override
    public boolean setSensorName(String name)
    {
        Objects.requireNonNull(name, "name");
        if (!isSensorPresent()) {
            return false;
        }
        transport.setString(PowerNetObjects.SENSOR_CONFIG_NAME, name);
        return true;
    }

    @Override
    public SensorType sensorType()
    {
        SensorType type = reportedSensorType();
        return type.isPresent() ? type : SensorType.NOT_INSTALLED;
    }

    @Override
    public CommStatus sensorCommStatus()
    {
        if (!isSensorPresent()) {
            return CommStatus.NOT_INSTALLED;
        }
        return CommStatus.fromCode(transport.getInt(PowerNetObjects.SENSOR_COMM_STATUS));
    }

    @Override
    public OptionalDouble temperature()
    {
        if (!sensorType().supportsTemperature()) {
            return OptionalDouble.empty();
        }
        String oid = useCentigrade ? PowerNetObjects.SENSOR_TEMP_C : PowerNetObjects.SENSOR_TEMP_F;
        return OptionalDouble.of(transport.getInt(oid) / TEMPERATURE_FACTOR);
    }

    @Override
    public OptionalDouble humidity()
    {
        if (!sensorType().supportsHumidity()) {
            return OptionalDouble.empty();
        }
        return OptionalDouble.of(transport.getInt(PowerNetObjects.SENSOR_HUMIDITY));
    }

    @Override
    public SensorStatus temperatureStatus()
    {
        if (!sensorType().supportsTemperature()) {
            return SensorStatus.NOT_PRESENT;
        }
        return SensorStatus.fromCode(transport.getInt(PowerNetObjects.SENSOR_TEMP_STATUS));
    }

    @Override
    public SensorStatus humidityStatus()
    {
        if (!sensorType().supportsHumidity()) {
            return SensorStatus.NOT_PRESENT;
        }
        return SensorStatus.fromCode(transport.getInt(PowerNetObjects.SENSOR_HUMIDITY_STATUS));
    }

    @Override
    public boolean useCentigrade()
    {
        return useCentigrade;
    }

    @Override
    public void setUseCentigrade(boolean useCentigrade)
    {
        this.useCentigrade = useCentigrade;
    }

    // ---------------------------------------------------------------------
    // Outlets
    // ---------------------------------------------------------------------

    @Override
    public String outletName(int outlet)
    {
        OutletNumber n = outlet(outlet);
        return transport.getString(PowerNetObjects.outletName(n.value()));
    }

    @Override
    public void setOutletName(int outlet, String name)
    {
        OutletNumber n = outlet(outlet);
        Objects.requireNonNull(name, "name");
        transport.setString(PowerNetObjects.outletConfigName(n.value()), name);
    }

    @Override
    public OutletState outletStatus(int outlet)
    {
        OutletNumber n = outlet(outlet);
        return readOutletState(n);
    }

    /**
     * Convenience overload accepting {@code on}, {@code off} or {@code reboot}.
     *
     * @throws IllegalArgumentException for an unknown operation or an out-of-range outlet
     */
    public boolean outletCommand(int outlet, String operation)
    {
        return outletCommand(outlet, OutletCommand.fromName(operation));
    }

    @Override
    public boolean outletCommand(int outlet, OutletCommand command)
    {
        Objects.requireNonNull(command, "command");
        OutletNumber n = outlet(outlet);

        transport.setInt(PowerNetObjects.outletCommand(n.value()), command.code());

        OutletState target = command.targetState();
        AtomicReference<OutletState> observed = new AtomicReference<>(OutletState.UNKNOWN);
        AtomicBoolean droppedOff = new AtomicBoolean(!command.cyclesThroughOff());
        BoundedPoll.Outcome outcome = outletPoll.await(() -> {
            OutletState state = readOutletState(n);
            observed.set(state);
            if (!droppedOff.get()) {
                droppedOff.set(state == OutletState.OFF);
                return false;
            }
            return state == target;
        });

        log.debug("{}: outlet {} {} after {} read(s)", host(), n.value(), command.label(), outcome.attempts());
        sink.onVerification(new VerificationEvent(
                wallClock.now(), host(), "outlet-" + command.label(), n.toString(),
                target.label(), observed.get().label(), outcome.satisfied()));
        return outcome.satisfied();
    }

    @Override
    public void close()
    {
        transport.close();
    }

    @Override
    public String toString()
    {
        return "ApcPdu[" + config.host() + ", " + identity.modelNumber() + "]";
    }

    // ---------------------------------------------------------------------
    // Internals
    // ---------------------------------------------------------------------

    private OutletNumber outlet(int outlet)
    {
        return OutletNumber.of(outlet, identity.numOutlets());
    }

    private OutletState readOutletState(OutletNumber n)
    {
        return OutletState.fromCode(transport.getInt(PowerNetObjects.outletState(n.value())));
    }

    private SensorType reportedSensorType()
    {
        return SensorType.fromCode(transport.getInt(PowerNetObjects.SENSOR_TYPE));
    }

    static PduIdentity readIdentity(SnmpTransport transport)
    {
        return new PduIdentity(
                transport.getString(PowerNetObjects.IDENT_NAME),
                transport.getString(PowerNetObjects.IDENT_LOCATION),
                transport.getString(PowerNetObjects.IDENT_HARDWARE_REV),
                transport.getString(PowerNetObjects.IDENT_FIRMWARE_REV),
                parseManufactureDate(transport.getString(PowerNetObjects.IDENT_DATE_OF_MANUFACTURE)),
                transport.getString(PowerNetObjects.IDENT_MODEL_NUMBER),
                transport.getString(PowerNetObjects.IDENT_SERIAL_NUMBER),
                transport.getInt(PowerNetObjects.NUM_OUTLETS),
                transport.getInt(PowerNetObjects.NUM_SWITCHED_OUTLETS),
                transport.getInt(PowerNetObjects.NUM_METERED_OUTLETS),
                transport.getInt(PowerNetObjects.MAX_CURRENT_RATING),
                transport.getInt(PowerNetObjects.PHASE_VOLTAGE));
    }

    static Optional<LocalDate> parseManufactureDate(String text)
    {
        try {
            return Optional.of(LocalDate.parse(text.strip(), MANUFACTURE_DATE));
        } catch (DateTimeParseException e) {
            log.warn("Unrecognized date of manufacture '{}'", text);
            return Optional.empty();
        }
    }

    public static final class Builder
    {
        private PduConfig config;
        private SnmpConnector connector = Snmp4jTransport::open;
        private NocObservabilitySink sink = NullObservabilitySink.INSTANCE;
        private WallClock wallClock = SystemWallClock.INSTANCE;
        private MonotonicClock monotonicClock = SystemMonotonicClock.INSTANCE;
        private Sleeper sleeper = Sleeper.SYSTEM;

        public Builder withConfig(PduConfig config)
        {
            this.config = config;
            return this;
        }

        public Builder withConnector(SnmpConnector connector)
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

        public Builder withMonotonicClock(MonotonicClock monotonicClock)
        {
            this.monotonicClock = monotonicClock;
            return this;
        }

        public Builder withSleeper(Sleeper sleeper)
        {
            this.sleeper = sleeper;
            return this;
        }

        /**
         * Opens the transport and reads the unit's identity.
         *
         * @throws DeviceConnectionException if the transport cannot be opened
         *         or the identity cannot be read
         */
        public ApcPdu build()
        {
            Objects.requireNonNull(config, "config");
            Objects.requireNonNull(connector, "connector");
            Objects.requireNonNull(sink, "sink");
            Objects.requireNonNull(wallClock, "wallClock");

            SnmpTransport transport;
            try {
                transport = connector.open(config);
            } catch (IOException e) {
                sink.onError(new NocErrorEvent(wallClock.now(), config.host(), "SNMP open failed", e));
                throw new DeviceConnectionException(config.host(), "SNMP open failed: " + e.getMessage(), e);
            }

            PduIdentity identity;
            try {
                identity = readIdentity(transport);
            } catch (DeviceConnectionException e) {
                sink.onError(new NocErrorEvent(wallClock.now(), config.host(), "identity read failed", e));
                transport.close();
                throw e;
            }

            BoundedPoll poll = new BoundedPoll(monotonicClock, sleeper,
                    config.pollingPolicy().outletPollInterval(),
                    config.pollingPolicy().outletPollTimeout());

            return new ApcPdu(config, transport, identity, sink, wallClock, poll);
        }
    }
}

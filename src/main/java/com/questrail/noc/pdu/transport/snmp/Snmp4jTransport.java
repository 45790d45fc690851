package com.questrail.noc.pdu.transport.snmp;

import com.questrail.noc.api.DeviceConnectionException;
import com.questrail.noc.config.PduConfig;
import com.questrail.noc.pdu.transport.SnmpTransport;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.snmp4j.CommunityTarget;
import org.snmp4j.PDU;
import org.snmp4j.Snmp;
import org.snmp4j.event.ResponseEvent;
import org.snmp4j.mp.SnmpConstants;
import org.snmp4j.smi.Integer32;
import org.snmp4j.smi.OID;
import org.snmp4j.smi.OctetString;
import org.snmp4j.smi.UdpAddress;
import org.snmp4j.smi.Variable;
import org.snmp4j.smi.VariableBinding;
import org.snmp4j.transport.DefaultUdpTransportMapping;

import java.io.IOException;
import java.net.InetAddress;
import java.util.List;
import java.util.Objects;

/**
 * Snmp4jTransport
 * =============================================================================
 * SNMPv2c implementation of {@link SnmpTransport} over SNMP4J.
 *
 * <h2>Targets</h2>
 * Two community targets share one UDP socket: the read target carries the
 * public community, the write target the private one. Both use the timeout
 * and retry count from {@link PduConfig}.
 *
 * <h2>Failure model</h2>
 * <ul>
 *   <li>No response within timeout and retries → {@link DeviceConnectionException}</li>
 *   <li>Response with a non-zero error status → {@link DeviceConnectionException}</li>
 *   <li>{@code noSuchObject} / {@code noSuchInstance} → {@link DeviceConnectionException}</li>
 * </ul>
 *
 * SNMP4J types MUST NOT escape this package.
 */
public final class Snmp4jTransport implements SnmpTransport
{
    private static final Logger log = LoggerFactory.getLogger(Snmp4jTransport.class);

    private final String host;
    private final Snmp snmp;
    private final CommunityTarget<UdpAddress> readTarget;
    private final CommunityTarget<UdpAddress> writeTarget;

    private Snmp4jTransport(String host,
                            Snmp snmp,
                            CommunityTarget<UdpAddress> readTarget,
                            CommunityTarget<UdpAddress> writeTarget)
    {
        this.host = host;
        this.snmp = snmp;
        this.readTarget = readTarget;
        this.writeTarget = writeTarget;
    }

    /**
     * Resolves the agent address and starts listening for responses.
     *
     * @throws IOException if the host cannot be resolved or the socket cannot be opened
     */
    public static Snmp4jTransport open(PduConfig config) throws IOException
    {
        Objects.requireNonNull(config, "config");
        return open(config, new Snmp(new DefaultUdpTransportMapping()));
    }

    /**
     * Starts {@code snmp} listening for responses from the configured agent.
     * {@code snmp} is closed if that fails.
     */
    static Snmp4jTransport open(PduConfig config, Snmp snmp) throws IOException
    {
        UdpAddress address;
        try {
            address = new UdpAddress(InetAddress.getByName(config.host()), config.port());
            snmp.listen();
        } catch (IOException e) {
            closeQuietly(config.host(), snmp);
            throw e;
        }

        return new Snmp4jTransport(
                config.host(),
                snmp,
                target(address, config.publicCommunity(), config),
                target(address, config.privateCommunity(), config));
    }

    private static CommunityTarget<UdpAddress> target(UdpAddress address, String community, PduConfig config)
    {
        CommunityTarget<UdpAddress> target = new CommunityTarget<>(address, new OctetString(community));
        target.setVersion(SnmpConstants.version2c);
        target.setRetries(config.retries());
        target.setTimeout(config.requestTimeout().toMillis());
        return target;
    }

    // ---------------------------------------------------------------------
    // SnmpTransport
    // ---------------------------------------------------------------------

    @Override
    public int getInt(String oid)
    {
        Variable value = get(oid);
        try {
            return value.toInt();
        } catch (UnsupportedOperationException e) {
            throw new DeviceConnectionException(host,
                    oid + " is not an integer (" + value.getSyntaxString() + ")", e);
        }
    }

    @Override
    public String getString(String oid)
    {
        return get(oid).toString();
    }

    @Override
    public void setInt(String oid, int value)
    {
        send(PDU.SET, writeTarget, new VariableBinding(new OID(oid), new Integer32(value)));
    }

    @Override
    public void setString(String oid, String value)
    {
        send(PDU.SET, writeTarget, new VariableBinding(new OID(oid), new OctetString(value)));
    }

    @Override
    public void close()
    {
        closeQuietly(host, snmp);
    }

    // ---------------------------------------------------------------------
    // Internals
    // ---------------------------------------------------------------------

    static void closeQuietly(String host, Snmp snmp)
    {
        try {
            snmp.close();
        } catch (IOException e) {
            log.debug("{}: error closing SNMP session", host, e);
        }
    }

    private Variable get(String oid)
    {
        return send(PDU.GET, readTarget, new VariableBinding(new OID(oid)));
    }

    private Variable send(int type, CommunityTarget<UdpAddress> target, VariableBinding binding)
    {
        PDU pdu = new PDU();
        pdu.setType(type);
        pdu.add(binding);

        log.debug("---> {} {} {}", host, PDU.getTypeString(type), binding);

        ResponseEvent<UdpAddress> event;
        try {
            event = snmp.send(pdu, target);
        } catch (IOException e) {
            throw new DeviceConnectionException(host, "SNMP send failed: " + e.getMessage(), e);
        }

        if (event == null || event.getResponse() == null) {
            throw new DeviceConnectionException(host, "SNMP request timed out for " + binding.getOid());
        }

        PDU response = event.getResponse();
        if (response.getErrorStatus() != PDU.noError) {
            throw new DeviceConnectionException(host,
                    "SNMP error " + response.getErrorStatusText() + " for " + binding.getOid());
        }

        List<? extends VariableBinding> bindings = response.getVariableBindings();
        if (bindings.isEmpty()) {
            throw new DeviceConnectionException(host, "Empty SNMP response for " + binding.getOid());
        }

        VariableBinding result = bindings.get(0);
        log.debug("<--- {} {}", host, result);

        if (result.isException()) {
            throw new DeviceConnectionException(host,
                    result.getOid() + ": " + result.getVariable());
        }
        return result.getVariable();
    }
}

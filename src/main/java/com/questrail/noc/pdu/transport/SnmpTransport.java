package com.questrail.noc.pdu.transport;

/**
 * Scalar SNMP access to one agent.
 *
 * <p>Reads go out with the read community, writes with the write community.
 * Object identifiers are dotted-decimal strings (see
 * {@link com.questrail.noc.pdu.PowerNetObjects}).</p>
 *
 * <p>Every method throws {@link com.questrail.noc.api.DeviceConnectionException}
 * when the request times out, the agent reports an error status, or the
 * object does not exist on the agent.</p>
 */
public interface SnmpTransport extends AutoCloseable
{
    int getInt(String oid);

    String getString(String oid);

    void setInt(String oid, int value);

    void setString(String oid, String value);

    @Override
    void close();
}

package com.questrail.noc.pdu.transport;

import com.questrail.noc.config.PduConfig;

import java.io.IOException;

/**
 * Creates the {@link SnmpTransport} for a unit.
 */
@FunctionalInterface
public interface SnmpConnector
{
    SnmpTransport open(PduConfig config) throws IOException;
}

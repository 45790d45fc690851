package com.questrail.noc.pdu.transport.snmp;

import com.questrail.noc.config.PduConfig;
import org.junit.jupiter.api.Test;
import org.snmp4j.Snmp;

import java.io.IOException;

import static org.junit.jupiter.api.Assertions.*;

class Snmp4jTransportTest {

    private static final PduConfig CONFIG = PduConfig.builder().withHost("127.0.0.1").build();

    /** An {@link Snmp} whose socket cannot be bound. */
    private static final class UnboundSnmp extends Snmp {
        boolean closed;

        @Override
        public void listen() throws IOException {
            throw new IOException("Address already in use");
        }

        @Override
        public void close() {
            closed = true;
        }
    }

    @Test
    void sessionIsClosedWhenListeningFails() {
        UnboundSnmp snmp = new UnboundSnmp();

        IOException e = assertThrows(IOException.class, () -> Snmp4jTransport.open(CONFIG, snmp));

        assertEquals("Address already in use", e.getMessage());
        assertTrue(snmp.closed);
    }

    @Test
    void closeReleasesSession() throws IOException {
        RecordingSnmp snmp = new RecordingSnmp();
        Snmp4jTransport transport = Snmp4jTransport.open(CONFIG, snmp);

        transport.close();

        assertTrue(snmp.listening);
        assertTrue(snmp.closed);
    }

    private static final class RecordingSnmp extends Snmp {
        boolean listening;
        boolean closed;

        @Override
        public void listen() {
            listening = true;
        }

        @Override
        public void close() {
            closed = true;
        }
    }
}

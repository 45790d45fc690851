package com.questrail.noc.observability;

import com.questrail.noc.switching.internal.session.SessionState;
import org.junit.jupiter.api.Test;

import java.io.IOException;
import java.time.Instant;

import static org.junit.jupiter.api.Assertions.*;

class Slf4jObservabilitySinkTest {

    private static final Instant NOW = Instant.parse("2024-03-01T12:00:00Z");

    @Test
    void connectivityChangeIsDistinguishedFromPrivilegeChange() {
        assertTrue(new SessionTransitionEvent(NOW, "sw", SessionState.DISCONNECTED, SessionState.UNPRIVILEGED)
                .isConnectivityChange());
        assertTrue(new SessionTransitionEvent(NOW, "sw", SessionState.PRIVILEGED, SessionState.DISCONNECTED)
                .isConnectivityChange());
        assertFalse(new SessionTransitionEvent(NOW, "sw", SessionState.UNPRIVILEGED, SessionState.PRIVILEGED)
                .isConnectivityChange());
    }

    @Test
    void logsEveryEventKind() {
        NocObservabilitySink sink = new Slf4jObservabilitySink();

        assertDoesNotThrow(() -> {
            sink.onSessionTransition(
                    new SessionTransitionEvent(NOW, "sw", SessionState.DISCONNECTED, SessionState.PRIVILEGED));
            sink.onCommand(new CommandEvent(NOW, "sw", "show version", 1200));
            sink.onVerification(new VerificationEvent(NOW, "sw", "poe-on", "Gi1/0/1", "auto", "auto", true));
            sink.onVerification(new VerificationEvent(NOW, "sw", "poe-on", "Gi1/0/1", "auto", "off", false));
            sink.onError(new NocErrorEvent(NOW, "sw", "connect failed", new IOException("Auth fail")));
        });
    }

    @Test
    void nullSinkIgnoresEverything() {
        assertDoesNotThrow(() -> NullObservabilitySink.INSTANCE.onError(new NocErrorEvent(NOW, "sw", "x", null)));
    }
}

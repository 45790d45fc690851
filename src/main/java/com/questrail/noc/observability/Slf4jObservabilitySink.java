package com.questrail.noc.observability;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Production implementation of NocObservabilitySink that emits logs via SLF4J.
 */
public final class Slf4jObservabilitySink implements NocObservabilitySink {
    private static final Logger log = LoggerFactory.getLogger(Slf4jObservabilitySink.class);

    @Override
    public void onSessionTransition(SessionTransitionEvent event) {
        if (event.isConnectivityChange()) {
            log.info("{}: Session {} -> {}", event.host(), event.oldState(), event.newState());
        } else {
            log.debug("{}: Session {} -> {}", event.host(), event.oldState(), event.newState());
        }
    }

    @Override
    public void onCommand(CommandEvent event) {
        log.debug("{}: Command '{}' returned {} chars", event.host(), event.command(), event.outputLength());
    }

    @Override
    public void onVerification(VerificationEvent event) {
        if (event.confirmed()) {
            log.info("{}: {} on {} confirmed ({})",
                event.host(), event.operation(), event.target(), event.observed());
        } else {
            log.warn("{}: {} on {} not confirmed, expected {} but observed {}",
                event.host(), event.operation(), event.target(), event.expected(), event.observed());
        }
    }

    @Override
    public void onError(NocErrorEvent event) {
        log.error("{}: {}", event.host(), event.message(), event.cause());
    }
}

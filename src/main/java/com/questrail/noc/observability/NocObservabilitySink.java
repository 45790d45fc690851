package com.questrail.noc.observability;

/**
 * Main interface for receiving device-control observability events.
 * Implementations can provide logging, metrics, or tracing.
 *
 * <p>A sink is injected into each facade instead of relying on a process-wide
 * logger, so two devices driven from the same process can be observed
 * separately.</p>
 */
public interface NocObservabilitySink {
    /**
     * Called when a switch session changes connection or privilege state.
     * @param event the transition event details
     */
    void onSessionTransition(SessionTransitionEvent event);

    /**
     * Called after a command has been exchanged with a device.
     * @param event the command event
     */
    void onCommand(CommandEvent event);

    /**
     * Called when a mutating operation has been verified against device state,
     * whether or not the intended state was observed.
     * @param event the verification outcome
     */
    void onVerification(VerificationEvent event);

    /**
     * Called when an error or anomaly occurs while talking to a device.
     * @param event the error event
     */
    void onError(NocErrorEvent event);
}

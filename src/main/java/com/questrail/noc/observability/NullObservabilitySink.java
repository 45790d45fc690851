package com.questrail.noc.observability;

/**
 * No-op implementation of NocObservabilitySink.
 */
public final class NullObservabilitySink implements NocObservabilitySink {
    public static final NullObservabilitySink INSTANCE = new NullObservabilitySink();

    private NullObservabilitySink() {}

    @Override
    public void onSessionTransition(SessionTransitionEvent event) {}

    @Override
    public void onCommand(CommandEvent event) {}

    @Override
    public void onVerification(VerificationEvent event) {}

    @Override
    public void onError(NocErrorEvent event) {}
}

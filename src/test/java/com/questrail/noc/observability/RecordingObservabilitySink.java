package com.questrail.noc.observability;

import java.util.ArrayList;
import java.util.List;
import java.util.stream.Collectors;

/**
 * Test sink that records events for assertions.
 */
public final class RecordingObservabilitySink implements NocObservabilitySink {
    private final List<Object> events = new ArrayList<>();

    @Override
    public synchronized void onSessionTransition(SessionTransitionEvent event) {
        events.add(event);
    }

    @Override
    public synchronized void onCommand(CommandEvent event) {
        events.add(event);
    }

    @Override
    public synchronized void onVerification(VerificationEvent event) {
        events.add(event);
    }

    @Override
    public synchronized void onError(NocErrorEvent event) {
        events.add(event);
    }

    public synchronized List<Object> getAllEvents() {
        return new ArrayList<>(events);
    }

    public synchronized List<SessionTransitionEvent> getSessionTransitions() {
        return ofType(SessionTransitionEvent.class);
    }

    public synchronized List<CommandEvent> getCommands() {
        return ofType(CommandEvent.class);
    }

    public synchronized List<VerificationEvent> getVerifications() {
        return ofType(VerificationEvent.class);
    }

    public synchronized List<NocErrorEvent> getErrors() {
        return ofType(NocErrorEvent.class);
    }

    public synchronized <T> boolean hasEventOfType(Class<T> type) {
        return events.stream().anyMatch(type::isInstance);
    }

    private <T> List<T> ofType(Class<T> type) {
        return events.stream()
            .filter(type::isInstance)
            .map(type::cast)
            .collect(Collectors.toList());
    }
}

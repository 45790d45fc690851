package com.questrail.noc.observability;

import com.questrail.noc.switching.internal.session.SessionState;

import java.time.Instant;

/**
 * Record representing a change of a switch session's state.
 */
public record SessionTransitionEvent(
    Instant timestamp,
    String host,
    SessionState oldState,
    SessionState newState
) {
    /**
     * Checks if the transition crossed the connected/disconnected boundary.
     */
    public boolean isConnectivityChange() {
        return oldState.isConnected() != newState.isConnected();
    }
}

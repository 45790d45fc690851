package com.questrail.noc.switching.internal.session;

import com.questrail.noc.switching.model.PrivilegeLevel;

import java.util.Optional;

/**
 * Connection and privilege state of a {@link SwitchSession}.
 *
 * <pre>
 *   DISCONNECTED ──connect──▶ UNPRIVILEGED ──enable──▶ PRIVILEGED
 *        ▲                         │                       │
 *        └──────── disconnect / transport failure ─────────┘
 * </pre>
 *
 * A login that lands directly on a {@code #} prompt goes straight to
 * {@link #PRIVILEGED}.
 */
public enum SessionState
{
    DISCONNECTED(null),
    UNPRIVILEGED(PrivilegeLevel.UNPRIVILEGED),
    PRIVILEGED(PrivilegeLevel.PRIVILEGED);

    private final PrivilegeLevel privilegeLevel;

    SessionState(PrivilegeLevel privilegeLevel) {
        this.privilegeLevel = privilegeLevel;
    }

    public boolean isConnected() {
        return this != DISCONNECTED;
    }

    /**
     * Privilege of the connected session, or empty when disconnected.
     */
    public Optional<PrivilegeLevel> privilegeLevel() {
        return Optional.ofNullable(privilegeLevel);
    }
}

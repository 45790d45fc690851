package com.questrail.noc.switching.model;

/**
 * CLI privilege of a switch session.
 *
 * <p>A session only ever moves from {@link #UNPRIVILEGED} to
 * {@link #PRIVILEGED}, through {@code enable}. A new connection starts again
 * from whatever the login prompt shows.</p>
 */
public enum PrivilegeLevel
{
    /** User EXEC mode, prompt ends with {@code >}. */
    UNPRIVILEGED,

    /** Privileged EXEC mode, prompt ends with {@code #}. */
    PRIVILEGED
}

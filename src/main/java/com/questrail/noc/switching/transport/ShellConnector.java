package com.questrail.noc.switching.transport;

import com.questrail.noc.config.SwitchConfig;

import java.io.IOException;

/**
 * Opens an authenticated interactive shell on a switch.
 *
 * <p>One call yields one {@link ShellTransport}; the caller owns it and must
 * {@link ShellTransport#close() close} it.</p>
 */
@FunctionalInterface
public interface ShellConnector
{
    /**
     * Connects and authenticates.
     *
     * @throws IOException if the host is unreachable, authentication fails,
     *         or the shell channel cannot be opened
     */
    ShellTransport open(SwitchConfig config) throws IOException;
}

package com.questrail.noc.switching.transport;

import java.io.IOException;
import java.util.Collection;
import java.util.List;

/**
 * ShellTransport
 * -----------------------------------------------------------------------------
 * An open interactive shell on a switch.
 *
 * <p>Exchanges are strictly sequential: a line is sent, then the caller blocks
 * until the device prints one of the expected signals (normally the prompt).
 * There is no pipelining.</p>
 */
public interface ShellTransport
{
    /**
     * Sends one line and waits until any of {@code signals} appears.
     *
     * @param command text to send; a line terminator is appended
     * @param signals strings whose appearance ends the exchange
     * @return everything the device printed, up to and including the signal
     * @throws IOException if the channel fails or no signal arrives in time
     */
    String sendCommand(String command, Collection<String> signals) throws IOException;

    /**
     * Sends configuration lines one at a time, waiting for a {@code #}
     * terminated prompt after each.
     *
     * @return the concatenated output of all lines
     */
    default String sendConfigSequence(List<String> lines) throws IOException {
        StringBuilder output = new StringBuilder();
        for (String line : lines) {
            output.append(sendCommand(line, List.of("#")));
        }
        return output.toString();
    }

    /**
     * Checks that the remote shell is still alive.
     *
     * <p>The check must touch the live connection (channel state or a no-op
     * exchange), not merely a cached flag, because the far end can drop the
     * session at any time.</p>
     */
    boolean probeLiveness();

    /**
     * Closes the shell and the underlying connection. Idempotent.
     */
    void close();
}

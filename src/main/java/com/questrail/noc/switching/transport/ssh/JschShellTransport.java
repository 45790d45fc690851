package com.questrail.noc.switching.transport.ssh;

import com.jcraft.jsch.ChannelShell;
import com.jcraft.jsch.Session;
import com.questrail.noc.switching.transport.ShellTransport;
import net.sf.expectit.Expect;
import net.sf.expectit.Result;
import net.sf.expectit.matcher.Matcher;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.time.Duration;
import java.util.Collection;
import java.util.Objects;
import java.util.concurrent.TimeUnit;

import static net.sf.expectit.matcher.Matchers.anyOf;
import static net.sf.expectit.matcher.Matchers.contains;

/**
 * An interactive JSch shell channel driven through expectit.
 *
 * <p>Each exchange writes one line and then reads until any of the requested
 * signal strings is seen. The command timeout configured on the
 * {@link Expect} bounds every read.</p>
 */
final class JschShellTransport implements ShellTransport
{
    private static final Logger log = LoggerFactory.getLogger(JschShellTransport.class);

    private final String host;
    private final Session session;
    private final ChannelShell channel;
    private final Expect expect;
    private final Duration livenessTimeout;

    private boolean closed;

    JschShellTransport(String host,
                       Session session,
                       ChannelShell channel,
                       Expect expect,
                       Duration livenessTimeout)
    {
        this.host = Objects.requireNonNull(host, "host");
        this.session = Objects.requireNonNull(session, "session");
        this.channel = Objects.requireNonNull(channel, "channel");
        this.expect = Objects.requireNonNull(expect, "expect");
        this.livenessTimeout = Objects.requireNonNull(livenessTimeout, "livenessTimeout");
    }

    @Override
    public String sendCommand(String command, Collection<String> signals) throws IOException
    {
        Objects.requireNonNull(command, "command");
        if (signals.isEmpty()) {
            throw new IllegalArgumentException("At least one signal required");
        }
        requireOpen();

        expect.sendLine(command);
        Result result = expect.expect(anyOfSignals(signals));
        return result.getBefore() + result.group();
    }

    @Override
    public boolean probeLiveness()
    {
        if (closed || !session.isConnected() || !channel.isConnected() || channel.isClosed()) {
            return false;
        }

        // An empty line makes the device reprint its prompt.
        try {
            Expect probe = expect.withTimeout(livenessTimeout.toMillis(), TimeUnit.MILLISECONDS);
            probe.sendLine();
            probe.expect(anyOf(contains("#"), contains(">")));
            return true;
        } catch (IOException e) {
            log.debug("{}: liveness probe failed", host, e);
            return false;
        }
    }

    @Override
    public void close()
    {
        if (closed) {
            return;
        }
        closed = true;

        try {
            expect.close();
        } catch (IOException e) {
            log.debug("{}: error closing expect streams", host, e);
        }
        channel.disconnect();
        session.disconnect();
    }

    private void requireOpen() throws IOException
    {
        if (closed) {
            throw new IOException("Shell to " + host + " is closed");
        }
        if (channel.isClosed()) {
            throw new IOException("Shell to " + host + " was closed by the remote side");
        }
    }

    private static Matcher<?> anyOfSignals(Collection<String> signals)
    {
        Matcher<?>[] matchers = signals.stream()
                .map(signal -> contains(signal))
                .toArray(Matcher<?>[]::new);
        return matchers.length == 1 ? matchers[0] : anyOf(matchers);
    }
}

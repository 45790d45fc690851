package com.questrail.noc.switching.transport.ssh;

import com.jcraft.jsch.ChannelShell;
import com.jcraft.jsch.JSch;
import com.jcraft.jsch.JSchException;
import com.jcraft.jsch.Session;
import com.questrail.noc.config.SwitchConfig;
import com.questrail.noc.switching.transport.ShellConnector;
import com.questrail.noc.switching.transport.ShellTransport;
import net.sf.expectit.Expect;
import net.sf.expectit.ExpectBuilder;

import java.io.IOException;
import java.io.InputStream;
import java.io.OutputStream;
import java.nio.charset.StandardCharsets;
import java.util.Properties;
import java.util.concurrent.TimeUnit;

import static net.sf.expectit.filter.Filters.removeColors;

/**
 * JschShellConnector
 * =============================================================================
 * JSch-backed implementation of the {@link ShellConnector} port.
 *
 * <h2>Authentication</h2>
 * Password authentication only: no agent, no key files. Unknown host keys
 * are accepted, since lab switches are routinely re-imaged and re-keyed.
 *
 * <h2>JSch containment rule</h2>
 * JSch and expectit types MUST NOT escape this package. Everything above it
 * sees {@link ShellTransport} and {@link IOException}.
 */
public final class JschShellConnector implements ShellConnector
{
    @Override
    public ShellTransport open(SwitchConfig config) throws IOException
    {
        final int timeoutMillis = (int) config.pollingPolicy().commandTimeout().toMillis();

        Session session = null;
        try {
            JSch jsch = new JSch();
            session = jsch.getSession(config.username(), config.host(), config.port());
            session.setPassword(config.password());

            Properties properties = new Properties();
            properties.put("StrictHostKeyChecking", "no");
            properties.put("PreferredAuthentications", "password,keyboard-interactive");
            session.setConfig(properties);
            session.connect(timeoutMillis);

            ChannelShell channel = (ChannelShell) session.openChannel("shell");
            InputStream input = channel.getInputStream();
            OutputStream output = channel.getOutputStream();
            channel.connect(timeoutMillis);

            Expect expect = new ExpectBuilder()
                    .withOutput(output)
                    .withInputs(input)
                    .withCharset(StandardCharsets.UTF_8)
                    .withTimeout(timeoutMillis, TimeUnit.MILLISECONDS)
                    .withInputFilters(removeColors())
                    .withExceptionOnFailure()
                    .build();

            return new JschShellTransport(
                    config.host(), session, channel, expect, config.pollingPolicy().livenessTimeout());
        } catch (JSchException e) {
            if (session != null) {
                session.disconnect();
            }
            throw new IOException("SSH connection to " + config.host() + " failed: " + e.getMessage(), e);
        } catch (IOException e) {
            if (session != null) {
                session.disconnect();
            }
            throw e;
        }
    }
}

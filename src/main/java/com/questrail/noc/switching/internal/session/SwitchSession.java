package com.questrail.noc.switching.internal.session;

import com.questrail.noc.api.DeviceConnectionException;
import com.questrail.noc.config.SwitchConfig;
import com.questrail.noc.internal.time.WallClock;
import com.questrail.noc.observability.CommandEvent;
import com.questrail.noc.observability.NocErrorEvent;
import com.questrail.noc.observability.NocObservabilitySink;
import com.questrail.noc.observability.SessionTransitionEvent;
import com.questrail.noc.switching.model.PrivilegeLevel;
import com.questrail.noc.switching.transport.ShellConnector;
import com.questrail.noc.switching.transport.ShellTransport;

import java.io.IOException;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.Optional;

/**
 * SwitchSession
 * -----------------------------------------------------------------------------
 * Owner of the single logical CLI connection to one switch.
 *
 * <h2>What this class is</h2>
 * <ul>
 *   <li>The only holder of the {@link ShellTransport}; nothing else reads or
 *       writes it</li>
 *   <li>The state machine of {@link SessionState}: login, privilege
 *       escalation, disconnect</li>
 *   <li>The provider of two primitives to the command engine:
 *       {@link #runQuery(String)} and {@link #runConfig(List)}</li>
 * </ul>
 *
 * <h2>What this class is <em>not</em></h2>
 * <ul>
 *   <li>It does not parse command output</li>
 *   <li>It does not verify that a configuration change took effect</li>
 *   <li>It does not retry</li>
 * </ul>
 *
 * <h2>Not-connected model</h2>
 * Queries and configuration attempted before the session is ready return
 * {@link Optional#empty()} or {@code false}. Only {@link #connect()} and a
 * transport failure in the middle of an exchange throw
 * {@link DeviceConnectionException}.
 *
 * <h2>Threading</h2>
 * Not thread-safe. One session per concurrent caller. Disconnecting while a
 * configuration sequence is in flight can leave the device half-configured
 * and is the caller's responsibility to avoid.
 */
public final class SwitchSession
{
    static final List<String> LOGIN_SIGNALS = List.of(">", "#");
    static final List<String> ENABLE_SIGNALS = List.of("Password", "password");

    static final String CMD_ENABLE = "enable";
    static final String CMD_TERMINAL_LENGTH = "terminal length 0";
    static final String CMD_CONFIGURE = "configure terminal";
    static final String CMD_END = "end";

    private static final String MASKED = "********";

    // IOS allows three password attempts before returning to the > prompt.
    private static final int MAX_ENABLE_REPROMPTS = 3;

    private final SwitchConfig config;
    private final ShellConnector connector;
    private final NocObservabilitySink sink;
    private final WallClock wallClock;

    private ShellTransport transport;
    private SessionState state = SessionState.DISCONNECTED;
    private String hostname = "";
    private long connectionCount;

    public SwitchSession(SwitchConfig config,
                         ShellConnector connector,
                         NocObservabilitySink sink,
                         WallClock wallClock)
    {
        this.config = Objects.requireNonNull(config, "config");
        this.connector = Objects.requireNonNull(connector, "connector");
        this.sink = Objects.requireNonNull(sink, "sink");
        this.wallClock = Objects.requireNonNull(wallClock, "wallClock");
    }

    // ---------------------------------------------------------------------
    // Lifecycle
    // ---------------------------------------------------------------------

    /**
     * Opens the shell and reads the login prompt.
     *
     * <p>A {@code >} prompt leaves the session {@link SessionState#UNPRIVILEGED};
     * a {@code #} prompt makes it {@link SessionState#PRIVILEGED} immediately.
     * No-op if already connected.</p>
     *
     * @throws DeviceConnectionException if the connection or login fails
     */
    public void connect()
    {
        if (state.isConnected()) {
            return;
        }

        ShellTransport opened;
        try {
            opened = connector.open(config);
        } catch (IOException e) {
            sink.onError(new NocErrorEvent(wallClock.now(), host(), "connect failed", e));
            throw new DeviceConnectionException(host(), "connect failed: " + e.getMessage(), e);
        }

        this.transport = opened;
        connectionCount++;
        try {
            String banner = exchange("", LOGIN_SIGNALS, "");
            String prompt = lastLine(banner);
            hostname = promptHost(prompt);

            if (prompt.endsWith("#")) {
                transition(SessionState.PRIVILEGED);
                setTerminalLength();
            } else {
                transition(SessionState.UNPRIVILEGED);
            }
        } catch (IOException e) {
            throw transportFailure("login failed", e);
        }
    }

    /**
     * Escalates to privileged mode.
     *
     * <p>No-op unless the session is connected and unprivileged. If the device
     * rejects the secret the session stays unprivileged.</p>
     *
     * @param secret the enable secret
     * @throws DeviceConnectionException if the transport fails during the exchange
     */
    public void enable(String secret)
    {
        if (state != SessionState.UNPRIVILEGED) {
            return;
        }
        Objects.requireNonNull(secret, "secret");

        try {
            exchange(CMD_ENABLE, ENABLE_SIGNALS, CMD_ENABLE);

            List<String> afterSecret = new ArrayList<>(promptSignals());
            afterSecret.add(hostname + ">");
            afterSecret.addAll(ENABLE_SIGNALS);
            String reply = exchange(secret, afterSecret, MASKED);

            int reprompts = 0;
            while (isPasswordPrompt(reply) && reprompts++ < MAX_ENABLE_REPROMPTS) {
                // Rejected. Answer the remaining prompts empty to get back to >.
                reply = exchange("", afterSecret, "");
            }

            if (lastLine(reply).endsWith("#")) {
                transition(SessionState.PRIVILEGED);
                setTerminalLength();
            } else {
                sink.onError(new NocErrorEvent(wallClock.now(), host(), "enable secret rejected", null));
            }
        } catch (IOException e) {
            throw transportFailure("enable failed", e);
        }
    }

    /**
     * Releases the transport. Safe to call in any state, any number of times.
     */
    public void disconnect()
    {
        ShellTransport t = transport;
        transport = null;
        hostname = "";
        if (t != null) {
            t.close();
        }
        if (state != SessionState.DISCONNECTED) {
            transition(SessionState.DISCONNECTED);
        }
    }

    /**
     * Disables output paging so tables arrive in one piece.
     *
     * <p>Issued automatically on reaching privileged mode; calling it again is
     * harmless. No-op unless ready.</p>
     */
    public void setTerminalLength()
    {
        if (!isReady()) {
            return;
        }
        try {
            exchange(CMD_TERMINAL_LENGTH, promptSignals(), CMD_TERMINAL_LENGTH);
        } catch (IOException e) {
            throw transportFailure("terminal length failed", e);
        }
    }

    // ---------------------------------------------------------------------
    // State
    // ---------------------------------------------------------------------

    /**
     * Actively probes the remote shell.
     *
     * <p>A dead shell is released and the session becomes disconnected, so
     * subsequent operations return their not-connected results.</p>
     */
    public boolean isConnected()
    {
        if (transport == null) {
            return false;
        }
        if (transport.probeLiveness()) {
            return true;
        }

        sink.onError(new NocErrorEvent(wallClock.now(), host(), "shell no longer alive", null));
        disconnect();
        return false;
    }

    /**
     * Connected and privileged; cheap, does not touch the transport.
     */
    public boolean isReady()
    {
        return transport != null && state == SessionState.PRIVILEGED;
    }

    public SessionState state()
    {
        return state;
    }

    /**
     * Privilege of the current connection; {@link PrivilegeLevel#UNPRIVILEGED}
     * when disconnected.
     */
    public PrivilegeLevel privilegeLevel()
    {
        return state.privilegeLevel().orElse(PrivilegeLevel.UNPRIVILEGED);
    }

    public String host()
    {
        return config.host();
    }

    /**
     * Number of successful connects so far. Facts cached per connection
     * (such as the software version) are keyed by this value.
     */
    public long connectionCount()
    {
        return connectionCount;
    }

    /**
     * Device hostname as learned from the login prompt, or empty.
     */
    public String hostname()
    {
        return hostname;
    }

    // ---------------------------------------------------------------------
    // Primitives for the command engine
    // ---------------------------------------------------------------------

    /**
     * Runs a read-only command in privileged EXEC mode.
     *
     * @return the raw output, or empty when the session is not ready
     * @throws DeviceConnectionException if the transport fails during the exchange
     */
    public Optional<String> runQuery(String command)
    {
        Objects.requireNonNull(command, "command");
        if (!isReady()) {
            return Optional.empty();
        }
        try {
            return Optional.of(exchange(command, promptSignals(), command));
        } catch (IOException e) {
            throw transportFailure("'" + command + "' failed", e);
        }
    }

    /**
     * Runs configuration lines inside {@code configure terminal} ... {@code end}.
     *
     * <p>Returns once every line has been sent. Whether the device accepted
     * the change is for the caller to verify.</p>
     *
     * @return {@code true} if the sequence was sent, {@code false} when the
     *         session is not ready
     * @throws DeviceConnectionException if the transport fails during the sequence
     */
    public boolean runConfig(List<String> lines)
    {
        Objects.requireNonNull(lines, "lines");
        if (!isReady()) {
            return false;
        }

        List<String> sequence = new ArrayList<>(lines.size() + 2);
        sequence.add(CMD_CONFIGURE);
        sequence.addAll(lines);
        sequence.add(CMD_END);

        try {
            String output = transport.sendConfigSequence(sequence);
            sink.onCommand(new CommandEvent(wallClock.now(), host(), String.join("; ", sequence), output.length()));
            return true;
        } catch (IOException e) {
            throw transportFailure("configuration failed", e);
        }
    }

    // ---------------------------------------------------------------------
    // Internals
    // ---------------------------------------------------------------------

    private String exchange(String command, List<String> signals, String reported) throws IOException
    {
        String output = transport.sendCommand(command, signals);
        sink.onCommand(new CommandEvent(wallClock.now(), host(), reported, output.length()));
        return output;
    }

    private List<String> promptSignals()
    {
        if (hostname.isEmpty()) {
            return List.of("#");
        }
        return List.of(hostname + "#");
    }

    private DeviceConnectionException transportFailure(String what, IOException e)
    {
        sink.onError(new NocErrorEvent(wallClock.now(), host(), what, e));
        disconnect();
        return new DeviceConnectionException(host(), what + ": " + e.getMessage(), e);
    }

    private void transition(SessionState newState)
    {
        SessionState old = state;
        state = newState;
        sink.onSessionTransition(new SessionTransitionEvent(wallClock.now(), host(), old, newState));
    }

    private static boolean isPasswordPrompt(String output)
    {
        String last = lastLine(output);
        return last.contains("Password") || last.contains("password");
    }

    static String lastLine(String output)
    {
        String trimmed = output.strip();
        int newline = Math.max(trimmed.lastIndexOf('\n'), trimmed.lastIndexOf('\r'));
        return newline < 0 ? trimmed : trimmed.substring(newline + 1).strip();
    }

    /**
     * {@code Switch>} and {@code Switch#} both yield {@code Switch}.
     */
    static String promptHost(String prompt)
    {
        if (prompt.endsWith("#") || prompt.endsWith(">")) {
            return prompt.substring(0, prompt.length() - 1);
        }
        return "";
    }
}

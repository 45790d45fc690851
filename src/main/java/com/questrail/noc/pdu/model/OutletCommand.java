package com.questrail.noc.pdu.model;

import java.util.Locale;

/**
 * Commands accepted by {@code rPDU2OutletSwitchedControlCommand}, each with
 * the outlet state that confirms it took effect.
 *
 * <p>A reboot cycles the outlet off and back on. It is confirmed only once
 * {@link OutletState#OFF} has been observed and then {@link OutletState#ON};
 * an outlet still reading on before it drops does not count.</p>
 */
public enum OutletCommand
{
    ON(1, "on", OutletState.ON),
    OFF(2, "off", OutletState.OFF),
    REBOOT(3, "reboot", OutletState.ON);

    private final int code;
    private final String label;
    private final OutletState targetState;

    OutletCommand(int code, String label, OutletState targetState)
    {
        this.code = code;
        this.label = label;
        this.targetState = targetState;
    }

    public int code()
    {
        return code;
    }

    public String label()
    {
        return label;
    }

    public OutletState targetState()
    {
        return targetState;
    }

    /**
     * Whether the outlet must be seen off before its target state counts.
     */
    public boolean cyclesThroughOff()
    {
        return this == REBOOT;
    }

    /**
     * Parses {@code on}, {@code off} or {@code reboot}, ignoring case.
     *
     * @throws IllegalArgumentException for any other name
     */
    public static OutletCommand fromName(String name)
    {
        if (name != null) {
            String n = name.strip().toLowerCase(Locale.ROOT);
            for (OutletCommand c : values()) {
                if (c.label.equals(n)) {
                    return c;
                }
            }
        }
        throw new IllegalArgumentException("Unknown outlet command: " + name);
    }
}

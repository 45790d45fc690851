package com.questrail.noc.pdu.model;

/**
 * Switched outlet state ({@code rPDU2OutletSwitchedStatusState}).
 */
public enum OutletState
{
    UNKNOWN(0, ""),
    OFF(1, "off"),
    ON(2, "on");

    private final int code;
    private final String label;

    OutletState(int code, String label)
    {
        this.code = code;
        this.label = label;
    }

    public int code()
    {
        return code;
    }

    public String label()
    {
        return label;
    }

    public static OutletState fromCode(int code)
    {
        for (OutletState v : values()) {
            if (v.code == code) {
                return v;
            }
        }
        return UNKNOWN;
    }
}

package com.questrail.noc.pdu.model;

/**
 * Phase load state ({@code rPDU2PhaseStatusLoadState}).
 */
public enum LoadState
{
    UNKNOWN(0, ""),
    LOW_LOAD(1, "lowLoad"),
    NORMAL(2, "normal"),
    NEAR_OVERLOAD(3, "nearOverload"),
    OVERLOAD(4, "overload");

    private final int code;
    private final String label;

    LoadState(int code, String label)
    {
        this.code = code;
        this.label = label;
    }

    /** Integer value of the MIB enumeration. */
    public int code()
    {
        return code;
    }

    /** MIB enumeration name, e.g. {@code nearOverload}. */
    public String label()
    {
        return label;
    }

    /**
     * Maps an agent-reported value; values outside the enumeration map to
     * {@link #UNKNOWN}.
     */
    public static LoadState fromCode(int code)
    {
        for (LoadState v : values()) {
            if (v.code == code) {
                return v;
            }
        }
        return UNKNOWN;
    }
}

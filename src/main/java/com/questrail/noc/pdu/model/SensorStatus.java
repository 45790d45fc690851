package com.questrail.noc.pdu.model;

/**
 * Threshold status of a temperature or humidity reading.
 */
public enum SensorStatus
{
    UNKNOWN(0, ""),
    NOT_PRESENT(1, "notPresent"),
    BELOW_MIN(2, "belowMin"),
    BELOW_LOW(3, "belowLow"),
    NORMAL(4, "normal"),
    ABOVE_HIGH(5, "aboveHigh"),
    ABOVE_MAX(6, "aboveMax");

    private final int code;
    private final String label;

    SensorStatus(int code, String label)
    {
        this.code = code;
        this.label = label;
    }

    /** Integer value of the MIB enumeration. */
    public int code()
    {
        return code;
    }

    /** MIB enumeration name, e.g. {@code aboveHigh}. */
    public String label()
    {
        return label;
    }

    /**
     * Maps an agent-reported value; values outside the enumeration map to
     * {@link #UNKNOWN}.
     */
    public static SensorStatus fromCode(int code)
    {
        for (SensorStatus v : values()) {
            if (v.code == code) {
                return v;
            }
        }
        return UNKNOWN;
    }
}

package com.questrail.noc.pdu.model;

/**
 * Communication status between the unit and its probe.
 */
public enum CommStatus
{
    UNKNOWN(0, ""),
    NOT_INSTALLED(1, "notInstalled"),
    COMMS_OK(2, "commsOK"),
    COMMS_LOST(3, "commsLost");

    private final int code;
    private final String label;

    CommStatus(int code, String label)
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

    public static CommStatus fromCode(int code)
    {
        for (CommStatus v : values()) {
            if (v.code == code) {
                return v;
            }
        }
        return UNKNOWN;
    }
}

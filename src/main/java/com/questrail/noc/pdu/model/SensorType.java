package com.questrail.noc.pdu.model;

/**
 * Kind of environmental probe attached to the unit
 * ({@code rPDU2SensorTempHumidityStatusType}).
 */
public enum SensorType
{
    UNKNOWN(0, ""),
    TEMPERATURE_ONLY(1, "temperatureOnly"),
    TEMPERATURE_HUMIDITY(2, "temperatureHumidity"),
    COMMS_LOST(3, "commsLost"),
    NOT_INSTALLED(4, "notInstalled");

    private final int code;
    private final String label;

    SensorType(int code, String label)
    {
        this.code = code;
        this.label = label;
    }

    /** Integer value of the MIB enumeration. */
    public int code()
    {
        return code;
    }

    /** MIB enumeration name, e.g. {@code temperatureHumidity}. */
    public String label()
    {
        return label;
    }

    /**
     * A probe is present when it reports one of the two measuring types.
     */
    public boolean isPresent()
    {
        return this == TEMPERATURE_ONLY || this == TEMPERATURE_HUMIDITY;
    }

    public boolean supportsTemperature()
    {
        return isPresent();
    }

    public boolean supportsHumidity()
    {
        return this == TEMPERATURE_HUMIDITY;
    }

    /**
     * Maps an agent-reported value; values outside the enumeration map to
     * {@link #UNKNOWN}.
     */
    public static SensorType fromCode(int code)
    {
        for (SensorType v : values()) {
            if (v.code == code) {
                return v;
            }
        }
        return UNKNOWN;
    }
}

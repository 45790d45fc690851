package com.questrail.noc.pdu;

/**
 * PowerNetObjects
 * =============================================================================
 * Object identifiers of the PowerNet-MIB {@code rPDU2} objects used by
 * {@link ApcPdu}.
 *
 * <p>Unit-wide objects are instance {@code .1} of their table (one rack PDU
 * per agent). Per-outlet objects take the outlet number as the instance.</p>
 *
 * <pre>
 *   rPDU2                      1.3.6.1.4.1.318.1.1.26
 *     .2   ident
 *     .4   device (properties .2, status .3)
 *     .6   phase status .3
 *     .9   switched outlets (config .2.1, status .2.3, control .2.4)
 *     .10  temperature/humidity sensor (config .2.1, status .2.2)
 * </pre>
 */
public final class PowerNetObjects
{
    static final String RPDU2 = "1.3.6.1.4.1.318.1.1.26";

    private static final String IDENT = RPDU2 + ".2.1.1.";
    private static final String DEVICE_PROPERTIES = RPDU2 + ".4.2.1.";
    private static final String DEVICE_STATUS = RPDU2 + ".4.3.1.";
    private static final String PHASE_STATUS = RPDU2 + ".6.3.1.";
    private static final String OUTLET_CONFIG = RPDU2 + ".9.2.1.1.";
    private static final String OUTLET_STATUS = RPDU2 + ".9.2.3.1.";
    private static final String OUTLET_CONTROL = RPDU2 + ".9.2.4.1.";
    private static final String SENSOR_CONFIG = RPDU2 + ".10.2.1.1.";
    private static final String SENSOR_STATUS = RPDU2 + ".10.2.2.1.";

    // Identity (static)
    public static final String IDENT_NAME = IDENT + "3.1";
    public static final String IDENT_LOCATION = IDENT + "4.1";
    public static final String IDENT_HARDWARE_REV = IDENT + "5.1";
    public static final String IDENT_FIRMWARE_REV = IDENT + "6.1";
    public static final String IDENT_DATE_OF_MANUFACTURE = IDENT + "7.1";
    public static final String IDENT_MODEL_NUMBER = IDENT + "8.1";
    public static final String IDENT_SERIAL_NUMBER = IDENT + "9.1";

    // Device properties (static)
    public static final String NUM_OUTLETS = DEVICE_PROPERTIES + "4.1";
    public static final String NUM_SWITCHED_OUTLETS = DEVICE_PROPERTIES + "5.1";
    public static final String NUM_METERED_OUTLETS = DEVICE_PROPERTIES + "6.1";
    public static final String MAX_CURRENT_RATING = DEVICE_PROPERTIES + "9.1";

    // Status (dynamic)
    public static final String DEVICE_POWER = DEVICE_STATUS + "5.1";
    public static final String PHASE_LOAD_STATE = PHASE_STATUS + "4.1";
    public static final String PHASE_CURRENT = PHASE_STATUS + "5.1";
    public static final String PHASE_VOLTAGE = PHASE_STATUS + "6.1";

    // Temperature/humidity probe
    public static final String SENSOR_NAME = SENSOR_STATUS + "3.1";
    public static final String SENSOR_TYPE = SENSOR_STATUS + "5.1";
    public static final String SENSOR_COMM_STATUS = SENSOR_STATUS + "6.1";
    public static final String SENSOR_TEMP_F = SENSOR_STATUS + "7.1";
    public static final String SENSOR_TEMP_C = SENSOR_STATUS + "8.1";
    public static final String SENSOR_TEMP_STATUS = SENSOR_STATUS + "9.1";
    public static final String SENSOR_HUMIDITY = SENSOR_STATUS + "10.1";
    public static final String SENSOR_HUMIDITY_STATUS = SENSOR_STATUS + "11.1";
    public static final String SENSOR_CONFIG_NAME = SENSOR_CONFIG + "3.1";

    private PowerNetObjects() {}

    public static String outletName(int outlet)
    {
        return OUTLET_STATUS + "3." + outlet;
    }

    public static String outletState(int outlet)
    {
        return OUTLET_STATUS + "5." + outlet;
    }

    public static String outletConfigName(int outlet)
    {
        return OUTLET_CONFIG + "3." + outlet;
    }

    public static String outletCommand(int outlet)
    {
        return OUTLET_CONTROL + "5." + outlet;
    }
}

package com.questrail.noc.pdu.model;

import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

class OutletModelTest {

    @Test
    void commandNamesParseIgnoringCase() {
        assertEquals(OutletCommand.ON, OutletCommand.fromName("on"));
        assertEquals(OutletCommand.OFF, OutletCommand.fromName("OFF"));
        assertEquals(OutletCommand.REBOOT, OutletCommand.fromName(" reboot "));
        assertThrows(IllegalArgumentException.class, () -> OutletCommand.fromName("cycle"));
        assertThrows(IllegalArgumentException.class, () -> OutletCommand.fromName(null));
    }

    @Test
    void commandsCarryMibValuesAndTargetStates() {
        assertEquals(1, OutletCommand.ON.code());
        assertEquals(2, OutletCommand.OFF.code());
        assertEquals(3, OutletCommand.REBOOT.code());

        assertEquals(OutletState.ON, OutletCommand.ON.targetState());
        assertEquals(OutletState.OFF, OutletCommand.OFF.targetState());
        assertEquals(OutletState.ON, OutletCommand.REBOOT.targetState());
        assertTrue(OutletCommand.REBOOT.cyclesThroughOff());
        assertFalse(OutletCommand.ON.cyclesThroughOff());
        assertFalse(OutletCommand.OFF.cyclesThroughOff());
    }

    @Test
    void outletNumberIsRangeChecked() {
        assertEquals(1, OutletNumber.of(1, 24).value());
        assertEquals(24, OutletNumber.of(24, 24).value());
        assertEquals(OutletNumber.of(3, 24), OutletNumber.of(3, 8));
        assertThrows(IllegalArgumentException.class, () -> OutletNumber.of(0, 24));
        assertThrows(IllegalArgumentException.class, () -> OutletNumber.of(25, 24));
        assertThrows(IllegalArgumentException.class, () -> OutletNumber.of(1, 0));
    }

    @Test
    void mibEnumerationsMapCodesAndFallBackToUnknown() {
        assertEquals(OutletState.OFF, OutletState.fromCode(1));
        assertEquals(OutletState.UNKNOWN, OutletState.fromCode(0));
        assertEquals(LoadState.NEAR_OVERLOAD, LoadState.fromCode(3));
        assertEquals("nearOverload", LoadState.NEAR_OVERLOAD.label());
        assertEquals(CommStatus.COMMS_LOST, CommStatus.fromCode(3));
        assertEquals(SensorStatus.ABOVE_MAX, SensorStatus.fromCode(6));
        assertEquals(SensorStatus.UNKNOWN, SensorStatus.fromCode(-1));
    }

    @Test
    void onlyMeasuringProbeTypesArePresent() {
        assertTrue(SensorType.TEMPERATURE_ONLY.isPresent());
        assertTrue(SensorType.TEMPERATURE_HUMIDITY.supportsHumidity());
        assertFalse(SensorType.TEMPERATURE_ONLY.supportsHumidity());
        assertFalse(SensorType.COMMS_LOST.isPresent());
        assertFalse(SensorType.NOT_INSTALLED.supportsTemperature());
    }
}

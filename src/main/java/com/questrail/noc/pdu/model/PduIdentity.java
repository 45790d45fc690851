package com.questrail.noc.pdu.model;

import java.time.LocalDate;
import java.util.Objects;
import java.util.Optional;

/**
 * Static identity and ratings of a unit, read once when it is opened.
 *
 * @param dateOfManufacture empty when the agent reports a date that is not
 *                          in {@code MM/dd/yyyy} form
 * @param maxCurrent        rated current in amps
 * @param voltage           phase voltage in volts
 */
public record PduIdentity(
    String name,
    String location,
    String hardwareRevision,
    String firmwareRevision,
    Optional<LocalDate> dateOfManufacture,
    String modelNumber,
    String serialNumber,
    int numOutlets,
    int numSwitchedOutlets,
    int numMeteredOutlets,
    int maxCurrent,
    int voltage
) {
    public static final String VENDOR = "APC";

    public PduIdentity {
        Objects.requireNonNull(name, "name");
        Objects.requireNonNull(location, "location");
        Objects.requireNonNull(hardwareRevision, "hardwareRevision");
        Objects.requireNonNull(firmwareRevision, "firmwareRevision");
        Objects.requireNonNull(dateOfManufacture, "dateOfManufacture");
        Objects.requireNonNull(modelNumber, "modelNumber");
        Objects.requireNonNull(serialNumber, "serialNumber");

        if (numOutlets < 0) {
            throw new IllegalArgumentException("numOutlets must be non-negative");
        }
    }

    public String vendor() {
        return VENDOR;
    }
}

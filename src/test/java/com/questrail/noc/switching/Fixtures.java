package com.questrail.noc.switching;

import java.io.IOException;
import java.io.InputStream;
import java.io.UncheckedIOException;
import java.nio.charset.StandardCharsets;

/**
 * Loads captured device output from {@code src/test/resources/fixtures}.
 */
public final class Fixtures {

    public static final String MAC_ADDRESS_TABLE = "mac_address_table.txt";
    public static final String IP_DEVICE_TRACKING = "ip_device_tracking.txt";
    public static final String POWER_INLINE = "power_inline.txt";
    public static final String POWER_INLINE_TWO_TABLES = "power_inline_two_tables.txt";
    public static final String VLAN_BRIEF = "vlan_brief.txt";
    public static final String VERSION = "version.txt";

    private Fixtures() {}

    public static String load(String name) {
        try (InputStream in = Fixtures.class.getResourceAsStream("/fixtures/" + name)) {
            if (in == null) {
                throw new IllegalArgumentException("No fixture " + name);
            }
            return new String(in.readAllBytes(), StandardCharsets.UTF_8);
        } catch (IOException e) {
            throw new UncheckedIOException(e);
        }
    }
}

package com.questrail.noc.switching.model;

import java.util.Locale;
import java.util.Objects;

/**
 * Strongly typed 48-bit MAC address.
 *
 * <p>
 * Switch tables print addresses in Cisco dotted notation
 * ({@code 000b.7866.5240}); operators and DHCP logs use the colon form. This
 * type accepts either (and the dash form) and always prints the
 * lower-case colon form ({@code 00:0b:78:66:52:40}), so entries from
 * different tables compare equal.
 * </p>
 */
public final class MacAddress implements Comparable<MacAddress>
{
    private final long value;

    private MacAddress(long value) {
        this.value = value;
    }

    /**
     * Parses a MAC address in dotted ({@code 000b.7866.5240}), colon
     * ({@code 00:0b:78:66:52:40}) or dash ({@code 00-0b-78-66-52-40}) notation.
     *
     * @throws IllegalArgumentException if {@code text} is not a MAC address
     */
    public static MacAddress parse(String text) {
        Objects.requireNonNull(text, "text");

        String hex;
        if (text.matches("(?i)[0-9a-f]{4}\\.[0-9a-f]{4}\\.[0-9a-f]{4}")) {
            hex = text.replace(".", "");
        } else if (text.matches("(?i)([0-9a-f]{2}[:-]){5}[0-9a-f]{2}")) {
            hex = text.replace(":", "").replace("-", "");
        } else {
            throw new IllegalArgumentException("Not a MAC address: '" + text + "'");
        }
        return new MacAddress(Long.parseLong(hex, 16));
    }

    /**
     * Cisco dotted notation, as used in switch commands.
     */
    public String toDottedString() {
        String hex = String.format(Locale.ROOT, "%012x", value);
        return hex.substring(0, 4) + "." + hex.substring(4, 8) + "." + hex.substring(8);
    }

    /**
     * Numeric value of the address (low 48 bits).
     */
    public long value() {
        return value;
    }

    @Override
    public int compareTo(MacAddress other) {
        return Long.compare(value, other.value);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof MacAddress that)) return false;
        return value == that.value;
    }

    @Override
    public int hashCode() {
        return Long.hashCode(value);
    }

    @Override
    public String toString() {
        String hex = String.format(Locale.ROOT, "%012x", value);
        StringBuilder sb = new StringBuilder(17);
        for (int i = 0; i < 12; i += 2) {
            if (i > 0) {
                sb.append(':');
            }
            sb.append(hex, i, i + 2);
        }
        return sb.toString();
    }
}

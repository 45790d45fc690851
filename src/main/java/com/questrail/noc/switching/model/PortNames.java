package com.questrail.noc.switching.model;

import java.util.List;
import java.util.Locale;

/**
 * PortNames
 * =============================================================================
 * Maps long-form switch interface names to the vendor shorthand.
 *
 * <pre>
 *   FastEthernet1/0/1        → Fa1/0/1
 *   GigabitEthernet1/0/48    → Gi1/0/48
 *   TenGigabitEthernet1/1/1  → Ten1/1/1
 * </pre>
 *
 * <h2>Why this type exists</h2>
 * <p>
 * The same normalization MUST be applied when building a command for the
 * device and when matching a caller's port against parsed device output. If
 * one side used the long form and the other the shorthand, a verification
 * would silently report {@code false} for a change that did take effect.
 * Every interface name that leaves the parser or enters a command therefore
 * passes through {@link #shorthand(String)}.
 * </p>
 *
 * <h2>Properties</h2>
 * <ul>
 *   <li>Prefix matching is case-insensitive; the remainder is kept as written</li>
 *   <li>Names with no known long-form prefix pass through unchanged</li>
 *   <li>{@code null} maps to {@code null} and {@code ""} to {@code ""}</li>
 *   <li>Idempotent: {@code shorthand(shorthand(x)).equals(shorthand(x))}</li>
 * </ul>
 */
public final class PortNames
{
    private record Notation(String longForm, String shortForm) {}

    // Longest long-form first so that a prefix of another entry never wins.
    private static final List<Notation> NOTATIONS = List.of(
            new Notation("tengigabitethernet", "Ten"),
            new Notation("gigabitethernet", "Gi"),
            new Notation("fastethernet", "Fa")
    );

    private PortNames() {
    }

    /**
     * Returns the shorthand notation of {@code port}.
     *
     * @param port a port name such as {@code GigabitEthernet1/0/48} or {@code Gi1/0/48}
     * @return the shorthand port name, or the input unchanged if it has no
     *         known long-form prefix
     */
    public static String shorthand(String port) {
        if (port == null || port.isEmpty()) {
            return port;
        }

        String lower = port.toLowerCase(Locale.ROOT);
        for (Notation notation : NOTATIONS) {
            if (lower.startsWith(notation.longForm())) {
                return notation.shortForm() + port.substring(notation.longForm().length());
            }
        }
        return port;
    }

    /**
     * Whether {@code port} names a physical interface (Fa, Gi or Ten), as
     * opposed to {@code CPU}, a port-channel or a VLAN interface.
     */
    public static boolean isPhysical(String port) {
        if (port == null || port.isEmpty()) {
            return false;
        }

        String lower = shorthand(port).toLowerCase(Locale.ROOT);
        for (Notation notation : NOTATIONS) {
            if (lower.startsWith(notation.shortForm().toLowerCase(Locale.ROOT))) {
                return true;
            }
        }
        return false;
    }

    /**
     * Compares two port names after normalization, ignoring case.
     */
    public static boolean samePort(String a, String b) {
        if (a == null || b == null) {
            return false;
        }
        return shorthand(a).equalsIgnoreCase(shorthand(b));
    }
}

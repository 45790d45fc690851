package com.questrail.noc.pdu.model;

/**
 * A 1-based outlet index known to be within the unit's outlet count.
 *
 * <p>Only {@link #of(int, int)} creates instances, so an out-of-range index
 * can never reach the transport.</p>
 */
public final class OutletNumber
{
    private final int value;

    private OutletNumber(int value) {
        this.value = value;
    }

    /**
     * @param outlet     the requested outlet, counted from 1
     * @param numOutlets the unit's outlet count
     * @throws IllegalArgumentException if {@code outlet} is not in {@code [1, numOutlets]}
     */
    public static OutletNumber of(int outlet, int numOutlets) {
        if (outlet < 1 || outlet > numOutlets) {
            throw new IllegalArgumentException(
                    "Outlet must be in range 1-" + numOutlets + " (was " + outlet + ")");
        }
        return new OutletNumber(outlet);
    }

    public int value() {
        return value;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof OutletNumber)) return false;
        return value == ((OutletNumber) o).value;
    }

    @Override
    public int hashCode() {
        return Integer.hashCode(value);
    }

    @Override
    public String toString() {
        return "outlet " + value;
    }
}

package com.questrail.noc.switching.model;

import java.util.Locale;

/**
 * Power-over-Ethernet port modes, as spelled in {@code power inline <mode>}.
 */
public enum PoeMode
{
    /** Deliver power to any detected device, up to the class limit. */
    AUTO("auto"),

    /** Reserve a fixed power budget for the port. */
    STATIC("static"),

    /** Never deliver power. */
    NEVER("never");

    private final String keyword;

    PoeMode(String keyword) {
        this.keyword = keyword;
    }

    /**
     * The keyword used on the CLI and printed in the admin column.
     */
    public String keyword() {
        return keyword;
    }

    /**
     * Resolves a CLI keyword.
     *
     * @throws IllegalArgumentException if the keyword is not a known mode
     */
    public static PoeMode fromKeyword(String keyword) {
        if (keyword != null) {
            String lower = keyword.toLowerCase(Locale.ROOT);
            for (PoeMode mode : values()) {
                if (mode.keyword.equals(lower)) {
                    return mode;
                }
            }
        }
        throw new IllegalArgumentException("Unknown PoE mode: " + keyword);
    }
}

package com.questrail.noc.switching.internal.parse;

/**
 * Indicates that a line of switch output was recognized as a table row but
 * could not be translated into a record.
 *
 * This typically reflects:
 * <ul>
 *   <li>A matched row with fewer fields than the table layout requires</li>
 *   <li>A field that should be numeric or a MAC address but is not</li>
 *   <li>Firmware whose output layout differs from the supported one</li>
 * </ul>
 *
 * Lines that do not look like table rows at all (banners, headers, footers,
 * prompts) never raise this exception; they are skipped.
 */
public final class SwitchParseException extends RuntimeException
{
    private final String line;

    public SwitchParseException(String message, String line) {
        super(message + ": '" + line + "'");
        this.line = line;
    }

    public SwitchParseException(String message, String line, Throwable cause) {
        super(message + ": '" + line + "'", cause);
        this.line = line;
    }

    /**
     * The offending line, trimmed.
     */
    public String line() {
        return line;
    }
}

package com.questrail.noc.api;

/**
 * Indicates that a device could not be reached or that the connection to it
 * failed in a way the caller must handle.
 *
 * This typically reflects:
 * <ul>
 *   <li>Authentication failure or unreachable host during connect</li>
 *   <li>The remote shell dying in the middle of a command</li>
 *   <li>An SNMP request that timed out or returned an error status</li>
 * </ul>
 *
 * It is never thrown for an operation attempted while disconnected, and never
 * for a command whose effect could not be confirmed; those are reported
 * through ordinary return values.
 */
public final class DeviceConnectionException extends RuntimeException
{
    private final String host;

    public DeviceConnectionException(String host, String message) {
        super(host + ": " + message);
        this.host = host;
    }

    public DeviceConnectionException(String host, String message, Throwable cause) {
        super(host + ": " + message, cause);
        this.host = host;
    }

    /**
     * The address of the device that failed.
     */
    public String host() {
        return host;
    }
}

package com.flagpole.flags;

/**
 * Thrown at setup time for a malformed declaration: an empty, duplicate or oversized flag space,
 * a registration whose flag and key lists differ in length, or a duplicate trigger flag when
 * duplicates are rejected.
 */
public final class ConfigurationException extends FlagpoleException {

    public ConfigurationException(String message) {
        super(message);
    }

    public ConfigurationException(String message, Throwable cause) {
        super(message, cause);
    }
}

package com.flagpole.config;

/**
 * What a registry does when a new binding claims a trigger flag that is already bound.
 */
public enum DuplicatePolicy {
    /** Fail the registration with a configuration error. */
    REJECT,
    /** Drop the earlier binding(s) owning the flag, log a warning, and keep the new one in their place. */
    REPLACE
}

package com.flagpole.registry;

/**
 * Shape of a binding's return value, fixed at registration time.
 */
public enum BindingKind {
    /** One trigger flag; the handler returns one value. */
    SINGLE,
    /** Parallel flag/key lists; the handler returns a list with one value per flag, positionally aligned. */
    MULTI
}
